package io.b2mash.cetustek.model;

import io.b2mash.cetustek.exception.InvoiceValidationException;

/**
 * Tax category of the invoice ({@code TaxType} field). Only taxable categories accrue tax when
 * amounts are computed locally.
 */
public enum TaxType {
  TAXABLE("1", true),
  ZERO_RATED("2", false),
  TAX_FREE("3", false),
  SPECIAL_RATE("4", true),
  SPECIAL_ZERO_RATED("5", false),
  /** Mixed taxable and zero-rated/tax-free lines. */
  MIXED("9", true);

  private final String code;
  private final boolean taxable;

  TaxType(String code, boolean taxable) {
    this.code = code;
    this.taxable = taxable;
  }

  public String getCode() {
    return code;
  }

  public boolean isTaxable() {
    return taxable;
  }

  public static TaxType fromCode(String code) {
    for (TaxType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new InvoiceValidationException("taxType: unknown code '" + code + "'");
  }
}
