package io.b2mash.cetustek.model;

import io.b2mash.cetustek.exception.InvoiceValidationException;

/** Tax computation method of the invoice ({@code InvoiceType} field). */
public enum InvoiceType {
  /** General tax computation. */
  GENERAL("07"),
  /** Special tax computation. */
  SPECIAL("08");

  private final String code;

  InvoiceType(String code) {
    this.code = code;
  }

  /** Returns the two-digit code sent to the vendor. */
  public String getCode() {
    return code;
  }

  public static InvoiceType fromCode(String code) {
    for (InvoiceType type : values()) {
      if (type.code.equals(code)) {
        return type;
      }
    }
    throw new InvoiceValidationException("invoiceType: unknown code '" + code + "'");
  }
}
