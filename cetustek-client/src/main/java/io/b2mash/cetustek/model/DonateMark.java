package io.b2mash.cetustek.model;

import io.b2mash.cetustek.exception.InvoiceValidationException;

/** Where the issued invoice goes ({@code DonateMark} field). */
public enum DonateMark {
  NOT_DONATED("0"),
  /** Donated to the charity named by the NPOBAN code. */
  DONATED("1"),
  CARRIER("2");

  private final String code;

  DonateMark(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  public static DonateMark fromCode(String code) {
    for (DonateMark mark : values()) {
      if (mark.code.equals(code)) {
        return mark;
      }
    }
    throw new InvoiceValidationException("donateMark: unknown code '" + code + "'");
  }
}
