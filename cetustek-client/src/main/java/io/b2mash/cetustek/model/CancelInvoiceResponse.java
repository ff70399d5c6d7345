package io.b2mash.cetustek.model;

/**
 * Result of a cancel call. The vendor answers {@value #SUCCESS_CODE} on success; any other code is
 * a failure and is repeated in {@code message}.
 */
public record CancelInvoiceResponse(boolean success, String code, String message) {

  public static final String SUCCESS_CODE = "C0";

  public static CancelInvoiceResponse fromCode(String code) {
    if (SUCCESS_CODE.equals(code)) {
      return new CancelInvoiceResponse(true, code, null);
    }
    return new CancelInvoiceResponse(false, code, code);
  }
}
