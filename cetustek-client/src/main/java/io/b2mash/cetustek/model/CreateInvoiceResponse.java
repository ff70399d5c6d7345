package io.b2mash.cetustek.model;

/**
 * Result of a successful issue call. {@code amounts} are computed locally from the submitted items.
 *
 * @param invoiceNumber 10-character invoice number, e.g. {@code WP20260002}
 * @param randomCode 4-digit random code, e.g. {@code 6827}
 * @param amounts locally computed sales/tax/total amounts
 */
public record CreateInvoiceResponse(
    String invoiceNumber, String randomCode, InvoiceAmounts amounts) {

  /**
   * Year embedded in the invoice number (characters 2 to 5), e.g. {@code 2026} for {@code
   * WP20260002}. Returns null when the number is too short to carry one.
   */
  public String invoiceYear() {
    if (invoiceNumber == null || invoiceNumber.length() < 6) {
      return null;
    }
    return invoiceNumber.substring(2, 6);
  }
}
