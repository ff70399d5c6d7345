package io.b2mash.cetustek.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Input for voiding an issued invoice. {@code remark} (the reason) and {@code
 * returnTaxDocumentNumber} are optional and sent empty when null.
 */
public record CancelInvoiceInput(
    @NotBlank String invoiceNumber,
    @NotNull @Pattern(regexp = "\\d{4}", message = "must be a 4-digit year") String invoiceYear,
    String remark,
    String returnTaxDocumentNumber) {

  public static CancelInvoiceInput of(String invoiceNumber, String invoiceYear, String remark) {
    return new CancelInvoiceInput(invoiceNumber, invoiceYear, remark, null);
  }
}
