package io.b2mash.cetustek.client;

import io.b2mash.cetustek.model.CancelInvoiceInput;
import io.b2mash.cetustek.model.CancelInvoiceResponse;
import io.b2mash.cetustek.model.CreateInvoiceInput;
import io.b2mash.cetustek.model.CreateInvoiceResponse;
import io.b2mash.cetustek.model.QueryInvoiceInput;
import io.b2mash.cetustek.model.QueryInvoiceResponse;

/**
 * Port interface for issuing, querying and voiding Taiwanese e-invoices. Every call is a single
 * synchronous request; implementations hold no mutable state and may be shared between threads.
 *
 * <p>Failures surface as {@link io.b2mash.cetustek.exception.CetustekException} or one of its
 * subclasses: {@link io.b2mash.cetustek.exception.InvoiceValidationException} before anything is
 * sent, {@link io.b2mash.cetustek.exception.CetustekApiException} when the vendor rejects the call.
 */
public interface InvoiceClient {

  /** Issues a new invoice and returns its number and random code. */
  CreateInvoiceResponse createInvoice(CreateInvoiceInput input);

  /** Looks up an issued invoice by number and year. */
  QueryInvoiceResponse queryInvoice(QueryInvoiceInput input);

  /**
   * Voids an issued invoice. A vendor refusal is reported through {@link
   * CancelInvoiceResponse#success()} rather than an exception.
   */
  default CancelInvoiceResponse cancelInvoice(CancelInvoiceInput input) {
    return cancelInvoice(input, false);
  }

  /**
   * Voids an issued invoice.
   *
   * @param noCheck skip the vendor's pre-cancellation checks
   */
  CancelInvoiceResponse cancelInvoice(CancelInvoiceInput input, boolean noCheck);
}
