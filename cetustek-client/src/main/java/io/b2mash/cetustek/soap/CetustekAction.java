package io.b2mash.cetustek.soap;

/** SOAP operations exposed by the Cetustek invoice web service. */
public enum CetustekAction {
  CREATE_INVOICE("CreateInvoiceV3"),
  QUERY_INVOICE("QueryInvoice"),
  CANCEL_INVOICE("CancelInvoice"),
  /** Cancels without the vendor's pre-checks (e.g., on invoices already reported). */
  CANCEL_INVOICE_NO_CHECK("CancelInvoiceNoCheck");

  private final String operationName;

  CetustekAction(String operationName) {
    this.operationName = operationName;
  }

  /** Returns the operation element name used inside the SOAP body. */
  public String getOperationName() {
    return operationName;
  }
}
