package io.b2mash.cetustek.soap;

import io.b2mash.cetustek.model.CancelInvoiceInput;
import io.b2mash.cetustek.model.CreateInvoiceInput;
import io.b2mash.cetustek.model.InvoiceItem;
import io.b2mash.cetustek.model.QueryInvoiceInput;
import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.function.Consumer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.Parser;

/**
 * Builds SOAP 1.1 request envelopes for the Cetustek service. Invoice payloads ({@code <Invoice
 * XSDVersion="2.8">}) are embedded as CDATA inside {@code <invoicexml>}; every operation also
 * carries the {@code rentid} and {@code source} credentials. All text content is XML-escaped by
 * jsoup's XML serializer.
 *
 * <p>Instances are immutable and thread-safe.
 */
public class SoapRequestWriter {

  static final String SOAP_ENVELOPE_NS = "http://schemas.xmlsoap.org/soap/envelope/";
  static final String SERVICE_NS = "http://webservice.cetustek.com/";
  static final String XSD_VERSION = "2.8";

  private static final DateTimeFormatter ORDER_DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy/MM/dd");

  private final String rentId;
  private final String source;

  /**
   * @param rentId vendor tenant identifier
   * @param source the {@code source} auth value (site code followed by the API password)
   */
  public SoapRequestWriter(String rentId, String source) {
    this.rentId = rentId;
    this.source = source;
  }

  public String createInvoice(CreateInvoiceInput input) {
    var invoiceXml = invoiceXml(input);
    return envelope(
        CetustekAction.CREATE_INVOICE,
        operation -> operation.appendElement("invoicexml").appendChild(new CDataNode(invoiceXml)));
  }

  public String cancelInvoice(CancelInvoiceInput input, boolean noCheck) {
    var invoiceXml = cancelXml(input);
    var action = noCheck ? CetustekAction.CANCEL_INVOICE_NO_CHECK : CetustekAction.CANCEL_INVOICE;
    return envelope(
        action,
        operation -> operation.appendElement("invoicexml").appendChild(new CDataNode(invoiceXml)));
  }

  public String queryInvoice(QueryInvoiceInput input) {
    return envelope(
        CetustekAction.QUERY_INVOICE,
        operation -> {
          field(operation, "invoicenumber", input.invoiceNumber());
          field(operation, "invoiceyear", input.invoiceYear());
        });
  }

  /** Builds the {@code <Invoice>} document for an issue call. Package-private for testing. */
  String invoiceXml(CreateInvoiceInput input) {
    var doc = newXmlDocument();
    var invoice = doc.appendElement("Invoice").attr("XSDVersion", XSD_VERSION);
    field(invoice, "OrderId", input.orderId());
    field(invoice, "OrderDate", input.orderDate().format(ORDER_DATE_FORMAT));
    field(invoice, "BuyerIdentifier", input.buyerIdentifier());
    field(invoice, "BuyerName", input.buyerName());
    field(invoice, "BuyerAddress", input.buyerAddress());
    field(invoice, "BuyerEmailAddress", input.buyerEmail());
    field(invoice, "DonateMark", input.donateMark().getCode());
    field(invoice, "InvoiceType", input.invoiceType().getCode());
    field(invoice, "CarrierType", input.carrierType());
    field(invoice, "CarrierId1", input.carrierId1());
    field(invoice, "CarrierId2", input.carrierId2());
    field(invoice, "NPOBAN", input.npoban());
    field(invoice, "PayWay", input.payWay());
    field(invoice, "TaxType", input.taxType().getCode());
    field(invoice, "TaxRate", decimal(input.taxRate()));
    field(invoice, "Remark", input.remark());

    var details = invoice.appendElement("Details");
    for (InvoiceItem item : input.items()) {
      var product = details.appendElement("ProductItem");
      field(product, "ProductionCode", item.productionCode());
      field(product, "Description", item.description());
      field(product, "Quantity", decimal(item.quantity()));
      if (item.unit() != null && !item.unit().isBlank()) {
        field(product, "Unit", item.unit());
      }
      field(product, "UnitPrice", decimal(item.unitPrice()));
    }
    return doc.outerHtml();
  }

  /** Builds the {@code <Invoice>} document for a cancel call. Package-private for testing. */
  String cancelXml(CancelInvoiceInput input) {
    var doc = newXmlDocument();
    var invoice = doc.appendElement("Invoice").attr("XSDVersion", XSD_VERSION);
    field(invoice, "InvoiceNumber", input.invoiceNumber());
    field(invoice, "InvoiceYear", input.invoiceYear());
    field(invoice, "ReturnTaxDocumentNumber", input.returnTaxDocumentNumber());
    field(invoice, "Remark", input.remark());
    return doc.outerHtml();
  }

  private String envelope(CetustekAction action, Consumer<Element> operationBody) {
    var doc = newXmlDocument();
    var declaration = new XmlDeclaration("xml", false);
    declaration.attr("version", "1.0");
    declaration.attr("encoding", "utf-8");
    doc.appendChild(declaration);

    var envelope =
        doc.appendElement("soap:Envelope")
            .attr("xmlns:soap", SOAP_ENVELOPE_NS)
            .attr("xmlns:tns", SERVICE_NS);
    var operation =
        envelope.appendElement("soap:Body").appendElement("tns:" + action.getOperationName());
    operationBody.accept(operation);
    field(operation, "rentid", rentId);
    field(operation, "source", source);
    return doc.outerHtml();
  }

  private static Document newXmlDocument() {
    var doc = Jsoup.parse("", "", Parser.xmlParser());
    doc.outputSettings().prettyPrint(false);
    return doc;
  }

  private static void field(Element parent, String name, String value) {
    parent.appendElement(name).text(value == null ? "" : value);
  }

  private static String decimal(BigDecimal value) {
    return value.stripTrailingZeros().toPlainString();
  }
}
