package io.b2mash.cetustek.soap;

import io.b2mash.cetustek.exception.CetustekApiException;
import io.b2mash.cetustek.exception.CetustekException;
import io.b2mash.cetustek.model.CancelInvoiceResponse;
import io.b2mash.cetustek.model.CreateInvoiceResponse;
import io.b2mash.cetustek.model.InvoiceAmounts;
import io.b2mash.cetustek.model.QueryInvoiceResponse;
import java.math.BigDecimal;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interprets Cetustek SOAP responses. Every operation answers with a single {@code <return>}
 * element whose text is either a result or a vendor error code.
 */
public class SoapResponseReader {

  private static final Logger log = LoggerFactory.getLogger(SoapResponseReader.class);

  private static final Pattern RETURN_CONTENT =
      Pattern.compile(
          "<return(?:\\s[^>]*)?>(.*?)</return>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  /**
   * Extracts the trimmed text of the {@code <return>} element, with XML entities decoded. A payload
   * sent as unescaped child elements is returned exactly as it appears in the body.
   *
   * @throws CetustekException if the body is empty, is a SOAP fault or has no {@code <return>}
   */
  public String extractReturnValue(String responseXml) {
    if (responseXml == null || responseXml.isBlank()) {
      throw new CetustekException("Invalid response: empty body");
    }
    var doc = parseXml(responseXml);
    var returnElement = doc.selectFirst("return");
    if (returnElement == null) {
      var fault = doc.selectFirst("faultstring");
      if (fault != null) {
        throw new CetustekException("SOAP fault: " + fault.text());
      }
      throw new CetustekException("Invalid response: missing <return> tag");
    }
    if (returnElement.children().isEmpty()) {
      return returnElement.wholeText().strip();
    }
    var raw = RETURN_CONTENT.matcher(responseXml);
    if (!raw.find()) {
      throw new CetustekException("Invalid response: unterminated <return> tag");
    }
    return raw.group(1).strip();
  }

  /**
   * Returns the {@code faultstring} of a SOAP fault body, or null when the body is not a fault.
   * HTTP error responses are passed through here to recover the vendor's explanation.
   */
  public String findFaultString(String responseXml) {
    if (responseXml == null || responseXml.isBlank()) {
      return null;
    }
    var fault = parseXml(responseXml).selectFirst("faultstring");
    return fault == null ? null : fault.text();
  }

  /**
   * Reads an issue result of the form {@code NUMBER;RANDOM}.
   *
   * @throws CetustekApiException if the value is a vendor error code or has an unexpected shape
   */
  public CreateInvoiceResponse readCreateResult(String returnValue, InvoiceAmounts amounts) {
    if (!returnValue.contains(";")) {
      throw new CetustekApiException(returnValue);
    }
    var parts = returnValue.split(";", -1);
    if (parts.length != 2) {
      throw new CetustekApiException(returnValue, "Unexpected response format");
    }
    return new CreateInvoiceResponse(parts[0], parts[1], amounts);
  }

  public CancelInvoiceResponse readCancelResult(String returnValue) {
    return CancelInvoiceResponse.fromCode(returnValue);
  }

  /**
   * Reads a query result. The return value is the invoice XML itself; anything not starting with
   * {@code <} is a vendor error code. Tags are matched case-insensitively.
   *
   * @throws CetustekApiException if the vendor returned an error code instead of invoice XML
   */
  public QueryInvoiceResponse readQueryResult(String invoiceNumber, String invoiceXml) {
    if (!invoiceXml.startsWith("<")) {
      throw new CetustekApiException(invoiceXml);
    }
    var doc = parseXml(invoiceXml);
    return new QueryInvoiceResponse(
        invoiceNumber,
        value(doc, "InvoiceDate"),
        value(doc, "InvoiceTime"),
        value(doc, "OrderID"),
        value(doc, "RandomNumber"),
        value(doc, "BuyerIdentifier"),
        value(doc, "BuyerName"),
        value(doc, "SellerIdentifier"),
        value(doc, "SellerName"),
        value(doc, "InvoiceStatus"),
        value(doc, "DonateMark"),
        value(doc, "CarrierType"),
        value(doc, "CarrierId1"),
        value(doc, "NPOBAN"),
        value(doc, "TaxType"),
        amount(doc, "SalesAmount"),
        amount(doc, "TaxAmount"),
        amount(doc, "TotalAmount"),
        invoiceXml);
  }

  private static Document parseXml(String xml) {
    var doc = Jsoup.parse(xml, "", Parser.xmlParser());
    doc.outputSettings().prettyPrint(false);
    return doc;
  }

  private static String value(Document doc, String tag) {
    var element = doc.selectFirst(tag);
    if (element == null) {
      return null;
    }
    var text = element.wholeText().strip();
    return text.isEmpty() ? null : text;
  }

  private static BigDecimal amount(Document doc, String tag) {
    var text = value(doc, tag);
    if (text == null) {
      return null;
    }
    try {
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      log.warn("Cetustek query: unparsable {} '{}', leaving it empty", tag, text);
      return null;
    }
  }
}
