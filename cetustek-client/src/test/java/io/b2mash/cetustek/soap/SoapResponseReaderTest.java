package io.b2mash.cetustek.soap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.cetustek.exception.CetustekApiException;
import io.b2mash.cetustek.exception.CetustekException;
import io.b2mash.cetustek.model.InvoiceAmounts;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class SoapResponseReaderTest {

  private final SoapResponseReader reader = new SoapResponseReader();

  // --- <return> extraction ---

  @Test
  void extractReturnValue_trims_text() {
    assertThat(reader.extractReturnValue(envelope("\n  C0  \n"))).isEqualTo("C0");
  }

  @Test
  void extractReturnValue_decodes_entities() {
    assertThat(reader.extractReturnValue(envelope("&lt;Invoice&gt;&amp;&lt;/Invoice&gt;")))
        .isEqualTo("<Invoice>&</Invoice>");
  }

  @Test
  void extractReturnValue_keeps_unescaped_child_elements_verbatim() {
    var payload =
        "<Invoice><BuyerName/><Remark a='1'>x &amp; y</Remark>"
            + "<OrderID>A1</OrderID></Invoice>";

    assertThat(reader.extractReturnValue(envelope(payload))).isEqualTo(payload);
  }

  @Test
  void extractReturnValue_missing_return_is_sdk_error() {
    assertThatThrownBy(() -> reader.extractReturnValue("<Envelope><Body/></Envelope>"))
        .isExactlyInstanceOf(CetustekException.class)
        .hasMessage("Invalid response: missing <return> tag");
  }

  @Test
  void extractReturnValue_empty_body_is_sdk_error() {
    assertThatThrownBy(() -> reader.extractReturnValue("  "))
        .isExactlyInstanceOf(CetustekException.class)
        .hasMessageContaining("empty body");
  }

  @Test
  void extractReturnValue_soap_fault_is_sdk_error_with_fault_string() {
    assertThatThrownBy(() -> reader.extractReturnValue(fault("Unknown rentid")))
        .isExactlyInstanceOf(CetustekException.class)
        .hasMessage("SOAP fault: Unknown rentid");
  }

  @Test
  void findFaultString_returns_null_for_regular_response() {
    assertThat(reader.findFaultString(envelope("C0"))).isNull();
    assertThat(reader.findFaultString(null)).isNull();
    assertThat(reader.findFaultString(fault("Boom"))).isEqualTo("Boom");
  }

  // --- Issue results ---

  @Test
  void readCreateResult_splits_number_and_random_code() {
    var amounts = new InvoiceAmounts(BigDecimal.TEN, BigDecimal.ONE, new BigDecimal("11"));

    var result = reader.readCreateResult("AB12345678;0423", amounts);

    assertThat(result.invoiceNumber()).isEqualTo("AB12345678");
    assertThat(result.randomCode()).isEqualTo("0423");
    assertThat(result.invoiceYear()).isEqualTo("1234");
    assertThat(result.amounts()).isSameAs(amounts);
  }

  @Test
  void readCreateResult_code_without_separator_is_api_error() {
    assertThatThrownBy(() -> reader.readCreateResult("E7", null))
        .isInstanceOfSatisfying(
            CetustekApiException.class, e -> assertThat(e.getCode()).isEqualTo("E7"));
  }

  @Test
  void readCreateResult_trailing_separator_is_unexpected_format() {
    assertThatThrownBy(() -> reader.readCreateResult("AB12345678;0423;", null))
        .isInstanceOfSatisfying(
            CetustekApiException.class,
            e -> {
              assertThat(e.getCode()).isEqualTo("AB12345678;0423;");
              assertThat(e.getVendorMessage()).isEqualTo("Unexpected response format");
            });
  }

  // --- Cancel results ---

  @Test
  void readCancelResult_maps_c0_to_success() {
    assertThat(reader.readCancelResult("C0").success()).isTrue();
    assertThat(reader.readCancelResult("C1").success()).isFalse();
    assertThat(reader.readCancelResult("C1").message()).isEqualTo("C1");
  }

  // --- Query results ---

  @Test
  void readQueryResult_matches_tags_case_insensitively() {
    var xml =
        "<invoice><orderid>ORD-9</orderid><RANDOMNUMBER>1111</RANDOMNUMBER>"
            + "<BuyerIdentifier>12345678</BuyerIdentifier><CarrierId1>/ABC+123</CarrierId1>"
            + "<npoban>8585</npoban></invoice>";

    var result = reader.readQueryResult("AB12345678", xml);

    assertThat(result.invoiceNumber()).isEqualTo("AB12345678");
    assertThat(result.orderId()).isEqualTo("ORD-9");
    assertThat(result.randomCode()).isEqualTo("1111");
    assertThat(result.buyerIdentifier()).isEqualTo("12345678");
    assertThat(result.carrierId()).isEqualTo("/ABC+123");
    assertThat(result.npoban()).isEqualTo("8585");
  }

  @Test
  void readQueryResult_blank_and_unparsable_values_become_null() {
    var xml =
        "<Invoice><BuyerName>  </BuyerName><SalesAmount>n/a</SalesAmount>"
            + "<TaxAmount>25.5</TaxAmount></Invoice>";

    var result = reader.readQueryResult("AB12345678", xml);

    assertThat(result.buyerName()).isNull();
    assertThat(result.salesAmount()).isNull();
    assertThat(result.taxAmount()).isEqualByComparingTo("25.5");
    assertThat(result.totalAmount()).isNull();
    assertThat(result.invoiceStatus()).isNull();
  }

  @Test
  void readQueryResult_keeps_raw_xml_verbatim() {
    var xml =
        "<?xml version=\"1.0\"?>\n<Invoice>\n  <Unmapped attr=\"x\">v</Unmapped>\n</Invoice>";

    assertThat(reader.readQueryResult("AB12345678", xml).rawXml()).isEqualTo(xml);
  }

  @Test
  void readQueryResult_non_xml_value_is_api_error() {
    assertThatThrownBy(() -> reader.readQueryResult("AB12345678", "Q2"))
        .isInstanceOfSatisfying(
            CetustekApiException.class, e -> assertThat(e.getCode()).isEqualTo("Q2"));
  }

  private static String envelope(String returnContent) {
    return "<soap:Envelope xmlns:soap=\"http://schemas.xmlsoap.org/soap/envelope/\"><soap:Body>"
        + "<ns2:QueryInvoiceResponse xmlns:ns2=\"http://webservice.cetustek.com/\"><return>"
        + returnContent
        + "</return></ns2:QueryInvoiceResponse></soap:Body></soap:Envelope>";
  }

  private static String fault(String faultString) {
    return "<soap:Envelope xmlns:soap=\"http://schemas.xmlsoap.org/soap/envelope/\"><soap:Body>"
        + "<soap:Fault><faultcode>soap:Client</faultcode><faultstring>"
        + faultString
        + "</faultstring></soap:Fault></soap:Body></soap:Envelope>";
  }
}
