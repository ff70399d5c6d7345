package io.b2mash.cetustek.client;

import io.b2mash.cetustek.config.CetustekProperties;
import io.b2mash.cetustek.exception.CetustekApiException;
import io.b2mash.cetustek.exception.CetustekException;
import io.b2mash.cetustek.exception.InvoiceValidationException;
import io.b2mash.cetustek.model.CancelInvoiceInput;
import io.b2mash.cetustek.model.CancelInvoiceResponse;
import io.b2mash.cetustek.model.CreateInvoiceInput;
import io.b2mash.cetustek.model.CreateInvoiceResponse;
import io.b2mash.cetustek.model.QueryInvoiceInput;
import io.b2mash.cetustek.model.QueryInvoiceResponse;
import io.b2mash.cetustek.soap.CetustekAction;
import io.b2mash.cetustek.soap.SoapRequestWriter;
import io.b2mash.cetustek.soap.SoapResponseReader;
import io.b2mash.cetustek.tax.InvoiceAmountCalculator;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Cetustek SOAP adapter. Inputs are validated with Bean Validation before anything is sent; each
 * operation then posts one SOAP envelope and reads the {@code <return>} value of the response.
 * Credentials are fixed at construction.
 */
public class CetustekInvoiceClient implements InvoiceClient {

  private static final Logger log = LoggerFactory.getLogger(CetustekInvoiceClient.class);

  private static final MediaType TEXT_XML_UTF8 =
      new MediaType("text", "xml", StandardCharsets.UTF_8);

  private final CetustekProperties properties;
  private final URI endpoint;
  private final RestClient restClient;
  private final Validator validator;
  private final SoapRequestWriter requestWriter;
  private final SoapResponseReader responseReader = new SoapResponseReader();
  private final InvoiceAmountCalculator amountCalculator = new InvoiceAmountCalculator();

  public CetustekInvoiceClient(CetustekProperties properties) {
    this(properties, RestClient.builder());
  }

  /** Uses the shared default Bean Validation validator. */
  public CetustekInvoiceClient(
      CetustekProperties properties, RestClient.Builder restClientBuilder) {
    this(properties, restClientBuilder, defaultValidator());
  }

  /**
   * @param restClientBuilder builder for the HTTP client; it is cloned, never modified. Response
   *     bodies are always decoded as UTF-8 unless the server declares another charset
   * @param validator Bean Validation validator applied to every input
   */
  public CetustekInvoiceClient(
      CetustekProperties properties, RestClient.Builder restClientBuilder, Validator validator) {
    requireConfigured(properties.rentId(), "rent_id");
    requireConfigured(properties.siteCode(), "site_code");
    requireConfigured(properties.apiPassword(), "api_password");
    this.properties = properties;
    this.endpoint = URI.create(properties.endpoint());
    var utf8Strings = new StringHttpMessageConverter(StandardCharsets.UTF_8);
    this.restClient =
        restClientBuilder
            .clone()
            .messageConverters(converters -> converters.add(0, utf8Strings))
            .build();
    this.validator = validator;
    this.requestWriter = new SoapRequestWriter(properties.rentId(), properties.source());
  }

  @Override
  public CreateInvoiceResponse createInvoice(CreateInvoiceInput input) {
    validate(input);
    var amounts = amountCalculator.calculate(input);
    var returnValue = call(CetustekAction.CREATE_INVOICE, requestWriter.createInvoice(input));
    try {
      var response = responseReader.readCreateResult(returnValue, amounts);
      log.info(
          "Cetustek: issued invoice {} for order {}, total={}",
          response.invoiceNumber(),
          input.orderId(),
          amounts.totalAmount());
      return response;
    } catch (CetustekApiException e) {
      log.warn("Cetustek: issue rejected for order {}: {}", input.orderId(), e.getMessage());
      throw e;
    }
  }

  @Override
  public QueryInvoiceResponse queryInvoice(QueryInvoiceInput input) {
    validate(input);
    var returnValue = call(CetustekAction.QUERY_INVOICE, requestWriter.queryInvoice(input));
    try {
      return responseReader.readQueryResult(input.invoiceNumber(), returnValue);
    } catch (CetustekApiException e) {
      log.warn(
          "Cetustek: query of invoice {} rejected: {}", input.invoiceNumber(), e.getMessage());
      throw e;
    }
  }

  @Override
  public CancelInvoiceResponse cancelInvoice(CancelInvoiceInput input, boolean noCheck) {
    validate(input);
    var action = noCheck ? CetustekAction.CANCEL_INVOICE_NO_CHECK : CetustekAction.CANCEL_INVOICE;
    var returnValue = call(action, requestWriter.cancelInvoice(input, noCheck));
    var response = responseReader.readCancelResult(returnValue);
    if (response.success()) {
      log.info("Cetustek: cancelled invoice {}", input.invoiceNumber());
    } else {
      log.warn(
          "Cetustek: cancel of invoice {} returned code {}",
          input.invoiceNumber(),
          response.code());
    }
    return response;
  }

  private <T> void validate(T input) {
    if (input == null) {
      throw new InvoiceValidationException("input must not be null");
    }
    var violations = validator.validate(input);
    if (!violations.isEmpty()) {
      var messages =
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .toList();
      throw new InvoiceValidationException(messages);
    }
  }

  /** Posts the envelope and returns the {@code <return>} value. */
  private String call(CetustekAction action, String envelope) {
    var operation = action.getOperationName();
    log.debug("Cetustek: calling {} at {}", operation, endpoint);
    String body;
    try {
      body =
          restClient
              .post()
              .uri(endpoint)
              .contentType(TEXT_XML_UTF8)
              .accept(MediaType.TEXT_XML)
              .header(HttpHeaders.USER_AGENT, properties.userAgent())
              .body(envelope)
              .retrieve()
              .body(String.class);
    } catch (RestClientResponseException e) {
      var fault = responseReader.findFaultString(e.getResponseBodyAsString());
      var detail = "HTTP " + e.getStatusCode().value() + (fault != null ? " - " + fault : "");
      log.error("Cetustek {} request failed: {}", operation, detail, e);
      throw new CetustekException("Cetustek " + operation + " request failed: " + detail, e);
    } catch (RestClientException e) {
      log.error("Cetustek {} request failed: {}", operation, e.getMessage(), e);
      throw new CetustekException(
          "Cetustek " + operation + " request failed: " + e.getMessage(), e);
    }
    return responseReader.extractReturnValue(body);
  }

  /** The validator of one process-wide {@link ValidatorFactory}, built on first use. */
  static Validator defaultValidator() {
    return DefaultValidatorHolder.VALIDATOR;
  }

  private static void requireConfigured(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("Cetustek " + name + " not configured");
    }
  }

  private static final class DefaultValidatorHolder {
    private static final ValidatorFactory FACTORY = Validation.buildDefaultValidatorFactory();
    private static final Validator VALIDATOR = FACTORY.getValidator();
  }
}
