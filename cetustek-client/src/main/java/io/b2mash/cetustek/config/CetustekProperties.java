package io.b2mash.cetustek.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings for the Cetustek invoice service.
 *
 * @param endpoint SOAP endpoint URL
 * @param rentId vendor-assigned tenant identifier
 * @param siteCode vendor-assigned site code
 * @param apiPassword API password, sent after the site code in the {@code source} field
 * @param userAgent value of the {@code User-Agent} request header
 */
@ConfigurationProperties("cetustek")
public record CetustekProperties(
    @DefaultValue(CetustekProperties.DEFAULT_ENDPOINT) String endpoint,
    String rentId,
    String siteCode,
    String apiPassword,
    @DefaultValue(CetustekProperties.DEFAULT_USER_AGENT) String userAgent) {

  public static final String DEFAULT_ENDPOINT =
      "https://invoice.cetustek.com.tw/InvoiceMultiWeb/InvoiceAPI";
  public static final String DEFAULT_USER_AGENT = "Cetustek-Java-SDK/1.0";

  public CetustekProperties {
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint;
    userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
  }

  public static CetustekProperties of(String rentId, String siteCode, String apiPassword) {
    return new CetustekProperties(null, rentId, siteCode, apiPassword, null);
  }

  /** The {@code source} auth value: site code immediately followed by the API password. */
  public String source() {
    return siteCode + apiPassword;
  }

  @Override
  public String toString() {
    return "CetustekProperties[endpoint="
        + endpoint
        + ", rentId="
        + rentId
        + ", siteCode="
        + siteCode
        + ", apiPassword=****, userAgent="
        + userAgent
        + "]";
  }
}
