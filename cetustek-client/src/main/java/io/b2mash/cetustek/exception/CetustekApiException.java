package io.b2mash.cetustek.exception;

/**
 * Thrown when the Cetustek service answers with an error code instead of a result. The vendor code
 * and message are carried verbatim.
 */
public class CetustekApiException extends CetustekException {

  private final String code;
  private final String vendorMessage;

  public CetustekApiException(String code) {
    this(code, null);
  }

  public CetustekApiException(String code, String vendorMessage) {
    super("API Error: " + code + (vendorMessage != null ? " - " + vendorMessage : ""));
    this.code = code;
    this.vendorMessage = vendorMessage;
  }

  public String getCode() {
    return code;
  }

  /** Additional detail, or {@code null} when the vendor returned only a code. */
  public String getVendorMessage() {
    return vendorMessage;
  }
}
