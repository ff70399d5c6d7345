package io.b2mash.cetustek.exception;

import java.util.List;

/** Thrown when an input fails local validation. Always raised before any request is sent. */
public class InvoiceValidationException extends CetustekException {

  private final List<String> violations;

  public InvoiceValidationException(String violation) {
    this(List.of(violation));
  }

  public InvoiceValidationException(List<String> violations) {
    super("Invalid invoice input: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
