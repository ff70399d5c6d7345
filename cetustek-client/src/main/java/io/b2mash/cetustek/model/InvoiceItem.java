package io.b2mash.cetustek.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;

/** One product line of an invoice ({@code ProductItem}). {@code unit} may be null. */
public record InvoiceItem(
    @NotBlank String productionCode,
    @NotBlank String description,
    @NotNull @PositiveOrZero BigDecimal quantity,
    @NotNull @PositiveOrZero BigDecimal unitPrice,
    String unit) {

  public static InvoiceItem of(
      String productionCode, String description, BigDecimal quantity, BigDecimal unitPrice) {
    return new InvoiceItem(productionCode, description, quantity, unitPrice, null);
  }

  /** quantity * unitPrice, unrounded. */
  public BigDecimal lineAmount() {
    return quantity.multiply(unitPrice);
  }
}
