package io.b2mash.cetustek.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record QueryInvoiceInput(
    @NotBlank String invoiceNumber,
    @NotNull @Pattern(regexp = "\\d{4}", message = "must be a 4-digit year") String invoiceYear) {}
