package io.b2mash.cetustek.model;

import java.math.BigDecimal;

/** Sales (pre-tax), tax and total amounts of an invoice, in whole TWD. */
public record InvoiceAmounts(
    BigDecimal salesAmount, BigDecimal taxAmount, BigDecimal totalAmount) {}
