package io.b2mash.cetustek.model;

import java.math.BigDecimal;

/**
 * Invoice details returned by a query. Every field except {@code invoiceNumber} and {@code rawXml}
 * is null when the vendor payload omits it or leaves it blank. {@code rawXml} holds the complete
 * vendor payload for fields this record does not map.
 */
public record QueryInvoiceResponse(
    String invoiceNumber,
    String invoiceDate,
    String invoiceTime,
    String orderId,
    String randomCode,
    String buyerIdentifier,
    String buyerName,
    String sellerIdentifier,
    String sellerName,
    String invoiceStatus,
    String donateMark,
    String carrierType,
    String carrierId,
    String npoban,
    String taxType,
    BigDecimal salesAmount,
    BigDecimal taxAmount,
    BigDecimal totalAmount,
    String rawXml) {}
