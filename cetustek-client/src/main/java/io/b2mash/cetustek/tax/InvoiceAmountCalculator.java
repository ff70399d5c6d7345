package io.b2mash.cetustek.tax;

import io.b2mash.cetustek.model.CreateInvoiceInput;
import io.b2mash.cetustek.model.InvoiceAmounts;
import io.b2mash.cetustek.model.InvoiceItem;
import io.b2mash.cetustek.model.TaxType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/** Stateless calculator for invoice sales, tax and total amounts in whole TWD. */
public class InvoiceAmountCalculator {

  /**
   * Calculates the amounts of an invoice. B2B invoices (buyer identifier present) carry
   * tax-exclusive unit prices; B2C invoices carry tax-inclusive prices.
   *
   * @param input the validated invoice input
   * @return sales, tax and total amounts, scale 0, HALF_UP rounding
   */
  public InvoiceAmounts calculate(CreateInvoiceInput input) {
    return calculate(input.items(), input.taxType(), input.taxRate(), !input.hasBuyerIdentifier());
  }

  /**
   * Calculates the amounts for a list of items.
   *
   * @param items the invoice lines
   * @param taxType the tax category; non-taxable categories yield zero tax
   * @param taxRate the tax rate as a fraction (e.g., 0.05 for 5%)
   * @param taxInclusive whether unit prices already include tax
   */
  public InvoiceAmounts calculate(
      List<InvoiceItem> items, TaxType taxType, BigDecimal taxRate, boolean taxInclusive) {
    BigDecimal sum =
        items.stream()
            .map(InvoiceItem::lineAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(0, RoundingMode.HALF_UP);

    if (!taxType.isTaxable() || taxRate.signum() == 0) {
      return new InvoiceAmounts(sum, BigDecimal.ZERO, sum);
    }

    if (taxInclusive) {
      // Extract tax from the inclusive total
      BigDecimal sales = sum.divide(BigDecimal.ONE.add(taxRate), 0, RoundingMode.HALF_UP);
      return new InvoiceAmounts(sales, sum.subtract(sales), sum);
    }
    BigDecimal tax = sum.multiply(taxRate).setScale(0, RoundingMode.HALF_UP);
    return new InvoiceAmounts(sum, tax, sum.add(tax));
  }
}
