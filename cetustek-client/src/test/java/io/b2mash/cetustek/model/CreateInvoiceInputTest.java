package io.b2mash.cetustek.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.cetustek.exception.InvoiceValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import org.junit.jupiter.api.Test;

class CreateInvoiceInputTest {

  @Test
  void builder_defaults_tax_rate_and_donate_mark() {
    var input = minimal().build();

    assertThat(input.taxRate()).isEqualByComparingTo("0.05");
    assertThat(input.donateMark()).isEqualTo(DonateMark.NOT_DONATED);
    assertThat(input.hasBuyerIdentifier()).isFalse();
  }

  @Test
  void builder_accepts_vendor_codes() {
    var input = minimal().donateMark("1").invoiceType("08").taxType("9").build();

    assertThat(input.donateMark()).isEqualTo(DonateMark.DONATED);
    assertThat(input.invoiceType()).isEqualTo(InvoiceType.SPECIAL);
    assertThat(input.taxType()).isEqualTo(TaxType.MIXED);
  }

  @Test
  void items_are_copied_and_unmodifiable() {
    var items = new ArrayList<InvoiceItem>();
    items.add(InvoiceItem.of("P1", "One", BigDecimal.ONE, BigDecimal.TEN));
    var input = minimal().items(items).build();
    items.add(InvoiceItem.of("P2", "Two", BigDecimal.ONE, BigDecimal.TEN));

    assertThat(input.items()).hasSize(1);
    assertThatThrownBy(() -> input.items().clear())
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void donated_invoice_requires_npoban() {
    assertThat(minimal().donateMark(DonateMark.DONATED).build().isNpobanPresentWhenDonated())
        .isFalse();
    assertThat(
            minimal()
                .donateMark(DonateMark.DONATED)
                .npoban("8585")
                .build()
                .isNpobanPresentWhenDonated())
        .isTrue();
    assertThat(minimal().build().isNpobanPresentWhenDonated()).isTrue();
  }

  @Test
  void unknown_codes_are_rejected() {
    assertThatThrownBy(() -> InvoiceType.fromCode("09"))
        .isInstanceOf(InvoiceValidationException.class)
        .hasMessage("Invalid invoice input: invoiceType: unknown code '09'");
    assertThatThrownBy(() -> DonateMark.fromCode("3"))
        .isInstanceOf(InvoiceValidationException.class);
    assertThatThrownBy(() -> TaxType.fromCode("6")).isInstanceOf(InvoiceValidationException.class);
    assertThatThrownBy(() -> TaxType.fromCode(null))
        .isInstanceOf(InvoiceValidationException.class);
  }

  @Test
  void tax_types_mark_taxable_categories() {
    assertThat(TaxType.fromCode("1").isTaxable()).isTrue();
    assertThat(TaxType.fromCode("4").isTaxable()).isTrue();
    assertThat(TaxType.fromCode("3").isTaxable()).isFalse();
  }

  private static CreateInvoiceInput.Builder minimal() {
    return CreateInvoiceInput.builder()
        .orderId("A1")
        .orderDate(LocalDate.of(2026, 1, 1))
        .invoiceType(InvoiceType.GENERAL)
        .taxType(TaxType.TAXABLE)
        .payWay("1")
        .item(InvoiceItem.of("P1", "One", BigDecimal.ONE, BigDecimal.TEN));
  }
}
