package io.b2mash.cetustek.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input for issuing a new e-invoice. Buyer, carrier and NPO fields are optional; {@code taxRate}
 * defaults to {@link #DEFAULT_TAX_RATE} when null. Use {@link #builder()} rather than the canonical
 * constructor.
 */
public record CreateInvoiceInput(
    @NotBlank String orderId,
    @NotNull LocalDate orderDate,
    @NotNull DonateMark donateMark,
    @NotNull InvoiceType invoiceType,
    @NotNull TaxType taxType,
    @NotBlank String payWay,
    @NotEmpty List<@NotNull @Valid InvoiceItem> items,
    String buyerIdentifier,
    String buyerName,
    String buyerAddress,
    @Email String buyerEmail,
    @NotNull @DecimalMin("0") @DecimalMax("1") BigDecimal taxRate,
    String carrierType,
    String carrierId1,
    String carrierId2,
    String npoban,
    String remark) {

  public static final BigDecimal DEFAULT_TAX_RATE = new BigDecimal("0.05");

  public CreateInvoiceInput {
    items = items == null ? null : Collections.unmodifiableList(new ArrayList<>(items));
    taxRate = taxRate == null ? DEFAULT_TAX_RATE : taxRate;
  }

  /** True when a buyer identifier (tax ID) is present, i.e. a B2B invoice. */
  public boolean hasBuyerIdentifier() {
    return buyerIdentifier != null && !buyerIdentifier.isBlank();
  }

  @AssertTrue(message = "npoban is required for donated invoices")
  public boolean isNpobanPresentWhenDonated() {
    return donateMark != DonateMark.DONATED || (npoban != null && !npoban.isBlank());
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private String orderId;
    private LocalDate orderDate;
    private DonateMark donateMark = DonateMark.NOT_DONATED;
    private InvoiceType invoiceType;
    private TaxType taxType;
    private String payWay;
    private final List<InvoiceItem> items = new ArrayList<>();
    private String buyerIdentifier;
    private String buyerName;
    private String buyerAddress;
    private String buyerEmail;
    private BigDecimal taxRate;
    private String carrierType;
    private String carrierId1;
    private String carrierId2;
    private String npoban;
    private String remark;

    private Builder() {}

    public Builder orderId(String orderId) {
      this.orderId = orderId;
      return this;
    }

    public Builder orderDate(LocalDate orderDate) {
      this.orderDate = orderDate;
      return this;
    }

    public Builder donateMark(DonateMark donateMark) {
      this.donateMark = donateMark;
      return this;
    }

    public Builder donateMark(String code) {
      return donateMark(DonateMark.fromCode(code));
    }

    public Builder invoiceType(InvoiceType invoiceType) {
      this.invoiceType = invoiceType;
      return this;
    }

    /** Sets the invoice type from its vendor code; unknown codes fail immediately. */
    public Builder invoiceType(String code) {
      return invoiceType(InvoiceType.fromCode(code));
    }

    public Builder taxType(TaxType taxType) {
      this.taxType = taxType;
      return this;
    }

    public Builder taxType(String code) {
      return taxType(TaxType.fromCode(code));
    }

    public Builder payWay(String payWay) {
      this.payWay = payWay;
      return this;
    }

    public Builder item(InvoiceItem item) {
      this.items.add(item);
      return this;
    }

    public Builder items(List<InvoiceItem> items) {
      this.items.clear();
      this.items.addAll(items);
      return this;
    }

    public Builder buyerIdentifier(String buyerIdentifier) {
      this.buyerIdentifier = buyerIdentifier;
      return this;
    }

    public Builder buyerName(String buyerName) {
      this.buyerName = buyerName;
      return this;
    }

    public Builder buyerAddress(String buyerAddress) {
      this.buyerAddress = buyerAddress;
      return this;
    }

    public Builder buyerEmail(String buyerEmail) {
      this.buyerEmail = buyerEmail;
      return this;
    }

    public Builder taxRate(BigDecimal taxRate) {
      this.taxRate = taxRate;
      return this;
    }

    public Builder carrierType(String carrierType) {
      this.carrierType = carrierType;
      return this;
    }

    public Builder carrierId1(String carrierId1) {
      this.carrierId1 = carrierId1;
      return this;
    }

    public Builder carrierId2(String carrierId2) {
      this.carrierId2 = carrierId2;
      return this;
    }

    public Builder npoban(String npoban) {
      this.npoban = npoban;
      return this;
    }

    public Builder remark(String remark) {
      this.remark = remark;
      return this;
    }

    public CreateInvoiceInput build() {
      return new CreateInvoiceInput(
          orderId,
          orderDate,
          donateMark,
          invoiceType,
          taxType,
          payWay,
          items,
          buyerIdentifier,
          buyerName,
          buyerAddress,
          buyerEmail,
          taxRate,
          carrierType,
          carrierId1,
          carrierId2,
          npoban,
          remark);
    }
  }
}
