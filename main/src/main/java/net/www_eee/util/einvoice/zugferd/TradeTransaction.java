/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.zugferd;

import org.eclipse.jdt.annotation.*;

import net.www_eee.util.einvoice.model.*;

import static net.www_eee.util.einvoice.model.Namespaces.*;


/**
 * The <code>rsm:SpecifiedSupplyChainTradeTransaction</code>, covering the parties, delivery, settlement, and line
 * items of an {@link Invoice}.
 */
@NonNullByDefault
public final class TradeTransaction extends Element {
  public static final Field<Agreement> AGREEMENT = Field.element("agreement", Agreement.TYPE);
  public static final Field<Delivery> DELIVERY = Field.element("delivery", Delivery.TYPE);
  public static final Field<Settlement> SETTLEMENT = Field.element("settlement", Settlement.TYPE);
  public static final Field<Container<LineItem>> ITEMS = Field.elements("items", LineItem.TYPE);
  public static final ElementType<TradeTransaction> TYPE = ElementType.define(TradeTransaction.class, TradeTransaction::new).name(rsm("SpecifiedSupplyChainTradeTransaction")).field(AGREEMENT).field(DELIVERY).field(SETTLEMENT).field(ITEMS).build();

  public TradeTransaction() {
    super(TYPE);
    return;
  }

  public static final class Agreement extends Element {
    public static final Field<TextValue> BUYER_REFERENCE = Field.text("buyerReference", ram("BuyerReference"));
    public static final Field<TradeParty.Seller> SELLER = Field.element("seller", TradeParty.Seller.TYPE);
    public static final Field<TradeParty.Buyer> BUYER = Field.element("buyer", TradeParty.Buyer.TYPE);
    public static final ElementType<Agreement> TYPE = ElementType.define(Agreement.class, Agreement::new).name(ram("ApplicableSupplyChainTradeAgreement")).field(BUYER_REFERENCE).field(SELLER).field(BUYER).build();

    public Agreement() {
      super(TYPE);
      return;
    }

  } // Agreement

  public static final class Delivery extends Element {
    public static final Field<DeliveryEvent> EVENT = Field.element("event", DeliveryEvent.TYPE);
    public static final ElementType<Delivery> TYPE = ElementType.define(Delivery.class, Delivery::new).name(ram("ApplicableSupplyChainTradeDelivery")).field(EVENT).build();

    public Delivery() {
      super(TYPE);
      return;
    }

  } // Delivery

  public static final class DeliveryEvent extends Element {
    public static final Field<DateValue> OCCURRENCE_DATE_TIME = Field.date("occurrenceDateTime", ram("OccurrenceDateTime"));
    public static final ElementType<DeliveryEvent> TYPE = ElementType.define(DeliveryEvent.class, DeliveryEvent::new).name(ram("ActualDeliverySupplyChainEvent")).field(OCCURRENCE_DATE_TIME).build();

    public DeliveryEvent() {
      super(TYPE);
      return;
    }

  } // DeliveryEvent

  public static final class Settlement extends Element {
    public static final Field<TextValue> PAYMENT_REFERENCE = Field.text("paymentReference", ram("PaymentReference"));
    /**
     * ISO 4217.
     */
    public static final Field<TextValue> CURRENCY_CODE = Field.text("currencyCode", ram("InvoiceCurrencyCode"));
    public static final Field<Container<ApplicableTradeTax>> TRADE_TAXES = Field.elements("tradeTaxes", ApplicableTradeTax.TYPE);
    public static final Field<MonetarySummation> MONETARY_SUMMATION = Field.element("monetarySummation", MonetarySummation.TYPE);
    public static final ElementType<Settlement> TYPE = ElementType.define(Settlement.class, Settlement::new).name(ram("ApplicableSupplyChainTradeSettlement")).field(PAYMENT_REFERENCE).field(CURRENCY_CODE).field(TRADE_TAXES).field(MONETARY_SUMMATION).build();

    public Settlement() {
      super(TYPE);
      return;
    }

  } // Settlement

  /**
   * A tax applied to the whole invoice, or to a single {@linkplain LineItem.LineSettlement line}.
   */
  public static final class ApplicableTradeTax extends Element {
    public static final Field<CurrencyAmount> CALCULATED_AMOUNT = Field.currency("calculatedAmount", ram("CalculatedAmount"));
    public static final Field<TextValue> TYPE_CODE = Field.text("typeCode", ram("TypeCode"));
    public static final Field<CurrencyAmount> BASIS_AMOUNT = Field.currency("basisAmount", ram("BasisAmount"));
    public static final Field<TextValue> CATEGORY_CODE = Field.text("categoryCode", ram("CategoryCode"));
    public static final Field<DecimalValue> APPLICABLE_PERCENT = Field.decimal("applicablePercent", ram("ApplicablePercent"));
    public static final ElementType<ApplicableTradeTax> TYPE = ElementType.define(ApplicableTradeTax.class, ApplicableTradeTax::new).name(ram("ApplicableTradeTax")).field(CALCULATED_AMOUNT).field(TYPE_CODE).field(BASIS_AMOUNT).field(CATEGORY_CODE).field(APPLICABLE_PERCENT).build();

    public ApplicableTradeTax() {
      super(TYPE);
      return;
    }

  } // ApplicableTradeTax

  public static final class MonetarySummation extends Element {
    public static final Field<CurrencyAmount> LINE_TOTAL = Field.currency("lineTotal", ram("LineTotalAmount"));
    public static final Field<CurrencyAmount> CHARGE_TOTAL = Field.currency("chargeTotal", ram("ChargeTotalAmount"));
    public static final Field<CurrencyAmount> ALLOWANCE_TOTAL = Field.currency("allowanceTotal", ram("AllowanceTotalAmount"));
    public static final Field<CurrencyAmount> TAX_BASIS_TOTAL = Field.currency("taxBasisTotal", ram("TaxBasisTotalAmount"));
    public static final Field<CurrencyAmount> TAX_TOTAL = Field.currency("taxTotal", ram("TaxTotalAmount"));
    public static final Field<CurrencyAmount> GRAND_TOTAL = Field.currency("grandTotal", ram("GrandTotalAmount"));
    public static final Field<CurrencyAmount> DUE_PAYABLE = Field.currency("duePayable", ram("DuePayableAmount"));
    public static final ElementType<MonetarySummation> TYPE = ElementType.define(MonetarySummation.class, MonetarySummation::new).name(ram("SpecifiedTradeSettlementMonetarySummation")).field(LINE_TOTAL).field(CHARGE_TOTAL).field(ALLOWANCE_TOTAL).field(TAX_BASIS_TOTAL).field(TAX_TOTAL).field(GRAND_TOTAL).field(DUE_PAYABLE).build();

    public MonetarySummation() {
      super(TYPE);
      return;
    }

  } // MonetarySummation

}
