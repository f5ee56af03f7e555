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
 * An <code>ram:IncludedSupplyChainTradeLineItem</code>.
 */
@NonNullByDefault
public final class LineItem extends Element {
  public static final Field<LineDocument> DOCUMENT = Field.element("document", LineDocument.TYPE);
  public static final Field<LineAgreement> AGREEMENT = Field.element("agreement", LineAgreement.TYPE);
  public static final Field<LineDelivery> DELIVERY = Field.element("delivery", LineDelivery.TYPE);
  public static final Field<LineSettlement> SETTLEMENT = Field.element("settlement", LineSettlement.TYPE);
  public static final Field<Product> PRODUCT = Field.element("product", Product.TYPE);
  public static final ElementType<LineItem> TYPE = ElementType.define(LineItem.class, LineItem::new).name(ram("IncludedSupplyChainTradeLineItem")).field(DOCUMENT).field(AGREEMENT).field(DELIVERY).field(SETTLEMENT).field(PRODUCT).build();

  public LineItem() {
    super(TYPE);
    return;
  }

  public static final class LineDocument extends Element {
    public static final Field<TextValue> LINE_ID = Field.text("lineId", ram("LineID"));
    public static final Field<Container<Invoice.IncludedNote>> NOTES = Field.elements("notes", Invoice.IncludedNote.TYPE);
    public static final ElementType<LineDocument> TYPE = ElementType.define(LineDocument.class, LineDocument::new).name(ram("AssociatedDocumentLineDocument")).field(LINE_ID).field(NOTES).build();

    public LineDocument() {
      super(TYPE);
      return;
    }

  } // LineDocument

  public static final class LineAgreement extends Element {
    public static final Field<NetPrice> NET_PRICE = Field.element("netPrice", NetPrice.TYPE);
    public static final ElementType<LineAgreement> TYPE = ElementType.define(LineAgreement.class, LineAgreement::new).name(ram("SpecifiedSupplyChainTradeAgreement")).field(NET_PRICE).build();

    public LineAgreement() {
      super(TYPE);
      return;
    }

  } // LineAgreement

  public static final class NetPrice extends Element {
    public static final Field<CurrencyAmount> CHARGE_AMOUNT = Field.currency("chargeAmount", ram("ChargeAmount"));
    public static final Field<QuantityValue> BASIS_QUANTITY = Field.quantity("basisQuantity", ram("BasisQuantity"));
    public static final ElementType<NetPrice> TYPE = ElementType.define(NetPrice.class, NetPrice::new).name(ram("NetPriceProductTradePrice")).field(CHARGE_AMOUNT).field(BASIS_QUANTITY).build();

    public NetPrice() {
      super(TYPE);
      return;
    }

  } // NetPrice

  public static final class LineDelivery extends Element {
    public static final Field<QuantityValue> BILLED_QUANTITY = Field.quantity("billedQuantity", ram("BilledQuantity"));
    public static final ElementType<LineDelivery> TYPE = ElementType.define(LineDelivery.class, LineDelivery::new).name(ram("SpecifiedSupplyChainTradeDelivery")).field(BILLED_QUANTITY).build();

    public LineDelivery() {
      super(TYPE);
      return;
    }

  } // LineDelivery

  public static final class LineSettlement extends Element {
    public static final Field<Container<TradeTransaction.ApplicableTradeTax>> TRADE_TAXES = Field.elements("tradeTaxes", TradeTransaction.ApplicableTradeTax.TYPE);
    public static final Field<LineSummation> SUMMATION = Field.element("summation", LineSummation.TYPE);
    public static final ElementType<LineSettlement> TYPE = ElementType.define(LineSettlement.class, LineSettlement::new).name(ram("SpecifiedSupplyChainTradeSettlement")).field(TRADE_TAXES).field(SUMMATION).build();

    public LineSettlement() {
      super(TYPE);
      return;
    }

  } // LineSettlement

  public static final class LineSummation extends Element {
    public static final Field<CurrencyAmount> LINE_TOTAL = Field.currency("lineTotal", ram("LineTotalAmount"));
    public static final ElementType<LineSummation> TYPE = ElementType.define(LineSummation.class, LineSummation::new).name(ram("SpecifiedTradeSettlementMonetarySummation")).field(LINE_TOTAL).build();

    public LineSummation() {
      super(TYPE);
      return;
    }

  } // LineSummation

  public static final class Product extends Element {
    public static final Field<SchemeId> GLOBAL_ID = Field.schemeId("globalId", ram("GlobalID"));
    public static final Field<TextValue> SELLER_ASSIGNED_ID = Field.text("sellerAssignedId", ram("SellerAssignedID"));
    public static final Field<TextValue> NAME = Field.text("name", ram("Name"));
    public static final Field<Container<ProductClassification>> CLASSIFICATIONS = Field.elements("classifications", ProductClassification.TYPE);
    public static final ElementType<Product> TYPE = ElementType.define(Product.class, Product::new).name(ram("SpecifiedTradeProduct")).field(GLOBAL_ID).field(SELLER_ASSIGNED_ID).field(NAME).field(CLASSIFICATIONS).build();

    public Product() {
      super(TYPE);
      return;
    }

  } // Product

  public static final class ProductClassification extends Element {
    public static final Field<ClassificationCode> CLASS_CODE = Field.classification("classCode", ram("ClassCode"));
    public static final Field<TextValue> CLASS_NAME = Field.text("className", ram("ClassName"));
    public static final ElementType<ProductClassification> TYPE = ElementType.define(ProductClassification.class, ProductClassification::new).name(ram("DesignatedProductClassification")).field(CLASS_CODE).field(CLASS_NAME).build();

    public ProductClassification() {
      super(TYPE);
      return;
    }

  } // ProductClassification

}
