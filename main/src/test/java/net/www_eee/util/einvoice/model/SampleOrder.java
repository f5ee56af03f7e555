/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import java.util.*;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;


/**
 * A small document type exercising each kind of field.
 */
@SuppressWarnings("javadoc")
@NonNullByDefault
public final class SampleOrder extends DocumentRoot {
  public static final String NS = "urn:test:einvoice";
  public static final String SCHEMA_NAME = "Sample";
  public static final Field<DecimalValue> AMOUNT = Field.decimal("amount", new QName(NS, "Amount"));
  public static final Field<Container<TextValue>> ITEMS = Field.texts("items", new QName(NS, "Item"));
  public static final Field<DateValue> DUE = Field.date("due", new QName(NS, "Due"));
  public static final Field<Buyer> BUYER = Field.element("buyer", Buyer.TYPE);
  public static final Field<Container<Line>> LINES = Field.elements("lines", Line.TYPE);
  public static final ElementType<SampleOrder> TYPE = ElementType.define(SampleOrder.class, SampleOrder::new).name(NS, "Order").attr("version", "1").field(AMOUNT).field(ITEMS).field(DUE).field(BUYER).field(LINES).build();
  public static final Map<String,String> PREFIXES;
  static {
    final Map<String,String> prefixes = new HashMap<>();
    prefixes.put(NS, "t");
    prefixes.put(Namespaces.UDT, "udt");
    PREFIXES = Collections.unmodifiableMap(prefixes);
  }

  public SampleOrder() {
    super(TYPE);
    return;
  }

  @Override
  public String getSchemaName() {
    return SCHEMA_NAME;
  }

  @Override
  public Map<String,String> getNamespacePrefixes() {
    return PREFIXES;
  }

  public static abstract class Party extends Element {
    public static final Field<TextValue> NAME = Field.text("name", new QName(NS, "Name"));
    public static final ElementType<Party> TYPE = ElementType.define(Party.class).field(NAME).build();

    protected Party(final ElementType<? extends Party> type) {
      super(type);
      return;
    }

  } // Party

  public static final class Buyer extends Party {
    public static final Field<TextValue> CONTACT = Field.text("contact", new QName(NS, "Contact"));
    public static final ElementType<Buyer> TYPE = ElementType.extend(Party.TYPE, Buyer.class, Buyer::new).name(NS, "Buyer").field(CONTACT).build();

    public Buyer() {
      super(TYPE);
      return;
    }

  } // Buyer

  public static final class Line extends Element {
    public static final Field<QuantityValue> QUANTITY = Field.quantity("quantity", new QName(NS, "Quantity"));
    public static final Field<CurrencyAmount> PRICE = Field.currency("price", new QName(NS, "Price"));
    public static final ElementType<Line> TYPE = ElementType.define(Line.class, Line::new).name(NS, "Line").field(QUANTITY).field(PRICE).build();

    public Line() {
      super(TYPE);
      return;
    }

  } // Line

}
