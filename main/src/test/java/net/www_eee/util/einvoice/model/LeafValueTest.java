/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import java.math.*;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;

import org.junit.jupiter.api.*;

import net.www_eee.util.einvoice.xml.*;

import static org.junit.jupiter.api.Assertions.*;


@SuppressWarnings("javadoc")
@NonNullByDefault
public class LeafValueTest {
  protected static final QName NAME = new QName(SampleOrder.NS, "Value");

  @Test
  public void testText() throws Exception {
    final DocumentNode node = new TextValue(NAME, "Widget & Co").encode();
    assertEquals(NAME, node.getName());
    assertEquals("Widget & Co", node.getText());
    assertTrue(node.getAttrs().isEmpty());
    assertEquals(new TextValue(NAME, "Widget & Co"), new TextValue(NAME).decode(node));
    return;
  }

  @Test
  public void testTextMissing() throws Exception {
    assertEquals("", new TextValue(NAME, "old").decode(new DocumentNode(NAME)).getText());
    return;
  }

  @Test
  public void testDecimalPreservesScale() throws Exception {
    final DocumentNode node = new DecimalValue(NAME, new BigDecimal("100.00")).encode();
    assertEquals("100.00", node.getText());
    final DecimalValue decoded = new DecimalValue(NAME).decode(node);
    assertEquals(new BigDecimal("100.00"), decoded.getValue());
    assertEquals(2, decoded.getValue().scale());
    return;
  }

  @Test
  public void testDecimalNegativeScale() throws Exception {
    final DecimalValue value = new DecimalValue(NAME, new BigDecimal("100").stripTrailingZeros());
    assertEquals(0, value.getValue().scale());
    assertEquals("100", value.encode().getText());
    assertEquals(value, new DecimalValue(NAME).decode(value.encode()));
    assertEquals(value, new DecimalValue(NAME).decode(new DocumentNode(NAME).setText("1E+2")));
    final CurrencyAmount amount = new CurrencyAmount(NAME).set(new BigDecimal("1E+3"), "USD");
    assertEquals(amount, new CurrencyAmount(NAME).decode(amount.encode()));
    final QuantityValue quantity = new QuantityValue(NAME, new BigDecimal("5E+1"), "KGM");
    assertEquals(quantity, new QuantityValue(NAME).decode(quantity.encode()));
    return;
  }

  @Test
  public void testDecimalInvalid() throws Exception {
    final CodecException.InvalidDecimalException ide = assertThrows(CodecException.InvalidDecimalException.class, () -> new DecimalValue(NAME).decode(new DocumentNode(NAME).setText("12,50")));
    assertEquals(NAME, ide.getElementName());
    assertEquals("12,50", ide.getText());
    assertThrows(CodecException.InvalidDecimalException.class, () -> new DecimalValue(NAME).decode(new DocumentNode(NAME)));
    return;
  }

  @Test
  public void testDecimalUnset() throws Exception {
    assertThrows(IllegalStateException.class, () -> new DecimalValue(NAME).encode());
    return;
  }

  @Test
  public void testQuantity() throws Exception {
    final DocumentNode node = new QuantityValue(NAME, new BigDecimal("2.5"), "KGM").encode();
    assertEquals("2.5", node.getText());
    assertEquals("KGM", node.getAttrOrNull(QuantityValue.UNIT_CODE_ATTR));
    final QuantityValue decoded = new QuantityValue(NAME).decode(node);
    assertEquals(new BigDecimal("2.5"), decoded.getAmount());
    assertEquals("KGM", decoded.getUnitCode());
    final QuantityValue weight = new QuantityValue(NAME, new BigDecimal("12.50"), "KGM");
    assertEquals(weight, new QuantityValue(NAME).decode(weight.encode()));
    return;
  }

  @Test
  public void testQuantityMissingUnitCode() throws Exception {
    final CodecException.MissingAttributeException mae = assertThrows(CodecException.MissingAttributeException.class, () -> new QuantityValue(NAME).decode(new DocumentNode(NAME).setText("1")));
    assertEquals("unitCode", mae.getAttrName());
    return;
  }

  @Test
  public void testCurrencyDefault() throws Exception {
    final CurrencyAmount amount = new CurrencyAmount(NAME, new BigDecimal("19.99"));
    assertEquals("EUR", amount.getCurrency());
    final DocumentNode node = amount.encode();
    assertEquals("19.99", node.getText());
    assertEquals("EUR", node.getAttrOrNull(CurrencyAmount.CURRENCY_ID_ATTR));
    return;
  }

  @Test
  public void testCurrency() throws Exception {
    final CurrencyAmount decoded = new CurrencyAmount(NAME).decode(new DocumentNode(NAME).setText("5.00").setAttr("currencyID", "USD"));
    assertEquals(new BigDecimal("5.00"), decoded.getAmount());
    assertEquals("USD", decoded.getCurrency());
    assertThrows(CodecException.MissingAttributeException.class, () -> new CurrencyAmount(NAME).decode(new DocumentNode(NAME).setText("5.00")));
    return;
  }

  @Test
  public void testClassificationKeepsText() throws Exception {
    final DocumentNode node = new ClassificationCode(NAME, "0815", "TST", "2").encode();
    assertEquals("0815", node.getText());
    assertEquals("TST", node.getAttrOrNull("listID"));
    assertEquals("2", node.getAttrOrNull("listVersionID"));
    final ClassificationCode decoded = new ClassificationCode(NAME).decode(node);
    assertEquals("0815", decoded.getText());
    assertEquals(new ClassificationCode(NAME, "0815", "TST", "2"), decoded);
    assertEquals("ABC-1", new ClassificationCode(NAME).decode(new DocumentNode(NAME).setText("ABC-1")).getText());
    return;
  }

  @Test
  public void testClassificationMissingAttrs() throws Exception {
    final ClassificationCode decoded = new ClassificationCode(NAME).decode(new DocumentNode(NAME).setText("42"));
    assertEquals("", decoded.getListId());
    assertEquals("", decoded.getListVersionId());
    return;
  }

  @Test
  public void testAgencyCode() throws Exception {
    final DocumentNode node = new AgencyCode(NAME, "4000001123452", "9").encode();
    assertEquals("9", node.getAttrOrNull("schemeAgencyID"));
    assertEquals(new AgencyCode(NAME, "4000001123452", "9"), new AgencyCode(NAME).decode(node));
    assertEquals("", new AgencyCode(NAME).decode(new DocumentNode(NAME).setText("X")).getSchemeAgencyId());
    return;
  }

  @Test
  public void testSchemeId() throws Exception {
    final DocumentNode node = new SchemeId(NAME, "DE123456789", "VA").encode();
    assertEquals("DE123456789", node.getText());
    assertEquals("VA", node.getAttrOrNull("schemeID"));
    assertEquals(new SchemeId(NAME, "DE123456789", "VA"), new SchemeId(NAME).decode(node));
    assertEquals("", new SchemeId(NAME).decode(new DocumentNode(NAME).setText("X")).getSchemeId());
    return;
  }

  @Test
  public void testIndicator() throws Exception {
    final DocumentNode node = new IndicatorValue(NAME, Boolean.TRUE).encode();
    assertNull(node.getText());
    assertEquals(1, node.getChildren().size());
    assertEquals(IndicatorValue.INDICATOR, node.getChildren().get(0).getName());
    assertEquals("true", node.getChildren().get(0).getText());
    assertEquals(Boolean.TRUE, new IndicatorValue(NAME).decode(node).getValue());
    assertEquals(Boolean.FALSE, new IndicatorValue(NAME).decode(new IndicatorValue(NAME, Boolean.FALSE).encode()).getValue());
    return;
  }

  @Test
  public void testIndicatorMalformed() throws Exception {
    assertThrows(CodecException.MalformedIndicatorException.class, () -> new IndicatorValue(NAME).decode(new DocumentNode(NAME).setText("true")));
    final DocumentNode node = new DocumentNode(NAME);
    node.appendChild(new DocumentNode(IndicatorValue.INDICATOR)).setText("yes");
    assertThrows(CodecException.MalformedIndicatorException.class, () -> new IndicatorValue(NAME).decode(node));
    assertThrows(IllegalStateException.class, () -> new IndicatorValue(NAME).encode());
    return;
  }

  @Test
  public void testEqualityIncludesName() throws Exception {
    assertNotEquals(new TextValue(NAME, "a"), new TextValue(new QName(SampleOrder.NS, "Other"), "a"));
    assertNotEquals(new TextValue(NAME, "a"), new TextValue(NAME, "b"));
    assertEquals(new TextValue(NAME, "a").hashCode(), new TextValue(NAME, "a").hashCode());
    return;
  }

}
