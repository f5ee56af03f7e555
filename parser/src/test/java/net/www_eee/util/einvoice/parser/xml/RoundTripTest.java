/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.parser.xml;

import java.math.*;
import java.util.*;

import org.eclipse.jdt.annotation.*;

import org.junit.jupiter.api.*;

import net.www_eee.util.einvoice.model.*;

import static org.junit.jupiter.api.Assertions.*;


/**
 * Serialize a document, then parse and decode it back again.
 */
@SuppressWarnings("javadoc")
@NonNullByDefault
public class RoundTripTest {

  private static Receipt createReceipt() {
    final Receipt receipt = new Receipt();
    receipt.getOrInit(Receipt.AMOUNT).setValue(new BigDecimal("100.00"));
    receipt.getOrInit(Receipt.ITEMS).appendNew().setText("A");
    receipt.getOrInit(Receipt.ITEMS).appendNew().setText("B");
    return receipt;
  }

  @Test
  public void testStubValidator() throws Exception {
    final Receipt receipt = createReceipt();
    final List<String> validated = new ArrayList<>();
    final byte[] xml = receipt.serialize((bytes, schemaName) -> validated.add(schemaName));
    assertEquals(Collections.singletonList("Receipt"), validated);
    final Receipt decoded = DocumentNodeParser.parse(xml, Receipt.TYPE);
    assertEquals(receipt, decoded);
    assertEquals(new BigDecimal("100.00"), decoded.get(Receipt.AMOUNT).getValue());
    return;
  }

  @Test
  public void testSchemaValidator() throws Exception {
    final Receipt receipt = createReceipt();
    final byte[] xml = receipt.serialize(XSDSchemaValidator.load(XSDSchemaValidatorTest.CATALOG_URL));
    assertEquals(receipt, DocumentNodeParser.parse(xml, Receipt.TYPE));
    return;
  }

  @Test
  public void testEmpty() throws Exception {
    final Receipt receipt = new Receipt();
    final byte[] xml = receipt.serialize(XSDSchemaValidator.load(XSDSchemaValidatorTest.CATALOG_URL));
    final Receipt decoded = DocumentNodeParser.parse(xml, Receipt.TYPE);
    assertEquals(receipt, decoded);
    assertNull(decoded.get(Receipt.AMOUNT));
    return;
  }

  @Test
  public void testNegativeScale() throws Exception {
    final Receipt receipt = new Receipt();
    receipt.getOrInit(Receipt.AMOUNT).setValue(new BigDecimal("100").stripTrailingZeros());
    final Receipt decoded = DocumentNodeParser.parse(receipt.serialize((bytes, schemaName) -> {}), Receipt.TYPE);
    assertEquals(receipt, decoded);
    assertEquals(new BigDecimal("100"), decoded.get(Receipt.AMOUNT).getValue());
    return;
  }

  @Test
  public void testLineEnds() throws Exception {
    final Receipt receipt = new Receipt();
    receipt.getOrInit(Receipt.ITEMS).appendNew().setText("line1\r\nline2");
    receipt.getOrInit(Receipt.ITEMS).appendNew().setText("\r");
    final Receipt decoded = DocumentNodeParser.parse(receipt.serialize((bytes, schemaName) -> {}), Receipt.TYPE);
    assertEquals(receipt, decoded);
    assertEquals("line1\r\nline2", decoded.get(Receipt.ITEMS).getItems().get(0).getText());
    return;
  }

}
