/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.ws.rs.provider.xml;

import java.io.*;
import java.lang.annotation.*;
import java.math.*;
import java.time.*;
import java.util.*;

import org.eclipse.jdt.annotation.*;

import javax.ws.rs.core.*;

import org.junit.jupiter.api.*;

import net.www_eee.util.einvoice.model.*;
import net.www_eee.util.einvoice.zugferd.*;

import static org.junit.jupiter.api.Assertions.*;


@SuppressWarnings("javadoc")
@NonNullByDefault
public class DocumentRootMessageBodyWriterTest {
  protected static final @NonNull Annotation[] NO_ANNOTATIONS = new Annotation[0];

  protected static Invoice createInvoice() {
    final Invoice invoice = new Invoice();
    final Invoice.Header header = invoice.getOrInit(Invoice.HEADER);
    header.getOrInit(Invoice.Header.ID).setText("RE1337");
    header.getOrInit(Invoice.Header.TYPE_CODE).setText("380");
    header.getOrInit(Invoice.Header.ISSUE_DATE_TIME).setDate(LocalDate.of(2018, 6, 5));
    final TradeTransaction.MonetarySummation summation = invoice.getOrInit(Invoice.TRADE).getOrInit(TradeTransaction.SETTLEMENT).getOrInit(TradeTransaction.Settlement.MONETARY_SUMMATION);
    summation.getOrInit(TradeTransaction.MonetarySummation.GRAND_TOTAL).setAmount(new BigDecimal("119.00"));
    return invoice;
  }

  @Test
  public void testIsWriteable() throws Exception {
    final DocumentRootMessageBodyWriter writer = new DocumentRootMessageBodyWriter((bytes, schemaName) -> {
      return;
    });
    assertTrue(writer.isWriteable(Invoice.class, Invoice.class, NO_ANNOTATIONS, MediaType.APPLICATION_XML_TYPE));
    assertTrue(writer.isWriteable(DocumentRoot.class, DocumentRoot.class, NO_ANNOTATIONS, MediaType.APPLICATION_XML_TYPE));
    assertFalse(writer.isWriteable(String.class, String.class, NO_ANNOTATIONS, MediaType.APPLICATION_XML_TYPE));
    assertEquals(-1, writer.getSize(createInvoice(), Invoice.class, Invoice.class, NO_ANNOTATIONS, MediaType.APPLICATION_XML_TYPE));
    return;
  }

  @Test
  public void testWriteTo() throws Exception {
    final List<String> validated = new ArrayList<>();
    final DocumentRootMessageBodyWriter writer = new DocumentRootMessageBodyWriter((bytes, schemaName) -> validated.add(schemaName));
    final Invoice invoice = createInvoice();
    final ByteArrayOutputStream entityStream = new ByteArrayOutputStream();
    writer.writeTo(invoice, Invoice.class, Invoice.class, NO_ANNOTATIONS, MediaType.APPLICATION_XML_TYPE, new MultivaluedHashMap<>(), entityStream);
    assertEquals(Collections.singletonList(Invoice.SCHEMA_NAME), validated);
    assertArrayEquals(invoice.toXML(), entityStream.toByteArray());
    return;
  }

  @Test
  public void testWriteToInvalid() throws Exception {
    final DocumentRootMessageBodyWriter writer = new DocumentRootMessageBodyWriter((bytes, schemaName) -> {
      throw new CodecException.ValidationFailedException(schemaName, "line 1, column 1: rejected", null);
    });
    final ByteArrayOutputStream entityStream = new ByteArrayOutputStream();
    assertThrows(CodecException.ValidationFailedException.class, () -> writer.writeTo(createInvoice(), Invoice.class, Invoice.class, NO_ANNOTATIONS, MediaType.APPLICATION_XML_TYPE, new MultivaluedHashMap<>(), entityStream));
    assertEquals(0, entityStream.size());
    return;
  }

}
