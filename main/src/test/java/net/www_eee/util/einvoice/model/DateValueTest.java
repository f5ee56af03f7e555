/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import java.time.*;
import java.time.format.*;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;

import org.junit.jupiter.api.*;

import net.www_eee.util.einvoice.xml.*;

import static org.junit.jupiter.api.Assertions.*;


@SuppressWarnings("javadoc")
@NonNullByDefault
public class DateValueTest {
  protected static final QName NAME = new QName(SampleOrder.NS, "Due");

  private static DocumentNode createDateNode(final @Nullable String format, final String text) {
    final DocumentNode node = new DocumentNode(NAME);
    final DocumentNode dateTimeString = node.appendChild(new DocumentNode(DateValue.DATE_TIME_STRING)).setText(text);
    if (format != null) dateTimeString.setAttr("format", format);
    return node;
  }

  @Test
  public void testEncode() throws Exception {
    final DocumentNode node = new DateValue(NAME, LocalDate.of(2023, 1, 15)).encode();
    assertEquals(NAME, node.getName());
    assertNull(node.getText());
    assertEquals(1, node.getChildren().size());
    final DocumentNode dateTimeString = node.getChildren().get(0);
    assertEquals(new QName(Namespaces.UDT, "DateTimeString"), dateTimeString.getName());
    assertEquals("102", dateTimeString.getAttrOrNull("format"));
    assertEquals("20230115", dateTimeString.getText());
    return;
  }

  @Test
  public void testDecode() throws Exception {
    final DocumentNode node = createDateNode("102", "20230115");
    final DateValue decoded = new DateValue(NAME).decode(node);
    assertEquals(LocalDate.of(2023, 1, 15), decoded.getDate());
    assertEquals(node, decoded.encode());
    assertEquals(new DateValue(NAME, LocalDate.of(1999, 12, 31)), new DateValue(NAME).decode(new DateValue(NAME, LocalDate.of(1999, 12, 31)).encode()));
    return;
  }

  @Test
  public void testUnsupportedFormat() throws Exception {
    final CodecException.UnsupportedDateFormatException udfe = assertThrows(CodecException.UnsupportedDateFormatException.class, () -> new DateValue(NAME).decode(createDateNode("101", "230115")));
    assertEquals("101", udfe.getFormatCode());
    assertEquals(NAME, udfe.getElementName());
    return;
  }

  @Test
  public void testMissingFormat() throws Exception {
    assertThrows(CodecException.MissingAttributeException.class, () -> new DateValue(NAME).decode(createDateNode(null, "20230115")));
    return;
  }

  @Test
  public void testTwoChildren() throws Exception {
    final DocumentNode node = createDateNode("102", "20230115");
    node.appendChild(new DocumentNode(DateValue.DATE_TIME_STRING)).setAttr("format", "102").setText("20230116");
    assertThrows(CodecException.MalformedDateContainerException.class, () -> new DateValue(NAME).decode(node));
    return;
  }

  @Test
  public void testNoChildren() throws Exception {
    assertThrows(CodecException.MalformedDateContainerException.class, () -> new DateValue(NAME).decode(new DocumentNode(NAME).setText("20230115")));
    return;
  }

  @Test
  public void testWrongChild() throws Exception {
    final DocumentNode node = new DocumentNode(NAME);
    node.appendChild(new DocumentNode(SampleOrder.NS, "DateTimeString")).setAttr("format", "102").setText("20230115");
    assertThrows(CodecException.MalformedDateContainerException.class, () -> new DateValue(NAME).decode(node));
    return;
  }

  @Test
  public void testInvalidDate() throws Exception {
    final CodecException.MalformedDateContainerException mdce = assertThrows(CodecException.MalformedDateContainerException.class, () -> new DateValue(NAME).decode(createDateNode("102", "20230230")));
    assertTrue(mdce.getCause() instanceof DateTimeParseException);
    assertThrows(CodecException.MalformedDateContainerException.class, () -> new DateValue(NAME).decode(createDateNode("102", "2023-01-15")));
    return;
  }

  @Test
  public void testUnset() throws Exception {
    assertThrows(IllegalStateException.class, () -> new DateValue(NAME).encode());
    return;
  }

}
