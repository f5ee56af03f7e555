/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import java.util.*;
import java.util.stream.*;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;

import org.junit.jupiter.api.*;

import net.www_eee.util.einvoice.xml.*;

import static org.junit.jupiter.api.Assertions.*;


@SuppressWarnings("javadoc")
@NonNullByDefault
public class ContainerTest {
  protected static final QName ITEM = new QName(SampleOrder.NS, "Item");

  private static Container<TextValue> createContainer() {
    return new Container<>(ITEM, () -> new TextValue(ITEM));
  }

  @Test
  public void testOrder() throws Exception {
    final Container<TextValue> container = createContainer();
    container.append(new TextValue(ITEM, "first"));
    container.appendNew().setText("second");
    container.append(new TextValue(ITEM, "third"));
    final DocumentNode parent = new DocumentNode(SampleOrder.NS, "Order");
    container.appendTo(parent);
    assertEquals(Arrays.asList("first", "second", "third"), parent.getChildren().stream().map(DocumentNode::getText).collect(Collectors.toList()));
    assertEquals(3, container.size());
    return;
  }

  @Test
  public void testEmpty() throws Exception {
    final DocumentNode parent = new DocumentNode(SampleOrder.NS, "Order");
    createContainer().appendTo(parent);
    assertTrue(parent.getChildren().isEmpty());
    return;
  }

  @Test
  public void testWrongTag() throws Exception {
    assertThrows(IllegalArgumentException.class, () -> createContainer().append(new TextValue(new QName(SampleOrder.NS, "Other"), "x")));
    return;
  }

  @Test
  public void testDecodeAppend() throws Exception {
    final Container<SampleOrder.Line> container = Container.of(SampleOrder.Line.TYPE);
    final DocumentNode node = new DocumentNode(SampleOrder.NS, "Line");
    node.appendChild(new DocumentNode(SampleOrder.NS, "Quantity")).setText("2").setAttr("unitCode", "H87");
    final SampleOrder.Line line = container.decodeAppend(node);
    assertSame(line, container.getItems().get(0));
    assertEquals("H87", line.get(SampleOrder.Line.QUANTITY).getUnitCode());
    assertNull(line.get(SampleOrder.Line.PRICE));
    return;
  }

  @Test
  public void testAbstractItems() throws Exception {
    assertThrows(IllegalStateException.class, () -> Container.of(SampleOrder.Party.TYPE));
    return;
  }

}
