/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import java.math.*;
import java.util.*;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;

import net.www_eee.util.einvoice.xml.*;


/**
 * A terminal value, encoded as a single node carrying text and/or attributes according to the rules of the concrete
 * variant.
 */
@NonNullByDefault
public abstract class LeafValue extends SingleNodeValue {
  protected final QName name;

  LeafValue(final QName name) {
    this.name = Objects.requireNonNull(name, "null name");
    return;
  }

  @Override
  public final QName getName() {
    return name;
  }

  @Override
  public abstract LeafValue decode(DocumentNode node) throws CodecException.DecodingException;

  protected final DocumentNode createNode() {
    return new DocumentNode(name);
  }

  protected static String getText(final DocumentNode node) {
    final @Nullable String text = node.getText();
    return (text != null) ? text : "";
  }

  protected static String getAttr(final DocumentNode node, final String attrName) {
    return node.getOptionalAttr(attrName).orElse("");
  }

  protected static String getRequiredAttr(final DocumentNode node, final String attrName) throws CodecException.MissingAttributeException {
    final @Nullable String value = node.getAttrOrNull(attrName);
    if (value == null) throw new CodecException.MissingAttributeException(node.getName(), attrName);
    return value;
  }

  /**
   * Values with a negative scale are rendered without an exponent, so are held at scale zero.
   */
  protected static @Nullable BigDecimal plainScale(final @Nullable BigDecimal value) {
    return ((value != null) && (value.scale() < 0)) ? value.setScale(0) : value;
  }

  protected static BigDecimal parseDecimal(final DocumentNode node) throws CodecException.InvalidDecimalException {
    final @Nullable String text = node.getText();
    if (text == null) throw new CodecException.InvalidDecimalException(node.getName(), null, new NumberFormatException("No text"));
    try {
      return Objects.requireNonNull(plainScale(new BigDecimal(text.trim())));
    } catch (NumberFormatException nfe) {
      throw new CodecException.InvalidDecimalException(node.getName(), text, nfe);
    }
  }

  protected final <T> T requireSet(final @Nullable T value, final String what) throws IllegalStateException {
    if (value == null) throw new IllegalStateException("No " + what + " set for " + name);
    return value;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return Optional.ofNullable(other).filter(LeafValue.class::isInstance).map(LeafValue.class::cast).filter((l) -> getClass().equals(l.getClass())).filter((l) -> name.equals(l.name)).isPresent();
  }

}
