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

import net.www_eee.util.einvoice.xml.*;


/**
 * A boolean {@link LeafValue}, wrapping a single <code>udt:Indicator</code> child holding <code>"true"</code> or
 * <code>"false"</code>.
 */
@NonNullByDefault
public final class IndicatorValue extends LeafValue {
  public static final QName INDICATOR = Namespaces.udt("Indicator");
  private @Nullable Boolean value;

  public IndicatorValue(final QName name, final @Nullable Boolean value) {
    super(name);
    this.value = value;
    return;
  }

  public IndicatorValue(final QName name) {
    this(name, null);
    return;
  }

  public @Nullable Boolean getValue() {
    return value;
  }

  public IndicatorValue setValue(final @Nullable Boolean value) {
    this.value = value;
    return this;
  }

  @Override
  public DocumentNode encode() throws IllegalStateException {
    final DocumentNode node = createNode();
    node.appendChild(new DocumentNode(INDICATOR)).setText(requireSet(value, "value").toString());
    return node;
  }

  @Override
  public IndicatorValue decode(final DocumentNode node) throws CodecException.MalformedIndicatorException {
    final List<DocumentNode> children = node.getChildren();
    if ((children.size() != 1) || (!INDICATOR.equals(children.get(0).getName()))) throw new CodecException.MalformedIndicatorException(node.getName(), "must contain exactly one " + INDICATOR);
    final String text = getText(children.get(0)).trim();
    if ("true".equals(text)) {
      value = Boolean.TRUE;
    } else if ("false".equals(text)) {
      value = Boolean.FALSE;
    } else {
      throw new CodecException.MalformedIndicatorException(node.getName(), "contains invalid value '" + text + "'");
    }
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return super.equals(other) && Objects.equals(value, ((IndicatorValue)Objects.requireNonNull(other)).value);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }

}
