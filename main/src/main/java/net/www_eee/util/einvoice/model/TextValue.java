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
 * A plain text {@link LeafValue}.
 */
@NonNullByDefault
public final class TextValue extends LeafValue {
  private String text;

  public TextValue(final QName name, final String text) {
    super(name);
    this.text = Objects.requireNonNull(text, "null text");
    return;
  }

  public TextValue(final QName name) {
    this(name, "");
    return;
  }

  public String getText() {
    return text;
  }

  public TextValue setText(final String text) {
    this.text = Objects.requireNonNull(text, "null text");
    return this;
  }

  @Override
  public DocumentNode encode() {
    return createNode().setText(text);
  }

  @Override
  public TextValue decode(final DocumentNode node) {
    text = getText(node);
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, text);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return super.equals(other) && text.equals(((TextValue)Objects.requireNonNull(other)).text);
  }

  @Override
  public String toString() {
    return text;
  }

}
