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
 * An exact precision decimal {@link LeafValue}. The scale of the value is preserved in both directions.
 */
@NonNullByDefault
public final class DecimalValue extends LeafValue {
  private @Nullable BigDecimal value;

  public DecimalValue(final QName name, final @Nullable BigDecimal value) {
    super(name);
    this.value = plainScale(value);
    return;
  }

  public DecimalValue(final QName name) {
    this(name, null);
    return;
  }

  public @Nullable BigDecimal getValue() {
    return value;
  }

  public DecimalValue setValue(final @Nullable BigDecimal value) {
    this.value = plainScale(value);
    return this;
  }

  @Override
  public DocumentNode encode() throws IllegalStateException {
    return createNode().setText(requireSet(value, "value").toPlainString());
  }

  @Override
  public DecimalValue decode(final DocumentNode node) throws CodecException.InvalidDecimalException {
    value = parseDecimal(node);
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return super.equals(other) && Objects.equals(value, ((DecimalValue)Objects.requireNonNull(other)).value);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }

}
