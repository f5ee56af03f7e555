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
 * A {@link LeafValue} holding a decimal amount qualified by a <code>unitCode</code> attribute (UN/ECE Recommendation
 * 20, e.g. <code>"KGM"</code> or <code>"C62"</code>).
 */
@NonNullByDefault
public final class QuantityValue extends LeafValue {
  public static final String UNIT_CODE_ATTR = "unitCode";
  private @Nullable BigDecimal amount;
  private String unitCode;

  public QuantityValue(final QName name, final @Nullable BigDecimal amount, final String unitCode) {
    super(name);
    this.amount = plainScale(amount);
    this.unitCode = Objects.requireNonNull(unitCode, "null unitCode");
    return;
  }

  public QuantityValue(final QName name) {
    this(name, null, "");
    return;
  }

  public @Nullable BigDecimal getAmount() {
    return amount;
  }

  public String getUnitCode() {
    return unitCode;
  }

  public QuantityValue set(final BigDecimal amount, final String unitCode) {
    this.amount = plainScale(Objects.requireNonNull(amount, "null amount"));
    this.unitCode = Objects.requireNonNull(unitCode, "null unitCode");
    return this;
  }

  @Override
  public DocumentNode encode() throws IllegalStateException {
    return createNode().setText(requireSet(amount, "amount").toPlainString()).setAttr(UNIT_CODE_ATTR, unitCode);
  }

  @Override
  public QuantityValue decode(final DocumentNode node) throws CodecException.InvalidDecimalException, CodecException.MissingAttributeException {
    amount = parseDecimal(node);
    unitCode = getRequiredAttr(node, UNIT_CODE_ATTR);
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, amount, unitCode);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    if (!super.equals(other)) return false;
    final QuantityValue q = (QuantityValue)Objects.requireNonNull(other);
    return Objects.equals(amount, q.amount) && unitCode.equals(q.unitCode);
  }

  @Override
  public String toString() {
    return amount + " " + unitCode;
  }

}
