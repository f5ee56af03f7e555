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
 * A {@link LeafValue} holding a monetary amount qualified by a <code>currencyID</code> attribute (ISO 4217).
 */
@NonNullByDefault
public final class CurrencyAmount extends LeafValue {
  public static final String CURRENCY_ID_ATTR = "currencyID";
  public static final String DEFAULT_CURRENCY = "EUR";
  private @Nullable BigDecimal amount;
  private String currency;

  public CurrencyAmount(final QName name, final @Nullable BigDecimal amount, final String currency) {
    super(name);
    this.amount = plainScale(amount);
    this.currency = Objects.requireNonNull(currency, "null currency");
    return;
  }

  public CurrencyAmount(final QName name, final @Nullable BigDecimal amount) {
    this(name, amount, DEFAULT_CURRENCY);
    return;
  }

  public CurrencyAmount(final QName name) {
    this(name, null);
    return;
  }

  public @Nullable BigDecimal getAmount() {
    return amount;
  }

  public String getCurrency() {
    return currency;
  }

  public CurrencyAmount setAmount(final BigDecimal amount) {
    this.amount = plainScale(Objects.requireNonNull(amount, "null amount"));
    return this;
  }

  public CurrencyAmount set(final BigDecimal amount, final String currency) {
    this.amount = plainScale(Objects.requireNonNull(amount, "null amount"));
    this.currency = Objects.requireNonNull(currency, "null currency");
    return this;
  }

  @Override
  public DocumentNode encode() throws IllegalStateException {
    return createNode().setText(requireSet(amount, "amount").toPlainString()).setAttr(CURRENCY_ID_ATTR, currency);
  }

  @Override
  public CurrencyAmount decode(final DocumentNode node) throws CodecException.InvalidDecimalException, CodecException.MissingAttributeException {
    amount = parseDecimal(node);
    currency = getRequiredAttr(node, CURRENCY_ID_ATTR);
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, amount, currency);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    if (!super.equals(other)) return false;
    final CurrencyAmount c = (CurrencyAmount)Objects.requireNonNull(other);
    return Objects.equals(amount, c.amount) && currency.equals(c.currency);
  }

  @Override
  public String toString() {
    return amount + " " + currency;
  }

}
