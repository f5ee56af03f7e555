/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import java.util.*;
import java.util.function.*;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;


/**
 * A named slot declared by an {@link ElementType}, along with the factory used to create it's value.
 *
 * <p>
 * A field {@linkplain #hasDefault() with a default} is populated as soon as an {@link Element} is created, any other
 * field starts out <code>null</code>, and is only populated when it's value is {@linkplain Element#set(Field, NodeValue)
 * set}, {@linkplain Element#getOrInit(Field) initialized}, or found while {@linkplain Element#decode
 * decoding}.
 * </p>
 *
 * @param <V> The type of value held by the field.
 */
@NonNullByDefault
public final class Field<V extends NodeValue> {
  private final String name;
  private final boolean hasDefault;
  private final Supplier<? extends V> factory;

  private Field(final String name, final boolean hasDefault, final Supplier<? extends V> factory) {
    this.name = Objects.requireNonNull(name, "null name");
    this.hasDefault = hasDefault;
    this.factory = Objects.requireNonNull(factory, "null factory");
    return;
  }

  public static <V extends NodeValue> Field<V> of(final String name, final Supplier<? extends V> factory) {
    return new Field<>(name, false, factory);
  }

  public static <V extends NodeValue> Field<V> withDefault(final String name, final Supplier<? extends V> factory) {
    return new Field<>(name, true, factory);
  }

  public static <E extends Element> Field<E> element(final String name, final ElementType<E> type) {
    return of(name, type::newInstance);
  }

  /**
   * Declare a repeatable element field, which always holds a (possibly empty) {@link Container}.
   */
  public static <E extends Element> Field<Container<E>> elements(final String name, final ElementType<E> type) {
    return withDefault(name, () -> Container.of(type));
  }

  public static Field<Container<TextValue>> texts(final String name, final QName tag) {
    return withDefault(name, () -> new Container<TextValue>(tag, () -> new TextValue(tag)));
  }

  public static Field<TextValue> text(final String name, final QName tag) {
    return of(name, () -> new TextValue(tag));
  }

  public static Field<DecimalValue> decimal(final String name, final QName tag) {
    return of(name, () -> new DecimalValue(tag));
  }

  public static Field<QuantityValue> quantity(final String name, final QName tag) {
    return of(name, () -> new QuantityValue(tag));
  }

  public static Field<CurrencyAmount> currency(final String name, final QName tag) {
    return of(name, () -> new CurrencyAmount(tag));
  }

  public static Field<ClassificationCode> classification(final String name, final QName tag) {
    return of(name, () -> new ClassificationCode(tag));
  }

  public static Field<AgencyCode> agencyCode(final String name, final QName tag) {
    return of(name, () -> new AgencyCode(tag));
  }

  public static Field<SchemeId> schemeId(final String name, final QName tag) {
    return of(name, () -> new SchemeId(tag));
  }

  public static Field<DateValue> date(final String name, final QName tag) {
    return of(name, () -> new DateValue(tag));
  }

  public static Field<IndicatorValue> indicator(final String name, final QName tag) {
    return of(name, () -> new IndicatorValue(tag));
  }

  public String getName() {
    return name;
  }

  public boolean hasDefault() {
    return hasDefault;
  }

  /**
   * Create a fresh value for this field.
   *
   * @return The new value.
   */
  public V initialize() {
    return Objects.requireNonNull(factory.get(), "null value from factory");
  }

  @Override
  public String toString() {
    return name;
  }

}
