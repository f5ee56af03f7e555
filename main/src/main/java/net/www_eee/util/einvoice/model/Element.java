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
import javax.xml.stream.*;

import org.eclipse.jdt.annotation.*;

import net.www_eee.util.einvoice.xml.*;


/**
 * A composite value, holding one slot for each {@link Field} declared by it's {@link ElementType}.
 *
 * <p>
 * An {@link Element} {@linkplain #encode() encodes} to a node carrying the type's tag and fixed attributes, followed
 * by the encoding of each non-<code>null</code> slot, in field declaration order (regardless of the order in which
 * they were set). {@linkplain #decode(DocumentNode) Decoding} is closed-world, a child matching no declared field is
 * an error.
 * </p>
 */
@NonNullByDefault
public abstract class Element extends SingleNodeValue implements XMLSerializable {
  private final ElementType<?> type;
  private final Map<String,@Nullable NodeValue> slots = new LinkedHashMap<>();

  protected Element(final ElementType<?> type) throws IllegalArgumentException {
    this.type = Objects.requireNonNull(type, "null type");
    if (!type.getElementClass().isInstance(this)) throw new IllegalArgumentException(getClass().getName() + " is not a " + type.getElementClass().getName());
    for (Field<?> field : type.getFields()) {
      slots.put(field.getName(), field.hasDefault() ? field.initialize() : null);
    }
    return;
  }

  public ElementType<?> getType() {
    return type;
  }

  @Override
  public QName getName() throws IllegalStateException {
    return type.getRequiredName();
  }

  private void checkDeclared(final Field<?> field) throws IllegalArgumentException {
    if (!type.isDeclared(field)) throw new IllegalArgumentException(getClass().getName() + " has no field '" + field.getName() + "'");
    return;
  }

  @SuppressWarnings("unchecked")
  public <V extends NodeValue> @Nullable V get(final Field<V> field) throws IllegalArgumentException {
    checkDeclared(field);
    return (V)slots.get(field.getName());
  }

  /**
   * Get the value of a field, {@linkplain Field#initialize() initializing} it first if it's currently
   * <code>null</code>.
   *
   * @param <V> The type of value held by the field.
   * @param field The field to get.
   * @return The (never <code>null</code>) value of the field.
   * @throws IllegalArgumentException If the field isn't declared by this element's type.
   */
  @SuppressWarnings("unchecked")
  public <V extends NodeValue> V getOrInit(final Field<V> field) throws IllegalArgumentException {
    checkDeclared(field);
    final @Nullable NodeValue value = slots.get(field.getName());
    if (value != null) return (V)value;
    final V initialized = field.initialize();
    slots.put(field.getName(), initialized);
    return initialized;
  }

  /**
   * Set the value of a field.
   *
   * @param <V> The type of value held by the field.
   * @param field The field to set.
   * @param value The new value, or <code>null</code> to omit the field.
   * @return This element.
   * @throws IllegalArgumentException If the field isn't declared by this element's type, or the value doesn't encode to
   * the tag of the field.
   */
  public <V extends NodeValue> Element set(final Field<V> field, final @Nullable V value) throws IllegalArgumentException {
    checkDeclared(field);
    if (value != null) {
      final QName expected = field.initialize().getName();
      if (!expected.equals(value.getName())) throw new IllegalArgumentException("Field '" + field.getName() + "' of " + getClass().getName() + " requires " + expected + ", not " + value.getName());
    }
    slots.put(field.getName(), value);
    return this;
  }

  /**
   * Get the current slot values, keyed by field name, in field declaration order.
   */
  public Map<String,@Nullable NodeValue> getSlots() {
    return Collections.unmodifiableMap(slots);
  }

  @Override
  public DocumentNode encode() {
    final DocumentNode node = new DocumentNode(getName());
    type.getAttrs().forEach(node::setAttr);
    for (@Nullable NodeValue value : slots.values()) {
      if (value != null) value.appendTo(node);
    }
    return node;
  }

  /**
   * @throws CodecException.TagMismatchException If the node doesn't have this element's tag.
   * @throws CodecException.UnknownElementException If the node has a child matching none of this element's fields.
   */
  @Override
  public Element decode(final DocumentNode node) throws CodecException.DecodingException {
    final QName name = getName();
    if (!name.equals(node.getName())) throw new CodecException.TagMismatchException(name, node.getName());

    final Map<QName,Map.Entry<String,NodeValue>> fieldIndex = new HashMap<>();
    for (Field<?> field : type.getFields()) {
      final @Nullable NodeValue current = slots.get(field.getName());
      final NodeValue target = (current != null) ? current : field.initialize();
      fieldIndex.put(target.getName(), new AbstractMap.SimpleImmutableEntry<>(field.getName(), target));
    }

    for (DocumentNode child : node.getChildren()) {
      final Map.Entry<String,NodeValue> entry = fieldIndex.get(child.getName());
      if (entry == null) throw new CodecException.UnknownElementException(name, child.getName());
      final NodeValue target = entry.getValue();
      slots.put(entry.getKey(), target);
      if (target instanceof Container) {
        ((Container<?>)target).decodeAppend(child);
      } else {
        ((SingleNodeValue)target).decode(child);
      }
    }
    return this;
  }

  @Override
  public void writeXML(final XMLStreamWriter streamWriter, final Map<String,String> namespacePrefixes) throws XMLStreamException {
    encode().writeXML(streamWriter, namespacePrefixes);
    return;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type.getElementClass(), slots);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return Optional.ofNullable(other).filter(Element.class::isInstance).map(Element.class::cast).filter((e) -> getClass().equals(e.getClass())).filter((e) -> type == e.type).filter((e) -> slots.equals(e.slots)).isPresent();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + slots;
  }

}
