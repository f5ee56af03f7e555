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
import org.slf4j.*;

import net.www_eee.util.einvoice.xml.*;


/**
 * The immutable definition shared by every instance of an {@link Element} class: it's tag, any fixed attributes, and
 * it's {@linkplain #getFields() fields}, in the order they are encoded.
 *
 * <p>
 * Each {@link Element} class builds it's type once, in a static initializer, via {@link #define(Class, Supplier)}, or
 * {@link #extend(ElementType, Class, Supplier)} to inherit the fields of a parent type.
 * </p>
 *
 * @param <E> The type of {@link Element} this defines.
 */
@NonNullByDefault
public final class ElementType<E extends Element> {
  private static final Logger LOGGER = LoggerFactory.getLogger(ElementType.class);
  private final Class<E> elementClass;
  private final @Nullable QName name;
  private final Map<String,String> attrs;
  private final List<Field<?>> fields;
  private final Map<String,Field<?>> fieldsByName;
  private final @Nullable Supplier<? extends E> factory;

  private ElementType(final Builder<E> builder) {
    elementClass = builder.elementClass;
    name = builder.name;
    attrs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attrs));
    fields = Collections.unmodifiableList(new ArrayList<>(builder.fields.values()));
    fieldsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    factory = builder.factory;
    return;
  }

  /**
   * Start defining a new element type.
   *
   * @param <E> The type of {@link Element} being defined.
   * @param elementClass The class of {@link Element} being defined.
   * @param factory Creates a new instance, or <code>null</code> if the class is abstract.
   * @return A {@link Builder} for the type.
   */
  public static <E extends Element> Builder<E> define(final Class<E> elementClass, final @Nullable Supplier<? extends E> factory) {
    return new Builder<>(elementClass, factory, null);
  }

  public static <E extends Element> Builder<E> define(final Class<E> elementClass) {
    return define(elementClass, null);
  }

  /**
   * Start defining a type inheriting the tag, attributes, and fields of the <code>parent</code>. Fields declared on the
   * returned {@link Builder} follow those of the parent.
   */
  public static <E extends Element> Builder<E> extend(final ElementType<? super E> parent, final Class<E> elementClass, final Supplier<? extends E> factory) {
    return new Builder<>(elementClass, factory, Objects.requireNonNull(parent, "null parent"));
  }

  public Class<E> getElementClass() {
    return elementClass;
  }

  public @Nullable QName getName() {
    return name;
  }

  public QName getRequiredName() throws IllegalStateException {
    if (name == null) throw new IllegalStateException(elementClass.getName() + " declares no tag");
    return name;
  }

  public Map<String,String> getAttrs() {
    return attrs;
  }

  public List<Field<?>> getFields() {
    return fields;
  }

  public Optional<Field<?>> getField(final String fieldName) {
    return Optional.ofNullable(fieldsByName.get(fieldName));
  }

  /**
   * Is the supplied {@link Field} (the very same instance) declared by this type?
   */
  public boolean isDeclared(final Field<?> field) {
    return fieldsByName.get(field.getName()) == field;
  }

  public E newInstance() throws IllegalStateException {
    if (factory == null) throw new IllegalStateException(elementClass.getName() + " can't be instantiated");
    return Objects.requireNonNull(factory.get(), "null instance from factory");
  }

  /**
   * Create a new instance of this type, populated from the supplied node.
   *
   * @param node The node to decode.
   * @return The decoded {@link Element}.
   * @throws CodecException.DecodingException If the node doesn't conform to this type.
   */
  public E decode(final DocumentNode node) throws CodecException.DecodingException {
    final E element = newInstance();
    element.decode(node);
    return element;
  }

  @Override
  public String toString() {
    return elementClass.getSimpleName() + ((name != null) ? "<" + name + ">" : "") + fields;
  }

  public static final class Builder<E extends Element> {
    private final Class<E> elementClass;
    private final @Nullable Supplier<? extends E> factory;
    private @Nullable QName name = null;
    private final Map<String,String> attrs = new LinkedHashMap<>();
    private final Map<String,Field<?>> fields = new LinkedHashMap<>();

    Builder(final Class<E> elementClass, final @Nullable Supplier<? extends E> factory, final @Nullable ElementType<?> parent) {
      this.elementClass = Objects.requireNonNull(elementClass, "null elementClass");
      this.factory = factory;
      if (parent != null) {
        name = parent.name;
        attrs.putAll(parent.attrs);
        fields.putAll(parent.fieldsByName);
      }
      return;
    }

    public Builder<E> name(final QName name) {
      this.name = Objects.requireNonNull(name, "null name");
      return this;
    }

    public Builder<E> name(final String namespaceURI, final String localName) {
      return name(new QName(namespaceURI, localName));
    }

    /**
     * Add a fixed attribute, emitted on every encoded instance of the type.
     */
    public Builder<E> attr(final String attrName, final String value) {
      attrs.put(Objects.requireNonNull(attrName, "null attrName"), Objects.requireNonNull(value, "null value"));
      return this;
    }

    public Builder<E> field(final Field<?> field) throws IllegalArgumentException {
      if (fields.containsKey(field.getName())) throw new IllegalArgumentException("Field '" + field.getName() + "' is already declared by " + elementClass.getName());
      fields.put(field.getName(), field);
      return this;
    }

    public Builder<E> field(final String fieldName, final Supplier<? extends NodeValue> factory) throws IllegalArgumentException {
      return field(Field.of(fieldName, factory));
    }

    /**
     * @throws IllegalStateException If the type can be instantiated but has no tag.
     * @throws IllegalArgumentException If two fields encode to the same tag, so decoding couldn't tell them apart.
     */
    public ElementType<E> build() throws IllegalStateException, IllegalArgumentException {
      if ((factory != null) && (name == null)) throw new IllegalStateException(elementClass.getName() + " is instantiable but declares no tag");
      final Map<QName,String> fieldTags = new HashMap<>();
      for (Field<?> field : fields.values()) {
        final @Nullable String previous = fieldTags.putIfAbsent(field.initialize().getName(), field.getName());
        if (previous != null) throw new IllegalArgumentException("Fields '" + previous + "' and '" + field.getName() + "' of " + elementClass.getName() + " share the tag " + field.initialize().getName());
      }
      final ElementType<E> type = new ElementType<>(this);
      if (LOGGER.isDebugEnabled()) LOGGER.debug("Defined element type {}", type);
      return type;
    }

  } // Builder

}
