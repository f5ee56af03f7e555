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

import net.www_eee.util.einvoice.xml.*;


/**
 * An ordered, repeatable group of values sharing a single tag. Each item encodes to a sibling node within the parent
 * of the container, an empty container encodes to nothing.
 *
 * @param <V> The type of item.
 */
@NonNullByDefault
public final class Container<V extends SingleNodeValue> extends NodeValue implements Iterable<V> {
  private final QName itemName;
  private final Supplier<? extends V> itemFactory;
  private final List<V> items = new ArrayList<>();

  public Container(final QName itemName, final Supplier<? extends V> itemFactory) {
    this.itemName = Objects.requireNonNull(itemName, "null itemName");
    this.itemFactory = Objects.requireNonNull(itemFactory, "null itemFactory");
    return;
  }

  public static <E extends Element> Container<E> of(final ElementType<E> type) throws IllegalStateException {
    return new Container<E>(type.getRequiredName(), type::newInstance);
  }

  /**
   * Get the tag shared by every item.
   */
  @Override
  public QName getName() {
    return itemName;
  }

  /**
   * Append an item.
   *
   * @param item The item to append.
   * @return The supplied <code>item</code>.
   * @throws IllegalArgumentException If the item doesn't have this container's tag.
   */
  public V append(final V item) throws IllegalArgumentException {
    if (!itemName.equals(item.getName())) throw new IllegalArgumentException("Container of " + itemName + " can't hold " + item.getName());
    items.add(item);
    return item;
  }

  /**
   * Create a new item, and append it.
   *
   * @return The new item.
   */
  public V appendNew() {
    return append(itemFactory.get());
  }

  /**
   * Create a new item, {@linkplain SingleNodeValue#decode(DocumentNode) decode} the supplied node into it, and append
   * it.
   *
   * @param node The node to decode.
   * @return The new item.
   * @throws CodecException.DecodingException If the node couldn't be decoded.
   */
  public V decodeAppend(final DocumentNode node) throws CodecException.DecodingException {
    final V item = itemFactory.get();
    item.decode(node);
    return append(item);
  }

  public List<V> getItems() {
    return Collections.unmodifiableList(items);
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  @Override
  public Iterator<V> iterator() {
    return getItems().iterator();
  }

  @Override
  public void appendTo(final DocumentNode parent) {
    items.forEach((item) -> item.appendTo(parent));
    return;
  }

  @Override
  public int hashCode() {
    return Objects.hash(itemName, items);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return Optional.ofNullable(other).filter(Container.class::isInstance).map(Container.class::cast).filter((c) -> itemName.equals(c.itemName)).filter((c) -> items.equals(c.items)).isPresent();
  }

  @Override
  public String toString() {
    return items.toString();
  }

}
