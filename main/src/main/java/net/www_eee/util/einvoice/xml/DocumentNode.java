/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.xml;

import java.util.*;
import java.util.regex.*;
import java.util.stream.*;

import javax.xml.*;
import javax.xml.namespace.*;
import javax.xml.stream.*;

import org.eclipse.jdt.annotation.*;


/**
 * A namespace qualified node within a document tree, having string-keyed {@linkplain #getAttrs() attributes}, an
 * ordered list of {@linkplain #getChildren() child} nodes, and optional {@linkplain #getText() text} content.
 *
 * <p>
 * Attributes without a namespace are keyed by their local name, those with a namespace by the
 * <code>{uri}local</code> form produced by {@link QName#toString()}.
 * </p>
 */
@NonNullByDefault
public final class DocumentNode implements XMLSerializable {
  private static final Pattern ATTR_NORMALIZED_CHARS = Pattern.compile("[\\t\\n\\r]");
  private final QName name;
  private final Map<String,String> attrs = new LinkedHashMap<>();
  private final List<DocumentNode> children = new ArrayList<>();
  private @Nullable String text = null;

  public DocumentNode(final QName name) {
    this.name = new QName(Objects.requireNonNull(name, "null name").getNamespaceURI(), name.getLocalPart()); // Prefixes carry no meaning here.
    return;
  }

  public DocumentNode(final String namespaceURI, final String localName) {
    this(new QName(namespaceURI, localName));
    return;
  }

  public QName getName() {
    return name;
  }

  public Map<String,String> getAttrs() {
    return Collections.unmodifiableMap(attrs);
  }

  public @Nullable String getAttrOrNull(final String attrName) {
    return attrs.get(attrName);
  }

  public Optional<String> getOptionalAttr(final String attrName) {
    return Optional.ofNullable(attrs.get(attrName));
  }

  public DocumentNode setAttr(final String attrName, final String value) {
    attrs.put(Objects.requireNonNull(attrName, "null attrName"), Objects.requireNonNull(value, "null value"));
    return this;
  }

  public List<DocumentNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  /**
   * Append a child node.
   *
   * @param child The node to append.
   * @return The supplied <code>child</code>.
   */
  public DocumentNode appendChild(final DocumentNode child) {
    children.add(Objects.requireNonNull(child, "null child"));
    return child;
  }

  public @Nullable String getText() {
    return text;
  }

  public Optional<String> getOptionalText() {
    return Optional.ofNullable(text);
  }

  public DocumentNode setText(final @Nullable String text) {
    this.text = text;
    return this;
  }

  private static Stream<String> getNamespaceURIs(final QName qname) {
    return Stream.of(qname.getNamespaceURI()).filter((ns) -> !XMLConstants.NULL_NS_URI.equals(ns)).filter((ns) -> !XMLConstants.XML_NS_URI.equals(ns));
  }

  /**
   * Get every namespace used by this node, it's attributes, and it's descendants.
   *
   * @return The namespace URI's, in document order.
   */
  public Set<String> getNamespaceURIs() {
    final Set<String> namespaceURIs = new LinkedHashSet<>();
    getNamespaceURIs(name).forEach(namespaceURIs::add);
    attrs.keySet().stream().map(QName::valueOf).flatMap(DocumentNode::getNamespaceURIs).forEach(namespaceURIs::add);
    children.stream().map(DocumentNode::getNamespaceURIs).forEach(namespaceURIs::addAll);
    return namespaceURIs;
  }

  /**
   * Write this node as the root of a document fragment. Every namespace used within the fragment is declared on this
   * node.
   */
  @Override
  public void writeXML(final XMLStreamWriter streamWriter, final Map<String,String> namespacePrefixes) throws XMLStreamException {
    final Map<String,String> bound = new LinkedHashMap<>();
    final Set<String> usedPrefixes = new HashSet<>(namespacePrefixes.values());
    int generated = 0;
    for (String namespaceURI : getNamespaceURIs()) {
      @Nullable String prefix = namespacePrefixes.get(namespaceURI);
      if (prefix == null) {
        do {
          prefix = "ns" + generated++;
        } while (usedPrefixes.contains(prefix));
      }
      bound.put(namespaceURI, prefix);
    }
    writeXML(streamWriter, bound, true);
    return;
  }

  private static String getPrefix(final QName qname, final Map<String,String> bound) {
    if (XMLConstants.NULL_NS_URI.equals(qname.getNamespaceURI())) return XMLConstants.DEFAULT_NS_PREFIX;
    if (XMLConstants.XML_NS_URI.equals(qname.getNamespaceURI())) return XMLConstants.XML_NS_PREFIX;
    return Objects.requireNonNull(bound.get(qname.getNamespaceURI()));
  }

  private void writeXML(final XMLStreamWriter streamWriter, final Map<String,String> bound, final boolean declareNamespaces) throws XMLStreamException {
    final boolean empty = children.isEmpty() && (text == null);
    if (empty) {
      streamWriter.writeEmptyElement(getPrefix(name, bound), name.getLocalPart(), name.getNamespaceURI());
    } else {
      streamWriter.writeStartElement(getPrefix(name, bound), name.getLocalPart(), name.getNamespaceURI());
    }

    if (declareNamespaces) {
      for (Map.Entry<String,String> namespace : bound.entrySet()) {
        streamWriter.writeNamespace(namespace.getValue(), namespace.getKey());
      }
    }

    for (Map.Entry<String,String> attr : attrs.entrySet()) {
      final QName attrName = QName.valueOf(attr.getKey());
      if (ATTR_NORMALIZED_CHARS.matcher(attr.getValue()).find()) throw new XMLStreamException("Value of attribute '" + attr.getKey() + "' on " + name + " contains a tab or line end, which attribute value normalization would replace");
      if (XMLConstants.NULL_NS_URI.equals(attrName.getNamespaceURI())) {
        streamWriter.writeAttribute(attrName.getLocalPart(), attr.getValue());
      } else {
        streamWriter.writeAttribute(getPrefix(attrName, bound), attrName.getNamespaceURI(), attrName.getLocalPart(), attr.getValue());
      }
    }

    if (empty) return;

    if (text != null) writeText(streamWriter, text);
    for (DocumentNode child : children) {
      child.writeXML(streamWriter, bound, false);
    }
    streamWriter.writeEndElement();
    return;
  }

  /**
   * Write text content, with each carriage return as a character reference, since line end normalization would
   * otherwise turn it into a line feed when read back.
   */
  private static void writeText(final XMLStreamWriter streamWriter, final String text) throws XMLStreamException {
    int start = 0;
    for (int cr = text.indexOf('\r'); cr >= 0; cr = text.indexOf('\r', start)) {
      if (cr > start) streamWriter.writeCharacters(text.substring(start, cr));
      streamWriter.writeEntityRef("#13");
      start = cr + 1;
    }
    if ((start < text.length()) || (start == 0)) streamWriter.writeCharacters(text.substring(start));
    return;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, attrs, children, text);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return Optional.ofNullable(other).filter(DocumentNode.class::isInstance).map(DocumentNode.class::cast).filter((n) -> name.equals(n.name)).filter((n) -> attrs.equals(n.attrs)).filter((n) -> children.equals(n.children)).filter((n) -> Objects.equals(text, n.text)).isPresent();
  }

  @Override
  public String toString() {
    return toXMLString(Collections.emptyMap());
  }

}
