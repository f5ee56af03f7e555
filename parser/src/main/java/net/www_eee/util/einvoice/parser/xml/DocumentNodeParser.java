/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.parser.xml;

import java.io.*;
import java.util.*;

import javax.xml.*;
import javax.xml.namespace.*;
import javax.xml.stream.*;
import javax.xml.stream.events.*;

import org.eclipse.jdt.annotation.*;
import org.slf4j.*;

import net.www_eee.util.einvoice.model.*;
import net.www_eee.util.einvoice.xml.*;


/**
 * Parses XML into a tree of {@link DocumentNode}'s, which can then be {@linkplain ElementType#decode(DocumentNode)
 * decoded}.
 *
 * <p>
 * Adjacent character data is concatenated into the {@linkplain DocumentNode#getText() text} of it's node, except
 * where it's only whitespace between the children of a node. Comments and processing instructions are discarded.
 * DTD's and external entities are not supported.
 * </p>
 */
@NonNullByDefault
public final class DocumentNodeParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentNodeParser.class);
  private static final XMLInputFactory XML_INPUT_FACTORY;
  static {
    final XMLInputFactory xmlInputFactory = XMLInputFactory.newInstance();
    xmlInputFactory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
    xmlInputFactory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
    xmlInputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    xmlInputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    XML_INPUT_FACTORY = xmlInputFactory;
  }

  private DocumentNodeParser() {
    return;
  }

  /**
   * Parse the XML provided by the supplied {@link InputStream}. The stream is read up to the end of the root element,
   * but is not closed.
   *
   * @param inputStream The {@link InputStream} to read XML from.
   * @return The root {@link DocumentNode}.
   * @throws ParsingException If the input isn't well formed XML.
   */
  public static DocumentNode parse(final InputStream inputStream) throws ParsingException {
    final XMLEventReader reader;
    try {
      reader = XML_INPUT_FACTORY.createXMLEventReader(Objects.requireNonNull(inputStream, "null inputStream"));
    } catch (XMLStreamException xmlse) {
      throw new XMLStreamParsingException(xmlse);
    }
    try {
      while (reader.hasNext()) {
        final XMLEvent event = reader.nextEvent();
        if (!event.isStartElement()) continue;
        final DocumentNode root = parseElement(event.asStartElement(), reader);
        if (LOGGER.isDebugEnabled()) LOGGER.debug("Parsed document with root {}", root.getName());
        return root;
      }
      throw new XMLStreamParsingException(new XMLStreamException("No root element found"));
    } catch (XMLStreamException xmlse) {
      throw new XMLStreamParsingException(xmlse);
    } finally {
      close(reader);
    }
  }

  public static DocumentNode parse(final byte[] xml) throws ParsingException {
    return parse(new ByteArrayInputStream(xml));
  }

  /**
   * Parse the XML provided by the supplied {@link InputStream}, and decode it into a new instance of the given type.
   *
   * @param <E> The type of {@link Element} to decode.
   * @param inputStream The {@link InputStream} to read XML from.
   * @param type The {@link ElementType} of the root element.
   * @return The decoded {@link Element}.
   * @throws ParsingException If the input isn't well formed XML.
   * @throws CodecException.DecodingException If the XML doesn't conform to the given <code>type</code>.
   */
  public static <E extends Element> E parse(final InputStream inputStream, final ElementType<E> type) throws CodecException {
    return type.decode(parse(inputStream));
  }

  public static <E extends Element> E parse(final byte[] xml, final ElementType<E> type) throws CodecException {
    return type.decode(parse(xml));
  }

  private static String getAttrKey(final QName attrName) {
    if (XMLConstants.NULL_NS_URI.equals(attrName.getNamespaceURI())) return attrName.getLocalPart();
    return new QName(attrName.getNamespaceURI(), attrName.getLocalPart()).toString();
  }

  private static DocumentNode parseElement(final StartElement startElement, final XMLEventReader reader) throws XMLStreamException {
    final DocumentNode node = new DocumentNode(startElement.getName());
    final Iterator<?> attrs = startElement.getAttributes();
    while (attrs.hasNext()) {
      final Attribute attr = Attribute.class.cast(attrs.next());
      node.setAttr(getAttrKey(attr.getName()), attr.getValue());
    }

    @Nullable StringBuilder text = null;
    while (true) {
      final XMLEvent event = reader.nextEvent();
      if (event.isEndElement()) break;
      if (event.isStartElement()) {
        node.appendChild(parseElement(event.asStartElement(), reader));
      } else if (event.isCharacters()) {
        if (text == null) text = new StringBuilder();
        text.append(event.asCharacters().getData());
      }
    }

    if ((text != null) && ((node.getChildren().isEmpty()) || (!text.toString().trim().isEmpty()))) node.setText(text.toString());
    return node;
  }

  private static void close(final XMLEventReader reader) {
    try {
      reader.close();
    } catch (XMLStreamException xmlse) {
      LOGGER.debug("Failed to close XMLEventReader", xmlse);
    }
    return;
  }

  /**
   * The base class for an {@link Exception} indicating the input couldn't be parsed.
   */
  public abstract static class ParsingException extends CodecException {

    protected ParsingException(final Throwable cause) {
      super(cause);
      return;
    }

  } // ParsingException

  /**
   * A {@link ParsingException} caused by an {@link XMLStreamException}, generally indicating the input wasn't well
   * formed.
   */
  public static class XMLStreamParsingException extends ParsingException {

    protected XMLStreamParsingException(final XMLStreamException xmlse) {
      super(Objects.requireNonNull(xmlse, "null cause"));
      return;
    }

    @Override
    public XMLStreamException getCause() {
      return Objects.requireNonNull(XMLStreamException.class.cast(super.getCause()));
    }

  } // XMLStreamParsingException

}
