/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import java.io.*;
import java.nio.charset.*;
import java.util.*;

import javax.xml.stream.*;

import org.eclipse.jdt.annotation.*;
import org.slf4j.*;


/**
 * An {@link Element} which forms the root of a complete document, validated against a
 * {@linkplain #getSchemaName() named schema}.
 */
@NonNullByDefault
public abstract class DocumentRoot extends Element {
  /**
   * The XML declaration written at the start of every document.
   */
  public static final String PROLOGUE = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";
  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentRoot.class);
  private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newInstance();

  protected DocumentRoot(final ElementType<? extends DocumentRoot> type) throws IllegalArgumentException {
    super(type);
    return;
  }

  /**
   * Get the name of the schema this document is validated against.
   *
   * @return The name supplied to the {@link SchemaValidator}.
   */
  public abstract String getSchemaName();

  /**
   * Get the prefix to use for each namespace when rendering this document.
   *
   * @return A map of namespace URI to prefix.
   */
  public Map<String,String> getNamespacePrefixes() {
    return Namespaces.PREFIXES;
  }

  /**
   * Render this document, without validating it.
   *
   * @return The UTF-8 encoded document, starting with the {@link #PROLOGUE}.
   * @throws IllegalStateException If a leaf value required for encoding isn't set.
   */
  public byte[] toXML() throws IllegalStateException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(PROLOGUE.getBytes(StandardCharsets.UTF_8));
    try {
      final XMLStreamWriter streamWriter = OUTPUT_FACTORY.createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
      writeXML(streamWriter, getNamespacePrefixes());
      streamWriter.writeEndDocument();
      streamWriter.flush();
      streamWriter.close();
    } catch (XMLStreamException xmlse) {
      if (xmlse.getCause() instanceof IOException) throw new UncheckedIOException((IOException)xmlse.getCause());
      throw new IllegalStateException(xmlse);
    }
    return out.toByteArray();
  }

  /**
   * Render this document, then validate it.
   *
   * @param validator The {@link SchemaValidator} to use.
   * @return The UTF-8 encoded document, starting with the {@link #PROLOGUE}.
   * @throws CodecException.ValidationFailedException If the rendered document isn't valid.
   */
  public byte[] serialize(final SchemaValidator validator) throws CodecException.ValidationFailedException {
    final byte[] xml = toXML();
    if (LOGGER.isDebugEnabled()) LOGGER.debug("Validating {} byte {} document against {}", xml.length, getName(), getSchemaName());
    validator.validate(xml, getSchemaName());
    return xml;
  }

}
