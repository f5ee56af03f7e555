/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.parser.xml;

import java.io.*;
import java.net.*;
import java.util.*;
import java.util.concurrent.*;

import javax.xml.*;
import javax.xml.transform.stream.*;
import javax.xml.validation.*;

import org.eclipse.jdt.annotation.*;
import org.slf4j.*;
import org.xml.sax.*;

import net.www_eee.util.einvoice.model.*;


/**
 * A {@link SchemaValidator} using W3C XML Schema definitions, located through a catalog mapping each schema name to the
 * {@link URL} of it's XSD.
 *
 * <p>
 * Each schema is compiled the first time it's used, and cached for the life of the validator. Instances are safe for
 * use by multiple threads.
 * </p>
 */
@NonNullByDefault
public class XSDSchemaValidator implements SchemaValidator {
  private static final Logger LOGGER = LoggerFactory.getLogger(XSDSchemaValidator.class);
  protected final Map<String,URL> catalog;
  private final ConcurrentMap<String,Schema> schemas = new ConcurrentHashMap<>();

  public XSDSchemaValidator(final Map<String,URL> catalog) {
    this.catalog = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(catalog, "null catalog")));
    return;
  }

  /**
   * Create a validator from a catalog stored as {@link Properties}, where each key is a schema name, and each value
   * is the location of it's XSD, relative to the properties file.
   *
   * @param catalogURL The location of the catalog properties.
   * @return A new {@link XSDSchemaValidator}.
   * @throws IOException If the catalog couldn't be read.
   */
  public static XSDSchemaValidator load(final URL catalogURL) throws IOException {
    final Properties properties = new Properties();
    try (InputStream inputStream = catalogURL.openStream()) {
      properties.load(inputStream);
    }
    final Map<String,URL> catalog = new TreeMap<>();
    for (String schemaName : properties.stringPropertyNames()) {
      catalog.put(schemaName, new URL(catalogURL, properties.getProperty(schemaName).trim()));
    }
    LOGGER.debug("Loaded schema catalog {} from {}", catalog.keySet(), catalogURL);
    return new XSDSchemaValidator(catalog);
  }

  public Set<String> getSchemaNames() {
    return catalog.keySet();
  }

  /**
   * Get the compiled {@link Schema} with the given name.
   *
   * @param schemaName The name of the schema.
   * @return The compiled {@link Schema}.
   * @throws IllegalArgumentException If the catalog has no schema with that name.
   * @throws IllegalStateException If the schema couldn't be compiled.
   */
  protected Schema getSchema(final String schemaName) throws IllegalArgumentException, IllegalStateException {
    final @Nullable URL schemaURL = catalog.get(schemaName);
    if (schemaURL == null) throw new IllegalArgumentException("Unknown schema '" + schemaName + "'");
    return schemas.computeIfAbsent(schemaName, (name) -> compile(name, schemaURL));
  }

  private static Schema compile(final String schemaName, final URL schemaURL) throws IllegalStateException {
    LOGGER.debug("Compiling schema '{}' from {}", schemaName, schemaURL);
    try {
      return SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI).newSchema(schemaURL);
    } catch (SAXException saxe) {
      throw new IllegalStateException("Invalid schema '" + schemaName + "' at " + schemaURL, saxe);
    }
  }

  @Override
  public void validate(final byte[] xml, final String schemaName) throws CodecException.ValidationFailedException {
    final Validator validator = getSchema(schemaName).newValidator();
    try {
      validator.validate(new StreamSource(new ByteArrayInputStream(xml)));
    } catch (SAXParseException saxpe) {
      LOGGER.debug("Document failed validation against '{}'", schemaName, saxpe);
      throw new CodecException.ValidationFailedException(schemaName, "line " + saxpe.getLineNumber() + ", column " + saxpe.getColumnNumber() + ": " + saxpe.getMessage(), saxpe);
    } catch (SAXException saxe) {
      LOGGER.debug("Document failed validation against '{}'", schemaName, saxe);
      throw new CodecException.ValidationFailedException(schemaName, String.valueOf(saxe.getMessage()), saxe);
    } catch (IOException ioe) {
      throw new UncheckedIOException(ioe);
    }
    return;
  }

}
