/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.xml;

import java.io.*;
import java.util.*;

import javax.xml.stream.*;

import org.eclipse.jdt.annotation.*;


@NonNullByDefault
public interface XMLSerializable {

  /**
   * Write XML for this object to the supplied {@link XMLStreamWriter}.
   *
   * @param streamWriter The {@link XMLStreamWriter} to write to.
   * @param namespacePrefixes The preferred prefix for each namespace URI used by this object. Namespaces without an
   * entry are assigned a generated prefix.
   * @throws XMLStreamException If there was a problem writing the XML.
   */
  public void writeXML(XMLStreamWriter streamWriter, Map<String,String> namespacePrefixes) throws XMLStreamException;

  /**
   * Create a {@link String} containing the {@linkplain #writeXML(XMLStreamWriter, Map) XML} for this object.
   *
   * @param namespacePrefixes The preferred prefix for each namespace URI used by this object.
   * @return An XML {@link String}.
   */
  public default String toXMLString(final Map<String,String> namespacePrefixes) {
    final StringWriter stringWriter = new StringWriter();
    try {
      final XMLStreamWriter streamWriter = XMLOutputFactory.newInstance().createXMLStreamWriter(stringWriter);
      writeXML(streamWriter, namespacePrefixes);
      streamWriter.writeEndDocument();
      streamWriter.flush();
    } catch (XMLStreamException | FactoryConfigurationError e) {
      throw new IllegalStateException(e);
    }
    return stringWriter.getBuffer().toString();
  }

}
