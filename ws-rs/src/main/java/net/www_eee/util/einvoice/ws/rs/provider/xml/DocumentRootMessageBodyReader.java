/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.ws.rs.provider.xml;

import java.io.*;
import java.lang.annotation.*;
import java.lang.reflect.*;
import java.util.*;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;

import javax.ws.rs.*;
import javax.ws.rs.core.*;
import javax.ws.rs.ext.*;

import net.www_eee.util.einvoice.model.*;
import net.www_eee.util.einvoice.parser.xml.*;
import net.www_eee.util.einvoice.xml.*;
import net.www_eee.util.einvoice.model.ElementType;


/**
 * A {@link MessageBodyReader} implementation for {@link DocumentRoot} entities, supporting the
 * {@linkplain ElementType document types} it's constructed with. The document type is selected using the name of the
 * root element.
 */
@NonNullByDefault
public class DocumentRootMessageBodyReader implements MessageBodyReader<DocumentRoot> {
  private final Map<QName,ElementType<? extends DocumentRoot>> documentTypes = new LinkedHashMap<>();

  @SafeVarargs
  public DocumentRootMessageBodyReader(final ElementType<? extends DocumentRoot>... documentTypes) {
    for (ElementType<? extends DocumentRoot> documentType : Objects.requireNonNull(documentTypes, "null documentTypes")) {
      this.documentTypes.put(documentType.getRequiredName(), documentType);
    }
    return;
  }

  private Optional<ElementType<? extends DocumentRoot>> getDocumentType(final Class<?> type) {
    return documentTypes.values().stream().filter((documentType) -> type.isAssignableFrom(documentType.getElementClass())).findFirst();
  }

  @Override
  public final boolean isReadable(final Class<?> type, final Type genericType, final @NonNull Annotation[] annotations, final MediaType mediaType) {
    return getDocumentType(type).isPresent();
  }

  /**
   * @throws DocumentNodeParser.ParsingException If the entity isn't well formed XML.
   * @throws CodecException.DecodingException If the entity doesn't conform to a supported document type.
   */
  @Override
  public final DocumentRoot readFrom(final Class<DocumentRoot> type, final Type genericType, final @NonNull Annotation[] annotations, final MediaType mediaType, final MultivaluedMap<String,String> httpHeaders, final InputStream entityStream) throws IOException, WebApplicationException {
    final DocumentNode root = DocumentNodeParser.parse(entityStream);
    final ElementType<? extends DocumentRoot> documentType = Optional.<ElementType<? extends DocumentRoot>> ofNullable(documentTypes.get(root.getName())).filter((dt) -> type.isAssignableFrom(dt.getElementClass())).orElseGet(() -> getDocumentType(type).orElseThrow(() -> new IllegalArgumentException("Unsupported type " + type.getName()))); // An unsupported root will fail decoding with a tag mismatch.
    return type.cast(documentType.decode(root));
  }

}
