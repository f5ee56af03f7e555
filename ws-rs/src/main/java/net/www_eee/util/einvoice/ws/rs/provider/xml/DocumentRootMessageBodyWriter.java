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

import org.eclipse.jdt.annotation.*;

import javax.ws.rs.*;
import javax.ws.rs.core.*;
import javax.ws.rs.ext.*;

import net.www_eee.util.einvoice.model.*;


/**
 * A {@link MessageBodyWriter} implementation for {@link DocumentRoot} entities, which are
 * {@linkplain DocumentRoot#serialize(SchemaValidator) validated} before anything is written.
 */
@NonNullByDefault
public class DocumentRootMessageBodyWriter implements MessageBodyWriter<DocumentRoot> {
  protected final SchemaValidator validator;

  public DocumentRootMessageBodyWriter(final SchemaValidator validator) {
    this.validator = Objects.requireNonNull(validator, "null validator");
    return;
  }

  @Override
  public final boolean isWriteable(final Class<?> type, final Type genericType, final @NonNull Annotation[] annotations, final MediaType mediaType) {
    return DocumentRoot.class.isAssignableFrom(type);
  }

  @Override
  public final long getSize(final DocumentRoot entity, final Class<?> type, final Type genericType, final @NonNull Annotation[] annotations, final MediaType mediaType) {
    return -1;
  }

  /**
   * @throws CodecException.ValidationFailedException If the entity isn't valid.
   */
  @Override
  public final void writeTo(final DocumentRoot entity, final Class<?> type, final Type genericType, final @NonNull Annotation[] annotations, final MediaType mediaType, final MultivaluedMap<String,Object> httpHeaders, final OutputStream entityStream) throws IOException, WebApplicationException {
    final byte[] xml = entity.serialize(validator);
    entityStream.write(xml);
    return;
  }

}
