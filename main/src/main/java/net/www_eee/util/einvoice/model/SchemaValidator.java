/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import org.eclipse.jdt.annotation.*;


/**
 * Validates a rendered document against a named schema version.
 */
@FunctionalInterface
@NonNullByDefault
public interface SchemaValidator {

  /**
   * Validate the supplied document.
   *
   * @param xml The UTF-8 encoded document.
   * @param schemaName The name of the schema to validate against (e.g. <code>"ZUGFeRD1p0"</code>).
   * @throws CodecException.ValidationFailedException If the document isn't valid.
   */
  public void validate(byte[] xml, String schemaName) throws CodecException.ValidationFailedException;

}
