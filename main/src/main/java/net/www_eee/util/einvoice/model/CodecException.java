/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import java.util.*;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;


/**
 * The base class for an {@link Exception} indicating a document could not be {@linkplain Element#decode decoded} or
 * failed {@linkplain SchemaValidator validation}. None of these are recoverable, the first one encountered aborts the
 * whole operation.
 */
@NonNullByDefault
public abstract class CodecException extends RuntimeException {

  protected CodecException(final String message) {
    super(message);
    return;
  }

  protected CodecException(final String message, final @Nullable Throwable cause) {
    super(message, cause);
    return;
  }

  protected CodecException(final Throwable cause) {
    super(Objects.requireNonNull(cause, "null cause"));
    return;
  }

  /**
   * A {@link CodecException} associated with the {@linkplain #getElementName() element} which couldn't be decoded.
   */
  public abstract static class DecodingException extends CodecException {
    protected final QName elementName;

    protected DecodingException(final QName elementName, final String message, final @Nullable Throwable cause) {
      super(message, cause);
      this.elementName = Objects.requireNonNull(elementName, "null elementName");
      return;
    }

    /**
     * Get the name of the offending element.
     *
     * @return The name of the offending element.
     */
    public QName getElementName() {
      return elementName;
    }

  } // DecodingException

  /**
   * Indicates the node being decoded doesn't have the tag declared by the target element type.
   */
  public static class TagMismatchException extends DecodingException {
    protected final QName expectedName;

    protected TagMismatchException(final QName expectedName, final QName foundName) {
      super(foundName, "Invalid XML, found tag " + foundName + " where " + expectedName + " was expected", null);
      this.expectedName = expectedName;
      return;
    }

    public QName getExpectedName() {
      return expectedName;
    }

  } // TagMismatchException

  /**
   * Indicates a child node which has no matching field on the element being decoded.
   */
  public static class UnknownElementException extends DecodingException {
    protected final QName parentName;

    protected UnknownElementException(final QName parentName, final QName elementName) {
      super(elementName, "Unknown element " + elementName + " within " + parentName, null);
      this.parentName = parentName;
      return;
    }

    public QName getParentName() {
      return parentName;
    }

  } // UnknownElementException

  public static class InvalidDecimalException extends DecodingException {
    protected final @Nullable String text;

    protected InvalidDecimalException(final QName elementName, final @Nullable String text, final NumberFormatException cause) {
      super(elementName, "Element " + elementName + " contains invalid decimal '" + text + "'", cause);
      this.text = text;
      return;
    }

    public @Nullable String getText() {
      return text;
    }

  } // InvalidDecimalException

  public static class MissingAttributeException extends DecodingException {
    protected final String attrName;

    protected MissingAttributeException(final QName elementName, final String attrName) {
      super(elementName, "Element " + elementName + " has no '" + attrName + "' attribute", null);
      this.attrName = attrName;
      return;
    }

    public String getAttrName() {
      return attrName;
    }

  } // MissingAttributeException

  /**
   * Indicates a date element didn't contain exactly one well formed <code>DateTimeString</code> child.
   */
  public static class MalformedDateContainerException extends DecodingException {

    protected MalformedDateContainerException(final QName elementName, final String message, final @Nullable Throwable cause) {
      super(elementName, "Date element " + elementName + ' ' + message, cause);
      return;
    }

  } // MalformedDateContainerException

  public static class UnsupportedDateFormatException extends DecodingException {
    protected final String formatCode;

    protected UnsupportedDateFormatException(final QName elementName, final String formatCode) {
      super(elementName, "Date format " + formatCode + " of element " + elementName + " cannot be parsed", null);
      this.formatCode = formatCode;
      return;
    }

    public String getFormatCode() {
      return formatCode;
    }

  } // UnsupportedDateFormatException

  /**
   * Indicates an indicator element didn't contain exactly one <code>Indicator</code> child holding a boolean.
   */
  public static class MalformedIndicatorException extends DecodingException {

    protected MalformedIndicatorException(final QName elementName, final String message) {
      super(elementName, "Indicator element " + elementName + ' ' + message, null);
      return;
    }

  } // MalformedIndicatorException

  /**
   * Indicates a rendered document was rejected by a {@link SchemaValidator}.
   */
  public static class ValidationFailedException extends CodecException {
    protected final String schemaName;
    protected final String details;

    public ValidationFailedException(final String schemaName, final String details, final @Nullable Throwable cause) {
      super("Document failed validation against schema '" + schemaName + "': " + details, cause);
      this.schemaName = Objects.requireNonNull(schemaName, "null schemaName");
      this.details = Objects.requireNonNull(details, "null details");
      return;
    }

    public String getSchemaName() {
      return schemaName;
    }

    public String getDetails() {
      return details;
    }

  } // ValidationFailedException

}
