/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import java.time.*;
import java.time.format.*;
import java.util.*;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;

import net.www_eee.util.einvoice.xml.*;


/**
 * A calendar date {@link LeafValue}. Rather than holding text directly, the element wraps a single
 * <code>udt:DateTimeString</code> child, whose <code>format</code> attribute names the UN/CEFACT date format code.
 * Only format {@value #FORMAT} (<code>CCYYMMDD</code>) is supported.
 */
@NonNullByDefault
public final class DateValue extends LeafValue {
  /**
   * The name of the wrapped child element.
   */
  public static final QName DATE_TIME_STRING = Namespaces.udt("DateTimeString");
  public static final String FORMAT_ATTR = "format";
  /**
   * The UN/CEFACT code for the <code>CCYYMMDD</code> date format.
   */
  public static final String FORMAT = "102";
  private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);
  private @Nullable LocalDate date;

  public DateValue(final QName name, final @Nullable LocalDate date) {
    super(name);
    this.date = date;
    return;
  }

  public DateValue(final QName name) {
    this(name, null);
    return;
  }

  public @Nullable LocalDate getDate() {
    return date;
  }

  public DateValue setDate(final @Nullable LocalDate date) {
    this.date = date;
    return this;
  }

  @Override
  public DocumentNode encode() throws IllegalStateException {
    final DocumentNode node = createNode();
    node.appendChild(new DocumentNode(DATE_TIME_STRING)).setAttr(FORMAT_ATTR, FORMAT).setText(FORMATTER.format(requireSet(date, "date")));
    return node;
  }

  /**
   * @throws CodecException.MalformedDateContainerException If the node doesn't contain exactly one
   * <code>DateTimeString</code> child, or it's text isn't a valid date.
   * @throws CodecException.MissingAttributeException If the <code>DateTimeString</code> has no <code>format</code>.
   * @throws CodecException.UnsupportedDateFormatException If the <code>format</code> isn't {@value #FORMAT}.
   */
  @Override
  public DateValue decode(final DocumentNode node) throws CodecException.DecodingException {
    final List<DocumentNode> children = node.getChildren();
    if (children.size() != 1) throw new CodecException.MalformedDateContainerException(node.getName(), "contains " + children.size() + " children, but exactly one " + DATE_TIME_STRING + " was expected", null);
    final DocumentNode dateTimeString = children.get(0);
    if (!DATE_TIME_STRING.equals(dateTimeString.getName())) throw new CodecException.MalformedDateContainerException(node.getName(), "contains " + dateTimeString.getName() + " where " + DATE_TIME_STRING + " was expected", null);

    final String format = getRequiredAttr(dateTimeString, FORMAT_ATTR);
    if (!FORMAT.equals(format)) throw new CodecException.UnsupportedDateFormatException(node.getName(), format);

    final String text = getText(dateTimeString).trim();
    try {
      date = LocalDate.parse(text, FORMATTER);
    } catch (DateTimeParseException dtpe) {
      throw new CodecException.MalformedDateContainerException(node.getName(), "contains invalid date '" + text + "'", dtpe);
    }
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, date);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    return super.equals(other) && Objects.equals(date, ((DateValue)Objects.requireNonNull(other)).date);
  }

  @Override
  public String toString() {
    return String.valueOf(date);
  }

}
