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

import net.www_eee.util.einvoice.xml.*;


/**
 * An identifier from the scheme named in the <code>schemeID</code> attribute (e.g. <code>"0088"</code> for GLN, or
 * <code>"VA"</code> for a VAT registration).
 */
@NonNullByDefault
public final class SchemeId extends LeafValue {
  public static final String SCHEME_ID_ATTR = "schemeID";
  private String text;
  private String schemeId;

  public SchemeId(final QName name, final String text, final String schemeId) {
    super(name);
    this.text = Objects.requireNonNull(text, "null text");
    this.schemeId = Objects.requireNonNull(schemeId, "null schemeId");
    return;
  }

  public SchemeId(final QName name) {
    this(name, "", "");
    return;
  }

  public String getText() {
    return text;
  }

  public String getSchemeId() {
    return schemeId;
  }

  public SchemeId set(final String text, final String schemeId) {
    this.text = Objects.requireNonNull(text, "null text");
    this.schemeId = Objects.requireNonNull(schemeId, "null schemeId");
    return this;
  }

  @Override
  public DocumentNode encode() {
    return createNode().setText(text).setAttr(SCHEME_ID_ATTR, schemeId);
  }

  @Override
  public SchemeId decode(final DocumentNode node) {
    text = getText(node);
    schemeId = getAttr(node, SCHEME_ID_ATTR);
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, text, schemeId);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    if (!super.equals(other)) return false;
    final SchemeId s = (SchemeId)Objects.requireNonNull(other);
    return text.equals(s.text) && schemeId.equals(s.schemeId);
  }

  @Override
  public String toString() {
    return text + " (" + schemeId + ')';
  }

}
