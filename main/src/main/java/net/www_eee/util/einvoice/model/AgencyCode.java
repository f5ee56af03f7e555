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
 * An identifier issued by the agency named in the <code>schemeAgencyID</code> attribute.
 */
@NonNullByDefault
public final class AgencyCode extends LeafValue {
  public static final String SCHEME_AGENCY_ID_ATTR = "schemeAgencyID";
  private String text;
  private String schemeAgencyId;

  public AgencyCode(final QName name, final String text, final String schemeAgencyId) {
    super(name);
    this.text = Objects.requireNonNull(text, "null text");
    this.schemeAgencyId = Objects.requireNonNull(schemeAgencyId, "null schemeAgencyId");
    return;
  }

  public AgencyCode(final QName name) {
    this(name, "", "");
    return;
  }

  public String getText() {
    return text;
  }

  public String getSchemeAgencyId() {
    return schemeAgencyId;
  }

  public AgencyCode set(final String text, final String schemeAgencyId) {
    this.text = Objects.requireNonNull(text, "null text");
    this.schemeAgencyId = Objects.requireNonNull(schemeAgencyId, "null schemeAgencyId");
    return this;
  }

  @Override
  public DocumentNode encode() {
    return createNode().setText(text).setAttr(SCHEME_AGENCY_ID_ATTR, schemeAgencyId);
  }

  @Override
  public AgencyCode decode(final DocumentNode node) {
    text = getText(node);
    schemeAgencyId = getAttr(node, SCHEME_AGENCY_ID_ATTR);
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, text, schemeAgencyId);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    if (!super.equals(other)) return false;
    final AgencyCode a = (AgencyCode)Objects.requireNonNull(other);
    return text.equals(a.text) && schemeAgencyId.equals(a.schemeAgencyId);
  }

  @Override
  public String toString() {
    return text + " (" + schemeAgencyId + ')';
  }

}
