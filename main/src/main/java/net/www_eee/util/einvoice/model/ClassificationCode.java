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
 * A code drawn from a versioned code list, identified by the <code>listID</code> and <code>listVersionID</code>
 * attributes. The code itself is opaque text, even where a list happens to use numeric codes.
 */
@NonNullByDefault
public final class ClassificationCode extends LeafValue {
  public static final String LIST_ID_ATTR = "listID";
  public static final String LIST_VERSION_ID_ATTR = "listVersionID";
  private String text;
  private String listId;
  private String listVersionId;

  public ClassificationCode(final QName name, final String text, final String listId, final String listVersionId) {
    super(name);
    this.text = Objects.requireNonNull(text, "null text");
    this.listId = Objects.requireNonNull(listId, "null listId");
    this.listVersionId = Objects.requireNonNull(listVersionId, "null listVersionId");
    return;
  }

  public ClassificationCode(final QName name) {
    this(name, "", "", "");
    return;
  }

  public String getText() {
    return text;
  }

  public String getListId() {
    return listId;
  }

  public String getListVersionId() {
    return listVersionId;
  }

  public ClassificationCode set(final String text, final String listId, final String listVersionId) {
    this.text = Objects.requireNonNull(text, "null text");
    this.listId = Objects.requireNonNull(listId, "null listId");
    this.listVersionId = Objects.requireNonNull(listVersionId, "null listVersionId");
    return this;
  }

  @Override
  public DocumentNode encode() {
    return createNode().setText(text).setAttr(LIST_ID_ATTR, listId).setAttr(LIST_VERSION_ID_ATTR, listVersionId);
  }

  @Override
  public ClassificationCode decode(final DocumentNode node) {
    text = getText(node);
    listId = getAttr(node, LIST_ID_ATTR);
    listVersionId = getAttr(node, LIST_VERSION_ID_ATTR);
    return this;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, text, listId, listVersionId);
  }

  @Override
  public boolean equals(final @Nullable Object other) {
    if (!super.equals(other)) return false;
    final ClassificationCode c = (ClassificationCode)Objects.requireNonNull(other);
    return text.equals(c.text) && listId.equals(c.listId) && listVersionId.equals(c.listVersionId);
  }

  @Override
  public String toString() {
    return text + " (" + listId + ' ' + listVersionId + ')';
  }

}
