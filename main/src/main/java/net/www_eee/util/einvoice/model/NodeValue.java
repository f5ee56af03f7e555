/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import javax.xml.namespace.*;

import org.eclipse.jdt.annotation.*;

import net.www_eee.util.einvoice.xml.*;


/**
 * The value held by an {@link Element} {@link Field}. This is a closed hierarchy, every value is either a
 * {@link LeafValue}, a nested {@link Element}, or a {@link Container} of one of those.
 */
@NonNullByDefault
public abstract class NodeValue {

  NodeValue() {
    return;
  }

  /**
   * Get the name of the node(s) this value encodes to. When decoding, an {@link Element} uses this to find which of
   * it's fields a child node belongs to.
   *
   * @return The qualified node name.
   */
  public abstract QName getName();

  /**
   * Encode this value and append the resulting node(s) to the supplied parent.
   *
   * @param parent The node to append to.
   */
  public abstract void appendTo(DocumentNode parent);

}
