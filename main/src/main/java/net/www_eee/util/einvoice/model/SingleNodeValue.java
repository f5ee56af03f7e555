/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.model;

import org.eclipse.jdt.annotation.*;

import net.www_eee.util.einvoice.xml.*;


/**
 * A {@link NodeValue} which encodes to exactly one node, and can decode a node back into itself.
 */
@NonNullByDefault
public abstract class SingleNodeValue extends NodeValue {

  SingleNodeValue() {
    return;
  }

  /**
   * Encode this value.
   *
   * @return A new node tree representing the current state of this value.
   */
  public abstract DocumentNode encode();

  /**
   * Populate this value from the supplied node.
   *
   * @param node The node to decode.
   * @return This value.
   * @throws CodecException.DecodingException If the node doesn't match what this value expects.
   */
  public abstract SingleNodeValue decode(DocumentNode node) throws CodecException.DecodingException;

  @Override
  public final void appendTo(final DocumentNode parent) {
    parent.appendChild(encode());
    return;
  }

}
