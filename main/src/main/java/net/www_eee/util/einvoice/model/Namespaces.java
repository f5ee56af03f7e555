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
 * The namespaces used by ZUGFeRD 1.0 / UN/CEFACT Cross Industry Invoice documents.
 */
@NonNullByDefault
public final class Namespaces {
  /**
   * The root schema module, <code>rsm</code>.
   */
  public static final String RSM = "urn:ferd:CrossIndustryDocument:invoice:1p0";
  /**
   * Reusable aggregate business information entities, <code>ram</code>.
   */
  public static final String RAM = "urn:un:unece:uncefact:data:standard:ReusableAggregateBusinessInformationEntity:12";
  /**
   * Unqualified data types, <code>udt</code>. Also the namespace of the {@link DateValue} and {@link IndicatorValue}
   * wrapper children.
   */
  public static final String UDT = "urn:un:unece:uncefact:data:standard:UnqualifiedDataType:15";
  /**
   * Qualified data types, <code>qdt</code>.
   */
  public static final String QDT = "urn:un:unece:uncefact:data:standard:QualifiedDataType:12";
  /**
   * The conventional prefix for each namespace, keyed by namespace URI.
   */
  public static final Map<String,String> PREFIXES;
  static {
    final Map<String,String> prefixes = new LinkedHashMap<>();
    prefixes.put(RSM, "rsm");
    prefixes.put(RAM, "ram");
    prefixes.put(UDT, "udt");
    prefixes.put(QDT, "qdt");
    PREFIXES = Collections.unmodifiableMap(prefixes);
  }

  private Namespaces() {
    return;
  }

  public static QName rsm(final String localName) {
    return new QName(RSM, localName);
  }

  public static QName ram(final String localName) {
    return new QName(RAM, localName);
  }

  public static QName udt(final String localName) {
    return new QName(UDT, localName);
  }

  public static QName qdt(final String localName) {
    return new QName(QDT, localName);
  }

}
