/*
 * Copyright 2017-2020 by Chris Hubick. All Rights Reserved.
 *
 * This work is licensed under the terms of the "GNU AFFERO GENERAL PUBLIC LICENSE" version 3, as published by the Free
 * Software Foundation <http://www.gnu.org/licenses/>, plus additional permissions, a copy of which you should have
 * received in the file LICENSE.txt.
 */

package net.www_eee.util.einvoice.zugferd;

import org.eclipse.jdt.annotation.*;

import net.www_eee.util.einvoice.model.*;

import static net.www_eee.util.einvoice.model.Namespaces.*;


/**
 * A ZUGFeRD 1.0 invoice (<code>rsm:CrossIndustryDocument</code>).
 */
@NonNullByDefault
public final class Invoice extends DocumentRoot {
  public static final String SCHEMA_NAME = "ZUGFeRD1p0";
  public static final Field<Context> CONTEXT = Field.element("context", Context.TYPE);
  public static final Field<Header> HEADER = Field.element("header", Header.TYPE);
  public static final Field<TradeTransaction> TRADE = Field.element("trade", TradeTransaction.TYPE);
  public static final ElementType<Invoice> TYPE = ElementType.define(Invoice.class, Invoice::new).name(rsm("CrossIndustryDocument")).field(CONTEXT).field(HEADER).field(TRADE).build();

  public Invoice() {
    super(TYPE);
    return;
  }

  @Override
  public String getSchemaName() {
    return SCHEMA_NAME;
  }

  /**
   * The <code>rsm:SpecifiedExchangedDocumentContext</code>, identifying the ZUGFeRD profile the invoice conforms to.
   */
  public static final class Context extends Element {
    public static final Field<IndicatorValue> TEST_INDICATOR = Field.indicator("testIndicator", ram("TestIndicator"));
    public static final Field<Container<GuidelineParameter>> GUIDELINE_PARAMETERS = Field.elements("guidelineParameters", GuidelineParameter.TYPE);
    public static final ElementType<Context> TYPE = ElementType.define(Context.class, Context::new).name(rsm("SpecifiedExchangedDocumentContext")).field(TEST_INDICATOR).field(GUIDELINE_PARAMETERS).build();

    public Context() {
      super(TYPE);
      return;
    }

  } // Context

  public static final class GuidelineParameter extends Element {
    /**
     * The profile URN, e.g. <code>urn:ferd:CrossIndustryDocument:invoice:1p0:basic</code>.
     */
    public static final Field<TextValue> ID = Field.text("id", ram("ID"));
    public static final ElementType<GuidelineParameter> TYPE = ElementType.define(GuidelineParameter.class, GuidelineParameter::new).name(ram("GuidelineSpecifiedDocumentContextParameter")).field(ID).build();

    public GuidelineParameter() {
      super(TYPE);
      return;
    }

  } // GuidelineParameter

  public static final class Header extends Element {
    public static final Field<TextValue> ID = Field.text("id", ram("ID"));
    public static final Field<TextValue> NAME = Field.text("name", ram("Name"));
    public static final Field<TextValue> TYPE_CODE = Field.text("typeCode", ram("TypeCode"));
    public static final Field<DateValue> ISSUE_DATE_TIME = Field.date("issueDateTime", ram("IssueDateTime"));
    public static final Field<Container<IncludedNote>> NOTES = Field.elements("notes", IncludedNote.TYPE);
    public static final ElementType<Header> TYPE = ElementType.define(Header.class, Header::new).name(rsm("HeaderExchangedDocument")).field(ID).field(NAME).field(TYPE_CODE).field(ISSUE_DATE_TIME).field(NOTES).build();

    public Header() {
      super(TYPE);
      return;
    }

  } // Header

  public static final class IncludedNote extends Element {
    public static final Field<Container<TextValue>> CONTENT = Field.texts("content", ram("Content"));
    public static final Field<TextValue> SUBJECT_CODE = Field.text("subjectCode", ram("SubjectCode"));
    public static final ElementType<IncludedNote> TYPE = ElementType.define(IncludedNote.class, IncludedNote::new).name(ram("IncludedNote")).field(CONTENT).field(SUBJECT_CODE).build();

    public IncludedNote() {
      super(TYPE);
      return;
    }

  } // IncludedNote

}
