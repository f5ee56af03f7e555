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
 * The fields common to each party to a trade. This type declares no tag of it's own, each concrete
 * {@linkplain Seller party} supplies one.
 */
@NonNullByDefault
public abstract class TradeParty extends Element {
  public static final Field<AgencyCode> ID = Field.agencyCode("id", ram("ID"));
  public static final Field<SchemeId> GLOBAL_ID = Field.schemeId("globalId", ram("GlobalID"));
  public static final Field<TextValue> NAME = Field.text("name", ram("Name"));
  public static final Field<PostalTradeAddress> ADDRESS = Field.element("address", PostalTradeAddress.TYPE);
  public static final Field<Container<TaxRegistration>> TAX_REGISTRATIONS = Field.elements("taxRegistrations", TaxRegistration.TYPE);
  public static final ElementType<TradeParty> TYPE = ElementType.define(TradeParty.class).field(ID).field(GLOBAL_ID).field(NAME).field(ADDRESS).field(TAX_REGISTRATIONS).build();

  protected TradeParty(final ElementType<? extends TradeParty> type) {
    super(type);
    return;
  }

  public static final class Seller extends TradeParty {
    public static final ElementType<Seller> TYPE = ElementType.extend(TradeParty.TYPE, Seller.class, Seller::new).name(ram("SellerTradeParty")).build();

    public Seller() {
      super(TYPE);
      return;
    }

  } // Seller

  public static final class Buyer extends TradeParty {
    public static final ElementType<Buyer> TYPE = ElementType.extend(TradeParty.TYPE, Buyer.class, Buyer::new).name(ram("BuyerTradeParty")).build();

    public Buyer() {
      super(TYPE);
      return;
    }

  } // Buyer

  public static final class PostalTradeAddress extends Element {
    public static final Field<TextValue> POSTCODE = Field.text("postcode", ram("PostcodeCode"));
    public static final Field<TextValue> LINE_ONE = Field.text("lineOne", ram("LineOne"));
    public static final Field<TextValue> LINE_TWO = Field.text("lineTwo", ram("LineTwo"));
    public static final Field<TextValue> CITY_NAME = Field.text("cityName", ram("CityName"));
    /**
     * ISO 3166-1 alpha-2.
     */
    public static final Field<TextValue> COUNTRY_ID = Field.text("countryId", ram("CountryID"));
    public static final ElementType<PostalTradeAddress> TYPE = ElementType.define(PostalTradeAddress.class, PostalTradeAddress::new).name(ram("PostalTradeAddress")).field(POSTCODE).field(LINE_ONE).field(LINE_TWO).field(CITY_NAME).field(COUNTRY_ID).build();

    public PostalTradeAddress() {
      super(TYPE);
      return;
    }

  } // PostalTradeAddress

  public static final class TaxRegistration extends Element {
    public static final Field<SchemeId> ID = Field.schemeId("id", ram("ID"));
    public static final ElementType<TaxRegistration> TYPE = ElementType.define(TaxRegistration.class, TaxRegistration::new).name(ram("SpecifiedTaxRegistration")).field(ID).build();

    public TaxRegistration() {
      super(TYPE);
      return;
    }

  } // TaxRegistration

}
