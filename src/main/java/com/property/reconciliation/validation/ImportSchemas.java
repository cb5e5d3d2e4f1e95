package com.property.reconciliation.validation;

import java.util.List;

/**
 * Column layouts of the five bulk import sheets, plus the marker columns
 * that switch on the optional sections of the one-sheet import.
 */
public final class ImportSchemas {

    public static final String PROPERTY_NAME_REQUIRED = "Property name is required";

    public static final RowSchema PROPERTY = RowSchema.builder("property")
            .field(FieldSpec.text("name").from("name", "propertyName").required(PROPERTY_NAME_REQUIRED))
            .field(FieldSpec.text("destinationId"))
            .field(FieldSpec.text("destinationName").from("destinationName", "destination"))
            .field(FieldSpec.integer("numberOfRooms").nonNegative())
            .field(FieldSpec.integer("numberOfBathrooms").nonNegative())
            .field(FieldSpec.integer("maxGuests").nonNegative())
            .field(FieldSpec.text("address"))
            .field(FieldSpec.text("city"))
            .field(FieldSpec.decimal("latitude").between(-90, 90))
            .field(FieldSpec.decimal("longitude").between(-180, 180))
            .field(FieldSpec.enumerated("status", EnumMappings.PROPERTY_STATUS))
            .field(FieldSpec.text("segment"))
            .field(FieldSpec.list("categories"))
            .build();

    public static final RowSchema BOOKING = RowSchema.builder("booking")
            .field(FieldSpec.text("propertyName").from("propertyName", "propertyId", "property")
                    .required(PROPERTY_NAME_REQUIRED))
            .field(FieldSpec.enumerated("bookingType", EnumMappings.BOOKING_TYPE).from("bookingType", "type"))
            .field(FieldSpec.enumerated("status", EnumMappings.BOOKING_STATUS).from("status", "bookingStatus"))
            .field(FieldSpec.date("startDate").required("Start date is required"))
            .field(FieldSpec.date("endDate").required("End date is required"))
            .field(FieldSpec.text("guestName"))
            .field(FieldSpec.email("guestEmail"))
            .field(FieldSpec.text("guestPhone"))
            .field(FieldSpec.integer("numberOfGuests").nonNegative())
            .field(FieldSpec.decimal("totalAmount").nonNegative())
            .field(FieldSpec.text("notes"))
            .field(FieldSpec.text("externalId").from("externalId", "bookingId"))
            .build();

    public static final RowSchema CONTACT = RowSchema.builder("contact")
            .field(FieldSpec.text("firstName").required("First name is required"))
            .field(FieldSpec.text("lastName").required("Last name is required"))
            .field(FieldSpec.email("email"))
            .field(FieldSpec.text("phone"))
            .field(FieldSpec.enumerated("category", EnumMappings.CONTACT_CATEGORY))
            .field(FieldSpec.text("language"))
            .field(FieldSpec.text("comments"))
            .field(FieldSpec.list("linkedProperties"))
            .field(FieldSpec.enumerated("relationship", EnumMappings.RELATIONSHIP))
            .build();

    public static final RowSchema PRICE_RANGE = RowSchema.builder("priceRange")
            .field(FieldSpec.text("propertyName").from("propertyName", "propertyId", "property")
                    .required(PROPERTY_NAME_REQUIRED))
            .field(FieldSpec.text("periodName").from("periodName", "name").required("Period name is required"))
            .field(FieldSpec.date("startDate").required("Start date is required"))
            .field(FieldSpec.date("endDate").required("End date is required"))
            .field(FieldSpec.decimal("ownerNightlyRate").nonNegative().required("Owner nightly rate is required"))
            .field(FieldSpec.decimal("ownerWeeklyRate").nonNegative())
            .build();

    public static final RowSchema COMBINED = RowSchema.builder("combined")
            .field(FieldSpec.text("propertyName").required(PROPERTY_NAME_REQUIRED))
            .field(FieldSpec.text("destinationName"))
            .field(FieldSpec.integer("numberOfRooms").nonNegative())
            .field(FieldSpec.integer("numberOfBathrooms").nonNegative())
            .field(FieldSpec.integer("maxGuests").nonNegative())
            .field(FieldSpec.text("address"))
            .field(FieldSpec.text("city"))
            .field(FieldSpec.decimal("latitude").between(-90, 90))
            .field(FieldSpec.decimal("longitude").between(-180, 180))
            .field(FieldSpec.enumerated("status", EnumMappings.IMPORTED_PROPERTY_STATUS))
            .field(FieldSpec.text("segment"))
            .field(FieldSpec.list("categories"))
            .field(FieldSpec.text("periodName"))
            .field(FieldSpec.date("priceStartDate"))
            .field(FieldSpec.date("priceEndDate"))
            .field(FieldSpec.decimal("ownerNightlyRate").nonNegative())
            .field(FieldSpec.decimal("ownerWeeklyRate").nonNegative())
            .field(FieldSpec.enumerated("costType", EnumMappings.COST_TYPE))
            .field(FieldSpec.decimal("costEstimatedPrice").nonNegative())
            .field(FieldSpec.enumerated("bookingType", EnumMappings.BOOKING_TYPE))
            .field(FieldSpec.date("bookingStartDate"))
            .field(FieldSpec.date("bookingEndDate"))
            .field(FieldSpec.text("guestName"))
            .field(FieldSpec.email("guestEmail"))
            .field(FieldSpec.date("requestStartDate"))
            .field(FieldSpec.date("requestEndDate"))
            .field(FieldSpec.text("requestGuestName"))
            .field(FieldSpec.email("requestGuestEmail"))
            .field(FieldSpec.text("requestGuestPhone"))
            .field(FieldSpec.integer("requestNumberOfGuests"))
            .field(FieldSpec.text("requestMessage"))
            .field(FieldSpec.enumerated("requestStatus", EnumMappings.REQUEST_STATUS))
            .field(FieldSpec.enumerated("requestUrgency", EnumMappings.REQUEST_URGENCY))
            .build();

    public static final PresenceRule PROPERTY_SECTION =
            PresenceRule.of("property", "numberOfRooms", "maxGuests", "address");
    public static final PresenceRule PRICING_SECTION =
            PresenceRule.of("pricing", "periodName", "priceStartDate", "ownerNightlyRate");
    public static final PresenceRule COST_SECTION =
            PresenceRule.of("cost", "costType", "costEstimatedPrice");
    public static final PresenceRule BOOKING_SECTION =
            PresenceRule.of("booking", "bookingType", "bookingStartDate");
    public static final PresenceRule REQUEST_SECTION =
            PresenceRule.of("availabilityRequest", "requestStartDate", "requestGuestName", "requestGuestEmail");

    public static final List<PresenceRule> COMBINED_SECTIONS =
            List.of(PROPERTY_SECTION, PRICING_SECTION, COST_SECTION, BOOKING_SECTION, REQUEST_SECTION);

    private ImportSchemas() {
    }
}
