package com.property.reconciliation.validation;

import com.property.reconciliation.core.model.BookingStatus;
import com.property.reconciliation.core.model.BookingType;
import com.property.reconciliation.core.model.ContactCategory;
import com.property.reconciliation.core.model.ContactPropertyRelationship;
import com.property.reconciliation.core.model.OperationalCostType;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.core.model.RequestStatus;
import com.property.reconciliation.core.model.RequestUrgency;

/**
 * The fallback table for every enum-valued import column. An unrecognised value
 * maps to the default listed here and the validator reports a warning.
 */
public final class EnumMappings {

    public static final EnumMapping<BookingStatus> BOOKING_STATUS =
            EnumMapping.of("bookingStatus", BookingStatus.class, BookingStatus.PENDING);

    public static final EnumMapping<BookingType> BOOKING_TYPE =
            EnumMapping.of("bookingType", BookingType.class, BookingType.CONFIRMED);

    public static final EnumMapping<PropertyStatus> PROPERTY_STATUS =
            EnumMapping.of("propertyStatus", PropertyStatus.class, PropertyStatus.PUBLISHED);

    /** One-sheet imports create properties hidden until someone reviews them. */
    public static final EnumMapping<PropertyStatus> IMPORTED_PROPERTY_STATUS =
            EnumMapping.of("importedPropertyStatus", PropertyStatus.class, PropertyStatus.HIDDEN);

    public static final EnumMapping<ContactCategory> CONTACT_CATEGORY =
            EnumMapping.of("contactCategory", ContactCategory.class, ContactCategory.OTHER);

    public static final EnumMapping<ContactPropertyRelationship> RELATIONSHIP =
            EnumMapping.of("relationship", ContactPropertyRelationship.class, ContactPropertyRelationship.OTHER);

    public static final EnumMapping<RequestStatus> REQUEST_STATUS =
            EnumMapping.of("requestStatus", RequestStatus.class, RequestStatus.PENDING);

    public static final EnumMapping<RequestUrgency> REQUEST_URGENCY =
            EnumMapping.of("requestUrgency", RequestUrgency.class, RequestUrgency.MEDIUM)
                    .withAlias("URGENT", RequestUrgency.HIGH);

    public static final EnumMapping<OperationalCostType> COST_TYPE =
            EnumMapping.of("costType", OperationalCostType.class, OperationalCostType.HOUSEKEEPING);

    private EnumMappings() {
    }
}
