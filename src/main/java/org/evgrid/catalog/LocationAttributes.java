package org.evgrid.catalog;

import lombok.Builder;
import lombok.Value;

/**
 * Free-text address attributes; every field may be null.
 */
@Value
@Builder
public class LocationAttributes {
    String city;
    String county;
    String postalCode;
    String country;

    public static LocationAttributes empty() {
        return LocationAttributes.builder().build();
    }
}
