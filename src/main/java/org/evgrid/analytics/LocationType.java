package org.evgrid.analytics;

import java.util.Set;

/**
 * Coarse settlement class of a station's city.
 */
public enum LocationType {
    MAJOR_CITY,
    TOWN_CITY,
    RURAL_OTHER;

    /**
     * Classifies a city name: listed major city, name starting with an ASCII
     * capital letter, or anything else (including a missing city).
     */
    public static LocationType classify(String city, Set<String> majorCities) {
        if (city == null) {
            return RURAL_OTHER;
        }
        if (majorCities.contains(city)) {
            return MAJOR_CITY;
        }
        if (!city.isEmpty() && city.charAt(0) >= 'A' && city.charAt(0) <= 'Z') {
            return TOWN_CITY;
        }
        return RURAL_OTHER;
    }
}
