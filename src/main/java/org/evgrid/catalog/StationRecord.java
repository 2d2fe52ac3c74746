package org.evgrid.catalog;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Normalized station row as handed over by the cleaning/loading collaborator.
 *
 * <p>Fields mirror the cleaned source columns. Nothing is validated here;
 * {@link Station#from(StationRecord)} performs validation and derives the
 * planar point.</p>
 */
@Value
@Builder(toBuilder = true)
public class StationRecord {
    Long id;
    Double latitude;
    Double longitude;

    String city;
    String county;
    String postalCode;
    String country;

    String operator;
    /** Null means the source did not state an operational status. */
    Boolean operational;
    Integer capacity;

    boolean free;
    boolean paidUnspecified;
    boolean inaccessible;
    boolean payAtLocation;
    boolean membershipRequired;

    Double acPricePerKwh;
    Double dcPricePerKwh;
    Double pricePerMinute;
    String additionalFees;
    String usageCost;

    String teslaType;
    LocalDate lastVerifiedDate;
    LocalDate creationDate;
    String accessComments;
    String notes;
}
