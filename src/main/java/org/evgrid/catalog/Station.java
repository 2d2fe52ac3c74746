package org.evgrid.catalog;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.evgrid.core.StationCoreException;
import org.evgrid.geometry.GeoPoint;
import org.evgrid.geometry.PlanarPoint;
import org.evgrid.geometry.WebMercatorProjection;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Immutable, validated charging station.
 *
 * <p>The planar point is always derived from the geographic location inside
 * {@link #from(StationRecord)}; there is no way to construct a station whose
 * two representations disagree. Updates replace the whole station.</p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Station {
    private final long id;
    private final GeoPoint location;
    private final PlanarPoint planarPoint;
    private final LocationAttributes address;
    private final String operator;
    private final OperationalStatus status;
    private final Integer capacity;
    private final Pricing pricing;
    private final AccessFlags access;
    private final LocalDate creationDate;
    private final LocalDate lastVerifiedDate;
    private final String teslaType;
    private final String accessComments;
    private final String notes;

    /**
     * Validates a normalized record and builds the station.
     *
     * @throws StationCoreException {@code INVALID_COORDINATE} for missing or out-of-range
     *                              coordinates, {@code MALFORMED_RECORD} for a missing id,
     *                              negative capacity or invalid pricing.
     */
    public static Station from(StationRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.getId() == null) {
            throw new StationCoreException(StationCoreException.REASON_MALFORMED_RECORD, "station id is required");
        }
        if (record.getLatitude() == null || record.getLongitude() == null) {
            throw new StationCoreException(
                    StationCoreException.REASON_INVALID_COORDINATE,
                    "latitude and longitude are required for station " + record.getId()
            );
        }
        GeoPoint location = GeoPoint.of(record.getLatitude(), record.getLongitude());

        Integer capacity = record.getCapacity();
        if (capacity != null && capacity < 0) {
            throw new StationCoreException(
                    StationCoreException.REASON_MALFORMED_RECORD,
                    "capacity must be >= 0, got " + capacity
            );
        }

        Pricing pricing = Pricing.builder()
                .free(record.isFree())
                .paidUnspecified(record.isPaidUnspecified())
                .acPricePerKwh(record.getAcPricePerKwh())
                .dcPricePerKwh(record.getDcPricePerKwh())
                .pricePerMinute(record.getPricePerMinute())
                .additionalFees(record.getAdditionalFees())
                .usageCost(record.getUsageCost())
                .build();

        return new Station(
                record.getId(),
                location,
                WebMercatorProjection.project(location),
                LocationAttributes.builder()
                        .city(record.getCity())
                        .county(record.getCounty())
                        .postalCode(record.getPostalCode())
                        .country(record.getCountry())
                        .build(),
                record.getOperator(),
                OperationalStatus.fromFlag(record.getOperational()),
                capacity,
                pricing,
                AccessFlags.builder()
                        .inaccessible(record.isInaccessible())
                        .payAtLocation(record.isPayAtLocation())
                        .membershipRequired(record.isMembershipRequired())
                        .build(),
                record.getCreationDate(),
                record.getLastVerifiedDate(),
                record.getTeslaType(),
                record.getAccessComments(),
                record.getNotes()
        );
    }

    public String city() {
        return address.getCity();
    }

    public String county() {
        return address.getCounty();
    }

    public boolean isOperational() {
        return status == OperationalStatus.OPERATIONAL;
    }

    public boolean hasCapacity() {
        return capacity != null;
    }
}
