package org.evgrid.core;

import lombok.Value;

/**
 * One rejected record of a bulk load.
 */
@Value
public class LoadFailure {
    /** Zero-based position in the submitted batch. */
    int recordIndex;
    /** Id of the rejected record, or null when the record had none. */
    Long stationId;
    String reasonCode;
    String message;

    static LoadFailure of(StationCoreException failure) {
        return new LoadFailure(failure.getRecordIndex(), failure.getStationId(), failure.getReasonCode(), failure.getMessage());
    }
}
