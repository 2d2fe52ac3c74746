package org.evgrid.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Batch summary returned by {@link StationCore#load(List, LoadOptions)}.
 */
@Value
@Builder
public class LoadReport {
    /** Records submitted in the batch. */
    int submitted;
    /** Stations whose id was new to the catalog. */
    int inserted;
    /** Stations that replaced an existing id. */
    int replaced;
    /** Rejected records; always empty in atomic mode. */
    @Singular
    List<LoadFailure> failures;

    public int accepted() {
        return inserted + replaced;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
