package org.evgrid.core;

import lombok.Builder;
import lombok.Value;
import org.evgrid.catalog.Station;

import java.util.List;

/**
 * Post-load verification summary.
 */
@Value
@Builder
public class CatalogSummary {
    int stationCount;
    int indexedCount;
    int indexHeight;
    /** First stations in id order. */
    List<Station> sample;
}
