package org.evgrid.quality;

import lombok.Value;

/**
 * One flagged station and the first issue found on it.
 */
@Value
public class DataIssue {
    long stationId;
    String city;
    String operator;
    IssueKind kind;
}
