package org.evgrid.catalog;

import lombok.Builder;
import lombok.Value;

/**
 * Independent, non-exclusive access restrictions.
 */
@Value
@Builder
public class AccessFlags {
    boolean inaccessible;
    boolean payAtLocation;
    boolean membershipRequired;

    public static AccessFlags none() {
        return AccessFlags.builder().build();
    }
}
