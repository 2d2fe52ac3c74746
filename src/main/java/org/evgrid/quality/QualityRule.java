package org.evgrid.quality;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.evgrid.catalog.OperationalStatus;
import org.evgrid.catalog.Station;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named predicate that flags one kind of data-quality issue.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class QualityRule {
    private final IssueKind kind;
    private final Predicate<Station> trigger;

    public static final QualityRule MISSING_PRICE = new QualityRule(
            IssueKind.MISSING_PRICE,
            s -> !s.pricing().isFree() && s.pricing().getAcPricePerKwh() == null
    );

    public static final QualityRule MISSING_OPERATIONAL_STATUS = new QualityRule(
            IssueKind.MISSING_OPERATIONAL_STATUS,
            s -> s.status() == OperationalStatus.UNKNOWN
    );

    public static final QualityRule MISSING_CAPACITY = new QualityRule(
            IssueKind.MISSING_CAPACITY,
            s -> s.capacity() == null
    );

    public static final QualityRule VERIFICATION_BEFORE_CREATION = new QualityRule(
            IssueKind.VERIFICATION_BEFORE_CREATION,
            s -> s.creationDate() != null
                    && s.lastVerifiedDate() != null
                    && s.lastVerifiedDate().isBefore(s.creationDate())
    );

    /**
     * Built-in rules in priority order.
     */
    public static List<QualityRule> defaultRules() {
        return List.of(MISSING_PRICE, MISSING_OPERATIONAL_STATUS, MISSING_CAPACITY, VERIFICATION_BEFORE_CREATION);
    }

    public boolean matches(Station station) {
        return trigger.test(Objects.requireNonNull(station, "station"));
    }
}
