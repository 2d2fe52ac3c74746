package org.evgrid.quality;

import lombok.extern.slf4j.Slf4j;
import org.evgrid.catalog.CatalogSnapshot;
import org.evgrid.catalog.Station;
import org.evgrid.core.QueryDeadline;
import org.evgrid.core.StationCoreException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Single-pass, rule-ordered data-quality scan.
 * <p>
 * A station is first selected by the selection predicate, then classified by the
 * first rule that matches it, so each station is reported at most once. With the
 * default selection ("any rule matches") every selected station is classifiable.
 * A selected station that no rule classifies means selection and rules have
 * drifted apart; that is raised as {@code INTERNAL_INCONSISTENCY} rather than
 * reported as a generic issue.
 * </p>
 * <p>
 * Stations are only read, never modified.
 * </p>
 */
@Slf4j
public final class DataQualityValidator {
    private final List<QualityRule> rules;
    private final Predicate<Station> selection;

    public DataQualityValidator() {
        this(QualityRule.defaultRules());
    }

    /**
     * Validator whose selection is "any of {@code rules} matches".
     */
    public DataQualityValidator(List<QualityRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.selection = station -> anyMatch(this.rules, station);
    }

    /**
     * Validator with an explicit selection predicate.
     *
     * @param rules classification rules in priority order.
     * @param selection which stations to report; every selected station must match a rule.
     */
    public DataQualityValidator(List<QualityRule> rules, Predicate<Station> selection) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.selection = Objects.requireNonNull(selection, "selection");
    }

    public List<DataIssue> validate(CatalogSnapshot snapshot) {
        return validate(snapshot, QueryDeadline.none());
    }

    /**
     * Scans {@code snapshot} once and returns flagged stations in id order.
     *
     * @throws StationCoreException {@code INTERNAL_INCONSISTENCY} when a selected station
     *                              matches no rule; {@code TIMEOUT} when the deadline passes.
     */
    public List<DataIssue> validate(CatalogSnapshot snapshot, QueryDeadline deadline) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(deadline, "deadline");
        List<DataIssue> issues = new ArrayList<>();
        for (Station station : snapshot.scan(selection)) {
            deadline.check("validate");
            IssueKind kind = classify(station);
            if (kind == null) {
                log.error("Station {} selected for validation but matched no rule", station.id());
                throw new StationCoreException(
                        StationCoreException.REASON_INTERNAL_INCONSISTENCY,
                        "station " + station.id() + " was selected but no quality rule classifies it"
                );
            }
            issues.add(new DataIssue(station.id(), station.city(), station.operator(), kind));
        }
        log.debug("Validated {} stations, {} flagged", snapshot.size(), issues.size());
        return issues;
    }

    /**
     * First matching issue kind for a station, or null when it is clean.
     */
    public IssueKind classify(Station station) {
        for (QualityRule rule : rules) {
            if (rule.matches(station)) {
                return rule.kind();
            }
        }
        return null;
    }

    /**
     * Number of flagged stations per issue kind, in priority order.
     */
    public static Map<IssueKind, Long> issueCounts(List<DataIssue> issues) {
        EnumMap<IssueKind, Long> counts = new EnumMap<>(IssueKind.class);
        for (DataIssue issue : issues) {
            counts.merge(issue.getKind(), 1L, Long::sum);
        }
        return counts;
    }

    private static boolean anyMatch(List<QualityRule> rules, Station station) {
        for (QualityRule rule : rules) {
            if (rule.matches(station)) {
                return true;
            }
        }
        return false;
    }
}
