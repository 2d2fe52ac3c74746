package org.evgrid.analytics;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Tunable parameters of the analytics views.
 *
 * <p>Competition thresholds are expressed in the catalog's currency, so they
 * are configuration rather than constants. {@link #defaults()} reads optional
 * {@code evgrid.analytics.*} system properties.</p>
 */
@Value
@Builder(toBuilder = true)
public class AnalyticsConfig {
    public static final int DEFAULT_TOP_N = 5;
    public static final double DEFAULT_DENSITY_SCALE_FACTOR = 1000.0d;
    public static final int DEFAULT_HIGH_COMPETITION_MIN_OPERATORS = 3;
    public static final double DEFAULT_HIGH_COMPETITION_MIN_SPREAD = 50.0d;
    public static final int DEFAULT_MODERATE_COMPETITION_OPERATORS = 2;
    public static final int DEFAULT_COMPETITION_MIN_STATIONS = 3;
    public static final int DEFAULT_MIN_OPERATOR_STATIONS = 5;
    public static final Set<String> DEFAULT_MAJOR_CITIES = Set.of("Budapest", "Debrecen", "Szeged", "Miskolc", "Pécs");

    private static final String PROP_PREFIX = "evgrid.analytics.";

    /**
     * Row limit of top-N views.
     */
    @Builder.Default
    int topN = DEFAULT_TOP_N;

    /**
     * Multiplier of the proxy density view ({@code count / total * scaleFactor}).
     */
    @Builder.Default
    double densityScaleFactor = DEFAULT_DENSITY_SCALE_FACTOR;

    /**
     * Minimum distinct operators for HIGH competition.
     */
    @Builder.Default
    int highCompetitionMinOperators = DEFAULT_HIGH_COMPETITION_MIN_OPERATORS;

    /**
     * Price spread that must be exceeded (strictly) for HIGH competition.
     */
    @Builder.Default
    double highCompetitionMinSpread = DEFAULT_HIGH_COMPETITION_MIN_SPREAD;

    /**
     * Exact operator count classified as MODERATE competition.
     */
    @Builder.Default
    int moderateCompetitionOperators = DEFAULT_MODERATE_COMPETITION_OPERATORS;

    /**
     * Cities with fewer priced operational stations are left out of the competition view.
     */
    @Builder.Default
    int competitionMinStations = DEFAULT_COMPETITION_MIN_STATIONS;

    /**
     * Operators with fewer operational stations are left out of the pricing-strategy view.
     */
    @Builder.Default
    int minOperatorStations = DEFAULT_MIN_OPERATOR_STATIONS;

    /**
     * City names classified as {@link LocationType#MAJOR_CITY}; an empty set classifies none.
     */
    @Builder.Default
    Set<String> majorCities = DEFAULT_MAJOR_CITIES;

    /**
     * Built-in defaults, each overridable with a system property such as
     * {@code -Devgrid.analytics.highCompetitionMinSpread=30}.
     */
    public static AnalyticsConfig defaults() {
        return AnalyticsConfig.builder()
                .topN(readInt("topN", DEFAULT_TOP_N))
                .densityScaleFactor(readDouble("densityScaleFactor", DEFAULT_DENSITY_SCALE_FACTOR))
                .highCompetitionMinOperators(readInt("highCompetitionMinOperators", DEFAULT_HIGH_COMPETITION_MIN_OPERATORS))
                .highCompetitionMinSpread(readDouble("highCompetitionMinSpread", DEFAULT_HIGH_COMPETITION_MIN_SPREAD))
                .moderateCompetitionOperators(readInt("moderateCompetitionOperators", DEFAULT_MODERATE_COMPETITION_OPERATORS))
                .competitionMinStations(readInt("competitionMinStations", DEFAULT_COMPETITION_MIN_STATIONS))
                .minOperatorStations(readInt("minOperatorStations", DEFAULT_MIN_OPERATOR_STATIONS))
                .majorCities(DEFAULT_MAJOR_CITIES)
                .build();
    }

    void validate() {
        if (topN <= 0) {
            throw new IllegalArgumentException("topN must be > 0, got " + topN);
        }
        if (!(densityScaleFactor > 0.0d) || Double.isInfinite(densityScaleFactor)) {
            throw new IllegalArgumentException("densityScaleFactor must be finite and > 0, got " + densityScaleFactor);
        }
        if (highCompetitionMinOperators <= 0 || moderateCompetitionOperators <= 0) {
            throw new IllegalArgumentException("competition operator thresholds must be > 0");
        }
        if (!Double.isFinite(highCompetitionMinSpread)) {
            throw new IllegalArgumentException("highCompetitionMinSpread must be finite");
        }
        if (majorCities == null) {
            throw new IllegalArgumentException("majorCities must not be null");
        }
    }

    private static int readInt(String key, int fallback) {
        String raw = System.getProperty(PROP_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String key, double fallback) {
        String raw = System.getProperty(PROP_PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
