package org.evgrid.analytics;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.evgrid.catalog.CatalogSnapshot;
import org.evgrid.catalog.OperationalStatus;
import org.evgrid.catalog.PricingModel;
import org.evgrid.catalog.Station;
import org.evgrid.core.QueryDeadline;
import org.evgrid.geometry.ConvexHull;
import org.evgrid.geometry.PlanarPoint;
import org.evgrid.geometry.Polygon;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Grouped reporting views over one immutable catalog snapshot.
 * <p>
 * Every view is a pure function of the snapshot and the {@link AnalyticsConfig};
 * nothing is cached between calls. Money and percentages are rounded half-up to
 * 2 decimals unless a view documents otherwise.
 * </p>
 * <p>
 * Null handling: grouping keys that are null are left out of top-N, share,
 * price-statistics and pricing-strategy rows. The proxy density view keeps a
 * null county as its own group.
 * </p>
 */
@Slf4j
public final class AnalyticsEngine {
    private static final Comparator<String> NULLS_LAST = Comparator.nullsLast(Comparator.naturalOrder());

    @Getter
    @Accessors(fluent = true)
    private final CatalogSnapshot snapshot;
    @Getter
    @Accessors(fluent = true)
    private final AnalyticsConfig config;
    private final QueryDeadline deadline;

    public AnalyticsEngine(CatalogSnapshot snapshot) {
        this(snapshot, AnalyticsConfig.defaults(), QueryDeadline.none());
    }

    public AnalyticsEngine(CatalogSnapshot snapshot, AnalyticsConfig config) {
        this(snapshot, config, QueryDeadline.none());
    }

    /**
     * @param deadline bound checked while iterating; views fail with {@code TIMEOUT} once it passes.
     */
    public AnalyticsEngine(CatalogSnapshot snapshot, AnalyticsConfig config, QueryDeadline deadline) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.config = Objects.requireNonNull(config, "config");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        config.validate();
    }

    // =====================================================================
    // COUNTS
    // =====================================================================

    /**
     * Station count per operational status, in enum order; absent statuses are omitted.
     */
    public List<CountRow<OperationalStatus>> statusBreakdown() {
        EnumMap<OperationalStatus, Long> counts = new EnumMap<>(OperationalStatus.class);
        for (Station station : snapshot.stations()) {
            tick("statusBreakdown");
            counts.merge(station.status(), 1L, Long::sum);
        }
        List<CountRow<OperationalStatus>> rows = new ArrayList<>(counts.size());
        counts.forEach((status, count) -> rows.add(new CountRow<>(status, count)));
        return rows;
    }

    /**
     * Largest groups first; ties by key ascending; null keys excluded; at most {@code n} rows.
     */
    public <K extends Comparable<? super K>> List<CountRow<K>> topN(Function<? super Station, ? extends K> keyFn, int n) {
        Objects.requireNonNull(keyFn, "keyFn");
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0, got " + n);
        }
        List<CountRow<K>> rows = countByKey(keyFn, "topN");
        rows.sort(Comparator.<CountRow<K>>comparingLong(CountRow::getCount).reversed()
                .thenComparing(CountRow::getKey));
        return rows.size() > n ? new ArrayList<>(rows.subList(0, n)) : rows;
    }

    /**
     * Cities with the most stations, limited to {@link AnalyticsConfig#getTopN()}.
     */
    public List<CountRow<String>> topCities() {
        return topN(Station::city, config.getTopN());
    }

    /**
     * Stations per month of creation date, chronological; stations without a creation date are excluded.
     */
    public List<CountRow<YearMonth>> monthlyTrend() {
        TreeMap<YearMonth, Long> counts = new TreeMap<>();
        for (Station station : snapshot.stations()) {
            tick("monthlyTrend");
            if (station.creationDate() != null) {
                counts.merge(YearMonth.from(station.creationDate()), 1L, Long::sum);
            }
        }
        List<CountRow<YearMonth>> rows = new ArrayList<>(counts.size());
        counts.forEach((month, count) -> rows.add(new CountRow<>(month, count)));
        return rows;
    }

    /**
     * Stations per stated charging-point count, ascending; unknown capacity is excluded.
     */
    public List<CountRow<Integer>> chargingPointDistribution() {
        TreeMap<Integer, Long> counts = new TreeMap<>();
        for (Station station : snapshot.stations()) {
            tick("chargingPointDistribution");
            if (station.capacity() != null) {
                counts.merge(station.capacity(), 1L, Long::sum);
            }
        }
        List<CountRow<Integer>> rows = new ArrayList<>(counts.size());
        counts.forEach((points, count) -> rows.add(new CountRow<>(points, count)));
        return rows;
    }

    // =====================================================================
    // SHARES
    // =====================================================================

    /**
     * Share of each non-null group in the chosen population, 2 decimals.
     * Ordered by share descending, then key ascending.
     */
    public <K extends Comparable<? super K>> List<ShareRow<K>> shareOfTotal(
            Function<? super Station, ? extends K> keyFn,
            SharePopulation population
    ) {
        Objects.requireNonNull(keyFn, "keyFn");
        Objects.requireNonNull(population, "population");
        List<CountRow<K>> counts = countByKey(keyFn, "shareOfTotal");
        long denominator;
        if (population == SharePopulation.ALL_STATIONS) {
            denominator = snapshot.size();
        } else {
            denominator = 0L;
            for (CountRow<K> row : counts) {
                denominator += row.getCount();
            }
        }

        List<ShareRow<K>> rows = new ArrayList<>(counts.size());
        for (CountRow<K> row : counts) {
            rows.add(new ShareRow<>(row.getKey(), row.getCount(),
                    StatisticsMath.percent(row.getCount(), denominator, 2)));
        }
        rows.sort(Comparator.<ShareRow<K>>comparingDouble(ShareRow::getSharePercent).reversed()
                .thenComparing(ShareRow::getKey));
        return rows;
    }

    /**
     * Operator market share among stations with a known operator.
     */
    public List<ShareRow<String>> operatorShare() {
        return shareOfTotal(Station::operator, SharePopulation.NON_NULL_KEYS);
    }

    // =====================================================================
    // PRICES
    // =====================================================================

    /**
     * AC price statistics per group over paid stations that publish an AC price.
     * Ordered by mean descending, then key ascending; null keys excluded.
     */
    public <K extends Comparable<? super K>> List<PriceStatisticsRow<K>> priceStatistics(
            Function<? super Station, ? extends K> keyFn
    ) {
        Objects.requireNonNull(keyFn, "keyFn");
        Map<K, List<Station>> groups = CatalogSnapshot.groupBy(
                keyFn,
                snapshot.scan(s -> !s.pricing().isFree() && s.pricing().hasAcPrice())
        );

        List<PriceStatisticsRow<K>> rows = new ArrayList<>();
        for (Map.Entry<K, List<Station>> group : groups.entrySet()) {
            tick("priceStatistics");
            if (group.getKey() == null) {
                continue;
            }
            PriceSummary prices = PriceSummary.acPrices(group.getValue());
            Double variance = prices.sampleVariance();
            rows.add(PriceStatisticsRow.<K>builder()
                    .key(group.getKey())
                    .count(prices.count)
                    .mean(StatisticsMath.round(prices.mean(), 2))
                    .min(StatisticsMath.round(prices.min, 2))
                    .max(StatisticsMath.round(prices.max, 2))
                    .variance(StatisticsMath.roundOrNull(variance, 2))
                    .standardDeviation(StatisticsMath.roundOrNull(StatisticsMath.sqrtOrNull(variance), 2))
                    .build());
        }
        rows.sort(Comparator.<PriceStatisticsRow<K>>comparingDouble(PriceStatisticsRow::getMean).reversed()
                .thenComparing(PriceStatisticsRow::getKey));
        return rows;
    }

    /**
     * Average AC price per kWh by operator, excluding free stations.
     */
    public List<PriceStatisticsRow<String>> averageAcPriceByOperator() {
        return priceStatistics(Station::operator);
    }

    /**
     * Pricing-strategy mix of operators with at least
     * {@link AnalyticsConfig#getMinOperatorStations()} operational stations.
     * Ordered by station count descending, then operator ascending.
     */
    public List<OperatorPricingRow> operatorPricingStrategy() {
        Map<String, List<Station>> groups = CatalogSnapshot.groupBy(
                Station::operator,
                snapshot.scan(Station::isOperational)
        );

        List<OperatorPricingRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<Station>> group : groups.entrySet()) {
            tick("operatorPricingStrategy");
            List<Station> stations = group.getValue();
            if (group.getKey() == null || stations.size() < config.getMinOperatorStations()) {
                continue;
            }
            long kwhPriced = 0;
            long minutePriced = 0;
            long free = 0;
            for (Station station : stations) {
                if (station.pricing().getAcPricePerKwh() != null) {
                    kwhPriced++;
                }
                if (station.pricing().getPricePerMinute() != null) {
                    minutePriced++;
                }
                if (station.pricing().isFree()) {
                    free++;
                }
            }
            PriceSummary prices = PriceSummary.acPrices(stations);
            long total = stations.size();
            rows.add(OperatorPricingRow.builder()
                    .operator(group.getKey())
                    .totalStations(total)
                    .kwhModelPercent(StatisticsMath.percent(kwhPriced, total, 1))
                    .minuteModelPercent(StatisticsMath.percent(minutePriced, total, 1))
                    .freeModelPercent(StatisticsMath.percent(free, total, 1))
                    .averageKwhPrice(prices.count == 0 ? null : StatisticsMath.round(prices.mean(), 0))
                    .priceConsistencyScore(StatisticsMath.roundOrNull(
                            StatisticsMath.sqrtOrNull(prices.sampleVariance()), 1))
                    .build());
        }
        rows.sort(Comparator.comparingLong(OperatorPricingRow::getTotalStations).reversed()
                .thenComparing(OperatorPricingRow::getOperator));
        return rows;
    }

    /**
     * Operational stations grouped by pricing model and location type, with the
     * segment's share of all operational stations. Ordered by model, then location type.
     */
    public List<PricingModelRow> pricingModelAnalysis() {
        EnumMap<PricingModel, EnumMap<LocationType, List<Station>>> segments = new EnumMap<>(PricingModel.class);
        long operationalTotal = 0;
        for (Station station : snapshot.scan(Station::isOperational)) {
            tick("pricingModelAnalysis");
            operationalTotal++;
            LocationType locationType = LocationType.classify(station.city(), config.getMajorCities());
            segments.computeIfAbsent(station.pricing().model(), ignored -> new EnumMap<>(LocationType.class))
                    .computeIfAbsent(locationType, ignored -> new ArrayList<>())
                    .add(station);
        }

        List<PricingModelRow> rows = new ArrayList<>();
        for (Map.Entry<PricingModel, EnumMap<LocationType, List<Station>>> byModel : segments.entrySet()) {
            for (Map.Entry<LocationType, List<Station>> segment : byModel.getValue().entrySet()) {
                List<Station> stations = segment.getValue();
                double capacitySum = 0.0d;
                long capacityCount = 0;
                double minuteSum = 0.0d;
                long minuteCount = 0;
                for (Station station : stations) {
                    if (station.capacity() != null) {
                        capacitySum += station.capacity();
                        capacityCount++;
                    }
                    if (station.pricing().getPricePerMinute() != null) {
                        minuteSum += station.pricing().getPricePerMinute();
                        minuteCount++;
                    }
                }
                PriceSummary kwh = PriceSummary.acPrices(stations);
                rows.add(PricingModelRow.builder()
                        .pricingModel(byModel.getKey())
                        .locationType(segment.getKey())
                        .stationCount(stations.size())
                        .averageChargingPoints(StatisticsMath.roundOrNull(StatisticsMath.mean(capacitySum, capacityCount), 1))
                        .averageKwhPrice(kwh.count == 0 ? null : StatisticsMath.round(kwh.mean(), 0))
                        .averageMinutePrice(StatisticsMath.roundOrNull(StatisticsMath.mean(minuteSum, minuteCount), 1))
                        .marketSharePercent(StatisticsMath.percent(stations.size(), operationalTotal, 1))
                        .build());
            }
        }
        return rows;
    }

    // =====================================================================
    // REGIONS
    // =====================================================================

    /**
     * Proxy density per county: {@code count / totalStations * densityScaleFactor}, 0 decimals.
     *
     * <p>This keeps the reference report's semantics, which divide by the total
     * station count rather than by county area. Use {@link #densityByCounty(Map)}
     * for a true area-weighted density.</p>
     */
    public List<DensityRow> densityByCounty() {
        Map<String, List<Station>> groups = snapshot.groupBy(Station::county);
        long total = snapshot.size();
        List<DensityRow> rows = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<Station>> group : groups.entrySet()) {
            tick("densityByCounty");
            long count = group.getValue().size();
            double density = StatisticsMath.round(count * config.getDensityScaleFactor() / total, 0);
            rows.add(new DensityRow(group.getKey(), count, density, null));
        }
        rows.sort(Comparator.comparingDouble(DensityRow::getDensity).reversed()
                .thenComparing(DensityRow::getCounty, NULLS_LAST));
        return rows;
    }

    /**
     * Stations per 1000 km² for every county whose area is known, 2 decimals.
     * Counties without a positive area entry are skipped.
     */
    public List<DensityRow> densityByCounty(Map<String, Double> countyAreasKm2) {
        Objects.requireNonNull(countyAreasKm2, "countyAreasKm2");
        Map<String, List<Station>> groups = snapshot.groupBy(Station::county);
        List<DensityRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<Station>> group : groups.entrySet()) {
            tick("densityByCounty");
            Double area = group.getKey() == null ? null : countyAreasKm2.get(group.getKey());
            if (area == null || !(area > 0.0d)) {
                continue;
            }
            long count = group.getValue().size();
            rows.add(new DensityRow(group.getKey(), count, StatisticsMath.round(count * 1000.0d / area, 2), area));
        }
        rows.sort(Comparator.comparingDouble(DensityRow::getDensity).reversed()
                .thenComparing(DensityRow::getCounty, NULLS_LAST));
        return rows;
    }

    /**
     * Competition level per city over operational stations with an AC price.
     * Cities below {@link AnalyticsConfig#getCompetitionMinStations()} are skipped.
     * Ordered by price spread descending, then city ascending.
     */
    public List<CompetitionRow> competitionByCity() {
        Map<String, List<Station>> groups = CatalogSnapshot.groupBy(
                Station::city,
                snapshot.scan(s -> s.isOperational() && s.pricing().hasAcPrice() && s.city() != null)
        );
        List<CompetitionRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<Station>> group : groups.entrySet()) {
            tick("competitionByCity");
            List<Station> stations = group.getValue();
            if (stations.size() < config.getCompetitionMinStations()) {
                continue;
            }
            Set<String> operators = new HashSet<>();
            for (Station station : stations) {
                if (station.operator() != null) {
                    operators.add(station.operator());
                }
            }
            PriceSummary prices = PriceSummary.acPrices(stations);
            double spread = prices.max - prices.min;
            rows.add(CompetitionRow.builder()
                    .city(group.getKey())
                    .stationCount(stations.size())
                    .operatorCount(operators.size())
                    .averagePrice(StatisticsMath.round(prices.mean(), 2))
                    .minPrice(prices.min)
                    .maxPrice(prices.max)
                    .priceSpread(StatisticsMath.round(spread, 2))
                    .level(classifyCompetition(operators.size(), spread))
                    .build());
        }
        rows.sort(Comparator.comparingDouble(CompetitionRow::getPriceSpread).reversed()
                .thenComparing(CompetitionRow::getCity));
        return rows;
    }

    /**
     * Classifies competition from the distinct operator count and price spread.
     */
    public CompetitionLevel classifyCompetition(int operatorCount, double priceSpread) {
        if (operatorCount >= config.getHighCompetitionMinOperators()
                && priceSpread > config.getHighCompetitionMinSpread()) {
            return CompetitionLevel.HIGH;
        }
        if (operatorCount == config.getModerateCompetitionOperators()) {
            return CompetitionLevel.MODERATE;
        }
        return CompetitionLevel.LOW;
    }

    /**
     * Convex hull of each city's operational stations, for cities with more than one.
     * Ordered by city.
     */
    public List<CoverageAreaRow> coverageAreas() {
        TreeMap<String, List<PlanarPoint>> pointsByCity = new TreeMap<>();
        for (Station station : snapshot.scan(s -> s.isOperational() && s.city() != null)) {
            tick("coverageAreas");
            pointsByCity.computeIfAbsent(station.city(), ignored -> new ArrayList<>()).add(station.planarPoint());
        }
        List<CoverageAreaRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<PlanarPoint>> city : pointsByCity.entrySet()) {
            if (city.getValue().size() <= 1) {
                continue;
            }
            Polygon hull = ConvexHull.of(city.getValue());
            rows.add(new CoverageAreaRow(
                    city.getKey(),
                    city.getValue().size(),
                    hull,
                    StatisticsMath.round(hull.areaSquareKm(), 2)
            ));
        }
        log.debug("Computed coverage areas for {} cities", rows.size());
        return rows;
    }

    // =====================================================================
    // INTERNALS
    // =====================================================================

    private <K> List<CountRow<K>> countByKey(Function<? super Station, ? extends K> keyFn, String operation) {
        Map<K, Long> counts = new LinkedHashMap<>();
        for (Station station : snapshot.stations()) {
            tick(operation);
            K key = keyFn.apply(station);
            if (key != null) {
                counts.merge(key, 1L, Long::sum);
            }
        }
        List<CountRow<K>> rows = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> rows.add(new CountRow<>(key, count)));
        return rows;
    }

    private void tick(String operation) {
        deadline.check(operation);
    }

    /**
     * AC price moments of a station group; stations without an AC price are skipped.
     */
    private static final class PriceSummary {
        final double[] values;
        final int count;
        final double mean;
        final double min;
        final double max;

        private PriceSummary(double[] values, int count, double mean, double min, double max) {
            this.values = values;
            this.count = count;
            this.mean = mean;
            this.min = min;
            this.max = max;
        }

        static PriceSummary acPrices(List<Station> stations) {
            double[] values = new double[stations.size()];
            int count = 0;
            double mean = 0.0d;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (Station station : stations) {
                Double price = station.pricing().getAcPricePerKwh();
                if (price == null) {
                    continue;
                }
                values[count++] = price;
                // running mean stays finite for any finite prices
                mean += (price - mean) / count;
                min = Math.min(min, price);
                max = Math.max(max, price);
            }
            return new PriceSummary(values, count, mean, min, max);
        }

        double mean() {
            return mean;
        }

        Double sampleVariance() {
            return StatisticsMath.sampleVariance(values, count);
        }
    }
}
