package org.evgrid.core;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import lombok.extern.slf4j.Slf4j;
import org.evgrid.analytics.AnalyticsConfig;
import org.evgrid.analytics.AnalyticsEngine;
import org.evgrid.catalog.CatalogSnapshot;
import org.evgrid.catalog.Station;
import org.evgrid.catalog.StationCatalog;
import org.evgrid.catalog.StationRecord;
import org.evgrid.geometry.BoundingBox;
import org.evgrid.geometry.GeoPoint;
import org.evgrid.geometry.PlanarPoint;
import org.evgrid.geometry.WebMercatorProjection;
import org.evgrid.quality.DataIssue;
import org.evgrid.quality.DataQualityValidator;
import org.evgrid.spatial.IndexConfig;
import org.evgrid.spatial.NearestMatch;
import org.evgrid.spatial.StationRTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongPredicate;
import java.util.function.Predicate;

/**
 * Owner of one station catalog and its spatial index.
 * <p>
 * All reads and writes go through this object. A read-write lock lets any
 * number of queries run in parallel while each mutation holds exclusive access
 * and updates catalog and index together, so readers never observe one without
 * the other. Analytics and validation copy a snapshot under the read lock and
 * compute outside it.
 * </p>
 * <p>
 * Instances are independent; there is no global catalog.
 * </p>
 */
@Slf4j
public final class StationCore {
    /** Bulk loads touching at least this share of the resulting catalog rebuild the index with STR. */
    private static final double BULK_REBUILD_RATIO = 0.5d;

    private final StationCatalog catalog = new StationCatalog();
    private final StationRTree index;
    private final AnalyticsConfig analyticsConfig;
    private final DataQualityValidator validator;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public StationCore() {
        this(IndexConfig.defaults(), AnalyticsConfig.defaults(), new DataQualityValidator());
    }

    public StationCore(IndexConfig indexConfig, AnalyticsConfig analyticsConfig) {
        this(indexConfig, analyticsConfig, new DataQualityValidator());
    }

    public StationCore(IndexConfig indexConfig, AnalyticsConfig analyticsConfig, DataQualityValidator validator) {
        this.index = new StationRTree(Objects.requireNonNull(indexConfig, "indexConfig"));
        this.analyticsConfig = Objects.requireNonNull(analyticsConfig, "analyticsConfig");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    // =====================================================================
    // LOADING & MUTATION
    // =====================================================================

    public LoadReport load(List<StationRecord> records) {
        return load(records, LoadOptions.defaults());
    }

    /**
     * Loads a batch of normalized records.
     * <p>
     * In {@link LoadOptions.LoadMode#ATOMIC} mode the first invalid record aborts the
     * call with a {@link StationCoreException} naming its batch index and id, and the
     * catalog and index are left untouched. In
     * {@link LoadOptions.LoadMode#COLLECT_FAILURES} mode invalid records are reported
     * and every valid record is committed.
     * </p>
     *
     * @throws StationCoreException {@code INVALID_COORDINATE}, {@code MALFORMED_RECORD}
     *                              (including an id repeated within the batch) or
     *                              {@code DUPLICATE_ID} (insert-only mode), atomic mode only.
     */
    public LoadReport load(List<StationRecord> records, LoadOptions options) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(options, "options");
        boolean atomic = options.getMode() == LoadOptions.LoadMode.ATOMIC;

        LoadReport.LoadReportBuilder report = LoadReport.builder().submitted(records.size());
        List<Station> valid = new ArrayList<>(records.size());
        List<Integer> validIndices = new ArrayList<>(records.size());
        LongOpenHashSet batchIds = new LongOpenHashSet(records.size());

        for (int i = 0; i < records.size(); i++) {
            StationRecord record = records.get(i);
            Long recordId = record == null ? null : record.getId();
            try {
                if (record == null) {
                    throw new StationCoreException(StationCoreException.REASON_MALFORMED_RECORD, "record is null");
                }
                Station station = Station.from(record);
                if (!batchIds.add(station.id())) {
                    throw new StationCoreException(
                            StationCoreException.REASON_MALFORMED_RECORD,
                            "id " + station.id() + " appears more than once in the batch"
                    );
                }
                valid.add(station);
                validIndices.add(i);
            } catch (StationCoreException ex) {
                StationCoreException located = StationCoreException.atRecord(i, recordId, ex);
                if (atomic) {
                    log.warn("Rejecting batch of {} records: {}", records.size(), located.getMessage());
                    throw located;
                }
                log.warn("Skipping record: {}", located.getMessage());
                report.failure(LoadFailure.of(located));
            }
        }

        lock.writeLock().lock();
        try {
            List<Station> toApply = valid;
            if (options.getWriteMode() == LoadOptions.WriteMode.INSERT_ONLY) {
                toApply = new ArrayList<>(valid.size());
                for (int i = 0; i < valid.size(); i++) {
                    Station station = valid.get(i);
                    if (!catalog.contains(station.id())) {
                        toApply.add(station);
                        continue;
                    }
                    StationCoreException located = StationCoreException.atRecord(
                            validIndices.get(i),
                            station.id(),
                            duplicateId(station.id())
                    );
                    if (atomic) {
                        log.warn("Rejecting batch of {} records: {}", records.size(), located.getMessage());
                        throw located;
                    }
                    log.warn("Skipping record: {}", located.getMessage());
                    report.failure(LoadFailure.of(located));
                }
            }
            int replaced = applyLocked(toApply);
            report.inserted(toApply.size() - replaced).replaced(replaced);
        } finally {
            lock.writeLock().unlock();
        }

        LoadReport result = report.build();
        log.info("Loaded {} of {} records ({} inserted, {} replaced, {} rejected)",
                result.accepted(), result.getSubmitted(), result.getInserted(), result.getReplaced(),
                result.getFailures().size());
        return result;
    }

    /**
     * Inserts or fully replaces one station.
     *
     * @return the stored station.
     */
    public Station upsert(StationRecord record) {
        Station station = Station.from(Objects.requireNonNull(record, "record"));
        lock.writeLock().lock();
        try {
            applyLocked(List.of(station));
        } finally {
            lock.writeLock().unlock();
        }
        return station;
    }

    /**
     * Inserts a station whose id must be new.
     *
     * @throws StationCoreException {@code DUPLICATE_ID} when the id exists.
     */
    public Station insert(StationRecord record) {
        Station station = Station.from(Objects.requireNonNull(record, "record"));
        lock.writeLock().lock();
        try {
            if (catalog.contains(station.id())) {
                throw duplicateId(station.id());
            }
            applyLocked(List.of(station));
        } finally {
            lock.writeLock().unlock();
        }
        return station;
    }

    /**
     * Removes a station from catalog and index.
     *
     * @return true when the id existed.
     */
    public boolean remove(long id) {
        lock.writeLock().lock();
        try {
            Station removed = catalog.remove(id);
            if (removed == null) {
                return false;
            }
            try {
                index.remove(id);
            } catch (RuntimeException ex) {
                catalog.upsert(removed);
                rebuildIndexLocked("index remove failed for station " + id);
                throw ex;
            }
            log.debug("Removed station {}", id);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies stations to catalog and index; on an index failure the catalog is
     * restored and the index rebuilt before the failure propagates.
     *
     * @return number of stations that replaced an existing id.
     */
    private int applyLocked(List<Station> stations) {
        if (stations.isEmpty()) {
            return 0;
        }
        List<Station> previous = new ArrayList<>(stations.size());
        int replaced = 0;
        for (Station station : stations) {
            Station old = catalog.upsert(station);
            previous.add(old);
            if (old != null) {
                replaced++;
            }
        }

        try {
            if (stations.size() >= BULK_REBUILD_RATIO * catalog.size() && stations.size() > 1) {
                index.build(indexEntries());
            } else {
                for (int i = 0; i < stations.size(); i++) {
                    Station station = stations.get(i);
                    Station old = previous.get(i);
                    if (old == null || !old.planarPoint().equals(station.planarPoint())) {
                        index.insert(station.id(), station.planarPoint());
                    }
                }
            }
        } catch (RuntimeException ex) {
            for (int i = stations.size() - 1; i >= 0; i--) {
                Station old = previous.get(i);
                if (old == null) {
                    catalog.remove(stations.get(i).id());
                } else {
                    catalog.upsert(old);
                }
            }
            rebuildIndexLocked("index update failed: " + ex.getMessage());
            throw ex;
        }
        return replaced;
    }

    // =====================================================================
    // SPATIAL QUERIES
    // =====================================================================

    public List<NearestMatch> nearestK(GeoPoint query, int k, Predicate<Station> predicate) {
        return nearestK(query, k, predicate, QueryDeadline.none());
    }

    /**
     * Up to {@code k} stations accepted by {@code predicate}, nearest first, ties by id.
     * An empty list is a valid result.
     */
    public List<NearestMatch> nearestK(GeoPoint query, int k, Predicate<Station> predicate, QueryDeadline deadline) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(deadline, "deadline");
        PlanarPoint planar = WebMercatorProjection.project(query);
        lock.readLock().lock();
        try {
            deadline.check("nearestK");
            List<NearestMatch> matches = index.nearestK(planar, k, stationFilter(predicate, deadline, "nearestK"));
            log.debug("nearestK({}, k={}) returned {} matches", query, k, matches.size());
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Nearest operational stations that publish a usage cost, with distance in km.
     */
    public List<NearestStation> nearestOperationalWithCost(GeoPoint query, int k) {
        Predicate<Station> predicate = s -> s.isOperational() && s.pricing().hasUsageCost();
        PlanarPoint planar = WebMercatorProjection.project(Objects.requireNonNull(query, "query"));
        lock.readLock().lock();
        try {
            List<NearestMatch> matches = index.nearestK(planar, k, stationFilter(predicate, QueryDeadline.none(), "nearestK"));
            List<NearestStation> rows = new ArrayList<>(matches.size());
            for (NearestMatch match : matches) {
                rows.add(NearestStation.of(requireStation(match.stationId()), match.distanceMeters()));
            }
            return rows;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Ids of stations whose planar point lies in {@code box}.
     */
    public LongSet rangeQuery(BoundingBox box) {
        Objects.requireNonNull(box, "box");
        lock.readLock().lock();
        try {
            return index.rangeQuery(box);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stations accepted by {@code predicate} within {@code radiusKm} of {@code query}, nearest first.
     */
    public List<NearestMatch> withinRadius(GeoPoint query, double radiusKm, Predicate<Station> predicate) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(predicate, "predicate");
        double radiusMeters = toRadiusMeters(radiusKm);
        PlanarPoint planar = WebMercatorProjection.project(query);
        lock.readLock().lock();
        try {
            return index.withinRadius(planar, radiusMeters, stationFilter(predicate, QueryDeadline.none(), "withinRadius"));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Candidate points with no operational station within {@code radiusKm}.
     */
    public List<GeoPoint> uncoveredPoints(List<GeoPoint> candidates, double radiusKm) {
        Objects.requireNonNull(candidates, "candidates");
        double radiusMeters = toRadiusMeters(radiusKm);
        LongPredicate operational = stationFilter(Station::isOperational, QueryDeadline.none(), "uncoveredPoints");
        List<GeoPoint> uncovered = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (GeoPoint candidate : candidates) {
                List<NearestMatch> nearest = index.nearestK(WebMercatorProjection.project(candidate), 1, operational);
                if (nearest.isEmpty() || nearest.get(0).distanceMeters() > radiusMeters) {
                    uncovered.add(candidate);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return uncovered;
    }

    // =====================================================================
    // CATALOG QUERIES
    // =====================================================================

    public Optional<Station> get(long id) {
        lock.readLock().lock();
        try {
            return catalog.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return catalog.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Immutable copy of the catalog at call time.
     */
    public CatalogSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return catalog.snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Restartable filtered iteration over the catalog state at call time.
     */
    public Iterable<Station> scan(Predicate<? super Station> predicate) {
        return snapshot().scan(predicate);
    }

    public AnalyticsEngine analytics() {
        return new AnalyticsEngine(snapshot(), analyticsConfig);
    }

    /**
     * Analytics over a fresh snapshot whose views fail with {@code TIMEOUT} past {@code deadline}.
     */
    public AnalyticsEngine analytics(QueryDeadline deadline) {
        return new AnalyticsEngine(snapshot(), analyticsConfig, deadline);
    }

    public List<DataIssue> validate() {
        return validator.validate(snapshot());
    }

    public List<DataIssue> validate(QueryDeadline deadline) {
        return validator.validate(snapshot(), deadline);
    }

    /**
     * Station and index counts plus the first {@code sampleSize} stations by id.
     */
    public CatalogSummary summary(int sampleSize) {
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must be >= 0, got " + sampleSize);
        }
        lock.readLock().lock();
        try {
            List<Station> all = catalog.snapshot().stations();
            return CatalogSummary.builder()
                    .stationCount(catalog.size())
                    .indexedCount(index.size())
                    .indexHeight(index.height())
                    .sample(List.copyOf(all.subList(0, Math.min(sampleSize, all.size()))))
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    // =====================================================================
    // CONSISTENCY
    // =====================================================================

    /**
     * Checks that catalog and index hold exactly the same ids with matching planar
     * points and that the tree is structurally sound. A violation is logged and
     * repaired by rebuilding the index from the catalog.
     *
     * @return true when no repair was needed.
     */
    public boolean verifyConsistency() {
        lock.writeLock().lock();
        try {
            String violation = findViolationLocked();
            if (violation == null) {
                return true;
            }
            log.error("Catalog/index inconsistency detected: {}", violation);
            rebuildIndexLocked(violation);
            String remaining = findViolationLocked();
            if (remaining != null) {
                throw new StationCoreException(
                        StationCoreException.REASON_INTERNAL_INCONSISTENCY,
                        "index rebuild did not restore consistency: " + remaining
                );
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rebuilds the spatial index from the catalog with STR bulk loading.
     */
    public void rebuildIndex() {
        lock.writeLock().lock();
        try {
            rebuildIndexLocked("requested");
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Direct index access for consistency tests in this package.
     */
    StationRTree indexForTesting() {
        return index;
    }

    private String findViolationLocked() {
        try {
            index.checkInvariants();
        } catch (IllegalStateException ex) {
            return "index structure: " + ex.getMessage();
        }
        if (index.size() != catalog.size()) {
            return "index holds " + index.size() + " ids, catalog holds " + catalog.size();
        }
        for (Station station : catalog.snapshot().stations()) {
            PlanarPoint indexed = index.pointOf(station.id());
            if (indexed == null) {
                return "station " + station.id() + " missing from index";
            }
            if (!indexed.equals(station.planarPoint())) {
                return "station " + station.id() + " indexed at a stale point";
            }
        }
        return null;
    }

    private void rebuildIndexLocked(String reason) {
        index.build(indexEntries());
        log.info("Rebuilt spatial index over {} stations ({})", index.size(), reason);
    }

    private List<StationRTree.Entry> indexEntries() {
        List<Station> stations = catalog.snapshot().stations();
        List<StationRTree.Entry> entries = new ArrayList<>(stations.size());
        for (Station station : stations) {
            entries.add(new StationRTree.Entry(station.id(), station.planarPoint()));
        }
        return entries;
    }

    private LongPredicate stationFilter(Predicate<Station> predicate, QueryDeadline deadline, String operation) {
        return id -> {
            deadline.check(operation);
            Optional<Station> station = catalog.get(id);
            return station.isPresent() && predicate.test(station.get());
        };
    }

    private Station requireStation(long id) {
        return catalog.get(id).orElseThrow(() -> new StationCoreException(
                StationCoreException.REASON_INTERNAL_INCONSISTENCY,
                "index returned station " + id + " that is not in the catalog"
        ));
    }

    /**
     * Validates a caller radius in km; radii beyond the planar range saturate rather than overflow.
     */
    private static double toRadiusMeters(double radiusKm) {
        if (!(radiusKm >= 0.0d) || Double.isInfinite(radiusKm)) {
            throw new IllegalArgumentException("radiusKm must be finite and >= 0, got " + radiusKm);
        }
        return Math.min(radiusKm * 1000.0d, Double.MAX_VALUE);
    }

    private static StationCoreException duplicateId(long id) {
        return new StationCoreException(StationCoreException.REASON_DUPLICATE_ID, "station " + id + " already exists");
    }
}
