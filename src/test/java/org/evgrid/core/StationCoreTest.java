package org.evgrid.core;

import it.unimi.dsi.fastutil.longs.LongSet;
import org.evgrid.analytics.AnalyticsConfig;
import org.evgrid.catalog.Station;
import org.evgrid.catalog.StationRecord;
import org.evgrid.geometry.BoundingBox;
import org.evgrid.geometry.GeoPoint;
import org.evgrid.geometry.GeometryDistance;
import org.evgrid.geometry.PlanarPoint;
import org.evgrid.geometry.WebMercatorProjection;
import org.evgrid.quality.DataIssue;
import org.evgrid.quality.IssueKind;
import org.evgrid.spatial.IndexConfig;
import org.evgrid.spatial.NearestMatch;
import org.evgrid.spatial.StationRTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.evgrid.testutil.StationFixtures.record;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Station Core Tests")
class StationCoreTest {

    private static final IndexConfig SMALL_NODES = IndexConfig.builder().maxEntries(4).build();

    private static StationCore newCore() {
        return new StationCore(SMALL_NODES, AnalyticsConfig.defaults());
    }

    private static List<StationRecord> threeStations() {
        return List.of(
                record(1L, 47.50, 19.04).capacity(2).build(),
                record(2L, 47.49, 19.03).capacity(4).build(),
                record(3L, 46.43, 20.32).capacity(null).build()
        );
    }

    private static List<StationRecord> randomRecords(Random random, long firstId, int count) {
        List<StationRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(record(firstId + i, 45.8 + random.nextDouble() * 2.6, 16.2 + random.nextDouble() * 6.6)
                    .operational(random.nextInt(4) != 0)
                    .build());
        }
        return records;
    }

    // =====================================================================
    // LOADING
    // =====================================================================

    @Test
    @DisplayName("Load: nearestK ranks the three reference stations by distance")
    void testReferenceScenario() {
        StationCore core = newCore();
        LoadReport report = core.load(threeStations());
        assertEquals(3, report.getInserted());
        assertFalse(report.hasFailures());

        GeoPoint query = GeoPoint.of(47.50, 19.04);
        List<NearestMatch> withCapacity = core.nearestK(query, 2, Station::hasCapacity);
        assertEquals(List.of(1L, 2L), ids(withCapacity));
        assertEquals(0.0, withCapacity.get(0).distanceMeters(), 1e-9);

        List<NearestMatch> all = core.nearestK(query, 3, s -> true);
        assertEquals(List.of(1L, 2L, 3L), ids(all));
        assertTrue(all.get(1).distanceMeters() < all.get(2).distanceMeters());

        assertTrue(core.verifyConsistency());
    }

    @Test
    @DisplayName("Load: atomic mode rejects the whole batch and names the failing record")
    void testAtomicLoadRejectsBatch() {
        StationCore core = newCore();
        core.load(threeStations());

        List<StationRecord> batch = List.of(
                record(10L, 47.0, 19.0).build(),
                record(11L, 95.0, 19.0).build(),
                record(12L, 47.0, 19.0).build()
        );
        StationCoreException ex = assertThrows(StationCoreException.class, () -> core.load(batch));
        assertEquals(StationCoreException.REASON_INVALID_COORDINATE, ex.getReasonCode());
        assertEquals(1, ex.getRecordIndex());
        assertEquals(11L, ex.getStationId());
        assertTrue(ex.getMessage().contains("record[1]"));

        assertEquals(3, core.size());
        assertTrue(core.get(10L).isEmpty());
        assertTrue(core.verifyConsistency());
    }

    @Test
    @DisplayName("Load: collect-failures mode commits valid records and reports the rest")
    void testCollectFailures() {
        StationCore core = newCore();
        List<StationRecord> batch = Arrays.asList(
                record(1L, 47.0, 19.0).build(),
                null,
                record(2L, 47.0, 19.0).capacity(-3).build(),
                record(3L, 47.1, 19.1).build(),
                record(1L, 47.2, 19.2).build(),
                record(4L, 47.0, 19.0).longitude(null).build()
        );
        LoadReport report = core.load(batch, LoadOptions.collectFailures());

        assertEquals(6, report.getSubmitted());
        assertEquals(2, report.accepted());
        assertEquals(List.of(1, 2, 4, 5), report.getFailures().stream().map(LoadFailure::getRecordIndex).toList());
        assertEquals(List.of(
                StationCoreException.REASON_MALFORMED_RECORD,
                StationCoreException.REASON_MALFORMED_RECORD,
                StationCoreException.REASON_MALFORMED_RECORD,
                StationCoreException.REASON_INVALID_COORDINATE
        ), report.getFailures().stream().map(LoadFailure::getReasonCode).toList());
        assertNull(report.getFailures().get(0).getStationId());
        assertEquals(1L, report.getFailures().get(2).getStationId());

        assertEquals(2, core.size());
        assertEquals(47.0, core.get(1L).orElseThrow().location().latitude());
        assertTrue(core.verifyConsistency());
    }

    @Test
    @DisplayName("Load: an id repeated within a batch is malformed even in atomic mode")
    void testBatchDuplicateIsMalformed() {
        StationCore core = newCore();
        StationCoreException ex = assertThrows(StationCoreException.class, () -> core.load(List.of(
                record(1L, 47.0, 19.0).build(),
                record(1L, 47.5, 19.5).build()
        )));
        assertEquals(StationCoreException.REASON_MALFORMED_RECORD, ex.getReasonCode());
        assertEquals(1, ex.getRecordIndex());
        assertEquals(0, core.size());
    }

    @Test
    @DisplayName("Load: insert-only mode reports DUPLICATE_ID for existing ids")
    void testInsertOnly() {
        StationCore core = newCore();
        core.load(threeStations());

        LoadOptions atomicInsert = LoadOptions.builder().writeMode(LoadOptions.WriteMode.INSERT_ONLY).build();
        StationCoreException ex = assertThrows(StationCoreException.class, () -> core.load(List.of(
                record(20L, 47.0, 19.0).build(),
                record(2L, 47.0, 19.0).build()
        ), atomicInsert));
        assertEquals(StationCoreException.REASON_DUPLICATE_ID, ex.getReasonCode());
        assertEquals(1, ex.getRecordIndex());
        assertTrue(core.get(20L).isEmpty());

        LoadOptions collectInsert = LoadOptions.builder()
                .mode(LoadOptions.LoadMode.COLLECT_FAILURES)
                .writeMode(LoadOptions.WriteMode.INSERT_ONLY)
                .build();
        LoadReport report = core.load(List.of(
                record(20L, 47.0, 19.0).build(),
                record(2L, 47.0, 19.0).build()
        ), collectInsert);
        assertEquals(1, report.getInserted());
        assertEquals(StationCoreException.REASON_DUPLICATE_ID, report.getFailures().get(0).getReasonCode());
        assertEquals(4, core.size());

        StationCoreException single = assertThrows(StationCoreException.class,
                () -> core.insert(record(3L, 47.0, 19.0).build()));
        assertEquals(StationCoreException.REASON_DUPLICATE_ID, single.getReasonCode());
    }

    // =====================================================================
    // MUTATION & CONSISTENCY
    // =====================================================================

    @Test
    @DisplayName("Upsert moves a station in the index and keeps catalog and index in step")
    void testUpsertMovesStation() {
        StationCore core = newCore();
        core.load(randomRecords(new Random(42), 1L, 200));

        GeoPoint far = GeoPoint.of(35.0, 5.0);
        assertNotEquals(7L, core.nearestK(far, 1, s -> true).get(0).stationId());

        Station moved = core.upsert(record(7L, 35.0, 5.0).build());
        assertEquals(WebMercatorProjection.project(far), moved.planarPoint());
        assertEquals(7L, core.nearestK(far, 1, s -> true).get(0).stationId());
        assertEquals(200, core.size());

        LoadReport report = core.load(randomRecords(new Random(7), 195L, 10));
        assertEquals(6, report.getReplaced());
        assertEquals(4, report.getInserted());
        assertEquals(204, core.size());
        assertTrue(core.verifyConsistency());
    }

    @Test
    @DisplayName("Re-upserting identical records leaves catalog snapshot and index content unchanged")
    void testIdempotentUpsert() {
        StationCore core = newCore();
        List<StationRecord> records = randomRecords(new Random(42), 1L, 200);
        core.load(records);
        StationRTree index = core.indexForTesting();

        List<Station> stationsBefore = core.snapshot().stations();
        PlanarPoint pointBefore = index.pointOf(7L);
        int heightBefore = index.height();
        LongSet idsBefore = index.ids();

        core.upsert(records.get(6));
        assertEquals(stationsBefore, core.snapshot().stations());
        assertEquals(pointBefore, index.pointOf(7L));
        assertEquals(heightBefore, index.height());
        assertEquals(idsBefore, index.ids());

        // a full identical batch takes the bulk rebuild path
        LoadReport report = core.load(records);
        assertEquals(200, report.getReplaced());
        assertEquals(0, report.getInserted());
        assertEquals(stationsBefore, core.snapshot().stations());
        assertEquals(pointBefore, index.pointOf(7L));
        assertEquals(heightBefore, index.height());
        assertEquals(idsBefore, index.ids());
        assertTrue(core.verifyConsistency());
    }

    @Test
    @DisplayName("Remove deletes from catalog and index")
    void testRemove() {
        StationCore core = newCore();
        core.load(threeStations());

        assertTrue(core.remove(1L));
        assertFalse(core.remove(1L));
        assertEquals(2, core.size());
        assertEquals(List.of(2L, 3L), ids(core.nearestK(GeoPoint.of(47.50, 19.04), 5, s -> true)));
        assertTrue(core.verifyConsistency());
    }

    @Test
    @DisplayName("verifyConsistency repairs an index that drifted from the catalog")
    void testVerifyConsistencyRepairs() {
        StationCore core = newCore();
        core.load(randomRecords(new Random(42), 1L, 50));

        StationRTree index = core.indexForTesting();
        index.remove(10L);
        index.insert(11L, WebMercatorProjection.project(0.0, 0.0));

        assertFalse(core.verifyConsistency());
        assertTrue(core.verifyConsistency());
        assertEquals(50, index.size());
        assertEquals(core.get(11L).orElseThrow().planarPoint(), index.pointOf(11L));
    }

    // =====================================================================
    // QUERIES
    // =====================================================================

    @Test
    @DisplayName("Nearest operational stations with a usage cost report km distance to 2 decimals")
    void testNearestOperationalWithCost() {
        StationCore core = newCore();
        core.load(List.of(
                record(1L, 47.50, 19.04).usageCost("150 Ft/kWh").build(),
                record(2L, 47.52, 19.08).usageCost("140 Ft/kWh").build(),
                record(3L, 47.50, 19.05).build(),
                record(4L, 47.50, 19.041).usageCost("free").operational(false).build()
        ));

        List<NearestStation> rows = core.nearestOperationalWithCost(GeoPoint.of(47.50, 19.04), 5);
        assertEquals(List.of(1L, 2L), rows.stream().map(r -> r.getStation().id()).toList());
        assertEquals(0.0, rows.get(0).getDistanceKm());

        double expectedKm = GeometryDistance.distanceKm(
                WebMercatorProjection.project(47.50, 19.04),
                WebMercatorProjection.project(47.52, 19.08)
        );
        assertEquals(expectedKm, rows.get(1).getDistanceKm(), 0.005);
        assertEquals(rows.get(1).getDistanceKm(), Math.round(rows.get(1).getDistanceKm() * 100.0) / 100.0, 1e-12);
    }

    @Test
    @DisplayName("Radius, range and coverage-gap queries")
    void testRadiusRangeAndGaps() {
        StationCore core = newCore();
        core.load(threeStations());

        List<NearestMatch> nearby = core.withinRadius(GeoPoint.of(47.50, 19.04), 5.0, s -> true);
        assertEquals(List.of(1L, 2L), ids(nearby));

        LongSet inBox = core.rangeQuery(BoundingBox.ofGeo(GeoPoint.of(47.0, 18.5), GeoPoint.of(48.0, 19.5)));
        assertEquals(2, inBox.size());
        assertTrue(inBox.contains(1L) && inBox.contains(2L));

        List<GeoPoint> gaps = core.uncoveredPoints(List.of(
                GeoPoint.of(47.50, 19.05),
                GeoPoint.of(46.43, 20.33),
                GeoPoint.of(48.10, 20.79)
        ), 10.0);
        assertEquals(List.of(GeoPoint.of(48.10, 20.79)), gaps);
        assertThrows(IllegalArgumentException.class, () -> core.uncoveredPoints(List.of(), -1.0));
    }

    @Test
    @DisplayName("Radius is validated in km and saturates instead of overflowing")
    void testRadiusBounds() {
        StationCore core = newCore();
        core.load(threeStations());
        GeoPoint origin = GeoPoint.of(47.50, 19.04);

        assertEquals(List.of(1L, 2L, 3L), ids(core.withinRadius(origin, 1.0e306, s -> true)));
        assertTrue(core.uncoveredPoints(List.of(origin), 1.0e306).isEmpty());

        IllegalArgumentException negative = assertThrows(IllegalArgumentException.class,
                () -> core.withinRadius(origin, -1.0, s -> true));
        assertTrue(negative.getMessage().startsWith("radiusKm"));
        assertThrows(IllegalArgumentException.class,
                () -> core.withinRadius(origin, Double.POSITIVE_INFINITY, s -> true));
        assertThrows(IllegalArgumentException.class, () -> core.withinRadius(origin, Double.NaN, s -> true));
    }

    @Test
    @DisplayName("Queries on an empty core return empty results")
    void testEmptyCore() {
        StationCore core = newCore();
        assertTrue(core.nearestK(GeoPoint.of(47.0, 19.0), 3, s -> true).isEmpty());
        assertTrue(core.nearestOperationalWithCost(GeoPoint.of(47.0, 19.0), 3).isEmpty());
        assertEquals(List.of(GeoPoint.of(47.0, 19.0)), core.uncoveredPoints(List.of(GeoPoint.of(47.0, 19.0)), 100.0));
        assertTrue(core.analytics().topCities().isEmpty());
        assertTrue(core.validate().isEmpty());
        assertEquals(0, core.summary(5).getStationCount());
        assertTrue(core.verifyConsistency());
    }

    @Test
    @DisplayName("Expired deadline fails nearestK with TIMEOUT")
    void testNearestKTimeout() {
        StationCore core = newCore();
        core.load(threeStations());
        AtomicLong clock = new AtomicLong();
        QueryDeadline deadline = QueryDeadline.after(Duration.ofMillis(1), clock::get);
        clock.set(Duration.ofMillis(2).toNanos());

        StationCoreException ex = assertThrows(StationCoreException.class,
                () -> core.nearestK(GeoPoint.of(47.5, 19.0), 1, s -> true, deadline));
        assertEquals(StationCoreException.REASON_TIMEOUT, ex.getReasonCode());
        assertTrue(ex.getMessage().contains("nearestK"));
    }

    @Test
    @DisplayName("Analytics, validation and summary run over the current catalog")
    void testAnalyticsValidationAndSummary() {
        StationCore core = newCore();
        core.load(List.of(
                record(3L, 47.50, 19.04).city("Budapest").acPricePerKwh(120.0).build(),
                record(1L, 47.49, 19.03).city("Budapest").build(),
                record(2L, 46.25, 20.14).city("Szeged").acPricePerKwh(99.0).build()
        ));

        assertEquals("Budapest", core.analytics().topCities().get(0).getKey());
        List<DataIssue> issues = core.validate();
        assertEquals(1, issues.size());
        assertEquals(IssueKind.MISSING_PRICE, issues.get(0).getKind());

        CatalogSummary summary = core.summary(2);
        assertEquals(3, summary.getStationCount());
        assertEquals(3, summary.getIndexedCount());
        assertEquals(1, summary.getIndexHeight());
        assertEquals(List.of(1L, 2L), summary.getSample().stream().map(Station::id).toList());

        List<Long> scanned = new ArrayList<>();
        for (Station station : core.scan(s -> s.pricing().hasAcPrice())) {
            scanned.add(station.id());
        }
        assertEquals(List.of(2L, 3L), scanned);
    }

    // =====================================================================
    // CONCURRENCY
    // =====================================================================

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrency: readers never observe catalog and index out of step")
    void testConcurrentReadersAndWriter() throws Exception {
        StationCore core = newCore();
        core.load(randomRecords(new Random(42), 1L, 500));

        ExecutorService pool = Executors.newFixedThreadPool(5);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean failed = new AtomicBoolean(false);
        try {
            List<Future<?>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> {
                Random random = new Random(7);
                start.await();
                for (int i = 0; i < 400; i++) {
                    long id = 1 + random.nextInt(600);
                    if (random.nextInt(5) == 0) {
                        core.remove(id);
                    } else {
                        core.upsert(record(id, 45.8 + random.nextDouble() * 2.6, 16.2 + random.nextDouble() * 6.6).build());
                    }
                }
                return null;
            }));
            for (int reader = 0; reader < 4; reader++) {
                long seed = reader;
                futures.add(pool.submit(() -> {
                    Random random = new Random(seed);
                    start.await();
                    for (int i = 0; i < 400; i++) {
                        GeoPoint query = GeoPoint.of(45.8 + random.nextDouble() * 2.6, 16.2 + random.nextDouble() * 6.6);
                        // predicate resolves every candidate id against the catalog
                        List<NearestMatch> matches = core.nearestK(query, 5, s -> true);
                        for (int m = 1; m < matches.size(); m++) {
                            if (matches.get(m - 1).distanceMeters() > matches.get(m).distanceMeters()) {
                                failed.set(true);
                            }
                        }
                        if (matches.size() != 5) {
                            failed.set(true);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertFalse(failed.get(), "nearestK returned a short or out-of-order result");
        assertTrue(core.verifyConsistency());
    }

    private static List<Long> ids(List<NearestMatch> matches) {
        return matches.stream().map(NearestMatch::stationId).toList();
    }
}
