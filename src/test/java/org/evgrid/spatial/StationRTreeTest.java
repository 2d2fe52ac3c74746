package org.evgrid.spatial;

import it.unimi.dsi.fastutil.longs.LongSet;
import org.evgrid.geometry.BoundingBox;
import org.evgrid.geometry.GeometryDistance;
import org.evgrid.geometry.PlanarPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.LongPredicate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Station R-Tree Tests")
class StationRTreeTest {

    private record Expected(long id, double distanceSquared) {
        double distance() {
            return Math.sqrt(distanceSquared);
        }
    }

    private static final IndexConfig SMALL_NODES = IndexConfig.builder().maxEntries(4).build();

    // =====================================================================
    // CORRECTNESS TESTS
    // =====================================================================

    @Test
    @DisplayName("Correctness: empty tree answers every query with nothing")
    void testEmptyTree() {
        StationRTree tree = new StationRTree(SMALL_NODES);
        assertTrue(tree.nearestK(new PlanarPoint(0.0, 0.0), 3, id -> true).isEmpty());
        assertTrue(tree.withinRadius(new PlanarPoint(0.0, 0.0), 1000.0, id -> true).isEmpty());
        assertTrue(tree.rangeQuery(new BoundingBox(-1.0, -1.0, 1.0, 1.0)).isEmpty());
        assertEquals(1, tree.height());
        assertNull(tree.bounds());
        assertDoesNotThrow(tree::checkInvariants);
    }

    @Test
    @DisplayName("Correctness: nearestK matches brute force on random points")
    void testNearestKAgainstBruteForce() {
        Random random = new Random(42);
        List<StationRTree.Entry> entries = randomEntries(random, 600);
        StationRTree tree = new StationRTree(SMALL_NODES);
        tree.build(entries);
        tree.checkInvariants();

        for (int q = 0; q < 100; q++) {
            PlanarPoint query = new PlanarPoint(random.nextDouble() * 100_000.0, random.nextDouble() * 100_000.0);
            int k = 1 + random.nextInt(12);
            List<NearestMatch> actual = tree.nearestK(query, k, id -> id % 3 != 0);
            List<Expected> expected = bruteForce(entries, query, id -> id % 3 != 0);

            assertEquals(Math.min(k, expected.size()), actual.size());
            for (int i = 0; i < actual.size(); i++) {
                assertEquals(expected.get(i).id(), actual.get(i).stationId(), "rank " + i);
                assertEquals(expected.get(i).distance(), actual.get(i).distanceMeters(), 1e-9);
            }
        }
    }

    @Test
    @DisplayName("Correctness: equidistant stations are ordered by ascending id")
    void testTieBreakById() {
        StationRTree tree = new StationRTree(SMALL_NODES);
        tree.insert(9L, new PlanarPoint(10.0, 0.0));
        tree.insert(4L, new PlanarPoint(-10.0, 0.0));
        tree.insert(7L, new PlanarPoint(0.0, 10.0));
        tree.insert(2L, new PlanarPoint(0.0, -10.0));
        tree.insert(1L, new PlanarPoint(50.0, 50.0));

        List<NearestMatch> matches = tree.nearestK(new PlanarPoint(0.0, 0.0), 3, id -> true);
        assertEquals(List.of(2L, 4L, 7L), matches.stream().map(NearestMatch::stationId).toList());
        assertEquals(10.0, matches.get(0).distanceMeters(), 1e-12);
        assertEquals(0.01, matches.get(0).distanceKm(), 1e-12);
    }

    @Test
    @DisplayName("Correctness: k larger than the qualifying set returns everything that qualifies")
    void testKExceedsSize() {
        StationRTree tree = new StationRTree(SMALL_NODES);
        tree.insert(1L, new PlanarPoint(0.0, 0.0));
        tree.insert(2L, new PlanarPoint(5.0, 0.0));
        tree.insert(3L, new PlanarPoint(9.0, 0.0));

        assertEquals(3, tree.nearestK(new PlanarPoint(0.0, 0.0), 50, id -> true).size());
        assertEquals(List.of(3L), tree.nearestK(new PlanarPoint(0.0, 0.0), 50, id -> id == 3L)
                .stream().map(NearestMatch::stationId).toList());
        assertTrue(tree.nearestK(new PlanarPoint(0.0, 0.0), 2, id -> false).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> tree.nearestK(new PlanarPoint(0.0, 0.0), 0, id -> true));
    }

    @Test
    @DisplayName("Correctness: withinRadius and rangeQuery agree with brute force")
    void testRadiusAndRange() {
        Random random = new Random(42);
        List<StationRTree.Entry> entries = randomEntries(random, 400);
        StationRTree tree = new StationRTree(SMALL_NODES);
        for (StationRTree.Entry entry : entries) {
            tree.insert(entry.id(), entry.point());
        }
        tree.checkInvariants();

        PlanarPoint center = new PlanarPoint(50_000.0, 50_000.0);
        double radius = 20_000.0;
        List<NearestMatch> within = tree.withinRadius(center, radius, id -> true);
        List<Expected> expected = bruteForce(entries, center, id -> true).stream()
                .filter(e -> e.distanceSquared() <= radius * radius)
                .toList();
        assertEquals(expected.stream().map(Expected::id).toList(),
                within.stream().map(NearestMatch::stationId).toList());

        BoundingBox box = new BoundingBox(10_000.0, 20_000.0, 60_000.0, 45_000.0);
        LongSet inBox = tree.rangeQuery(box);
        long expectedInBox = entries.stream().filter(e -> box.contains(e.point())).count();
        assertEquals(expectedInBox, inBox.size());
        for (StationRTree.Entry entry : entries) {
            assertEquals(box.contains(entry.point()), inBox.contains(entry.id()));
        }
    }

    // =====================================================================
    // MAINTENANCE TESTS
    // =====================================================================

    @Test
    @DisplayName("Maintenance: incremental inserts keep the tree balanced and logarithmic")
    void testInsertKeepsBalance() {
        Random random = new Random(42);
        StationRTree tree = new StationRTree(SMALL_NODES);
        int count = 2_000;
        for (long id = 0; id < count; id++) {
            tree.insert(id, new PlanarPoint(random.nextDouble() * 1e6, random.nextDouble() * 1e6));
        }
        tree.checkInvariants();
        assertEquals(count, tree.size());
        // min fill 2 bounds height by log2(n) + 1
        assertTrue(tree.height() <= (int) Math.ceil(Math.log(count) / Math.log(2)) + 1, "height " + tree.height());
        assertTrue(tree.height() >= 2);
    }

    @Test
    @DisplayName("Maintenance: removals condense the tree and keep queries exact")
    void testRemoveCondenses() {
        Random random = new Random(42);
        List<StationRTree.Entry> entries = randomEntries(random, 500);
        StationRTree tree = new StationRTree(SMALL_NODES);
        tree.build(entries);

        List<StationRTree.Entry> remaining = new ArrayList<>();
        for (StationRTree.Entry entry : entries) {
            if (entry.id() % 4 == 0) {
                remaining.add(entry);
            } else {
                assertTrue(tree.remove(entry.id()));
            }
        }
        tree.checkInvariants();
        assertEquals(remaining.size(), tree.size());
        assertFalse(tree.remove(1L));
        assertFalse(tree.contains(1L));

        PlanarPoint query = new PlanarPoint(30_000.0, 70_000.0);
        List<Expected> expected = bruteForce(remaining, query, id -> true);
        List<NearestMatch> actual = tree.nearestK(query, 5, id -> true);
        for (int i = 0; i < 5; i++) {
            assertEquals(expected.get(i).id(), actual.get(i).stationId());
        }

        for (StationRTree.Entry entry : remaining) {
            assertTrue(tree.remove(entry.id()));
        }
        tree.checkInvariants();
        assertTrue(tree.isEmpty());
        assertEquals(1, tree.height());
    }

    @Test
    @DisplayName("Maintenance: re-inserting an id moves its point")
    void testInsertMovesExistingId() {
        StationRTree tree = new StationRTree(SMALL_NODES);
        tree.insert(1L, new PlanarPoint(0.0, 0.0));
        tree.insert(2L, new PlanarPoint(100.0, 0.0));
        tree.insert(1L, new PlanarPoint(200.0, 0.0));

        assertEquals(2, tree.size());
        assertEquals(new PlanarPoint(200.0, 0.0), tree.pointOf(1L));
        assertTrue(tree.rangeQuery(new BoundingBox(-1.0, -1.0, 1.0, 1.0)).isEmpty());
        assertEquals(2L, tree.nearestK(new PlanarPoint(0.0, 0.0), 1, id -> true).get(0).stationId());
        tree.checkInvariants();
    }

    @Test
    @DisplayName("Maintenance: bulk build rejects duplicate ids and replaces previous content")
    void testBuild() {
        StationRTree tree = new StationRTree(SMALL_NODES);
        tree.insert(99L, new PlanarPoint(1.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> tree.build(List.of(
                new StationRTree.Entry(1L, new PlanarPoint(0.0, 0.0)),
                new StationRTree.Entry(1L, new PlanarPoint(5.0, 5.0))
        )));
        assertTrue(tree.contains(99L), "failed build must leave the tree untouched");

        tree.build(randomEntries(new Random(42), 100));
        assertFalse(tree.contains(99L));
        assertEquals(100, tree.size());
        tree.checkInvariants();
        assertTrue(tree.height() >= 3);

        tree.build(List.of());
        assertTrue(tree.isEmpty());
        tree.clear();
        assertEquals(0, tree.ids().size());
    }

    @Test
    @DisplayName("Config: capacity below four is rejected")
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new StationRTree(IndexConfig.builder().maxEntries(3).build()));
        assertEquals(2, IndexConfig.builder().maxEntries(4).build().minEntries());
        assertEquals(6, IndexConfig.builder().maxEntries(16).build().minEntries());
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private static List<StationRTree.Entry> randomEntries(Random random, int count) {
        List<StationRTree.Entry> entries = new ArrayList<>(count);
        for (long id = 0; id < count; id++) {
            entries.add(new StationRTree.Entry(id, new PlanarPoint(
                    Math.floor(random.nextDouble() * 100_000.0),
                    Math.floor(random.nextDouble() * 100_000.0)
            )));
        }
        return entries;
    }

    private static List<Expected> bruteForce(
            List<StationRTree.Entry> entries,
            PlanarPoint query,
            LongPredicate predicate
    ) {
        List<Expected> all = new ArrayList<>();
        for (StationRTree.Entry entry : entries) {
            if (predicate.test(entry.id())) {
                all.add(new Expected(entry.id(), GeometryDistance.squaredDistance(
                        query.x(), query.y(), entry.point().x(), entry.point().y())));
            }
        }
        all.sort(Comparator.comparingDouble(Expected::distanceSquared).thenComparingLong(Expected::id));
        return all;
    }
}
