package org.evgrid.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Immutable point-in-time view of the catalog, ordered by station id.
 *
 * <p>All analytics and validation run on a snapshot, so later catalog
 * mutations never affect a computation already in progress.</p>
 */
public final class CatalogSnapshot {
    private static final CatalogSnapshot EMPTY = new CatalogSnapshot(List.of());

    private final List<Station> stations;

    private CatalogSnapshot(List<Station> sortedStations) {
        this.stations = Collections.unmodifiableList(sortedStations);
    }

    /**
     * Creates a snapshot from any collection; the stations are copied and sorted by id.
     */
    public static CatalogSnapshot of(Iterable<Station> stations) {
        Objects.requireNonNull(stations, "stations");
        List<Station> copy = new ArrayList<>();
        for (Station station : stations) {
            copy.add(Objects.requireNonNull(station, "station"));
        }
        copy.sort(Comparator.comparingLong(Station::id));
        return new CatalogSnapshot(copy);
    }

    public static CatalogSnapshot empty() {
        return EMPTY;
    }

    public List<Station> stations() {
        return stations;
    }

    public int size() {
        return stations.size();
    }

    public boolean isEmpty() {
        return stations.isEmpty();
    }

    public Stream<Station> stream() {
        return stations.stream();
    }

    /**
     * Restartable lazy filter over this snapshot. Each {@code iterator()} call starts over.
     */
    public Iterable<Station> scan(Predicate<? super Station> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return () -> new FilteringIterator(stations.iterator(), predicate);
    }

    /**
     * Filtered sub-snapshot.
     */
    public CatalogSnapshot filter(Predicate<? super Station> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        List<Station> kept = new ArrayList<>();
        for (Station station : stations) {
            if (predicate.test(station)) {
                kept.add(station);
            }
        }
        return new CatalogSnapshot(kept);
    }

    /**
     * Stable partition: keys appear in first-seen order and stations keep input order
     * within each group. A null key forms its own group.
     */
    public static <K> Map<K, List<Station>> groupBy(
            Function<? super Station, ? extends K> keyFn,
            Iterable<Station> records
    ) {
        Objects.requireNonNull(keyFn, "keyFn");
        Objects.requireNonNull(records, "records");
        LinkedHashMap<K, List<Station>> groups = new LinkedHashMap<>();
        for (Station station : records) {
            groups.computeIfAbsent(keyFn.apply(station), ignored -> new ArrayList<>()).add(station);
        }
        return groups;
    }

    public <K> Map<K, List<Station>> groupBy(Function<? super Station, ? extends K> keyFn) {
        return groupBy(keyFn, stations);
    }

    private static final class FilteringIterator implements Iterator<Station> {
        private final Iterator<Station> source;
        private final Predicate<? super Station> predicate;
        private Station next;

        FilteringIterator(Iterator<Station> source, Predicate<? super Station> predicate) {
            this.source = source;
            this.predicate = predicate;
        }

        @Override
        public boolean hasNext() {
            while (next == null && source.hasNext()) {
                Station candidate = source.next();
                if (predicate.test(candidate)) {
                    next = candidate;
                }
            }
            return next != null;
        }

        @Override
        public Station next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Station current = next;
            next = null;
            return current;
        }
    }
}
