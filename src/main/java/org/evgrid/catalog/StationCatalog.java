package org.evgrid.catalog;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Id-keyed collection of live stations: exactly one station per id.
 *
 * <p>Not thread-safe on its own; {@code StationCore} serializes writers and
 * lets readers take snapshots under a shared lock.</p>
 */
public final class StationCatalog {
    private final Long2ObjectOpenHashMap<Station> stationsById = new Long2ObjectOpenHashMap<>();

    /**
     * Inserts or fully replaces the station with the same id.
     *
     * @return the replaced station, or null when the id was new.
     */
    public Station upsert(Station station) {
        Objects.requireNonNull(station, "station");
        return stationsById.put(station.id(), station);
    }

    /**
     * Removes a station.
     *
     * @return the removed station, or null when absent.
     */
    public Station remove(long id) {
        return stationsById.remove(id);
    }

    public Optional<Station> get(long id) {
        return Optional.ofNullable(stationsById.get(id));
    }

    public boolean contains(long id) {
        return stationsById.containsKey(id);
    }

    public int size() {
        return stationsById.size();
    }

    public void clear() {
        stationsById.clear();
    }

    /**
     * Copies the current contents into an immutable, id-ordered snapshot.
     */
    public CatalogSnapshot snapshot() {
        return CatalogSnapshot.of(stationsById.values());
    }

    /**
     * Lazy filtered iteration over the state at call time.
     */
    public Iterable<Station> scan(Predicate<? super Station> predicate) {
        return snapshot().scan(predicate);
    }

    /**
     * Stable grouping of {@code records}; see {@link CatalogSnapshot#groupBy(Function, Iterable)}.
     */
    public <K> Map<K, List<Station>> groupBy(Function<? super Station, ? extends K> keyFn, Iterable<Station> records) {
        return CatalogSnapshot.groupBy(keyFn, records);
    }
}
