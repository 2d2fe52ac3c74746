package org.evgrid.spatial;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.evgrid.geometry.BoundingBox;
import org.evgrid.geometry.GeometryDistance;
import org.evgrid.geometry.PlanarPoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.LongPredicate;
import java.util.function.ToDoubleFunction;

/**
 * R-tree over station planar points.
 * <p>
 * Supports Sort-Tile-Recursive bulk loading, Guttman-style incremental insert
 * with quadratic split, delete with tree condensation, range queries and
 * best-first nearest-K search.
 * </p>
 * <ul>
 * <li>Every entry lies inside the bounding box of each of its ancestors.</li>
 * <li>All leaves sit at the same depth, so height is logarithmic in size.</li>
 * <li>Nearest-K ordering is ascending distance with ties broken by lower id.</li>
 * </ul>
 * <p>
 * Not thread-safe. Concurrent readers are safe only while no writer runs;
 * {@code StationCore} provides that guarantee with a read-write lock.
 * </p>
 */
public final class StationRTree {

    private static final Comparator<Candidate> FARTHEST_FIRST = (a, b) -> {
        int byDistance = Double.compare(b.distanceSquared, a.distanceSquared);
        return byDistance != 0 ? byDistance : Long.compare(b.id, a.id);
    };

    private static final Comparator<Candidate> NEAREST_FIRST = FARTHEST_FIRST.reversed();

    private final int maxEntries;
    private final int minEntries;
    private final Long2ObjectOpenHashMap<PlanarPoint> pointsById;

    private Node root;

    @Getter
    @Accessors(fluent = true)
    private final IndexConfig config;

    public StationRTree() {
        this(IndexConfig.defaults());
    }

    public StationRTree(IndexConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        this.maxEntries = config.getMaxEntries();
        this.minEntries = config.minEntries();
        this.pointsById = new Long2ObjectOpenHashMap<>();
        this.root = Node.leaf();
    }

    /**
     * One indexed (id, planar point) pair, used for bulk loading.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class Entry {
        private final long id;
        private final PlanarPoint point;

        public Entry(long id, PlanarPoint point) {
            this.id = id;
            this.point = Objects.requireNonNull(point, "point");
        }
    }

    // =====================================================================
    // MAINTENANCE
    // =====================================================================

    /**
     * Replaces the whole index with an STR bulk-loaded tree over {@code entries}.
     *
     * @throws IllegalArgumentException when an id appears twice.
     */
    public void build(List<Entry> entries) {
        Objects.requireNonNull(entries, "entries");
        Long2ObjectOpenHashMap<PlanarPoint> points = new Long2ObjectOpenHashMap<>(entries.size());
        for (Entry entry : entries) {
            Objects.requireNonNull(entry, "entry");
            if (points.put(entry.id, entry.point) != null) {
                throw new IllegalArgumentException("duplicate id in bulk build: " + entry.id);
            }
        }

        pointsById.clear();
        pointsById.putAll(points);
        if (entries.isEmpty()) {
            root = Node.leaf();
            return;
        }

        List<Node> level = new ArrayList<>();
        for (List<Entry> chunk : strPartition(new ArrayList<>(entries), e -> e.point.x(), e -> e.point.y())) {
            Node leaf = Node.leaf();
            leaf.entries.addAll(chunk);
            leaf.recomputeBox();
            level.add(leaf);
        }
        while (level.size() > 1) {
            List<Node> parents = new ArrayList<>();
            for (List<Node> chunk : strPartition(level, n -> n.box.centerX(), n -> n.box.centerY())) {
                Node parent = Node.internal();
                for (Node child : chunk) {
                    parent.addChild(child);
                }
                parent.recomputeBox();
                parents.add(parent);
            }
            level = parents;
        }
        root = level.get(0);
        root.parent = null;
    }

    /**
     * Inserts a station point. An id that is already indexed is moved to the new point.
     */
    public void insert(long id, PlanarPoint point) {
        Objects.requireNonNull(point, "point");
        if (pointsById.containsKey(id)) {
            remove(id);
        }
        insertEntry(new Entry(id, point));
        pointsById.put(id, point);
    }

    /**
     * Removes a station point.
     *
     * @return true when the id was indexed.
     */
    public boolean remove(long id) {
        PlanarPoint point = pointsById.get(id);
        if (point == null) {
            return false;
        }
        Node leaf = findLeaf(root, id, point);
        if (leaf == null) {
            throw new IllegalStateException("index entry for id " + id + " not found in tree");
        }
        leaf.removeEntry(id);
        pointsById.remove(id);
        condense(leaf);
        return true;
    }

    public void clear() {
        pointsById.clear();
        root = Node.leaf();
    }

    // =====================================================================
    // QUERIES
    // =====================================================================

    /**
     * Finds up to {@code k} ids accepted by {@code predicate}, nearest first.
     *
     * <p>Best-first branch-and-bound: nodes are expanded in order of their box's
     * minimum distance to the query, and expansion stops once that distance exceeds
     * the current k-th best. An empty list is returned when nothing qualifies.</p>
     */
    public List<NearestMatch> nearestK(PlanarPoint query, int k, LongPredicate predicate) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(predicate, "predicate");
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0, got " + k);
        }
        if (pointsById.isEmpty()) {
            return List.of();
        }

        double qx = query.x();
        double qy = query.y();
        PriorityQueue<Candidate> best = new PriorityQueue<>(Math.min(k, pointsById.size()) + 1, FARTHEST_FIRST);
        PriorityQueue<NodeDistance> frontier = new PriorityQueue<>(Comparator.comparingDouble(NodeDistance::minDistanceSquared));
        frontier.add(new NodeDistance(root, root.box.minDistanceSquared(qx, qy)));

        while (!frontier.isEmpty()) {
            NodeDistance next = frontier.poll();
            if (best.size() == k && next.minDistanceSquared > best.peek().distanceSquared) {
                break;
            }
            Node node = next.node;
            if (node.leaf) {
                for (Entry entry : node.entries) {
                    if (!predicate.test(entry.id)) {
                        continue;
                    }
                    double d = GeometryDistance.squaredDistance(qx, qy, entry.point.x(), entry.point.y());
                    offer(best, k, new Candidate(entry.id, d));
                }
                continue;
            }
            for (Node child : node.children) {
                double minDistance = child.box.minDistanceSquared(qx, qy);
                if (best.size() < k || minDistance <= best.peek().distanceSquared) {
                    frontier.add(new NodeDistance(child, minDistance));
                }
            }
        }
        return toMatches(best);
    }

    /**
     * Finds every id accepted by {@code predicate} within {@code radiusMeters}, nearest first.
     */
    public List<NearestMatch> withinRadius(PlanarPoint query, double radiusMeters, LongPredicate predicate) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(predicate, "predicate");
        if (!(radiusMeters >= 0.0d) || Double.isInfinite(radiusMeters)) {
            throw new IllegalArgumentException("radiusMeters must be finite and >= 0, got " + radiusMeters);
        }
        double limit = radiusMeters * radiusMeters;
        List<Candidate> hits = new ArrayList<>();
        if (!pointsById.isEmpty()) {
            collectWithin(root, query.x(), query.y(), limit, predicate, hits);
        }
        hits.sort(NEAREST_FIRST);
        List<NearestMatch> matches = new ArrayList<>(hits.size());
        for (Candidate hit : hits) {
            matches.add(new NearestMatch(hit.id, Math.sqrt(hit.distanceSquared)));
        }
        return matches;
    }

    /**
     * Returns ids whose point lies inside {@code box} (edges inclusive).
     */
    public LongSet rangeQuery(BoundingBox box) {
        Objects.requireNonNull(box, "box");
        LongOpenHashSet result = new LongOpenHashSet();
        if (!pointsById.isEmpty()) {
            collectRange(root, box, result);
        }
        return result;
    }

    public int size() {
        return pointsById.size();
    }

    public boolean isEmpty() {
        return pointsById.isEmpty();
    }

    public boolean contains(long id) {
        return pointsById.containsKey(id);
    }

    /**
     * Indexed point of {@code id}, or null when not indexed.
     */
    public PlanarPoint pointOf(long id) {
        return pointsById.get(id);
    }

    /**
     * Snapshot of indexed ids.
     */
    public LongSet ids() {
        return new LongOpenHashSet(pointsById.keySet());
    }

    /**
     * Number of levels; a tree holding only a root leaf has height 1.
     */
    public int height() {
        int height = 1;
        Node node = root;
        while (!node.leaf) {
            node = node.children.get(0);
            height++;
        }
        return height;
    }

    /**
     * Bounding box of all indexed points, or null when empty.
     */
    public BoundingBox bounds() {
        return pointsById.isEmpty() ? null : root.box;
    }

    /**
     * Verifies structural invariants.
     *
     * @throws IllegalStateException naming the first violation found.
     */
    public void checkInvariants() {
        if (root.parent != null) {
            throw new IllegalStateException("root must not have a parent");
        }
        Long2ObjectOpenHashMap<PlanarPoint> seen = new Long2ObjectOpenHashMap<>(pointsById.size());
        int leafDepth = checkNode(root, null, 1, seen);
        if (leafDepth != height()) {
            throw new IllegalStateException("leaf depth " + leafDepth + " differs from height " + height());
        }
        if (seen.size() != pointsById.size()) {
            throw new IllegalStateException(
                    "tree holds " + seen.size() + " entries but id map holds " + pointsById.size());
        }
        for (Long2ObjectMap.Entry<PlanarPoint> entry : seen.long2ObjectEntrySet()) {
            PlanarPoint mapped = pointsById.get(entry.getLongKey());
            if (!entry.getValue().equals(mapped)) {
                throw new IllegalStateException("tree point for id " + entry.getLongKey() + " differs from id map");
            }
        }
    }

    @Override
    public String toString() {
        return "StationRTree[size=" + pointsById.size() + ", height=" + height() + ", maxEntries=" + maxEntries + "]";
    }

    // =====================================================================
    // INTERNALS
    // =====================================================================

    private void insertEntry(Entry entry) {
        BoundingBox entryBox = BoundingBox.of(entry.point);
        Node leaf = chooseLeaf(entryBox);
        leaf.entries.add(entry);
        leaf.box = leaf.box == null ? entryBox : leaf.box.union(entryBox);

        Node split = leaf.size() > maxEntries ? splitLeaf(leaf) : null;
        adjustTree(leaf, split);
    }

    private Node chooseLeaf(BoundingBox entryBox) {
        Node node = root;
        while (!node.leaf) {
            Node bestChild = null;
            double bestEnlargement = Double.POSITIVE_INFINITY;
            double bestArea = Double.POSITIVE_INFINITY;
            for (Node child : node.children) {
                double enlargement = child.box.enlargement(entryBox);
                double area = child.box.area();
                if (enlargement < bestEnlargement || (enlargement == bestEnlargement && area < bestArea)) {
                    bestChild = child;
                    bestEnlargement = enlargement;
                    bestArea = area;
                }
            }
            node = bestChild;
        }
        return node;
    }

    private void adjustTree(Node node, Node split) {
        while (node != root) {
            Node parent = node.parent;
            parent.box = parent.box.union(node.box);
            Node parentSplit = null;
            if (split != null) {
                parent.addChild(split);
                parent.box = parent.box.union(split.box);
                if (parent.size() > maxEntries) {
                    parentSplit = splitInternal(parent);
                }
            }
            node = parent;
            split = parentSplit;
        }
        if (split != null) {
            Node newRoot = Node.internal();
            newRoot.addChild(root);
            newRoot.addChild(split);
            newRoot.recomputeBox();
            root = newRoot;
        }
    }

    private Node splitLeaf(Node leaf) {
        List<Entry> all = new ArrayList<>(leaf.entries);
        List<BoundingBox> boxes = new ArrayList<>(all.size());
        for (Entry entry : all) {
            boxes.add(BoundingBox.of(entry.point));
        }
        boolean[] toSibling = quadraticSplit(boxes);
        Node sibling = Node.leaf();
        leaf.entries.clear();
        for (int i = 0; i < all.size(); i++) {
            (toSibling[i] ? sibling : leaf).entries.add(all.get(i));
        }
        leaf.recomputeBox();
        sibling.recomputeBox();
        return sibling;
    }

    private Node splitInternal(Node node) {
        List<Node> all = new ArrayList<>(node.children);
        List<BoundingBox> boxes = new ArrayList<>(all.size());
        for (Node child : all) {
            boxes.add(child.box);
        }
        boolean[] toSibling = quadraticSplit(boxes);
        Node sibling = Node.internal();
        node.children.clear();
        for (int i = 0; i < all.size(); i++) {
            (toSibling[i] ? sibling : node).addChild(all.get(i));
        }
        node.recomputeBox();
        sibling.recomputeBox();
        return sibling;
    }

    /**
     * Guttman quadratic split. Returns, per item, whether it moves to the new sibling.
     */
    private boolean[] quadraticSplit(List<BoundingBox> boxes) {
        int n = boxes.size();
        int seedA = 0;
        int seedB = 1;
        double worstWaste = Double.NEGATIVE_INFINITY;
        double widestSeparation = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                BoundingBox a = boxes.get(i);
                BoundingBox b = boxes.get(j);
                double waste = a.union(b).area() - a.area() - b.area();
                double separation = GeometryDistance.squaredDistance(a.centerX(), a.centerY(), b.centerX(), b.centerY());
                if (waste > worstWaste || (waste == worstWaste && separation > widestSeparation)) {
                    worstWaste = waste;
                    widestSeparation = separation;
                    seedA = i;
                    seedB = j;
                }
            }
        }

        boolean[] toSibling = new boolean[n];
        boolean[] assigned = new boolean[n];
        assigned[seedA] = true;
        assigned[seedB] = true;
        toSibling[seedB] = true;
        BoundingBox boxA = boxes.get(seedA);
        BoundingBox boxB = boxes.get(seedB);
        int countA = 1;
        int countB = 1;
        int remaining = n - 2;

        while (remaining > 0) {
            if (countA + remaining == minEntries) {
                for (int i = 0; i < n; i++) {
                    if (!assigned[i]) {
                        assigned[i] = true;
                        countA++;
                    }
                }
                break;
            }
            if (countB + remaining == minEntries) {
                for (int i = 0; i < n; i++) {
                    if (!assigned[i]) {
                        assigned[i] = true;
                        toSibling[i] = true;
                        countB++;
                    }
                }
                break;
            }

            int pick = -1;
            double pickDifference = Double.NEGATIVE_INFINITY;
            double pickGrowA = 0.0d;
            double pickGrowB = 0.0d;
            for (int i = 0; i < n; i++) {
                if (assigned[i]) {
                    continue;
                }
                double growA = boxA.enlargement(boxes.get(i));
                double growB = boxB.enlargement(boxes.get(i));
                double difference = Math.abs(growA - growB);
                if (difference > pickDifference) {
                    pick = i;
                    pickDifference = difference;
                    pickGrowA = growA;
                    pickGrowB = growB;
                }
            }

            boolean intoB;
            if (pickGrowA != pickGrowB) {
                intoB = pickGrowB < pickGrowA;
            } else if (boxA.area() != boxB.area()) {
                intoB = boxB.area() < boxA.area();
            } else {
                intoB = countB < countA;
            }
            assigned[pick] = true;
            remaining--;
            if (intoB) {
                toSibling[pick] = true;
                boxB = boxB.union(boxes.get(pick));
                countB++;
            } else {
                boxA = boxA.union(boxes.get(pick));
                countA++;
            }
        }
        return toSibling;
    }

    private Node findLeaf(Node node, long id, PlanarPoint point) {
        if (node.box == null || !node.box.contains(point)) {
            return null;
        }
        if (node.leaf) {
            for (Entry entry : node.entries) {
                if (entry.id == id) {
                    return node;
                }
            }
            return null;
        }
        for (Node child : node.children) {
            Node found = findLeaf(child, id, point);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Dissolves under-full nodes on the path from {@code leaf} to the root and
     * re-inserts their entries, then shortens the tree if the root has one child.
     */
    private void condense(Node leaf) {
        List<Entry> orphans = new ArrayList<>();
        Node node = leaf;
        while (node != root) {
            Node parent = node.parent;
            if (node.size() < minEntries) {
                parent.children.remove(node);
                node.parent = null;
                collectEntries(node, orphans);
            } else {
                node.recomputeBox();
            }
            node = parent;
        }
        root.recomputeBox();
        while (!root.leaf && root.children.size() == 1) {
            root = root.children.get(0);
            root.parent = null;
        }
        if (!root.leaf && root.children.isEmpty()) {
            root = Node.leaf();
        }
        for (Entry orphan : orphans) {
            insertEntry(orphan);
        }
    }

    private static void collectEntries(Node node, List<Entry> sink) {
        if (node.leaf) {
            sink.addAll(node.entries);
            return;
        }
        for (Node child : node.children) {
            collectEntries(child, sink);
        }
    }

    private static void collectRange(Node node, BoundingBox box, LongOpenHashSet sink) {
        if (!box.intersects(node.box)) {
            return;
        }
        if (node.leaf) {
            for (Entry entry : node.entries) {
                if (box.contains(entry.point)) {
                    sink.add(entry.id);
                }
            }
            return;
        }
        for (Node child : node.children) {
            collectRange(child, box, sink);
        }
    }

    private static void collectWithin(
            Node node,
            double qx,
            double qy,
            double limitSquared,
            LongPredicate predicate,
            List<Candidate> sink
    ) {
        if (node.box.minDistanceSquared(qx, qy) > limitSquared) {
            return;
        }
        if (node.leaf) {
            for (Entry entry : node.entries) {
                double d = GeometryDistance.squaredDistance(qx, qy, entry.point.x(), entry.point.y());
                if (d <= limitSquared && predicate.test(entry.id)) {
                    sink.add(new Candidate(entry.id, d));
                }
            }
            return;
        }
        for (Node child : node.children) {
            collectWithin(child, qx, qy, limitSquared, predicate, sink);
        }
    }

    private int checkNode(Node node, Node expectedParent, int depth, Long2ObjectOpenHashMap<PlanarPoint> seen) {
        if (node.parent != expectedParent) {
            throw new IllegalStateException("broken parent link at depth " + depth);
        }
        if (node.size() > maxEntries) {
            throw new IllegalStateException("node at depth " + depth + " exceeds capacity: " + node.size());
        }
        if (node != root && node.size() == 0) {
            throw new IllegalStateException("empty non-root node at depth " + depth);
        }
        if (node.leaf) {
            for (Entry entry : node.entries) {
                if (!node.box.contains(entry.point)) {
                    throw new IllegalStateException("entry " + entry.id + " outside its leaf bounding box");
                }
                if (seen.put(entry.id, entry.point) != null) {
                    throw new IllegalStateException("id " + entry.id + " indexed twice");
                }
                checkAncestors(node.parent, entry);
            }
            return depth;
        }
        int leafDepth = -1;
        for (Node child : node.children) {
            if (!node.box.contains(child.box)) {
                throw new IllegalStateException("child box escapes parent box at depth " + depth);
            }
            int childDepth = checkNode(child, node, depth + 1, seen);
            if (leafDepth >= 0 && childDepth != leafDepth) {
                throw new IllegalStateException("leaves at uneven depths " + leafDepth + " and " + childDepth);
            }
            leafDepth = childDepth;
        }
        return leafDepth;
    }

    private static void checkAncestors(Node ancestor, Entry entry) {
        while (ancestor != null) {
            if (!ancestor.box.contains(entry.point)) {
                throw new IllegalStateException("entry " + entry.id + " outside an ancestor bounding box");
            }
            ancestor = ancestor.parent;
        }
    }

    private static void offer(PriorityQueue<Candidate> best, int k, Candidate candidate) {
        if (best.size() < k) {
            best.add(candidate);
            return;
        }
        if (FARTHEST_FIRST.compare(candidate, best.peek()) > 0) {
            best.poll();
            best.add(candidate);
        }
    }

    private static List<NearestMatch> toMatches(PriorityQueue<Candidate> best) {
        List<Candidate> ordered = new ArrayList<>(best);
        ordered.sort(NEAREST_FIRST);
        List<NearestMatch> matches = new ArrayList<>(ordered.size());
        for (Candidate candidate : ordered) {
            matches.add(new NearestMatch(candidate.id, Math.sqrt(candidate.distanceSquared)));
        }
        return matches;
    }

    /**
     * Sort-Tile-Recursive grouping: sort by x, cut into vertical slices, sort each
     * slice by y and cut into node-sized runs.
     */
    private <T> List<List<T>> strPartition(
            List<T> items,
            ToDoubleFunction<T> xOf,
            ToDoubleFunction<T> yOf
    ) {
        int nodeCount = (items.size() + maxEntries - 1) / maxEntries;
        int sliceCount = (int) Math.ceil(Math.sqrt(nodeCount));
        int sliceSize = sliceCount * maxEntries;

        items.sort(Comparator.comparingDouble(xOf));
        List<List<T>> groups = new ArrayList<>(nodeCount);
        for (int sliceStart = 0; sliceStart < items.size(); sliceStart += sliceSize) {
            List<T> slice = new ArrayList<>(items.subList(sliceStart, Math.min(items.size(), sliceStart + sliceSize)));
            slice.sort(Comparator.comparingDouble(yOf));
            for (int start = 0; start < slice.size(); start += maxEntries) {
                groups.add(new ArrayList<>(slice.subList(start, Math.min(slice.size(), start + maxEntries))));
            }
        }
        return groups;
    }

    private static final class Node {
        final boolean leaf;
        final List<Entry> entries;
        final List<Node> children;
        Node parent;
        BoundingBox box;

        private Node(boolean leaf) {
            this.leaf = leaf;
            this.entries = leaf ? new ArrayList<>() : List.of();
            this.children = leaf ? List.of() : new ArrayList<>();
        }

        static Node leaf() {
            return new Node(true);
        }

        static Node internal() {
            return new Node(false);
        }

        int size() {
            return leaf ? entries.size() : children.size();
        }

        void addChild(Node child) {
            children.add(child);
            child.parent = this;
        }

        void removeEntry(long id) {
            for (int i = 0; i < entries.size(); i++) {
                if (entries.get(i).id == id) {
                    entries.remove(i);
                    return;
                }
            }
        }

        void recomputeBox() {
            BoundingBox merged = null;
            if (leaf) {
                for (Entry entry : entries) {
                    BoundingBox entryBox = BoundingBox.of(entry.point);
                    merged = merged == null ? entryBox : merged.union(entryBox);
                }
            } else {
                for (Node child : children) {
                    merged = merged == null ? child.box : merged.union(child.box);
                }
            }
            box = merged;
        }
    }

    private static final class NodeDistance {
        final Node node;
        final double minDistanceSquared;

        NodeDistance(Node node, double minDistanceSquared) {
            this.node = node;
            this.minDistanceSquared = minDistanceSquared;
        }

        double minDistanceSquared() {
            return minDistanceSquared;
        }
    }

    private static final class Candidate {
        final long id;
        final double distanceSquared;

        Candidate(long id, double distanceSquared) {
            this.id = id;
            this.distanceSquared = distanceSquared;
        }
    }
}
