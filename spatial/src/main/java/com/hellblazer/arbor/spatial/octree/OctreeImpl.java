/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arbor.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arbor.spatial.octree;

import com.hellblazer.arbor.geometry.Point;
import com.hellblazer.arbor.geometry.Shape;
import com.hellblazer.arbor.spatial.Constants;
import com.hellblazer.arbor.spatial.SpatialSizingException;
import com.hellblazer.arbor.spatial.traversal.OctreeEntryIterator;
import com.hellblazer.arbor.spatial.traversal.OctreeValueIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Mutable octree. Every node is itself an octree: the root and each of its descendants are instances of this class.
 * <p>
 * A node owns a list of at most {@code capacity} entries and, once split, exactly eight children covering the octants
 * around its center. Inserting into a split node routes the entry to the child whose octant holds the entry's center
 * (a coordinate equal to the center counts as the high side). When a leaf's list grows past its capacity the leaf
 * splits and moves its entries down.
 * <p>
 * Bounds only grow. Every insertion widens the bounds of each node it passes through to cover the entry, so a node's
 * bounds always cover every entry beneath it. Queries rely on this: a child is visited only if its bounds can hold a
 * match. Removal never shrinks bounds and never merges children.
 * <p>
 * Queries walk the tree with an explicit stack rather than recursion.
 * <p>
 * Thread Safety: This class is NOT thread-safe.
 *
 * @param <T> the type of the stored values
 * @author hal.hildebrand
 */
public class OctreeImpl<T> implements MutableOctree<T> {

    private static final Logger log = LoggerFactory.getLogger(OctreeImpl.class);

    private final int                  capacity;
    private final int                  maxDepth;
    private final int                  depth;
    private final List<NodeData<T>>    data;
    private       OctreeImpl<T>[]      children;
    private       int                  size;
    private       boolean              bounded;
    private       double               minX, minY, minZ;
    private       double               maxX, maxY, maxZ;
    private       double               centerX, centerY, centerZ;

    public OctreeImpl() {
        this(OctreeConfig.defaults());
    }

    public OctreeImpl(int capacity) {
        this(OctreeConfig.defaults().withCapacity(capacity));
    }

    public OctreeImpl(Point min, Point max) {
        this(OctreeConfig.defaults().withBounds(min, max));
    }

    public OctreeImpl(Point min, Point max, int capacity) {
        this(OctreeConfig.defaults().withCapacity(capacity).withBounds(min, max));
    }

    public OctreeImpl(OctreeConfig config) {
        this(config.getCapacity(), config.getMaxDepth(), 0);
        if (config.hasBounds()) {
            setBounds(config.getMin(), config.getMax());
        }
    }

    private OctreeImpl(int capacity, int maxDepth, int depth) {
        this.capacity = capacity;
        this.maxDepth = maxDepth;
        this.depth = depth;
        this.data = new ArrayList<>(Math.min(capacity, 16));
    }

    @Override
    public void clear() {
        data.clear();
        children = null;
        size = 0;
    }

    @Override
    public boolean containsValue(T value) {
        var entries = entryIterator();
        while (entries.hasNext()) {
            if (Objects.equals(entries.next().getValue(), value)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<NodeData<T>> entryIterator() {
        return new OctreeEntryIterator<>(this);
    }

    @Override
    public Set<T> find(Point point) {
        return search(node -> point.isWithinBounds(node.getMin(), node.getMax()), entry -> entry.contains(point),
                      NodeData::getValue);
    }

    @Override
    public Set<T> findInRegion(Point min, Point max) {
        return search(node -> Shape.boxesIntersect(node.getMin(), node.getMax(), min, max),
                      entry -> entry.intersects(min, max), NodeData::getValue);
    }

    @Override
    public Set<T> findNearby(Point point, double radius) {
        double radiusSquared = radiusSquared(radius);
        return search(node -> Shape.boxDistanceSquared(node.getMin(), node.getMax(), point) <= radiusSquared,
                      entry -> entry.distanceSquared(point) <= radiusSquared, NodeData::getValue);
    }

    @Override
    public Set<NodeData<T>> findNodes(Point point) {
        return search(node -> point.isWithinBounds(node.getMin(), node.getMax()), entry -> entry.contains(point),
                      Function.identity());
    }

    @Override
    public Set<NodeData<T>> findNodesInRegion(Point min, Point max) {
        return search(node -> Shape.boxesIntersect(node.getMin(), node.getMax(), min, max),
                      entry -> entry.intersects(min, max), Function.identity());
    }

    @Override
    public Set<NodeData<T>> findNodesNearby(Point point, double radius) {
        double radiusSquared = radiusSquared(radius);
        return search(node -> Shape.boxDistanceSquared(node.getMin(), node.getMax(), point) <= radiusSquared,
                      entry -> entry.distanceSquared(point) <= radiusSquared, Function.identity());
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public Point getCenter() {
        checkBounds();
        return new Point(centerX, centerY, centerZ);
    }

    /**
     * The present children in octant order, empty until this node has split
     */
    public List<OctreeImpl<T>> getChildren() {
        return children == null ? Collections.emptyList() : Collections.unmodifiableList(Arrays.asList(children));
    }

    /**
     * @return the depth of this node, zero for the root
     */
    public int getDepth() {
        return depth;
    }

    /**
     * The entries held directly by this node, not by its children
     */
    public List<NodeData<T>> getLocalEntries() {
        return Collections.unmodifiableList(data);
    }

    @Override
    public Point getMax() {
        checkBounds();
        return new Point(maxX, maxY, maxZ);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    @Override
    public Point getMin() {
        checkBounds();
        return new Point(minX, minY, minZ);
    }

    @Override
    public boolean hasBounds() {
        return bounded;
    }

    public boolean hasChildren() {
        return children != null;
    }

    @Override
    public void insert(NodeData<T> entry) {
        Objects.requireNonNull(entry, "entry");
        growBounds(entry.getMin(), entry.getMax());

        if (children != null) {
            children[octant(entry.getCenter())].insert(entry);
            size++;
            return;
        }

        data.add(entry);
        if (data.size() > capacity) {
            try {
                split();
            } catch (SpatialSizingException e) {
                data.remove(data.size() - 1);
                throw e;
            }
        }
        size++;
    }

    @Override
    public Iterator<T> iterator() {
        return new OctreeValueIterator<>(this);
    }

    /**
     * Index of the octant holding the point. A coordinate at or above the center sets its bit to 0: bit 0 is x, bit
     * 1 is z and bit 2 is y.
     *
     * @param point the point to route
     * @return the octant index, or -1 if this node has no bounds yet
     */
    public int octant(Point point) {
        if (!bounded) {
            return -1;
        }
        int xBit = point.x >= centerX ? 0 : 1;
        int yBit = point.y >= centerY ? 0 : 1;
        int zBit = point.z >= centerZ ? 0 : 1;
        return (yBit << 2) | (zBit << 1) | xBit;
    }

    @Override
    public boolean remove(T value) {
        if (children != null) {
            for (var child : children) {
                if (child.remove(value)) {
                    size--;
                    return true;
                }
            }
        }
        var iterator = data.iterator();
        while (iterator.hasNext()) {
            if (Objects.equals(iterator.next().getValue(), value)) {
                iterator.remove();
                size--;
                return true;
            }
        }
        return false;
    }

    @Override
    public int removeIf(Predicate<? super T> predicate) {
        int removed = 0;
        if (children != null) {
            for (var child : children) {
                removed += child.removeIf(predicate);
            }
        }
        var iterator = data.iterator();
        while (iterator.hasNext()) {
            if (predicate.test(iterator.next().getValue())) {
                iterator.remove();
                removed++;
            }
        }
        size -= removed;
        return removed;
    }

    /**
     * Pre-seed the bounds of an empty tree.
     *
     * @throws IllegalStateException if the tree already holds entries
     */
    public void setBounds(Point min, Point max) {
        if (size > 0 || children != null) {
            throw new IllegalStateException("Bounds can only be set on an empty octree");
        }
        assignBounds(min.x, min.y, min.z, max.x, max.y, max.z);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public String toString() {
        var bounds = bounded ? "min=(" + minX + ", " + minY + ", " + minZ + "), max=(" + maxX + ", " + maxY + ", "
                               + maxZ + ")" : "unbounded";
        return "OctreeImpl{" + bounds + ", depth=" + depth + ", size=" + size + ", local=" + data.size()
        + ", children=" + (children == null ? 0 : children.length) + "}";
    }

    private void assignBounds(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {
        this.minX = minX;
        this.minY = minY;
        this.minZ = minZ;
        this.maxX = maxX;
        this.maxY = maxY;
        this.maxZ = maxZ;
        centerX = (minX + maxX) / 2;
        centerY = (minY + maxY) / 2;
        centerZ = (minZ + maxZ) / 2;
        bounded = true;
    }

    private void checkBounds() {
        if (!bounded) {
            throw new IllegalStateException("Octree bounds have not been established");
        }
    }

    private void growBounds(Point min, Point max) {
        if (!bounded) {
            assignBounds(min.x, min.y, min.z, max.x, max.y, max.z);
            return;
        }
        assignBounds(Math.min(minX, min.x), Math.min(minY, min.y), Math.min(minZ, min.z), Math.max(maxX, max.x),
                     Math.max(maxY, max.y), Math.max(maxZ, max.z));
    }

    private OctreeImpl<T> newChild(int octant) {
        var child = new OctreeImpl<T>(capacity, maxDepth, depth + 1);
        boolean lowX = (octant & 1) != 0;
        boolean lowZ = (octant & 2) != 0;
        boolean lowY = (octant & 4) != 0;
        child.assignBounds(lowX ? minX : centerX, lowY ? minY : centerY, lowZ ? minZ : centerZ,
                           lowX ? centerX : maxX, lowY ? centerY : maxY, lowZ ? centerZ : maxZ);
        return child;
    }

    private double radiusSquared(double radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non negative: " + radius);
        }
        return radius * radius;
    }

    private <R> Set<R> search(Predicate<OctreeImpl<T>> mayHold, Predicate<NodeData<T>> matches,
                              Function<NodeData<T>, R> result) {
        var found = new LinkedHashSet<R>();
        if (!bounded || !mayHold.test(this)) {
            return found;
        }
        var stack = new ArrayDeque<OctreeImpl<T>>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var current = stack.pop();
            if (current.children != null) {
                for (var child : current.children) {
                    if (child.bounded && mayHold.test(child)) {
                        stack.push(child);
                    }
                }
            }
            for (var entry : current.data) {
                if (matches.test(entry)) {
                    found.add(result.apply(entry));
                }
            }
        }
        return found;
    }

    private SpatialSizingException sizingError(String reason) {
        var message = String.format(
        "Cannot split octree node: %s. Increase capacity or the extent of the octree | capacity: %d, depth: %d, "
        + "min: (%s, %s, %s), max: (%s, %s, %s)", reason, capacity, depth, minX, minY, minZ, maxX, maxY, maxZ);
        log.warn(message);
        return new SpatialSizingException(message, capacity, depth);
    }

    /**
     * Create the eight octant children and move every local entry into the child holding its center. The node is
     * left untouched if any child fails to take its entries.
     */
    @SuppressWarnings("unchecked")
    private void split() {
        if (depth >= maxDepth) {
            throw sizingError("maximum depth " + maxDepth + " reached");
        }
        // children no larger than the capacity would split without end
        if (!(minX + capacity < maxX && minY + capacity < maxY && minZ + capacity < maxZ)) {
            throw sizingError("bounds too small for capacity");
        }

        var created = (OctreeImpl<T>[]) new OctreeImpl[Constants.OCTANTS];
        for (int i = 0; i < created.length; i++) {
            created[i] = newChild(i);
        }
        for (var entry : data) {
            created[octant(entry.getCenter())].insert(entry);
        }
        children = created;
        if (log.isDebugEnabled()) {
            log.debug("Split octree node at depth {} moving {} entries, center ({}, {}, {})", depth, data.size(),
                      centerX, centerY, centerZ);
        }
        data.clear();
    }
}
