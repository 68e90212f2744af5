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

import java.util.Iterator;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Read side of an octree: a container that recursively partitions 3D space into eight octants and answers point,
 * radius and region queries over the shapes of its entries.
 * <p>
 * Every query has a value form and an entry form. The entry form ({@code findNodes...}) answers the {@link NodeData}
 * holding each match, so callers can see the shape the value was indexed with.
 *
 * @param <T> the type of the stored values
 * @author hal.hildebrand
 */
public interface Octree<T> extends Iterable<T> {

    /**
     * @return the minimum corner of the tree's bounds
     * @throws IllegalStateException if no bounds have been established
     */
    Point getMin();

    /**
     * @return the maximum corner of the tree's bounds
     * @throws IllegalStateException if no bounds have been established
     */
    Point getMax();

    /**
     * @return the center of the tree's bounds, the point its split planes pass through
     * @throws IllegalStateException if no bounds have been established
     */
    Point getCenter();

    /**
     * Answer true once bounds were pre-seeded or established by an insertion
     */
    boolean hasBounds();

    /**
     * @return number of entries stored in the tree
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Answer true if some entry stores a value equal to the given one
     */
    boolean containsValue(T value);

    /**
     * Find the values whose shapes contain the point.
     *
     * @param point the point to search for
     * @return the matching values, empty if none
     */
    Set<T> find(Point point);

    /**
     * Find the entries whose shapes contain the point.
     */
    Set<NodeData<T>> findNodes(Point point);

    /**
     * Find the values whose shapes lie within the radius of the point, i.e. whose squared distance to the point is
     * at most {@code radius * radius}.
     *
     * @param point  the point to search from
     * @param radius non negative search radius
     * @return the matching values, empty if none
     */
    Set<T> findNearby(Point point, double radius);

    /**
     * Find the entries whose shapes lie within the radius of the point.
     */
    Set<NodeData<T>> findNodesNearby(Point point, double radius);

    /**
     * Find the values whose shapes overlap the axis aligned box [min, max].
     *
     * @param min the minimum corner of the region
     * @param max the maximum corner of the region
     * @return the matching values, empty if none
     */
    Set<T> findInRegion(Point min, Point max);

    /**
     * Find the entries whose shapes overlap the axis aligned box [min, max].
     */
    Set<NodeData<T>> findNodesInRegion(Point min, Point max);

    /**
     * @return a fresh iterator over every entry of the tree
     */
    Iterator<NodeData<T>> entryIterator();

    default void forEachEntry(Consumer<? super NodeData<T>> action) {
        entryIterator().forEachRemaining(action);
    }
}
