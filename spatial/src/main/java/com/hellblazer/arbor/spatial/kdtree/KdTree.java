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
package com.hellblazer.arbor.spatial.kdtree;

import com.hellblazer.arbor.geometry.Point;

import java.util.List;
import java.util.Optional;

/**
 * Read side of a 3 dimensional k-d tree: a binary tree of points where the splitting axis cycles x, y, z with depth.
 *
 * @param <T> the type of the values stored with the points
 * @author hal.hildebrand
 */
public interface KdTree<T> extends Iterable<T> {

    /**
     * @return the number of points stored in the tree
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Answer true if the exact point is stored in the tree
     */
    default boolean contains(Point point) {
        return get(point).isPresent();
    }

    /**
     * @return the value stored with the exact point, if any
     */
    Optional<T> get(Point point);

    /**
     * Find the value of the point closest to the query point.
     *
     * @param point the query point
     * @return the value of the nearest point, empty if the tree is empty
     */
    Optional<T> nearestNeighbor(Point point);

    /**
     * Find the values of the {@code n} points closest to the query point.
     *
     * @param point the query point
     * @param n     number of neighbors, not negative
     * @return at most {@code n} values ordered by increasing distance; fewer if the tree holds fewer points
     */
    List<T> nearestNeighbors(Point point, int n);

    /**
     * Find the values of every point within the radius of the center, inclusive.
     *
     * @param center the center of the search sphere
     * @param radius non negative radius
     */
    List<T> rangeSearch(Point center, double radius);

    /**
     * Find the values of every point inside the axis aligned box [min, max], inclusive.
     */
    List<T> rangeSearch(Point min, Point max);
}
