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

/**
 * A k-d tree that can be modified. No rebalancing is performed: the shape of the tree follows insertion order. Not
 * thread safe.
 *
 * @param <T> the type of the values stored with the points
 * @author hal.hildebrand
 */
public interface MutableKdTree<T> extends KdTree<T> {

    /**
     * Insert a point with its value. Duplicate points are stored as separate nodes.
     */
    void insert(Point point, T value);

    /**
     * Remove a node holding the exact point.
     *
     * @return true if a node was removed, false if the point is absent
     */
    boolean remove(Point point);

    /**
     * Remove every point.
     */
    void clear();
}
