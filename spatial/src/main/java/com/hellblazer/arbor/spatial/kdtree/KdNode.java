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
 * A node of a k-d tree: a point key, its value and the two subtrees split by the node's axis. Points on the left
 * compare strictly less than this node's point along the axis, points on the right compare greater or equal.
 *
 * @param <T> the type of the stored value
 * @author hal.hildebrand
 */
public class KdNode<T> {
    Point     point;
    T         value;
    KdNode<T> left;
    KdNode<T> right;

    KdNode(Point point, T value) {
        this.point = point;
        this.value = value;
    }

    public KdNode<T> getLeft() {
        return left;
    }

    public Point getPoint() {
        return point;
    }

    public KdNode<T> getRight() {
        return right;
    }

    public T getValue() {
        return value;
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    @Override
    public String toString() {
        return point + " -> " + value;
    }
}
