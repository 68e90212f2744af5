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

import com.hellblazer.arbor.geometry.Shape;

import java.util.function.Predicate;

/**
 * An octree that can be modified. Not thread safe: one owner mutates the tree and queries it synchronously; callers
 * sharing a tree across threads must layer their own locking on top.
 *
 * @param <T> the type of the stored values
 * @author hal.hildebrand
 */
public interface MutableOctree<T> extends Octree<T> {

    /**
     * Insert an entry, growing the tree's bounds to cover it.
     *
     * @param entry the entry to insert
     * @throws com.hellblazer.arbor.spatial.SpatialSizingException if a node must split but cannot
     */
    void insert(NodeData<T> entry);

    /**
     * Insert a value with the shape giving its spatial extent.
     */
    default void insert(T value, Shape shape) {
        insert(new NodeData<>(value, shape));
    }

    /**
     * Remove the first entry storing a value equal to the given one. Bounds are not shrunk and no nodes are merged.
     *
     * @return true if an entry was removed
     */
    boolean remove(T value);

    /**
     * Remove every entry whose value matches the predicate.
     *
     * @return the number of entries removed
     */
    int removeIf(Predicate<? super T> predicate);

    /**
     * Drop every entry and child node. The bounds are kept.
     */
    void clear();
}
