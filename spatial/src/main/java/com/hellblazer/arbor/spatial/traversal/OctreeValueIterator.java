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
package com.hellblazer.arbor.spatial.traversal;

import com.hellblazer.arbor.spatial.octree.NodeData;
import com.hellblazer.arbor.spatial.octree.OctreeImpl;

import java.util.Deque;
import java.util.Iterator;

/**
 * Iterates the stored values of an octree.
 *
 * @author hal.hildebrand
 */
public class OctreeValueIterator<T> extends StackIterator<OctreeImpl<T>, T> {

    public OctreeValueIterator(OctreeImpl<T> octree) {
        super(octree);
    }

    @Override
    protected Iterator<T> elements(OctreeImpl<T> node) {
        return node.getLocalEntries().stream().map(NodeData::getValue).iterator();
    }

    @Override
    protected void pushChildren(OctreeImpl<T> node, Deque<OctreeImpl<T>> stack) {
        for (var child : node.getChildren()) {
            stack.push(child);
        }
    }
}
