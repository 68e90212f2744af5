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

import com.hellblazer.arbor.spatial.kdtree.KdNode;

import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;

/**
 * Iterates the stored values of a k-d tree, pre-order.
 *
 * @author hal.hildebrand
 */
public class KdTreeIterator<T> extends StackIterator<KdNode<T>, T> {

    public KdTreeIterator(KdNode<T> root) {
        super(root);
    }

    @Override
    protected Iterator<T> elements(KdNode<T> node) {
        return Collections.singleton(node.getValue()).iterator();
    }

    @Override
    protected void pushChildren(KdNode<T> node, Deque<KdNode<T>> stack) {
        // right first so the left subtree comes out first
        if (node.getRight() != null) {
            stack.push(node.getRight());
        }
        if (node.getLeft() != null) {
            stack.push(node.getLeft());
        }
    }
}
