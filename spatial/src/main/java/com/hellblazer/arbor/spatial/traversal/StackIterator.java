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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Depth first iterator over the elements held by the nodes of a tree. Nodes are visited with an explicit stack, so
 * the depth of the tree never bears on the call stack. Each instance owns its own stack: iterating a tree again means
 * asking it for a fresh iterator.
 * <p>
 * The tree must not be modified while an iterator over it is in use.
 *
 * @param <N> the node type
 * @param <E> the element type
 * @author hal.hildebrand
 */
public abstract class StackIterator<N, E> implements Iterator<E> {

    private final Deque<N>              stack   = new ArrayDeque<>();
    private       Iterator<? extends E> current = Collections.emptyIterator();

    protected StackIterator(N root) {
        if (root != null) {
            stack.push(root);
        }
    }

    @Override
    public boolean hasNext() {
        while (!current.hasNext()) {
            if (stack.isEmpty()) {
                return false;
            }
            var node = stack.pop();
            pushChildren(node, stack);
            current = elements(node);
        }
        return true;
    }

    @Override
    public E next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }

    /**
     * @return the elements held directly by the node
     */
    protected abstract Iterator<? extends E> elements(N node);

    /**
     * Push the node's present children onto the traversal stack
     */
    protected abstract void pushChildren(N node, Deque<N> stack);
}
