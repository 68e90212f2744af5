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

import com.hellblazer.arbor.geometry.Axis;
import com.hellblazer.arbor.geometry.Point;
import com.hellblazer.arbor.spatial.traversal.KdTreeIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Mutable 3 dimensional k-d tree. The node at depth {@code d} splits on axis {@code d % 3}: points strictly less
 * along that axis go left, the rest go right.
 * <p>
 * Insertion, removal and every query run as loops over an explicit stack, so an unbalanced tree (for example one
 * built from sorted input) costs time but never call stack depth.
 * <p>
 * Removal keeps the splitting invariant along every axis. A node whose only child is a leaf is replaced by that leaf.
 * Otherwise the node takes the point and value of the minimum, along its own axis, of its right subtree, and that
 * minimum is removed in turn. A node with only a left subtree first moves that subtree to the right, taking the
 * minimum of it.
 * <p>
 * Thread Safety: This class is NOT thread-safe.
 *
 * @param <T> the type of the values stored with the points
 * @author hal.hildebrand
 */
public class KdTreeImpl<T> implements MutableKdTree<T> {

    private static final Logger log = LoggerFactory.getLogger(KdTreeImpl.class);

    private KdNode<T> root;
    private int       size;

    @Override
    public void clear() {
        log.debug("Clearing k-d tree of {} points", size);
        root = null;
        size = 0;
    }

    @Override
    public Optional<T> get(Point point) {
        var found = locate(point);
        return found == null ? Optional.empty() : Optional.ofNullable(found.node.value);
    }

    @Override
    public void insert(Point point, T value) {
        Objects.requireNonNull(point, "point");
        var created = new KdNode<>(point, value);
        size++;
        if (root == null) {
            root = created;
            return;
        }
        var node = root;
        int depth = 0;
        while (true) {
            if (compare(point, node.point, Axis.atDepth(depth)) < 0) {
                if (node.left == null) {
                    node.left = created;
                    return;
                }
                node = node.left;
            } else {
                if (node.right == null) {
                    node.right = created;
                    return;
                }
                node = node.right;
            }
            depth++;
        }
    }

    @Override
    public Iterator<T> iterator() {
        return new KdTreeIterator<>(root);
    }

    @Override
    public Optional<T> nearestNeighbor(Point point) {
        Objects.requireNonNull(point, "point");
        if (root == null) {
            return Optional.empty();
        }
        KdNode<T> best = null;
        double bestDistance = Double.POSITIVE_INFINITY;

        var stack = new ArrayDeque<Branch<T>>();
        stack.push(new Branch<>(root, 0, 0.0));
        while (!stack.isEmpty()) {
            var branch = stack.pop();
            // nothing beyond the splitting plane can beat the current best
            if (branch.bound >= bestDistance) {
                continue;
            }
            var node = branch.node;
            double distance = node.point.distanceSquared(point);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = node;
            }
            pushBranches(stack, branch, point);
        }
        return Optional.ofNullable(best.value);
    }

    @Override
    public List<T> nearestNeighbors(Point point, int n) {
        Objects.requireNonNull(point, "point");
        if (n < 0) {
            throw new IllegalArgumentException("Neighbor count must not be negative: " + n);
        }
        if (n == 0 || root == null) {
            return new ArrayList<>();
        }
        // never more candidates than points
        int k = Math.min(n, size);
        var worstFirst = new PriorityQueue<Candidate<T>>(k + 1,
                                                         Comparator.comparingDouble(
                                                         (Candidate<T> c) -> c.distance).reversed());
        var stack = new ArrayDeque<Branch<T>>();
        stack.push(new Branch<>(root, 0, 0.0));
        while (!stack.isEmpty()) {
            var branch = stack.pop();
            if (worstFirst.size() == k && branch.bound >= worstFirst.peek().distance) {
                continue;
            }
            var node = branch.node;
            double distance = node.point.distanceSquared(point);
            if (worstFirst.size() < k) {
                worstFirst.add(new Candidate<>(node, distance));
            } else if (distance < worstFirst.peek().distance) {
                worstFirst.poll();
                worstFirst.add(new Candidate<>(node, distance));
            }
            pushBranches(stack, branch, point);
        }

        var candidates = new ArrayList<>(worstFirst);
        candidates.sort(Comparator.comparingDouble(c -> c.distance));
        var result = new ArrayList<T>(candidates.size());
        for (var candidate : candidates) {
            result.add(candidate.node.value);
        }
        return result;
    }

    @Override
    public List<T> rangeSearch(Point center, double radius) {
        Objects.requireNonNull(center, "center");
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non negative: " + radius);
        }
        var result = new ArrayList<T>();
        if (root == null) {
            return result;
        }
        double radiusSquared = radius * radius;
        var stack = new ArrayDeque<Branch<T>>();
        stack.push(new Branch<>(root, 0, 0.0));
        while (!stack.isEmpty()) {
            var branch = stack.pop();
            var node = branch.node;
            if (node.point.distanceSquared(center) <= radiusSquared) {
                result.add(node.value);
            }
            var axis = Axis.atDepth(branch.depth);
            double diff = center.get(axis) - node.point.get(axis);
            if (diff * diff <= radiusSquared) {
                // the sphere crosses the splitting plane
                push(stack, node.left, branch.depth + 1, 0.0);
                push(stack, node.right, branch.depth + 1, 0.0);
            } else {
                push(stack, diff < 0 ? node.left : node.right, branch.depth + 1, 0.0);
            }
        }
        return result;
    }

    @Override
    public List<T> rangeSearch(Point min, Point max) {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        var result = new ArrayList<T>();
        if (root == null) {
            return result;
        }
        var stack = new ArrayDeque<Branch<T>>();
        stack.push(new Branch<>(root, 0, 0.0));
        while (!stack.isEmpty()) {
            var branch = stack.pop();
            var node = branch.node;
            if (node.point.isWithinBounds(min, max)) {
                result.add(node.value);
            }
            var axis = Axis.atDepth(branch.depth);
            double split = node.point.get(axis);
            if (min.get(axis) <= split) {
                push(stack, node.left, branch.depth + 1, 0.0);
            }
            if (max.get(axis) >= split) {
                push(stack, node.right, branch.depth + 1, 0.0);
            }
        }
        return result;
    }

    @Override
    public boolean remove(Point point) {
        var found = locate(point);
        if (found == null) {
            return false;
        }
        delete(found.node, found.parent, found.depth);
        size--;
        return true;
    }

    /**
     * @return the root node, null when the tree is empty
     */
    public KdNode<T> getRoot() {
        return root;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public String toString() {
        return "KdTreeImpl{size=" + size + ", root=" + root + "}";
    }

    private static int compare(Point a, Point b, Axis axis) {
        return Double.compare(a.get(axis), b.get(axis));
    }

    private static <T> void push(ArrayDeque<Branch<T>> stack, KdNode<T> node, int depth, double bound) {
        if (node != null) {
            stack.push(new Branch<>(node, depth, bound));
        }
    }

    /**
     * Push the far side of the splitting plane, bounded by the squared distance to the plane, then the near side so
     * it is searched first.
     */
    private static <T> void pushBranches(ArrayDeque<Branch<T>> stack, Branch<T> branch, Point point) {
        var node = branch.node;
        var axis = Axis.atDepth(branch.depth);
        double diff = point.get(axis) - node.point.get(axis);
        var near = diff < 0 ? node.left : node.right;
        var far = diff < 0 ? node.right : node.left;
        push(stack, far, branch.depth + 1, Math.max(branch.bound, diff * diff));
        push(stack, near, branch.depth + 1, branch.bound);
    }

    /**
     * Remove the node, found at the given depth under the given parent, restoring the splitting invariant below it.
     */
    private void delete(KdNode<T> node, KdNode<T> parent, int depth) {
        while (true) {
            var axis = Axis.atDepth(depth);
            if (node.right != null) {
                if (node.left == null && node.right.isLeaf()) {
                    replace(parent, node, node.right);
                    return;
                }
                var min = findMin(node.right, node, depth + 1, axis);
                if (log.isTraceEnabled()) {
                    log.trace("Replacing {} with right subtree minimum {} on {}", node.point, min.node.point, axis);
                }
                node.point = min.node.point;
                node.value = min.node.value;
                node = min.node;
                parent = min.parent;
                depth = min.depth;
            } else if (node.left != null) {
                if (node.left.isLeaf()) {
                    replace(parent, node, node.left);
                    return;
                }
                var min = findMin(node.left, node, depth + 1, axis);
                node.point = min.node.point;
                node.value = min.node.value;
                node.right = node.left;
                node.left = null;
                node = min.node;
                parent = min.parent;
                depth = min.depth;
            } else {
                replace(parent, node, null);
                return;
            }
        }
    }

    /**
     * Find the node with the smallest coordinate along the axis in the subtree. Where a node splits on that same axis
     * only its left side can hold anything smaller; elsewhere both sides must be searched.
     */
    private Located<T> findMin(KdNode<T> subtree, KdNode<T> parent, int depth, Axis axis) {
        Located<T> min = null;
        var stack = new ArrayDeque<Located<T>>();
        stack.push(new Located<>(subtree, parent, depth));
        while (!stack.isEmpty()) {
            var current = stack.pop();
            var node = current.node;
            if (min == null || node.point.get(axis) < min.node.point.get(axis)) {
                min = current;
            }
            if (node.left != null) {
                stack.push(new Located<>(node.left, node, current.depth + 1));
            }
            if (node.right != null && Axis.atDepth(current.depth) != axis) {
                stack.push(new Located<>(node.right, node, current.depth + 1));
            }
        }
        return min;
    }

    private Located<T> locate(Point point) {
        Objects.requireNonNull(point, "point");
        KdNode<T> parent = null;
        var node = root;
        int depth = 0;
        while (node != null) {
            if (node.point.equals(point)) {
                return new Located<>(node, parent, depth);
            }
            parent = node;
            node = compare(point, node.point, Axis.atDepth(depth)) < 0 ? node.left : node.right;
            depth++;
        }
        return null;
    }

    private void replace(KdNode<T> parent, KdNode<T> node, KdNode<T> replacement) {
        if (parent == null) {
            root = replacement;
        } else if (parent.left == node) {
            parent.left = replacement;
        } else {
            parent.right = replacement;
        }
    }

    private record Branch<T>(KdNode<T> node, int depth, double bound) {
    }

    private record Candidate<T>(KdNode<T> node, double distance) {
    }

    private record Located<T>(KdNode<T> node, KdNode<T> parent, int depth) {
    }
}
