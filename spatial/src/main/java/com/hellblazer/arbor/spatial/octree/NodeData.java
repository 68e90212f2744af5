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

import java.util.Objects;

/**
 * A value stored in an octree, paired with the shape giving its spatial extent. The bounds and center are captured
 * from the shape when the entry is created.
 * <p>
 * Entries compare by identity: an entry lives in exactly one node's list at a time and is moved, never copied, when
 * that node splits.
 *
 * @param <T> the type of the stored value
 * @author hal.hildebrand
 */
public final class NodeData<T> {

    private final T     value;
    private final Shape shape;
    private final Point min;
    private final Point max;
    private final Point center;

    public NodeData(T value, Shape shape) {
        this.value = value;
        this.shape = Objects.requireNonNull(shape, "shape");
        this.min = shape.min();
        this.max = shape.max();
        this.center = min.midpoint(max);
    }

    public T getValue() {
        return value;
    }

    public Shape getShape() {
        return shape;
    }

    public Point getMin() {
        return min;
    }

    public Point getMax() {
        return max;
    }

    public Point getCenter() {
        return center;
    }

    public boolean contains(Point point) {
        return shape.contains(point);
    }

    public double distanceSquared(Point point) {
        return shape.distanceSquared(point);
    }

    public boolean intersects(Point min, Point max) {
        return shape.intersects(min, max);
    }

    @Override
    public String toString() {
        return "NodeData{value=" + value + ", min=" + min + ", max=" + max + "}";
    }
}
