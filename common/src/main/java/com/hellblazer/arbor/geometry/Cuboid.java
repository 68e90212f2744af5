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
package com.hellblazer.arbor.geometry;

import java.util.Objects;

/**
 * Axis aligned box.
 *
 * @param min minimum corner
 * @param max maximum corner
 * @author hal.hildebrand
 */
public record Cuboid(Point min, Point max) implements Shape {

    public Cuboid {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.x > max.x || min.y > max.y || min.z > max.z) {
            throw new IllegalArgumentException("Inverted cuboid: min " + min + " exceeds max " + max);
        }
    }

    /**
     * A cube of the given edge length with its minimum corner at the origin point
     */
    public static Cuboid cube(Point origin, double extent) {
        return new Cuboid(origin, origin.add(extent, extent, extent));
    }

    /**
     * A degenerate box holding exactly one point
     */
    public static Cuboid point(Point point) {
        return new Cuboid(point, point);
    }

    @Override
    public boolean contains(Point point) {
        return point.isWithinBounds(min, max);
    }

    @Override
    public double distanceSquared(Point point) {
        return Shape.boxDistanceSquared(min, max, point);
    }

    @Override
    public boolean intersects(Point min, Point max) {
        return Shape.boxesIntersect(this.min, this.max, min, max);
    }
}
