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
 * Solid ball.
 *
 * @param center center of the sphere
 * @param radius non negative radius
 * @author hal.hildebrand
 */
public record Sphere(Point center, double radius) implements Shape {

    public Sphere {
        Objects.requireNonNull(center, "center");
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non negative: " + radius);
        }
    }

    /**
     * A zero radius sphere, the default shape of a point sized value
     */
    public static Sphere point(Point point) {
        return new Sphere(point, 0.0);
    }

    @Override
    public Point min() {
        return center.subtract(radius, radius, radius);
    }

    @Override
    public Point max() {
        return center.add(radius, radius, radius);
    }

    @Override
    public double distanceSquared(Point point) {
        double d2 = center.distanceSquared(point);
        if (d2 <= radius * radius) {
            return 0.0;
        }
        double gap = Math.sqrt(d2) - radius;
        return gap * gap;
    }

    @Override
    public boolean intersects(Point min, Point max) {
        // distance from the center to the clamped closest point of the box
        return Shape.boxDistanceSquared(min, max, center) <= radius * radius;
    }
}
