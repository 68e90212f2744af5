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

/**
 * A bounded volume that can be stored in a spatial index. Implementations supply a tight axis aligned bounding box
 * and closed form containment, distance and box overlap tests.
 * <p>
 * {@link #contains(Point)} and {@link #distanceSquared(Point)} agree: a point is contained exactly when its squared
 * distance to the shape is zero. Containment is inclusive of the boundary.
 *
 * @author hal.hildebrand
 */
public interface Shape {

    /**
     * @return the minimum corner of the bounding box
     */
    Point min();

    /**
     * @return the maximum corner of the bounding box
     */
    Point max();

    /**
     * @return the center of the bounding box
     */
    default Point center() {
        return min().midpoint(max());
    }

    /**
     * Answer true if the point lies inside or on the boundary of the receiver
     */
    default boolean contains(Point point) {
        return distanceSquared(point) == 0.0;
    }

    /**
     * @return zero if the point is contained, otherwise the squared distance to the nearest point of the shape
     */
    double distanceSquared(Point point);

    /**
     * Answer true if the receiver overlaps the axis aligned box [min, max]
     */
    boolean intersects(Point min, Point max);

    /**
     * Squared distance from a point to an axis aligned box, zero when inside.
     */
    static double boxDistanceSquared(Point min, Point max, Point point) {
        double dx = Math.max(0.0, Math.max(min.x - point.x, point.x - max.x));
        double dy = Math.max(0.0, Math.max(min.y - point.y, point.y - max.y));
        double dz = Math.max(0.0, Math.max(min.z - point.z, point.z - max.z));
        return dx * dx + dy * dy + dz * dz;
    }

    /**
     * Inclusive overlap test of two axis aligned boxes.
     */
    static boolean boxesIntersect(Point aMin, Point aMax, Point bMin, Point bMax) {
        return !(aMax.x < bMin.x || aMin.x > bMax.x || aMax.y < bMin.y || aMin.y > bMax.y || aMax.z < bMin.z
                 || aMin.z > bMax.z);
    }
}
