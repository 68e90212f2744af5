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
 * A disc extruded along one of the coordinate axes, i.e. an axis aligned solid cylinder. The center is the middle of
 * the cylinder: it spans {@code height / 2} either side of the center along its axis.
 *
 * @param center center of the cylinder
 * @param radius radius of the disc
 * @param height length along the axis
 * @param axis   extrusion axis
 * @author hal.hildebrand
 */
public record Circle(Point center, double radius, double height, Axis axis) implements Shape {

    public Circle {
        Objects.requireNonNull(center, "center");
        Objects.requireNonNull(axis, "axis");
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non negative: " + radius);
        }
        if (height < 0) {
            throw new IllegalArgumentException("Height must be non negative: " + height);
        }
    }

    /**
     * An upright cylinder, extruded along Y
     */
    public Circle(Point center, double radius, double height) {
        this(center, radius, height, Axis.Y);
    }

    @Override
    public Point min() {
        double half = height / 2;
        return switch (axis) {
            case X -> center.subtract(half, radius, radius);
            case Y -> center.subtract(radius, half, radius);
            case Z -> center.subtract(radius, radius, half);
        };
    }

    @Override
    public Point max() {
        double half = height / 2;
        return switch (axis) {
            case X -> center.add(half, radius, radius);
            case Y -> center.add(radius, half, radius);
            case Z -> center.add(radius, radius, half);
        };
    }

    @Override
    public double distanceSquared(Point point) {
        var offset = point.subtract(center);
        double along = Math.abs(offset.get(axis));
        double u = offset.get(axis.next());
        double v = offset.get(axis.next().next());

        double axial = Math.max(0.0, along - height / 2);
        double radial2 = u * u + v * v;
        double radial = radial2 <= radius * radius ? 0.0 : Math.sqrt(radial2) - radius;
        return axial * axial + radial * radial;
    }

    @Override
    public boolean intersects(Point min, Point max) {
        double half = height / 2;
        double c = center.get(axis);
        if (c + half < min.get(axis) || c - half > max.get(axis)) {
            return false;
        }
        // disc against the box's cross section
        var first = axis.next();
        var second = first.next();
        double du = clampDistance(center.get(first), min.get(first), max.get(first));
        double dv = clampDistance(center.get(second), min.get(second), max.get(second));
        return du * du + dv * dv <= radius * radius;
    }

    private static double clampDistance(double value, double low, double high) {
        return Math.max(0.0, Math.max(low - value, value - high));
    }
}
