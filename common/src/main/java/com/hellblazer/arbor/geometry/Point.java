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

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3d;
import java.util.regex.Pattern;

/**
 * Immutable 3D point with double coordinates. Doubles as a vector: the arithmetic operations treat the receiver as
 * the vector from the origin.
 * <p>
 * Points are totally ordered by x, then y, then z.
 *
 * @author hal.hildebrand
 */
public final class Point implements Comparable<Point> {

    public static final Point ZERO = new Point(0, 0, 0);

    private static final Pattern SEPARATORS = Pattern.compile("\\s*[,;|:]\\s*|\\s+");

    /** X coordinate */
    public final double x;

    /** Y coordinate */
    public final double y;

    /** Z coordinate */
    public final double z;

    public Point(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static Point of(Tuple3d tuple) {
        return new Point(tuple.x, tuple.y, tuple.z);
    }

    public static Point of(Tuple3f tuple) {
        return new Point(tuple.x, tuple.y, tuple.z);
    }

    /**
     * Parse a point from its textual form, three numbers separated by any of {@code , ; | :} or whitespace.
     *
     * @param text e.g. {@code "1.5, 2, -3"}
     * @return the parsed point
     * @throws IllegalArgumentException if the text does not hold exactly three numbers
     */
    public static Point parse(String text) {
        var parts = SEPARATORS.split(text.trim());
        if (parts.length != 3) {
            throw new IllegalArgumentException(
            "Invalid point format, expected 3 coordinates but was " + parts.length + ": " + text);
        }
        try {
            return new Point(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]),
                             Double.parseDouble(parts[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid point coordinate: " + text, e);
        }
    }

    public Point add(Point other) {
        return new Point(x + other.x, y + other.y, z + other.z);
    }

    public Point add(double dx, double dy, double dz) {
        return new Point(x + dx, y + dy, z + dz);
    }

    public Point subtract(Point other) {
        return new Point(x - other.x, y - other.y, z - other.z);
    }

    public Point subtract(double dx, double dy, double dz) {
        return new Point(x - dx, y - dy, z - dz);
    }

    public Point multiply(double scalar) {
        return new Point(x * scalar, y * scalar, z * scalar);
    }

    /**
     * Component-wise product.
     */
    public Point multiply(Point other) {
        return new Point(x * other.x, y * other.y, z * other.z);
    }

    public Point divide(double scalar) {
        return new Point(x / scalar, y / scalar, z / scalar);
    }

    /**
     * Component-wise quotient.
     */
    public Point divide(Point other) {
        return new Point(x / other.x, y / other.y, z / other.z);
    }

    public double dot(Point other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Point cross(Point other) {
        return new Point(y * other.z - z * other.y, z * other.x - x * other.z, x * other.y - y * other.x);
    }

    /**
     * Squared length of this point taken as a vector from the origin. Avoids sqrt() for performance.
     */
    public double lengthSquared() {
        return x * x + y * y + z * z;
    }

    public double length() {
        return Math.sqrt(lengthSquared());
    }

    /**
     * @return the unit vector in the direction of the receiver
     */
    public Point normalized() {
        return multiply(1.0 / length());
    }

    /**
     * Squared Euclidean distance to another point.
     *
     * @param other Other point
     * @return Squared distance
     */
    public double distanceSquared(Point other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return dx * dx + dy * dy + dz * dz;
    }

    public double distance(Point other) {
        return Math.sqrt(distanceSquared(other));
    }

    /**
     * @return the point halfway between the receiver and the other point
     */
    public Point midpoint(Point other) {
        return new Point((x + other.x) / 2, (y + other.y) / 2, (z + other.z) / 2);
    }

    /**
     * @return the coordinate along the axis
     */
    public double get(Axis axis) {
        return switch (axis) {
            case X -> x;
            case Y -> y;
            case Z -> z;
        };
    }

    /**
     * Component-wise minimum.
     */
    public Point min(Point other) {
        return new Point(Math.min(x, other.x), Math.min(y, other.y), Math.min(z, other.z));
    }

    /**
     * Component-wise maximum.
     */
    public Point max(Point other) {
        return new Point(Math.max(x, other.x), Math.max(y, other.y), Math.max(z, other.z));
    }

    /**
     * Check if this point is within an axis aligned box.
     *
     * @param min Minimum corner (inclusive)
     * @param max Maximum corner (inclusive)
     * @return True if point is within bounds
     */
    public boolean isWithinBounds(Point min, Point max) {
        return x >= min.x && x <= max.x && y >= min.y && y <= max.y && z >= min.z && z <= max.z;
    }

    public Point3d toPoint3d() {
        return new Point3d(x, y, z);
    }

    public Vector3d toVector3d() {
        return new Vector3d(x, y, z);
    }

    @Override
    public int compareTo(Point other) {
        int result = Double.compare(x, other.x);
        if (result != 0) {
            return result;
        }
        result = Double.compare(y, other.y);
        if (result != 0) {
            return result;
        }
        return Double.compare(z, other.z);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point other)) return false;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0 && Double.compare(z, other.z) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        result = 31 * result + Double.hashCode(z);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Point(%s, %s, %s)", x, y, z);
    }
}
