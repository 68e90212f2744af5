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
import com.hellblazer.arbor.spatial.Constants;

import java.util.Objects;

/**
 * Configuration for an octree. Provides the split threshold, the depth limit and optional pre-seeded bounds.
 *
 * @author hal.hildebrand
 */
public class OctreeConfig {

    private int   capacity = Constants.DEFAULT_CAPACITY;
    private int   maxDepth = Constants.MAX_DEPTH;
    private Point min;
    private Point max;

    /**
     * Default configuration: capacity 10, depth limit 21, bounds established by the first insertion.
     */
    public static OctreeConfig defaults() {
        return new OctreeConfig();
    }

    /**
     * Number of entries a node holds before it splits into octants.
     */
    public int getCapacity() {
        return capacity;
    }

    /**
     * Depth at which a node is no longer allowed to split.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Pre-seeded minimum corner, or null when the first insertion establishes the bounds.
     */
    public Point getMin() {
        return min;
    }

    /**
     * Pre-seeded maximum corner, or null when the first insertion establishes the bounds.
     */
    public Point getMax() {
        return max;
    }

    public boolean hasBounds() {
        return min != null;
    }

    // Fluent API for configuration

    public OctreeConfig withCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
        return this;
    }

    public OctreeConfig withMaxDepth(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max depth must not be negative");
        }
        this.maxDepth = maxDepth;
        return this;
    }

    public OctreeConfig withBounds(Point min, Point max) {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.x > max.x || min.y > max.y || min.z > max.z) {
            throw new IllegalArgumentException("Inverted bounds: min " + min + " exceeds max " + max);
        }
        this.min = min;
        this.max = max;
        return this;
    }

    @Override
    public String toString() {
        return "OctreeConfig{capacity=" + capacity + ", maxDepth=" + maxDepth + ", min=" + min + ", max=" + max + "}";
    }
}
