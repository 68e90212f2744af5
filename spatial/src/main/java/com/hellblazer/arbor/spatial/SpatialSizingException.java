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
package com.hellblazer.arbor.spatial;

/**
 * Thrown when an over full node must split but cannot produce valid children: its bounds are too small relative to
 * its capacity, or it already sits at the maximum depth. This is a misconfiguration of capacity against the extent of
 * the data, not a transient condition, and the failed insert is not retried.
 *
 * @author hal.hildebrand
 */
public class SpatialSizingException extends IllegalStateException {

    private final int capacity;
    private final int depth;

    public SpatialSizingException(String message, int capacity, int depth) {
        super(message);
        this.capacity = capacity;
        this.depth = depth;
    }

    /**
     * @return the capacity of the node that failed to split
     */
    public int getCapacity() {
        return capacity;
    }

    /**
     * @return the depth of the node that failed to split
     */
    public int getDepth() {
        return depth;
    }
}
