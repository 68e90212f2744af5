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
 * Shared defaults of the spatial indexes.
 *
 * @author hal.hildebrand
 */
public class Constants {

    /** Entries a node holds before it splits */
    public static final int DEFAULT_CAPACITY = 10;

    /** Deepest octree node that may still split. The root is depth 0 */
    public static final int MAX_DEPTH = 21;

    /** Number of children of a split octree node */
    public static final int OCTANTS = 8;

    /** Dimension of the k-d tree key space */
    public static final int DIMENSIONS = 3;

    private Constants() {
    }
}
