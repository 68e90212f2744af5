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
 * The three coordinate axes. The ordinal is the k-d tree splitting dimension.
 *
 * @author hal.hildebrand
 */
public enum Axis {
    X, Y, Z;

    private static final Axis[] VALUES = values();

    /**
     * @param depth depth of a node below the root
     * @return the axis cycled to at that depth, {@code depth % 3}
     */
    public static Axis atDepth(int depth) {
        return VALUES[depth % 3];
    }

    public Axis next() {
        return VALUES[(ordinal() + 1) % 3];
    }
}
