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

import com.hellblazer.arbor.geometry.Axis;
import com.hellblazer.arbor.geometry.Circle;
import com.hellblazer.arbor.geometry.Cuboid;
import com.hellblazer.arbor.geometry.Point;
import com.hellblazer.arbor.geometry.Shape;
import com.hellblazer.arbor.geometry.Sphere;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compare octree queries against a linear scan of the inserted shapes
 *
 * @author hal.hildebrand
 */
public class OctreeQueryTest {

    private static final int ENTRIES = 500;
    private static final int QUERIES = 200;

    private final List<Shape>         shapes = new ArrayList<>();
    private       Random              random;
    private       OctreeImpl<Integer> octree;

    @BeforeEach
    void setUp() {
        random = new Random(0x0C7);
        octree = new OctreeImpl<>(new Point(0, 0, 0), new Point(100, 100, 100), 8);
        for (int i = 0; i < ENTRIES; i++) {
            var shape = randomShape();
            shapes.add(shape);
            octree.insert(i, shape);
        }
        // shapes centered on the root's split planes
        for (var center : List.of(new Point(50, 50, 50), new Point(50, 20, 80), new Point(10, 50, 50),
                                  new Point(75, 75, 50))) {
            var shape = new Sphere(center, 3);
            octree.insert(shapes.size(), shape);
            shapes.add(shape);
        }
        assertEquals(shapes.size(), octree.size());
        assertTrue(octree.hasChildren());
    }

    @Test
    void testFind() {
        for (int i = 0; i < QUERIES; i++) {
            var point = randomPoint(-5, 105);
            assertEquals(scan(shape -> shape.contains(point)), octree.find(point), () -> "find " + point);
        }
        // entry centers are always found
        for (int i = 0; i < shapes.size(); i++) {
            assertTrue(octree.find(shapes.get(i).center()).contains(i));
        }
    }

    @Test
    void testFindNearby() {
        for (int i = 0; i < QUERIES; i++) {
            var point = randomPoint(-10, 110);
            double radius = random.nextDouble() * 15;
            assertEquals(scan(shape -> shape.distanceSquared(point) <= radius * radius),
                         octree.findNearby(point, radius), () -> "nearby " + point + " r " + radius);
        }
    }

    @Test
    void testFindInRegion() {
        for (int i = 0; i < QUERIES; i++) {
            var corner = randomPoint(-10, 110);
            var other = randomPoint(-10, 110);
            var min = corner.min(other);
            var max = corner.max(other);
            assertEquals(scan(shape -> shape.intersects(min, max)), octree.findInRegion(min, max),
                         () -> "region " + min + " " + max);
        }
        assertEquals(shapes.size(), octree.findInRegion(new Point(-10, -10, -10), new Point(110, 110, 110)).size());
    }

    @Test
    void testQueriesAfterRemoval() {
        var removed = new HashSet<Integer>();
        for (int i = 0; i < shapes.size(); i += 3) {
            assertTrue(octree.remove(i));
            removed.add(i);
        }
        assertEquals(shapes.size() - removed.size(), octree.size());

        for (int i = 0; i < QUERIES; i++) {
            var point = randomPoint(0, 100);
            double radius = random.nextDouble() * 20;
            var expected = scan(shape -> shape.distanceSquared(point) <= radius * radius);
            expected.removeAll(removed);
            assertEquals(expected, octree.findNearby(point, radius));
        }
    }

    private Point randomPoint(double low, double high) {
        return new Point(low + random.nextDouble() * (high - low), low + random.nextDouble() * (high - low),
                         low + random.nextDouble() * (high - low));
    }

    private Shape randomShape() {
        var center = randomPoint(2, 98);
        return switch (random.nextInt(3)) {
            case 0 -> new Cuboid(center.subtract(random.nextDouble() * 2, random.nextDouble() * 2,
                                                 random.nextDouble() * 2),
                                 center.add(random.nextDouble() * 2, random.nextDouble() * 2, random.nextDouble() * 2));
            case 1 -> new Sphere(center, random.nextDouble() * 2);
            default -> new Circle(center, random.nextDouble() * 2, random.nextDouble() * 4,
                                  Axis.values()[random.nextInt(3)]);
        };
    }

    private Set<Integer> scan(Predicate<Shape> predicate) {
        var found = new HashSet<Integer>();
        for (int i = 0; i < shapes.size(); i++) {
            if (predicate.test(shapes.get(i))) {
                found.add(i);
            }
        }
        return found;
    }
}
