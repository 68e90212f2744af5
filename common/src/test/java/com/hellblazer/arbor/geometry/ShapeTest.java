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

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the concrete shapes: cuboid, sphere and circle (axis aligned cylinder).
 *
 * @author hal.hildebrand
 */
public class ShapeTest {

    @Test
    public void testCuboid() {
        var cuboid = new Cuboid(new Point(0, 0, 0), new Point(2, 4, 6));

        assertEquals(new Point(1, 2, 3), cuboid.center());
        assertTrue(cuboid.contains(new Point(1, 1, 1)));
        assertTrue(cuboid.contains(new Point(2, 4, 6)));
        assertFalse(cuboid.contains(new Point(3, 1, 1)));

        assertEquals(0.0, cuboid.distanceSquared(new Point(1, 1, 1)));
        assertEquals(1.0, cuboid.distanceSquared(new Point(3, 1, 1)));
        assertEquals(2.0, cuboid.distanceSquared(new Point(-1, -1, 3)));

        assertTrue(cuboid.intersects(new Point(1, 1, 1), new Point(10, 10, 10)));
        assertTrue(cuboid.intersects(new Point(2, 4, 6), new Point(10, 10, 10)));
        assertFalse(cuboid.intersects(new Point(3, 0, 0), new Point(10, 10, 10)));

        assertThrows(IllegalArgumentException.class, () -> new Cuboid(new Point(1, 0, 0), new Point(0, 1, 1)));
        assertEquals(new Point(1, 1, 1), Cuboid.cube(Point.ZERO, 1).max());
    }

    @Test
    public void testSphere() {
        var sphere = new Sphere(new Point(0, 0, 0), 2);

        assertEquals(new Point(-2, -2, -2), sphere.min());
        assertEquals(new Point(2, 2, 2), sphere.max());
        assertEquals(new Point(0, 0, 0), sphere.center());

        assertTrue(sphere.contains(new Point(1, 1, 0)));
        assertTrue(sphere.contains(new Point(2, 0, 0)));
        assertFalse(sphere.contains(new Point(3, 3, 3)));

        assertEquals(0.0, sphere.distanceSquared(new Point(1, 1, 0)));
        assertEquals(9.0, sphere.distanceSquared(new Point(5, 0, 0)), 1e-12);

        // the box corner nearest the center is (1.5, 1.5, 0) at distance ~2.12
        assertFalse(sphere.intersects(new Point(1.5, 1.5, -1), new Point(5, 5, 1)));
        assertTrue(sphere.intersects(new Point(1, 1, -1), new Point(5, 5, 1)));
        assertTrue(sphere.intersects(new Point(-10, -10, -10), new Point(10, 10, 10)));

        assertThrows(IllegalArgumentException.class, () -> new Sphere(Point.ZERO, -1));
    }

    @Test
    public void testCircle() {
        var cylinder = new Circle(new Point(0, 0, 0), 2, 5);

        assertEquals(Axis.Y, cylinder.axis());
        assertEquals(new Point(-2, -2.5, -2), cylinder.min());
        assertEquals(new Point(2, 2.5, 2), cylinder.max());

        assertTrue(cylinder.contains(new Point(1, 2, 0)));
        assertTrue(cylinder.contains(new Point(0, 2.5, 2)));
        assertFalse(cylinder.contains(new Point(0, 3, 0)));
        assertFalse(cylinder.contains(new Point(1.5, 0, 1.5)));

        // above the top face
        assertEquals(1.0, cylinder.distanceSquared(new Point(0, 3.5, 0)), 1e-12);
        // beside the curved wall
        assertEquals(4.0, cylinder.distanceSquared(new Point(4, 0, 0)), 1e-12);
        // off the rim: 1 above and 1 out
        assertEquals(2.0, cylinder.distanceSquared(new Point(3, 3.5, 0)), 1e-12);

        assertTrue(cylinder.intersects(new Point(1, -1, -1), new Point(3, 1, 1)));
        assertFalse(cylinder.intersects(new Point(0, 3, 0), new Point(1, 4, 1)));
        // the box touches the bounding box corner but not the disc
        assertFalse(cylinder.intersects(new Point(1.8, 0, 1.8), new Point(3, 1, 3)));
    }

    @Test
    public void testCircleAlongOtherAxes() {
        var alongX = new Circle(new Point(0, 0, 0), 1, 10, Axis.X);
        assertEquals(new Point(-5, -1, -1), alongX.min());
        assertTrue(alongX.contains(new Point(4.5, 0.5, 0.5)));
        assertFalse(alongX.contains(new Point(0, 1, 1)));

        var alongZ = new Circle(new Point(0, 0, 0), 1, 10, Axis.Z);
        assertEquals(new Point(1, 1, 5), alongZ.max());
        assertTrue(alongZ.contains(new Point(0, 1, -5)));
        assertFalse(alongZ.contains(new Point(0, 0, 5.5)));
    }

    @Test
    public void testContainmentAgreesWithDistance() {
        var random = new Random(0x5EED);
        for (int i = 0; i < 200; i++) {
            var shape = randomShape(random);
            for (int j = 0; j < 50; j++) {
                var point = new Point(random.nextDouble() * 20 - 10, random.nextDouble() * 20 - 10,
                                      random.nextDouble() * 20 - 10);
                assertEquals(shape.contains(point), shape.distanceSquared(point) == 0.0,
                             () -> shape + " disagrees at " + point);
            }
            // the center of every shape is inside it
            assertTrue(shape.contains(shape.center()), shape::toString);
        }
    }

    @Test
    public void testIntersectsAgreesWithBounds() {
        var random = new Random(0xB0B);
        for (int i = 0; i < 200; i++) {
            var shape = randomShape(random);
            // a box holding the whole shape overlaps it, a box beyond the bounding box does not
            assertTrue(shape.intersects(shape.min().subtract(1, 1, 1), shape.max().add(1, 1, 1)));
            var beyond = shape.max().add(0.5, 0.5, 0.5);
            assertFalse(shape.intersects(beyond, beyond.add(1, 1, 1)));
        }
    }

    static Shape randomShape(Random random) {
        var center = new Point(random.nextDouble() * 10 - 5, random.nextDouble() * 10 - 5,
                               random.nextDouble() * 10 - 5);
        return switch (random.nextInt(3)) {
            case 0 -> new Cuboid(center, center.add(random.nextDouble() * 4, random.nextDouble() * 4,
                                                    random.nextDouble() * 4));
            case 1 -> new Sphere(center, random.nextDouble() * 4);
            default -> new Circle(center, random.nextDouble() * 3, random.nextDouble() * 6,
                                  Axis.values()[random.nextInt(3)]);
        };
    }
}
