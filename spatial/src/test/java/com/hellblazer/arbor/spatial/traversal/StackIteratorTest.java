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
package com.hellblazer.arbor.spatial.traversal;

import com.hellblazer.arbor.geometry.Point;
import com.hellblazer.arbor.geometry.Sphere;
import com.hellblazer.arbor.spatial.kdtree.KdTreeImpl;
import com.hellblazer.arbor.spatial.octree.OctreeImpl;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class StackIteratorTest {

    @Test
    void testKdTreeIterationOrder() {
        var tree = new KdTreeImpl<String>();
        tree.insert(new Point(5, 5, 5), "root");
        tree.insert(new Point(8, 5, 5), "right");
        tree.insert(new Point(2, 5, 5), "left");
        tree.insert(new Point(1, 1, 5), "left-left");

        // pre-order, left before right
        var values = new ArrayList<String>();
        new KdTreeIterator<>(tree.getRoot()).forEachRemaining(values::add);
        assertEquals(List.of("root", "left", "left-left", "right"), values);
    }

    @Test
    void testExhaustion() {
        var iterator = new KdTreeIterator<String>(null);
        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);

        var tree = new KdTreeImpl<String>();
        tree.insert(Point.ZERO, "only");
        var single = tree.iterator();
        assertTrue(single.hasNext());
        // hasNext is idempotent
        assertTrue(single.hasNext());
        assertEquals("only", single.next());
        assertFalse(single.hasNext());
        assertThrows(NoSuchElementException.class, single::next);
    }

    @Test
    void testOctreeSkipsEmptyNodes() {
        var octree = new OctreeImpl<Integer>(new Point(0, 0, 0), new Point(64, 64, 64), 2);
        // all in one octant, the other seven children stay empty
        octree.insert(1, Sphere.point(new Point(1, 1, 1)));
        octree.insert(2, Sphere.point(new Point(10, 10, 10)));
        octree.insert(3, Sphere.point(new Point(20, 20, 20)));
        assertTrue(octree.hasChildren());

        var values = new ArrayList<Integer>();
        new OctreeValueIterator<>(octree).forEachRemaining(values::add);
        values.sort(Integer::compareTo);
        assertEquals(List.of(1, 2, 3), values);

        var entries = new OctreeEntryIterator<>(octree);
        int count = 0;
        while (entries.hasNext()) {
            assertNotNull(entries.next().getShape());
            count++;
        }
        assertEquals(3, count);
        assertThrows(NoSuchElementException.class, entries::next);
    }
}
