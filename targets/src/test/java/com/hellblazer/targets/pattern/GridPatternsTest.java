/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.targets.pattern;

import org.junit.jupiter.api.Test;

import static com.hellblazer.targets.image.Gray.*;
import static org.junit.jupiter.api.Assertions.*;

public class GridPatternsTest {

    private static final PatternSpec SPEC = new PatternSpec("grid", 100, 100, 10);

    @Test
    public void testCheckerboardCells() {
        var result = GridPatterns.checkerboard(SPEC);
        var canvas = result.canvas();
        assertFalse(result.needsPostProcess());
        assertEquals(BLACK, canvas.red(0, 0));
        assertEquals(BLACK, canvas.red(9, 9));
        assertEquals(WHITE, canvas.red(10, 0));
        assertEquals(WHITE, canvas.red(-1, 0));
        assertEquals(BLACK, canvas.red(-1, -1));
    }

    @Test
    public void testVerticalAndHorizontalStripes() {
        var vertical = GridPatterns.stripes(SPEC, 0).canvas();
        assertEquals(BLACK, vertical.red(0, 37));
        assertEquals(WHITE, vertical.red(15, 37));
        assertEquals(BLACK, vertical.red(25, -20));

        var horizontal = GridPatterns.stripes(SPEC, 90).canvas();
        assertEquals(BLACK, horizontal.red(0, 5));
        assertEquals(WHITE, horizontal.red(0, 15));
    }

    @Test
    public void testJailLines() {
        var canvas = GridPatterns.jail(SPEC, WHITE, BLACK).canvas();
        assertEquals(BLACK, canvas.red(0, 5));
        assertEquals(BLACK, canvas.red(20, 33));
        assertEquals(BLACK, canvas.red(33, -30));
        assertEquals(WHITE, canvas.red(5, 5));
        assertEquals(WHITE, canvas.red(-15, 25));
    }

    @Test
    public void testJailCheckCombinesCheckerAndLines() {
        var canvas = GridPatterns.jailCheck(SPEC).canvas();
        assertEquals(BLACK, canvas.red(0, 0));
        assertEquals(gray(0.25), canvas.red(5, 5));
        assertEquals(WHITE, canvas.red(15, 5));
    }

    @Test
    public void testJailLineWidth() {
        assertEquals(0.5, GridPatterns.jailLineWidth(10), 1e-12);
        assertEquals(5.0, GridPatterns.jailLineWidth(384), 1e-12);
    }
}
