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

package com.hellblazer.targets.post;

import com.hellblazer.targets.image.Canvas;
import com.hellblazer.targets.image.Gray;
import com.hellblazer.targets.image.RenderedImage;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the stochastic 1-bit dither.
 *
 * @author hal.hildebrand
 */
public class StochasticDitherTest {

    private static Canvas horizontalRamp(int width, int height) {
        var canvas = new Canvas(width, height);
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                canvas.setGray(x, y, (x - canvas.minX()) * 257);
            }
        }
        return canvas;
    }

    @Test
    public void testBinaryOutput() {
        var out = StochasticDither.dither(horizontalRamp(64, 64));
        for (int y = out.minY(); y < out.maxY(); y++) {
            for (int x = out.minX(); x < out.maxX(); x++) {
                int v = out.red(x, y);
                assertTrue(v == Gray.WHITE || v == Gray.BLACK);
            }
        }
    }

    @Test
    public void testLocalDensityTracksIntensity() {
        var ramp = horizontalRamp(256, 1024);
        var out = StochasticDither.dither(ramp);
        for (int block = 0; block < 16; block++) {
            long level = 0;
            int white = 0;
            int total = 0;
            for (int y = out.minY(); y < out.maxY(); y++) {
                for (int x = out.minX() + block * 16; x < out.minX() + block * 16 + 16; x++) {
                    level += ramp.red(x, y);
                    if (out.red(x, y) == Gray.WHITE) {
                        white++;
                    }
                    total++;
                }
            }
            double expected = (double) level / total / 65536.0;
            assertEquals(expected, (double) white / total, 0.02, "block " + block);
        }
    }

    @Test
    public void testExtremes() {
        var black = StochasticDither.dither(Canvas.filled(32, 32, Gray.BLACK));
        var white = StochasticDither.dither(Canvas.filled(32, 32, Gray.WHITE));
        int whiteCount = 0;
        for (int y = -16; y < 16; y++) {
            for (int x = -16; x < 16; x++) {
                assertEquals(Gray.BLACK, black.red(x, y));
                if (white.red(x, y) == Gray.WHITE) {
                    whiteCount++;
                }
            }
        }
        // a draw of exactly 65535 still yields black
        assertTrue(whiteCount >= 1020, "white pixels " + whiteCount);
    }

    @Test
    public void testReproducible() {
        var ramp = horizontalRamp(128, 32);
        assertTrue(StochasticDither.dither(ramp).contentEquals(StochasticDither.dither(ramp)));
    }

    @Test
    public void testProcessReadsSynthesizedCanvas() {
        var synthesized = horizontalRamp(64, 16);
        var dither = new StochasticDither();
        var image = new RenderedImage("ramp", synthesized, true);
        assertEquals(64, image.width());
        assertEquals(16, image.height());
        var out = dither.process(image);
        assertTrue(out.contentEquals(StochasticDither.dither(synthesized)));
        assertEquals("_dith", dither.suffix());
    }
}
