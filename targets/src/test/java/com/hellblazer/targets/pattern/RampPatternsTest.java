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

import com.hellblazer.targets.color.LookupTables;
import com.hellblazer.targets.color.TransferFunction;
import com.hellblazer.targets.color.TransferLUT;
import org.junit.jupiter.api.Test;

import static com.hellblazer.targets.image.Gray.*;
import static org.junit.jupiter.api.Assertions.*;

public class RampPatternsTest {

    private static final PatternSpec SPEC = new PatternSpec("ramp", 256, 64, 2);

    @Test
    public void testBandsAlternate() {
        assertEquals(16, RampPatterns.bandHeight(SPEC));
        var canvas = RampPatterns.ramp(SPEC, TransferLUT.build(TransferFunction.LINEAR)).canvas();

        for (int col = 0; col < canvas.width(); col++) {
            int x = canvas.minX() + col;
            assertEquals(col * 257, canvas.red(x, canvas.minY()));
            assertEquals(col * 257, canvas.red(x, canvas.minY() + 47));
            int reference = canvas.red(x, canvas.minY() + 16);
            assertTrue(reference == WHITE || reference == BLACK);
        }
    }

    @Test
    public void testLinearReferenceTracksRamp() {
        var canvas = RampPatterns.ramp(SPEC, TransferLUT.build(TransferFunction.LINEAR)).canvas();
        for (int block = 0; block < 8; block++) {
            int white = 0;
            int total = 0;
            long level = 0;
            for (int row = 16; row < 32; row++) {
                for (int col = block * 32; col < block * 32 + 32; col++) {
                    int x = canvas.minX() + col;
                    int y = canvas.minY() + row;
                    if (canvas.red(x, y) == WHITE) {
                        white++;
                    }
                    level += canvas.red(x, canvas.minY());
                    total++;
                }
            }
            double expected = (double) level / total / 65536.0;
            assertEquals(expected, (double) white / total, 0.1, "block " + block);
        }
    }

    @Test
    public void testGammaRampsUseTheirOwnTables() {
        var tables = LookupTables.build();
        var registry = PatternRegistry.standard(tables);
        var spec = new PatternSpec("ramp", 256, 256, 2);

        double gamma = midRampWhiteFraction(registry.require("gammaRamp"), spec, tables.gammaEncode());
        double inverse = midRampWhiteFraction(registry.require("inverseGammaRamp"), spec, tables.gammaDecode());

        // a linear draw would leave the middle of the ramp about half white
        assertTrue(gamma > 0.65, "gammaRamp white fraction " + gamma);
        assertTrue(inverse < 0.3, "inverseGammaRamp white fraction " + inverse);
    }

    /**
     * White fraction of the reference bands over the middle sixteen columns, checked against the fraction the
     * table predicts for those columns.
     */
    private static double midRampWhiteFraction(Pattern pattern, PatternSpec spec, TransferLUT lut) {
        var canvas = pattern.synthesize(spec).orElseThrow().canvas();
        int band = RampPatterns.bandHeight(spec);
        assertEquals(64, band);

        double expected = 0.0;
        for (int col = 120; col < 136; col++) {
            int level = RampPatterns.columnLevel(col, canvas.width());
            int below = 0;
            for (int r = 0; r < TransferLUT.SIZE; r++) {
                if (lut.get(r) < level) {
                    below++;
                }
            }
            expected += (double) below / TransferLUT.SIZE;
        }
        expected /= 16;

        int white = 0;
        int total = 0;
        for (int row = 0; row < canvas.height(); row++) {
            if ((row / band) % 2 == 0) {
                continue;
            }
            for (int col = 120; col < 136; col++) {
                if (canvas.red(canvas.minX() + col, canvas.minY() + row) == WHITE) {
                    white++;
                }
                total++;
            }
        }
        assertEquals(2048, total);
        double observed = (double) white / total;
        assertEquals(expected, observed, 0.05, pattern.name());
        return observed;
    }

    @Test
    public void testColumnLevel() {
        assertEquals(BLACK, RampPatterns.columnLevel(0, 100));
        assertEquals(WHITE, RampPatterns.columnLevel(99, 100));
        assertEquals(WHITE, RampPatterns.columnLevel(0, 1));
    }

    @Test
    public void testField() {
        var full = RampPatterns.field(new PatternSpec("field", 32, 32, 480));
        assertTrue(full.needsPostProcess());
        assertEquals(WHITE, full.canvas().red(0, 0));

        var half = RampPatterns.field(new PatternSpec("field", 32, 32, 240)).canvas();
        assertEquals(32767, half.red(-16, 15));
        assertEquals(32767, half.red(15, -16));
    }
}
