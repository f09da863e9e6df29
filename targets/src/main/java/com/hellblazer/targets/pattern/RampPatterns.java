/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Targets.
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
package com.hellblazer.targets.pattern;

import com.hellblazer.targets.color.LookupTables;
import com.hellblazer.targets.color.TransferLUT;
import com.hellblazer.targets.image.Canvas;

import java.util.Random;

import static com.hellblazer.targets.image.Gray.BLACK;
import static com.hellblazer.targets.image.Gray.WHITE;

/**
 * Calibration ramps and flat fields.
 *
 * <p>A ramp runs linearly from black at the left column to white at the right. Rows alternate in bands of height
 * {@code max(1, H / (2 * density))}: even bands carry the plain ramp, odd bands an ordered reference where a pixel is
 * white when a fixed-seed 16-bit draw, mapped through the ramp's transfer table, falls below the column intensity.
 *
 * @author hal.hildebrand
 */
public final class RampPatterns {

    static final long RAMP_SEED    = 0x2545F4914F6CDD1DL;
    static final int  FIELD_LEVELS = 480;

    private RampPatterns() {
    }

    static void register(PatternRegistry.Builder registry, LookupTables tables) {
        registry.add("linearRamp", PatternFamily.RAMP, spec -> ramp(spec, tables.linear()))
                .add("gammaRamp", PatternFamily.RAMP, spec -> ramp(spec, tables.gammaEncode()))
                .add("inverseGammaRamp", PatternFamily.RAMP, spec -> ramp(spec, tables.gammaDecode()))
                .add("field", PatternFamily.RAMP, RampPatterns::field);
    }

    static SynthesisResult ramp(PatternSpec spec, TransferLUT lut) {
        var canvas = new Canvas(spec.width(), spec.height());
        int band = bandHeight(spec);
        var random = new Random(RAMP_SEED);
        for (int row = 0; row < canvas.height(); row++) {
            int y = canvas.minY() + row;
            boolean reference = (row / band) % 2 == 1;
            for (int col = 0; col < canvas.width(); col++) {
                int x = canvas.minX() + col;
                int level = columnLevel(col, canvas.width());
                if (reference) {
                    int draw = lut.get(random.nextInt(TransferLUT.SIZE));
                    canvas.setGray(x, y, draw < level ? WHITE : BLACK);
                } else {
                    canvas.setGray(x, y, level);
                }
            }
        }
        return new SynthesisResult(canvas, false);
    }

    static int bandHeight(PatternSpec spec) {
        return Math.max(1, spec.height() / (2 * spec.density()));
    }

    static int columnLevel(int col, int width) {
        if (width == 1) {
            return WHITE;
        }
        return (int) ((long) col * WHITE / (width - 1));
    }

    /**
     * Uniform gray at {@code density / 480} of full scale.
     */
    static SynthesisResult field(PatternSpec spec) {
        int level = (int) Math.min(WHITE, (long) spec.density() * WHITE / FIELD_LEVELS);
        return new SynthesisResult(Canvas.filled(spec.width(), spec.height(), level), true);
    }
}
