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
package com.hellblazer.targets.post;

import com.hellblazer.targets.image.Canvas;
import com.hellblazer.targets.image.RenderedImage;

import java.util.Random;

import static com.hellblazer.targets.image.Gray.BLACK;
import static com.hellblazer.targets.image.Gray.WHITE;

/**
 * Random-threshold halftone. Every pixel becomes white with probability {@code red / 65536}.
 *
 * <p>The generator is re-seeded with the same constant for every image and consumed in row-major order, so the
 * output depends only on the input canvas.
 *
 * @author hal.hildebrand
 */
public final class StochasticDither implements PostProcessor {

    public static final long   SEED   = 1L;
    public static final String SUFFIX = "_dith";

    @Override
    public Canvas process(RenderedImage image) {
        return dither(image.synthesized());
    }

    public static Canvas dither(Canvas in) {
        var out = new Canvas(in.width(), in.height());
        var random = new Random(SEED);
        for (int y = in.minY(); y < in.maxY(); y++) {
            for (int x = in.minX(); x < in.maxX(); x++) {
                int draw = random.nextInt(Canvas.MAX_VALUE + 1);
                out.setGray(x, y, draw < in.red(x, y) ? WHITE : BLACK);
            }
        }
        return out;
    }

    @Override
    public String suffix() {
        return SUFFIX;
    }
}
