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

import static com.hellblazer.targets.image.Gray.*;

/**
 * Hard threshold at mid gray followed by a Gaussian blur that softens the resulting edges.
 *
 * @author hal.hildebrand
 */
public final class ThresholdSmooth implements PostProcessor {

    public static final String SUFFIX        = "_clamp";
    public static final double DEFAULT_SIGMA = 1.0;

    private final GaussianBlur blur;

    public ThresholdSmooth() {
        this(DEFAULT_SIGMA);
    }

    public ThresholdSmooth(double sigma) {
        this.blur = new GaussianBlur(sigma);
    }

    @Override
    public Canvas process(RenderedImage image) {
        var out = threshold(image.synthesized());
        blur.applyInPlace(out);
        return out;
    }

    /**
     * White where red exceeds {@value com.hellblazer.targets.image.Gray#MID_GRAY}, black elsewhere.
     */
    public static Canvas threshold(Canvas in) {
        var out = new Canvas(in.width(), in.height());
        for (int y = in.minY(); y < in.maxY(); y++) {
            for (int x = in.minX(); x < in.maxX(); x++) {
                out.setGray(x, y, in.red(x, y) > MID_GRAY ? WHITE : BLACK);
            }
        }
        return out;
    }

    @Override
    public String suffix() {
        return SUFFIX;
    }
}
