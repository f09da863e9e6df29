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
package com.hellblazer.targets.color;

import com.hellblazer.targets.image.Canvas;

/**
 * Per-channel transfer conversion.
 *
 * @author hal.hildebrand
 */
public final class ColorPipeline {

    private ColorPipeline() {
    }

    /**
     * Map R, G and B of every pixel through {@code lut}, copying alpha. The input is left untouched.
     *
     * @return a new canvas of identical dimensions
     */
    public static Canvas convert(Canvas in, TransferLUT lut) {
        var out = in.copy();
        int n = out.sampleCount();
        for (int i = 0; i < n; i += Canvas.CHANNELS) {
            out.setSample(i + Canvas.RED, lut.get(in.sample(i + Canvas.RED)));
            out.setSample(i + Canvas.GREEN, lut.get(in.sample(i + Canvas.GREEN)));
            out.setSample(i + Canvas.BLUE, lut.get(in.sample(i + Canvas.BLUE)));
        }
        return out;
    }
}
