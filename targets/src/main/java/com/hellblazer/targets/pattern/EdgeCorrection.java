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

import com.hellblazer.targets.image.Canvas;

/**
 * Removes the one pixel seam that bucket-parity rasterization leaves along the frame.
 *
 * <p>Rows first, then columns: each border row is overwritten by its interior neighbour row wherever the two
 * differ, then each border column likewise. Afterwards every border pixel equals its interior neighbour.
 *
 * @author hal.hildebrand
 */
public final class EdgeCorrection {

    private EdgeCorrection() {
    }

    /**
     * Correct the canvas in place.
     *
     * @return the number of border pixels overwritten
     */
    public static int apply(Canvas canvas) {
        if (canvas.width() < 2 || canvas.height() < 2) {
            return 0;
        }
        int top = canvas.minY();
        int bottom = canvas.maxY() - 1;
        int left = canvas.minX();
        int right = canvas.maxX() - 1;

        int corrected = 0;
        for (int x = left; x <= right; x++) {
            corrected += replaceIfDifferent(canvas, x, top + 1, x, top);
            corrected += replaceIfDifferent(canvas, x, bottom - 1, x, bottom);
        }
        for (int y = top; y <= bottom; y++) {
            corrected += replaceIfDifferent(canvas, left + 1, y, left, y);
            corrected += replaceIfDifferent(canvas, right - 1, y, right, y);
        }
        return corrected;
    }

    private static int replaceIfDifferent(Canvas canvas, int fromX, int fromY, int toX, int toY) {
        if (canvas.samePixel(fromX, fromY, toX, toY)) {
            return 0;
        }
        canvas.copyPixel(fromX, fromY, toX, toY);
        return 1;
    }
}
