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
package com.hellblazer.targets.image;

/**
 * 16-bit gray levels and the mapping from the signed unit interval onto them.
 *
 * @author hal.hildebrand
 */
public final class Gray {

    public static final int BLACK     = 0;
    public static final int DARK_GRAY = 16383;
    public static final int MID_GRAY  = 32767;
    public static final int WHITE     = Canvas.MAX_VALUE;

    private static final double HALF_RANGE = 32767.5;

    private Gray() {
    }

    /**
     * Map {@code z} in [-1, 1] onto [0, 65535]. Values outside the interval are clamped.
     */
    public static int gray(double z) {
        long v = Math.round((z + 1.0) * HALF_RANGE);
        return (int) Math.max(BLACK, Math.min(WHITE, v));
    }
}
