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

/**
 * Immutable 16-bit to 16-bit lookup table sampling a {@link TransferFunction} over its full domain.
 *
 * <p>Never written after construction, so instances may be read concurrently without
 * synchronization.
 *
 * @author hal.hildebrand
 */
public final class TransferLUT {

    public static final int SIZE = 1 << 16;

    private static final double MAX = SIZE - 1;

    private final TransferFunction function;
    private final short[]          table;

    private TransferLUT(TransferFunction function, short[] table) {
        this.function = function;
        this.table = table;
    }

    /**
     * Sample {@code function} at all 65536 inputs, rounding and clamping each output to 16 bits.
     */
    public static TransferLUT build(TransferFunction function) {
        var table = new short[SIZE];
        for (int i = 0; i < SIZE; i++) {
            double out = function.apply(i / MAX) * MAX;
            long v = Math.round(out);
            table[i] = (short) Math.max(0, Math.min(SIZE - 1, v));
        }
        return new TransferLUT(function, table);
    }

    public int get(int sample) {
        return table[sample] & 0xFFFF;
    }

    /**
     * @return true when {@code lut[i] <= lut[i + 1]} holds across the whole table
     */
    public boolean isMonotonic() {
        for (int i = 1; i < SIZE; i++) {
            if (get(i - 1) > get(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "TransferLUT[" + function + "]";
    }
}
