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
 * Transfer functions over normalized samples in [0, 1].
 *
 * <ul>
 * <li><b>LINEAR</b>: identity</li>
 * <li><b>SRGB_ENCODE</b>: linear light to sRGB, {@code 12.92x} below 0.0031308, else {@code 1.055x^(1/2.4) - 0.055}</li>
 * <li><b>SRGB_DECODE</b>: sRGB to linear light, {@code x/12.92} below 0.04045, else {@code ((x+0.055)/1.055)^2.4}</li>
 * <li><b>GAMMA22_ENCODE</b>: {@code x^2.2}</li>
 * <li><b>GAMMA22_DECODE</b>: {@code x^(1/2.2)}</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public enum TransferFunction {
    LINEAR("linear") {
        @Override
        public double apply(double x) {
            return x;
        }
    },
    SRGB_ENCODE("srgb") {
        @Override
        public double apply(double x) {
            if (x <= SRGB_LINEAR_LIMIT) {
                return x * SRGB_SLOPE;
            }
            return (1.0 + SRGB_A) * Math.pow(x, 1.0 / SRGB_GAMMA) - SRGB_A;
        }
    },
    SRGB_DECODE("srgb-inverse") {
        @Override
        public double apply(double x) {
            if (x <= SRGB_ENCODED_LIMIT) {
                return x / SRGB_SLOPE;
            }
            return Math.pow((x + SRGB_A) / (1.0 + SRGB_A), SRGB_GAMMA);
        }
    },
    GAMMA22_ENCODE("gamma22") {
        @Override
        public double apply(double x) {
            return Math.pow(x, GAMMA_22);
        }
    },
    GAMMA22_DECODE("gamma22-inverse") {
        @Override
        public double apply(double x) {
            return Math.pow(x, 1.0 / GAMMA_22);
        }
    };

    private static final double SRGB_A             = 0.055;
    private static final double SRGB_GAMMA         = 2.4;
    private static final double SRGB_SLOPE         = 12.92;
    private static final double SRGB_LINEAR_LIMIT  = 0.0031308;
    private static final double SRGB_ENCODED_LIMIT = 0.04045;
    private static final double GAMMA_22           = 2.2;

    private final String key;

    TransferFunction(String key) {
        this.key = key;
    }

    public static TransferFunction fromString(String key) {
        for (var fn : values()) {
            if (fn.key.equals(key)) {
                return fn;
            }
        }
        throw new IllegalArgumentException("Unknown transfer function: " + key);
    }

    /**
     * Evaluate the function on a normalized sample.
     */
    public abstract double apply(double x);
}
