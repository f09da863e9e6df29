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

/**
 * Separable Gaussian blur over R, G and B with clamp-to-edge sampling. Alpha is copied.
 *
 * @author hal.hildebrand
 */
public final class GaussianBlur {

    private final double[] kernel;
    private final int      radius;

    public GaussianBlur(double sigma) {
        if (!(sigma > 0.0)) {
            throw new IllegalArgumentException("Sigma must be positive, got: " + sigma);
        }
        this.radius = (int) Math.ceil(3.0 * sigma);
        this.kernel = kernel(sigma, radius);
    }

    static double[] kernel(double sigma, int radius) {
        var weights = new double[2 * radius + 1];
        double sum = 0.0;
        for (int i = -radius; i <= radius; i++) {
            double w = Math.exp(-(i * i) / (2.0 * sigma * sigma));
            weights[i + radius] = w;
            sum += w;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= sum;
        }
        return weights;
    }

    public Canvas apply(Canvas in) {
        var out = in.copy();
        applyInPlace(out);
        return out;
    }

    /**
     * Blur {@code canvas} in place. The horizontal pass writes into a single scratch canvas and the vertical pass
     * writes back into {@code canvas}.
     */
    public void applyInPlace(Canvas canvas) {
        int w = canvas.width();
        int h = canvas.height();
        var horizontal = new Canvas(w, h);
        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                for (int c = 0; c < 3; c++) {
                    double acc = 0.0;
                    for (int k = -radius; k <= radius; k++) {
                        acc += kernel[k + radius] * canvas.sample(sampleIndex(row, clamp(col + k, w), w) + c);
                    }
                    horizontal.setSample(sampleIndex(row, col, w) + c, quantize(acc));
                }
            }
        }

        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                for (int c = 0; c < 3; c++) {
                    double acc = 0.0;
                    for (int k = -radius; k <= radius; k++) {
                        acc += kernel[k + radius] * horizontal.sample(sampleIndex(clamp(row + k, h), col, w) + c);
                    }
                    canvas.setSample(sampleIndex(row, col, w) + c, quantize(acc));
                }
            }
        }
    }

    private static int sampleIndex(int row, int col, int width) {
        return (row * width + col) * Canvas.CHANNELS;
    }

    private static int quantize(double v) {
        return (int) Math.max(0, Math.min(Canvas.MAX_VALUE, Math.round(v)));
    }

    private static int clamp(int i, int size) {
        return i < 0 ? 0 : (i >= size ? size - 1 : i);
    }

    public int radius() {
        return radius;
    }
}
