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

import static com.hellblazer.targets.image.Gray.WHITE;
import static com.hellblazer.targets.image.Gray.gray;

/**
 * Continuous-tone radial and periodic patterns. Each pixel is {@code gray(z)} for a trigonometric {@code z} in
 * [-1, 1] of the pixel's Cartesian or polar coordinates.
 *
 * <p>All but {@code ringFade} request a post-processed variant.
 *
 * @author hal.hildebrand
 */
public final class RadialPatterns {

    static final double SQUARE_WAVE_EXPONENT_SCALE = 100.0;

    private RadialPatterns() {
    }

    static void register(PatternRegistry.Builder registry) {
        registry.add("radial", PatternFamily.RADIAL, RadialPatterns::radial)
                .add("rings", PatternFamily.RADIAL, RadialPatterns::rings)
                .add("ringFade", PatternFamily.RADIAL, RadialPatterns::ringFade)
                .add("wavy", PatternFamily.RADIAL, RadialPatterns::wavy)
                .add("radialWave", PatternFamily.RADIAL, RadialPatterns::radialWave)
                .add("ringWave", PatternFamily.RADIAL, RadialPatterns::ringWave)
                .add("squareWave", PatternFamily.RADIAL, RadialPatterns::squareWave);
    }

    /**
     * Chirp: phase grows with r², reaching {@code pi / density} radians per pixel of radius at the corners.
     */
    static SynthesisResult radial(PatternSpec spec) {
        var canvas = new Canvas(spec.width(), spec.height());
        double slope = (Math.PI / spec.density()) / spec.halfDiagonal();
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            double y2 = (double) y * y;
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                double r = Math.sqrt(x * (double) x + y2);
                canvas.setGray(x, y, gray(Math.cos(r * r * slope)));
            }
        }
        return new SynthesisResult(canvas, true);
    }

    /**
     * Concentric rings, one full cosine period per cell, brightest at the center.
     */
    static SynthesisResult rings(PatternSpec spec) {
        var canvas = new Canvas(spec.width(), spec.height());
        double f = 2.0 * Math.PI / spec.cell();
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            double y2 = (double) y * y;
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                double r = Math.sqrt(x * (double) x + y2);
                canvas.setGray(x, y, gray(Math.cos(r * f)));
            }
        }
        return new SynthesisResult(canvas, true);
    }

    /**
     * Radial sinc, {@code density} periods across the half diagonal. sin(0)/0 is taken as its limit, full white.
     */
    static SynthesisResult ringFade(PatternSpec spec) {
        var canvas = new Canvas(spec.width(), spec.height());
        double f = 2.0 * Math.PI / (spec.halfDiagonal() / spec.density());
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            double y2 = (double) y * y;
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                if (x == 0 && y == 0) {
                    canvas.setGray(x, y, WHITE);
                    continue;
                }
                double rho = Math.sqrt(x * (double) x + y2) * f;
                canvas.setGray(x, y, gray(Math.sin(rho) / rho));
            }
        }
        return new SynthesisResult(canvas, false);
    }

    /**
     * Egg crate: average of two axis cosines, a half period per cell.
     */
    static SynthesisResult wavy(PatternSpec spec) {
        var canvas = new Canvas(spec.width(), spec.height());
        double scale = Math.PI / spec.cell();
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            double cy = Math.cos(y * scale);
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                canvas.setGray(x, y, gray((Math.cos(x * scale) + cy) / 2.0));
            }
        }
        return new SynthesisResult(canvas, true);
    }

    /**
     * Angular sunburst with {@code density} periods around the origin.
     */
    static SynthesisResult radialWave(PatternSpec spec) {
        var canvas = new Canvas(spec.width(), spec.height());
        double n = spec.density();
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                double theta = Math.atan2(y, x);
                canvas.setGray(x, y, gray(Math.cos(Math.PI + theta * n)));
            }
        }
        return new SynthesisResult(canvas, true);
    }

    /**
     * Product of the sunburst and the ring cosine.
     */
    static SynthesisResult ringWave(PatternSpec spec) {
        var canvas = new Canvas(spec.width(), spec.height());
        double f = 2.0 * Math.PI / spec.cell();
        double n = spec.density();
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            double y2 = (double) y * y;
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                double r = Math.sqrt(x * (double) x + y2);
                double theta = Math.atan2(y, x);
                canvas.setGray(x, y, gray(Math.cos(Math.PI + theta * n) * Math.cos(r * f)));
            }
        }
        return new SynthesisResult(canvas, true);
    }

    /**
     * Separable chirp {@code cos(|x|^e) cos(|y|^e)} with exponent {@code e = density / 100}.
     */
    static SynthesisResult squareWave(PatternSpec spec) {
        var canvas = new Canvas(spec.width(), spec.height());
        double exponent = spec.density() / SQUARE_WAVE_EXPONENT_SCALE;
        double[] columns = new double[canvas.width()];
        for (int x = canvas.minX(); x < canvas.maxX(); x++) {
            columns[x - canvas.minX()] = Math.cos(Math.pow(Math.abs(x), exponent));
        }
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            double zy = Math.cos(Math.pow(Math.abs(y), exponent));
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                canvas.setGray(x, y, gray(zy * columns[x - canvas.minX()]));
            }
        }
        return new SynthesisResult(canvas, true);
    }
}
