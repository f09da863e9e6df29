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

import static com.hellblazer.targets.image.Gray.*;

/**
 * Grid and line patterns rasterized by coordinate bucket parity.
 *
 * <p>Density is the number of cells (lines, squares or stripes) along the long edge; one cell spans
 * {@code longEdge / density} pixels. Every result passes through {@link EdgeCorrection} and never requests a
 * post-processed variant.
 *
 * @author hal.hildebrand
 */
public final class GridPatterns {

    static final double JAIL_LINE_FRACTION  = 0.05;
    static final double MAX_JAIL_LINE_WIDTH = 5.0;

    private static final double SQRT2 = Math.sqrt(2.0);

    private GridPatterns() {
    }

    static void register(PatternRegistry.Builder registry) {
        registry.add("jailWhite", PatternFamily.GRID, spec -> jail(spec, WHITE, BLACK))
                .add("jailBlack", PatternFamily.GRID, spec -> jail(spec, BLACK, WHITE))
                .add("jailDark", PatternFamily.GRID, spec -> jail(spec, DARK_GRAY, WHITE))
                .add("jailMid", PatternFamily.GRID, spec -> jail(spec, MID_GRAY, WHITE))
                .add("jailCheck", PatternFamily.GRID, GridPatterns::jailCheck)
                .add("check", PatternFamily.GRID, GridPatterns::checkerboard)
                .add("stripesh", PatternFamily.GRID, spec -> stripes(spec, 90))
                .add("stripesv", PatternFamily.GRID, spec -> stripes(spec, 0))
                .add("stripesdl", PatternFamily.GRID, spec -> stripes(spec, 45))
                .add("stripesdr", PatternFamily.GRID, spec -> stripes(spec, -45))
                .add("diamond", PatternFamily.GRID, GridPatterns::diamond)
                .add("crosshatch", PatternFamily.GRID, GridPatterns::crosshatch);
    }

    static SynthesisResult jail(PatternSpec spec, int background, int line) {
        var canvas = Canvas.filled(spec.width(), spec.height(), background);
        paintJail(canvas, spec.cell(), 0, line);
        return corrected(canvas);
    }

    static SynthesisResult jailCheck(PatternSpec spec) {
        var canvas = Canvas.filled(spec.width(), spec.height(), WHITE);
        paintChecker(canvas, spec.cell(), gray(0.25));
        paintJail(canvas, spec.cell(), 0, BLACK);
        return corrected(canvas);
    }

    static SynthesisResult checkerboard(PatternSpec spec) {
        var canvas = Canvas.filled(spec.width(), spec.height(), WHITE);
        paintChecker(canvas, spec.cell(), BLACK);
        return corrected(canvas);
    }

    static SynthesisResult stripes(PatternSpec spec, double degrees) {
        var canvas = Canvas.filled(spec.width(), spec.height(), WHITE);
        paintStripes(canvas, spec.cell(), degrees, BLACK);
        return corrected(canvas);
    }

    static SynthesisResult diamond(PatternSpec spec) {
        var canvas = Canvas.filled(spec.width(), spec.height(), WHITE);
        paintJail(canvas, spec.cell(), 45, BLACK);
        return corrected(canvas);
    }

    static SynthesisResult crosshatch(PatternSpec spec) {
        var canvas = Canvas.filled(spec.width(), spec.height(), WHITE);
        paintJail(canvas, spec.cell(), 0, BLACK);
        paintJail(canvas, spec.cell() * SQRT2, 45, BLACK);
        return corrected(canvas);
    }

    /**
     * Squares of side {@code cell}; a square is inked when the sum of its bucket indices is even.
     */
    public static void paintChecker(Canvas canvas, double cell, int ink) {
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            long by = (long) Math.floor(y / cell);
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                long bx = (long) Math.floor(x / cell);
                if (((bx + by) & 1L) == 0) {
                    canvas.setGray(x, y, ink);
                }
            }
        }
    }

    /**
     * Stripes of width {@code cell} across the axis rotated by {@code degrees}; even buckets are inked.
     */
    public static void paintStripes(Canvas canvas, double cell, double degrees, int ink) {
        double theta = Math.toRadians(degrees);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                double u = x * cos + y * sin;
                if ((((long) Math.floor(u / cell)) & 1L) == 0) {
                    canvas.setGray(x, y, ink);
                }
            }
        }
    }

    /**
     * Lines through the origin at every multiple of {@code spacing} along both axes of a frame rotated by
     * {@code degrees}. Lines are {@code min(0.05 * spacing, 5)} pixels wide and never thinner than one pixel.
     */
    public static void paintJail(Canvas canvas, double spacing, double degrees, int ink) {
        double halfWidth = Math.max(jailLineWidth(spacing), 1.0) / 2.0;
        double theta = Math.toRadians(degrees);
        double cos = Math.cos(theta);
        double sin = Math.sin(theta);
        for (int y = canvas.minY(); y < canvas.maxY(); y++) {
            for (int x = canvas.minX(); x < canvas.maxX(); x++) {
                double u = x * cos + y * sin;
                double v = y * cos - x * sin;
                if (distanceToLine(u, spacing) <= halfWidth || distanceToLine(v, spacing) <= halfWidth) {
                    canvas.setGray(x, y, ink);
                }
            }
        }
    }

    static double jailLineWidth(double spacing) {
        return Math.min(JAIL_LINE_FRACTION * spacing, MAX_JAIL_LINE_WIDTH);
    }

    private static double distanceToLine(double coordinate, double spacing) {
        return Math.abs(coordinate - spacing * Math.rint(coordinate / spacing));
    }

    private static SynthesisResult corrected(Canvas canvas) {
        EdgeCorrection.apply(canvas);
        return new SynthesisResult(canvas, false);
    }
}
