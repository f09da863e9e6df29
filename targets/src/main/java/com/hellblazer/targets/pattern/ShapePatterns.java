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
import com.hellblazer.targets.image.ShapeRasterizer;

import javax.vecmath.Point2d;
import java.awt.geom.Arc2D;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Line2D;
import java.awt.geom.Path2D;
import java.util.ArrayList;
import java.util.List;

import static com.hellblazer.targets.image.Gray.*;

/**
 * Vector shape patterns: filled dots, stroked hexagons, angular wedges and string-art curves, drawn anti-aliased at
 * lattice positions derived from {@code longEdge / density}.
 *
 * @author hal.hildebrand
 */
public final class ShapePatterns {

    static final double STROKE_FRACTION  = 0.06;
    static final double MAX_STROKE_WIDTH = 6.0;
    static final double OFFSET_CENTER    = 1.5;

    private ShapePatterns() {
    }

    static void register(PatternRegistry.Builder registry) {
        registry.add("polkaDot", PatternFamily.SHAPE, spec -> polkaDot(spec, BLACK, WHITE))
                .add("polkaDark", PatternFamily.SHAPE, spec -> polkaDot(spec, WHITE, DARK_GRAY))
                .add("polkaMid", PatternFamily.SHAPE, spec -> polkaDot(spec, WHITE, MID_GRAY))
                .add("honeycomb", PatternFamily.SHAPE, ShapePatterns::honeycomb)
                .add("radialWedge", PatternFamily.SHAPE, spec -> radialWedge(spec, 0, 0))
                .add("radialWedgeOffsetX", PatternFamily.SHAPE, spec -> radialWedge(spec, -OFFSET_CENTER, 0))
                .add("radialWedgeOffsetY", PatternFamily.SHAPE, spec -> radialWedge(spec, 0, OFFSET_CENTER))
                .add("sCurve", PatternFamily.SHAPE, ShapePatterns::sCurve);
    }

    static SynthesisResult polkaDot(PatternSpec spec, int foreground, int background) {
        var canvas = Canvas.filled(spec.width(), spec.height(), background);
        double radius = dotRadius(spec);
        try (var raster = new ShapeRasterizer(canvas)) {
            for (var center : dotCenters(spec)) {
                raster.fill(new Ellipse2D.Double(center.x - radius, center.y - radius, 2 * radius, 2 * radius));
            }
            raster.composite(foreground);
        }
        return new SynthesisResult(canvas, false);
    }

    /**
     * Dot centers on the interior lattice points of a {@code density x density} grid laid along the long edge.
     * There are always {@code (density - 1)^2} of them; on a non-square canvas some fall outside the frame.
     */
    public static List<Point2d> dotCenters(PatternSpec spec) {
        int n = spec.density();
        int longEdge = spec.longEdge();
        int longMin = spec.height() > spec.width() ? -(spec.height() / 2) : -(spec.width() / 2);
        var centers = new ArrayList<Point2d>(Math.max(0, (n - 1) * (n - 1)));
        for (int xi = 1; xi < n; xi++) {
            int offsetX = longMin + (int) ((long) longEdge * xi / n);
            for (int yi = 1; yi < n; yi++) {
                int offsetY = longMin + (int) ((long) longEdge * yi / n);
                centers.add(new Point2d(offsetX, offsetY));
            }
        }
        return centers;
    }

    static double dotRadius(PatternSpec spec) {
        return (spec.longEdge() / spec.density()) / 5;
    }

    static SynthesisResult honeycomb(PatternSpec spec) {
        var canvas = Canvas.filled(spec.width(), spec.height(), WHITE);
        double d = spec.cell();
        double r = d / 2;
        try (var raster = new ShapeRasterizer(canvas)) {
            var cells = new Path2D.Double();
            for (var center : hexagonCenters(spec)) {
                appendHexagon(cells, center, r);
            }
            raster.stroke(cells, strokeWidth(spec));
            raster.composite(BLACK);
        }
        return new SynthesisResult(canvas, false);
    }

    /**
     * Centers of flat-topped hexagons with circumradius {@code cell / 2}, tiling from the top left corner. Odd
     * columns are shifted down by the inradius.
     */
    public static List<Point2d> hexagonCenters(PatternSpec spec) {
        double d = spec.cell();
        double r = d / 2;
        double innerR = r * Math.cos(Math.PI / 6);
        double side = d * Math.sin(Math.PI / 6);
        double wedge = side * Math.cos(Math.PI / 3);
        double minX = -spec.width() / 2.0;
        double minY = -spec.height() / 2.0;
        double maxX = spec.width() / 2.0;
        double maxY = spec.height() / 2.0;

        var centers = new ArrayList<Point2d>();
        for (double y = minY; y < maxY + innerR; y += 2 * innerR) {
            for (double x = minX; x < maxX + innerR; x += d + side) {
                centers.add(new Point2d(x, y));
            }
            for (double x = minX + wedge + side; x < maxX + innerR; x += d + side) {
                centers.add(new Point2d(x, y + innerR));
            }
        }
        return centers;
    }

    private static void appendHexagon(Path2D.Double path, Point2d center, double r) {
        for (int i = 0; i < 6; i++) {
            double a = Math.PI / 3 * i;
            double px = center.x + r * Math.cos(a);
            double py = center.y + r * Math.sin(a);
            if (i == 0) {
                path.moveTo(px, py);
            } else {
                path.lineTo(px, py);
            }
        }
        path.closePath();
    }

    /**
     * {@code 2 * density} sectors around an apex at {@code (offsetX * W/2, offsetY * H/2)}, starting at 45 degrees;
     * every other sector is black. Radii reach past every corner.
     */
    static SynthesisResult radialWedge(PatternSpec spec, double offsetX, double offsetY) {
        var canvas = Canvas.filled(spec.width(), spec.height(), WHITE);
        int sectors = spec.density() * 2;
        double cx = spec.width() / 2.0 * offsetX;
        double cy = spec.height() / 2.0 * offsetY;
        double r = Math.sqrt(cx * cx + cy * cy) + spec.longEdge();
        try (var raster = new ShapeRasterizer(canvas)) {
            for (int i = 0; i < sectors; i += 2) {
                double start = wedgeAngle(i, sectors);
                double end = wedgeAngle(i + 1, sectors);
                // Arc2D angles run counterclockwise on screen, canvas y grows downward
                raster.fill(new Arc2D.Double(cx - r, cy - r, 2 * r, 2 * r, -Math.toDegrees(start),
                                             -Math.toDegrees(end - start), Arc2D.PIE));
            }
            raster.composite(BLACK);
        }
        return new SynthesisResult(canvas, false);
    }

    static double wedgeAngle(int i, int sectors) {
        return Math.PI * 2 * i / sectors + Math.PI / 4;
    }

    /**
     * String-art envelope: {@code density + 1} chords per quadrant joining the vertical half axis to the
     * horizontal one, which together trace four concave curves.
     */
    static SynthesisResult sCurve(PatternSpec spec) {
        var canvas = Canvas.filled(spec.width(), spec.height(), WHITE);
        double n = spec.density();
        double halfW = spec.width() / 2.0;
        double halfH = spec.height() / 2.0;
        double dx = halfW / n;
        double dy = halfH / n;
        try (var raster = new ShapeRasterizer(canvas)) {
            var chords = new Path2D.Double();
            for (int i = 0; i <= spec.density(); i++) {
                double xDelta = dx * i;
                double yDelta = halfH - dy * i;
                chords.append(new Line2D.Double(0, yDelta, xDelta, 0), false);
                chords.append(new Line2D.Double(xDelta, 0, 0, -yDelta), false);
                chords.append(new Line2D.Double(0, -yDelta, -xDelta, 0), false);
                chords.append(new Line2D.Double(-xDelta, 0, 0, yDelta), false);
            }
            raster.stroke(chords, strokeWidth(spec));
            raster.composite(BLACK);
        }
        return new SynthesisResult(canvas, false);
    }

    static double strokeWidth(PatternSpec spec) {
        return Math.min(STROKE_FRACTION * spec.cell(), MAX_STROKE_WIDTH);
    }
}
