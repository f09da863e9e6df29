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

import java.awt.*;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Arrays;

/**
 * Anti-aliased vector drawing onto a {@link Canvas}.
 *
 * <p>Shapes are accumulated, in centered canvas coordinates, into an 8-bit coverage mask through
 * Java2D. {@link #composite(int)} then blends the mask into the canvas toward a 16-bit gray
 * level and clears it, so gray levels keep their full 16-bit precision.
 *
 * @author hal.hildebrand
 */
public final class ShapeRasterizer implements AutoCloseable {

    private final Canvas        canvas;
    private final BufferedImage mask;
    private final Graphics2D    graphics;
    private final byte[]        coverage;

    public ShapeRasterizer(Canvas canvas) {
        this.canvas = canvas;
        this.mask = new BufferedImage(canvas.width(), canvas.height(), BufferedImage.TYPE_BYTE_GRAY);
        this.coverage = ((DataBufferByte) mask.getRaster().getDataBuffer()).getData();
        this.graphics = mask.createGraphics();
        graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
        graphics.setColor(Color.WHITE);
        graphics.translate(-canvas.minX(), -canvas.minY());
    }

    public void fill(Shape shape) {
        graphics.fill(shape);
    }

    public void stroke(Shape shape, double lineWidth) {
        graphics.setStroke(new BasicStroke((float) lineWidth, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER));
        graphics.draw(shape);
    }

    /**
     * Blend the accumulated coverage into the canvas toward {@code gray}, then clear the mask.
     */
    public void composite(int gray) {
        int width = canvas.width();
        int height = canvas.height();
        for (int row = 0; row < height; row++) {
            int y = canvas.minY() + row;
            for (int col = 0; col < width; col++) {
                int c = coverage[row * width + col] & 0xFF;
                if (c == 0) {
                    continue;
                }
                int x = canvas.minX() + col;
                int current = canvas.red(x, y);
                int blended = c == 0xFF ? gray : current + Math.round((gray - current) * (c / 255.0f));
                canvas.setGray(x, y, blended);
            }
        }
        Arrays.fill(coverage, (byte) 0);
    }

    @Override
    public void close() {
        graphics.dispose();
    }
}
