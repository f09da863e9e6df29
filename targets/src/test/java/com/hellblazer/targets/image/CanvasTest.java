/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.targets.image;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the centered 16-bit RGBA canvas.
 *
 * @author hal.hildebrand
 */
public class CanvasTest {

    @Test
    public void testCenteredBounds() {
        var canvas = new Canvas(4, 3);
        assertEquals(-2, canvas.minX());
        assertEquals(2, canvas.maxX());
        assertEquals(-1, canvas.minY());
        assertEquals(2, canvas.maxY());

        canvas.setGray(-2, -1, Gray.WHITE);
        canvas.setGray(1, 1, Gray.WHITE);
        assertThrows(IndexOutOfBoundsException.class, () -> canvas.red(2, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> canvas.red(0, -2));
    }

    @Test
    public void testInvalidDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new Canvas(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new Canvas(10, -1));
    }

    @Test
    public void testSetAndGet() {
        var canvas = new Canvas(8, 8);
        canvas.set(-4, 3, 1, 2, 3, 65535);
        assertEquals(1, canvas.get(-4, 3, Canvas.RED));
        assertEquals(2, canvas.get(-4, 3, Canvas.GREEN));
        assertEquals(3, canvas.get(-4, 3, Canvas.BLUE));
        assertEquals(65535, canvas.get(-4, 3, Canvas.ALPHA));

        canvas.setGray(0, 0, 40000);
        assertEquals(40000, canvas.red(0, 0));
        assertEquals(40000, canvas.get(0, 0, Canvas.BLUE));
        assertEquals(Canvas.MAX_VALUE, canvas.get(0, 0, Canvas.ALPHA));
    }

    @Test
    public void testOutOfBounds() {
        var canvas = new Canvas(8, 8);
        assertThrows(IndexOutOfBoundsException.class, () -> canvas.red(4, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> canvas.setGray(0, -5, 0));
    }

    @Test
    public void testFilledAndCopy() {
        var canvas = Canvas.filled(5, 5, Gray.MID_GRAY);
        var copy = canvas.copy();
        assertTrue(canvas.contentEquals(copy));

        copy.setGray(0, 0, Gray.WHITE);
        assertEquals(Gray.MID_GRAY, canvas.red(0, 0));
        assertFalse(canvas.contentEquals(copy));
    }

    @Test
    public void testPixelCopy() {
        var canvas = Canvas.filled(4, 4, Gray.BLACK);
        canvas.setGray(0, 0, Gray.WHITE);
        assertFalse(canvas.samePixel(0, 0, 1, 0));

        canvas.copyPixel(0, 0, 1, 0);
        assertTrue(canvas.samePixel(0, 0, 1, 0));
        assertEquals(Gray.WHITE, canvas.red(1, 0));
    }

    @Test
    public void testRawSamples() {
        var canvas = new Canvas(2, 2);
        assertEquals(16, canvas.sampleCount());
        canvas.setSample(5, 65535);
        assertEquals(65535, canvas.sample(5));
    }

    @Test
    public void testImageViewSharesSamples() {
        var canvas = new Canvas(3, 2);
        var image = canvas.asBufferedImage();
        assertEquals(3, image.getWidth());
        assertEquals(2, image.getHeight());
        assertEquals(16, image.getColorModel().getComponentSize(0));
        assertTrue(image.getColorModel().hasAlpha());

        // top left pixel is (-1, -1); bottom right is (1, 0)
        canvas.set(1, 0, 1000, 2000, 65535, 40000);
        var raster = image.getRaster();
        assertEquals(1000, raster.getSample(2, 1, 0));
        assertEquals(2000, raster.getSample(2, 1, 1));
        assertEquals(65535, raster.getSample(2, 1, 2));
        assertEquals(40000, raster.getSample(2, 1, 3));

        raster.setSample(0, 0, 0, 777);
        assertEquals(777, canvas.red(-1, -1));
    }
}
