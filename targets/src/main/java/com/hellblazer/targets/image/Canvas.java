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

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferUShort;
import java.awt.image.Raster;
import java.util.Arrays;

/**
 * A 16-bit RGBA pixel buffer addressed in coordinates centered on the origin.
 *
 * <p>Valid coordinates span {@code [minX, minX + width) x [minY, minY + height)} where
 * {@code minX = -(width / 2)} and {@code minY = -(height / 2)}. Samples are stored interleaved
 * (R, G, B, A) in row-major order and are read back as unsigned values in {@code [0, 65535]}.
 *
 * <p>A canvas is not thread safe. Each render job owns its canvases exclusively.
 *
 * @author hal.hildebrand
 */
public final class Canvas {

    public static final int CHANNELS  = 4;
    public static final int RED       = 0;
    public static final int GREEN     = 1;
    public static final int BLUE      = 2;
    public static final int ALPHA     = 3;
    public static final int MAX_VALUE = 0xFFFF;

    private final int     width;
    private final int     height;
    private final int     minX;
    private final int     minY;
    private final short[] data;

    /**
     * Create a fully transparent black canvas.
     */
    public Canvas(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canvas dimensions must be positive, got: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.minX = -(width / 2);
        this.minY = -(height / 2);
        this.data = new short[Math.multiplyExact(Math.multiplyExact(width, height), CHANNELS)];
    }

    private Canvas(Canvas source) {
        this.width = source.width;
        this.height = source.height;
        this.minX = source.minX;
        this.minY = source.minY;
        this.data = source.data.clone();
    }

    /**
     * Create an opaque canvas filled with a single gray level.
     */
    public static Canvas filled(int width, int height, int gray) {
        var canvas = new Canvas(width, height);
        canvas.fill(gray);
        return canvas;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int minX() {
        return minX;
    }

    public int minY() {
        return minY;
    }

    /**
     * @return exclusive upper bound of x
     */
    public int maxX() {
        return minX + width;
    }

    /**
     * @return exclusive upper bound of y
     */
    public int maxY() {
        return minY + height;
    }

    public int get(int x, int y, int channel) {
        return data[index(x, y) + channel] & MAX_VALUE;
    }

    public int red(int x, int y) {
        return get(x, y, RED);
    }

    public void set(int x, int y, int r, int g, int b, int a) {
        int i = index(x, y);
        data[i] = (short) r;
        data[i + 1] = (short) g;
        data[i + 2] = (short) b;
        data[i + 3] = (short) a;
    }

    /**
     * Set an opaque gray pixel.
     */
    public void setGray(int x, int y, int value) {
        set(x, y, value, value, value, MAX_VALUE);
    }

    /**
     * Copy all four channels of one pixel onto another.
     */
    public void copyPixel(int fromX, int fromY, int toX, int toY) {
        System.arraycopy(data, index(fromX, fromY), data, index(toX, toY), CHANNELS);
    }

    /**
     * @return true when both pixels carry identical samples on every channel
     */
    public boolean samePixel(int x1, int y1, int x2, int y2) {
        int a = index(x1, y1);
        int b = index(x2, y2);
        for (int c = 0; c < CHANNELS; c++) {
            if (data[a + c] != data[b + c]) {
                return false;
            }
        }
        return true;
    }

    public void fill(int gray) {
        short v = (short) gray;
        short opaque = (short) MAX_VALUE;
        for (int i = 0; i < data.length; i += CHANNELS) {
            data[i] = v;
            data[i + 1] = v;
            data[i + 2] = v;
            data[i + 3] = opaque;
        }
    }

    /**
     * Number of raw samples, {@code width * height * CHANNELS}.
     */
    public int sampleCount() {
        return data.length;
    }

    /**
     * Raw unsigned sample by interleaved index.
     */
    public int sample(int index) {
        return data[index] & MAX_VALUE;
    }

    public void setSample(int index, int value) {
        data[index] = (short) value;
    }

    public Canvas copy() {
        return new Canvas(this);
    }

    /**
     * A 16-bit interleaved RGBA image backed by this canvas's samples. No samples are copied, so writes through
     * either view are visible in the other.
     */
    public BufferedImage asBufferedImage() {
        var colorModel = new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_sRGB), true, false,
                                                 Transparency.TRANSLUCENT, DataBuffer.TYPE_USHORT);
        var raster = Raster.createInterleavedRaster(new DataBufferUShort(data, data.length), width, height,
                                                    width * CHANNELS, CHANNELS, new int[] { RED, GREEN, BLUE, ALPHA },
                                                    null);
        return new BufferedImage(colorModel, raster, false, null);
    }

    public boolean contentEquals(Canvas other) {
        return other != null && width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    private int index(int x, int y) {
        int col = x - minX;
        int row = y - minY;
        if (col < 0 || col >= width || row < 0 || row >= height) {
            throw new IndexOutOfBoundsException(
            String.format("(%d, %d) outside [%d, %d) x [%d, %d)", x, y, minX, maxX(), minY, maxY()));
        }
        return (row * width + col) * CHANNELS;
    }

    @Override
    public String toString() {
        return String.format("Canvas[%dx%d, x=[%d,%d), y=[%d,%d)]", width, height, minX, maxX(), minY, maxY());
    }
}
