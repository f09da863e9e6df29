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

import java.util.Objects;

/**
 * Immutable request for one pattern at one canvas size and density.
 *
 * <p>The density is interpreted by each pattern on its own terms (line pairs, angular wedges, ring frequency and so
 * on). A zero or negative density is rejected here, before any job is dispatched.
 *
 * @param name    pattern name
 * @param width   canvas width in pixels
 * @param height  canvas height in pixels
 * @param density pattern-specific spatial density, always positive
 * @author hal.hildebrand
 */
public record PatternSpec(String name, int width, int height, int density) {

    public PatternSpec {
        Objects.requireNonNull(name, "name");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Canvas size must be positive, got: " + width + "x" + height);
        }
        if (density <= 0) {
            throw new IllegalArgumentException("Density must be positive, got: " + density);
        }
    }

    public int longEdge() {
        return Math.max(width, height);
    }

    /**
     * Size in pixels of one density cell along the long edge.
     */
    public double cell() {
        return (double) longEdge() / density;
    }

    /**
     * A cell narrower than one pixel cannot be rasterized meaningfully.
     */
    public boolean isDegenerate() {
        return cell() < 1.0;
    }

    /**
     * Half the diagonal, measured from the canvas center to a corner.
     */
    public double halfDiagonal() {
        double hx = width / 2;
        double hy = height / 2;
        return Math.sqrt(hx * hx + hy * hy);
    }
}
