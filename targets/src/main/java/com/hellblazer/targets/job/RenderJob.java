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
package com.hellblazer.targets.job;

import com.hellblazer.targets.pattern.Pattern;
import com.hellblazer.targets.pattern.PatternSpec;

import java.util.Objects;

/**
 * One fully specified, independent unit of work.
 *
 * @author hal.hildebrand
 */
public record RenderJob(SizeClass sizeClass, Pattern pattern, int density) {

    public RenderJob {
        Objects.requireNonNull(sizeClass, "sizeClass");
        Objects.requireNonNull(pattern, "pattern");
        if (density <= 0) {
            throw new IllegalArgumentException("Density must be positive, got: " + density);
        }
    }

    public PatternSpec spec() {
        return new PatternSpec(pattern.name(), sizeClass.width(), sizeClass.height(), density);
    }

    /**
     * {@code {sizeClass}_{pattern}_{density:03d}}
     */
    public String baseName() {
        return baseName(sizeClass.name(), pattern.name(), density);
    }

    public static String baseName(String sizeClass, String pattern, int density) {
        return String.format("%s_%s_%03d", sizeClass, pattern, density);
    }

    @Override
    public String toString() {
        return "RenderJob[" + baseName() + "]";
    }
}
