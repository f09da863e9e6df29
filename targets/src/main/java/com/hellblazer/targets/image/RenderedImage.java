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

import java.util.Objects;

/**
 * One job's synthesized image as handed to post-processing. The transfer-converted canvas is persisted as soon as
 * it is produced and is not retained here.
 *
 * @param name             base output name
 * @param synthesized      the linear-light canvas as the pattern produced it
 * @param needsPostProcess copied from the pattern's synthesis result
 * @author hal.hildebrand
 */
public record RenderedImage(String name, Canvas synthesized, boolean needsPostProcess) {

    public RenderedImage {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(synthesized, "synthesized");
    }

    public int width() {
        return synthesized.width();
    }

    public int height() {
        return synthesized.height();
    }
}
