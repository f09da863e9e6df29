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
import com.hellblazer.targets.image.RenderedImage;

/**
 * Derives a 1-bit style variant from a rendered image. Implementations read the linear-light synthesized canvas,
 * never mutate it, and return a new canvas of the same dimensions.
 *
 * @author hal.hildebrand
 */
public interface PostProcessor {

    Canvas process(RenderedImage image);

    /**
     * File name suffix for the variant, including the leading underscore.
     */
    String suffix();
}
