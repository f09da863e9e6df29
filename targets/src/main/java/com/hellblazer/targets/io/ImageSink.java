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
package com.hellblazer.targets.io;

import com.hellblazer.targets.image.Canvas;

import java.io.IOException;

/**
 * Destination for finished canvases. Called concurrently from every worker; implementations must be thread safe.
 *
 * @author hal.hildebrand
 */
public interface ImageSink {

    /**
     * Encode and store {@code canvas} under {@code baseName}; the implementation appends its own extension.
     *
     * @throws IOException when the image cannot be created or encoded
     */
    void write(Canvas canvas, String baseName) throws IOException;
}
