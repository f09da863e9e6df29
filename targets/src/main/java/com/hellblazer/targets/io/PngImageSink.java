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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes canvases as 16-bit per channel RGBA PNG files into one output directory.
 *
 * @author hal.hildebrand
 */
public class PngImageSink implements ImageSink {
    private static final Logger log = LoggerFactory.getLogger(PngImageSink.class);

    public static final String EXTENSION = ".png";

    private final Path outputDir;

    /**
     * @throws IOException when the output directory cannot be created
     */
    public PngImageSink(Path outputDir) throws IOException {
        this.outputDir = outputDir;
        if (!Files.exists(outputDir)) {
            Files.createDirectories(outputDir);
            log.info("Created output directory: {}", outputDir.toAbsolutePath());
        }
    }

    @Override
    public void write(Canvas canvas, String baseName) throws IOException {
        var outputPath = resolve(baseName);
        if (!ImageIO.write(canvas.asBufferedImage(), "png", outputPath.toFile())) {
            throw new IOException("No PNG writer available for " + outputPath);
        }
        log.debug("Wrote {} ({}x{})", outputPath, canvas.width(), canvas.height());
    }

    public Path resolve(String baseName) {
        return outputDir.resolve(baseName + EXTENSION);
    }
}
