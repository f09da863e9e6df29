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

import com.hellblazer.targets.color.ColorPipeline;
import com.hellblazer.targets.color.TransferLUT;
import com.hellblazer.targets.image.Canvas;
import com.hellblazer.targets.image.RenderedImage;
import com.hellblazer.targets.io.ImageSink;
import com.hellblazer.targets.post.PostProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Executes one job end to end: synthesis, transfer conversion, persistence, then the optional post-processed
 * variant. Holds only immutable collaborators, so a single instance is shared by every worker.
 *
 * @author hal.hildebrand
 */
public class RenderTask {
    private static final Logger log = LoggerFactory.getLogger(RenderTask.class);

    /**
     * What one job produced.
     *
     * @param skipped      synthesis yielded no image
     * @param filesWritten number of images persisted
     */
    public record Outcome(boolean skipped, int filesWritten) {
        static final Outcome SKIPPED = new Outcome(true, 0);
    }

    private final TransferLUT             output;
    private final Optional<PostProcessor> postProcessor;
    private final ImageSink               sink;

    public RenderTask(TransferLUT output, Optional<PostProcessor> postProcessor, ImageSink sink) {
        this.output = output;
        this.postProcessor = postProcessor;
        this.sink = sink;
    }

    /**
     * @throws RenderException.PersistenceException when an image cannot be written
     */
    public Outcome execute(RenderJob job) {
        var result = job.pattern().synthesize(job.spec());
        if (result.isEmpty()) {
            log.warn("Skipping {}: pattern produced no image for {}x{} at density {}", job.baseName(),
                     job.sizeClass().width(), job.sizeClass().height(), job.density());
            return Outcome.SKIPPED;
        }

        var synthesized = result.get();
        var name = job.baseName();
        // converted canvas is unreachable once written
        persist(ColorPipeline.convert(synthesized.canvas(), output), name);
        int written = 1;

        if (synthesized.needsPostProcess() && postProcessor.isPresent()) {
            var processor = postProcessor.get();
            var image = new RenderedImage(name, synthesized.canvas(), true);
            persist(processor.process(image), name + processor.suffix());
            written++;
        }
        return new Outcome(false, written);
    }

    private void persist(Canvas canvas, String name) {
        try {
            sink.write(canvas, name);
        } catch (IOException e) {
            throw new RenderException.PersistenceException(name, e);
        }
        log.info("{}", name);
    }
}
