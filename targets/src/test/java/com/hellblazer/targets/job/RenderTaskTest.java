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

package com.hellblazer.targets.job;

import com.hellblazer.targets.color.ColorPipeline;
import com.hellblazer.targets.color.LookupTables;
import com.hellblazer.targets.image.Canvas;
import com.hellblazer.targets.image.RenderedImage;
import com.hellblazer.targets.pattern.PatternRegistry;
import com.hellblazer.targets.post.PostProcessor;
import com.hellblazer.targets.post.StochasticDither;
import com.hellblazer.targets.post.ThresholdSmooth;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RenderTaskTest {

    private static final SizeClass MINI = new SizeClass("mini", 48, 32);

    private static LookupTables    tables;
    private static PatternRegistry patterns;

    @BeforeAll
    public static void setup() {
        tables = LookupTables.build();
        patterns = PatternRegistry.standard(tables);
    }

    @Test
    public void testConvertedImageWritten() {
        var sink = new RecordingSink();
        var task = new RenderTask(tables.srgbEncode(), Optional.of(new ThresholdSmooth()), sink);
        var job = new RenderJob(MINI, patterns.require("check"), 4);

        var outcome = task.execute(job);

        assertFalse(outcome.skipped());
        assertEquals(1, outcome.filesWritten());
        var synthesized = job.pattern().synthesize(job.spec()).orElseThrow().canvas();
        assertTrue(ColorPipeline.convert(synthesized, tables.srgbEncode())
                                .contentEquals(sink.written.get("mini_check_004")));
    }

    @Test
    public void testPostProcessedVariant() {
        var sink = new RecordingSink();
        var task = new RenderTask(tables.srgbEncode(), Optional.of(new StochasticDither()), sink);
        var job = new RenderJob(MINI, patterns.require("rings"), 4);

        var outcome = task.execute(job);

        assertEquals(2, outcome.filesWritten());
        var synthesized = job.pattern().synthesize(job.spec()).orElseThrow().canvas();
        assertTrue(StochasticDither.dither(synthesized).contentEquals(sink.written.get("mini_rings_004_dith")));
    }

    @Test
    public void testConvertedWrittenBeforePostProcessing() {
        var sink = new RecordingSink();
        var seen = new ArrayList<RenderedImage>();
        PostProcessor recording = new PostProcessor() {
            @Override
            public Canvas process(RenderedImage image) {
                assertEquals(Set.of("mini_rings_004"), Set.copyOf(sink.written.keySet()));
                seen.add(image);
                return image.synthesized().copy();
            }

            @Override
            public String suffix() {
                return "_copy";
            }
        };
        var task = new RenderTask(tables.srgbEncode(), Optional.of(recording), sink);

        assertEquals(2, task.execute(new RenderJob(MINI, patterns.require("rings"), 4)).filesWritten());

        assertEquals(1, seen.size());
        var image = seen.get(0);
        assertEquals("mini_rings_004", image.name());
        assertTrue(image.needsPostProcess());
        assertEquals(MINI.width(), image.width());
        assertEquals(MINI.height(), image.height());
        assertTrue(image.synthesized().contentEquals(sink.written.get("mini_rings_004_copy")));
    }

    @Test
    public void testNoProcessorNoVariant() {
        var sink = new RecordingSink();
        var task = new RenderTask(tables.srgbEncode(), Optional.empty(), sink);
        assertEquals(1, task.execute(new RenderJob(MINI, patterns.require("rings"), 4)).filesWritten());
        assertEquals(1, sink.written.size());
    }

    @Test
    public void testDegenerateSkipped() {
        var sink = new RecordingSink();
        var task = new RenderTask(tables.srgbEncode(), Optional.empty(), sink);
        var outcome = task.execute(new RenderJob(MINI, patterns.require("check"), 60));
        assertTrue(outcome.skipped());
        assertTrue(sink.written.isEmpty());
    }

    @Test
    public void testPersistenceFailure() {
        var task = new RenderTask(tables.srgbEncode(), Optional.empty(), new RecordingSink("check"));
        var e = assertThrows(RenderException.PersistenceException.class,
                             () -> task.execute(new RenderJob(MINI, patterns.require("check"), 4)));
        assertEquals("mini_check_004", e.getFileName());
        assertEquals("disk full", e.getCause().getMessage());
    }
}
