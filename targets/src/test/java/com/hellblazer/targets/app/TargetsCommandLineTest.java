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

package com.hellblazer.targets.app;

import com.hellblazer.targets.color.TransferFunction;
import com.hellblazer.targets.post.PostProcessMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for command line parsing and exit codes.
 *
 * @author hal.hildebrand
 */
public class TargetsCommandLineTest {

    @TempDir
    Path tempDir;

    @Test
    public void testDefaults() {
        var config = TargetsCommandLine.parseArguments(new String[0]);
        assertEquals(TargetsCommandLine.Mode.RENDER, config.mode);
        assertNull(config.sizeClass);
        assertEquals(PostProcessMode.CLAMP, config.postProcess);
        assertEquals(TransferFunction.SRGB_ENCODE, config.transfer);
        assertEquals(Path.of("."), config.outputDir);
    }

    @Test
    public void testRenderOptions() {
        var config = TargetsCommandLine.parseArguments(
        new String[] { "proj", "--output", "out", "--threads", "3", "--post", "dither", "--transfer", "linear" });
        assertEquals(TargetsCommandLine.Mode.RENDER, config.mode);
        assertEquals("proj", config.sizeClass);
        assertEquals(Path.of("out"), config.outputDir);
        assertEquals(3, config.threads);
        assertEquals(PostProcessMode.DITHER, config.postProcess);
        assertEquals(TransferFunction.LINEAR, config.transfer);

        var scheduler = config.toSchedulerConfig();
        assertEquals(3, scheduler.workers);
        assertEquals(TransferFunction.LINEAR, scheduler.output);
    }

    @Test
    public void testExplicitRenderMode() {
        var config = TargetsCommandLine.parseArguments(new String[] { "render", "tv" });
        assertEquals(TargetsCommandLine.Mode.RENDER, config.mode);
        assertEquals("tv", config.sizeClass);
    }

    @Test
    public void testFlagModes() {
        assertEquals(TargetsCommandLine.Mode.LIST, TargetsCommandLine.parseArguments(new String[] { "--list" }).mode);
        assertEquals(TargetsCommandLine.Mode.HELP, TargetsCommandLine.parseArguments(new String[] { "--help" }).mode);
        assertThrows(IllegalArgumentException.class,
                     () -> TargetsCommandLine.parseArguments(new String[] { "--render" }));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                     () -> TargetsCommandLine.parseArguments(new String[] { "--threads", "0" }));
        assertThrows(IllegalArgumentException.class,
                     () -> TargetsCommandLine.parseArguments(new String[] { "--threads", "many" }));
        assertThrows(IllegalArgumentException.class,
                     () -> TargetsCommandLine.parseArguments(new String[] { "--post", "sharpen" }));
        assertThrows(IllegalArgumentException.class,
                     () -> TargetsCommandLine.parseArguments(new String[] { "--output" }));
        assertThrows(IllegalArgumentException.class,
                     () -> TargetsCommandLine.parseArguments(new String[] { "--verbose" }));
        assertThrows(IllegalArgumentException.class,
                     () -> TargetsCommandLine.parseArguments(new String[] { "tv", "proj" }));
        assertThrows(IllegalArgumentException.class,
                     () -> TargetsCommandLine.parseArguments(new String[] { "list", "tv" }));
    }

    @Test
    public void testHelpAndList() {
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        assertEquals(0, TargetsCommandLine.run(new String[] { "help" }, stream(out), stream(err)));
        assertTrue(text(out).contains("--transfer"));

        out.reset();
        assertEquals(0, TargetsCommandLine.run(new String[] { "list" }, stream(out), stream(err)));
        var listing = text(out);
        assertTrue(listing.contains("tvx2"));
        assertTrue(listing.contains("honeycomb"));
        assertTrue(listing.contains("[2, 5, 10, 30, 60, 120, 480]"));
    }

    @Test
    public void testErrorsExitNonZero() {
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        assertEquals(1, TargetsCommandLine.run(new String[] { "--bogus" }, stream(out), stream(err)));
        assertTrue(text(err).contains("Unknown render option"));

        err.reset();
        assertEquals(1, TargetsCommandLine.run(new String[] { "imax", "--output", tempDir.toString() }, stream(out),
                                               stream(err)));
        assertTrue(text(err).contains("imax"));
    }

    private static PrintStream stream(ByteArrayOutputStream bytes) {
        return new PrintStream(bytes, true, StandardCharsets.UTF_8);
    }

    private static String text(ByteArrayOutputStream bytes) {
        return bytes.toString(StandardCharsets.UTF_8);
    }
}
