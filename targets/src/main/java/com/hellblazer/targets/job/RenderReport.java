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

import java.time.Duration;

/**
 * Summary of a completed run.
 *
 * @param jobsEnumerated jobs produced by enumeration
 * @param jobsRendered   jobs that produced at least one file
 * @param jobsSkipped    jobs whose pattern yielded no image
 * @param filesWritten   images persisted, variants included
 * @param workers        worker threads used
 * @param elapsed        wall time from start of enumeration to the final join
 * @author hal.hildebrand
 */
public record RenderReport(int jobsEnumerated, int jobsRendered, int jobsSkipped, int filesWritten, int workers,
                           Duration elapsed) {

    @Override
    public String toString() {
        return String.format("RenderReport[jobs=%d, rendered=%d, skipped=%d, files=%d, workers=%d, time=%d.%03ds]",
                             jobsEnumerated, jobsRendered, jobsSkipped, filesWritten, workers, elapsed.toSeconds(),
                             elapsed.toMillis() % 1000);
    }
}
