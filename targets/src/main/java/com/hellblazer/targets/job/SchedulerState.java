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

/**
 * Lifecycle of a {@link RenderScheduler} run.
 *
 * <ol>
 * <li><b>IDLE</b>: constructed, not yet started</li>
 * <li><b>ENUMERATING</b>: building the ordered job list</li>
 * <li><b>DISPATCHING</b>: handing jobs to workers one at a time</li>
 * <li><b>DRAINING</b>: all jobs handed off, waiting for workers to finish and exit</li>
 * <li><b>DONE</b>: every worker has returned</li>
 * <li><b>FAILED</b>: a fatal error aborted the run</li>
 * </ol>
 *
 * @author hal.hildebrand
 */
public enum SchedulerState {
    IDLE,
    ENUMERATING,
    DISPATCHING,
    DRAINING,
    DONE,
    FAILED
}
