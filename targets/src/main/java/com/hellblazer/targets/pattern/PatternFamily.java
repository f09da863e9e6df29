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
package com.hellblazer.targets.pattern;

/**
 * Pattern families, grouped by how they compute pixels.
 *
 * <ol>
 * <li><b>GRID</b>: coordinate bucket parity, followed by edge correction</li>
 * <li><b>RADIAL</b>: per-pixel trigonometry over polar or periodic quantities</li>
 * <li><b>SHAPE</b>: anti-aliased vector primitives on a lattice</li>
 * <li><b>RAMP</b>: calibration ramps and flat fields</li>
 * </ol>
 *
 * @author hal.hildebrand
 */
public enum PatternFamily {
    GRID,
    RADIAL,
    SHAPE,
    RAMP
}
