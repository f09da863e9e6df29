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

import java.util.Optional;

/**
 * A named, pure synthesis function.
 *
 * <p>Implementations keep no mutable state and perform no I/O, so one instance serves every worker concurrently.
 *
 * @author hal.hildebrand
 */
public interface Pattern {

    String name();

    PatternFamily family();

    /**
     * Render the pattern.
     *
     * @return the synthesized canvas, or empty when the size and density combination cannot produce an image
     */
    Optional<SynthesisResult> synthesize(PatternSpec spec);

    /**
     * The raw rendering step a registered pattern delegates to once the request is known not to be degenerate.
     */
    @FunctionalInterface
    interface Synthesis {
        SynthesisResult render(PatternSpec spec);
    }
}
