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

import java.util.Optional;

/**
 * Which post-processing strategy produces the secondary variant of patterns that ask for one.
 *
 * @author hal.hildebrand
 */
public enum PostProcessMode {
    DITHER("dither", "Stochastic 1-bit dither, saved with suffix _dith"),
    CLAMP("clamp", "Mid-gray threshold followed by a Gaussian blur, saved with suffix _clamp"),
    NONE("none", "No post-processed variants");

    private final String command;
    private final String description;

    PostProcessMode(String command, String description) {
        this.command = command;
        this.description = description;
    }

    public String getCommand() { return command; }
    public String getDescription() { return description; }

    public static PostProcessMode fromString(String command) {
        for (PostProcessMode mode : values()) {
            if (mode.command.equals(command)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown post-process mode: " + command);
    }

    /**
     * @return the strategy for this mode, empty for {@link #NONE}
     */
    public Optional<PostProcessor> processor() {
        switch (this) {
            case DITHER:
                return Optional.of(new StochasticDither());
            case CLAMP:
                return Optional.of(new ThresholdSmooth());
            default:
                return Optional.empty();
        }
    }
}
