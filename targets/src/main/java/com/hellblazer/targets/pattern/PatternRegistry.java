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

import com.hellblazer.targets.color.LookupTables;

import java.util.*;

/**
 * Immutable catalog of patterns keyed by name, in registration order.
 *
 * <p>Names are stored explicitly with each entry and are used verbatim in output file names.
 *
 * @author hal.hildebrand
 */
public final class PatternRegistry {

    private final Map<String, Pattern> patterns;

    private PatternRegistry(Map<String, Pattern> patterns) {
        this.patterns = Collections.unmodifiableMap(patterns);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The full catalog: grid, radial, shape and ramp families.
     */
    public static PatternRegistry standard(LookupTables tables) {
        var builder = builder();
        GridPatterns.register(builder);
        RadialPatterns.register(builder);
        ShapePatterns.register(builder);
        RampPatterns.register(builder, tables);
        return builder.build();
    }

    public Optional<Pattern> get(String name) {
        return Optional.ofNullable(patterns.get(name));
    }

    public Pattern require(String name) {
        var pattern = patterns.get(name);
        if (pattern == null) {
            throw new IllegalArgumentException("Unknown pattern: " + name);
        }
        return pattern;
    }

    public List<Pattern> patterns() {
        return List.copyOf(patterns.values());
    }

    public List<String> names() {
        return List.copyOf(patterns.keySet());
    }

    public List<Pattern> family(PatternFamily family) {
        return patterns.values().stream().filter(p -> p.family() == family).toList();
    }

    public int size() {
        return patterns.size();
    }

    public static final class Builder {
        private final Map<String, Pattern> patterns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String name, PatternFamily family, Pattern.Synthesis synthesis) {
            return add(new RegisteredPattern(name, family, synthesis));
        }

        public Builder add(Pattern pattern) {
            if (patterns.putIfAbsent(pattern.name(), pattern) != null) {
                throw new IllegalArgumentException("Duplicate pattern: " + pattern.name());
            }
            return this;
        }

        public PatternRegistry build() {
            return new PatternRegistry(new LinkedHashMap<>(patterns));
        }
    }

    /**
     * A registered synthesis function. Degenerate specs short-circuit to an empty result.
     */
    record RegisteredPattern(String name, PatternFamily family, Pattern.Synthesis synthesis) implements Pattern {

        RegisteredPattern {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(family, "family");
            Objects.requireNonNull(synthesis, "synthesis");
        }

        @Override
        public Optional<SynthesisResult> synthesize(PatternSpec spec) {
            if (spec.isDegenerate()) {
                return Optional.empty();
            }
            return Optional.of(synthesis.render(spec));
        }
    }
}
