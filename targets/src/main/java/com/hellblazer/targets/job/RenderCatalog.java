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

import com.hellblazer.targets.pattern.PatternRegistry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Static render configuration: size classes, densities and the enabled pattern set.
 *
 * @author hal.hildebrand
 */
public final class RenderCatalog {

    public static final List<Integer>   DEFAULT_DENSITIES     = List.of(2, 5, 10, 30, 60, 120, 480);
    public static final List<SizeClass> DEFAULT_SIZE_CLASSES = List.of(new SizeClass("tv", 3840, 2160),
                                                                       new SizeClass("tvx2", 3840 * 2, 2160 * 2),
                                                                       new SizeClass("proj", 3840, 2400));

    private final List<SizeClass>  sizeClasses;
    private final List<Integer>    densities;
    private final PatternRegistry  patterns;

    public RenderCatalog(List<SizeClass> sizeClasses, List<Integer> densities, PatternRegistry patterns) {
        this.sizeClasses = List.copyOf(sizeClasses);
        this.densities = List.copyOf(densities);
        this.patterns = patterns;
        validate();
    }

    public static RenderCatalog standard(PatternRegistry patterns) {
        return new RenderCatalog(DEFAULT_SIZE_CLASSES, DEFAULT_DENSITIES, patterns);
    }

    private void validate() {
        var names = new HashSet<String>();
        for (var sizeClass : sizeClasses) {
            if (!names.add(sizeClass.name())) {
                throw new RenderException.InvalidCatalogException("Duplicate size class: " + sizeClass.name());
            }
        }
        for (var density : densities) {
            if (density <= 0) {
                throw new RenderException.InvalidCatalogException("Density must be positive, got: " + density);
            }
        }
    }

    /**
     * Every job of the catalog, ordered size class, then density, then pattern.
     *
     * @param filter size class name to restrict to, or null for all of them
     * @throws IllegalArgumentException when the filter names no configured size class
     */
    public List<RenderJob> enumerate(String filter) {
        if (filter != null && sizeClasses.stream().noneMatch(s -> s.name().equals(filter))) {
            throw new IllegalArgumentException("Unknown size class: " + filter + ", expected one of " + sizeClassNames());
        }
        var jobs = new ArrayList<RenderJob>();
        for (var sizeClass : sizeClasses) {
            if (filter != null && !sizeClass.name().equals(filter)) {
                continue;
            }
            for (var density : densities) {
                for (var pattern : patterns.patterns()) {
                    jobs.add(new RenderJob(sizeClass, pattern, density));
                }
            }
        }
        return jobs;
    }

    public List<String> sizeClassNames() {
        return sizeClasses.stream().map(SizeClass::name).toList();
    }

    public List<SizeClass> getSizeClasses() {
        return sizeClasses;
    }

    public List<Integer> getDensities() {
        return densities;
    }

    public PatternRegistry getPatterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return String.format("RenderCatalog[sizes=%s, densities=%s, patterns=%d]", sizeClasses, densities,
                             patterns.size());
    }
}
