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
package com.hellblazer.targets.color;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The full set of transfer lookup tables, built once before any rendering starts and shared read-only by every
 * worker.
 *
 * @author hal.hildebrand
 */
public final class LookupTables {
    private static final Logger log = LoggerFactory.getLogger(LookupTables.class);

    private final Map<TransferFunction, TransferLUT> tables;

    private LookupTables(Map<TransferFunction, TransferLUT> tables) {
        this.tables = tables;
    }

    public static LookupTables build() {
        long start = System.nanoTime();
        var tables = new EnumMap<TransferFunction, TransferLUT>(TransferFunction.class);
        for (var fn : TransferFunction.values()) {
            tables.put(fn, TransferLUT.build(fn));
        }
        log.debug("Built {} transfer tables in {} ms", tables.size(), (System.nanoTime() - start) / 1_000_000);
        return new LookupTables(Collections.unmodifiableMap(tables));
    }

    public TransferLUT get(TransferFunction function) {
        return tables.get(function);
    }

    public TransferLUT linear() {
        return get(TransferFunction.LINEAR);
    }

    public TransferLUT srgbEncode() {
        return get(TransferFunction.SRGB_ENCODE);
    }

    public TransferLUT srgbDecode() {
        return get(TransferFunction.SRGB_DECODE);
    }

    public TransferLUT gammaEncode() {
        return get(TransferFunction.GAMMA22_ENCODE);
    }

    public TransferLUT gammaDecode() {
        return get(TransferFunction.GAMMA22_DECODE);
    }
}
