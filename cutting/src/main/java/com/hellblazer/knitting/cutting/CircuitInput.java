/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Knitting.
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
package com.hellblazer.knitting.cutting;

import com.hellblazer.knitting.circuit.Circuit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The circuit(s) to generate experiments for: either one unseparated circuit, or separated partitions keyed by
 * label.
 *
 * @author hal.hildebrand
 */
public sealed interface CircuitInput permits CircuitInput.Unified, CircuitInput.Partitioned {

    static CircuitInput of(Circuit circuit) {
        return new Unified(circuit);
    }

    static CircuitInput of(Map<String, Circuit> partitions) {
        return new Partitioned(partitions);
    }

    record Unified(Circuit circuit) implements CircuitInput {
        public Unified {
            Objects.requireNonNull(circuit, "circuit cannot be null");
        }
    }

    /**
     * Partitions in caller iteration order.
     */
    record Partitioned(Map<String, Circuit> circuits) implements CircuitInput {
        public Partitioned {
            Objects.requireNonNull(circuits, "circuits cannot be null");
            circuits.forEach((label, circuit) -> {
                Objects.requireNonNull(label, "partition label cannot be null");
                Objects.requireNonNull(circuit, "circuit cannot be null for partition " + label);
            });
            circuits = Collections.unmodifiableMap(new LinkedHashMap<>(circuits));
        }
    }
}
