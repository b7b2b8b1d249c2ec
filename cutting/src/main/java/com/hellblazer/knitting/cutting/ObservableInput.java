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

import com.hellblazer.knitting.observable.PauliString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The observables to measure: one list for an unseparated circuit, or one list per partition label.
 *
 * @author hal.hildebrand
 */
public sealed interface ObservableInput permits ObservableInput.Unified, ObservableInput.Partitioned {

    static ObservableInput of(List<PauliString> observables) {
        return new Unified(observables);
    }

    static ObservableInput of(Map<String, List<PauliString>> observables) {
        return new Partitioned(observables);
    }

    record Unified(List<PauliString> observables) implements ObservableInput {
        public Unified {
            Objects.requireNonNull(observables, "observables cannot be null");
            observables = List.copyOf(observables);
        }
    }

    /**
     * Observables per partition, in caller iteration order; this order is the order of the output buckets.
     */
    record Partitioned(Map<String, List<PauliString>> observables) implements ObservableInput {
        public Partitioned {
            Objects.requireNonNull(observables, "observables cannot be null");
            var copy = new LinkedHashMap<String, List<PauliString>>();
            observables.forEach((label, paulis) -> {
                Objects.requireNonNull(label, "partition label cannot be null");
                Objects.requireNonNull(paulis, "observables cannot be null for partition " + label);
                copy.put(label, List.copyOf(paulis));
            });
            observables = Collections.unmodifiableMap(copy);
        }
    }
}
