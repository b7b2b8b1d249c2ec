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
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Generated subexperiments, shaped like the input: a flat list for an unseparated circuit, one list per
 * partition otherwise. Within a list, subexperiments are ordered by joint choice rank, then by measurement group.
 *
 * @author hal.hildebrand
 */
public sealed interface SubexperimentSet permits SubexperimentSet.Unified, SubexperimentSet.Partitioned {

    /**
     * @return the flat list of an unseparated result
     * @throws IllegalStateException if the result is partitioned
     */
    List<Circuit> asList();

    /**
     * @return the lists of a partitioned result keyed by label
     * @throws IllegalStateException if the result is unseparated
     */
    Map<String, List<Circuit>> asMap();

    record Unified(List<Circuit> subexperiments) implements SubexperimentSet {
        public Unified {
            Objects.requireNonNull(subexperiments, "subexperiments cannot be null");
            subexperiments = List.copyOf(subexperiments);
        }

        @Override
        public List<Circuit> asList() {
            return subexperiments;
        }

        @Override
        public Map<String, List<Circuit>> asMap() {
            throw new IllegalStateException("Subexperiments of an unseparated circuit are not keyed by partition");
        }
    }

    record Partitioned(Map<String, List<Circuit>> subexperiments) implements SubexperimentSet {
        public Partitioned {
            Objects.requireNonNull(subexperiments, "subexperiments cannot be null");
            var copy = new LinkedHashMap<String, List<Circuit>>();
            subexperiments.forEach((label, circuits) -> copy.put(label, List.copyOf(circuits)));
            subexperiments = Collections.unmodifiableMap(copy);
        }

        @Override
        public List<Circuit> asList() {
            throw new IllegalStateException("Subexperiments of separated circuits are keyed by partition");
        }

        @Override
        public Map<String, List<Circuit>> asMap() {
            return subexperiments;
        }
    }
}
