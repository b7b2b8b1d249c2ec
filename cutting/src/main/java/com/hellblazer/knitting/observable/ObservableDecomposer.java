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
package com.hellblazer.knitting.observable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits observables over a set of qubit partitions.
 *
 * @author hal.hildebrand
 */
public final class ObservableDecomposer {

    private ObservableDecomposer() {
    }

    /**
     * Decompose each observable into one sub-observable per partition.
     *
     * @param observables     observables of equal width
     * @param partitionLabels one label character per qubit, qubit 0 first
     * @return sub-observables keyed by partition label, labels in order of first appearance; qubits within a
     *     partition keep their relative order
     */
    public static Map<String, List<PauliString>> decompose(List<PauliString> observables, String partitionLabels) {
        Objects.requireNonNull(observables, "observables cannot be null");
        Objects.requireNonNull(partitionLabels, "partitionLabels cannot be null");

        var qubitsByLabel = new LinkedHashMap<String, List<Integer>>();
        for (int q = 0; q < partitionLabels.length(); q++) {
            qubitsByLabel.computeIfAbsent(String.valueOf(partitionLabels.charAt(q)), k -> new ArrayList<>()).add(q);
        }

        var decomposed = new LinkedHashMap<String, List<PauliString>>();
        qubitsByLabel.keySet().forEach(label -> decomposed.put(label, new ArrayList<>()));
        for (var observable : observables) {
            if (observable.numQubits() != partitionLabels.length()) {
                throw new IllegalArgumentException(
                String.format("Observable %s acts on %d qubits but %d partition labels were given", observable,
                              observable.numQubits(), partitionLabels.length()));
            }
            qubitsByLabel.forEach((label, qubits) -> decomposed.get(label).add(observable.select(qubits)));
        }
        return decomposed;
    }
}
