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
package com.hellblazer.knitting.circuit;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * An operation bound to the qubits and classical bits it acts on.
 *
 * @param operation the operation
 * @param qubits    the qubit indices, one per qubit of the operation
 * @param clbits    the classical bits written, one per classical bit of the operation
 * @author hal.hildebrand
 */
public record CircuitInstruction(Operation operation, List<Integer> qubits, List<Clbit> clbits) {

    public CircuitInstruction {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(qubits, "qubits cannot be null");
        Objects.requireNonNull(clbits, "clbits cannot be null");
        if (qubits.size() != operation.numQubits()) {
            throw new IllegalArgumentException(
            String.format("Operation %s acts on %d qubit(s) but %d were given", operation.name(),
                          operation.numQubits(), qubits.size()));
        }
        if (clbits.size() != operation.numClbits()) {
            throw new IllegalArgumentException(
            String.format("Operation %s writes %d clbit(s) but %d were given", operation.name(),
                          operation.numClbits(), clbits.size()));
        }
        if (qubits.stream().distinct().count() != qubits.size()) {
            throw new IllegalArgumentException("Duplicate qubit arguments: " + qubits);
        }
        qubits = List.copyOf(qubits);
        clbits = List.copyOf(clbits);
    }

    public static CircuitInstruction of(Operation operation, int... qubits) {
        return new CircuitInstruction(operation, Arrays.stream(qubits).boxed().toList(), List.of());
    }
}
