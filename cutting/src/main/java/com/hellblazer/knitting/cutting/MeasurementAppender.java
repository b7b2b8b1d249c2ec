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
import com.hellblazer.knitting.circuit.ClassicalRegister;
import com.hellblazer.knitting.exceptions.QubitCountMismatchException;
import com.hellblazer.knitting.observable.CommutingObservableGroup;

import java.util.Objects;

/**
 * Appends the basis rotations and measurements needed to measure a {@link CommutingObservableGroup}.
 *
 * @author hal.hildebrand
 */
public final class MeasurementAppender {

    /** Name of the register holding the observable measurements; always the last register of the result */
    public static final String OBSERVABLE_MEASUREMENTS = "observable_measurements";

    private MeasurementAppender() {
    }

    /**
     * Measure {@code group} on a copy of {@code circuit}, qubit i of the group on qubit i of the circuit.
     */
    public static Circuit appendMeasurementCircuit(Circuit circuit, CommutingObservableGroup group) {
        return appendMeasurementCircuit(circuit, group, null, false);
    }

    /**
     * Append a new classical register named {@value #OBSERVABLE_MEASUREMENTS} and the measurement instructions for
     * the group. Only qubits on which the group's general observable is not the identity are measured, into
     * consecutive bits of the new register. A qubit with an X component is rotated by H first, preceded by SDG if
     * it also has a Z component.
     *
     * @param circuit        the circuit
     * @param group          the group to measure
     * @param qubitLocations for each qubit of the group, its index in the circuit; null for the identity map,
     *                       which requires equal qubit counts
     * @param inPlace        whether to modify {@code circuit} rather than a copy
     * @return the modified circuit
     * @throws QubitCountMismatchException if no mapping is given and the qubit counts differ
     */
    public static Circuit appendMeasurementCircuit(Circuit circuit, CommutingObservableGroup group,
                                                   int[] qubitLocations, boolean inPlace) {
        Objects.requireNonNull(circuit, "circuit cannot be null");
        Objects.requireNonNull(group, "group cannot be null");
        var numObservableQubits = group.numQubits();
        if (qubitLocations == null) {
            if (circuit.numQubits() != numObservableQubits) {
                throw new QubitCountMismatchException(circuit.numQubits(), numObservableQubits);
            }
        } else if (qubitLocations.length != numObservableQubits) {
            throw new IllegalArgumentException(
            String.format("qubitLocations has %d element(s) but the observable(s) have %d qubit(s).",
                          qubitLocations.length, numObservableQubits));
        }

        var target = inPlace ? circuit : circuit.copy();
        var pauliIndices = group.pauliIndices();
        var register = new ClassicalRegister(OBSERVABLE_MEASUREMENTS, pauliIndices.size());
        target.addRegister(register);

        int clbit = 0;
        for (var subqubit : pauliIndices) {
            var actualQubit = qubitLocations == null ? subqubit : qubitLocations[subqubit];
            if (group.hasX(subqubit)) {
                if (group.hasZ(subqubit)) {
                    target.sdg(actualQubit);
                }
                target.h(actualQubit);
            }
            target.measure(actualQubit, register.get(clbit++));
        }
        return target;
    }
}
