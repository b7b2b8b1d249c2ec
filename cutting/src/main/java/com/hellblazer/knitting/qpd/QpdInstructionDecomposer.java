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
package com.hellblazer.knitting.qpd;

import com.hellblazer.knitting.circuit.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default {@link CircuitResolver}. Each listed marker is replaced, in place in the instruction order, by the
 * operations its chosen term prescribes for the qubit(s) it acts on. Measurements inside chosen terms are bound,
 * in circuit order, to the bits of a new register named {@value #QPD_MEASUREMENTS}, added only when the chosen
 * terms measure at all.
 *
 * @author hal.hildebrand
 */
public class QpdInstructionDecomposer implements CircuitResolver {

    public static final String QPD_MEASUREMENTS = "qpd_measurements";

    @Override
    public Circuit resolve(Circuit circuit, List<List<Integer>> gateIds, JointChoice choice) {
        Objects.requireNonNull(circuit, "circuit cannot be null");
        Objects.requireNonNull(gateIds, "gateIds cannot be null");
        Objects.requireNonNull(choice, "choice cannot be null");
        if (gateIds.size() != choice.size()) {
            throw new IllegalArgumentException(
            String.format("gateIds has %d decomposition(s) but the choice has %d entries", gateIds.size(),
                          choice.size()));
        }

        var chosen = new HashMap<Integer, QpdBasis.Term>();
        for (int d = 0; d < gateIds.size(); d++) {
            for (var position : gateIds.get(d)) {
                var marker = markerAt(circuit, position);
                var mapId = choice.get(d);
                if (mapId >= marker.basis().size()) {
                    throw new IllegalArgumentException(
                    String.format("Term index %d out of range for basis of %d terms at position %d", mapId,
                                  marker.basis().size(), position));
                }
                if (chosen.put(position, marker.basis().getTerm(mapId)) != null) {
                    throw new IllegalArgumentException("Marker position listed more than once: " + position);
                }
            }
        }

        var resolved = circuit.copyEmpty();
        var measurements = countMeasurements(circuit, chosen);
        ClassicalRegister qpdRegister = null;
        if (measurements > 0) {
            qpdRegister = new ClassicalRegister(QPD_MEASUREMENTS, measurements);
            resolved.addRegister(qpdRegister);
        }

        int nextBit = 0;
        for (int i = 0; i < circuit.size(); i++) {
            var instruction = circuit.get(i);
            var term = chosen.get(i);
            if (term == null) {
                resolved.append(instruction);
                continue;
            }
            var marker = (QpdGate) instruction.operation();
            for (int q = 0; q < instruction.qubits().size(); q++) {
                var party = marker.kind() == QpdGate.Kind.TWO_PARTY ? q : marker.partyIndex();
                var qubit = instruction.qubits().get(q);
                for (var op : term.operations(party)) {
                    if (op instanceof Measure) {
                        resolved.measure(qubit, qpdRegister.get(nextBit++));
                    } else {
                        resolved.append(op, qubit);
                    }
                }
            }
        }
        return resolved;
    }

    private static QpdGate markerAt(Circuit circuit, int position) {
        var operation = circuit.get(position).operation();
        if (operation instanceof QpdGate marker) {
            return marker;
        }
        throw new IllegalArgumentException(
        String.format("Instruction %d is not a QPD gate: %s", position, operation.name()));
    }

    private static int countMeasurements(Circuit circuit, Map<Integer, QpdBasis.Term> chosen) {
        int count = 0;
        for (var entry : chosen.entrySet()) {
            var marker = (QpdGate) circuit.get(entry.getKey()).operation();
            var term = entry.getValue();
            if (marker.kind() == QpdGate.Kind.TWO_PARTY) {
                for (int party = 0; party < term.numParties(); party++) {
                    count += measurementsIn(term.operations(party));
                }
            } else {
                count += measurementsIn(term.operations(marker.partyIndex()));
            }
        }
        return count;
    }

    private static int measurementsIn(List<Operation> operations) {
        return (int) operations.stream().filter(op -> op instanceof Measure).count();
    }
}
