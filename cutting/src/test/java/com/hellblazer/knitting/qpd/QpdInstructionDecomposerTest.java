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

import com.hellblazer.knitting.TestBase;
import com.hellblazer.knitting.circuit.Circuit;
import com.hellblazer.knitting.circuit.ClassicalRegister;
import com.hellblazer.knitting.circuit.Gate;
import com.hellblazer.knitting.circuit.Measure;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class QpdInstructionDecomposerTest extends TestBase {

    private final QpdInstructionDecomposer decomposer = new QpdInstructionDecomposer();

    @Test
    void testTwoPartyReplacement() {
        var circuit = new Circuit(2).h(0).append(QpdGate.twoParty(signBasis()), 0, 1).x(1);
        var before = circuit.copy();

        var identity = decomposer.resolve(circuit, List.of(List.of(1)), JointChoice.of(0));
        assertEquals(List.of("h", "x"), names(identity));

        var flipped = decomposer.resolve(circuit, List.of(List.of(1)), JointChoice.of(1));
        assertEquals(List.of("h", "z", "z", "x"), names(flipped));
        assertEquals(List.of(0), flipped.get(1).qubits());
        assertEquals(List.of(1), flipped.get(2).qubits());

        assertEquals(before, circuit);
        assertTrue(flipped.getRegisters().isEmpty());
    }

    @Test
    void testPartiesFollowMarkerQubits() {
        var circuit = new Circuit(3).append(QpdGate.twoParty(measuringBasis()), 2, 0);

        var resolved = decomposer.resolve(circuit, List.of(List.of(0)), JointChoice.of(1));

        // party 0 measures on qubit 2, party 1 applies X on qubit 0
        assertEquals(List.of("measure", "x"), names(resolved));
        assertEquals(List.of(2), resolved.get(0).qubits());
        assertEquals(List.of(0), resolved.get(1).qubits());

        var register = resolved.getRegisters().get(0);
        assertEquals(QpdInstructionDecomposer.QPD_MEASUREMENTS, register.name());
        assertEquals(1, register.size());
        assertEquals(register.get(0), resolved.get(0).clbits().get(0));
    }

    @Test
    void testOnePartyUsesItsParty() {
        var basis = measuringBasis();
        var creg = new ClassicalRegister("c", 1);
        var circuit = new Circuit(1, creg)
            .append(QpdGate.oneParty(basis, 0, "cut_0"), 0)
            .append(QpdGate.oneParty(basis, 1, "cut_1"), 0)
            .measure(0, creg.get(0));

        var resolved = decomposer.resolve(circuit, List.of(List.of(0), List.of(1)), JointChoice.of(1, 1));

        assertEquals(List.of("measure", "x", "measure"), names(resolved));
        assertEquals(List.of(creg, new ClassicalRegister(QpdInstructionDecomposer.QPD_MEASUREMENTS, 1)),
                     resolved.getRegisters());
        assertEquals(creg.get(0), resolved.get(2).clbits().get(0));
    }

    @Test
    void testMeasurementsBindConsecutiveBits() {
        var basis = measuringBasis();
        var circuit = new Circuit(2)
            .append(QpdGate.twoParty(basis), 0, 1)
            .append(QpdGate.twoParty(basis), 1, 0);

        var resolved = decomposer.resolve(circuit, List.of(List.of(0), List.of(1)), JointChoice.of(1, 1));

        var register = resolved.getRegisters().get(0);
        assertEquals(2, register.size());
        var measurements = resolved.getData().stream().filter(inst -> inst.operation() instanceof Measure).toList();
        assertEquals(2, measurements.size());
        assertEquals(register.get(0), measurements.get(0).clbits().get(0));
        assertEquals(List.of(0), measurements.get(0).qubits());
        assertEquals(register.get(1), measurements.get(1).clbits().get(0));
        assertEquals(List.of(1), measurements.get(1).qubits());
    }

    @Test
    void testSharedDecompositionAcrossPositions() {
        var basis = signBasis();
        var circuit = new Circuit(2)
            .append(QpdGate.oneParty(basis, 0, "cut_0"), 0)
            .append(Gate.H, 1)
            .append(QpdGate.oneParty(basis, 1, "cut_0"), 1);

        var resolved = decomposer.resolve(circuit, List.of(List.of(0, 2)), JointChoice.of(1));

        assertEquals(List.of("z", "h", "z"), names(resolved));
    }

    @Test
    void testValidation() {
        var circuit = new Circuit(2).h(0).append(QpdGate.twoParty(signBasis()), 0, 1);

        assertThrows(IllegalArgumentException.class,
                     () -> decomposer.resolve(circuit, List.of(List.of(0)), JointChoice.of(0)));
        assertThrows(IllegalArgumentException.class,
                     () -> decomposer.resolve(circuit, List.of(List.of(1)), JointChoice.of(2)));
        assertThrows(IllegalArgumentException.class,
                     () -> decomposer.resolve(circuit, List.of(List.of(1)), JointChoice.of(0, 0)));
        assertThrows(IllegalArgumentException.class,
                     () -> decomposer.resolve(circuit, List.of(List.of(1), List.of(1)), JointChoice.of(0, 0)));
    }
}
