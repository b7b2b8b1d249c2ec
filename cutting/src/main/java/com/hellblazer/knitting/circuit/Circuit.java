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

import java.util.*;

/**
 * A quantum circuit: a fixed number of qubits, an ordered list of classical registers and an ordered list of
 * instructions.
 *
 * Circuits are mutable; instructions and registers are immutable values, so {@link #copy()} produces a fully
 * independent circuit. Equality is structural.
 *
 * @author hal.hildebrand
 */
public final class Circuit {

    private final int                      numQubits;
    private final List<ClassicalRegister>  registers;
    private final List<CircuitInstruction> data;

    public Circuit(int numQubits, ClassicalRegister... registers) {
        if (numQubits < 0) {
            throw new IllegalArgumentException("Qubit count cannot be negative: " + numQubits);
        }
        this.numQubits = numQubits;
        this.registers = new ArrayList<>();
        this.data = new ArrayList<>();
        for (var register : registers) {
            addRegister(register);
        }
    }

    private Circuit(Circuit source) {
        this.numQubits = source.numQubits;
        this.registers = new ArrayList<>(source.registers);
        this.data = new ArrayList<>(source.data);
    }

    /**
     * Creates an empty circuit with the same qubits and classical registers as this one.
     */
    public Circuit copyEmpty() {
        var empty = new Circuit(numQubits);
        empty.registers.addAll(registers);
        return empty;
    }

    public Circuit copy() {
        return new Circuit(this);
    }

    public int numQubits() {
        return numQubits;
    }

    public int numClbits() {
        return registers.stream().mapToInt(ClassicalRegister::size).sum();
    }

    public List<ClassicalRegister> getRegisters() {
        return Collections.unmodifiableList(registers);
    }

    public List<CircuitInstruction> getData() {
        return Collections.unmodifiableList(data);
    }

    public CircuitInstruction get(int index) {
        if (index < 0 || index >= data.size()) {
            throw new IndexOutOfBoundsException(String.format("Index %d out of range [0, %d)", index, data.size()));
        }
        return data.get(index);
    }

    public int size() {
        return data.size();
    }

    /**
     * Adds a classical register after all existing registers.
     *
     * @throws IllegalArgumentException if a register of the same name exists
     */
    public Circuit addRegister(ClassicalRegister register) {
        Objects.requireNonNull(register, "register cannot be null");
        for (var existing : registers) {
            if (existing.name().equals(register.name())) {
                throw new IllegalArgumentException("Register already exists: " + register.name());
            }
        }
        registers.add(register);
        return this;
    }

    public Circuit append(CircuitInstruction instruction) {
        Objects.requireNonNull(instruction, "instruction cannot be null");
        for (var qubit : instruction.qubits()) {
            if (qubit < 0 || qubit >= numQubits) {
                throw new IllegalArgumentException(
                String.format("Qubit %d out of range [0, %d) for %s", qubit, numQubits, instruction.operation().name()));
            }
        }
        for (var clbit : instruction.clbits()) {
            if (!registers.contains(clbit.register())) {
                throw new IllegalArgumentException("Register not in circuit: " + clbit.register().name());
            }
        }
        data.add(instruction);
        return this;
    }

    public Circuit append(Operation operation, int... qubits) {
        return append(CircuitInstruction.of(operation, qubits));
    }

    public Circuit h(int qubit) {
        return append(Gate.H, qubit);
    }

    public Circuit sdg(int qubit) {
        return append(Gate.SDG, qubit);
    }

    public Circuit x(int qubit) {
        return append(Gate.X, qubit);
    }

    public Circuit z(int qubit) {
        return append(Gate.Z, qubit);
    }

    public Circuit rz(double theta, int qubit) {
        return append(Gate.rz(theta), qubit);
    }

    public Circuit cx(int control, int target) {
        return append(Gate.CX, control, target);
    }

    public Circuit measure(int qubit, Clbit clbit) {
        return append(new CircuitInstruction(Measure.MEASURE, List.of(qubit), List.of(clbit)));
    }

    /**
     * @return true if any instruction of this circuit is a measurement
     */
    public boolean hasMeasurements() {
        return data.stream().anyMatch(inst -> inst.operation() instanceof Measure);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (Circuit) obj;
        return numQubits == other.numQubits && registers.equals(other.registers) && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numQubits, registers, data);
    }

    @Override
    public String toString() {
        return String.format("Circuit{qubits=%d, clbits=%d, instructions=%d}", numQubits, numClbits(), data.size());
    }
}
