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
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * A tensor product of single qubit Pauli operators, stored as X and Z bit vectors (Y = X and Z). Immutable.
 *
 * String labels are little-endian: the rightmost character acts on qubit 0, so "XZ" is Z on qubit 0 and X on
 * qubit 1.
 *
 * @author hal.hildebrand
 */
public final class PauliString {

    private final int    numQubits;
    private final BitSet x;
    private final BitSet z;

    private PauliString(int numQubits, BitSet x, BitSet z) {
        this.numQubits = numQubits;
        this.x = x;
        this.z = z;
    }

    /**
     * Parse a label of the characters I, X, Y and Z.
     */
    public static PauliString parse(String label) {
        Objects.requireNonNull(label, "label cannot be null");
        var n = label.length();
        var x = new BitSet(n);
        var z = new BitSet(n);
        for (int i = 0; i < n; i++) {
            var qubit = n - 1 - i;
            switch (Character.toUpperCase(label.charAt(i))) {
                case 'I' -> {
                }
                case 'X' -> x.set(qubit);
                case 'Z' -> z.set(qubit);
                case 'Y' -> {
                    x.set(qubit);
                    z.set(qubit);
                }
                default -> throw new IllegalArgumentException(
                String.format("Invalid Pauli character '%c' at position %d of \"%s\"", label.charAt(i), i, label));
            }
        }
        return new PauliString(n, x, z);
    }

    public static List<PauliString> parseAll(String... labels) {
        var paulis = new ArrayList<PauliString>(labels.length);
        for (var label : labels) {
            paulis.add(parse(label));
        }
        return paulis;
    }

    public static PauliString identity(int numQubits) {
        if (numQubits < 0) {
            throw new IllegalArgumentException("Qubit count cannot be negative: " + numQubits);
        }
        return new PauliString(numQubits, new BitSet(), new BitSet());
    }

    /**
     * Build from explicit bit vectors, index = qubit.
     */
    public static PauliString of(boolean[] x, boolean[] z) {
        if (x.length != z.length) {
            throw new IllegalArgumentException(
            String.format("X and Z vectors must have the same length: %d vs %d", x.length, z.length));
        }
        var xs = new BitSet(x.length);
        var zs = new BitSet(z.length);
        for (int q = 0; q < x.length; q++) {
            xs.set(q, x[q]);
            zs.set(q, z[q]);
        }
        return new PauliString(x.length, xs, zs);
    }

    public int numQubits() {
        return numQubits;
    }

    public boolean x(int qubit) {
        checkQubit(qubit);
        return x.get(qubit);
    }

    public boolean z(int qubit) {
        checkQubit(qubit);
        return z.get(qubit);
    }

    public boolean isIdentityAt(int qubit) {
        return !x(qubit) && !z(qubit);
    }

    public char pauliAt(int qubit) {
        var hasX = x(qubit);
        var hasZ = z(qubit);
        return hasX ? (hasZ ? 'Y' : 'X') : (hasZ ? 'Z' : 'I');
    }

    /**
     * @return the qubits on which this operator is not the identity, ascending
     */
    public List<Integer> nonIdentityIndices() {
        var support = (BitSet) x.clone();
        support.or(z);
        return support.stream().boxed().toList();
    }

    /**
     * Two operators commute qubit-wise when, on every qubit, they agree or at least one is the identity.
     */
    public boolean qubitWiseCommutes(PauliString other) {
        checkWidth(other);
        for (int q = 0; q < numQubits; q++) {
            if (!isIdentityAt(q) && !other.isIdentityAt(q) && pauliAt(q) != other.pauliAt(q)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The qubit-wise union of two qubit-wise commuting operators.
     */
    public PauliString union(PauliString other) {
        if (!qubitWiseCommutes(other)) {
            throw new IllegalArgumentException(
            String.format("%s and %s do not commute qubit-wise", label(), other.label()));
        }
        var ux = (BitSet) x.clone();
        ux.or(other.x);
        var uz = (BitSet) z.clone();
        uz.or(other.z);
        return new PauliString(numQubits, ux, uz);
    }

    /**
     * Select the given qubits, in order, as a new operator on {@code qubits.size()} qubits.
     */
    public PauliString select(List<Integer> qubits) {
        var sx = new BitSet(qubits.size());
        var sz = new BitSet(qubits.size());
        for (int i = 0; i < qubits.size(); i++) {
            var q = qubits.get(i);
            sx.set(i, x(q));
            sz.set(i, z(q));
        }
        return new PauliString(qubits.size(), sx, sz);
    }

    public String label() {
        var sb = new StringBuilder(numQubits);
        for (int q = numQubits - 1; q >= 0; q--) {
            sb.append(pauliAt(q));
        }
        return sb.toString();
    }

    private void checkQubit(int qubit) {
        if (qubit < 0 || qubit >= numQubits) {
            throw new IndexOutOfBoundsException(String.format("Qubit %d out of range [0, %d)", qubit, numQubits));
        }
    }

    private void checkWidth(PauliString other) {
        if (other.numQubits != numQubits) {
            throw new IllegalArgumentException(
            String.format("Qubit count mismatch: %d vs %d", numQubits, other.numQubits));
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (PauliString) obj;
        return numQubits == other.numQubits && x.equals(other.x) && z.equals(other.z);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numQubits, x, z);
    }

    @Override
    public String toString() {
        return label();
    }
}
