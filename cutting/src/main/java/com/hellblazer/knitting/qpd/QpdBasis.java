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

import com.hellblazer.knitting.circuit.Operation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A quasi-probability decomposition of one cut: an ordered list of terms, each a real coefficient and the local
 * operations that replace the cut on every party it spans.
 *
 * The overhead factor kappa is the 1-norm of the coefficients, and term i is selected with probability
 * |c_i| / kappa. Immutable.
 *
 * @author hal.hildebrand
 */
public final class QpdBasis {

    /**
     * One alternative of the decomposition.
     *
     * @param coefficient the signed real coefficient
     * @param operations  one sequence of single qubit operations per party
     */
    public record Term(double coefficient, List<List<Operation>> operations) {

        public Term {
            Objects.requireNonNull(operations, "operations cannot be null");
            if (!Double.isFinite(coefficient)) {
                throw new IllegalArgumentException("Coefficient must be finite: " + coefficient);
            }
            if (operations.isEmpty()) {
                throw new IllegalArgumentException("Term must have operations for at least one party");
            }
            var copy = new ArrayList<List<Operation>>(operations.size());
            for (var partyOps : operations) {
                for (var op : partyOps) {
                    if (op.numQubits() != 1) {
                        throw new IllegalArgumentException(
                        String.format("Term operations must act on a single qubit: %s acts on %d", op.name(),
                                      op.numQubits()));
                    }
                }
                copy.add(List.copyOf(partyOps));
            }
            operations = List.copyOf(copy);
        }

        public static Term of(double coefficient, List<Operation> party0) {
            return new Term(coefficient, List.of(party0));
        }

        public static Term of(double coefficient, List<Operation> party0, List<Operation> party1) {
            return new Term(coefficient, List.of(party0, party1));
        }

        public int numParties() {
            return operations.size();
        }

        public List<Operation> operations(int party) {
            return operations.get(party);
        }
    }

    private final List<Term> terms;
    private final int        numParties;
    private final double     kappa;
    private final double[]   probabilities;

    public QpdBasis(List<Term> terms) {
        Objects.requireNonNull(terms, "terms cannot be null");
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("A QPD basis requires at least one term");
        }
        this.terms = List.copyOf(terms);
        this.numParties = this.terms.get(0).numParties();
        for (var term : this.terms) {
            if (term.numParties() != numParties) {
                throw new IllegalArgumentException(
                String.format("All terms must span the same number of parties: %d vs %d", term.numParties(),
                              numParties));
            }
        }
        this.kappa = this.terms.stream().mapToDouble(t -> Math.abs(t.coefficient())).sum();
        if (kappa == 0.0) {
            throw new IllegalArgumentException("Coefficients of a QPD basis cannot all be zero");
        }
        this.probabilities = this.terms.stream().mapToDouble(t -> Math.abs(t.coefficient()) / kappa).toArray();
    }

    public static QpdBasis of(Term... terms) {
        return new QpdBasis(Arrays.asList(terms));
    }

    public int size() {
        return terms.size();
    }

    public int numParties() {
        return numParties;
    }

    public Term getTerm(int index) {
        if (index < 0 || index >= terms.size()) {
            throw new IndexOutOfBoundsException(String.format("Term %d out of range [0, %d)", index, terms.size()));
        }
        return terms.get(index);
    }

    public double coefficient(int index) {
        return getTerm(index).coefficient();
    }

    public double[] coefficients() {
        return terms.stream().mapToDouble(Term::coefficient).toArray();
    }

    public double[] probabilities() {
        return probabilities.clone();
    }

    public double probability(int index) {
        getTerm(index);
        return probabilities[index];
    }

    /**
     * @return the sampling overhead factor, the sum of absolute coefficients
     */
    public double kappa() {
        return kappa;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return terms.equals(((QpdBasis) obj).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return String.format("QpdBasis{terms=%d, parties=%d, kappa=%.4f}", terms.size(), numParties, kappa);
    }
}
