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

import java.util.List;
import java.util.Objects;

/**
 * A set of qubit-wise commuting observables, all measurable in the single local basis described by the general
 * observable.
 *
 * @param generalObservable    the qubit-wise union of the members
 * @param commutingObservables the members, in insertion order
 * @author hal.hildebrand
 */
public record CommutingObservableGroup(PauliString generalObservable, List<PauliString> commutingObservables) {

    public CommutingObservableGroup {
        Objects.requireNonNull(generalObservable, "generalObservable cannot be null");
        Objects.requireNonNull(commutingObservables, "commutingObservables cannot be null");
        if (commutingObservables.isEmpty()) {
            throw new IllegalArgumentException("A commuting observable group requires at least one observable");
        }
        for (var observable : commutingObservables) {
            if (!generalObservable.qubitWiseCommutes(observable)) {
                throw new IllegalArgumentException(
                String.format("%s is not measurable in the basis of %s", observable, generalObservable));
            }
        }
        commutingObservables = List.copyOf(commutingObservables);
    }

    /**
     * Group the given observables, deriving the general observable as their union.
     */
    public static CommutingObservableGroup of(List<PauliString> observables) {
        if (observables.isEmpty()) {
            throw new IllegalArgumentException("A commuting observable group requires at least one observable");
        }
        var general = observables.get(0);
        for (var observable : observables.subList(1, observables.size())) {
            general = general.union(observable);
        }
        return new CommutingObservableGroup(general, observables);
    }

    public int numQubits() {
        return generalObservable.numQubits();
    }

    /**
     * @return the qubits actually measured, ascending
     */
    public List<Integer> pauliIndices() {
        return generalObservable.nonIdentityIndices();
    }

    public boolean hasX(int qubit) {
        return generalObservable.x(qubit);
    }

    public boolean hasZ(int qubit) {
        return generalObservable.z(qubit);
    }
}
