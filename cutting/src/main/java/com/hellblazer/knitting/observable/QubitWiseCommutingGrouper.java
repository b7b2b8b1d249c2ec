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
import java.util.List;
import java.util.Objects;

/**
 * Greedy first-fit grouping: each observable joins the first group it commutes with qubit-wise, otherwise it
 * opens a new group. Groups and their members keep input order.
 *
 * @author hal.hildebrand
 */
public class QubitWiseCommutingGrouper implements ObservableGrouper {

    @Override
    public List<CommutingObservableGroup> group(List<PauliString> observables) {
        Objects.requireNonNull(observables, "observables cannot be null");
        if (observables.isEmpty()) {
            throw new IllegalArgumentException("Cannot group an empty list of observables");
        }
        var width = observables.get(0).numQubits();

        var generals = new ArrayList<PauliString>();
        var members = new ArrayList<List<PauliString>>();
        for (var observable : observables) {
            if (observable.numQubits() != width) {
                throw new IllegalArgumentException(
                String.format("All observables must act on %d qubits; %s acts on %d", width, observable,
                              observable.numQubits()));
            }
            var placed = false;
            for (int g = 0; g < generals.size() && !placed; g++) {
                // Commuting with the union is commuting with every member
                if (generals.get(g).qubitWiseCommutes(observable)) {
                    generals.set(g, generals.get(g).union(observable));
                    members.get(g).add(observable);
                    placed = true;
                }
            }
            if (!placed) {
                generals.add(observable);
                members.add(new ArrayList<>(List.of(observable)));
            }
        }

        var groups = new ArrayList<CommutingObservableGroup>(generals.size());
        for (int g = 0; g < generals.size(); g++) {
            groups.add(new CommutingObservableGroup(generals.get(g), members.get(g)));
        }
        return groups;
    }
}
