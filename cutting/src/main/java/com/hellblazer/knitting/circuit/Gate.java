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

import java.util.List;
import java.util.Objects;

/**
 * A unitary gate identified by name, with optional real parameters.
 *
 * @param name      the gate name
 * @param numQubits the number of qubits acted on
 * @param params    the gate parameters (angles), possibly empty
 * @author hal.hildebrand
 */
public record Gate(String name, int numQubits, List<Double> params) implements Operation {

    public static final Gate H   = new Gate("h", 1, List.of());
    public static final Gate S   = new Gate("s", 1, List.of());
    public static final Gate SDG = new Gate("sdg", 1, List.of());
    public static final Gate X   = new Gate("x", 1, List.of());
    public static final Gate Z   = new Gate("z", 1, List.of());
    public static final Gate CX  = new Gate("cx", 2, List.of());

    public Gate {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(params, "params cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Gate name cannot be blank");
        }
        if (numQubits <= 0) {
            throw new IllegalArgumentException("Gate must act on at least one qubit: " + numQubits);
        }
        params = List.copyOf(params);
    }

    /**
     * Single qubit Z rotation.
     */
    public static Gate rz(double theta) {
        return new Gate("rz", 1, List.of(theta));
    }
}
