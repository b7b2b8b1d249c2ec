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

import com.hellblazer.knitting.circuit.Circuit;

import java.util.List;

/**
 * Replaces the cut markers of a circuit with the local operations of a chosen term.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface CircuitResolver {

    /**
     * Resolve the markers of a circuit.
     *
     * @param circuit the circuit containing {@link QpdGate} markers; never modified
     * @param gateIds for each decomposition, the instruction positions of its markers
     * @param choice  the term index chosen for each decomposition, aligned with {@code gateIds}
     * @return a new circuit with the listed markers replaced
     */
    Circuit resolve(Circuit circuit, List<List<Integer>> gateIds, JointChoice choice);
}
