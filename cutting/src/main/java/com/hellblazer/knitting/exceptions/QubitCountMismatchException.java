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
package com.hellblazer.knitting.exceptions;

/**
 * Thrown when a circuit and an observable group disagree on qubit count and no explicit qubit mapping was given.
 */
public final class QubitCountMismatchException extends CuttingException {

    private final int circuitQubits;
    private final int observableQubits;

    public QubitCountMismatchException(int circuitQubits, int observableQubits) {
        super(String.format(
        "Quantum circuit qubit count (%d) does not match qubit count of observable(s) (%d).  Try providing "
        + "`qubitLocations` explicitly.", circuitQubits, observableQubits));
        this.circuitQubits = circuitQubits;
        this.observableQubits = observableQubits;
    }

    public int getCircuitQubits() {
        return circuitQubits;
    }

    public int getObservableQubits() {
        return observableQubits;
    }
}
