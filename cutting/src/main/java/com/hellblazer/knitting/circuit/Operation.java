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

/**
 * An operation that can be placed in a {@link Circuit}. Implementations are immutable value types.
 *
 * @author hal.hildebrand
 */
public interface Operation {

    /**
     * @return the operation name, e.g. "h", "measure", "qpd_2q"
     */
    String name();

    /**
     * @return the number of qubits the operation acts on
     */
    int numQubits();

    /**
     * @return the number of classical bits the operation writes
     */
    default int numClbits() {
        return 0;
    }
}
