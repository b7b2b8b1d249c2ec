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

import java.util.Objects;

/**
 * A named, fixed size register of classical bits.
 *
 * @param name the register name, unique within a circuit
 * @param size the number of bits
 * @author hal.hildebrand
 */
public record ClassicalRegister(String name, int size) {

    public ClassicalRegister {
        Objects.requireNonNull(name, "name cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("Register size cannot be negative: " + size);
        }
    }

    /**
     * Returns the bit at the given index of this register.
     */
    public Clbit get(int index) {
        return new Clbit(this, index);
    }
}
