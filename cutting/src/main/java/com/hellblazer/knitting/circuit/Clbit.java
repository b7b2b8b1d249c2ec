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
 * One bit of a {@link ClassicalRegister}.
 *
 * @author hal.hildebrand
 */
public record Clbit(ClassicalRegister register, int index) {

    public Clbit {
        Objects.requireNonNull(register, "register cannot be null");
        if (index < 0 || index >= register.size()) {
            throw new IndexOutOfBoundsException(
            String.format("Bit %d out of range [0, %d) for register %s", index, register.size(),
                          register.name()));
        }
    }
}
