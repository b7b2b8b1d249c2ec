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
package com.hellblazer.knitting.cutting;

import com.hellblazer.knitting.qpd.WeightType;

import java.util.Objects;

/**
 * Signed reconstruction coefficient of one joint choice, shared by every subexperiment generated from it.
 *
 * @param value      the signed coefficient
 * @param weightType whether the underlying weight was exact or sampled
 * @author hal.hildebrand
 */
public record Coefficient(double value, WeightType weightType) {

    public Coefficient {
        Objects.requireNonNull(weightType, "weightType cannot be null");
    }
}
