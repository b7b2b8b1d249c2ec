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

import java.util.List;
import java.util.Objects;

/**
 * Subexperiments and the coefficients to recombine their results with. The n-th coefficient belongs to the n-th
 * block of subexperiments in every list, where a block holds one subexperiment per measurement group of that
 * partition.
 *
 * @param subexperiments the subexperiments, shaped like the input circuits
 * @param coefficients   one coefficient per distinct joint choice, in descending order of redundancy
 * @author hal.hildebrand
 */
public record CuttingExperiments(SubexperimentSet subexperiments, List<Coefficient> coefficients) {

    public CuttingExperiments {
        Objects.requireNonNull(subexperiments, "subexperiments cannot be null");
        Objects.requireNonNull(coefficients, "coefficients cannot be null");
        coefficients = List.copyOf(coefficients);
    }
}
