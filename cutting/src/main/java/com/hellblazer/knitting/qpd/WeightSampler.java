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

import java.util.List;
import java.util.Map;

/**
 * Draws joint choices from the product distribution of a list of bases.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface WeightSampler {

    /**
     * Sample the joint quasi-probability distribution.
     *
     * @param bases      the bases, in canonical cut order; every returned choice has one entry per basis
     * @param numSamples the sample budget, at least 1; {@link Double#POSITIVE_INFINITY} requests exact weights
     * @return the weight of each distinct choice, in a deterministic iteration order
     */
    Map<JointChoice, SampleWeight> sample(List<QpdBasis> bases, double numSamples);
}
