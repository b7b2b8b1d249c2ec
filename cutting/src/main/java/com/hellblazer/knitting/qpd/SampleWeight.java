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

import java.util.Objects;

/**
 * Weight of one joint choice as produced by a {@link WeightSampler}.
 *
 * @param redundancy the occurrence count of the choice; for exact weights, its probability
 * @param weightType how the weight was obtained
 * @author hal.hildebrand
 */
public record SampleWeight(double redundancy, WeightType weightType) {

    public SampleWeight {
        Objects.requireNonNull(weightType, "weightType cannot be null");
        if (!(redundancy > 0.0) || Double.isInfinite(redundancy)) {
            throw new IllegalArgumentException("Redundancy must be positive and finite: " + redundancy);
        }
    }

    public static SampleWeight sampled(long count) {
        return new SampleWeight(count, WeightType.SAMPLED);
    }

    public static SampleWeight exact(double weight) {
        return new SampleWeight(weight, WeightType.EXACT);
    }
}
