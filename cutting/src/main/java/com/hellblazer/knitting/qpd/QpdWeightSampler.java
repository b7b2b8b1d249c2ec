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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Default {@link WeightSampler}.
 *
 * When the budget N covers every joint choice, that is N * p >= 1 for the least likely choice with nonzero
 * probability p, every such choice is enumerated in lexicographic order and weighted by its exact probability. An
 * unbounded budget always qualifies. Otherwise floor(N) independent joint choices are drawn from the product
 * distribution and each distinct choice is weighted by its draw count; iteration order is first-draw order. Each
 * call reseeds, so repeated calls with the same arguments return the same samples.
 *
 * Drawing costs O(N * bases), so a large budget that still falls short of covering every choice is slow.
 *
 * @author hal.hildebrand
 */
public class QpdWeightSampler implements WeightSampler {

    private static final Logger log = LoggerFactory.getLogger(QpdWeightSampler.class);

    private final long seed;

    public QpdWeightSampler(long seed) {
        this.seed = seed;
    }

    @Override
    public Map<JointChoice, SampleWeight> sample(List<QpdBasis> bases, double numSamples) {
        Objects.requireNonNull(bases, "bases cannot be null");
        if (!(numSamples >= 1)) {
            throw new IllegalArgumentException("numSamples must be at least 1.");
        }

        var weights = new LinkedHashMap<JointChoice, SampleWeight>();
        if (bases.isEmpty()) {
            weights.put(JointChoice.empty(), SampleWeight.exact(1.0));
            return weights;
        }
        if (Double.isInfinite(numSamples) || coversEveryChoice(bases, numSamples)) {
            enumerate(bases, 0, new int[bases.size()], 1.0, weights);
            log.debug("Enumerated {} exact joint choices over {} bases", weights.size(), bases.size());
            return weights;
        }
        return draw(bases, (long) Math.floor(numSamples));
    }

    private static boolean coversEveryChoice(List<QpdBasis> bases, double numSamples) {
        var least = 1.0;
        for (var basis : bases) {
            var min = 1.0;
            for (var p : basis.probabilities()) {
                if (p > 0.0 && p < min) {
                    min = p;
                }
            }
            least *= min;
        }
        return numSamples * least >= 1.0;
    }

    private void enumerate(List<QpdBasis> bases, int depth, int[] mapIds, double probability,
                           Map<JointChoice, SampleWeight> weights) {
        if (depth == bases.size()) {
            weights.put(JointChoice.of(mapIds), SampleWeight.exact(probability));
            return;
        }
        var basis = bases.get(depth);
        for (int i = 0; i < basis.size(); i++) {
            var p = basis.probability(i);
            if (p == 0.0) {
                continue;
            }
            mapIds[depth] = i;
            enumerate(bases, depth + 1, mapIds, probability * p, weights);
        }
    }

    private Map<JointChoice, SampleWeight> draw(List<QpdBasis> bases, long count) {
        var random = new SplittableRandom(seed);
        var cumulative = new double[bases.size()][];
        for (int b = 0; b < bases.size(); b++) {
            var probabilities = bases.get(b).probabilities();
            var running = 0.0;
            cumulative[b] = new double[probabilities.length];
            for (int i = 0; i < probabilities.length; i++) {
                running += probabilities[i];
                cumulative[b][i] = running;
            }
        }

        var counts = new LinkedHashMap<JointChoice, Long>();
        var mapIds = new int[bases.size()];
        for (long s = 0; s < count; s++) {
            for (int b = 0; b < bases.size(); b++) {
                mapIds[b] = select(cumulative[b], random.nextDouble());
            }
            counts.merge(JointChoice.of(mapIds), 1L, Long::sum);
        }

        var weights = new LinkedHashMap<JointChoice, SampleWeight>();
        counts.forEach((choice, n) -> weights.put(choice, SampleWeight.sampled(n)));
        log.debug("Drew {} samples yielding {} distinct joint choices over {} bases", count, weights.size(),
                  bases.size());
        return weights;
    }

    private static int select(double[] cumulative, double u) {
        // Scaled by the final sum so accumulated rounding error cannot select past the end
        var target = u * cumulative[cumulative.length - 1];
        for (int i = 0; i < cumulative.length; i++) {
            if (target < cumulative[i]) {
                return i;
            }
        }
        return cumulative.length - 1;
    }
}
