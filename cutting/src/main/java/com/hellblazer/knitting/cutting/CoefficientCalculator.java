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

import com.hellblazer.knitting.qpd.JointChoice;
import com.hellblazer.knitting.qpd.QpdBasis;
import com.hellblazer.knitting.qpd.SampleWeight;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the signed reconstruction coefficient of each sampled joint choice.
 *
 * For a choice with redundancy r out of an effective sample count N, with total overhead kappa = prod(kappa_b),
 * the coefficient is (r / N) * kappa * sign(prod(c_b[choice_b])). Only the sign of the chosen coefficients is
 * kept: their magnitude is already accounted for by the sampling probabilities.
 *
 * @author hal.hildebrand
 */
public final class CoefficientCalculator {

    private CoefficientCalculator() {
    }

    /**
     * Order samples by descending redundancy. The sort is stable, so equal redundancies keep the sampler's
     * iteration order.
     */
    public static List<Map.Entry<JointChoice, SampleWeight>> sortSamples(Map<JointChoice, SampleWeight> samples) {
        Objects.requireNonNull(samples, "samples cannot be null");
        var sorted = new ArrayList<Map.Entry<JointChoice, SampleWeight>>(samples.size());
        samples.forEach((choice, weight) -> sorted.add(Map.entry(choice, weight)));
        sorted.sort(Comparator.comparingDouble((Map.Entry<JointChoice, SampleWeight> e) -> e.getValue().redundancy())
                              .reversed());
        return sorted;
    }

    /**
     * @return the product of the overhead factors of all bases; 1 for no bases
     */
    public static double totalKappa(List<QpdBasis> bases) {
        var kappa = 1.0;
        for (var basis : bases) {
            kappa *= basis.kappa();
        }
        return kappa;
    }

    /**
     * @return the sum of all redundancies, the Monte Carlo normalizer
     */
    public static double effectiveSampleCount(List<Map.Entry<JointChoice, SampleWeight>> samples) {
        return samples.stream().mapToDouble(e -> e.getValue().redundancy()).sum();
    }

    /**
     * @return the sign of the product of the chosen coefficients; +1 for no bases, 0 if any chosen coefficient
     *     is 0
     */
    public static double sign(List<QpdBasis> bases, JointChoice choice) {
        if (bases.size() != choice.size()) {
            throw new IllegalArgumentException(
            String.format("Joint choice %s has %d entries but there are %d bases", choice, choice.size(),
                          bases.size()));
        }
        var product = 1.0;
        for (int b = 0; b < bases.size(); b++) {
            product *= bases.get(b).coefficient(choice.get(b));
        }
        return Math.signum(product);
    }

    /**
     * Coefficients aligned one-to-one with {@code sortedSamples}.
     */
    public static List<Coefficient> coefficients(List<QpdBasis> bases,
                                                 List<Map.Entry<JointChoice, SampleWeight>> sortedSamples) {
        Objects.requireNonNull(bases, "bases cannot be null");
        Objects.requireNonNull(sortedSamples, "sortedSamples cannot be null");
        var kappa = totalKappa(bases);
        var numSamples = effectiveSampleCount(sortedSamples);

        var coefficients = new ArrayList<Coefficient>(sortedSamples.size());
        for (var sample : sortedSamples) {
            var weight = sample.getValue();
            var value = (weight.redundancy() / numSamples) * (kappa * sign(bases, sample.getKey()));
            coefficients.add(new Coefficient(value, weight.weightType()));
        }
        return coefficients;
    }
}
