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
package com.hellblazer.knitting;

import com.hellblazer.knitting.circuit.Circuit;
import com.hellblazer.knitting.circuit.Gate;
import com.hellblazer.knitting.circuit.Measure;
import com.hellblazer.knitting.circuit.Operation;
import com.hellblazer.knitting.qpd.JointChoice;
import com.hellblazer.knitting.qpd.QpdBasis;
import com.hellblazer.knitting.qpd.SampleWeight;
import com.hellblazer.knitting.qpd.WeightType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for cutting tests providing common bases and sample fixtures.
 */
public abstract class TestBase {

    protected static final Logger log = LoggerFactory.getLogger(TestBase.class);

    protected static final long RANDOM_SEED = 42L;

    @BeforeEach
    void setUp(TestInfo testInfo) {
        log.debug("Starting test: {}.{}",
            testInfo.getTestClass().map(Class::getSimpleName).orElse("Unknown"),
            testInfo.getDisplayName());
    }

    /**
     * Two-party basis with terms +1 (no operations) and -1 (Z on both parties): kappa 2, equal probabilities.
     */
    protected static QpdBasis signBasis() {
        return QpdBasis.of(
            QpdBasis.Term.of(1.0, List.of(), List.of()),
            QpdBasis.Term.of(-1.0, List.of(Gate.Z), List.of(Gate.Z))
        );
    }

    /**
     * Two-party basis with three terms, one of which measures party 0 mid-circuit: kappa 3.
     */
    protected static QpdBasis measuringBasis() {
        return QpdBasis.of(
            QpdBasis.Term.of(1.5, List.of(Gate.S), List.of(Gate.S)),
            QpdBasis.Term.of(-1.0, List.<Operation>of(Measure.MEASURE), List.of(Gate.X)),
            QpdBasis.Term.of(0.5, List.of(Gate.SDG), List.of(Gate.SDG))
        );
    }

    /**
     * Sampler output in the given insertion order: alternating choices and redundancies.
     */
    protected static Map<JointChoice, SampleWeight> samples(WeightType type, Object... choicesAndCounts) {
        var samples = new LinkedHashMap<JointChoice, SampleWeight>();
        for (int i = 0; i < choicesAndCounts.length; i += 2) {
            var choice = (JointChoice) choicesAndCounts[i];
            var count = ((Number) choicesAndCounts[i + 1]).doubleValue();
            samples.put(choice, new SampleWeight(count, type));
        }
        return samples;
    }

    protected static List<String> names(Circuit circuit) {
        return circuit.getData().stream().map(inst -> inst.operation().name()).toList();
    }
}
