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

import com.hellblazer.knitting.circuit.Circuit;
import com.hellblazer.knitting.circuit.Gate;
import com.hellblazer.knitting.circuit.Measure;
import com.hellblazer.knitting.circuit.Operation;
import com.hellblazer.knitting.observable.PauliString;
import com.hellblazer.knitting.observable.QubitWiseCommutingGrouper;
import com.hellblazer.knitting.qpd.QpdBasis;
import com.hellblazer.knitting.qpd.QpdGate;
import com.hellblazer.knitting.qpd.QpdWeightSampler;
import com.hellblazer.knitting.qpd.SampleWeight;
import com.hellblazer.knitting.qpd.WeightType;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based tests for generated cutting experiments.
 *
 * @author hal.hildebrand
 */
class CuttingExperimentPropertyTest {

    private static final List<PauliString> OBSERVABLES = PauliString.parseAll("ZZ", "XX", "ZI");

    private static final QpdBasis[] BASES = {
    QpdBasis.of(QpdBasis.Term.of(1.0, List.of(), List.of()), QpdBasis.Term.of(-1.0, List.of(Gate.Z), List.of(Gate.Z))),
    QpdBasis.of(QpdBasis.Term.of(1.5, List.of(Gate.S), List.of(Gate.S)),
                QpdBasis.Term.of(-1.0, List.<Operation>of(Measure.MEASURE), List.of(Gate.X)),
                QpdBasis.Term.of(0.5, List.of(Gate.SDG), List.of(Gate.SDG))) };

    private static Circuit circuit(int cuts) {
        var circuit = new Circuit(2).h(0);
        for (int i = 0; i < cuts; i++) {
            circuit.append(QpdGate.twoParty(BASES[i % BASES.length]), i % 2, (i + 1) % 2);
        }
        return circuit;
    }

    private static CuttingExperiments generate(int cuts, int budget, long seed) {
        var config = CuttingConfiguration.defaultConfig().withSeed(seed);
        return new CuttingExperimentGenerator(config).generateCuttingExperiments(circuit(cuts), OBSERVABLES,
                                                                                 budget);
    }

    @Property(tries = 50)
    @Label("One subexperiment per coefficient and measurement group")
    void subexperimentCount(@ForAll @IntRange(min = 0, max = 3) int cuts,
                            @ForAll @IntRange(min = 1, max = 300) int budget, @ForAll long seed) {
        var experiments = generate(cuts, budget, seed);
        var groups = new QubitWiseCommutingGrouper().group(OBSERVABLES).size();

        assertFalse(experiments.coefficients().isEmpty());
        assertTrue(experiments.coefficients().size() <= budget);
        assertEquals(experiments.coefficients().size() * groups, experiments.subexperiments().asList().size());
    }

    @Property(tries = 50)
    @Label("Coefficient magnitudes sum to the total overhead and never increase")
    void coefficientMagnitudes(@ForAll @IntRange(min = 0, max = 3) int cuts,
                               @ForAll @IntRange(min = 1, max = 300) int budget, @ForAll long seed) {
        var experiments = generate(cuts, budget, seed);

        var kappa = 1.0;
        for (int i = 0; i < cuts; i++) {
            kappa *= BASES[i % BASES.length].kappa();
        }
        var magnitudes = new ArrayList<Double>();
        experiments.coefficients().forEach(c -> magnitudes.add(Math.abs(c.value())));

        assertEquals(kappa, magnitudes.stream().mapToDouble(Double::doubleValue).sum(), 1e-9 * kappa);
        for (int i = 1; i < magnitudes.size(); i++) {
            assertTrue(magnitudes.get(i) <= magnitudes.get(i - 1));
        }
    }

    @Property(tries = 20)
    @Label("Redundancies add up to the budget when drawn and to one when exact")
    void redundanciesSumToBudget(@ForAll @IntRange(min = 1, max = 3) int cuts,
                                 @ForAll @IntRange(min = 1, max = 1000) int budget, @ForAll long seed) {
        var bases = new ArrayList<QpdBasis>();
        for (int i = 0; i < cuts; i++) {
            bases.add(BASES[i % BASES.length]);
        }

        var weights = new QpdWeightSampler(seed).sample(bases, budget);
        var total = weights.values().stream().mapToDouble(SampleWeight::redundancy).sum();

        if (weights.values().iterator().next().weightType() == WeightType.SAMPLED) {
            assertEquals(budget, total);
        } else {
            // every choice is covered by the budget
            assertEquals(1.0, total, 1e-9);
            weights.values().forEach(w -> assertTrue(w.redundancy() * budget >= 1.0 - 1e-9));
        }
    }
}
