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

import com.hellblazer.knitting.TestBase;
import com.hellblazer.knitting.circuit.Circuit;
import com.hellblazer.knitting.circuit.ClassicalRegister;
import com.hellblazer.knitting.exceptions.MalformedCutIdentityException;
import com.hellblazer.knitting.observable.PauliString;
import com.hellblazer.knitting.observable.QubitWiseCommutingGrouper;
import com.hellblazer.knitting.qpd.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
class CuttingExperimentGeneratorTest extends TestBase {

    private WeightSampler              sampler;
    private CuttingExperimentGenerator generator;

    @BeforeEach
    void setUpGenerator() {
        sampler = mock(WeightSampler.class);
        generator = new CuttingExperimentGenerator(CuttingConfiguration.defaultConfig(), sampler,
                                                   new QpdInstructionDecomposer(), new QubitWiseCommutingGrouper());
    }

    private static Circuit singleCut() {
        return new Circuit(2).h(0).append(QpdGate.twoParty(signBasis()), 0, 1);
    }

    private static List<Double> values(CuttingExperiments experiments) {
        return experiments.coefficients().stream().map(Coefficient::value).toList();
    }

    @Test
    void testUnifiedCoefficientsAndSubexperiments() {
        when(sampler.sample(any(), anyDouble())).thenReturn(
        samples(WeightType.EXACT, JointChoice.of(0), 2, JointChoice.of(1), 2));

        var experiments = generator.generateCuttingExperiments(singleCut(), PauliString.parseAll("ZZ"), 100);

        assertEquals(List.of(1.0, -1.0), values(experiments));
        assertEquals(WeightType.EXACT, experiments.coefficients().get(0).weightType());
        var subexperiments = experiments.subexperiments().asList();
        assertEquals(2, subexperiments.size());
        assertEquals(List.of("h", "measure", "measure"), names(subexperiments.get(0)));
        assertEquals(List.of("h", "z", "z", "measure", "measure"), names(subexperiments.get(1)));
        assertEquals(new ClassicalRegister(MeasurementAppender.OBSERVABLE_MEASUREMENTS, 2),
                     subexperiments.get(1).getRegisters().get(0));
        assertThrows(IllegalStateException.class, () -> experiments.subexperiments().asMap());

        verify(sampler).sample(eq(List.of(signBasis())), eq(100.0));
    }

    @Test
    void testSmallBudgetCoveringEveryChoiceIsExact() {
        for (var seed : new long[] { 2, 8, RANDOM_SEED }) {
            var config = CuttingConfiguration.defaultConfig().withSeed(seed);

            var experiments = new CuttingExperimentGenerator(config).generateCuttingExperiments(
            singleCut(), PauliString.parseAll("ZZ"), 4);

            assertEquals(List.of(new Coefficient(1.0, WeightType.EXACT), new Coefficient(-1.0, WeightType.EXACT)),
                         experiments.coefficients());
            assertEquals(2, experiments.subexperiments().asList().size());
        }
    }

    @Test
    void testZeroWidthObservables() {
        var e = assertThrows(IllegalArgumentException.class,
                             () -> generator.generateCuttingExperiments(singleCut(), PauliString.parseAll(""),
                                                                        10));
        assertTrue(e.getMessage().contains("at least one qubit"));
        verifyNoInteractions(sampler);
    }

    @Test
    void testDescendingRedundancyOrder() {
        when(sampler.sample(any(), anyDouble())).thenReturn(
        samples(WeightType.SAMPLED, JointChoice.of(0), 1, JointChoice.of(1), 3));

        var experiments = generator.generateCuttingExperiments(singleCut(), PauliString.parseAll("ZZ"), 4);

        assertEquals(List.of(-1.5, 0.5), values(experiments));
        assertEquals(List.of("h", "z", "z", "measure", "measure"),
                     names(experiments.subexperiments().asList().get(0)));
    }

    @Test
    void testTiesKeepSamplerOrder() {
        when(sampler.sample(any(), anyDouble())).thenReturn(
        samples(WeightType.SAMPLED, JointChoice.of(1), 2, JointChoice.of(0), 2));

        var experiments = generator.generateCuttingExperiments(singleCut(), PauliString.parseAll("ZZ"), 4);

        assertEquals(List.of(-1.0, 1.0), values(experiments));
    }

    @Test
    void testGroupsPerChoice() {
        when(sampler.sample(any(), anyDouble())).thenReturn(
        samples(WeightType.EXACT, JointChoice.of(0), 0.5, JointChoice.of(1), 0.5));

        var experiments = generator.generateCuttingExperiments(singleCut(), PauliString.parseAll("ZZ", "XI", "ZI"),
                                                               Double.POSITIVE_INFINITY);

        var subexperiments = experiments.subexperiments().asList();
        assertEquals(4, subexperiments.size());
        // choice 0 group ZZ, choice 0 group XI, choice 1 group ZZ, choice 1 group XI
        assertEquals(List.of("h", "measure", "measure"), names(subexperiments.get(0)));
        assertEquals(List.of("h", "h", "measure"), names(subexperiments.get(1)));
        assertEquals(List.of("h", "z", "z", "measure", "measure"), names(subexperiments.get(2)));
        assertEquals(List.of("h", "z", "z", "h", "measure"), names(subexperiments.get(3)));
    }

    @Test
    void testNoCuts() {
        var experiments = new CuttingExperimentGenerator(CuttingConfiguration.defaultConfig()).generateCuttingExperiments(
        new Circuit(2).h(0).cx(0, 1), PauliString.parseAll("ZZ", "XX"), 1000);

        assertEquals(List.of(new Coefficient(1.0, WeightType.EXACT)), experiments.coefficients());
        assertEquals(2, experiments.subexperiments().asList().size());
    }

    @Test
    void testPartitioned() {
        when(sampler.sample(any(), anyDouble())).thenReturn(
        samples(WeightType.EXACT, JointChoice.of(0), 1, JointChoice.of(1), 1));
        var circuits = new LinkedHashMap<String, Circuit>();
        circuits.put("A", new Circuit(1).h(0).append(QpdGate.oneParty(signBasis(), 0, "cut_0"), 0));
        circuits.put("B", new Circuit(1).append(QpdGate.oneParty(signBasis(), 1, "cut_0"), 0));
        var observables = new LinkedHashMap<String, List<PauliString>>();
        observables.put("A", PauliString.parseAll("Z"));
        observables.put("B", PauliString.parseAll("Z", "X"));

        var experiments = generator.generateCuttingExperiments(circuits, observables, 100);

        assertEquals(List.of(1.0, -1.0), values(experiments));
        var buckets = experiments.subexperiments().asMap();
        assertEquals(List.of("A", "B"), List.copyOf(buckets.keySet()));
        assertEquals(2, buckets.get("A").size());
        assertEquals(4, buckets.get("B").size());
        assertEquals(List.of("h", "z", "measure"), names(buckets.get("A").get(1)));
        assertEquals(List.of("measure"), names(buckets.get("B").get(0)));
        assertEquals(List.of("h", "measure"), names(buckets.get("B").get(1)));
        assertEquals(List.of("z", "measure"), names(buckets.get("B").get(2)));
        assertEquals(List.of("z", "h", "measure"), names(buckets.get("B").get(3)));
        assertThrows(IllegalStateException.class, () -> experiments.subexperiments().asList());
    }

    @Test
    void testNonContiguousCutIdentities() {
        when(sampler.sample(any(), anyDouble())).thenReturn(samples(WeightType.SAMPLED, JointChoice.of(1, 1), 10));
        var circuits = new LinkedHashMap<String, Circuit>();
        circuits.put("A", new Circuit(1).append(QpdGate.oneParty(signBasis(), 0, "cut_7"), 0)
                                        .append(QpdGate.oneParty(measuringBasis(), 0, "cut_3"), 0));
        circuits.put("B", new Circuit(1).append(QpdGate.oneParty(measuringBasis(), 1, "cut_3"), 0)
                                        .append(QpdGate.oneParty(signBasis(), 1, "cut_7"), 0));

        var experiments = generator.generateCuttingExperiments(circuits, Map.of("A", PauliString.parseAll("Z"), "B",
                                                                                PauliString.parseAll("Z")), 10);

        // cut 3 then cut 7: kappa 3 * 2, sign (-1) * (-1)
        assertEquals(List.of(6.0), values(experiments));
        verify(sampler).sample(eq(List.of(measuringBasis(), signBasis())), eq(10.0));
        var buckets = experiments.subexperiments().asMap();
        assertEquals(List.of("z", "measure", "measure"), names(buckets.get("A").get(0)));
        assertEquals(List.of("x", "z", "measure"), names(buckets.get("B").get(0)));
    }

    @Test
    void testMalformedCutLabel() {
        var circuits = Map.of("A", new Circuit(1).append(QpdGate.oneParty(signBasis(), 0, "cut"), 0));

        assertThrows(MalformedCutIdentityException.class,
                     () -> generator.generateCuttingExperiments(circuits, Map.of("A", PauliString.parseAll("Z")), 10));
        verifyNoInteractions(sampler);
    }

    @Test
    void testOnePartyInUnifiedCircuit() {
        var circuit = new Circuit(1).append(QpdGate.oneParty(signBasis(), 0, "cut_0"), 0);

        assertThrows(IllegalArgumentException.class,
                     () -> generator.generateCuttingExperiments(circuit, PauliString.parseAll("Z"), 10));
    }

    @Test
    void testShapeMismatch() {
        var unified = CircuitInput.of(singleCut());
        var partitioned = CircuitInput.of(Map.of("A", singleCut()));
        var unifiedObservables = ObservableInput.of(PauliString.parseAll("ZZ"));
        var partitionedObservables = ObservableInput.of(Map.of("A", PauliString.parseAll("ZZ")));

        var e = assertThrows(IllegalArgumentException.class,
                             () -> generator.generateCuttingExperiments(unified, partitionedObservables, 0.5));
        assertTrue(e.getMessage().startsWith("If the input circuits is a single circuit"));
        e = assertThrows(IllegalArgumentException.class,
                         () -> generator.generateCuttingExperiments(partitioned, unifiedObservables, 10));
        assertTrue(e.getMessage().contains("keyed by partition labels"));
        verifyNoInteractions(sampler);
    }

    @Test
    void testObservablesWithoutCircuit() {
        var circuits = Map.of("A", new Circuit(1));

        assertThrows(IllegalArgumentException.class,
                     () -> generator.generateCuttingExperiments(circuits, Map.of("B", PauliString.parseAll("Z")), 10));
    }

    @Test
    void testSampleBudget() {
        var e = assertThrows(IllegalArgumentException.class,
                             () -> generator.generateCuttingExperiments(singleCut(), PauliString.parseAll("ZZ"),
                                                                        0.5));
        assertEquals("numSamples must be at least 1.", e.getMessage());
        assertThrows(IllegalArgumentException.class,
                     () -> generator.generateCuttingExperiments(singleCut(), PauliString.parseAll("ZZ"), Double.NaN));
        assertThrows(IllegalArgumentException.class,
                     () -> generator.generateDistributionCuttingExperiments(singleCut(), 0));
        verifyNoInteractions(sampler);
    }

    @Test
    void testEmptySamplerResult() {
        when(sampler.sample(any(), anyDouble())).thenReturn(Map.of());

        assertThrows(IllegalStateException.class,
                     () -> generator.generateCuttingExperiments(singleCut(), PauliString.parseAll("ZZ"), 10));
    }

    @Test
    void testDistributionCutting() {
        var creg = new ClassicalRegister("c", 2);
        var circuit = new Circuit(2, creg).h(0)
                                          .append(QpdGate.twoParty(signBasis()), 0, 1)
                                          .measure(0, creg.get(0))
                                          .measure(1, creg.get(1));

        var experiments = new CuttingExperimentGenerator(
        CuttingConfiguration.defaultConfig()).generateDistributionCuttingExperiments(circuit,
                                                                                     Double.POSITIVE_INFINITY);

        assertEquals(List.of(new Coefficient(1.0, WeightType.EXACT), new Coefficient(-1.0, WeightType.EXACT)),
                     experiments.coefficients());
        var subexperiments = experiments.subexperiments().asList();
        assertEquals(List.of("h", "measure", "measure"), names(subexperiments.get(0)));
        assertEquals(List.of("h", "z", "z", "measure", "measure"), names(subexperiments.get(1)));
        assertEquals(List.of(creg), subexperiments.get(1).getRegisters());
    }

    @Test
    void testParallelMatchesSequential() {
        var circuit = new Circuit(3).h(0)
                                    .append(QpdGate.twoParty(signBasis()), 0, 1)
                                    .append(QpdGate.twoParty(measuringBasis()), 1, 2)
                                    .append(QpdGate.twoParty(measuringBasis()), 0, 2);
        var observables = PauliString.parseAll("ZZZ", "XIX", "IYI");
        var sequentialConfig = CuttingConfiguration.defaultConfig();
        var parallelConfig = sequentialConfig.withParallel(true).withParallelism(4).withParallelThreshold(1);

        var sequential = new CuttingExperimentGenerator(sequentialConfig).generateCuttingExperiments(circuit,
                                                                                                   observables,
                                                                                                   500);
        var parallel = new CuttingExperimentGenerator(parallelConfig).generateCuttingExperiments(circuit, observables,
                                                                                                 500);

        assertTrue(sequential.coefficients().size() > 1);
        assertEquals(sequential, parallel);
    }
}
