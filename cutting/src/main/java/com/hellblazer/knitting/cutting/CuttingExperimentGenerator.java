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
import com.hellblazer.knitting.observable.*;
import com.hellblazer.knitting.qpd.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Generates the subexperiments of a cut circuit and the coefficients to recombine their results with.
 *
 * The cuts are collected, the joint quasi-probability distribution of their bases is sampled, and for every
 * distinct joint choice, in descending order of redundancy, one coefficient is computed and one subexperiment per
 * partition and measurement group is assembled. Subexperiment lists are ordered
 * {@code [choice0 group0, ..., choice0 groupN, choice1 group0, ..., choiceM groupN]}.
 *
 * Instances are immutable and may be shared between threads.
 *
 * @author hal.hildebrand
 */
public class CuttingExperimentGenerator {
    private static final Logger log = LoggerFactory.getLogger(CuttingExperimentGenerator.class);

    /** Label of the implicit partition of an unseparated circuit */
    static final String UNIFIED_LABEL = "A";

    private final CuttingConfiguration config;
    private final WeightSampler        sampler;
    private final CircuitResolver      resolver;
    private final ObservableGrouper    grouper;

    /**
     * Generator configured from the classpath defaults, with the default collaborators.
     */
    public CuttingExperimentGenerator() {
        this(CuttingConfigurationLoader.loadDefaults());
    }

    public CuttingExperimentGenerator(CuttingConfiguration config) {
        this(config, new QpdWeightSampler(config.seed()), new QpdInstructionDecomposer(),
             new QubitWiseCommutingGrouper());
    }

    public CuttingExperimentGenerator(CuttingConfiguration config, WeightSampler sampler, CircuitResolver resolver,
                                      ObservableGrouper grouper) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler cannot be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver cannot be null");
        this.grouper = Objects.requireNonNull(grouper, "grouper cannot be null");
    }

    public CuttingConfiguration getConfiguration() {
        return config;
    }

    /**
     * Generate experiments for reconstructing the output distribution of a circuit. The circuit is expected to end
     * in the measurements of interest; one subexperiment is produced per joint choice.
     *
     * @param circuit    the unseparated circuit
     * @param numSamples the sample budget, at least 1; {@link Double#POSITIVE_INFINITY} for exact weights
     * @return flat subexperiments aligned one-to-one with the coefficients
     */
    public CuttingExperiments generateDistributionCuttingExperiments(Circuit circuit, double numSamples) {
        Objects.requireNonNull(circuit, "circuit cannot be null");
        checkSampleBudget(numSamples);
        if (!circuit.hasMeasurements()) {
            log.warn("Distribution cutting of a circuit without measurements: {}", circuit);
        }

        var cuts = CutCollector.collect(circuit);
        var sorted = sample(cuts.bases(), numSamples);
        var coefficients = CoefficientCalculator.coefficients(cuts.bases(), sorted);

        var arena = new Circuit[sorted.size()];
        fill(sorted.size(), rank -> arena[rank] = resolver.resolve(circuit, cuts.gateIds(), sorted.get(rank).getKey()));

        return new CuttingExperiments(new SubexperimentSet.Unified(Arrays.asList(arena)), coefficients);
    }

    /**
     * Generate experiments for an unseparated circuit and its observables.
     */
    public CuttingExperiments generateCuttingExperiments(Circuit circuit, List<PauliString> observables,
                                                         double numSamples) {
        return generateCuttingExperiments(CircuitInput.of(circuit), ObservableInput.of(observables), numSamples);
    }

    /**
     * Generate experiments for separated partitions and their observables.
     */
    public CuttingExperiments generateCuttingExperiments(Map<String, Circuit> partitions,
                                                         Map<String, List<PauliString>> observables,
                                                         double numSamples) {
        return generateCuttingExperiments(CircuitInput.of(partitions), ObservableInput.of(observables), numSamples);
    }

    /**
     * Generate cutting subexperiments and their coefficients.
     *
     * <p>A {@link CircuitInput.Unified} circuit requires {@link ObservableInput.Unified} observables and yields a
     * {@link SubexperimentSet.Unified} result; {@link CircuitInput.Partitioned} circuits require
     * {@link ObservableInput.Partitioned} observables and yield one list per observable partition, in observable
     * iteration order. For a partition with G measurement groups, its list holds G subexperiments per coefficient.
     *
     * @param circuits    the circuit(s) to cut
     * @param observables the observable(s) to measure for every joint choice
     * @param numSamples  the sample budget, at least 1; {@link Double#POSITIVE_INFINITY} for exact weights
     * @return the subexperiments and one coefficient per distinct joint choice
     * @throws IllegalArgumentException if the budget is below 1, the input shapes differ, or the cuts are invalid
     */
    public CuttingExperiments generateCuttingExperiments(CircuitInput circuits, ObservableInput observables,
                                                         double numSamples) {
        Objects.requireNonNull(circuits, "circuits cannot be null");
        Objects.requireNonNull(observables, "observables cannot be null");
        if (circuits instanceof CircuitInput.Unified && !(observables instanceof ObservableInput.Unified)) {
            throw new IllegalArgumentException(
            "If the input circuits is a single circuit, the observables must be a single list of observables.");
        }
        if (circuits instanceof CircuitInput.Partitioned && !(observables instanceof ObservableInput.Partitioned)) {
            throw new IllegalArgumentException(
            "If the input circuits are keyed by partition labels, the input observables must also be keyed by "
            + "partition labels.");
        }
        checkSampleBudget(numSamples);

        List<QpdBasis> bases;
        List<Partition> partitions;
        if (circuits instanceof CircuitInput.Unified unified) {
            var cuts = CutCollector.collect(unified.circuit());
            bases = cuts.bases();
            var paulis = ((ObservableInput.Unified) observables).observables();
            if (paulis.isEmpty()) {
                throw new IllegalArgumentException("At least one observable is required");
            }
            if (paulis.get(0).numQubits() == 0) {
                throw new IllegalArgumentException("Observables must act on at least one qubit");
            }
            var subobservables = ObservableDecomposer.decompose(paulis, UNIFIED_LABEL.repeat(
            paulis.get(0).numQubits()));
            partitions = List.of(new Partition(UNIFIED_LABEL, unified.circuit(), cuts.gateIds(), null,
                                               grouper.group(subobservables.get(UNIFIED_LABEL))));
        } else {
            var separated = (CircuitInput.Partitioned) circuits;
            var cuts = CutCollector.collect(separated.circuits());
            bases = cuts.bases();
            partitions = new ArrayList<>();
            for (var entry : ((ObservableInput.Partitioned) observables).observables().entrySet()) {
                var label = entry.getKey();
                var circuit = separated.circuits().get(label);
                if (circuit == null) {
                    throw new IllegalArgumentException(
                    String.format("Observables given for partition %s, which has no circuit; partitions are %s",
                                  label, separated.circuits().keySet()));
                }
                partitions.add(new Partition(label, circuit, cuts.gateIds(label), cuts.mapIds(label),
                                             grouper.group(entry.getValue())));
            }
        }

        var sorted = sample(bases, numSamples);
        var coefficients = CoefficientCalculator.coefficients(bases, sorted);

        // One slot per (partition, choice rank, group rank)
        var arenas = new ArrayList<Circuit[][]>(partitions.size());
        for (var partition : partitions) {
            arenas.add(new Circuit[sorted.size()][partition.groups().size()]);
        }
        fill(sorted.size(), rank -> {
            var choice = sorted.get(rank).getKey();
            for (int p = 0; p < partitions.size(); p++) {
                var partition = partitions.get(p);
                var local = partition.mapIds() == null ? choice : choice.restrict(partition.mapIds());
                var resolved = resolver.resolve(partition.circuit(), partition.gateIds(), local);
                var slots = arenas.get(p)[rank];
                for (int g = 0; g < slots.length; g++) {
                    slots[g] = MeasurementAppender.appendMeasurementCircuit(resolved, partition.groups().get(g));
                }
            }
        });

        var buckets = new LinkedHashMap<String, List<Circuit>>();
        for (int p = 0; p < partitions.size(); p++) {
            var flat = new ArrayList<Circuit>();
            for (var slots : arenas.get(p)) {
                flat.addAll(Arrays.asList(slots));
            }
            buckets.put(partitions.get(p).label(), flat);
        }
        if (log.isDebugEnabled()) {
            log.debug("Generated {} coefficient(s) and subexperiments per partition {}", coefficients.size(),
                      buckets.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue().size()).toList());
        }

        SubexperimentSet subexperiments = circuits instanceof CircuitInput.Unified ? new SubexperimentSet.Unified(
        buckets.get(UNIFIED_LABEL)) : new SubexperimentSet.Partitioned(buckets);
        return new CuttingExperiments(subexperiments, coefficients);
    }

    private List<Map.Entry<JointChoice, SampleWeight>> sample(List<QpdBasis> bases, double numSamples) {
        var samples = sampler.sample(bases, numSamples);
        if (samples.isEmpty()) {
            throw new IllegalStateException("Weight sampler returned no joint choices");
        }
        var sorted = CoefficientCalculator.sortSamples(samples);
        if (log.isDebugEnabled()) {
            log.debug("Sampled {} distinct joint choice(s) over {} basis(es), kappa={}, effective samples={}",
                      sorted.size(), bases.size(), CoefficientCalculator.totalKappa(bases),
                      CoefficientCalculator.effectiveSampleCount(sorted));
        }
        return sorted;
    }

    /**
     * Run {@code task} for every rank in [0, count). Each rank writes only its own slots, so parallel execution
     * produces the same result as sequential execution.
     */
    private void fill(int count, IntConsumer task) {
        if (!config.parallel() || count < config.parallelThreshold()) {
            for (int rank = 0; rank < count; rank++) {
                task.accept(rank);
            }
            return;
        }

        log.debug("Assembling {} joint choices on {} threads", count, config.parallelism());
        var pool = new ForkJoinPool(config.parallelism());
        try {
            pool.submit(() -> IntStream.range(0, count).parallel().forEach(task)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while assembling subexperiments", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Subexperiment assembly failed", cause);
        } finally {
            pool.shutdown();
        }
    }

    private static void checkSampleBudget(double numSamples) {
        if (!(numSamples >= 1)) {
            throw new IllegalArgumentException("numSamples must be at least 1.");
        }
    }

    /**
     * One partition's share of the work; {@code mapIds} is null when the partition holds every cut in canonical
     * order.
     */
    private record Partition(String label, Circuit circuit, List<List<Integer>> gateIds, List<Integer> mapIds,
                             List<CommutingObservableGroup> groups) {
    }
}
