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

import java.util.Objects;

/**
 * Configuration options for cutting experiment generation.
 *
 * <p>Controls the seed of the default weight sampler and whether subexperiments are assembled in parallel.
 * Parallel assembly fills index-addressed slots, so its output is identical to sequential assembly.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class CuttingConfiguration {

    /** Default seed of the Monte Carlo weight sampler */
    public static final long DEFAULT_SEED = 42L;

    /** Parallel assembly is off by default */
    public static final boolean DEFAULT_PARALLEL = false;

    /** Default worker count for parallel assembly */
    public static final int DEFAULT_PARALLELISM = Math.max(1, Runtime.getRuntime().availableProcessors());

    /** Default minimum number of joint choices before assembly runs in parallel */
    public static final int DEFAULT_PARALLEL_THRESHOLD = 64;

    private final long    seed;
    private final boolean parallel;
    private final int     parallelism;
    private final int     parallelThreshold;

    /**
     * Create a new cutting configuration.
     *
     * @param seed              the seed of the default weight sampler
     * @param parallel          whether to assemble subexperiments in parallel
     * @param parallelism       the number of worker threads for parallel assembly
     * @param parallelThreshold the minimum number of joint choices for parallel assembly
     * @throws IllegalArgumentException if parameters are invalid
     */
    public CuttingConfiguration(long seed, boolean parallel, int parallelism, int parallelThreshold) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        if (parallelThreshold <= 0) {
            throw new IllegalArgumentException("parallelThreshold must be positive: " + parallelThreshold);
        }
        this.seed = seed;
        this.parallel = parallel;
        this.parallelism = parallelism;
        this.parallelThreshold = parallelThreshold;
    }

    /**
     * Create a configuration with default values.
     *
     * @return a default configuration
     */
    public static CuttingConfiguration defaultConfig() {
        return new CuttingConfiguration(DEFAULT_SEED, DEFAULT_PARALLEL, DEFAULT_PARALLELISM,
                                        DEFAULT_PARALLEL_THRESHOLD);
    }

    public long seed() {
        return seed;
    }

    public boolean parallel() {
        return parallel;
    }

    public int parallelism() {
        return parallelism;
    }

    public int parallelThreshold() {
        return parallelThreshold;
    }

    public CuttingConfiguration withSeed(long newSeed) {
        return new CuttingConfiguration(newSeed, parallel, parallelism, parallelThreshold);
    }

    public CuttingConfiguration withParallel(boolean newParallel) {
        return new CuttingConfiguration(seed, newParallel, parallelism, parallelThreshold);
    }

    public CuttingConfiguration withParallelism(int newParallelism) {
        return new CuttingConfiguration(seed, parallel, newParallelism, parallelThreshold);
    }

    public CuttingConfiguration withParallelThreshold(int newThreshold) {
        return new CuttingConfiguration(seed, parallel, parallelism, newThreshold);
    }

    @Override
    public String toString() {
        return String.format("CuttingConfiguration[seed=%d, parallel=%s, parallelism=%d, parallelThreshold=%d]",
                             seed, parallel, parallelism, parallelThreshold);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (CuttingConfiguration) obj;
        return seed == other.seed && parallel == other.parallel && parallelism == other.parallelism
        && parallelThreshold == other.parallelThreshold;
    }

    @Override
    public int hashCode() {
        return Objects.hash(seed, parallel, parallelism, parallelThreshold);
    }
}
