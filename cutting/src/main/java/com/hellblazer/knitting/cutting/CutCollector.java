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
import com.hellblazer.knitting.exceptions.MalformedCutIdentityException;
import com.hellblazer.knitting.qpd.CutIdentity;
import com.hellblazer.knitting.qpd.QpdBasis;
import com.hellblazer.knitting.qpd.QpdGate;

import java.util.*;

/**
 * Scans circuits for QPD markers and collects the distinct cuts with their bases and positions. Read only.
 *
 * @author hal.hildebrand
 */
public final class CutCollector {

    private CutCollector() {
    }

    /**
     * Collect the cuts of an unseparated circuit: every two-party marker is its own cut, numbered in circuit order.
     *
     * @throws IllegalArgumentException if the circuit holds a one-party marker
     */
    public static CollectedCuts collect(Circuit circuit) {
        Objects.requireNonNull(circuit, "circuit cannot be null");
        var bases = new ArrayList<QpdBasis>();
        var gateIds = new ArrayList<List<Integer>>();
        for (int i = 0; i < circuit.size(); i++) {
            if (!(circuit.get(i).operation() instanceof QpdGate marker)) {
                continue;
            }
            switch (marker.kind()) {
                case ONE_PARTY -> throw new IllegalArgumentException(
                "One-party QPD gates are not supported in unseparated circuits (instruction " + i + ")");
                case TWO_PARTY -> {
                    bases.add(marker.basis());
                    gateIds.add(List.of(i));
                }
            }
        }
        return new CollectedCuts(bases, gateIds);
    }

    /**
     * Collect the cuts of separated partitions. Markers sharing a {@link CutIdentity} belong to the same cut and
     * are sampled jointly; cuts are ordered by ascending identity.
     *
     * @throws MalformedCutIdentityException if a one-party marker has no cut identity
     * @throws IllegalArgumentException      if a partition holds a two-party marker
     */
    public static PartitionedCuts collect(Map<String, Circuit> partitions) {
        Objects.requireNonNull(partitions, "partitions cannot be null");
        var basesById = new TreeMap<CutIdentity, QpdBasis>();
        var gateIds = new LinkedHashMap<String, List<List<Integer>>>();
        var cutIds = new LinkedHashMap<String, List<CutIdentity>>();

        partitions.forEach((label, circuit) -> {
            var partitionGates = new ArrayList<List<Integer>>();
            var partitionCuts = new ArrayList<CutIdentity>();
            for (int i = 0; i < circuit.size(); i++) {
                if (!(circuit.get(i).operation() instanceof QpdGate marker)) {
                    continue;
                }
                switch (marker.kind()) {
                    case TWO_PARTY -> throw new IllegalArgumentException(
                    String.format("Two-party QPD gate at instruction %d of partition %s; separated partitions may "
                                  + "only hold one-party QPD gates", i, label));
                    case ONE_PARTY -> {
                        var id = marker.cutIdentity()
                                       .orElseThrow(() -> new MalformedCutIdentityException(marker.label().orElse(null)));
                        basesById.put(id, marker.basis());
                        partitionGates.add(List.of(i));
                        partitionCuts.add(id);
                    }
                }
            }
            gateIds.put(label, partitionGates);
            cutIds.put(label, partitionCuts);
        });

        var identities = new ArrayList<>(basesById.keySet());
        var rank = new HashMap<CutIdentity, Integer>();
        for (int k = 0; k < identities.size(); k++) {
            rank.put(identities.get(k), k);
        }
        var mapIds = new LinkedHashMap<String, List<Integer>>();
        cutIds.forEach((label, ids) -> mapIds.put(label, ids.stream().map(rank::get).toList()));

        return new PartitionedCuts(identities, new ArrayList<>(basesById.values()), gateIds, mapIds);
    }
}
