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

import com.hellblazer.knitting.qpd.CutIdentity;
import com.hellblazer.knitting.qpd.QpdBasis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cuts spread over separated partitions.
 *
 * @param identities the distinct cut identities, ascending; position k is the canonical position of that cut
 * @param bases      the basis of each identity, aligned with {@code identities}
 * @param gateIds    per partition, the instruction position of each of its markers
 * @param mapIds     per partition, the canonical position of each of its markers' cut, aligned with
 *                   {@code gateIds}
 * @author hal.hildebrand
 */
public record PartitionedCuts(List<CutIdentity> identities, List<QpdBasis> bases,
                              Map<String, List<List<Integer>>> gateIds, Map<String, List<Integer>> mapIds) {

    public PartitionedCuts {
        Objects.requireNonNull(identities, "identities cannot be null");
        Objects.requireNonNull(bases, "bases cannot be null");
        Objects.requireNonNull(gateIds, "gateIds cannot be null");
        Objects.requireNonNull(mapIds, "mapIds cannot be null");
        if (identities.size() != bases.size()) {
            throw new IllegalArgumentException(
            String.format("Identity count %d != basis count %d", identities.size(), bases.size()));
        }
        identities = List.copyOf(identities);
        bases = List.copyOf(bases);
        var gateCopy = new LinkedHashMap<String, List<List<Integer>>>();
        gateIds.forEach((label, ids) -> gateCopy.put(label, ids.stream().map(List::copyOf).toList()));
        gateIds = Collections.unmodifiableMap(gateCopy);
        mapIds = Collections.unmodifiableMap(new LinkedHashMap<>(mapIds));
    }

    public List<List<Integer>> gateIds(String label) {
        return gateIds.getOrDefault(label, List.of());
    }

    public List<Integer> mapIds(String label) {
        return mapIds.getOrDefault(label, List.of());
    }
}
