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

import com.hellblazer.knitting.qpd.QpdBasis;

import java.util.List;
import java.util.Objects;

/**
 * Cuts of an unseparated circuit.
 *
 * @param bases   one basis per two-party marker, in circuit order
 * @param gateIds for each basis, the instruction position(s) of its marker
 * @author hal.hildebrand
 */
public record CollectedCuts(List<QpdBasis> bases, List<List<Integer>> gateIds) {

    public CollectedCuts {
        Objects.requireNonNull(bases, "bases cannot be null");
        Objects.requireNonNull(gateIds, "gateIds cannot be null");
        if (bases.size() != gateIds.size()) {
            throw new IllegalArgumentException(
            String.format("Basis count %d != gate id count %d", bases.size(), gateIds.size()));
        }
        bases = List.copyOf(bases);
        gateIds = gateIds.stream().map(List::copyOf).toList();
    }
}
