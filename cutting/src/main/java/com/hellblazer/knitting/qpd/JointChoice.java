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

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One term index per cut, in canonical cut order. Immutable.
 *
 * @author hal.hildebrand
 */
public final class JointChoice {

    private static final JointChoice EMPTY = new JointChoice(new int[0]);

    private final int[] mapIds;

    private JointChoice(int[] mapIds) {
        this.mapIds = mapIds;
    }

    public static JointChoice of(int... mapIds) {
        if (mapIds.length == 0) {
            return EMPTY;
        }
        for (int i = 0; i < mapIds.length; i++) {
            if (mapIds[i] < 0) {
                throw new IllegalArgumentException(
                String.format("Term index cannot be negative: %d at position %d", mapIds[i], i));
            }
        }
        return new JointChoice(mapIds.clone());
    }

    public static JointChoice empty() {
        return EMPTY;
    }

    public int size() {
        return mapIds.length;
    }

    public boolean isEmpty() {
        return mapIds.length == 0;
    }

    public int get(int position) {
        if (position < 0 || position >= mapIds.length) {
            throw new IndexOutOfBoundsException(
            String.format("Position %d out of range [0, %d)", position, mapIds.length));
        }
        return mapIds[position];
    }

    /**
     * Selects the term indices at the given positions, in the order given.
     */
    public JointChoice restrict(List<Integer> positions) {
        var restricted = new int[positions.size()];
        for (int i = 0; i < restricted.length; i++) {
            restricted[i] = get(positions.get(i));
        }
        return of(restricted);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return Arrays.equals(mapIds, ((JointChoice) obj).mapIds);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(mapIds);
    }

    @Override
    public String toString() {
        return Arrays.stream(mapIds).mapToObj(Integer::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
