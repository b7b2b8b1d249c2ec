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

import com.hellblazer.knitting.exceptions.MalformedCutIdentityException;

import java.util.Optional;

/**
 * Identity shared by every marker, in any partition, belonging to the same cut.
 *
 * @param value the non-negative cut index
 * @author hal.hildebrand
 */
public record CutIdentity(int value) implements Comparable<CutIdentity> {

    public CutIdentity {
        if (value < 0) {
            throw new IllegalArgumentException("Cut identity cannot be negative: " + value);
        }
    }

    /**
     * Reads the identity from a label of the form {@code <free-text>_<id>}.
     *
     * @return the identity, or empty if the label has no non-negative integer suffix
     */
    public static Optional<CutIdentity> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        var suffix = label.substring(label.lastIndexOf('_') + 1);
        try {
            var value = Integer.parseInt(suffix);
            return value < 0 ? Optional.empty() : Optional.of(new CutIdentity(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Reads the identity from a label of the form {@code <free-text>_<id>}.
     *
     * @throws MalformedCutIdentityException if the label carries no identity suffix
     */
    public static CutIdentity parse(String label) {
        return fromLabel(label).orElseThrow(() -> new MalformedCutIdentityException(label));
    }

    @Override
    public int compareTo(CutIdentity other) {
        return Integer.compare(value, other.value);
    }
}
