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
package com.hellblazer.knitting.exceptions;

/**
 * Thrown when a one-party cut marker carries no cut identity, so it cannot be associated with the other markers
 * belonging to the same cut.
 */
public final class MalformedCutIdentityException extends CuttingException {

    public static final String REMEDIATION =
    "One-party QPD gates in partitioned circuits must have their labels suffixed with \"_<id>\", where <id> is the "
    + "index of the cut relative to the other cuts in the circuit. For example, all one-party QPD gates belonging "
    + "to the same cut, N, should have labels formatted as \"<your_label>_N\". This allows one-party QPD gates "
    + "belonging to the same cut to be sampled jointly.";

    public MalformedCutIdentityException(String label) {
        super(String.format("Cannot determine cut identity of label '%s'. %s", label, REMEDIATION));
    }
}
