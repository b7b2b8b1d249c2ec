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
package com.hellblazer.knitting.observable;

import java.util.List;

/**
 * Partitions observables into groups measurable together.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ObservableGrouper {

    /**
     * @param observables observables of equal width
     * @return the groups, in a deterministic order
     */
    List<CommutingObservableGroup> group(List<PauliString> observables);
}
