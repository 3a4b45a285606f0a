/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.signaladvisor.analytics.model;

import java.util.List;
import java.util.Objects;

/// Interior class boundaries of a 1-D distribution, ascending.
///
/// `k` classes are separated by `k - 1` boundaries. The empty set means the
/// distribution was not partitioned.
///
/// @param boundaries ascending boundary values
public record BreakSet(List<Double> boundaries) {

    private static final BreakSet EMPTY = new BreakSet(List.of());

    public BreakSet {
        Objects.requireNonNull(boundaries, "boundaries cannot be null");
        boundaries = List.copyOf(boundaries);
        for (int i = 1; i < boundaries.size(); i++) {
            if (boundaries.get(i) < boundaries.get(i - 1)) {
                throw new IllegalArgumentException("boundaries must be ascending: " + boundaries);
            }
        }
    }

    /// @return the empty break set
    public static BreakSet empty() {
        return EMPTY;
    }

    /// @param boundaries ascending boundary values
    /// @return a break set over the given values
    public static BreakSet of(double... boundaries) {
        Double[] boxed = new Double[boundaries.length];
        for (int i = 0; i < boundaries.length; i++) {
            boxed[i] = boundaries[i];
        }
        return new BreakSet(List.of(boxed));
    }

    /// @return true if there are no boundaries
    public boolean isEmpty() {
        return boundaries.isEmpty();
    }

    /// @return the number of boundaries
    public int size() {
        return boundaries.size();
    }

    /// @return the number of classes the boundaries define, 0 when empty
    public int classCount() {
        return boundaries.isEmpty() ? 0 : boundaries.size() + 1;
    }

    /// @return the boundaries as a primitive array
    public double[] toArray() {
        double[] result = new double[boundaries.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = boundaries.get(i);
        }
        return result;
    }
}
