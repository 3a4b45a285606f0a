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

import java.util.Arrays;
import java.util.Objects;

/// Per-timestep information density of a series; every entry is non-negative.
///
/// The scores are copied on the way in and on the way out, and equality
/// compares their contents.
///
/// @param values one entropy score per timestep, in bits
public record EntropyProfile(double[] values) {

    public EntropyProfile {
        Objects.requireNonNull(values, "values cannot be null");
        values = values.clone();
        for (int i = 0; i < values.length; i++) {
            if (!(values[i] >= 0.0)) {
                throw new IllegalArgumentException("entropy must be non-negative, found " + values[i] + " at index " + i);
            }
        }
    }

    /// @return a copy of the scores
    @Override
    public double[] values() {
        return values.clone();
    }

    /// @return the number of timesteps
    public int length() {
        return values.length;
    }

    /// @param i timestep index
    /// @return the entropy at `i`
    public double get(int i) {
        return values[i];
    }

    /// @return true if every entry is zero
    public boolean isAllZero() {
        for (double v : values) {
            if (v != 0.0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof EntropyProfile other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EntropyProfile[values=" + Arrays.toString(values) + "]";
    }
}
