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

package io.signaladvisor.analytics;

import java.util.Arrays;
import java.util.Objects;

/// Checks and small reductions shared by the one-column tools.
public final class Samples {

    private Samples() {
        // Static utility class
    }

    /// Rejects null, empty and non-finite input.
    ///
    /// @param data the values to check
    /// @throws IllegalArgumentException if `data` is empty or holds `NaN` or an infinity
    public static void requireFinite(double[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        if (data.length == 0) {
            throw new IllegalArgumentException("data cannot be empty");
        }
        for (int i = 0; i < data.length; i++) {
            if (!Double.isFinite(data[i])) {
                throw new IllegalArgumentException("data must be finite, found " + data[i] + " at index " + i);
            }
        }
    }

    /// Counts distinct values, treating `-0.0` and `0.0` as one value.
    ///
    /// @param data the values
    /// @return the number of distinct values
    public static int distinctCount(double[] data) {
        return (int) Arrays.stream(data).map(v -> v == 0.0 ? 0.0 : v).distinct().count();
    }
}
