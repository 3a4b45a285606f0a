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

/// One binary flag per timestep: 1 marks a high-information position, 0 a
/// low-information one.
///
/// @param labels the flags, each 0 or 1; copied on construction and access
public record DensityLabels(int[] labels) {

    public DensityLabels {
        Objects.requireNonNull(labels, "labels cannot be null");
        labels = labels.clone();
        for (int label : labels) {
            if (label != 0 && label != 1) {
                throw new IllegalArgumentException("labels must be 0 or 1, got " + label);
            }
        }
    }

    /// @param length number of timesteps
    /// @return labels that mark every position low-information
    public static DensityLabels allLow(int length) {
        return new DensityLabels(new int[length]);
    }

    /// @return a copy of the flags
    @Override
    public int[] labels() {
        return labels.clone();
    }

    /// @return the number of timesteps
    public int length() {
        return labels.length;
    }

    /// @param i timestep index
    /// @return true if position `i` is high-information
    public boolean isHigh(int i) {
        return labels[i] == 1;
    }

    /// @return the number of high-information positions
    public int highCount() {
        int count = 0;
        for (int label : labels) {
            count += label;
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DensityLabels other && Arrays.equals(labels, other.labels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(labels);
    }

    @Override
    public String toString() {
        return "DensityLabels[labels=" + Arrays.toString(labels) + "]";
    }
}
