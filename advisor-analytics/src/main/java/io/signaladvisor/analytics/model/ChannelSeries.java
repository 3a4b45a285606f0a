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

import java.util.Objects;

/// One sampled channel as delivered by a time-series fetch: ascending
/// timestamps in seconds and a same-length value array where `NaN` marks a
/// missing sample.
///
/// @param timestamps ascending sample times, in seconds
/// @param values sampled values, `NaN` for missing
public record ChannelSeries(double[] timestamps, double[] values) {

    public ChannelSeries {
        Objects.requireNonNull(timestamps, "timestamps cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException(
                "timestamps and values must have the same length, got " + timestamps.length + " and " + values.length);
        }
    }

    /// @return the number of samples
    public int length() {
        return timestamps.length;
    }
}
