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

/// A recommended training window, as a pair of timestamps in seconds.
///
/// A window that opens on the final sample of a series collapses to a single
/// instant, so `start == end` is allowed.
///
/// @param start first timestamp of the window
/// @param end last timestamp of the window
public record Segment(double start, double end) {

    public Segment {
        if (!(start <= end)) {
            throw new IllegalArgumentException("segment start " + start + " is after end " + end);
        }
    }

    /// @return the window length in seconds
    public double duration() {
        return end - start;
    }

    /// @param t a timestamp
    /// @return true if `t` lies inside the window, bounds included
    public boolean contains(double t) {
        return t >= start && t <= end;
    }
}
