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

/// A `[lower, upper]` operating range.
///
/// @param lower lower bound, inclusive
/// @param upper upper bound, inclusive
public record RangeBound(double lower, double upper) {

    public RangeBound {
        if (!(lower <= upper)) {
            throw new IllegalArgumentException("lower bound " + lower + " exceeds upper bound " + upper);
        }
    }

    /// @return `{lower, upper}`
    public double[] toArray() {
        return new double[]{lower, upper};
    }

    /// @return `upper - lower`
    public double width() {
        return upper - lower;
    }

    /// @param value a value
    /// @return true if the value lies within the range, bounds included
    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
