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

package io.signaladvisor.analytics.range;

/// Parameters of a robust range estimate.
///
/// @param components number of mixture components
/// @param stdScale half-width of each component's interval, in standard deviations
/// @param weightThreshold components lighter than this are ignored
/// @param initializations number of mixture fits from different starting points
/// @param maxIterations maximum EM iterations per fit
/// @param seed seed of the mixture initializations
public record RangeParams(
    int components,
    double stdScale,
    double weightThreshold,
    int initializations,
    int maxIterations,
    long seed
) {

    public static final int DEFAULT_COMPONENTS = 3;
    public static final double DEFAULT_STD_SCALE = 3.0;
    public static final double DEFAULT_WEIGHT_THRESHOLD = 0.05;
    public static final int DEFAULT_INITIALIZATIONS = 10;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final long DEFAULT_SEED = 0L;

    private static final RangeParams DEFAULTS = new RangeParams(DEFAULT_COMPONENTS, DEFAULT_STD_SCALE,
        DEFAULT_WEIGHT_THRESHOLD, DEFAULT_INITIALIZATIONS, DEFAULT_MAX_ITERATIONS, DEFAULT_SEED);

    public RangeParams {
        if (components < 1) {
            throw new IllegalArgumentException("components must be at least 1, got " + components);
        }
        if (!(stdScale >= 0.0)) {
            throw new IllegalArgumentException("stdScale must be non-negative, got " + stdScale);
        }
        if (!(weightThreshold >= 0.0 && weightThreshold <= 1.0)) {
            throw new IllegalArgumentException("weightThreshold must be within [0, 1], got " + weightThreshold);
        }
        if (initializations < 1 || maxIterations < 1) {
            throw new IllegalArgumentException("initializations and maxIterations must be positive");
        }
    }

    /// @return `components=3, stdScale=3, weightThreshold=0.05, initializations=10, maxIterations=100, seed=0`
    public static RangeParams defaults() {
        return DEFAULTS;
    }

    /// @return a copy with the given range settings and the same fitting settings
    public RangeParams with(int components, double stdScale, double weightThreshold) {
        return new RangeParams(components, stdScale, weightThreshold, initializations, maxIterations, seed);
    }
}
