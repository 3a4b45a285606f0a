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

package io.signaladvisor.analytics.window;

/// Parameters of a training window search.
///
/// @param window trailing window size, in samples, for the entropy profile
/// @param startCount consecutive qualifying samples needed to open a window
/// @param stopCount consecutive disqualifying samples needed to close a window
/// @param nanThreshold timesteps whose missing-channel fraction exceeds this are skipped
/// @param seed seed for the density clustering
public record WindowSelectionParams(
    int window,
    int startCount,
    int stopCount,
    double nanThreshold,
    long seed
) {

    public static final int DEFAULT_WINDOW = 300;
    public static final int DEFAULT_START_COUNT = 3;
    public static final int DEFAULT_STOP_COUNT = 3;
    public static final double DEFAULT_NAN_THRESHOLD = 0.05;
    public static final long DEFAULT_SEED = 42L;

    private static final WindowSelectionParams DEFAULTS = new WindowSelectionParams(
        DEFAULT_WINDOW, DEFAULT_START_COUNT, DEFAULT_STOP_COUNT, DEFAULT_NAN_THRESHOLD, DEFAULT_SEED);

    public WindowSelectionParams {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1, got " + window);
        }
        if (startCount < 1) {
            throw new IllegalArgumentException("startCount must be at least 1, got " + startCount);
        }
        if (stopCount < 1) {
            throw new IllegalArgumentException("stopCount must be at least 1, got " + stopCount);
        }
        if (!(nanThreshold >= 0.0 && nanThreshold <= 1.0)) {
            throw new IllegalArgumentException("nanThreshold must be within [0, 1], got " + nanThreshold);
        }
    }

    /// @return `window=300, startCount=3, stopCount=3, nanThreshold=0.05, seed=42`
    public static WindowSelectionParams defaults() {
        return DEFAULTS;
    }

    /// @return a copy with the given hysteresis settings and the same seed
    public WindowSelectionParams with(int window, int startCount, int stopCount, double nanThreshold) {
        return new WindowSelectionParams(window, startCount, stopCount, nanThreshold, seed);
    }
}
