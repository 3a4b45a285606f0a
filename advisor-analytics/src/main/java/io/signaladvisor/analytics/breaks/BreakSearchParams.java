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

package io.signaladvisor.analytics.breaks;

import java.util.Objects;

/// Parameters of an optimal class-count search.
///
/// @param maxClasses largest class count evaluated; candidates are `2..maxClasses`
/// @param sampleSize inputs longer than this are reduced by stratified sampling
/// @param selection how the best class count is chosen
/// @param kneeSensitivity sensitivity `S` of the knee detector
/// @param seed seed for stratified sampling
public record BreakSearchParams(
    int maxClasses,
    int sampleSize,
    KSelection selection,
    double kneeSensitivity,
    long seed
) {

    public static final int DEFAULT_MAX_CLASSES = 10;
    public static final int DEFAULT_SAMPLE_SIZE = 10_000;
    public static final double DEFAULT_KNEE_SENSITIVITY = 2.0;
    public static final long DEFAULT_SEED = 42L;

    private static final BreakSearchParams DEFAULTS = new BreakSearchParams(
        DEFAULT_MAX_CLASSES, DEFAULT_SAMPLE_SIZE, KSelection.KNEE, DEFAULT_KNEE_SENSITIVITY, DEFAULT_SEED);

    public BreakSearchParams {
        Objects.requireNonNull(selection, "selection cannot be null");
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be positive, got " + sampleSize);
        }
        if (!(kneeSensitivity >= 0.0)) {
            throw new IllegalArgumentException("kneeSensitivity must be non-negative, got " + kneeSensitivity);
        }
    }

    /// @return `maxClasses=10, sampleSize=10000, selection=KNEE, kneeSensitivity=2, seed=42`
    public static BreakSearchParams defaults() {
        return DEFAULTS;
    }

    /// @param maxClasses the new ceiling
    /// @return a copy with a different class-count ceiling
    public BreakSearchParams withMaxClasses(int maxClasses) {
        return new BreakSearchParams(maxClasses, sampleSize, selection, kneeSensitivity, seed);
    }

    /// @param selection the new selection mode
    /// @return a copy with a different selection mode
    public BreakSearchParams withSelection(KSelection selection) {
        return new BreakSearchParams(maxClasses, sampleSize, selection, kneeSensitivity, seed);
    }
}
