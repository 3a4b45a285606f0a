package io.signaladvisor.analytics;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Samples}.
 */
@Tag("unit")
public class SamplesTest {

    @Test
    void acceptsFiniteValues() {
        assertDoesNotThrow(() -> Samples.requireFinite(new double[]{-1e300, 0.0, 1e300}));
    }

    @Test
    void rejectsEmptyNullAndNonFinite() {
        assertThrows(IllegalArgumentException.class, () -> Samples.requireFinite(new double[0]));
        assertThrows(NullPointerException.class, () -> Samples.requireFinite(null));
        assertThrows(IllegalArgumentException.class, () -> Samples.requireFinite(new double[]{1, Double.NaN}));
        assertThrows(IllegalArgumentException.class,
            () -> Samples.requireFinite(new double[]{Double.NEGATIVE_INFINITY}));
    }

    @Test
    void countsDistinctValues() {
        assertEquals(3, Samples.distinctCount(new double[]{1, 2, 2, 3, 1}));
        assertEquals(1, Samples.distinctCount(new double[]{4, 4}));
    }

    @Test
    void signedZerosCountOnce() {
        assertEquals(2, Samples.distinctCount(new double[]{0.0, -0.0, 1.0}));
        assertEquals(1, Samples.distinctCount(new double[]{-0.0, -0.0, 0.0}));
    }
}
