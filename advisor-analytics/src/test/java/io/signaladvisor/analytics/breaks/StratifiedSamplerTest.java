package io.signaladvisor.analytics.breaks;

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

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StratifiedSampler}.
 */
@Tag("unit")
public class StratifiedSamplerTest {

    @Test
    void strataScaleWithInputUpToLimit() {
        assertEquals(1, StratifiedSampler.strataCount(50));
        assertEquals(10, StratifiedSampler.strataCount(1_000));
        assertEquals(100, StratifiedSampler.strataCount(20_000));
        assertEquals(100, StratifiedSampler.strataCount(1_000_000));
    }

    @Test
    void reducesToAboutRequestedSize() {
        double[] data = uniform(20_000, 5L);

        double[] sample = StratifiedSampler.sample(data, 10_000, 42L);

        assertTrue(sample.length > 9_800 && sample.length < 10_200, "unexpected sample size " + sample.length);
    }

    @Test
    void drawsOnlyInputValues() {
        double[] data = uniform(5_000, 9L);
        double[] sorted = data.clone();
        Arrays.sort(sorted);

        for (double v : StratifiedSampler.sample(data, 1_000, 42L)) {
            assertTrue(Arrays.binarySearch(sorted, v) >= 0, "sampled value not in input: " + v);
        }
    }

    @Test
    void keepsMaximum() {
        double[] data = uniform(5_000, 13L);
        double max = Arrays.stream(data).max().orElseThrow();

        double[] sample = StratifiedSampler.sample(data, 500, 42L);

        assertTrue(Arrays.stream(sample).anyMatch(v -> v == max), "the maximum sits in its own stratum");
    }

    @Test
    void largeTargetKeepsEverything() {
        double[] data = uniform(800, 21L);

        double[] sample = StratifiedSampler.sample(data, 10_000, 42L);

        double[] expected = data.clone();
        Arrays.sort(expected);
        Arrays.sort(sample);
        assertArrayEquals(expected, sample);
    }

    @Test
    void seedControlsDraw() {
        double[] data = uniform(20_000, 5L);

        assertArrayEquals(StratifiedSampler.sample(data, 1_000, 42L), StratifiedSampler.sample(data, 1_000, 42L));
        assertFalse(Arrays.equals(StratifiedSampler.sample(data, 1_000, 42L), StratifiedSampler.sample(data, 1_000, 7L)));
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> StratifiedSampler.sample(new double[0], 10, 42L));
    }

    private static double[] uniform(int n, long seed) {
        Well19937c random = new Well19937c(seed);
        double[] data = new double[n];
        for (int i = 0; i < n; i++) {
            data[i] = 100.0 * random.nextDouble();
        }
        return data;
    }
}
