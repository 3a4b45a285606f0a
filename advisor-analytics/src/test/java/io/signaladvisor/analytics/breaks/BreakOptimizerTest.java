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

import io.signaladvisor.analytics.model.BreakSet;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link BreakOptimizer}.
 *
 * <p>This test class verifies:
 * <ol>
 *   <li>The low-diversity bypass and the strict search preconditions</li>
 *   <li>Boundaries between well-separated modes</li>
 *   <li>Knee and BIC selection of the class count</li>
 *   <li>Stratified reduction of large inputs and repeatability</li>
 * </ol>
 */
@Tag("unit")
public class BreakOptimizerTest {

    // ==================== Bypass and Precondition Tests ====================

    @Test
    void fewDistinctValuesGiveEmptyBreaks() {
        double[] data = {1, 1, 2, 3, 4, 5, 5, 5, 2, 3, 4, 1};
        BreakOptimizer optimizer = new BreakOptimizer();

        BreakSet first = optimizer.call(data);
        BreakSet second = optimizer.call(data);

        assertTrue(first.isEmpty());
        assertEquals(first, second);
    }

    @Test
    void searchRequiresMoreValuesThanClasses() {
        double[] ten = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

        assertThrows(IllegalArgumentException.class, () -> new BreakOptimizer().findOptimal(ten));
    }

    @Test
    void shortDiverseInputIsRejected() {
        // 8 distinct values cap the search at 8 classes, which needs more than 8 values
        double[] eight = {3, 1, 4, 15, 9, 2, 6, 5};

        assertThrows(IllegalArgumentException.class, () -> new BreakOptimizer().call(eight));
    }

    @Test
    void searchRequiresAtLeastTwoClasses() {
        double[] data = bimodal(100, 3L);
        BreakSearchParams params = BreakSearchParams.defaults().withMaxClasses(1);

        assertThrows(IllegalArgumentException.class, () -> new BreakOptimizer().findOptimal(data, params));
    }

    @Test
    void rejectsNonFiniteValues() {
        double[] data = bimodal(100, 3L);
        data[17] = Double.NaN;

        assertThrows(IllegalArgumentException.class, () -> new BreakOptimizer().call(data));
    }

    // ==================== Search Tests ====================

    @Test
    void separatesBimodalDistribution() {
        double[] data = bimodal(1000, 42L);

        BreakSet breaks = new BreakOptimizer().call(data);

        assertFalse(breaks.isEmpty());
        assertTrue(breaks.boundaries().stream().anyMatch(b -> b > 0.0 && b < 10.0),
            "expected a boundary between the modes, got " + breaks);
    }

    @Test
    void resultCarriesDiagnosticsForEveryCandidate() {
        double[] data = bimodal(1000, 42L);

        BreakSearchResult result = new BreakOptimizer().findOptimal(data);

        assertArrayEquals(new int[]{2, 3, 4, 5, 6, 7, 8, 9, 10}, result.kValues());
        assertEquals(9, result.gvf().length);
        assertEquals(9, result.breaks().size());
        for (double gvf : result.gvf()) {
            assertTrue(gvf >= 0.0 && gvf <= 1.0, "GVF out of range: " + gvf);
        }
        assertTrue(result.bestK() >= 2 && result.bestK() <= 10);
        assertEquals(2000, result.sampleCount());

        double[] full = result.breaksFor(result.bestK());
        assertEquals(result.bestK() + 1, full.length);
        assertEquals(Arrays.stream(data).min().orElseThrow(), full[0]);
        assertEquals(Arrays.stream(data).max().orElseThrow(), full[full.length - 1]);
        assertEquals(result.bestK() - 1, result.breakSet().size());
    }

    @Test
    void bicSelectionPicksSmallestCriterion() {
        double[] data = bimodal(500, 8L);
        BreakSearchParams params = BreakSearchParams.defaults().withSelection(KSelection.BIC);

        BreakSearchResult result = new BreakOptimizer(params).findOptimal(data);

        int argmin = 0;
        for (int i = 1; i < result.bic().length; i++) {
            if (result.bic()[i] < result.bic()[argmin]) {
                argmin = i;
            }
        }
        assertEquals(result.kValues()[argmin], result.bestK());
    }

    @Test
    void largeInputIsSampled() {
        double[] data = bimodal(10_000, 99L);

        BreakSearchResult result = new BreakOptimizer(BreakSearchParams.defaults().withMaxClasses(4)).findOptimal(data);

        assertTrue(result.sampleCount() < data.length, "expected sampling, got " + result.sampleCount());
        assertTrue(result.breakSet().boundaries().stream().anyMatch(b -> b > 0.0 && b < 10.0));
    }

    @Test
    void repeatedCallsAreIdentical() {
        double[] data = bimodal(3_000, 5L);
        BreakOptimizer optimizer = new BreakOptimizer();

        BreakSearchResult first = optimizer.findOptimal(data);
        BreakSearchResult second = optimizer.findOptimal(data);

        assertEquals(first.bestK(), second.bestK());
        assertArrayEquals(first.gvf(), second.gvf());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(optimizer.call(data), optimizer.call(data));
    }

    @Test
    void resultCannotBeChangedThroughItsArrays() {
        double[] data = bimodal(500, 13L);
        BreakSearchResult result = new BreakOptimizer().findOptimal(data);
        double bestGvf = result.bestGvf();
        double[] bestBreaks = result.breaksFor(result.bestK());

        Arrays.fill(result.gvf(), -1.0);
        result.kValues()[0] = 99;
        result.breaks().get(result.bestK() - 2)[1] = Double.NaN;

        assertEquals(bestGvf, result.bestGvf());
        assertEquals(2, result.kValues()[0]);
        assertArrayEquals(bestBreaks, result.breaksFor(result.bestK()));
    }

    @Test
    void inputIsNotModified() {
        double[] data = bimodal(300, 2L);
        double[] copy = data.clone();

        new BreakOptimizer().call(data);

        assertArrayEquals(copy, data);
    }

    @Test
    void valuesOnBoundaryJoinUpperClass() {
        double[] sorted = {1, 2, 3, 10, 11, 12};

        // classes {1, 2} and {3, 10, 11, 12}
        assertEquals(50.5, BreakOptimizer.withinClassSumOfSquares(sorted, new double[]{3}, 2), 1e-12);
    }

    /// `n` draws each of N(0, 1) and N(10, 1).
    static double[] bimodal(int n, long seed) {
        NormalDistribution low = new NormalDistribution(new Well19937c(seed), 0.0, 1.0);
        NormalDistribution high = new NormalDistribution(new Well19937c(seed + 1), 10.0, 1.0);
        double[] data = new double[2 * n];
        System.arraycopy(low.sample(n), 0, data, 0, n);
        System.arraycopy(high.sample(n), 0, data, n, n);
        return data;
    }
}
