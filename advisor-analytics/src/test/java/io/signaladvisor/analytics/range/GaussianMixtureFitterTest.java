package io.signaladvisor.analytics.range;

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

import io.signaladvisor.analytics.AnalysisException;
import io.signaladvisor.analytics.range.GaussianMixtureFitter.MixtureFit;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GaussianMixtureFitter}.
 */
@Tag("unit")
public class GaussianMixtureFitterTest {

    private static final double MEAN_TOLERANCE = 0.3;
    private static final double WEIGHT_TOLERANCE = 0.05;

    @Test
    void recoversTwoSeparatedComponents() {
        double[] data = twoClusters(500, 0.0, 20.0, 17L);

        MixtureFit fit = new GaussianMixtureFitter(2, 5, 100, GaussianMixtureFitter.DEFAULT_TOLERANCE, 0L).fit(data);

        int lowIdx = fit.means()[0] < fit.means()[1] ? 0 : 1;
        int highIdx = 1 - lowIdx;
        assertEquals(0.0, fit.means()[lowIdx], MEAN_TOLERANCE);
        assertEquals(20.0, fit.means()[highIdx], MEAN_TOLERANCE);
        assertEquals(1.0, fit.stdDevs()[lowIdx], 0.2);
        assertEquals(0.5, fit.weights()[lowIdx], WEIGHT_TOLERANCE);
        assertTrue(fit.converged(), "well separated clusters should converge: " + fit);
    }

    @Test
    void weightsSumToOne() {
        double[] data = twoClusters(300, -5.0, 5.0, 3L);

        MixtureFit fit = new GaussianMixtureFitter(RangeParams.defaults()).fit(data);

        assertEquals(3, fit.numComponents());
        assertEquals(1.0, Arrays.stream(fit.weights()).sum(), 1e-9);
        for (double sd : fit.stdDevs()) {
            assertTrue(sd > 0.0);
        }
        assertTrue(Double.isFinite(fit.logLikelihood()));
    }

    @Test
    void sameSeedGivesSameFit() {
        double[] data = twoClusters(400, 1.0, 4.0, 23L);
        GaussianMixtureFitter fitter = new GaussianMixtureFitter(RangeParams.defaults());

        assertEquals(fitter.fit(data), fitter.fit(data));
    }

    @Test
    void rejectsTooFewValues() {
        GaussianMixtureFitter fitter = new GaussianMixtureFitter(RangeParams.defaults());

        assertThrows(IllegalArgumentException.class, () -> fitter.fit(new double[]{1.0, 2.0}));
    }

    @Test
    void overflowingSpreadFailsWithToolError() {
        // squared deviations of 1e200 overflow to infinity, so the variance does too
        double[] data = {-1e200, 0.0, 1e200};
        GaussianMixtureFitter fitter = new GaussianMixtureFitter(1, 1, 10, GaussianMixtureFitter.DEFAULT_TOLERANCE, 0L);

        AnalysisException error = assertThrows(AnalysisException.class, () -> fitter.fit(data));

        assertEquals(RangeEstimator.NAME, error.getToolName());
        assertTrue(error.getMessage().contains("log-likelihood became NaN"), error.getMessage());
    }

    static double[] twoClusters(int n, double meanA, double meanB, long seed) {
        double[] a = new NormalDistribution(new Well19937c(seed), meanA, 1.0).sample(n);
        double[] b = new NormalDistribution(new Well19937c(seed + 1), meanB, 1.0).sample(n);
        double[] data = new double[2 * n];
        System.arraycopy(a, 0, data, 0, n);
        System.arraycopy(b, 0, data, n, n);
        return data;
    }
}
