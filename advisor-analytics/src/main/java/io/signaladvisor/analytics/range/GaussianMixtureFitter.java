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

import io.signaladvisor.analytics.AnalysisException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Expectation-Maximization fit of a one-dimensional Gaussian mixture.
///
/// ## Algorithm
///
/// Each of the `initializations` runs starts from a k-means partition of the
/// data (k-means++ seeding drawn from one seeded generator), then iterates:
///
/// 1. **E-step**: log-responsibilities, in the log domain for stability:
///    ```
///    log r_{ik} = log w_k + log N(x_i | μ_k, σ_k²) - logsumexp_j(...)
///    ```
/// 2. **M-step**:
///    ```
///    N_k  = Σ_i r_{ik} + 10·ε
///    μ_k  = (1/N_k) Σ_i r_{ik} x_i
///    σ_k² = (1/N_k) Σ_i r_{ik} (x_i - μ_k)² + reg
///    w_k  = N_k / n
///    ```
///
/// A run converges when the mean per-sample log-likelihood changes by less than
/// [#DEFAULT_TOLERANCE]. The run with the highest final log-likelihood wins;
/// ties keep the earlier run.
///
/// ## Failures
///
/// A non-finite log-likelihood raises [AnalysisException]. Runs that hit the
/// iteration cap without converging are kept and reported through
/// [MixtureFit#converged()].
///
/// ## Thread Safety
///
/// Instances are immutable; each [#fit(double[])] call owns its working state.
public final class GaussianMixtureFitter {

    private static final Logger logger = LogManager.getLogger(GaussianMixtureFitter.class);

    /// Convergence threshold on the mean per-sample log-likelihood
    public static final double DEFAULT_TOLERANCE = 1e-3;

    /// Added to every component variance
    public static final double VARIANCE_REGULARIZATION = 1e-6;

    private static final double COUNT_EPSILON = 10 * Math.ulp(1.0);
    private static final double LOG_SQRT_2PI = 0.5 * Math.log(2 * Math.PI);
    private static final int KMEANS_MAX_ITERATIONS = 300;

    private final int components;
    private final int initializations;
    private final int maxIterations;
    private final double tolerance;
    private final long seed;

    /// @param params the range parameters holding the fit settings
    public GaussianMixtureFitter(RangeParams params) {
        this(params.components(), params.initializations(), params.maxIterations(), DEFAULT_TOLERANCE, params.seed());
    }

    /// @param components number of mixture components
    /// @param initializations number of independent runs
    /// @param maxIterations maximum EM iterations per run
    /// @param tolerance convergence threshold on the mean log-likelihood
    /// @param seed seed of the k-means initializations
    public GaussianMixtureFitter(int components, int initializations, int maxIterations, double tolerance, long seed) {
        if (components < 1) {
            throw new IllegalArgumentException("components must be at least 1, got " + components);
        }
        this.components = components;
        this.initializations = initializations;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.seed = seed;
    }

    /// Fits the mixture.
    ///
    /// @param data the values; at least as many as there are components
    /// @return the best fit over all initializations
    /// @throws AnalysisException if the log-likelihood stops being finite, as it does
    ///     when squared deviations overflow a double
    public MixtureFit fit(double[] data) {
        if (data == null || data.length < components) {
            throw new IllegalArgumentException(
                "need at least " + components + " values to fit " + components + " components");
        }

        RandomGenerator random = new Well19937c(seed);
        MixtureFit best = null;
        for (int run = 0; run < initializations; run++) {
            MixtureFit candidate = runEm(data, initialLabels(data, random));
            logger.debug("mixture run {}: {}", run, candidate);
            if (best == null || candidate.logLikelihood() > best.logLikelihood()) {
                best = candidate;
            }
        }
        if (!best.converged()) {
            logger.warn("best mixture fit did not converge within {} iterations", maxIterations);
        }
        return best;
    }

    /// Hard k-means labels used to seed one EM run.
    private int[] initialLabels(double[] data, RandomGenerator random) {
        List<DoublePoint> points = new ArrayList<>(data.length);
        for (double v : data) {
            points.add(new DoublePoint(new double[]{v}));
        }
        KMeansPlusPlusClusterer<DoublePoint> kmeans = new KMeansPlusPlusClusterer<>(
            components, KMEANS_MAX_ITERATIONS, new EuclideanDistance(), random);
        List<CentroidCluster<DoublePoint>> clusters = kmeans.cluster(points);

        double[] centers = new double[clusters.size()];
        for (int k = 0; k < centers.length; k++) {
            centers[k] = clusters.get(k).getCenter().getPoint()[0];
        }
        int[] labels = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            int nearest = 0;
            for (int k = 1; k < centers.length; k++) {
                if (Math.abs(data[i] - centers[k]) < Math.abs(data[i] - centers[nearest])) {
                    nearest = k;
                }
            }
            labels[i] = nearest;
        }
        return labels;
    }

    private MixtureFit runEm(double[] data, int[] labels) {
        int n = data.length;
        double[][] resp = new double[n][components];
        for (int i = 0; i < n; i++) {
            resp[i][labels[i]] = 1.0;
        }

        double[] means = new double[components];
        double[] variances = new double[components];
        double[] weights = new double[components];
        mstep(data, resp, means, variances, weights);

        double logLikelihood = Double.NEGATIVE_INFINITY;
        boolean converged = false;
        int iteration;
        for (iteration = 1; iteration <= maxIterations; iteration++) {
            double previous = logLikelihood;
            logLikelihood = estep(data, means, variances, weights, resp);
            if (!Double.isFinite(logLikelihood)) {
                throw new AnalysisException(RangeEstimator.NAME,
                    "mixture log-likelihood became " + logLikelihood + " at iteration " + iteration);
            }
            mstep(data, resp, means, variances, weights);
            if (Math.abs(logLikelihood - previous) < tolerance) {
                converged = true;
                break;
            }
        }

        double[] stdDevs = new double[components];
        for (int k = 0; k < components; k++) {
            stdDevs[k] = Math.sqrt(variances[k]);
        }
        return new MixtureFit(means, stdDevs, weights, logLikelihood, Math.min(iteration, maxIterations), converged);
    }

    /// Fills `resp` and returns the mean per-sample log-likelihood.
    private double estep(double[] data, double[] means, double[] variances, double[] weights, double[][] resp) {
        double total = 0.0;
        double[] logWeighted = new double[components];
        for (int i = 0; i < data.length; i++) {
            double max = Double.NEGATIVE_INFINITY;
            for (int k = 0; k < components; k++) {
                double diff = data[i] - means[k];
                logWeighted[k] = Math.log(weights[k])
                    - LOG_SQRT_2PI - 0.5 * Math.log(variances[k]) - 0.5 * diff * diff / variances[k];
                max = Math.max(max, logWeighted[k]);
            }
            double sum = 0.0;
            for (int k = 0; k < components; k++) {
                sum += Math.exp(logWeighted[k] - max);
            }
            double logNorm = max + Math.log(sum);
            for (int k = 0; k < components; k++) {
                resp[i][k] = Math.exp(logWeighted[k] - logNorm);
            }
            total += logNorm;
        }
        return total / data.length;
    }

    private static void mstep(double[] data, double[][] resp, double[] means, double[] variances, double[] weights) {
        int n = data.length;
        int components = means.length;
        for (int k = 0; k < components; k++) {
            double nk = COUNT_EPSILON;
            double sum = 0.0;
            for (int i = 0; i < n; i++) {
                nk += resp[i][k];
                sum += resp[i][k] * data[i];
            }
            double mean = sum / nk;
            double sumSq = 0.0;
            for (int i = 0; i < n; i++) {
                double diff = data[i] - mean;
                sumSq += resp[i][k] * diff * diff;
            }
            means[k] = mean;
            variances[k] = sumSq / nk + VARIANCE_REGULARIZATION;
            weights[k] = nk / n;
        }
    }

    /// A fitted mixture.
    ///
    /// @param means component means
    /// @param stdDevs component standard deviations
    /// @param weights component weights
    /// @param logLikelihood final mean per-sample log-likelihood
    /// @param iterations EM iterations run
    /// @param converged whether the run converged before the iteration cap
    public record MixtureFit(
        double[] means,
        double[] stdDevs,
        double[] weights,
        double logLikelihood,
        int iterations,
        boolean converged
    ) {
        /// @return the number of components
        public int numComponents() {
            return means.length;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("MixtureFit[k=%d, LL=%.4f, iters=%d, converged=%s]",
                means.length, logLikelihood, iterations, converged));
            for (int k = 0; k < means.length; k++) {
                sb.append(String.format(" {mean=%.4f, std=%.4f, weight=%.3f}", means[k], stdDevs[k], weights[k]));
            }
            return sb.toString();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MixtureFit other)) return false;
            return Arrays.equals(means, other.means)
                && Arrays.equals(stdDevs, other.stdDevs)
                && Arrays.equals(weights, other.weights)
                && Double.compare(logLikelihood, other.logLikelihood) == 0
                && iterations == other.iterations
                && converged == other.converged;
        }

        @Override
        public int hashCode() {
            int result = Arrays.hashCode(means);
            result = 31 * result + Arrays.hashCode(stdDevs);
            result = 31 * result + Arrays.hashCode(weights);
            result = 31 * result + Double.hashCode(logLikelihood);
            return 31 * result + iterations;
        }
    }
}
