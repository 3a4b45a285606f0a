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

import io.signaladvisor.analytics.AnalysisTool;
import io.signaladvisor.analytics.Samples;
import io.signaladvisor.analytics.ToolName;
import io.signaladvisor.analytics.model.BreakSet;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/// Recommends partition points for a continuous variable: the number of classes
/// that best explains its distribution and the natural-break boundaries for it.
///
/// ## Search
///
/// For each candidate `k` in `2..maxClasses`:
///
/// | Diagnostic | Formula |
/// |------------|---------|
/// | GVF | `(SST - SSW) / SST` |
/// | pseudo-F | `((SST - SSW) / (k - 1)) / (SSW / (n - k))` |
/// | BIC | `n · ln(SSW / n) + k · ln(n)` |
///
/// `SSW` is the within-class sum of squares after assigning every value to the
/// class whose lower interior boundary it reaches (values equal to a boundary
/// go to the upper class). The best `k` is the knee of the concave, increasing
/// GVF curve ([KneeLocator]), or the largest `k` when the curve has no knee; in
/// [KSelection#BIC] mode it is the `k` with the smallest BIC.
///
/// Inputs longer than the sample size are first reduced by [StratifiedSampler].
///
/// ## Entry Points
///
/// - [#call(double[])] returns only the interior boundaries, and an empty set for
///   inputs with at most [#MIN_DISTINCT_VALUES] distinct values.
/// - [#findOptimal(double[], BreakSearchParams)] returns every diagnostic and
///   enforces its preconditions strictly.
@ToolName("jenks-breaks")
public final class BreakOptimizer implements AnalysisTool<double[], BreakSet> {

    private static final Logger logger = LogManager.getLogger(BreakOptimizer.class);

    public static final String NAME = "jenks-breaks";

    /// Inputs with this many distinct values or fewer are not partitioned
    public static final int MIN_DISTINCT_VALUES = 5;

    private final BreakSearchParams params;

    /// Creates an optimizer with [BreakSearchParams#defaults()].
    public BreakOptimizer() {
        this(BreakSearchParams.defaults());
    }

    /// @param params the search parameters; `maxClasses` is the ceiling used by [#call(double[])]
    public BreakOptimizer(BreakSearchParams params) {
        this.params = Objects.requireNonNull(params, "params cannot be null");
    }

    @Override
    public String getToolName() {
        return NAME;
    }

    /// @return the parameters of this optimizer
    public BreakSearchParams params() {
        return params;
    }

    /// Recommends class boundaries for the data.
    ///
    /// @param data the values; all finite
    /// @return ascending interior boundaries, empty when the data has too little diversity
    @Override
    public BreakSet call(double[] data) {
        Samples.requireFinite(data);
        int distinct = Samples.distinctCount(data);
        if (distinct <= MIN_DISTINCT_VALUES) {
            logger.debug("only {} distinct values, not partitioning", distinct);
            return BreakSet.empty();
        }
        int maxClasses = Math.min(params.maxClasses(), distinct);
        return findOptimal(data, params.withMaxClasses(maxClasses)).breakSet();
    }

    /// Searches the best class count with this optimizer's parameters.
    ///
    /// @param data the values; all finite
    /// @return the full search result
    public BreakSearchResult findOptimal(double[] data) {
        return findOptimal(data, params);
    }

    /// Searches the best class count.
    ///
    /// @param data the values; all finite, more of them than `maxClasses`
    /// @param searchParams the search parameters
    /// @return the full search result
    /// @throws IllegalArgumentException if `maxClasses < 2` or the data has no more
    ///         values than `maxClasses`
    public BreakSearchResult findOptimal(double[] data, BreakSearchParams searchParams) {
        Samples.requireFinite(data);
        int maxK = searchParams.maxClasses();
        if (maxK < 2) {
            throw new IllegalArgumentException("maxClasses must be at least 2, got " + maxK);
        }
        if (data.length <= maxK) {
            throw new IllegalArgumentException(
                "need more than " + maxK + " values to search up to " + maxK + " classes, got " + data.length);
        }

        double[] sample;
        if (data.length > searchParams.sampleSize()) {
            sample = StratifiedSampler.sample(data, searchParams.sampleSize(), searchParams.seed());
            logger.info("reduced {} values to a stratified sample of {}", data.length, sample.length);
        } else {
            sample = data.clone();
        }
        Arrays.sort(sample);

        int n = sample.length;
        double mean = StatUtils.mean(sample);
        double sst = 0.0;
        for (double v : sample) {
            sst += (v - mean) * (v - mean);
        }

        JenksNaturalBreaks jenks = new JenksNaturalBreaks(sample, maxK);
        int candidates = maxK - 1;
        int[] kValues = new int[candidates];
        double[] gvf = new double[candidates];
        double[] fStat = new double[candidates];
        double[] bic = new double[candidates];
        List<double[]> breaks = new ArrayList<>(candidates);

        for (int c = 0; c < candidates; c++) {
            int k = c + 2;
            double[] kBreaks = jenks.breaks(k);
            double ssw = withinClassSumOfSquares(sample, Arrays.copyOfRange(kBreaks, 1, k), k);

            kValues[c] = k;
            breaks.add(kBreaks);
            gvf[c] = (sst - ssw) / sst;
            fStat[c] = ((sst - ssw) / (k - 1)) / (ssw / (n - k));
            bic[c] = n * Math.log(ssw / n) + k * Math.log(n);
        }

        int bestK = selectK(kValues, gvf, bic, searchParams);
        BreakSearchResult result = new BreakSearchResult(bestK, kValues, gvf, fStat, bic, breaks, n);
        logger.info("selected k={} by {} over k=2..{}", bestK, searchParams.selection(), maxK);
        logger.debug("{}", result);
        return result;
    }

    private static int selectK(int[] kValues, double[] gvf, double[] bic, BreakSearchParams searchParams) {
        if (searchParams.selection() == KSelection.BIC) {
            int best = 0;
            for (int i = 1; i < bic.length; i++) {
                if (bic[i] < bic[best]) {
                    best = i;
                }
            }
            return kValues[best];
        }

        double[] x = new double[kValues.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = kValues[i];
        }
        OptionalDouble knee = new KneeLocator(x, gvf, KneeLocator.Curve.CONCAVE, KneeLocator.Direction.INCREASING,
            searchParams.kneeSensitivity()).knee();
        if (knee.isEmpty()) {
            logger.debug("no knee in the GVF curve, falling back to k={}", kValues[kValues.length - 1]);
            return kValues[kValues.length - 1];
        }
        return (int) knee.getAsDouble();
    }

    /// Sum of squared deviations from each class mean, classes formed by the
    /// interior boundaries over sorted values.
    static double withinClassSumOfSquares(double[] sorted, double[] interior, int k) {
        double[] sums = new double[k];
        int[] counts = new int[k];
        int[] classOf = new int[sorted.length];
        for (int i = 0; i < sorted.length; i++) {
            int cls = classIndex(interior, sorted[i]);
            classOf[i] = cls;
            sums[cls] += sorted[i];
            counts[cls]++;
        }
        double ssw = 0.0;
        for (int i = 0; i < sorted.length; i++) {
            int cls = classOf[i];
            double d = sorted[i] - sums[cls] / counts[cls];
            ssw += d * d;
        }
        return ssw;
    }

    /// Number of boundaries at or below `v`.
    private static int classIndex(double[] interior, double v) {
        int cls = 0;
        while (cls < interior.length && interior[cls] <= v) {
            cls++;
        }
        return cls;
    }
}
