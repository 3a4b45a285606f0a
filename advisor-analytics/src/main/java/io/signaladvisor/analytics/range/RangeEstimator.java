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

import io.signaladvisor.analytics.AnalysisTool;
import io.signaladvisor.analytics.Samples;
import io.signaladvisor.analytics.ToolName;
import io.signaladvisor.analytics.model.RangeBound;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Recommends a robust operating range `[lower, upper]` for one variable.
///
/// ## Algorithm
///
/// 1. **Discrete bypass**: with at most [#MAX_DISCRETE_VALUES] distinct values the
///    variable is treated as categorical and `[min, max]` is returned as is.
/// 2. **Mixture fit**: a [GaussianMixtureFitter] models the distribution.
/// 3. **Envelope**: components lighter than the weight threshold are dropped; the
///    rest contribute `[μ - s·σ, μ + s·σ]` and the envelope spans the lowest lower
///    and the highest upper bound. If every component was dropped the envelope is
///    the raw `[min, max]`.
/// 4. **Trim**: the result is the min and max of the original values that fall
///    inside the envelope, so it never extends past observed data. If no value
///    falls inside, the untrimmed `[min, max]` is returned.
///
/// ```text
///   data      ·  ·· ·········:::::::::::·········   ··        ·
///   envelope        [──────────────────────────────────]
///   result           [·····························  ··]
/// ```
@ToolName("normal-range")
public final class RangeEstimator implements AnalysisTool<double[], RangeBound> {

    private static final Logger logger = LogManager.getLogger(RangeEstimator.class);

    public static final String NAME = "normal-range";

    /// Inputs with this many distinct values or fewer bypass the mixture model
    public static final int MAX_DISCRETE_VALUES = 10;

    private final RangeParams params;

    /// Creates an estimator with [RangeParams#defaults()].
    public RangeEstimator() {
        this(RangeParams.defaults());
    }

    /// @param params the estimation parameters
    public RangeEstimator(RangeParams params) {
        this.params = Objects.requireNonNull(params, "params cannot be null");
    }

    @Override
    public String getToolName() {
        return NAME;
    }

    /// @return the parameters of this estimator
    public RangeParams params() {
        return params;
    }

    /// Estimates the range with this estimator's parameters.
    ///
    /// @param data the values; all finite
    /// @return the range, within `[min(data), max(data)]`
    @Override
    public RangeBound call(double[] data) {
        return estimate(data, params);
    }

    /// Estimates the range with explicit envelope settings.
    ///
    /// @param data the values; all finite
    /// @param components number of mixture components
    /// @param stdScale envelope half-width in standard deviations
    /// @param weightThreshold components lighter than this are ignored
    /// @return the range, within `[min(data), max(data)]`
    public RangeBound call(double[] data, int components, double stdScale, double weightThreshold) {
        return estimate(data, params.with(components, stdScale, weightThreshold));
    }

    /// Fits the mixture model alone, for inspection.
    ///
    /// @param data the values; all finite
    /// @return the fitted mixture
    public GaussianMixtureFitter.MixtureFit fitMixture(double[] data) {
        Samples.requireFinite(data);
        return new GaussianMixtureFitter(params).fit(data);
    }

    private RangeBound estimate(double[] data, RangeParams p) {
        Samples.requireFinite(data);
        double min = StatUtils.min(data);
        double max = StatUtils.max(data);

        int distinct = Samples.distinctCount(data);
        if (distinct <= MAX_DISCRETE_VALUES) {
            logger.debug("{} distinct values, treating as discrete", distinct);
            return new RangeBound(min, max);
        }

        GaussianMixtureFitter.MixtureFit fit = new GaussianMixtureFitter(p).fit(data);

        double lower = Double.POSITIVE_INFINITY;
        double upper = Double.NEGATIVE_INFINITY;
        int kept = 0;
        for (int k = 0; k < fit.numComponents(); k++) {
            if (fit.weights()[k] < p.weightThreshold()) {
                continue;
            }
            kept++;
            lower = Math.min(lower, fit.means()[k] - p.stdScale() * fit.stdDevs()[k]);
            upper = Math.max(upper, fit.means()[k] + p.stdScale() * fit.stdDevs()[k]);
        }
        if (kept == 0) {
            logger.warn("all {} mixture components weigh less than {}, using the raw range",
                fit.numComponents(), p.weightThreshold());
            lower = min;
            upper = max;
        }

        double trimmedMin = Double.POSITIVE_INFINITY;
        double trimmedMax = Double.NEGATIVE_INFINITY;
        for (double v : data) {
            if (v >= lower && v <= upper) {
                trimmedMin = Math.min(trimmedMin, v);
                trimmedMax = Math.max(trimmedMax, v);
            }
        }
        if (trimmedMin > trimmedMax) {
            logger.warn("no value inside the envelope [{}, {}], using the raw range", lower, upper);
            return new RangeBound(min, max);
        }
        logger.info("normal range [{}, {}] from {} of {} components over {} values",
            trimmedMin, trimmedMax, kept, fit.numComponents(), data.length);
        return new RangeBound(trimmedMin, trimmedMax);
    }
}
