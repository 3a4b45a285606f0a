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

import io.signaladvisor.analytics.model.EntropyProfile;
import io.signaladvisor.analytics.model.MultiChannelSeries;

import java.util.Arrays;

/// Scores every timestep of a multi-channel series by the information content
/// of the samples around it.
///
/// ## Algorithm
///
/// 1. **Normalize**: each channel is min-max scaled to `[0, 1]` with one fit over
///    the whole series. `NaN` is ignored by the fit and kept in the output; a
///    channel with zero range scales to 0.
/// 2. **Forward pass**: for each timestep `i ≥ 1` take the trailing window
///    `[max(0, i - window), i)`. Windows of fewer than 2 samples score 0. The
///    window's values are multiplied by decay weights
///    ```
///    w_d = exp(-λ · d / (window - 1))      d = distance from the newest sample
///    ```
///    and a [#HISTOGRAM_BINS]-bin Shannon entropy is taken per channel. The
///    channel entropies are summed.
/// 3. **Backward pass**: the same computation over the time-reversed channels,
///    reversed back into original order.
/// 4. **Combine**: the average of forward and backward scores.
/// 5. **Fill**: positions still at exactly 0 are replaced, in ascending order and
///    in place, by the mean score over `[max(0, i - window), min(n, i + window))`.
///
/// ```text
///   forward  :  ....[=====window=====)i
///   backward :                       i(=====window=====]....
/// ```
///
/// A position whose window holds a single distinct value, or only missing
/// values, scores 0; constant channels therefore contribute nothing.
///
/// ## Thread Safety
///
/// Instances are immutable and may be shared.
public final class EntropyProfiler {

    /// Histogram bins per channel window
    public static final int HISTOGRAM_BINS = 10;

    /// Default decay rate λ of the window weights
    public static final double DEFAULT_DECAY_RATE = 0.5;

    private final int window;
    private final double[] weights;

    /// @param window trailing window size, in samples
    public EntropyProfiler(int window) {
        this(window, DEFAULT_DECAY_RATE);
    }

    /// @param window trailing window size, in samples
    /// @param decayRate decay rate λ of the window weights
    public EntropyProfiler(int window, double decayRate) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1, got " + window);
        }
        this.window = window;
        this.weights = decayWeights(window, decayRate);
    }

    /// Computes the combined bidirectional entropy profile.
    ///
    /// @param series the input series
    /// @return one score per timestep
    public EntropyProfile profile(MultiChannelSeries series) {
        int n = series.length();
        int channels = series.channelCount();

        double[][] normalized = new double[channels][];
        double[][] reversed = new double[channels][];
        for (int c = 0; c < channels; c++) {
            normalized[c] = minMaxNormalize(series.channel(c));
            reversed[c] = reverse(normalized[c]);
        }

        double[] forward = directionalEntropy(normalized, n);
        double[] backward = reverse(directionalEntropy(reversed, n));

        double[] combined = new double[n];
        for (int i = 0; i < n; i++) {
            combined[i] = (forward[i] + backward[i]) / 2.0;
        }
        fillZeros(combined);
        return new EntropyProfile(combined);
    }

    /// @return the trailing window size
    public int window() {
        return window;
    }

    /// One-directional windowed entropy over channel-major normalized values.
    private double[] directionalEntropy(double[][] channels, int n) {
        double[] entropy = new double[n];
        double[] buffer = new double[window];

        for (int i = 1; i < n; i++) {
            int start = Math.max(0, i - window);
            int length = i - start;
            if (length < 2) {
                continue;
            }
            double sum = 0.0;
            for (double[] channel : channels) {
                for (int p = 0; p < length; p++) {
                    buffer[p] = channel[start + p] * weights[length - 1 - p];
                }
                sum += shannonEntropy(buffer, length, HISTOGRAM_BINS);
            }
            entropy[i] = sum;
        }
        return entropy;
    }

    /// Replaces exact zeros by their local mean, sequentially and in place.
    private void fillZeros(double[] combined) {
        int n = combined.length;
        for (int i = 0; i < n; i++) {
            if (combined[i] != 0.0) {
                continue;
            }
            int from = Math.max(0, i - window);
            int to = Math.min(n, i + window);
            double sum = 0.0;
            for (int j = from; j < to; j++) {
                sum += combined[j];
            }
            double localMean = sum / (to - from);
            combined[i] = Double.isNaN(localMean) ? 0.0 : localMean;
        }
    }

    /// `exp(-λ · linspace(0, 1, window))`
    static double[] decayWeights(int window, double decayRate) {
        double[] w = new double[window];
        for (int d = 0; d < window; d++) {
            double t = window == 1 ? 0.0 : (double) d / (window - 1);
            w[d] = Math.exp(-decayRate * t);
        }
        return w;
    }

    /// Scales values to `[0, 1]` by the global min and max, ignoring `NaN`.
    static double[] minMaxNormalize(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                if (v < min) min = v;
                if (v > max) max = v;
            }
        }
        double[] result = new double[values.length];
        if (min > max) {
            // all missing
            Arrays.fill(result, Double.NaN);
            return result;
        }
        double range = max - min;
        double scale = range == 0.0 ? 1.0 : 1.0 / range;
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - min) * scale;
        }
        return result;
    }

    /// Shannon entropy, in bits, of an equal-width histogram over the first
    /// `length` entries of `values`.
    ///
    /// The histogram spans the observed min and max of the non-missing entries.
    /// Fewer than two populated bins yields 0.
    ///
    /// @param values the samples; `NaN` entries are ignored
    /// @param length number of leading entries to use
    /// @param bins number of histogram bins
    /// @return the entropy, never negative
    static double shannonEntropy(double[] values, int length, int bins) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int total = 0;
        for (int i = 0; i < length; i++) {
            double v = values[i];
            if (!Double.isNaN(v)) {
                if (v < min) min = v;
                if (v > max) max = v;
                total++;
            }
        }
        if (total == 0 || min == max) {
            return 0.0;
        }

        double range = max - min;
        int[] counts = new int[bins];
        for (int i = 0; i < length; i++) {
            double v = values[i];
            if (Double.isNaN(v)) {
                continue;
            }
            counts[binIndex(v, min, range, bins)]++;
        }

        int populated = 0;
        for (int count : counts) {
            if (count > 0) populated++;
        }
        if (populated <= 1) {
            return 0.0;
        }

        double entropy = 0.0;
        for (int count : counts) {
            if (count > 0) {
                double p = (double) count / total;
                entropy -= p * (Math.log(p) / Math.log(2.0));
            }
        }
        return Math.max(0.0, entropy);
    }

    /// Bin of `v` in `bins` equal-width bins over `[min, min + range]`; the last
    /// bin is closed on the right.
    private static int binIndex(double v, double min, double range, int bins) {
        int index = (int) ((v - min) / range * bins);
        if (index >= bins) {
            return bins - 1;
        }
        // correct for rounding against the exact edges
        if (index > 0 && v < min + range * index / bins) {
            index--;
        } else if (index < bins - 1 && v >= min + range * (index + 1) / bins) {
            index++;
        }
        return index;
    }

    private static double[] reverse(double[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[values.length - 1 - i];
        }
        return result;
    }
}
