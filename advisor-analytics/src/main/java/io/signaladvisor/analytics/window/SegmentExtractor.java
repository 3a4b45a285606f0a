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

import io.signaladvisor.analytics.model.DensityLabels;
import io.signaladvisor.analytics.model.EntropyProfile;
import io.signaladvisor.analytics.model.MultiChannelSeries;
import io.signaladvisor.analytics.model.Segment;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Turns an entropy profile and its density labels into candidate training
/// windows with a two-threshold hysteresis state machine.
///
/// ## Thresholds
///
/// Computed from the scores of high-information positions only (population
/// standard deviation):
/// ```
/// t_high = mean + 0.5 · std
/// t_low  = mean - 1.5 · std
/// ```
///
/// ## State Machine
///
/// ```text
///            good streak reaches startCount
///   ┌─────┐ ─────────────────────────────────▶ ┌────┐
///   │ OUT │                                    │ IN │
///   └─────┘ ◀───────────────────────────────── └────┘
///            bad streak reaches stopCount
/// ```
///
/// - **OUT**: a sample is *good* when `score ≥ t_high` and it is labeled high.
///   Each good sample extends the good streak, anything else resets it. When the
///   streak reaches `startCount` the window opens at the first sample of the
///   streak, `i - startCount + 1`.
/// - **IN**: a sample is *bad* when `score ≤ t_low` or it is labeled low. When the
///   bad streak reaches `stopCount` the window closes at the first sample of the
///   bad streak, `i - stopCount + 1`.
///
/// Timesteps whose missing-channel fraction exceeds the NaN threshold are skipped:
/// they neither extend nor reset a streak. A window still open after the last
/// timestep ends at the last timestamp.
///
/// Windows come out in time order.
public final class SegmentExtractor {

    private static final Logger logger = LogManager.getLogger(SegmentExtractor.class);

    static final double HIGH_STD_FACTOR = 0.5;
    static final double LOW_STD_FACTOR = 1.5;

    private enum State { OUT, IN }

    /// Entry and exit thresholds of the state machine.
    ///
    /// @param high minimum score for a good sample
    /// @param low maximum score for a bad sample
    public record Thresholds(double high, double low) {
    }

    private final int startCount;
    private final int stopCount;
    private final double nanThreshold;

    /// @param startCount consecutive good samples that open a window
    /// @param stopCount consecutive bad samples that close a window
    /// @param nanThreshold missing fraction above which a timestep is skipped
    public SegmentExtractor(int startCount, int stopCount, double nanThreshold) {
        if (startCount < 1 || stopCount < 1) {
            throw new IllegalArgumentException(
                "startCount and stopCount must be at least 1, got " + startCount + " and " + stopCount);
        }
        this.startCount = startCount;
        this.stopCount = stopCount;
        this.nanThreshold = nanThreshold;
    }

    /// @param params the window selection parameters
    public SegmentExtractor(WindowSelectionParams params) {
        this(params.startCount(), params.stopCount(), params.nanThreshold());
    }

    /// Computes the hysteresis thresholds from the high-information scores.
    ///
    /// @param profile the entropy profile
    /// @param labels the density labels
    /// @return the thresholds, or empty if no position is labeled high
    public static Optional<Thresholds> thresholds(EntropyProfile profile, DensityLabels labels) {
        requireSameLength(profile, labels);
        double[] pool = new double[labels.highCount()];
        int p = 0;
        for (int i = 0; i < profile.length(); i++) {
            if (labels.isHigh(i)) {
                pool[p++] = profile.get(i);
            }
        }
        if (pool.length == 0) {
            return Optional.empty();
        }
        double mean = StatUtils.mean(pool);
        double std = new StandardDeviation(false).evaluate(pool);
        return Optional.of(new Thresholds(mean + HIGH_STD_FACTOR * std, mean - LOW_STD_FACTOR * std));
    }

    /// Extracts windows over a series.
    ///
    /// @param series the series the profile was computed from
    /// @param profile its entropy profile
    /// @param labels its density labels
    /// @return windows in time order, empty if nothing qualifies
    public List<Segment> extract(MultiChannelSeries series, EntropyProfile profile, DensityLabels labels) {
        double[] timestamps = new double[series.length()];
        for (int i = 0; i < timestamps.length; i++) {
            timestamps[i] = series.timestamp(i);
        }
        return extract(timestamps, profile, labels, series.missingFractions());
    }

    /// Extracts windows given the raw per-timestep inputs.
    ///
    /// @param timestamps the time axis, in seconds
    /// @param profile one score per timestep
    /// @param labels one label per timestep
    /// @param missingFractions fraction of missing channels per timestep
    /// @return windows in time order, empty if nothing qualifies
    public List<Segment> extract(double[] timestamps, EntropyProfile profile, DensityLabels labels,
                                 double[] missingFractions) {
        requireSameLength(profile, labels);
        if (timestamps.length != profile.length() || missingFractions.length != profile.length()) {
            throw new IllegalArgumentException(String.format(
                "timestamps (%d), missing fractions (%d) and profile (%d) must have the same length",
                timestamps.length, missingFractions.length, profile.length()));
        }

        Optional<Thresholds> found = thresholds(profile, labels);
        if (found.isEmpty()) {
            logger.warn("no high-information positions, no windows extracted");
            return List.of();
        }
        Thresholds t = found.get();
        logger.debug("hysteresis thresholds high={} low={}", t.high(), t.low());

        List<Segment> segments = new ArrayList<>();
        State state = State.OUT;
        int start = -1;
        int good = 0;
        int bad = 0;

        for (int i = 0; i < timestamps.length; i++) {
            if (missingFractions[i] > nanThreshold) {
                continue;
            }
            double score = profile.get(i);
            boolean high = labels.isHigh(i);

            if (state == State.OUT) {
                good = (score >= t.high() && high) ? good + 1 : 0;
                if (good >= startCount) {
                    start = i - startCount + 1;
                    state = State.IN;
                    bad = 0;
                }
            } else {
                bad = (score <= t.low() || !high) ? bad + 1 : 0;
                if (bad >= stopCount) {
                    segments.add(new Segment(timestamps[start], timestamps[i - stopCount + 1]));
                    state = State.OUT;
                    good = 0;
                }
            }
        }

        if (state == State.IN) {
            segments.add(new Segment(timestamps[start], timestamps[timestamps.length - 1]));
        }
        return segments;
    }

    private static void requireSameLength(EntropyProfile profile, DensityLabels labels) {
        if (profile.length() != labels.length()) {
            throw new IllegalArgumentException(
                "profile and labels differ in length: " + profile.length() + " vs " + labels.length());
        }
    }
}
