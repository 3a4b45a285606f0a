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

import io.signaladvisor.analytics.AnalysisTool;
import io.signaladvisor.analytics.ToolName;
import io.signaladvisor.analytics.model.ChannelSeries;
import io.signaladvisor.analytics.model.DensityLabels;
import io.signaladvisor.analytics.model.EntropyProfile;
import io.signaladvisor.analytics.model.MultiChannelSeries;
import io.signaladvisor.analytics.model.Segment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Recommends time windows of a multi-channel signal that carry enough
/// information to train a model on.
///
/// ## Pipeline
///
/// ```text
/// Map<String, ChannelSeries>
///        │  align on the first channel's timestamps
///        ▼
/// MultiChannelSeries ──▶ EntropyProfiler ──▶ DensityClassifier ──▶ SegmentExtractor
///                          (profile)            (labels)              List<Segment>
/// ```
///
/// ## Usage
///
/// ```java
/// Map<String, ChannelSeries> data = new LinkedHashMap<>();
/// data.put("flow", new ChannelSeries(ts, flow));
/// data.put("pressure", new ChannelSeries(ts, pressure));
///
/// List<Segment> windows = new TrainingWindowSelector().call(data, 300, 3, 3, 0.05);
/// ```
///
/// Exceptions raised by any step propagate unchanged; nothing is retried and no
/// partial result is returned.
@ToolName("training-window")
public final class TrainingWindowSelector implements AnalysisTool<Map<String, ChannelSeries>, List<Segment>> {

    private static final Logger logger = LogManager.getLogger(TrainingWindowSelector.class);

    public static final String NAME = "training-window";

    private final WindowSelectionParams params;

    /// Entropy profile and labels of one series, for charting the score.
    ///
    /// @param profile the combined entropy profile
    /// @param labels the density labels of the profile
    public record InformationProfile(EntropyProfile profile, DensityLabels labels) {
    }

    /// Creates a selector with [WindowSelectionParams#defaults()].
    public TrainingWindowSelector() {
        this(WindowSelectionParams.defaults());
    }

    /// @param params the selection parameters
    public TrainingWindowSelector(WindowSelectionParams params) {
        this.params = Objects.requireNonNull(params, "params cannot be null");
    }

    @Override
    public String getToolName() {
        return NAME;
    }

    /// @return the parameters used by [#call(Map)]
    public WindowSelectionParams params() {
        return params;
    }

    /// Recommends windows with this selector's parameters.
    ///
    /// @param data channel id → samples; at least one channel
    /// @return windows in time order
    @Override
    public List<Segment> call(Map<String, ChannelSeries> data) {
        return select(MultiChannelSeries.of(data), params);
    }

    /// Recommends windows with explicit hysteresis settings.
    ///
    /// @param data channel id → samples; at least one channel
    /// @param window trailing window size for the entropy profile
    /// @param startCount consecutive good samples that open a window
    /// @param stopCount consecutive bad samples that close a window
    /// @param nanThreshold missing fraction above which a timestep is skipped
    /// @return windows in time order
    public List<Segment> call(Map<String, ChannelSeries> data, int window, int startCount, int stopCount,
                              double nanThreshold) {
        return select(MultiChannelSeries.of(data), params.with(window, startCount, stopCount, nanThreshold));
    }

    /// Recommends windows over an already aligned series.
    ///
    /// @param series the series
    /// @return windows in time order
    public List<Segment> select(MultiChannelSeries series) {
        return select(series, params);
    }

    /// Computes the entropy profile and labels without extracting windows.
    ///
    /// @param data channel id → samples; at least one channel
    /// @return the profile and its labels
    public InformationProfile profile(Map<String, ChannelSeries> data) {
        return profile(MultiChannelSeries.of(data), params);
    }

    private List<Segment> select(MultiChannelSeries series, WindowSelectionParams p) {
        InformationProfile info = profile(series, p);
        List<Segment> segments = new SegmentExtractor(p).extract(series, info.profile(), info.labels());
        logger.info("detected {} high-information windows in {} samples of {} channel(s)",
            segments.size(), series.length(), series.channelCount());
        return segments;
    }

    private static InformationProfile profile(MultiChannelSeries series, WindowSelectionParams p) {
        EntropyProfile profile = new EntropyProfiler(p.window()).profile(series);
        DensityLabels labels = new DensityClassifier(p.seed(), DensityClassifier.DEFAULT_MAX_ITERATIONS)
            .classify(profile);
        return new InformationProfile(profile, labels);
    }
}
