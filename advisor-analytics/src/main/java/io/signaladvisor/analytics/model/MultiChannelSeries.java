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

package io.signaladvisor.analytics.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Several channels sampled on one shared timestamp axis.
///
/// ## Alignment
///
/// Channels are read positionally against the timestamp axis of the first
/// channel. [#of(Map)] enforces the part of that assumption that would otherwise
/// corrupt the computation silently:
///
/// - every channel must have exactly as many samples as the first one, else
///   [IllegalArgumentException];
/// - a channel whose own timestamps differ from the first channel's is accepted,
///   read on the first channel's axis, and reported with a `warn` log line.
///
/// ## Layout
///
/// Values are held channel-major: `values[channel][timestep]`. The arrays are
/// copied on construction and never exposed for writing.
public final class MultiChannelSeries {

    private static final Logger logger = LogManager.getLogger(MultiChannelSeries.class);

    private final double[] timestamps;
    private final double[][] values;
    private final List<String> channelNames;

    private MultiChannelSeries(double[] timestamps, double[][] values, List<String> channelNames) {
        this.timestamps = timestamps;
        this.values = values;
        this.channelNames = channelNames;
    }

    /// Builds a series from channel id → samples, keeping the map's iteration
    /// order as channel order.
    ///
    /// @param data the channels; at least one
    /// @return the aligned series
    public static MultiChannelSeries of(Map<String, ChannelSeries> data) {
        Objects.requireNonNull(data, "data cannot be null");
        if (data.isEmpty()) {
            throw new IllegalArgumentException("at least one channel is required");
        }

        double[] axis = null;
        String axisOwner = null;
        double[][] values = new double[data.size()][];
        List<String> names = new ArrayList<>(data.size());

        int c = 0;
        for (Map.Entry<String, ChannelSeries> entry : data.entrySet()) {
            ChannelSeries channel = Objects.requireNonNull(entry.getValue(), "channel " + entry.getKey() + " is null");
            if (axis == null) {
                axis = channel.timestamps().clone();
                axisOwner = entry.getKey();
            } else if (channel.length() != axis.length) {
                throw new IllegalArgumentException(String.format(
                    "channel %s has %d samples but %s defines %d timestamps",
                    entry.getKey(), channel.length(), axisOwner, axis.length));
            } else if (!Arrays.equals(channel.timestamps(), axis)) {
                logger.warn("channel {} has its own timestamp axis; reading it on the axis of {}",
                    entry.getKey(), axisOwner);
            }
            values[c++] = channel.values().clone();
            names.add(entry.getKey());
        }
        return new MultiChannelSeries(axis, values, Collections.unmodifiableList(names));
    }

    /// Builds a series directly from a shared axis and channel-major values.
    ///
    /// @param timestamps the shared axis, ascending seconds
    /// @param values `values[channel][timestep]`
    /// @return the series
    public static MultiChannelSeries of(double[] timestamps, double[]... values) {
        Objects.requireNonNull(timestamps, "timestamps cannot be null");
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("at least one channel is required");
        }
        double[][] copy = new double[values.length][];
        List<String> names = new ArrayList<>(values.length);
        for (int c = 0; c < values.length; c++) {
            if (values[c].length != timestamps.length) {
                throw new IllegalArgumentException(String.format(
                    "channel %d has %d samples but the axis has %d timestamps", c, values[c].length, timestamps.length));
            }
            copy[c] = values[c].clone();
            names.add("ch" + c);
        }
        return new MultiChannelSeries(timestamps.clone(), copy, Collections.unmodifiableList(names));
    }

    /// @return the number of timesteps
    public int length() {
        return timestamps.length;
    }

    /// @return the number of channels
    public int channelCount() {
        return values.length;
    }

    /// @return channel identifiers in channel order
    public List<String> channelNames() {
        return channelNames;
    }

    /// @param i timestep index
    /// @return the timestamp at `i`, in seconds
    public double timestamp(int i) {
        return timestamps[i];
    }

    /// @return the timestamp of the last sample
    public double lastTimestamp() {
        return timestamps[timestamps.length - 1];
    }

    /// @param channel channel index
    /// @param i timestep index
    /// @return the sample, `NaN` if missing
    public double value(int channel, int i) {
        return values[channel][i];
    }

    /// @param channel channel index
    /// @return a copy of the channel's values
    public double[] channel(int channel) {
        return values[channel].clone();
    }

    /// Fraction of channels that are missing (`NaN`) at timestep `i`.
    ///
    /// @param i timestep index
    /// @return a value in `[0, 1]`
    public double missingFraction(int i) {
        int missing = 0;
        for (double[] channel : values) {
            if (Double.isNaN(channel[i])) {
                missing++;
            }
        }
        return (double) missing / values.length;
    }

    /// @return per-timestep missing fractions
    public double[] missingFractions() {
        double[] fractions = new double[timestamps.length];
        for (int i = 0; i < fractions.length; i++) {
            fractions[i] = missingFraction(i);
        }
        return fractions;
    }

    @Override
    public String toString() {
        return "MultiChannelSeries[channels=" + channelNames + ", length=" + timestamps.length + "]";
    }
}
