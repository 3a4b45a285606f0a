package io.signaladvisor.analytics.window;

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

import io.signaladvisor.analytics.model.ChannelSeries;
import io.signaladvisor.analytics.model.MultiChannelSeries;
import io.signaladvisor.analytics.model.Segment;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TrainingWindowSelector}.
 *
 * <p>The end-to-end fixture is 1000 one-second samples of two channels that sit
 * flat at 0 except for an oscillating stretch over samples 200..399.
 */
@Tag("unit")
public class TrainingWindowSelectorTest {

    private static final int N = 1000;
    private static final int WINDOW = 50;

    @Test
    void findsWindowAroundOscillation() {
        List<Segment> segments = new TrainingWindowSelector().call(twoChannelFixture(), WINDOW, 3, 3, 0.05);

        assertEquals(1, segments.size(), "expected a single window, got " + segments);
        Segment segment = segments.get(0);
        assertTrue(segment.start() >= 200 - WINDOW, "window starts too early: " + segment);
        assertTrue(segment.end() <= 400 + WINDOW, "window ends too late: " + segment);
    }

    @Test
    void selectOnSeriesMatchesCall() {
        Map<String, ChannelSeries> data = twoChannelFixture();
        TrainingWindowSelector selector = new TrainingWindowSelector(WindowSelectionParams.defaults().with(WINDOW, 3, 3, 0.05));

        assertEquals(selector.call(data), selector.select(MultiChannelSeries.of(data)));
    }

    @Test
    void explicitArgumentsMatchParameterRecord() {
        Map<String, ChannelSeries> data = twoChannelFixture();
        WindowSelectionParams params = new WindowSelectionParams(WINDOW, 3, 3, 0.05, WindowSelectionParams.DEFAULT_SEED);

        assertEquals(new TrainingWindowSelector(params).call(data),
            new TrainingWindowSelector().call(data, WINDOW, 3, 3, 0.05));
    }

    @Test
    void repeatedCallsAreIdentical() {
        TrainingWindowSelector selector = new TrainingWindowSelector(WindowSelectionParams.defaults().with(WINDOW, 3, 3, 0.05));

        assertEquals(selector.call(twoChannelFixture()), selector.call(twoChannelFixture()));
    }

    @Test
    void constantDataYieldsNoWindows() {
        double[] ts = new double[100];
        double[] values = new double[100];
        for (int i = 0; i < 100; i++) {
            ts[i] = i;
            values[i] = 4.2;
        }

        List<Segment> segments = new TrainingWindowSelector().call(Map.of("flat", new ChannelSeries(ts, values)));

        assertTrue(segments.isEmpty());
    }

    @Test
    void profileExposesScoresAndLabels() {
        TrainingWindowSelector selector = new TrainingWindowSelector(WindowSelectionParams.defaults().with(WINDOW, 3, 3, 0.05));

        TrainingWindowSelector.InformationProfile info = selector.profile(twoChannelFixture());

        assertEquals(N, info.profile().length());
        assertEquals(N, info.labels().length());
        assertTrue(info.labels().isHigh(300), "center of the oscillation should be high-information");
        assertFalse(info.labels().isHigh(10));
    }

    @Test
    void repeatedProfilesAreEqual() {
        TrainingWindowSelector selector = new TrainingWindowSelector(WindowSelectionParams.defaults().with(WINDOW, 3, 3, 0.05));

        assertEquals(selector.profile(twoChannelFixture()), selector.profile(twoChannelFixture()));
    }

    @Test
    void batchCallKeepsInputOrder() {
        TrainingWindowSelector selector = new TrainingWindowSelector(WindowSelectionParams.defaults().with(WINDOW, 3, 3, 0.05));
        Map<String, ChannelSeries> fixture = twoChannelFixture();

        List<List<Segment>> results = selector.batchCall(List.of(fixture, fixture));

        assertEquals(2, results.size());
        assertEquals(selector.call(fixture), results.get(0));
        assertEquals(results.get(0), results.get(1));
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> new TrainingWindowSelector().call(Map.of()));
    }

    @Test
    void rejectsMisalignedChannels() {
        Map<String, ChannelSeries> data = new LinkedHashMap<>();
        data.put("a", new ChannelSeries(new double[]{0, 1, 2}, new double[]{1, 2, 3}));
        data.put("b", new ChannelSeries(new double[]{0, 1}, new double[]{1, 2}));

        assertThrows(IllegalArgumentException.class, () -> new TrainingWindowSelector().call(data));
    }

    @Test
    void rejectsInvalidArguments() {
        Map<String, ChannelSeries> data = twoChannelFixture();

        assertThrows(IllegalArgumentException.class, () -> new TrainingWindowSelector().call(data, 0, 3, 3, 0.05));
        assertThrows(IllegalArgumentException.class, () -> new TrainingWindowSelector().call(data, WINDOW, 3, 3, 1.5));
    }

    /// The flat stretches sit at each channel's minimum. A flat level above the
    /// minimum normalizes to a nonzero value, and the decay weights then spread it
    /// across histogram bins, so a constant stretch would score near-maximal entropy.
    static Map<String, ChannelSeries> twoChannelFixture() {
        double[] ts = new double[N];
        double[] a = new double[N];
        double[] b = new double[N];
        for (int i = 0; i < N; i++) {
            ts[i] = i;
            if (i >= 200 && i < 400) {
                a[i] = 5.0 + 5.0 * Math.sin(1.3 * i);
                b[i] = 5.0 + 5.0 * Math.cos(0.7 * i);
            }
        }
        Map<String, ChannelSeries> data = new LinkedHashMap<>();
        data.put("pressure", new ChannelSeries(ts, a));
        data.put("flow", new ChannelSeries(ts.clone(), b));
        return data;
    }
}
