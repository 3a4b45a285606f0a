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

package io.signaladvisor.analytics.config;

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.signaladvisor.analytics.breaks.BreakOptimizer;
import io.signaladvisor.analytics.breaks.BreakSearchParams;
import io.signaladvisor.analytics.breaks.KSelection;
import io.signaladvisor.analytics.range.RangeEstimator;
import io.signaladvisor.analytics.range.RangeParams;
import io.signaladvisor.analytics.window.TrainingWindowSelector;
import io.signaladvisor.analytics.window.WindowSelectionParams;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * JSON-serializable settings for the three analysis tools.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every key is optional; a missing key takes the tool's default.
 * <pre>{@code
 * {
 *   "training_window": {
 *     "window": 300,
 *     "start_count": 3,
 *     "stop_count": 3,
 *     "nan_threshold": 0.05,
 *     "seed": 42
 *   },
 *   "break_search": {
 *     "max_classes": 10,
 *     "sample_size": 10000,
 *     "selection": "knee",
 *     "knee_sensitivity": 2.0,
 *     "seed": 42
 *   },
 *   "normal_range": {
 *     "components": 3,
 *     "std_scale": 3.0,
 *     "weight_threshold": 0.05,
 *     "initializations": 10,
 *     "max_iterations": 100,
 *     "seed": 0
 *   }
 * }
 * }</pre>
 *
 * <p>Values are validated when a section is turned into its parameter record,
 * so an out-of-range setting fails with {@link IllegalArgumentException} at
 * that point.
 */
public class AnalysisConfig {

    @SerializedName("training_window")
    private TrainingWindowSection trainingWindow;

    @SerializedName("break_search")
    private BreakSearchSection breakSearch;

    @SerializedName("normal_range")
    private NormalRangeSection normalRange;

    /**
     * Settings of the training window selector.
     */
    public static class TrainingWindowSection {
        @SerializedName("window")
        private Integer window;

        @SerializedName("start_count")
        private Integer startCount;

        @SerializedName("stop_count")
        private Integer stopCount;

        @SerializedName("nan_threshold")
        private Double nanThreshold;

        @SerializedName("seed")
        private Long seed;

        public TrainingWindowSection() {
        }

        public TrainingWindowSection(WindowSelectionParams params) {
            this.window = params.window();
            this.startCount = params.startCount();
            this.stopCount = params.stopCount();
            this.nanThreshold = params.nanThreshold();
            this.seed = params.seed();
        }

        WindowSelectionParams toParams() {
            WindowSelectionParams d = WindowSelectionParams.defaults();
            return new WindowSelectionParams(
                orDefault(window, d.window()),
                orDefault(startCount, d.startCount()),
                orDefault(stopCount, d.stopCount()),
                orDefault(nanThreshold, d.nanThreshold()),
                orDefault(seed, d.seed()));
        }
    }

    /**
     * Settings of the natural breaks search.
     */
    public static class BreakSearchSection {
        @SerializedName("max_classes")
        private Integer maxClasses;

        @SerializedName("sample_size")
        private Integer sampleSize;

        /** {@code knee} or {@code bic} */
        @SerializedName("selection")
        private String selection;

        @SerializedName("knee_sensitivity")
        private Double kneeSensitivity;

        @SerializedName("seed")
        private Long seed;

        public BreakSearchSection() {
        }

        public BreakSearchSection(BreakSearchParams params) {
            this.maxClasses = params.maxClasses();
            this.sampleSize = params.sampleSize();
            this.selection = params.selection().name().toLowerCase(Locale.ROOT);
            this.kneeSensitivity = params.kneeSensitivity();
            this.seed = params.seed();
        }

        BreakSearchParams toParams() {
            BreakSearchParams d = BreakSearchParams.defaults();
            return new BreakSearchParams(
                orDefault(maxClasses, d.maxClasses()),
                orDefault(sampleSize, d.sampleSize()),
                selection == null ? d.selection() : parseSelection(selection),
                orDefault(kneeSensitivity, d.kneeSensitivity()),
                orDefault(seed, d.seed()));
        }

        private static KSelection parseSelection(String value) {
            try {
                return KSelection.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown break selection '" + value + "', expected knee or bic", e);
            }
        }
    }

    /**
     * Settings of the normal range estimator.
     */
    public static class NormalRangeSection {
        @SerializedName("components")
        private Integer components;

        @SerializedName("std_scale")
        private Double stdScale;

        @SerializedName("weight_threshold")
        private Double weightThreshold;

        @SerializedName("initializations")
        private Integer initializations;

        @SerializedName("max_iterations")
        private Integer maxIterations;

        @SerializedName("seed")
        private Long seed;

        public NormalRangeSection() {
        }

        public NormalRangeSection(RangeParams params) {
            this.components = params.components();
            this.stdScale = params.stdScale();
            this.weightThreshold = params.weightThreshold();
            this.initializations = params.initializations();
            this.maxIterations = params.maxIterations();
            this.seed = params.seed();
        }

        RangeParams toParams() {
            RangeParams d = RangeParams.defaults();
            return new RangeParams(
                orDefault(components, d.components()),
                orDefault(stdScale, d.stdScale()),
                orDefault(weightThreshold, d.weightThreshold()),
                orDefault(initializations, d.initializations()),
                orDefault(maxIterations, d.maxIterations()),
                orDefault(seed, d.seed()));
        }
    }

    public AnalysisConfig() {
    }

    /**
     * Creates a config holding the given parameters.
     */
    public AnalysisConfig(WindowSelectionParams window, BreakSearchParams breaks, RangeParams range) {
        this.trainingWindow = new TrainingWindowSection(window);
        this.breakSearch = new BreakSearchSection(breaks);
        this.normalRange = new NormalRangeSection(range);
    }

    /**
     * @return a config holding every tool's defaults
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(WindowSelectionParams.defaults(), BreakSearchParams.defaults(),
            RangeParams.defaults());
    }

    /**
     * Parses a config from JSON.
     *
     * @param json the JSON text
     * @return the config; an empty document yields all defaults
     * @throws IllegalArgumentException if the text is not a valid config document
     */
    public static AnalysisConfig fromJson(String json) {
        try {
            AnalysisConfig config = AnalysisGsonConfig.gson().fromJson(json, AnalysisConfig.class);
            return config == null ? new AnalysisConfig() : config;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid analysis config: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a config from a reader.
     */
    public static AnalysisConfig fromJson(Reader reader) {
        try {
            AnalysisConfig config = AnalysisGsonConfig.gson().fromJson(reader, AnalysisConfig.class);
            return config == null ? new AnalysisConfig() : config;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("invalid analysis config: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a config file.
     *
     * @param path the JSON file
     * @return the config
     * @throws UncheckedIOException if the file cannot be read
     */
    public static AnalysisConfig load(Path path) {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read analysis config " + path, e);
        }
    }

    /**
     * @return this config as pretty-printed JSON
     */
    public String toJson() {
        return AnalysisGsonConfig.gson().toJson(this);
    }

    /**
     * Writes this config to a file, replacing any existing content.
     *
     * @param path the target file
     * @throws UncheckedIOException if the file cannot be written
     */
    public void save(Path path) {
        try (Writer writer = Files.newBufferedWriter(path)) {
            AnalysisGsonConfig.gson().toJson(this, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write analysis config " + path, e);
        }
    }

    /**
     * @return the training window parameters, defaults filled in
     */
    public WindowSelectionParams trainingWindow() {
        return trainingWindow == null ? WindowSelectionParams.defaults() : trainingWindow.toParams();
    }

    /**
     * @return the break search parameters, defaults filled in
     */
    public BreakSearchParams breakSearch() {
        return breakSearch == null ? BreakSearchParams.defaults() : breakSearch.toParams();
    }

    /**
     * @return the normal range parameters, defaults filled in
     */
    public RangeParams normalRange() {
        return normalRange == null ? RangeParams.defaults() : normalRange.toParams();
    }

    /**
     * @return a training window selector configured from this document
     */
    public TrainingWindowSelector trainingWindowSelector() {
        return new TrainingWindowSelector(trainingWindow());
    }

    /**
     * @return a break optimizer configured from this document
     */
    public BreakOptimizer breakOptimizer() {
        return new BreakOptimizer(breakSearch());
    }

    /**
     * @return a range estimator configured from this document
     */
    public RangeEstimator rangeEstimator() {
        return new RangeEstimator(normalRange());
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static long orDefault(Long value, long fallback) {
        return value == null ? fallback : value;
    }

    private static double orDefault(Double value, double fallback) {
        return value == null ? fallback : value;
    }
}
