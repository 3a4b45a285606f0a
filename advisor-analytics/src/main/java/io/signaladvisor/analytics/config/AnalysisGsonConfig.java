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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for analysis configs and results.
///
/// ## Purpose
///
/// One place that decides how this module talks JSON, for:
///
/// - [AnalysisConfig] documents
/// - results handed to a host UI: `List<Segment>`, `BreakSet`, `RangeBound`,
///   `BreakSearchResult`, `MixtureFit`
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable config files |
/// | HTML escaping | Disabled | Cleaner numeric output |
/// | Special floating point | Allowed | `NaN` and infinities in diagnostics (e.g. BIC of a perfect fit) |
///
/// ## Usage
///
/// ```java
/// String json = AnalysisGsonConfig.gson().toJson(new RangeBound(1.5, 9.0));
/// // {"lower": 1.5, "upper": 9.0}
/// ```
///
/// The [Gson] instances are thread-safe and shared.
public final class AnalysisGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private static final Gson COMPACT = new GsonBuilder()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .create();

    private AnalysisGsonConfig() {
        // Utility class
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return a single-line Gson instance, for log lines and NDJSON output
    public static Gson compactGson() {
        return COMPACT;
    }

    /// @return a new builder with this module's defaults, for further customization
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
