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

package io.signaladvisor.analytics;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Common contract for the recommendation algorithms.
///
/// ## Purpose
///
/// Every analysis in this module is a single stateless computation that turns an
/// in-memory input (a multi-channel series, or one numeric column) into a small
/// structured result. This interface lets a host treat them polymorphically:
///
/// | Tool | Input | Result |
/// |------|-------|--------|
/// | `training-window` | `Map<String, ChannelSeries>` | `List<Segment>` |
/// | `jenks-breaks` | `double[]` | `BreakSet` |
/// | `normal-range` | `double[]` | `RangeBound` |
///
/// ## Contract
///
/// - `call` never mutates its input.
/// - Repeated calls with identical input and parameters return equal results;
///   any randomness inside a tool is driven by an explicit seed.
/// - Implementations hold only immutable parameters, so one instance may be
///   shared between threads.
/// - Failures surface as unchecked exceptions: [IllegalArgumentException] for
///   precondition violations, [AnalysisException] for numerical failures.
///
/// ## Usage
///
/// ```java
/// AnalysisTool<double[], RangeBound> tool = new RangeEstimator();
/// RangeBound bound = tool.call(values);
/// ```
///
/// @param <I> the input type
/// @param <R> the result type
/// @see AnalysisTools
/// @see ToolName
public interface AnalysisTool<I, R> {

    /// Returns the unique identifier of this tool, e.g. `normal-range`.
    ///
    /// @return the tool name, matching its [ToolName] annotation
    String getToolName();

    /// Runs the analysis on one input.
    ///
    /// @param input the data to analyze
    /// @return the analysis result
    R call(I input);

    /// Runs the analysis on each input in order.
    ///
    /// The first failing input aborts the batch; no partial result is returned.
    ///
    /// @param inputs the inputs to analyze
    /// @return one result per input, in input order
    default List<R> batchCall(List<? extends I> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        List<R> results = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            results.add(call(input));
        }
        return results;
    }
}
