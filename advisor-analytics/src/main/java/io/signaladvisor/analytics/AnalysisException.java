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

/// Thrown when a numerical step of an analysis fails, for example when a
/// mixture fit produces a non-finite likelihood.
///
/// Callers must treat it as a hard failure of the call; the engine never
/// retries with different parameters on its own.
public class AnalysisException extends RuntimeException {

    private final String toolName;

    public AnalysisException(String toolName, String message) {
        super(toolName + ": " + message);
        this.toolName = toolName;
    }

    public AnalysisException(String toolName, String message, Throwable cause) {
        super(toolName + ": " + message, cause);
        this.toolName = toolName;
    }

    /// @return the name of the tool that failed
    public String getToolName() {
        return toolName;
    }
}
