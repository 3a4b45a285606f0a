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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an {@link AnalysisTool} implementation with its unique name.
 *
 * <p>{@link AnalysisTools} reads this annotation to look tools up by name without
 * instantiating them.
 *
 * <pre>{@code
 * @ToolName("normal-range")
 * public class RangeEstimator implements AnalysisTool<double[], RangeBound> {
 *     // ...
 * }
 * }</pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ToolName {
    /**
     * The unique tool name. It should match {@link AnalysisTool#getToolName()}.
     *
     * @return the tool name
     */
    String value();
}
