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
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Discovers {@link AnalysisTool} implementations via SPI.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * Optional<AnalysisTool<double[], BreakSet>> tool =
 *     AnalysisTools.get("jenks-breaks", double[].class, BreakSet.class);
 *
 * List<String> names = AnalysisTools.getAvailableNames();
 * }</pre>
 *
 * <h2>Registering Tools</h2>
 *
 * <ol>
 *   <li>Implement {@link AnalysisTool}</li>
 *   <li>Add the {@link ToolName} annotation</li>
 *   <li>Provide a public no-args constructor (default parameters)</li>
 *   <li>Register in META-INF/services/io.signaladvisor.analytics.AnalysisTool</li>
 * </ol>
 */
@SuppressWarnings("rawtypes")
public final class AnalysisTools {

    private AnalysisTools() {
    }

    /**
     * Gets a new instance of the tool with the given name.
     *
     * @param name the tool name
     * @return the tool, or empty if no registered tool has that name
     */
    public static Optional<AnalysisTool<?, ?>> get(String name) {
        return providers()
            .filter(provider -> name.equals(toolName(provider)))
            .findFirst()
            .map(provider -> (AnalysisTool<?, ?>) provider.get());
    }

    /**
     * Gets a tool by name with its input and result types.
     *
     * @param name the tool name
     * @param inputType the expected input type
     * @param resultType the expected result type
     * @param <I> the input type
     * @param <R> the result type
     * @return the tool, or empty if no registered tool has that name
     */
    @SuppressWarnings("unchecked")
    public static <I, R> Optional<AnalysisTool<I, R>> get(String name, Class<I> inputType, Class<R> resultType) {
        return get(name).map(tool -> (AnalysisTool<I, R>) tool);
    }

    /**
     * Gets the names of all registered tools.
     *
     * @return tool names in service registration order
     */
    public static List<String> getAvailableNames() {
        List<String> names = new ArrayList<>();
        providers().forEach(provider -> names.add(toolName(provider)));
        return names;
    }

    /**
     * @param name the tool name to check
     * @return true if a tool with the given name is registered
     */
    public static boolean isAvailable(String name) {
        return providers().anyMatch(provider -> name.equals(toolName(provider)));
    }

    private static Stream<ServiceLoader.Provider<AnalysisTool>> providers() {
        // ServiceLoader instances are not thread-safe, so each lookup gets its own
        return ServiceLoader.load(AnalysisTool.class).stream();
    }

    private static String toolName(ServiceLoader.Provider<AnalysisTool> provider) {
        ToolName annotation = provider.type().getAnnotation(ToolName.class);
        if (annotation != null) {
            return annotation.value();
        }
        return provider.get().getToolName();
    }
}
