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

package io.signaladvisor.analytics.breaks;

import java.util.Arrays;

/// Jenks natural breaks by dynamic programming over sorted data.
///
/// ## Algorithm
///
/// For every prefix `data[0..l)` and class count `j`, the table keeps the lowest
/// total within-class squared deviation and the 1-based index where the last
/// class of that optimum starts:
///
/// ```
/// V[l][j] = min over m of ( SS(data[m..l)) + V[m][j-1] )
/// ```
///
/// Column `j` depends only on column `j - 1`, so one table built for `maxClasses`
/// answers every `k ≤ maxClasses`. Building costs `O(maxClasses · n²)` time and
/// `O(maxClasses · n)` memory.
///
/// ## Breaks
///
/// [#breaks(int)] returns `k + 1` values: the minimum, the upper value of each
/// class but the last, and the maximum. [#interiorBreaks(int)] drops the two
/// ends.
public final class JenksNaturalBreaks {

    private final double[] sorted;
    private final int maxClasses;
    private final int[][] lowerClassLimits;

    /// @param data the values; copied and sorted
    /// @param maxClasses largest class count to prepare
    public JenksNaturalBreaks(double[] data, int maxClasses) {
        if (maxClasses < 1) {
            throw new IllegalArgumentException("maxClasses must be at least 1, got " + maxClasses);
        }
        if (data.length < maxClasses) {
            throw new IllegalArgumentException(
                "need at least " + maxClasses + " values for " + maxClasses + " classes, got " + data.length);
        }
        this.sorted = data.clone();
        Arrays.sort(this.sorted);
        this.maxClasses = maxClasses;
        this.lowerClassLimits = buildTable(sorted, maxClasses);
    }

    private static int[][] buildTable(double[] data, int k) {
        int n = data.length;
        int[][] limits = new int[n + 1][k + 1];
        double[][] variances = new double[n + 1][k + 1];

        for (int j = 1; j <= k; j++) {
            limits[1][j] = 1;
            for (int l = 2; l <= n; l++) {
                variances[l][j] = Double.POSITIVE_INFINITY;
            }
        }

        for (int l = 2; l <= n; l++) {
            double sum = 0.0;
            double sumSquares = 0.0;
            double variance = 0.0;

            for (int m = 1; m <= l; m++) {
                int lowerClassLimit = l - m + 1;
                double val = data[lowerClassLimit - 1];
                sum += val;
                sumSquares += val * val;
                variance = sumSquares - (sum * sum) / m;

                int previous = lowerClassLimit - 1;
                if (previous != 0) {
                    for (int j = 2; j <= k; j++) {
                        double candidate = variance + variances[previous][j - 1];
                        if (variances[l][j] >= candidate) {
                            limits[l][j] = lowerClassLimit;
                            variances[l][j] = candidate;
                        }
                    }
                }
            }
            limits[l][1] = 1;
            variances[l][1] = variance;
        }
        return limits;
    }

    /// @param k class count, `1..maxClasses`
    /// @return `k + 1` ascending values, min and max included
    public double[] breaks(int k) {
        if (k < 1 || k > maxClasses) {
            throw new IllegalArgumentException("k must be within [1, " + maxClasses + "], got " + k);
        }
        int n = sorted.length;
        double[] result = new double[k + 1];
        result[0] = sorted[0];
        result[k] = sorted[n - 1];

        int end = n;
        for (int count = k; count > 1; count--) {
            int lower = lowerClassLimits[end][count];
            if (lower < 2) {
                // ties between zero-variance classes can exhaust the prefix early
                for (int c = count - 1; c >= 1; c--) {
                    result[c] = sorted[0];
                }
                break;
            }
            result[count - 1] = sorted[lower - 2];
            end = lower - 1;
        }
        return result;
    }

    /// @param k class count, `2..maxClasses`
    /// @return the `k - 1` boundaries between classes
    public double[] interiorBreaks(int k) {
        double[] all = breaks(k);
        return Arrays.copyOfRange(all, 1, all.length - 1);
    }

    /// @return the sorted data the table was built over
    public double[] sortedData() {
        return sorted.clone();
    }

    /// @return the largest class count prepared
    public int maxClasses() {
        return maxClasses;
    }
}
