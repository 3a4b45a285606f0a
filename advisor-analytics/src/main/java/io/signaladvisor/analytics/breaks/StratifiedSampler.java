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

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/// Shape-preserving reduction of a large 1-D sample.
///
/// ## Algorithm
///
/// 1. Place `s = min(100, n / 100)` equally spaced edges from the minimum to the
///    maximum of the data.
/// 2. Bucket each value by the number of edges at or below it, so values equal to
///    the maximum land in a bucket of their own.
/// 3. From each populated bucket draw, without replacement,
///    `min(max(1, ⌊sampleSize · |bucket| / n⌋), |bucket|)` values.
///
/// Buckets are visited in ascending order. The draw is driven by a seeded
/// commons-math generator, so equal inputs give equal samples.
public final class StratifiedSampler {

    /// Upper bound on the number of strata
    public static final int MAX_STRATA = 100;

    private StratifiedSampler() {
    }

    /// @param data the values to reduce
    /// @param sampleSize the target sample size
    /// @param seed the random seed
    /// @return roughly `sampleSize` values, at least one per populated stratum
    public static double[] sample(double[] data, int sampleSize, long seed) {
        int n = data.length;
        if (n == 0) {
            throw new IllegalArgumentException("data cannot be empty");
        }
        double min = data[0];
        double max = data[0];
        for (double v : data) {
            if (v < min) min = v;
            if (v > max) max = v;
        }

        double[] edges = edges(min, max, strataCount(n));
        List<List<Integer>> buckets = new ArrayList<>(edges.length + 1);
        for (int b = 0; b <= edges.length; b++) {
            buckets.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            buckets.get(bucketOf(edges, data[i])).add(i);
        }

        RandomGenerator random = new Well19937c(seed);
        double[] out = new double[n];
        int size = 0;
        for (List<Integer> bucket : buckets) {
            if (bucket.isEmpty()) {
                continue;
            }
            int draw = (int) Math.min(Math.max(1L, (long) sampleSize * bucket.size() / n), bucket.size());
            int[] pool = new int[bucket.size()];
            for (int p = 0; p < pool.length; p++) {
                pool[p] = bucket.get(p);
            }
            // partial Fisher-Yates: the first `draw` slots become the sample
            for (int p = 0; p < draw; p++) {
                int swap = p + random.nextInt(pool.length - p);
                int tmp = pool[p];
                pool[p] = pool[swap];
                pool[swap] = tmp;
                out[size++] = data[pool[p]];
            }
        }
        double[] result = new double[size];
        System.arraycopy(out, 0, result, 0, size);
        return result;
    }

    /// @param n the input length
    /// @return the number of edges used for an input of that length
    static int strataCount(int n) {
        return Math.max(1, Math.min(MAX_STRATA, n / 100));
    }

    private static double[] edges(double min, double max, int count) {
        double[] edges = new double[count];
        if (count == 1) {
            edges[0] = min;
            return edges;
        }
        double step = (max - min) / (count - 1);
        for (int i = 0; i < count; i++) {
            edges[i] = min + i * step;
        }
        edges[count - 1] = max;
        return edges;
    }

    /// Number of edges `≤ v`.
    private static int bucketOf(double[] edges, double v) {
        int lo = 0;
        int hi = edges.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (edges[mid] <= v) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
