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

import io.signaladvisor.analytics.model.BreakSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Outcome of an optimal class-count search: the chosen `k` plus the
/// diagnostics of every evaluated candidate.
///
/// Arrays are indexed by candidate position, so `gvf()[i]` belongs to
/// `kValues()[i]`; candidates run `2..maxClasses`. Every array is copied on
/// construction and on access, and equality compares contents.
///
/// @param bestK the selected class count
/// @param kValues the evaluated class counts
/// @param gvf goodness of variance fit per candidate
/// @param fStatistic pseudo-F statistic per candidate
/// @param bic Bayesian information criterion per candidate
/// @param breaks full Jenks breaks (minimum and maximum included) per candidate
/// @param sampleCount number of values the search ran on, after sampling
public record BreakSearchResult(
    int bestK,
    int[] kValues,
    double[] gvf,
    double[] fStatistic,
    double[] bic,
    List<double[]> breaks,
    int sampleCount
) {

    public BreakSearchResult {
        Objects.requireNonNull(kValues, "kValues cannot be null");
        Objects.requireNonNull(breaks, "breaks cannot be null");
        int n = kValues.length;
        if (gvf.length != n || fStatistic.length != n || bic.length != n || breaks.size() != n) {
            throw new IllegalArgumentException("every diagnostic needs one entry per candidate, expected " + n);
        }
        kValues = kValues.clone();
        gvf = gvf.clone();
        fStatistic = fStatistic.clone();
        bic = bic.clone();
        List<double[]> copies = new ArrayList<>(n);
        for (double[] b : breaks) {
            copies.add(b.clone());
        }
        breaks = Collections.unmodifiableList(copies);
    }

    @Override
    public int[] kValues() {
        return kValues.clone();
    }

    @Override
    public double[] gvf() {
        return gvf.clone();
    }

    @Override
    public double[] fStatistic() {
        return fStatistic.clone();
    }

    @Override
    public double[] bic() {
        return bic.clone();
    }

    /// @return a copy of the breaks of every candidate
    @Override
    public List<double[]> breaks() {
        List<double[]> copies = new ArrayList<>(breaks.size());
        for (double[] b : breaks) {
            copies.add(b.clone());
        }
        return copies;
    }

    /// @param k an evaluated class count
    /// @return its full Jenks breaks, minimum and maximum included
    public double[] breaksFor(int k) {
        return breaks.get(indexOf(k)).clone();
    }

    /// @return the interior boundaries of the selected class count
    public BreakSet breakSet() {
        double[] all = breaks.get(indexOf(bestK));
        return BreakSet.of(Arrays.copyOfRange(all, 1, all.length - 1));
    }

    /// @return the goodness of variance fit of the selected class count
    public double bestGvf() {
        return gvf[indexOf(bestK)];
    }

    private int indexOf(int k) {
        for (int i = 0; i < kValues.length; i++) {
            if (kValues[i] == k) {
                return i;
            }
        }
        throw new IllegalArgumentException("k=" + k + " was not evaluated, candidates are " + Arrays.toString(kValues));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BreakSearchResult other)) {
            return false;
        }
        if (bestK != other.bestK || sampleCount != other.sampleCount || breaks.size() != other.breaks.size()) {
            return false;
        }
        for (int i = 0; i < breaks.size(); i++) {
            if (!Arrays.equals(breaks.get(i), other.breaks.get(i))) {
                return false;
            }
        }
        return Arrays.equals(kValues, other.kValues)
            && Arrays.equals(gvf, other.gvf)
            && Arrays.equals(fStatistic, other.fStatistic)
            && Arrays.equals(bic, other.bic);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(bestK);
        result = 31 * result + Arrays.hashCode(kValues);
        result = 31 * result + Arrays.hashCode(gvf);
        result = 31 * result + Arrays.hashCode(fStatistic);
        result = 31 * result + Arrays.hashCode(bic);
        for (double[] b : breaks) {
            result = 31 * result + Arrays.hashCode(b);
        }
        return 31 * result + sampleCount;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("BreakSearchResult[bestK=%d, n=%d]%n", bestK, sampleCount));
        for (int i = 0; i < kValues.length; i++) {
            sb.append(String.format("  k=%d: gvf=%.4f, F=%.2f, bic=%.2f%n", kValues[i], gvf[i], fStatistic[i], bic[i]));
        }
        return sb.toString();
    }
}
