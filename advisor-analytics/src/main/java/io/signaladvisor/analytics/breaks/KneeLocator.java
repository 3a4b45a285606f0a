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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/// Finds the knee (or elbow) of a monotonic curve: the point after which
/// increasing `x` stops paying off in `y`.
///
/// ## Algorithm (Kneedle, offline mode)
///
/// 1. Normalize `x` and `y` to `[0, 1]`.
/// 2. Reshape the curve so that its knee is a maximum of `y - x`:
///    | curve | direction | transform |
///    |-------|-----------|-----------|
///    | concave | increasing | none |
///    | concave | decreasing | reverse `y` |
///    | convex | decreasing | `max(y) - y` |
///    | convex | increasing | reverse `max(y) - y` |
/// 3. Build the difference curve `d = y - x` and find its local maxima and
///    minima (neighbors compared with `≥` / `≤`, ends compared with themselves).
/// 4. Each local maximum sets a threshold `d_max - S · mean(Δx)`; a local minimum
///    resets it to 0.
/// 5. Walking from the first local maximum, the first point whose successor
///    falls below the current threshold is the knee.
///
/// `x` must be ascending. A curve without a knee, or with a flat `x` or `y`,
/// yields an empty result.
///
/// ## Usage
///
/// ```java
/// KneeLocator locator = new KneeLocator(k, gvf, Curve.CONCAVE, Direction.INCREASING, 2.0);
/// OptionalDouble knee = locator.knee();
/// ```
public final class KneeLocator {

    /// Shape of the curve
    public enum Curve { CONCAVE, CONVEX }

    /// Trend of the curve
    public enum Direction { INCREASING, DECREASING }

    private final double[] x;
    private final Curve curve;
    private final Direction direction;
    private final double sensitivity;

    private final double[] xNormalized;
    private final double[] yDifference;
    private final boolean[] maxima;
    private final boolean[] minima;

    private final OptionalDouble knee;
    private final OptionalDouble normalizedKnee;

    /// @param x ascending x values
    /// @param y y values, same length as `x`
    /// @param curve curve shape
    /// @param direction curve trend
    /// @param sensitivity the `S` parameter; larger values find more conservative knees
    public KneeLocator(double[] x, double[] y, Curve curve, Direction direction, double sensitivity) {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have the same length, got " + x.length + " and " + y.length);
        }
        this.x = x.clone();
        this.curve = Objects.requireNonNull(curve, "curve cannot be null");
        this.direction = Objects.requireNonNull(direction, "direction cannot be null");
        this.sensitivity = sensitivity;

        int n = x.length;
        this.xNormalized = normalize(x);
        double[] yNormalized = transform(normalize(y));
        this.yDifference = new double[n];
        this.maxima = new boolean[n];
        this.minima = new boolean[n];

        if (xNormalized == null || yNormalized == null || n < 2) {
            this.knee = OptionalDouble.empty();
            this.normalizedKnee = OptionalDouble.empty();
            return;
        }
        for (int i = 0; i < n; i++) {
            yDifference[i] = yNormalized[i] - xNormalized[i];
        }
        for (int i = 0; i < n; i++) {
            double left = yDifference[Math.max(0, i - 1)];
            double right = yDifference[Math.min(n - 1, i + 1)];
            maxima[i] = yDifference[i] >= left && yDifference[i] >= right;
            minima[i] = yDifference[i] <= left && yDifference[i] <= right;
        }

        int found = findKneeIndex();
        if (found < 0) {
            this.knee = OptionalDouble.empty();
            this.normalizedKnee = OptionalDouble.empty();
        } else {
            boolean mirrored = (curve == Curve.CONVEX) == (direction == Direction.INCREASING);
            this.knee = OptionalDouble.of(mirrored ? x[n - 1 - found] : x[found]);
            this.normalizedKnee = OptionalDouble.of(xNormalized[found]);
        }
    }

    /// @return the x value of the knee, if any
    public OptionalDouble knee() {
        return knee;
    }

    /// @return the normalized x value of the knee, if any
    public OptionalDouble normalizedKnee() {
        return normalizedKnee;
    }

    /// @return the difference curve `y - x` after normalization
    public double[] differenceCurve() {
        return yDifference.clone();
    }

    /// @return indices of local maxima of the difference curve
    public List<Integer> maximaIndices() {
        return indices(maxima);
    }

    private int findKneeIndex() {
        int n = x.length;
        int firstMaximum = -1;
        List<Double> thresholds = new ArrayList<>();
        double step = meanStep(xNormalized);
        for (int i = 0; i < n; i++) {
            if (maxima[i]) {
                if (firstMaximum < 0) firstMaximum = i;
                thresholds.add(yDifference[i] - sensitivity * step);
            }
        }
        if (firstMaximum < 0) {
            return -1;
        }

        int maximaSeen = 0;
        double threshold = 0.0;
        int thresholdIndex = firstMaximum;
        for (int i = firstMaximum; i < n - 1; i++) {
            if (maxima[i]) {
                threshold = thresholds.get(maximaSeen++);
                thresholdIndex = i;
            }
            if (minima[i]) {
                threshold = 0.0;
            }
            if (yDifference[i + 1] < threshold) {
                return thresholdIndex;
            }
        }
        return -1;
    }

    private double[] transform(double[] yNormalized) {
        if (yNormalized == null) {
            return null;
        }
        if (direction == Direction.DECREASING) {
            return curve == Curve.CONCAVE ? reverse(yNormalized) : flip(yNormalized);
        }
        return curve == Curve.CONVEX ? reverse(flip(yNormalized)) : yNormalized;
    }

    /// Scales to `[0, 1]`; null when the values span no range.
    private static double[] normalize(double[] values) {
        if (values.length == 0) {
            return null;
        }
        double min = values[0];
        double max = values[0];
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        double range = max - min;
        if (!(range > 0.0) || Double.isInfinite(range)) {
            return null;
        }
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] - min) / range;
        }
        return result;
    }

    private static double[] flip(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) max = Math.max(max, v);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = max - values[i];
        }
        return result;
    }

    private static double[] reverse(double[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[values.length - 1 - i];
        }
        return result;
    }

    private static double meanStep(double[] values) {
        double sum = 0.0;
        for (int i = 1; i < values.length; i++) {
            sum += values[i] - values[i - 1];
        }
        return Math.abs(sum / (values.length - 1));
    }

    private static List<Integer> indices(boolean[] flags) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < flags.length; i++) {
            if (flags[i]) result.add(i);
        }
        return result;
    }
}
