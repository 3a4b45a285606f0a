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

package io.signaladvisor.analytics.window;

import io.signaladvisor.analytics.model.DensityLabels;
import io.signaladvisor.analytics.model.EntropyProfile;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Splits an entropy profile into high- and low-information positions.
///
/// ## Algorithm
///
/// 1. Positions scoring above [#ENTROPY_FLOOR] are *valid*.
/// 2. The valid scores are clustered into two groups by k-means (k-means++
///    seeding from a fixed seed, at most [#DEFAULT_MAX_ITERATIONS] iterations).
/// 3. The cluster with the larger center is the high-information cluster.
/// 4. A position is labeled 1 when it is valid and its nearest center is the
///    high-information center; every other position, including all scores at or
///    below the floor, is labeled 0.
///
/// A profile without valid positions is labeled all-zero with a warning.
///
/// ## Failures
///
/// Clustering failures are not caught. A profile with a single valid position
/// cannot form two clusters, and the commons-math clusterer rejects it.
public final class DensityClassifier {

    private static final Logger logger = LogManager.getLogger(DensityClassifier.class);

    /// Minimum score for a position to take part in clustering
    public static final double ENTROPY_FLOOR = 0.001;

    /// Maximum k-means iterations
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private static final int CLUSTERS = 2;

    private final long seed;
    private final int maxIterations;

    /// Creates a classifier seeded with [WindowSelectionParams#DEFAULT_SEED].
    public DensityClassifier() {
        this(WindowSelectionParams.DEFAULT_SEED, DEFAULT_MAX_ITERATIONS);
    }

    /// @param seed seed for k-means++ initialization
    /// @param maxIterations maximum k-means iterations
    public DensityClassifier(long seed, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.seed = seed;
        this.maxIterations = maxIterations;
    }

    /// Labels each position of the profile.
    ///
    /// @param profile the entropy profile
    /// @return one label per position
    public DensityLabels classify(EntropyProfile profile) {
        double[] scores = profile.values();

        List<DoublePoint> valid = new ArrayList<>();
        for (double score : scores) {
            if (score > ENTROPY_FLOOR) {
                valid.add(new DoublePoint(new double[]{score}));
            }
        }
        if (valid.isEmpty()) {
            logger.warn("no entropy score exceeds {}, labeling all {} positions low-information",
                ENTROPY_FLOOR, scores.length);
            return DensityLabels.allLow(scores.length);
        }

        KMeansPlusPlusClusterer<DoublePoint> clusterer = new KMeansPlusPlusClusterer<>(
            CLUSTERS, maxIterations, new EuclideanDistance(), new Well19937c(seed));
        List<CentroidCluster<DoublePoint>> clusters = clusterer.cluster(valid);

        double[] centers = new double[clusters.size()];
        for (int k = 0; k < centers.length; k++) {
            centers[k] = clusters.get(k).getCenter().getPoint()[0];
        }
        int high = argmax(centers);
        logger.debug("density centers {}, high-information cluster {}", centers, high);

        int[] labels = new int[scores.length];
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > ENTROPY_FLOOR && nearest(centers, scores[i]) == high) {
                labels[i] = 1;
            }
        }
        return new DensityLabels(labels);
    }

    private static int nearest(double[] centers, double value) {
        int best = 0;
        double bestDistance = Math.abs(value - centers[0]);
        for (int k = 1; k < centers.length; k++) {
            double distance = Math.abs(value - centers[k]);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = k;
            }
        }
        return best;
    }

    private static int argmax(double[] values) {
        int best = 0;
        for (int k = 1; k < values.length; k++) {
            if (values[k] > values[best]) {
                best = k;
            }
        }
        return best;
    }
}
