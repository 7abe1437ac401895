/*
 * Copyright (c) 2015 Spotify AB.
 *
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
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

package com.spotify.rollup.aggregation.tdigest;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * A t-digest using the merging implementation.
 * <p>
 * Values are first collected in an unsorted temporary buffer, which is merged into the sorted
 * list of main centroids when it fills up or when a query requires it. The size of the main
 * list is bounded by the compression.
 * <p>
 * This class is not thread-safe, all access must be guarded by the caller.
 *
 * @see <a href="https://github.com/tdunning/t-digest">t-digest</a>
 */
public class TDigest {
    static final double MIN_TEMP_COMPRESSION = 20;
    static final double MAX_TEMP_COMPRESSION = 925;

    private final double compression;
    private final Random random;

    /* sorted by mean */
    private double[] mainMeans;
    private double[] mainWeights;
    private int mainSize;
    private double mainWeight;

    private final Centroid[] temps;
    private int tempSize;
    private double tempWeight;

    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public TDigest(final double compression) {
        this(compression, new Random());
    }

    public TDigest(final double compression, final Random random) {
        checkArgument(compression >= 0 && Double.isFinite(compression),
            "compression must be a finite, non-negative number: %s", compression);
        this.compression = compression;
        this.random = checkNotNull(random, "random");

        final int bound = Math.max(sizeBound(compression), 1);
        this.mainMeans = new double[bound];
        this.mainWeights = new double[bound];
        this.temps = new Centroid[estimateTempBuffer(compression)];
    }

    /**
     * Upper bound of the number of main centroids for the given compression.
     */
    public static int sizeBound(final double compression) {
        return (int) (Math.PI * compression / 2 + 0.5);
    }

    /**
     * Capacity of the temporary buffer, a heuristic from Dunning's paper. 925 is the maximum
     * point of the quadratic.
     */
    static int estimateTempBuffer(final double compression) {
        final double c =
            Math.min(MAX_TEMP_COMPRESSION, Math.max(MIN_TEMP_COMPRESSION, compression));
        return (int) (7.5 + 0.37 * c - 2e-4 * c * c);
    }

    static TDigest restore(
        final double compression, final List<Centroid> centroids, final double min,
        final double max
    ) {
        final TDigest digest = new TDigest(compression);

        double previous = Double.NEGATIVE_INFINITY;

        for (final Centroid c : centroids) {
            checkArgument(!Double.isNaN(c.getMean()) && !Double.isInfinite(c.getMean()),
                "invalid centroid mean: %s", c.getMean());
            checkArgument(c.getWeight() > 0 && Double.isFinite(c.getWeight()),
                "invalid centroid weight: %s", c.getWeight());
            checkArgument(c.getMean() >= previous, "centroids are not sorted by mean");
            previous = c.getMean();
            digest.appendMain(c.getMean(), c.getWeight());
            digest.mainWeight += c.getWeight();
        }

        digest.min = min;
        digest.max = max;
        return digest;
    }

    /**
     * Add a value with a unit weight.
     */
    public void add(final double value) {
        add(value, 1D);
    }

    /**
     * Add a value with the given weight.
     *
     * @throws IllegalArgumentException if value is not finite, or if weight is not positive.
     */
    public void add(final double value, final double weight) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("invalid value added: " + value);
        }

        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("invalid weight added: " + weight);
        }

        if (tempSize == temps.length) {
            mergeTemps();
        }

        min = Math.min(min, value);
        max = Math.max(max, value);

        temps[tempSize++] = new Centroid(value, weight);
        tempWeight += weight;
    }

    /**
     * Merge another digest into this one.
     * <p>
     * Main centroids of the other digest are added in random order, to avoid feeding sorted
     * input into the merge. Neither digest may be modified concurrently.
     */
    public void merge(final TDigest other) {
        checkNotNull(other, "other");
        checkArgument(other != this, "cannot merge a digest into itself");

        for (final int index : shuffledIndices(other.mainSize)) {
            add(other.mainMeans[index], other.mainWeights[index]);
        }

        for (int i = 0; i < other.tempSize; i++) {
            add(other.temps[i].getMean(), other.temps[i].getWeight());
        }

        if (other.count() > 0) {
            min = Math.min(min, other.min);
            max = Math.max(max, other.max);
        }
    }

    /**
     * Approximate value below which the given fraction of all values fall.
     *
     * @param q quantile, between 0 and 1 inclusive.
     * @return estimated value, or {@code NaN} if the digest is empty.
     */
    public double quantile(final double q) {
        if (q < 0 || q > 1) {
            throw new IllegalArgumentException("quantile out of bounds: " + q);
        }

        mergeTemps();

        if (mainSize == 0) {
            return Double.NaN;
        }

        final double target = q * mainWeight;

        double weightSoFar = 0;
        double lowerBound = min;

        for (int i = 0; i < mainSize; i++) {
            final double upperBound = upperBound(i);

            if (target <= weightSoFar + mainWeights[i]) {
                final double proportion = (target - weightSoFar) / mainWeights[i];
                return lowerBound + proportion * (upperBound - lowerBound);
            }

            weightSoFar += mainWeights[i];
            lowerBound = upperBound;
        }

        // rounding in the accumulated weight can leave q = 1 just past the last centroid
        return max;
    }

    /**
     * Approximate fraction of values which are below the given value.
     *
     * @return estimated fraction, or {@code NaN} if the digest is empty.
     */
    public double cdf(final double value) {
        mergeTemps();

        if (mainSize == 0) {
            return Double.NaN;
        }

        if (value <= min) {
            return 0;
        }

        if (value >= max) {
            return 1;
        }

        double weightSoFar = 0;
        double lowerBound = min;

        for (int i = 0; i < mainSize; i++) {
            final double upperBound = upperBound(i);

            if (value < upperBound) {
                weightSoFar += mainWeights[i] * (value - lowerBound) / (upperBound - lowerBound);
                return weightSoFar / mainWeight;
            }

            weightSoFar += mainWeights[i];
            lowerBound = upperBound;
        }

        return 1;
    }

    public double compression() {
        return compression;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    /**
     * Total weight of all added values, merged or not.
     */
    public double count() {
        return mainWeight + tempWeight;
    }

    /**
     * Merge pending values and return the main centroids, sorted by mean.
     */
    public List<Centroid> centroids() {
        mergeTemps();

        final ImmutableList.Builder<Centroid> centroids = ImmutableList.builder();

        for (int i = 0; i < mainSize; i++) {
            centroids.add(new Centroid(mainMeans[i], mainWeights[i]));
        }

        return centroids.build();
    }

    /**
     * Merge pending values and build a serializable view of this digest.
     */
    public TDigestSnapshot snapshot() {
        final List<Centroid> centroids = centroids();
        return new TDigestSnapshot(compression, centroids, mainWeight, min, max);
    }

    void mergeTemps() {
        if (tempSize == 0) {
            return;
        }

        Arrays.sort(temps, 0, tempSize, Centroid.BY_MEAN);

        final double totalWeight = mainWeight + tempWeight;

        final double[] inputMeans = mainMeans;
        final double[] inputWeights = mainWeights;
        final int inputSize = mainSize;

        mainMeans = new double[inputMeans.length];
        mainWeights = new double[inputWeights.length];
        mainSize = 0;

        double mergedWeight = 0;
        double lastMergedIndex = 0;

        int m = 0;
        int t = 0;

        while (m < inputSize || t < tempSize) {
            final double mean;
            final double weight;

            // ties are taken from the temporary buffer
            if (m < inputSize && (t >= tempSize || inputMeans[m] < temps[t].getMean())) {
                mean = inputMeans[m];
                weight = inputWeights[m];
                m++;
            } else {
                mean = temps[t].getMean();
                weight = temps[t].getWeight();
                t++;
            }

            lastMergedIndex = mergeOne(mergedWeight, totalWeight, lastMergedIndex, mean, weight);
            mergedWeight += weight;
        }

        Arrays.fill(temps, 0, tempSize, null);
        tempSize = 0;
        tempWeight = 0;
        mainWeight = totalWeight;
    }

    /**
     * Merge a single centroid into the tail of the main list, or append it as a new centroid if
     * the tail would become too wide.
     *
     * @return the index of the last quantile merged into the previous centroid.
     */
    private double mergeOne(
        final double beforeWeight, final double totalWeight, final double beforeIndex,
        final double mean, final double weight
    ) {
        final double nextIndex = indexEstimate((beforeWeight + weight) / totalWeight);

        if (nextIndex - beforeIndex > 1 || mainSize == 0) {
            appendMain(mean, weight);
            return indexEstimate(beforeWeight / totalWeight);
        }

        // welford's method, weight must be updated before mean
        final int last = mainSize - 1;
        mainWeights[last] += weight;
        mainMeans[last] += (mean - mainMeans[last]) * weight / mainWeights[last];
        return beforeIndex;
    }

    private double indexEstimate(final double quantile) {
        return compression * (Math.asin(2 * quantile - 1) / Math.PI + 0.5);
    }

    /**
     * Each centroid is assumed to hold a uniform distribution, bounded by the midpoints to its
     * neighbours, or by min and max at the ends.
     */
    private double upperBound(final int i) {
        if (i != mainSize - 1) {
            return (mainMeans[i + 1] + mainMeans[i]) / 2;
        }

        return max;
    }

    private void appendMain(final double mean, final double weight) {
        if (mainSize == mainMeans.length) {
            final int capacity = mainMeans.length * 2;
            mainMeans = Arrays.copyOf(mainMeans, capacity);
            mainWeights = Arrays.copyOf(mainWeights, capacity);
        }

        mainMeans[mainSize] = mean;
        mainWeights[mainSize] = weight;
        mainSize++;
    }

    private int[] shuffledIndices(final int size) {
        final int[] indices = new int[size];

        for (int i = 0; i < size; i++) {
            indices[i] = i;
        }

        for (int i = size - 1; i > 0; i--) {
            final int j = random.nextInt(i + 1);
            final int swap = indices[i];
            indices[i] = indices[j];
            indices[j] = swap;
        }

        return indices;
    }

    @Override
    public String toString() {
        return "TDigest(compression=" + compression + ", count=" + count() + ", min=" + min +
            ", max=" + max + ")";
    }
}
