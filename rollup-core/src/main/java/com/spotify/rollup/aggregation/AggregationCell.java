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

package com.spotify.rollup.aggregation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.spotify.rollup.RollupFields;
import com.spotify.rollup.RollupTags;
import com.spotify.rollup.aggregation.tdigest.Centroid;
import com.spotify.rollup.aggregation.tdigest.TDigest;
import com.spotify.rollup.macro.AggregationFamily;
import com.spotify.rollup.metric.MetricsAccumulator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Aggregation state for a single bucket and window.
 * <p>
 * All access to the digest is synchronized on the cell.
 */
@ToString(of = {"variant", "baseName", "window", "tags"})
public class AggregationCell {
    public enum Variant {
        /**
         * Emits the digest with the window start as timestamp, for downstream merging.
         */
        WINDOWED,
        /**
         * Emits summary statistics for the local host, stamped by the receiver.
         */
        LOCAL;

        public static Variant of(final AggregationFamily family) {
            return family == AggregationFamily.NONE ? LOCAL : WINDOWED;
        }
    }

    @Getter
    private final Variant variant;
    @Getter
    private final String baseName;
    @Getter
    private final AggregationFamily family;
    @Getter
    private final Map<String, String> tags;
    @Getter
    private final long window;
    @Getter
    private final long creationTime;

    private final Optional<String> host;
    private final TDigest digest;

    private double sum = 0D;

    public AggregationCell(
        final String baseName, final AggregationFamily family, final Map<String, String> tags,
        final Optional<String> host, final long window, final long creationTime,
        final double compression
    ) {
        this.variant = Variant.of(checkNotNull(family, "family"));
        this.baseName = checkNotNull(baseName, "baseName");
        this.family = family;
        this.tags = ImmutableMap.copyOf(checkNotNull(tags, "tags"));
        this.host = checkNotNull(host, "host");
        this.window = window;
        this.creationTime = creationTime;
        this.digest = new TDigest(compression);
    }

    public synchronized void add(final double value) {
        digest.add(value, 1D);
        sum += value;
    }

    public synchronized double aggregate(final NamedAggregate aggregate) {
        return aggregate.apply(digest, sum);
    }

    /**
     * Compute a statistic by name.
     *
     * @throws IllegalArgumentException if no statistic has the given name.
     */
    public double aggregate(final String name) {
        final NamedAggregate aggregate = NamedAggregate
            .fromName(name)
            .orElseThrow(() -> new IllegalArgumentException("No such aggregate: " + name));
        return aggregate(aggregate);
    }

    /**
     * Emit the content of this cell.
     *
     * @param mapper Mapper used to serialize the digest snapshot.
     * @param perCentroid Emit one point per centroid instead of a serialized snapshot.
     */
    public synchronized void emit(
        final MetricsAccumulator accumulator, final ObjectMapper mapper, final boolean perCentroid
    ) {
        switch (variant) {
            case LOCAL:
                emitLocal(accumulator);
                break;
            case WINDOWED:
                if (perCentroid) {
                    emitCentroids(accumulator);
                } else {
                    emitSnapshot(accumulator, mapper);
                }
                break;
            default:
                throw new IllegalStateException("Unsupported variant: " + variant);
        }
    }

    private void emitSnapshot(final MetricsAccumulator accumulator, final ObjectMapper mapper) {
        final String centroids;

        try {
            centroids = mapper.writeValueAsString(digest.snapshot());
        } catch (final JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize digest for " + baseName, e);
        }

        final Map<String, Object> fields = new LinkedHashMap<>();

        if (family.includes(RollupFields.SUM)) {
            fields.put(RollupFields.SUM + RollupFields.UTILITY_SUFFIX, sum);
        }

        fields.put(RollupFields.COMPRESSION, digest.compression());
        fields.put(RollupFields.CENTROIDS, centroids);

        accumulator.emit(baseName, fields, tags, window);
    }

    private void emitCentroids(final MetricsAccumulator accumulator) {
        final List<Centroid> centroids = digest.centroids();

        for (int i = 0; i < centroids.size(); i++) {
            final Centroid c = centroids.get(i);

            final Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(RollupFields.MEAN, c.getMean());
            fields.put(RollupFields.WEIGHT, c.getWeight());

            final Map<String, String> centroidTags = new HashMap<>(tags);
            centroidTags.put(RollupTags.CENTROID, Integer.toString(i));

            accumulator.emit(baseName, fields, centroidTags, window);
        }

        if (family.includes(RollupFields.SUM)) {
            final Map<String, Object> fields = ImmutableMap.of(RollupFields.SUM, sum);
            accumulator.emit(baseName, fields, tags, window);
        }
    }

    private void emitLocal(final MetricsAccumulator accumulator) {
        final Map<String, String> localTags = new HashMap<>(tags);
        localTags.remove(RollupTags.BUCKET_KEY);
        localTags.remove(RollupTags.AGGREGATES);

        // never attributed to the rollup source
        if (host.isPresent()) {
            localTags.put(RollupTags.SOURCE, host.get());
        } else {
            localTags.put(RollupTags.SOURCE, RollupTags.MISSING_PREFIX + RollupTags.HOST);
            localTags.put(RollupTags.HOST_SLA_VIOLATION, RollupTags.SLA_VIOLATION_MISSING);
        }

        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(RollupFields.MAX, digest.max());
        fields.put(RollupFields.MIN, digest.min());
        fields.put(RollupFields.COUNT, digest.count());
        fields.put(RollupFields.MEDIAN, digest.quantile(0.5));

        accumulator.emit(baseName, fields, localTags);
    }
}
