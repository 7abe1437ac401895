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

package com.spotify.rollup;

import static java.util.Optional.empty;
import static java.util.Optional.of;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.spotify.rollup.bucketing.BucketingConfig;
import com.spotify.rollup.statistics.NoopRollupReporter;
import com.spotify.rollup.statistics.RollupReporter;
import com.spotify.rollup.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.Data;

/**
 * Validated configuration of the rollup engine.
 */
@Data
public class RollupModule {
    public static final double DEFAULT_COMPRESSION = 30D;
    /**
     * Upper limit of the compression, beyond which the temporary buffer stops growing.
     */
    public static final double MAX_COMPRESSION = 925D;
    public static final boolean DEFAULT_EMIT_CENTROIDS = false;

    private final double compression;
    private final boolean emitCentroids;
    private final List<BucketingConfig> bucketing;

    public RollupAggregator aggregator(final Clock clock, final RollupReporter reporter) {
        return new RollupAggregator(compression, emitCentroids, bucketing, clock, reporter);
    }

    public RollupAggregator aggregator() {
        return aggregator(Clock.system(), NoopRollupReporter.get());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Optional<Double> compression = empty();
        private Optional<Boolean> emitCentroids = empty();
        private Optional<List<BucketingConfig>> bucketing = empty();

        public Builder() {
        }

        @JsonCreator
        public Builder(
            @JsonProperty("compression") Optional<Double> compression,
            @JsonProperty("emit_centroids") Optional<Boolean> emitCentroids,
            @JsonProperty("bucketing") Optional<List<BucketingConfig>> bucketing
        ) {
            this.compression = compression;
            this.emitCentroids = emitCentroids;
            this.bucketing = bucketing;
        }

        public Builder compression(final double compression) {
            this.compression = of(compression);
            return this;
        }

        public Builder emitCentroids(final boolean emitCentroids) {
            this.emitCentroids = of(emitCentroids);
            return this;
        }

        public Builder bucketing(final List<BucketingConfig> bucketing) {
            this.bucketing = of(bucketing);
            return this;
        }

        public Builder bucketing(final BucketingConfig... bucketing) {
            return bucketing(ImmutableList.copyOf(bucketing));
        }

        public RollupModule build() {
            final double compression = this.compression.orElse(DEFAULT_COMPRESSION);

            if (!(compression >= 0) || Double.isInfinite(compression)) {
                throw new IllegalArgumentException(
                    "compression: must be a finite, non-negative number: " + compression);
            }

            if (compression > MAX_COMPRESSION) {
                throw new IllegalArgumentException(
                    "compression: must not exceed " + MAX_COMPRESSION + ": " + compression);
            }

            final List<BucketingConfig> bucketing = this.bucketing
                .filter(b -> !b.isEmpty())
                .orElseThrow(() -> new IllegalStateException(
                    "bucketing: at least one policy is required"));

            return new RollupModule(compression, emitCentroids.orElse(DEFAULT_EMIT_CENTROIDS),
                ImmutableList.copyOf(bucketing));
        }
    }
}
