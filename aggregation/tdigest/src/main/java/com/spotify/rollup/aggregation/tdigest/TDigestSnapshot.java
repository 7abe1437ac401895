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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Data;

/**
 * Serializable view of a fully merged digest.
 */
@Data
@JsonPropertyOrder({"compression", "centroids", "weight", "min", "max"})
public class TDigestSnapshot {
    private final double compression;
    private final List<Centroid> centroids;
    private final double weight;
    private final double min;
    private final double max;

    @JsonCreator
    public TDigestSnapshot(
        @JsonProperty("compression") final double compression,
        @JsonProperty("centroids") final List<Centroid> centroids,
        @JsonProperty("weight") final double weight, @JsonProperty("min") final double min,
        @JsonProperty("max") final double max
    ) {
        this.compression = compression;
        this.centroids = centroids == null ? ImmutableList.of() : ImmutableList.copyOf(centroids);
        this.weight = weight;
        this.min = min;
        this.max = max;
    }

    /**
     * Build a new digest holding the centroids of this snapshot.
     * <p>
     * The stored weight is ignored and recomputed from the centroids.
     */
    public TDigest toDigest() {
        return TDigest.restore(compression, centroids, min, max);
    }
}
