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
import java.util.Comparator;
import lombok.Data;

/**
 * A cluster of values, summarized by their mean and total weight.
 */
@Data
public class Centroid {
    static final Comparator<Centroid> BY_MEAN = Comparator.comparingDouble(Centroid::getMean);

    private final double mean;
    private final double weight;

    @JsonCreator
    public Centroid(
        @JsonProperty("mean") final double mean, @JsonProperty("weight") final double weight
    ) {
        this.mean = mean;
        this.weight = weight;
    }
}
