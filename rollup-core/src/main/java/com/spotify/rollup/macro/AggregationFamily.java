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

package com.spotify.rollup.macro;

import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import java.util.Set;

/**
 * The kind of aggregation requested by the macro part of a rollup tag.
 */
public enum AggregationFamily {
    TIMER("timer", ImmutableSet.of()),
    COUNTER("counter", ImmutableSet.of("sum")),
    GAUGE("gauge", ImmutableSet.of()),
    UNSUPPORTED("unsupported", ImmutableSet.of()),
    /**
     * Aggregated locally, without a family label.
     */
    NONE(null, ImmutableSet.of());

    private final Optional<String> label;
    private final Set<String> aggregates;

    AggregationFamily(final String label, final Set<String> aggregates) {
        this.label = Optional.ofNullable(label);
        this.aggregates = aggregates;
    }

    /**
     * The value of the {@code aggregates} tag on emitted points, if any.
     */
    public Optional<String> label() {
        return label;
    }

    /**
     * Check if the family asks for the given statistic next to the digest.
     */
    public boolean includes(final String aggregate) {
        return aggregates.contains(aggregate);
    }

    public static AggregationFamily fromMacro(final String macro) {
        switch (macro) {
            case "timer":
                return TIMER;
            case "counter":
                return COUNTER;
            case "gauge":
            case "default":
                return GAUGE;
            case "local":
                return NONE;
            default:
                return UNSUPPORTED;
        }
    }
}
