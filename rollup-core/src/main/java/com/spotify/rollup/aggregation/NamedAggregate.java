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

import com.spotify.rollup.aggregation.tdigest.TDigest;
import java.util.Optional;

/**
 * Single statistics which can be computed from an aggregation cell.
 */
public enum NamedAggregate {
    MIN("min", (digest, sum) -> digest.min()),
    MAX("max", (digest, sum) -> digest.max()),
    SUM("sum", (digest, sum) -> sum),
    COUNT("count", (digest, sum) -> digest.count()),
    MEDIAN("median", (digest, sum) -> digest.quantile(0.5)),
    P90("p90", (digest, sum) -> digest.quantile(0.9)),
    P95("p95", (digest, sum) -> digest.quantile(0.95)),
    P99("p99", (digest, sum) -> digest.quantile(0.99));

    private final String name;
    private final Statistic statistic;

    NamedAggregate(final String name, final Statistic statistic) {
        this.name = name;
        this.statistic = statistic;
    }

    public String getName() {
        return name;
    }

    double apply(final TDigest digest, final double sum) {
        return statistic.compute(digest, sum);
    }

    public static Optional<NamedAggregate> fromName(final String name) {
        for (final NamedAggregate aggregate : values()) {
            if (aggregate.name.equals(name)) {
                return Optional.of(aggregate);
            }
        }

        return Optional.empty();
    }

    @FunctionalInterface
    interface Statistic {
        double compute(TDigest digest, double sum);
    }
}
