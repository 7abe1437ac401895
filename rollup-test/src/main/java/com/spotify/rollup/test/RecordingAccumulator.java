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

package com.spotify.rollup.test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.rollup.metric.MetricsAccumulator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Data;

/**
 * Accumulator which keeps every emitted point in memory.
 */
public class RecordingAccumulator implements MetricsAccumulator {
    private final List<Point> points = new ArrayList<>();

    @Override
    public synchronized void emit(
        final String name, final Map<String, Object> fields, final Map<String, String> tags
    ) {
        points.add(new Point(name, ImmutableMap.copyOf(fields), ImmutableMap.copyOf(tags),
            Optional.empty()));
    }

    @Override
    public synchronized void emit(
        final String name, final Map<String, Object> fields, final Map<String, String> tags,
        final long timestamp
    ) {
        points.add(new Point(name, ImmutableMap.copyOf(fields), ImmutableMap.copyOf(tags),
            Optional.of(timestamp)));
    }

    public synchronized List<Point> points() {
        return ImmutableList.copyOf(points);
    }

    public synchronized List<Point> points(final String name) {
        return points.stream().filter(p -> p.getName().equals(name)).collect(Collectors.toList());
    }

    /**
     * Find the single point with exactly the given name and tags.
     */
    public synchronized Optional<Point> find(final String name, final Map<String, String> tags) {
        final List<Point> matches = points
            .stream()
            .filter(p -> p.getName().equals(name) && p.getTags().equals(tags))
            .collect(Collectors.toList());

        if (matches.size() > 1) {
            throw new IllegalStateException(
                "More than one point named " + name + " with tags " + tags);
        }

        return matches.stream().findFirst();
    }

    /**
     * Check if a point with exactly the given name, fields and tags has been emitted.
     */
    public synchronized boolean contains(
        final String name, final Map<String, Object> fields, final Map<String, String> tags
    ) {
        return points
            .stream()
            .anyMatch(p -> p.getName().equals(name) && p.getFields().equals(fields) &&
                p.getTags().equals(tags));
    }

    public synchronized int size() {
        return points.size();
    }

    public synchronized void clear() {
        points.clear();
    }

    @Data
    public static class Point {
        private final String name;
        private final Map<String, Object> fields;
        private final Map<String, String> tags;
        private final Optional<Long> timestamp;
    }
}
