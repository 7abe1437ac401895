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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.rollup.aggregation.AggregationCell;
import com.spotify.rollup.aggregation.CacheKey;
import com.spotify.rollup.bucketing.BucketKey;
import com.spotify.rollup.bucketing.BucketKeyBuilder;
import com.spotify.rollup.bucketing.BucketingConfig;
import com.spotify.rollup.macro.RollupMacro;
import com.spotify.rollup.macro.RollupSelection;
import com.spotify.rollup.metric.Measurement;
import com.spotify.rollup.metric.MetricsAccumulator;
import com.spotify.rollup.statistics.RollupReporter;
import com.spotify.rollup.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * Aggregates measurements into t-digests, one per bucket and one-minute window.
 * <p>
 * Every numeric field of a measurement is added to one cell per bucketing policy. Cells are
 * kept until {@link #reset()} is called, {@link #push(MetricsAccumulator)} emits all of them.
 * <p>
 * This class is thread-safe.
 */
@Slf4j
@ToString(of = {"compression", "emitCentroids", "builders"})
public class RollupAggregator {
    public static final long WINDOW = TimeUnit.MINUTES.toMillis(1);

    private final Object createLock = new Object();

    private final double compression;
    private final boolean emitCentroids;
    private final List<BucketKeyBuilder> builders;
    private final RollupMacro macro;
    private final Clock clock;
    private final RollupReporter reporter;
    private final ObjectMapper mapper;

    private final ConcurrentMap<CacheKey, AggregationCell> cells = new ConcurrentHashMap<>();

    public RollupAggregator(
        final double compression, final boolean emitCentroids,
        final List<BucketingConfig> bucketing, final Clock clock, final RollupReporter reporter
    ) {
        checkArgument(compression >= 0, "compression must be non-negative: %s", compression);
        checkArgument(!bucketing.isEmpty(), "at least one bucketing policy is required");

        this.compression = compression;
        this.emitCentroids = emitCentroids;
        this.clock = checkNotNull(clock, "clock");
        this.reporter = checkNotNull(reporter, "reporter");
        this.macro = new RollupMacro(reporter);
        this.mapper = RollupMappers.json();

        final ImmutableList.Builder<BucketKeyBuilder> builders = ImmutableList.builder();

        for (final BucketingConfig config : bucketing) {
            builders.add(new BucketKeyBuilder(config, reporter));
        }

        this.builders = builders.build();
    }

    /**
     * Add all numeric fields of the given measurement.
     * <p>
     * Fields which are not numbers, or not finite, are skipped.
     */
    public void add(final Measurement measurement) {
        final long window = window(measurement.getTimestamp());
        final RollupSelection selection = macro.resolve(measurement.getTags());

        final Map<String, String> outputExtras = selection
            .getFamily()
            .label()
            .map(label -> ImmutableMap.of(RollupTags.AGGREGATES, label))
            .orElseGet(ImmutableMap::of);

        final Optional<String> host = Optional.ofNullable(selection.getTags().get(RollupTags.HOST));

        if (AggregationCell.Variant.of(selection.getFamily()) == AggregationCell.Variant.LOCAL
            && !host.isPresent()) {
            log.debug("{}: local aggregation without a host tag", measurement.getName());
            reporter.reportSlaViolation(RollupTags.HOST_SLA_VIOLATION);
        }

        for (final Map.Entry<String, Object> field : measurement.getFields().entrySet()) {
            if (!(field.getValue() instanceof Number)) {
                log.trace("{}: skipping non-numeric field {}", measurement.getName(),
                    field.getKey());
                continue;
            }

            final double value = ((Number) field.getValue()).doubleValue();

            if (!Double.isFinite(value)) {
                log.debug("{}: skipping non-finite value {} of field {}", measurement.getName(),
                    value, field.getKey());
                continue;
            }

            final String baseName = measurement.getName() + "_" + field.getKey();

            for (final BucketKeyBuilder builder : builders) {
                final BucketKey key =
                    builder.build(baseName, selection.getTags(), selection.getRollupTags());

                final AggregationCell cell =
                    getOrCreate(new CacheKey(key.getKey(), window), () -> {
                        final ImmutableMap.Builder<String, String> tags = ImmutableMap.builder();
                        tags.putAll(key.getTags());
                        tags.putAll(outputExtras);
                        return new AggregationCell(baseName, selection.getFamily(), tags.build(),
                            host, window, clock.currentTimeMillis(), compression);
                    });

                cell.add(value);
            }
        }
    }

    /**
     * Emit all cells to the given accumulator.
     * <p>
     * Cells are not removed, call {@link #reset()} to start over.
     */
    public void push(final MetricsAccumulator accumulator) {
        final long now = clock.currentTimeMillis();

        int emitted = 0;

        for (final AggregationCell cell : cells.values()) {
            cell.emit(accumulator, mapper, emitCentroids);

            final long age = TimeUnit.MILLISECONDS.toMinutes(now - cell.getCreationTime());
            reporter.reportFlushDelay(age - 1);
            emitted++;
        }

        log.debug("Pushed {} cell(s)", emitted);
    }

    /**
     * Drop all cells.
     */
    public void reset() {
        cells.clear();
    }

    /**
     * Number of cells currently held.
     */
    public int size() {
        return cells.size();
    }

    /**
     * Look up a cell, for single-statistic consumers.
     */
    public Optional<AggregationCell> cell(final String bucketKey, final long timestamp) {
        return Optional.ofNullable(cells.get(new CacheKey(bucketKey, window(timestamp))));
    }

    /**
     * Truncate the given timestamp to the start of its window.
     */
    public static long window(final long timestamp) {
        return Math.floorDiv(timestamp, WINDOW) * WINDOW;
    }

    private AggregationCell getOrCreate(
        final CacheKey key, final Supplier<AggregationCell> supplier
    ) {
        final AggregationCell cell = cells.get(key);

        if (cell != null) {
            return cell;
        }

        synchronized (createLock) {
            final AggregationCell checked = cells.get(key);

            if (checked != null) {
                return checked;
            }

            final AggregationCell created = supplier.get();
            cells.put(key, created);
            return created;
        }
    }
}
