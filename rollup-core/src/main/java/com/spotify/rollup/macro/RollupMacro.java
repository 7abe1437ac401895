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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.spotify.rollup.RollupTags;
import com.spotify.rollup.statistics.RollupReporter;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves rollup tags of the form {@code <macro>:<expression>}.
 * <p>
 * The macro names an {@link AggregationFamily}. The expression selects the tags that take part
 * in the rollup: {@code *} selects all tags, and {@code a;b;c*} selects the listed tags, where a
 * trailing {@code *} matches every tag with the given prefix. An expression prefixed with
 * {@code *-} selects all tags except the listed ones.
 */
@Slf4j
public class RollupMacro {
    public static final String DEFAULT_ROLLUP = "default:*";
    public static final String BAD_DATA_MACRO = "bad_data";
    public static final String ALL = "*";
    public static final String SUBTRACTIVE_PREFIX = "*-";

    private static final Splitter DIMENSION_SPLITTER = Splitter.on(';').omitEmptyStrings();

    private final RollupReporter reporter;

    public RollupMacro(final RollupReporter reporter) {
        this.reporter = checkNotNull(reporter, "reporter");
    }

    /**
     * Resolve the rollup tag among the given tags.
     * <p>
     * The given map is not modified. Measurements without a rollup tag are handled as
     * {@value #DEFAULT_ROLLUP}, malformed rollup tags are aggregated as unsupported over all
     * tags.
     */
    public RollupSelection resolve(final Map<String, String> tags) {
        final Map<String, String> view = withoutRollup(tags);
        final String rollup = tags.get(RollupTags.ROLLUP);

        if (rollup == null) {
            log.debug("No rollup tag in {}, using {}", tags, DEFAULT_ROLLUP);
            return select(AggregationFamily.GAUGE, ALL, view);
        }

        final int index = rollup.indexOf(':');

        if (index <= 0) {
            log.warn("Malformed rollup tag '{}', aggregating as {}", rollup, BAD_DATA_MACRO);
            reporter.reportInvalidRollup(rollup);
            return select(AggregationFamily.fromMacro(BAD_DATA_MACRO), ALL, view);
        }

        final String macro = rollup.substring(0, index);
        final AggregationFamily family = AggregationFamily.fromMacro(macro);

        if (family == AggregationFamily.UNSUPPORTED) {
            log.warn("Unsupported rollup macro '{}' in rollup tag '{}'", macro, rollup);
            reporter.reportInvalidRollup(rollup);
        }

        return select(family, rollup.substring(index + 1), view);
    }

    private RollupSelection select(
        final AggregationFamily family, final String expression, final Map<String, String> view
    ) {
        return new RollupSelection(family, expression, view, reduceToRollupTags(view, expression));
    }

    /**
     * Reduce the given tags to the ones selected by the expression.
     */
    public static Map<String, String> reduceToRollupTags(
        final Map<String, String> tags, final String expression
    ) {
        final boolean subtractive = expression.startsWith(SUBTRACTIVE_PREFIX);
        final String dimensions =
            subtractive ? expression.substring(SUBTRACTIVE_PREFIX.length()) : expression;

        final Set<String> selected = resolveDimensions(tags.keySet(), dimensions);

        final ImmutableMap.Builder<String, String> result = ImmutableMap.builder();

        for (final Map.Entry<String, String> e : tags.entrySet()) {
            if (selected.contains(e.getKey()) != subtractive) {
                result.put(e);
            }
        }

        return result.build();
    }

    /**
     * Find all keys which start with the part of the pattern before its first {@code *}.
     */
    public static Set<String> expandWildcard(final Set<String> keys, final String pattern) {
        final int index = pattern.indexOf('*');
        final String prefix = index < 0 ? pattern : pattern.substring(0, index);

        final ImmutableSet.Builder<String> matches = ImmutableSet.builder();

        for (final String key : keys) {
            if (key.startsWith(prefix)) {
                matches.add(key);
            }
        }

        return matches.build();
    }

    private static Set<String> resolveDimensions(final Set<String> keys, final String dimensions) {
        if (ALL.equals(dimensions)) {
            return keys;
        }

        final Set<String> resolved = new HashSet<>();

        for (final String dimension : DIMENSION_SPLITTER.split(dimensions)) {
            if (dimension.contains(ALL)) {
                resolved.addAll(expandWildcard(keys, dimension));
            } else {
                resolved.add(dimension);
            }
        }

        return resolved;
    }

    private static Map<String, String> withoutRollup(final Map<String, String> tags) {
        final ImmutableMap.Builder<String, String> view = ImmutableMap.builder();

        for (final Map.Entry<String, String> e : tags.entrySet()) {
            if (!RollupTags.ROLLUP.equals(e.getKey())) {
                view.put(e);
            }
        }

        return view.build();
    }
}
