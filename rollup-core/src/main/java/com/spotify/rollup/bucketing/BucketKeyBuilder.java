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

package com.spotify.rollup.bucketing;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Iterables;
import com.spotify.rollup.RollupTags;
import com.spotify.rollup.statistics.RollupReporter;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives bucket keys and output tags for a single bucketing policy.
 * <p>
 * The key is composed of the base name, the source, and the values of all selected tags in
 * lexicographical order of their keys, joined by {@code _}. A missing atom or source is
 * replaced with a {@code MISSING_<tag>} sentinel and flagged with an SLA violation tag.
 */
@Slf4j
@ToString(of = {"config"})
public class BucketKeyBuilder {
    private static final Set<String> ALWAYS_EXCLUDED =
        ImmutableSet.of(RollupTags.ROLLUP, RollupTags.AGGREGATES);

    private static final Joiner KEY_JOINER = Joiner.on('_');

    private final BucketingConfig config;
    private final RollupReporter reporter;

    public BucketKeyBuilder(final BucketingConfig config, final RollupReporter reporter) {
        this.config = checkNotNull(config, "config");
        this.reporter = checkNotNull(reporter, "reporter");
    }

    /**
     * Build the bucket key.
     *
     * @param baseName Name of the measurement and the field, joined with {@code _}.
     * @param tags All tags of the measurement, used to look up atom and source.
     * @param rollupTags The tags selected by the rollup expression.
     */
    public BucketKey build(
        final String baseName, final Map<String, String> tags, final Map<String, String> rollupTags
    ) {
        final Map<String, String> candidates = new HashMap<>(rollupTags);
        final Map<String, String> extra = new HashMap<>();

        extra.put(RollupTags.ATOM, atom(tags, candidates, extra));

        final String source = source(tags, candidates, extra);
        extra.put(RollupTags.SOURCE, source);

        candidates.keySet().removeAll(config.getExcludeTags());
        candidates.keySet().removeAll(ALWAYS_EXCLUDED);

        final SortedMap<String, String> sorted = new TreeMap<>(candidates);

        final String bucketKey = KEY_JOINER.join(
            Iterables.concat(ImmutableList.of(baseName, source), sorted.values()));

        final Map<String, String> output = new HashMap<>(sorted);
        output.putAll(extra);
        output.put(RollupTags.BUCKET_KEY, bucketKey);
        return new BucketKey(bucketKey, ImmutableSortedMap.copyOf(output));
    }

    private String atom(
        final Map<String, String> tags, final Map<String, String> candidates,
        final Map<String, String> extra
    ) {
        final String atom = tags.get(RollupTags.ATOM);

        if (atom != null) {
            return atom;
        }

        final Optional<String> replacementKey = config.getAtomReplacementTagKey();

        if (replacementKey.isPresent()) {
            final String replacement = tags.get(replacementKey.get());

            if (replacement != null) {
                return replacement;
            }
        }

        final String missing = RollupTags.MISSING_PREFIX + replacementKey.orElse(RollupTags.ATOM);
        replacementKey.ifPresent(k -> candidates.put(k, missing));

        log.debug("Atom tag missing from {}, using {}", tags, missing);
        extra.put(RollupTags.ATOM_SLA_VIOLATION, RollupTags.SLA_VIOLATION_MISSING);
        reporter.reportSlaViolation(RollupTags.ATOM_SLA_VIOLATION);
        return missing;
    }

    private String source(
        final Map<String, String> tags, final Map<String, String> candidates,
        final Map<String, String> extra
    ) {
        final String sourceTagKey = config.getSourceTagKey();
        final String source = tags.get(sourceTagKey);

        if (source != null) {
            return source;
        }

        final String missing = RollupTags.MISSING_PREFIX + sourceTagKey;
        candidates.put(sourceTagKey, missing);

        log.debug("Source tag '{}' missing from {}, using {}", sourceTagKey, tags, missing);
        extra.put(RollupTags.SOURCE_SLA_VIOLATION, RollupTags.SLA_VIOLATION_MISSING);
        reporter.reportSlaViolation(RollupTags.SOURCE_SLA_VIOLATION);
        return missing;
    }
}
