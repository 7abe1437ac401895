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

import static java.util.Optional.empty;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.Data;

/**
 * A policy describing how measurements are grouped into buckets.
 */
@Data
public class BucketingConfig {
    /**
     * Tags which never take part in the bucket key.
     */
    private final Set<String> excludeTags;
    /**
     * Tag whose value identifies the source of the measurement.
     */
    private final String sourceTagKey;
    /**
     * Tag used as atom when the measurement has no atom tag.
     */
    private final Optional<String> atomReplacementTagKey;

    @JsonCreator
    public BucketingConfig(
        @JsonProperty("exclude_tags") final Optional<List<String>> excludeTags,
        @JsonProperty("source_tag_key") final Optional<String> sourceTagKey,
        @JsonProperty("atom_replacement_tag_key") final Optional<String> atomReplacementTagKey
    ) {
        this.excludeTags = ImmutableSet.copyOf(
            Optional.ofNullable(excludeTags).flatMap(x -> x).orElseGet(ImmutableList::of));
        this.sourceTagKey = Optional
            .ofNullable(sourceTagKey)
            .flatMap(x -> x)
            .filter(key -> !key.isEmpty())
            .orElseThrow(() -> new IllegalStateException("source_tag_key: is required"));
        this.atomReplacementTagKey = Optional
            .ofNullable(atomReplacementTagKey)
            .flatMap(x -> x)
            .filter(key -> !key.isEmpty());
    }

    public static BucketingConfig of(final String sourceTagKey) {
        return new BucketingConfig(empty(), Optional.of(sourceTagKey), empty());
    }

    public static BucketingConfig of(
        final String sourceTagKey, final String atomReplacementTagKey,
        final Collection<String> excludeTags
    ) {
        return new BucketingConfig(Optional.of(ImmutableList.copyOf(excludeTags)),
            Optional.of(sourceTagKey), Optional.of(atomReplacementTagKey));
    }
}
