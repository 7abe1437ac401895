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

package com.spotify.rollup.metric;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.Data;

/**
 * A single tagged measurement with one or more fields.
 * <p>
 * Tags and fields are copied into immutable maps on construction, so instances can be shared
 * freely between threads.
 */
@Data
public class Measurement {
    private final String name;
    private final Map<String, String> tags;
    private final Map<String, Object> fields;
    private final long timestamp;

    public Measurement(
        final String name, final Map<String, String> tags, final Map<String, Object> fields,
        final long timestamp
    ) {
        this.name = checkNotNull(name, "name");
        this.tags = ImmutableMap.copyOf(checkNotNull(tags, "tags"));
        this.fields = ImmutableMap.copyOf(checkNotNull(fields, "fields"));
        this.timestamp = timestamp;
    }

    public static Measurement of(
        final String name, final Map<String, String> tags, final Map<String, Object> fields,
        final long timestamp
    ) {
        return new Measurement(name, tags, fields, timestamp);
    }
}
