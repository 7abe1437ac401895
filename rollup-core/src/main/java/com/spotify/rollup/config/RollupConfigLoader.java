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

package com.spotify.rollup.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spotify.rollup.RollupMappers;
import com.spotify.rollup.RollupModule;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads rollup configuration from YAML (or JSON) documents.
 */
@Slf4j
public final class RollupConfigLoader {
    private static final ObjectMapper MAPPER = RollupMappers.config();

    private RollupConfigLoader() {
    }

    public static RollupModule load(final Path path) throws IOException {
        log.info("Loading rollup configuration from {}", path);

        try (final InputStream input = Files.newInputStream(path)) {
            return load(input);
        }
    }

    /**
     * Parse and validate a configuration document.
     *
     * @throws IOException if the document can't be read or parsed.
     * @throws IllegalStateException if a required option is missing.
     * @throws IllegalArgumentException if an option has an invalid value.
     */
    public static RollupModule load(final InputStream input) throws IOException {
        final RollupModule.Builder builder = MAPPER.readValue(input, RollupModule.Builder.class);
        return builder.build();
    }
}
