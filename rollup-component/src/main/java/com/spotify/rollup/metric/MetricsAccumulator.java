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

import java.util.Map;

/**
 * Sink for aggregated output points.
 */
public interface MetricsAccumulator {
    /**
     * Emit a point which is stamped with the current time by the receiver.
     */
    void emit(String name, Map<String, Object> fields, Map<String, String> tags);

    /**
     * Emit a point with an explicit timestamp, in milliseconds since epoch.
     */
    void emit(String name, Map<String, Object> fields, Map<String, String> tags, long timestamp);
}
