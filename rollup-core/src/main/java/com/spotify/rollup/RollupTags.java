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

/**
 * Names of tags read from measurements and attached to emitted points.
 */
public final class RollupTags {
    public static final String ROLLUP = "rollup";
    public static final String ATOM = "atom";
    public static final String HOST = "host";

    public static final String SOURCE = "source";
    public static final String BUCKET_KEY = "bucket_key";
    public static final String AGGREGATES = "aggregates";
    public static final String CENTROID = "centroid";

    public static final String ATOM_SLA_VIOLATION = "sla.violation.atom_tag";
    public static final String SOURCE_SLA_VIOLATION = "sla.violation.source_tag";
    public static final String HOST_SLA_VIOLATION = "sla.violation.host_tag";
    public static final String SLA_VIOLATION_MISSING = "MISSING";

    /**
     * Prefix of the value substituted for a required tag which is missing.
     */
    public static final String MISSING_PREFIX = "MISSING_";

    private RollupTags() {
    }
}
