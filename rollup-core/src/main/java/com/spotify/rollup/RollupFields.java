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
 * Names of fields on emitted points.
 */
public final class RollupFields {
    public static final String COMPRESSION = "compression";
    public static final String CENTROIDS = "centroids";
    public static final String MEAN = "mean";
    public static final String WEIGHT = "weight";
    public static final String SUM = "sum";

    /**
     * Suffix marking a derived field that is carried next to the digest.
     */
    public static final String UTILITY_SUFFIX = "_util";

    public static final String MAX = "max";
    public static final String MIN = "min";
    public static final String COUNT = "count";
    public static final String MEDIAN = "median";

    private RollupFields() {
    }
}
