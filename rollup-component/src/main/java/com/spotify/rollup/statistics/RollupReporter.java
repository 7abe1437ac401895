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

package com.spotify.rollup.statistics;

/**
 * Receives internal statistics from the rollup engine.
 */
public interface RollupReporter {
    /**
     * Report how late a cell was flushed, relative to its creation.
     *
     * @param delayMinutes Whole minutes between cell creation and flush, minus one.
     */
    void reportFlushDelay(long delayMinutes);

    /**
     * Report that a required tag was missing and replaced with a sentinel value.
     *
     * @param violation Name of the violation marker, such as {@code sla.violation.atom_tag}.
     */
    void reportSlaViolation(String violation);

    /**
     * Report a rollup tag that could not be parsed, or named an unknown macro.
     */
    void reportInvalidRollup(String rollup);
}
