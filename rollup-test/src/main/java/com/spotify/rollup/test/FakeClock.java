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

package com.spotify.rollup.test;

import com.spotify.rollup.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A clock which only moves when told to.
 */
public class FakeClock implements Clock {
    private final AtomicLong now;

    public FakeClock(final long now) {
        this.now = new AtomicLong(now);
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }

    public void set(final long now) {
        this.now.set(now);
    }

    public void advance(final long duration, final TimeUnit unit) {
        now.addAndGet(unit.toMillis(duration));
    }
}
