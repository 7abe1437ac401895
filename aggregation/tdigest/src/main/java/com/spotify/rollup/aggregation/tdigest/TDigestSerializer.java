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

package com.spotify.rollup.aggregation.tdigest;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary codec for digest snapshots.
 * <p>
 * Layout, big-endian: number of centroids (int32), each centroid as mean and weight (float64
 * each), followed by compression, min and max (float64 each). Pending values are merged before
 * encoding.
 */
public class TDigestSerializer {
    private static final int HEADER_SIZE = Integer.BYTES;
    private static final int CENTROID_SIZE = 2 * Double.BYTES;
    private static final int TRAILER_SIZE = 3 * Double.BYTES;

    public byte[] serialize(final TDigest digest) {
        final List<Centroid> centroids = digest.centroids();

        final ByteBuffer buffer = ByteBuffer.allocate(
            HEADER_SIZE + centroids.size() * CENTROID_SIZE + TRAILER_SIZE);

        buffer.putInt(centroids.size());

        for (final Centroid c : centroids) {
            buffer.putDouble(c.getMean());
            buffer.putDouble(c.getWeight());
        }

        buffer.putDouble(digest.compression());
        buffer.putDouble(digest.min());
        buffer.putDouble(digest.max());
        return buffer.array();
    }

    /**
     * Decode a digest.
     *
     * @throws IllegalArgumentException if the input is truncated, has trailing bytes, or encodes
     * invalid centroids.
     */
    public TDigest deserialize(final byte[] bytes) {
        final ByteBuffer buffer = ByteBuffer.wrap(bytes);

        try {
            final int count = buffer.getInt();

            if (count < 0 || count > (buffer.remaining() - TRAILER_SIZE) / CENTROID_SIZE) {
                throw new IllegalArgumentException("invalid number of centroids: " + count);
            }

            final List<Centroid> centroids = new ArrayList<>(count);

            for (int i = 0; i < count; i++) {
                centroids.add(new Centroid(buffer.getDouble(), buffer.getDouble()));
            }

            final double compression = buffer.getDouble();
            final double min = buffer.getDouble();
            final double max = buffer.getDouble();

            if (buffer.hasRemaining()) {
                throw new IllegalArgumentException(
                    "trailing bytes after digest: " + buffer.remaining());
            }

            return TDigest.restore(compression, centroids, min, max);
        } catch (final BufferUnderflowException e) {
            throw new IllegalArgumentException("truncated digest", e);
        }
    }
}
