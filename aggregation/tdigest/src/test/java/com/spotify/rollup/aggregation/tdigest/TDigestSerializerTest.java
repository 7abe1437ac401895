package com.spotify.rollup.aggregation.tdigest;

import static org.junit.Assert.assertEquals;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Random;
import org.junit.Test;

public class TDigestSerializerTest {
    private final TDigestSerializer serializer = new TDigestSerializer();

    @Test
    public void testLayout() {
        final TDigest digest = new TDigest(100);
        digest.add(3);
        digest.add(1);
        digest.add(2);

        final ByteBuffer buffer = ByteBuffer.wrap(serializer.serialize(digest));

        assertEquals(4 + 3 * 16 + 3 * 8, buffer.remaining());
        assertEquals(3, buffer.getInt());
        assertEquals(1D, buffer.getDouble(), 0D);
        assertEquals(1D, buffer.getDouble(), 0D);
        assertEquals(2D, buffer.getDouble(), 0D);
        assertEquals(1D, buffer.getDouble(), 0D);
        assertEquals(3D, buffer.getDouble(), 0D);
        assertEquals(1D, buffer.getDouble(), 0D);
        assertEquals(100D, buffer.getDouble(), 0D);
        assertEquals(1D, buffer.getDouble(), 0D);
        assertEquals(3D, buffer.getDouble(), 0D);
    }

    @Test
    public void testRestore() {
        final Random random = new Random(1);
        final TDigest digest = new TDigest(50, random);

        for (int i = 0; i < 1_000; i++) {
            digest.add(random.nextGaussian());
        }

        final TDigest restored = serializer.deserialize(serializer.serialize(digest));

        assertEquals(digest.centroids(), restored.centroids());
        assertEquals(digest.compression(), restored.compression(), 0D);
        assertEquals(digest.min(), restored.min(), 0D);
        assertEquals(digest.max(), restored.max(), 0D);
        assertEquals(digest.count(), restored.count(), 1e-9);
        assertEquals(digest.quantile(0.9), restored.quantile(0.9), 0D);
    }

    @Test
    public void testRestoredDigestAcceptsValues() {
        final TDigest digest = new TDigest(30);
        digest.add(5);

        final TDigest restored = serializer.deserialize(serializer.serialize(digest));
        restored.add(7);

        assertEquals(2D, restored.count(), 0D);
        assertEquals(7D, restored.max(), 0D);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTruncated() {
        final TDigest digest = new TDigest(30);
        digest.add(5);

        final byte[] bytes = serializer.serialize(digest);
        serializer.deserialize(Arrays.copyOf(bytes, bytes.length - 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTrailingBytes() {
        final TDigest digest = new TDigest(30);
        digest.add(5);

        final byte[] bytes = serializer.serialize(digest);
        serializer.deserialize(Arrays.copyOf(bytes, bytes.length + 8));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCount() {
        final ByteBuffer buffer = ByteBuffer.allocate(4 + 24);
        buffer.putInt(-1);
        serializer.deserialize(buffer.array());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyInput() {
        serializer.deserialize(new byte[0]);
    }
}
