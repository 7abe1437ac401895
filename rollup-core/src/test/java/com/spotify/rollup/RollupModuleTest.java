package com.spotify.rollup;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import com.google.common.collect.ImmutableList;
import com.spotify.rollup.bucketing.BucketingConfig;
import org.junit.Test;

public class RollupModuleTest {
    @Test
    public void testDefaults() {
        final RollupModule module =
            RollupModule.builder().bucketing(BucketingConfig.of("service")).build();

        assertEquals(30D, module.getCompression(), 0D);
        assertFalse(module.isEmitCentroids());
        assertEquals(ImmutableList.of(BucketingConfig.of("service")), module.getBucketing());
    }

    @Test
    public void testZeroCompression() {
        final RollupModule module =
            RollupModule.builder().compression(0).bucketing(BucketingConfig.of("service")).build();

        assertEquals(0D, module.getCompression(), 0D);
        assertEquals(0, module.aggregator().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCompression() {
        RollupModule.builder().compression(-1).bucketing(BucketingConfig.of("service")).build();
    }

    @Test
    public void testMaximumCompression() {
        final RollupModule module = RollupModule
            .builder()
            .compression(RollupModule.MAX_COMPRESSION)
            .bucketing(BucketingConfig.of("service"))
            .build();

        assertEquals(925D, module.getCompression(), 0D);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCompressionAboveMaximum() {
        RollupModule.builder().compression(1e10).bucketing(BucketingConfig.of("service")).build();
    }

    @Test(expected = IllegalStateException.class)
    public void testBucketingIsRequired() {
        RollupModule.builder().build();
    }

    @Test(expected = IllegalStateException.class)
    public void testBucketingMustNotBeEmpty() {
        RollupModule.builder().bucketing(ImmutableList.of()).build();
    }
}
