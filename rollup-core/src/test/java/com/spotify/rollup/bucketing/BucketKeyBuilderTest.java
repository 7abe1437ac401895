package com.spotify.rollup.bucketing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spotify.rollup.statistics.RollupReporter;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class BucketKeyBuilderTest {
    private static final Map<String, String> TAGS = ImmutableMap.of(
        "az", "sea1", "env", "dev", "host", "ubuntu", "service", "telegraf");

    @Mock
    private RollupReporter reporter;

    private BucketKey build(
        final BucketingConfig config, final Map<String, String> tags,
        final Map<String, String> rollupTags
    ) {
        return new BucketKeyBuilder(config, reporter).build("m1_a", tags, rollupTags);
    }

    @Test
    public void testAllTags() {
        final BucketKey key =
            build(BucketingConfig.of("service", "host", ImmutableList.of()), TAGS, TAGS);

        assertEquals("m1_a_telegraf_sea1_dev_ubuntu_telegraf", key.getKey());
        assertEquals(ImmutableMap.builder()
            .putAll(TAGS)
            .put("atom", "ubuntu")
            .put("source", "telegraf")
            .put("bucket_key", "m1_a_telegraf_sea1_dev_ubuntu_telegraf")
            .build(), key.getTags());
        verifyNoInteractions(reporter);
    }

    @Test
    public void testSelectedTagsWithLookupsInAllTags() {
        final BucketKey key = build(BucketingConfig.of("service", "host", ImmutableList.of()),
            TAGS, ImmutableMap.of("az", "sea1", "foo", "bar"));

        assertEquals("m1_a_telegraf_sea1_bar", key.getKey());
        assertEquals(ImmutableMap.of("az", "sea1", "foo", "bar", "atom", "ubuntu", "source",
            "telegraf", "bucket_key", "m1_a_telegraf_sea1_bar"), key.getTags());
    }

    @Test
    public void testIsDeterministic() {
        final BucketingConfig config = BucketingConfig.of("service", "host", ImmutableList.of());

        final BucketKey a = build(config, TAGS, TAGS);
        final BucketKey b = build(config, ImmutableMap.copyOf(TAGS), ImmutableMap.copyOf(TAGS));

        assertEquals(a, b);
        assertEquals(a.getTags().toString(), b.getTags().toString());
    }

    @Test
    public void testExcludeTags() {
        final BucketKey key =
            build(BucketingConfig.of("service", "host", ImmutableList.of("az")), TAGS, TAGS);

        assertEquals("m1_a_telegraf_dev_ubuntu_telegraf", key.getKey());
        assertFalse(key.getTags().containsKey("az"));
    }

    @Test
    public void testExcludedTagUsedAsAtom() {
        final BucketKey key =
            build(BucketingConfig.of("service", "host", ImmutableList.of("host")), TAGS, TAGS);

        assertEquals("m1_a_telegraf_sea1_dev_telegraf", key.getKey());
        assertEquals("ubuntu", key.getTags().get("atom"));
        assertFalse(key.getTags().containsKey("host"));
    }

    @Test
    public void testAlwaysExcluded() {
        final Map<String, String> tags = ImmutableMap.<String, String>builder()
            .putAll(TAGS)
            .put("aggregates", "timer")
            .put("rollup", "timer:*")
            .build();

        final BucketKey key =
            build(BucketingConfig.of("service", "host", ImmutableList.of()), tags, tags);

        assertEquals("m1_a_telegraf_sea1_dev_ubuntu_telegraf", key.getKey());
        assertFalse(key.getTags().containsKey("rollup"));
        assertFalse(key.getTags().containsKey("aggregates"));
    }

    @Test
    public void testExplicitAtom() {
        final Map<String, String> tags = ImmutableMap.of(
            "az", "sea1", "env", "dev", "service", "telegraf", "atom", "carbon");

        final BucketKey key = build(BucketingConfig.of("service"), tags, tags);

        assertEquals("m1_a_telegraf_carbon_sea1_dev_telegraf", key.getKey());
        assertEquals("carbon", key.getTags().get("atom"));
    }

    @Test
    public void testMissingAtomReplacement() {
        final Map<String, String> tags =
            ImmutableMap.of("az", "sea1", "env", "dev", "service", "telegraf");

        final BucketKey key =
            build(BucketingConfig.of("service", "host", ImmutableList.of()), tags, tags);

        assertEquals("m1_a_telegraf_sea1_dev_MISSING_host_telegraf", key.getKey());
        assertEquals("MISSING_host", key.getTags().get("atom"));
        assertEquals("MISSING_host", key.getTags().get("host"));
        assertEquals("MISSING", key.getTags().get("sla.violation.atom_tag"));
        verify(reporter).reportSlaViolation("sla.violation.atom_tag");
    }

    @Test
    public void testMissingAtomWithoutReplacement() {
        final BucketKey key = build(BucketingConfig.of("service"), TAGS, TAGS);

        assertEquals("m1_a_telegraf_sea1_dev_ubuntu_telegraf", key.getKey());
        assertEquals("MISSING_atom", key.getTags().get("atom"));
        assertEquals("MISSING", key.getTags().get("sla.violation.atom_tag"));
    }

    @Test
    public void testMissingSource() {
        final Map<String, String> tags = ImmutableMap.of("az", "sea1", "env", "dev", "host",
            "ubuntu");

        final BucketKey key =
            build(BucketingConfig.of("service", "host", ImmutableList.of()), tags, tags);

        assertEquals("m1_a_MISSING_service_sea1_dev_ubuntu_MISSING_service", key.getKey());
        assertEquals("MISSING_service", key.getTags().get("source"));
        assertEquals("MISSING_service", key.getTags().get("service"));
        assertEquals("ubuntu", key.getTags().get("atom"));
        assertEquals("MISSING", key.getTags().get("sla.violation.source_tag"));
        assertFalse(key.getTags().containsKey("sla.violation.atom_tag"));
        verify(reporter).reportSlaViolation("sla.violation.source_tag");
    }

    @Test
    public void testOnlySource() {
        final Map<String, String> tags = ImmutableMap.of("service", "telegraf", "atom", "carbon");

        final BucketKey key = build(BucketingConfig.of("service"), tags, ImmutableMap.of());

        assertEquals("m1_a_telegraf", key.getKey());
    }

    @Test
    public void testToStringDescribesPolicy() {
        final BucketKeyBuilder builder = new BucketKeyBuilder(
            BucketingConfig.of("service", "host", ImmutableList.of("az")), reporter);

        assertTrue(builder.toString().contains("sourceTagKey=service"));
        assertTrue(builder.toString().contains("atomReplacementTagKey=Optional[host]"));
    }

    @Test(expected = IllegalStateException.class)
    public void testSourceTagKeyIsRequired() {
        BucketingConfig.of("");
    }
}
