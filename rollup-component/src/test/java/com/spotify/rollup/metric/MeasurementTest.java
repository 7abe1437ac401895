package com.spotify.rollup.metric;

import static org.junit.Assert.assertEquals;

import java.util.HashMap;
import java.util.Map;
import org.junit.Test;

public class MeasurementTest {
    @Test
    public void testCopiesMaps() {
        final Map<String, String> tags = new HashMap<>();
        tags.put("host", "a");
        final Map<String, Object> fields = new HashMap<>();
        fields.put("value", 1D);

        final Measurement m = Measurement.of("cpu", tags, fields, 42L);

        tags.put("host", "b");
        fields.clear();

        assertEquals("a", m.getTags().get("host"));
        assertEquals(1D, m.getFields().get("value"));
        assertEquals(42L, m.getTimestamp());
    }

    @Test(expected = NullPointerException.class)
    public void testNameIsRequired() {
        Measurement.of(null, new HashMap<>(), new HashMap<>(), 0L);
    }

    @Test(expected = NullPointerException.class)
    public void testNullTagValuesAreRejected() {
        final Map<String, String> tags = new HashMap<>();
        tags.put("host", null);
        Measurement.of("cpu", tags, new HashMap<>(), 0L);
    }
}
