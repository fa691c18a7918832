package com.dosify.node.record;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RecordsTest {

    @Test
    void jsonKeepsValueKinds() throws Exception {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("name", FieldValue.of("Insulin glargine"));
        fields.put("units", FieldValue.of(24));
        fields.put("refrigerated", FieldValue.of(true));
        fields.put("notes", FieldValue.nullValue());
        fields.put("pen", FieldValue.ofMap(Map.of("brand", FieldValue.of("Lantus"))));

        String json = Records.toJson(fields);

        assertThat(json).contains("\"units\":24.0", "\"notes\":null", "\"brand\":\"Lantus\"");
        assertThat(Records.fromJson(json)).isEqualTo(fields);
    }

    @Test
    void arraysAreKeptAsText() throws Exception {
        Map<String, FieldValue> fields = Records.fromJson("{\"times\":[\"08:00\",\"20:00\"]}");

        assertThat(fields.get("times")).isEqualTo(FieldValue.of("[\"08:00\",\"20:00\"]"));
    }

    @Test
    void nonObjectJsonIsRejected() {
        assertThatThrownBy(() -> Records.fromJson("[1,2]")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lastUpdateStampingAndStripping() {
        Instant now = Instant.parse("2024-03-01T08:00:00Z");
        Map<String, FieldValue> stamped = Records.withLastUpdate(Map.of("name", FieldValue.of("A")), now);

        assertThat(Records.lastUpdate(stamped)).contains(now);
        assertThat(Records.withoutLastUpdate(stamped)).containsOnlyKeys("name");
        assertThat(Records.lastUpdate(Map.of(Records.LAST_UPDATE, FieldValue.of("yesterday")))).isEmpty();
    }

    @Test
    void wholeNumbersRenderWithoutFraction() {
        assertThat(FieldValue.of(500).asText()).isEqualTo("500");
        assertThat(FieldValue.of(2.5).asText()).isEqualTo("2.5");
        assertThat(FieldValue.nullValue().asText()).isEmpty();
    }
}
