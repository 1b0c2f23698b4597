package com.redditads.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redditads.catalog.MetadataEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordConformerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RecordConformer conformer = new RecordConformer();

    private static final String SCHEMA = """
            {"type":["null","object"],"properties":{
              "id":{"type":["null","string"]},
              "clicks":{"type":["null","integer"]},
              "ctr":{"type":["null","number"]},
              "is_active":{"type":["null","boolean"]},
              "start_time":{"type":["null","string"],"format":"date-time"},
              "targeting":{"type":["null","object"],"properties":{
                "geos":{"type":["null","array"],"items":{"type":["null","string"]}},
                "devices":{"type":["null","array"],"items":{"type":["null","string"]}}
              }},
              "required_id":{"type":"string"},
              "budget":{"anyOf":[{"type":"integer"},{"type":"string"}]}
            }}""";

    private ObjectNode conform(String record) throws Exception {
        return conformer.conform(mapper.readTree(SCHEMA), mapper.readTree(record), List.of());
    }

    private ObjectNode conform(String record, List<MetadataEntry> metadata) throws Exception {
        return conformer.conform(mapper.readTree(SCHEMA), mapper.readTree(record), metadata);
    }

    @Test
    void keepsDeclaredFieldsAndDropsUndeclared() throws Exception {
        ObjectNode result = conform("{\"id\":\"a1\",\"clicks\":3,\"surprise\":true}");

        assertThat(result.path("id").asText()).isEqualTo("a1");
        assertThat(result.path("clicks").asInt()).isEqualTo(3);
        assertThat(result.has("surprise")).isFalse();
    }

    @Test
    void absentFieldsStayAbsent() throws Exception {
        ObjectNode result = conform("{\"id\":\"a1\"}");

        assertThat(result.size()).isEqualTo(1);
    }

    @Test
    void nullAllowedByNullableType() throws Exception {
        ObjectNode result = conform("{\"clicks\":null}");

        assertThat(result.get("clicks").isNull()).isTrue();
    }

    @Test
    void nullRejectedWhenTypeIsNotNullable() {
        assertThatThrownBy(() -> conform("{\"required_id\":null}"))
                .isInstanceOf(ConformException.class)
                .satisfies(e -> assertThat(((ConformException) e).getPath()).isEqualTo("$.required_id"));
    }

    @ParameterizedTest
    @CsvSource({"\"42\",42", "42.0,42", "\"100\",100"})
    void integersAcceptNumericTextAndWholeDecimals(String raw, long expected) throws Exception {
        ObjectNode result = conform("{\"clicks\":" + raw + "}");

        assertThat(result.get("clicks").isIntegralNumber()).isTrue();
        assertThat(result.get("clicks").asLong()).isEqualTo(expected);
    }

    @Test
    void fractionalValueIsNotAnInteger() {
        assertThatThrownBy(() -> conform("{\"clicks\":1.5}"))
                .isInstanceOf(ConformException.class)
                .hasMessageContaining("$.clicks");
    }

    @Test
    void numbersBecomeDecimals() throws Exception {
        ObjectNode result = conform("{\"ctr\":\"0.125\"}");

        assertThat(result.get("ctr").decimalValue()).isEqualByComparingTo(new BigDecimal("0.125"));
    }

    @Test
    void booleansAcceptTextualForms() throws Exception {
        ObjectNode result = conform("{\"is_active\":\"TRUE\"}");

        assertThat(result.get("is_active").isBoolean()).isTrue();
        assertThat(result.get("is_active").booleanValue()).isTrue();
    }

    @Test
    void nonBooleanTextIsRejected() {
        assertThatThrownBy(() -> conform("{\"is_active\":\"yes\"}")).isInstanceOf(ConformException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "2024-01-05T10:15:30Z, 2024-01-05T10:15:30Z",
            "2024-01-05T10:15:30+02:00, 2024-01-05T08:15:30Z",
            "2024-01-05 10:15:30, 2024-01-05T10:15:30Z",
            "2024-01-05, 2024-01-05T00:00:00Z"
    })
    @DisplayName("date-time strings normalize to UTC instants")
    void dateTimesAreNormalized(String raw, String expected) throws Exception {
        ObjectNode result = conform("{\"start_time\":\"" + raw + "\"}");

        assertThat(result.get("start_time").asText()).isEqualTo(expected);
    }

    @Test
    void unparseableDateTimeIsRejected() {
        assertThatThrownBy(() -> conform("{\"start_time\":\"next tuesday\"}"))
                .isInstanceOf(ConformException.class)
                .hasMessageContaining("start_time");
    }

    @Test
    void scalarsAreStringifiedForStringFields() throws Exception {
        ObjectNode result = conform("{\"id\":12345}");

        assertThat(result.get("id").isTextual()).isTrue();
        assertThat(result.get("id").asText()).isEqualTo("12345");
    }

    @Test
    void nestedObjectsAndArraysAreConformed() throws Exception {
        ObjectNode result = conform("{\"targeting\":{\"geos\":[\"US\",7],\"extra\":1}}");

        JsonNode targeting = result.get("targeting");
        assertThat(targeting.has("extra")).isFalse();
        assertThat(targeting.get("geos")).hasSize(2);
        assertThat(targeting.get("geos").get(1).asText()).isEqualTo("7");
    }

    @Test
    void anyOfTakesFirstMatchingOption() throws Exception {
        assertThat(conform("{\"budget\":5}").get("budget").isIntegralNumber()).isTrue();
        assertThat(conform("{\"budget\":\"unlimited\"}").get("budget").asText()).isEqualTo("unlimited");
    }

    @Test
    void anyOfWithNoMatchReportsLastFailure() {
        assertThatThrownBy(() -> conform("{\"budget\":{\"a\":1}}"))
                .isInstanceOf(ConformException.class)
                .hasMessageContaining("anyOf");
    }

    @Test
    void deselectedFieldsAreDropped() throws Exception {
        List<MetadataEntry> metadata = List.of(
                new MetadataEntry(List.of(), Map.of("selected", true)),
                new MetadataEntry(List.of("properties", "ctr"), Map.of("inclusion", "available", "selected", false)),
                new MetadataEntry(List.of("properties", "id"), Map.of("inclusion", "automatic", "selected", false)),
                new MetadataEntry(List.of("properties", "targeting", "properties", "devices"),
                        Map.of("inclusion", "available", "selected", false)),
                new MetadataEntry(List.of("properties", "clicks"), Map.of("inclusion", "unsupported")));

        ObjectNode result = conform(
                "{\"id\":\"a1\",\"ctr\":0.5,\"clicks\":3,\"targeting\":{\"geos\":[\"US\"],\"devices\":[\"ios\"]}}",
                metadata);

        assertThat(result.has("ctr")).isFalse();
        assertThat(result.has("clicks")).isFalse();
        assertThat(result.path("id").asText()).isEqualTo("a1");
        assertThat(result.get("targeting").has("devices")).isFalse();
        assertThat(result.get("targeting").has("geos")).isTrue();
    }

    @Test
    void nonObjectRecordIsRejected() {
        assertThatThrownBy(() -> conformer.conform(mapper.readTree(SCHEMA), mapper.readTree("[1,2]"), List.of()))
                .isInstanceOf(ConformException.class);
    }
}
