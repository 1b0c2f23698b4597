package com.redditads.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.redditads.catalog.JsonSchemaTypes;
import com.redditads.catalog.MetadataEntry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Coerces a raw API row to its stream schema. Properties the schema does not declare, and
 * properties deselected in the catalog, are dropped.
 */
@Component
public class RecordConformer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** ISO date, optionally followed by 'T' or ' ', a time and an offset. */
    private static final DateTimeFormatter DATE_TIME_PARSER = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalEnd()
            .toFormatter();

    /**
     * @param schema   stream JSON Schema (an object schema)
     * @param record   raw row
     * @param metadata catalog metadata of the stream; field entries with {@code selected: false} are dropped
     * @throws ConformException when a value fits none of its declared types
     */
    public ObjectNode conform(JsonNode schema, JsonNode record, List<MetadataEntry> metadata) {
        if (record == null || !record.isObject()) {
            throw new ConformException("$", "record is not an object");
        }
        return conformObject(schema, record, List.of(), deselected(metadata), "$");
    }

    private JsonNode conformValue(JsonNode schema, JsonNode value, List<String> breadcrumb,
                                  Set<List<String>> deselected, String path) {
        if (schema.has("anyOf")) {
            ConformException last = null;
            for (JsonNode option : schema.get("anyOf")) {
                try {
                    return conformValue(option, value, breadcrumb, deselected, path);
                } catch (ConformException e) {
                    last = e;
                }
            }
            throw new ConformException(path, "matches no anyOf option"
                    + (last != null ? " (" + last.getMessage() + ")" : ""));
        }
        List<String> types = JsonSchemaTypes.of(schema);
        if (types.isEmpty()) {
            return value == null ? NullNode.getInstance() : value;
        }
        if (value == null || value.isNull() || value.isMissingNode()) {
            if (types.contains("null")) {
                return NullNode.getInstance();
            }
            throw new ConformException(path, "null is not allowed");
        }
        for (String type : types) {
            Optional<JsonNode> converted = convert(type, schema, value, breadcrumb, deselected, path);
            if (converted.isPresent()) {
                return converted.get();
            }
        }
        throw new ConformException(path, "cannot convert " + value.getNodeType() + " to " + types);
    }

    private Optional<JsonNode> convert(String type, JsonNode schema, JsonNode value, List<String> breadcrumb,
                                       Set<List<String>> deselected, String path) {
        switch (type) {
            case "object":
                return value.isObject()
                        ? Optional.of(conformObject(schema, value, breadcrumb, deselected, path))
                        : Optional.empty();
            case "array":
                return value.isArray()
                        ? Optional.of(conformArray(schema, value, breadcrumb, deselected, path))
                        : Optional.empty();
            case "integer":
                return toInteger(value);
            case "number":
                return toDecimal(value).map(NODES::numberNode);
            case "boolean":
                return toBoolean(value);
            case "string":
                return toStringNode(schema, value);
            default:
                return Optional.empty();
        }
    }

    private ObjectNode conformObject(JsonNode schema, JsonNode value, List<String> breadcrumb,
                                     Set<List<String>> deselected, String path) {
        JsonNode properties = schema.get("properties");
        if (properties == null || !properties.isObject()) {
            return value.deepCopy();
        }
        ObjectNode result = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode propertySchema = properties.get(field.getKey());
            if (propertySchema == null) {
                continue;
            }
            List<String> childBreadcrumb = new ArrayList<>(breadcrumb);
            childBreadcrumb.add("properties");
            childBreadcrumb.add(field.getKey());
            if (deselected.contains(childBreadcrumb)) {
                continue;
            }
            result.set(field.getKey(), conformValue(propertySchema, field.getValue(), childBreadcrumb,
                    deselected, path + "." + field.getKey()));
        }
        return result;
    }

    private ArrayNode conformArray(JsonNode schema, JsonNode value, List<String> breadcrumb,
                                   Set<List<String>> deselected, String path) {
        JsonNode items = schema.path("items");
        ArrayNode result = NODES.arrayNode();
        int i = 0;
        for (JsonNode item : value) {
            result.add(items.isObject() ? conformValue(items, item, breadcrumb, deselected, path + "[" + i + "]") : item);
            i++;
        }
        return result;
    }

    private static Optional<JsonNode> toInteger(JsonNode value) {
        if (value.isIntegralNumber()) {
            return Optional.of(value);
        }
        return toDecimal(value)
                .filter(d -> d.stripTrailingZeros().scale() <= 0)
                .map(d -> NODES.numberNode(d.toBigIntegerExact()));
    }

    private static Optional<BigDecimal> toDecimal(JsonNode value) {
        if (value.isNumber()) {
            return Optional.of(value.decimalValue());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(new BigDecimal(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> toBoolean(JsonNode value) {
        if (value.isBoolean()) {
            return Optional.of(value);
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Optional.of(NODES.booleanNode(Boolean.parseBoolean(text)));
            }
        }
        return Optional.empty();
    }

    private static Optional<JsonNode> toStringNode(JsonNode schema, JsonNode value) {
        if (value.isContainerNode()) {
            return Optional.empty();
        }
        if ("date-time".equals(schema.path("format").asText())) {
            return value.isTextual()
                    ? parseDateTime(value.asText()).map(i -> NODES.textNode(i.toString()))
                    : Optional.empty();
        }
        return Optional.of(value.isTextual() ? value : NODES.textNode(value.asText()));
    }

    static Optional<Instant> parseDateTime(String text) {
        try {
            TemporalAccessor parsed = DATE_TIME_PARSER.parseBest(text.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            if (parsed instanceof LocalDateTime) {
                return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Set<List<String>> deselected(List<MetadataEntry> metadata) {
        Set<List<String>> result = new HashSet<>();
        if (metadata == null) {
            return result;
        }
        for (MetadataEntry entry : metadata) {
            if (entry.isStreamLevel()) {
                continue;
            }
            Map<String, Object> md = entry.metadata();
            boolean automatic = "automatic".equals(md.get("inclusion"));
            boolean unsupported = "unsupported".equals(md.get("inclusion"));
            if (unsupported || (!automatic && Boolean.FALSE.equals(md.get("selected")))) {
                result.add(entry.breadcrumb());
            }
        }
        return result;
    }
}
