package mailqueue.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
    static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultMapper());

    private final ObjectMapper mapper;

    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Mapper that tolerates unknown properties, which is what every consumer of provider
     * responses in this library wants.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }

    @Override
    public Map<String, String> parseObject(String json) {
        Map<String, String> result = new LinkedHashMap<>();
        if (isBlank(json)) {
            return result;
        }
        JsonNode node = readTree(json);
        if (node.isNull()) {
            return result;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object but got " + node.getNodeType());
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            result.put(field.getKey(), value.isNull() ? null : value.isValueNode() ? value.asText() : value.toString());
        }
        return result;
    }

    @Override
    public <T> List<T> parseList(String json, Class<T> elementType) {
        if (isBlank(json)) {
            return List.of();
        }
        CollectionType type = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            List<T> values = mapper.readValue(json, type);
            return values == null ? List.of() : values;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON array: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public <T> T parse(String json, Class<T> type) {
        if (isBlank(json)) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON for " + type.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean isBlank(String json) {
        return json == null || json.isBlank() || "null".equals(json.trim());
    }
}
