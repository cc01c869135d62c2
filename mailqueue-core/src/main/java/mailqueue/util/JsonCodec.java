package mailqueue.util;

import java.util.List;
import java.util.Map;

/**
 * JSON encoding used for job payloads, job results and the JSON-typed columns of the email
 * tables.
 *
 * @see JacksonJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the shared Jackson-backed instance.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes any value as JSON. Returns {@code null} for a {@code null} value.
     */
    String toJson(Object value);

    /**
     * Parses a flat JSON object into a string map. Returns an empty map for {@code null},
     * empty, or {@code "null"} input. Non-string scalar values are converted to their text form.
     *
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    Map<String, String> parseObject(String json);

    /**
     * Parses a JSON array. Returns an empty list for {@code null} or empty input.
     *
     * @throws IllegalArgumentException if the input cannot be bound to the element type
     */
    <T> List<T> parseList(String json, Class<T> elementType);

    /**
     * Parses a JSON document into {@code type}. Returns {@code null} for {@code null} or empty input.
     *
     * @throws IllegalArgumentException if the input cannot be bound to the type
     */
    <T> T parse(String json, Class<T> type);
}
