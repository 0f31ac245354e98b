package eventlog.util;

import java.util.Map;

/**
 * Converts event metadata maps to and from the JSON text stored in the
 * {@code metadata} column.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and
 * only handles flat string-to-string objects. Applications with Jackson or Gson on
 * the classpath can plug in their own implementation through the JDBC store constructors.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes metadata as a JSON object. Returns {@code null} for a null or empty map.
     */
    String toJson(Map<String, String> metadata);

    /**
     * Parses a JSON object into a map. Returns an empty map for {@code null}, blank
     * or {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a flat JSON object of strings
     */
    Map<String, String> parseObject(String json);
}
