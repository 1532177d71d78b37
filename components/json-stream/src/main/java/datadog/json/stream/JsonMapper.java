package datadog.json.stream;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.util.Collection;
import java.util.Map;
import java.util.function.Consumer;

/** Utility class for simple Java structure mapping into JSON strings. */
public final class JsonMapper {
  private static final int INITIAL_CAPACITY = 256;

  private JsonMapper() {}

  /**
   * Writes a JSON document to a string.
   *
   * @param document The callback writing the document to its root value.
   * @return The JSON document as Java string, empty if the callback wrote nothing.
   */
  public static String toJson(Consumer<JsonValue> document) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(INITIAL_CAPACITY);
    document.accept(JsonStreamWriter.newStreamWriter(out));
    return new String(out.toByteArray(), UTF_8);
  }

  /**
   * Converts a {@link Map} to a JSON object.
   *
   * @param map The map to convert.
   * @return The converted JSON object as Java string.
   */
  public static String toJson(Map<String, ?> map) {
    if (map == null || map.isEmpty()) {
      return "{}";
    }
    return toJson(
        root ->
            root.object(
                object -> {
                  for (Map.Entry<String, ?> entry : map.entrySet()) {
                    writeValue(object.item(entry.getKey()), entry.getValue());
                  }
                }));
  }

  /**
   * Converts a {@link Collection<String>} to a JSON array.
   *
   * @param items The collection to convert.
   * @return The converted JSON array as Java string.
   */
  public static String toJson(Collection<String> items) {
    if (items == null || items.isEmpty()) {
      return "[]";
    }
    return toJson(
        root ->
            root.array(
                array -> {
                  for (String item : items) {
                    array.value(item);
                  }
                }));
  }

  /**
   * Converts a String array to a JSON array.
   *
   * @param items The array to convert.
   * @return The converted JSON array as Java string.
   */
  public static String toJson(String[] items) {
    if (items == null) {
      return "[]";
    }
    return toJson(
        root ->
            root.array(
                array -> {
                  for (String item : items) {
                    array.value(item);
                  }
                }));
  }

  private static void writeValue(JsonValue target, Object value) {
    if (value == null) {
      target.nullValue();
    } else if (value instanceof String) {
      target.value((String) value);
    } else if (value instanceof Number) {
      target.value((Number) value);
    } else if (value instanceof Boolean) {
      target.value((boolean) (Boolean) value);
    } else {
      target.value(value.toString());
    }
  }
}
