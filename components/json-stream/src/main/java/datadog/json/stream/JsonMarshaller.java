package datadog.json.stream;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonWriter;
import com.squareup.moshi.Moshi;
import java.io.IOException;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import okio.Buffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes values to JSON text using Moshi. It marshals the values given to {@link
 * JsonValue#marshal(Object)} and {@link JsonObject#marshal(java.util.Map)}, and escapes strings and
 * formats floating point numbers for the stream writer.
 *
 * <p>Custom {@link JsonAdapter}s registered on the {@link Moshi} instance given to {@link
 * #JsonMarshaller(Moshi)} apply to marshaled values.
 */
public final class JsonMarshaller {
  private static final Logger LOGGER = LoggerFactory.getLogger(JsonMarshaller.class);
  private static final JsonMarshaller DEFAULT = new JsonMarshaller(new Moshi.Builder().build());

  private final JsonAdapter<Object> adapter;

  /**
   * Creates a marshaller.
   *
   * @param moshi The Moshi instance providing the adapters for marshaled values.
   */
  public JsonMarshaller(@Nonnull Moshi moshi) {
    if (moshi == null) {
      throw new IllegalArgumentException("moshi cannot be null");
    }
    this.adapter = moshi.adapter(Object.class).serializeNulls();
  }

  /**
   * Gets the marshaller backed by a default {@link Moshi} instance.
   *
   * @return The default marshaller.
   */
  public static JsonMarshaller getDefault() {
    return DEFAULT;
  }

  /**
   * Marshals a value to JSON text.
   *
   * @param value The value to marshal.
   * @return The UTF-8 JSON text of the value.
   * @throws JsonMarshalException if the value cannot be marshaled.
   */
  public byte[] marshal(@Nullable Object value) throws JsonMarshalException {
    Buffer buffer = new Buffer();
    try {
      this.adapter.toJson(buffer, value);
    } catch (IOException | RuntimeException e) {
      String type = value == null ? "null" : value.getClass().getName();
      LOGGER.debug("Failed to marshal value of type {}", type, e);
      throw new JsonMarshalException("Failed to marshal value of type " + type, e);
    }
    return buffer.readByteArray();
  }

  byte[] encode(String value) {
    Buffer buffer = new Buffer();
    try (JsonWriter writer = JsonWriter.of(buffer)) {
      writer.value(value);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to encode string", e);
    }
    return buffer.readByteArray();
  }

  byte[] encode(float value) {
    Buffer buffer = new Buffer();
    try (JsonWriter writer = JsonWriter.of(buffer)) {
      writer.value(Float.valueOf(value));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to encode number", e);
    }
    return buffer.readByteArray();
  }

  byte[] encode(double value) {
    Buffer buffer = new Buffer();
    try (JsonWriter writer = JsonWriter.of(buffer)) {
      writer.value(value);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to encode number", e);
    }
    return buffer.readByteArray();
  }
}
