package datadog.json.stream;

import static java.nio.charset.StandardCharsets.US_ASCII;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * A position in the JSON stream where a value can be written: the document root, the elements of an
 * array, or the value of an object item.
 *
 * <p>The root and object items accept a single value; once written, the handle is finished and any
 * further write is ignored. Array handles accept any number of values. Writes are also ignored while
 * a nested array or object opened from this handle is being populated, and after the callback
 * owning the handle has returned. Misuse never throws and never produces malformed JSON.
 */
public final class JsonValue {
  private static final byte[] NULL = "null".getBytes(US_ASCII);
  private static final byte[] TRUE = "true".getBytes(US_ASCII);
  private static final byte[] FALSE = "false".getBytes(US_ASCII);

  private final JsonMarshaller marshaller;
  private JsonSink sink;
  private JsonContext context;
  private boolean paused;

  JsonValue(JsonSink sink, JsonMarshaller marshaller) {
    this.sink = sink;
    this.marshaller = marshaller;
    this.paused = false;
  }

  /** Creates a handle that ignores every write but still reports the stream error. */
  static JsonValue inert(JsonSink sink, JsonMarshaller marshaller) {
    return new JsonValue(sink, marshaller);
  }

  void bind(JsonContext context) {
    this.context = context;
  }

  void setPaused(boolean paused) {
    this.paused = paused;
  }

  void sever() {
    this.sink = null;
  }

  /**
   * Writes a {@code null} value.
   *
   * @return This handle.
   */
  public JsonValue nullValue() {
    return writeToken(NULL);
  }

  /**
   * Writes a boolean value.
   *
   * @param value The value to write.
   * @return This handle.
   */
  public JsonValue value(boolean value) {
    return writeToken(value ? TRUE : FALSE);
  }

  /**
   * Writes a signed 64-bit integer.
   *
   * @param value The value to write.
   * @return This handle.
   */
  public JsonValue value(long value) {
    return writeToken(Long.toString(value).getBytes(US_ASCII));
  }

  /**
   * Writes an unsigned 64-bit integer.
   *
   * @param value The value to write, its bits read as an unsigned integer.
   * @return This handle.
   */
  public JsonValue unsignedValue(long value) {
    return writeToken(Long.toUnsignedString(value).getBytes(US_ASCII));
  }

  /**
   * Writes a float as a number value. {@code NaN} and infinite values have no JSON representation
   * and are written as {@code null}.
   *
   * @param value The value to write.
   * @return This handle.
   */
  public JsonValue value(float value) {
    if (Float.isNaN(value) || Float.isInfinite(value)) {
      return nullValue();
    }
    if (!canWrite()) {
      return this;
    }
    return writeToken(this.marshaller.encode(value));
  }

  /**
   * Writes a double as a number value. {@code NaN} and infinite values have no JSON representation
   * and are written as {@code null}.
   *
   * @param value The value to write.
   * @return This handle.
   */
  public JsonValue value(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return nullValue();
    }
    if (!canWrite()) {
      return this;
    }
    return writeToken(this.marshaller.encode(value));
  }

  /**
   * Writes a string value, escaping the JSON special characters. Unpaired surrogate characters
   * cannot be encoded in UTF-8 and are written as {@code ?}.
   *
   * @param value The value to write, {@code null} writes a {@code null} value.
   * @return This handle.
   */
  public JsonValue value(@Nullable String value) {
    if (value == null) {
      return nullValue();
    }
    if (!canWrite()) {
      return this;
    }
    return writeToken(this.marshaller.encode(value));
  }

  /**
   * Writes a boxed number.
   *
   * @param value The value to write, {@code null} writes a {@code null} value.
   * @return This handle.
   */
  public JsonValue value(@Nullable Number value) {
    if (value == null) {
      return nullValue();
    } else if (value instanceof Float) {
      return value(value.floatValue());
    } else if (value instanceof Double) {
      return value(value.doubleValue());
    } else if (value instanceof BigInteger || value instanceof BigDecimal) {
      return writeToken(value.toString().getBytes(US_ASCII));
    }
    return value(value.longValue());
  }

  /**
   * Marshals any value and writes it. Nothing is written if marshaling fails, and the handle keeps
   * accepting a value.
   *
   * @param value The value to marshal.
   * @return This handle.
   * @throws JsonMarshalException if the value cannot be marshaled.
   */
  public JsonValue marshal(@Nullable Object value) throws JsonMarshalException {
    if (canWrite()) {
      writeToken(this.marshaller.marshal(value));
    }
    return this;
  }

  /**
   * Writes an array. The callback receives the handle to write the array elements to, and the
   * array is closed when the callback returns.
   *
   * @param elements The callback writing the elements, {@code null} for an empty array.
   * @return This handle.
   */
  public JsonValue array(@Nullable Consumer<JsonValue> elements) {
    if (!canWrite()) {
      return this;
    }
    JsonSink sink = this.sink;
    boolean single = this.context.preWrite(sink);
    this.context.pause(true);
    sink.write('[');
    try {
      if (elements != null) {
        JsonValue array = new JsonValue(sink, this.marshaller);
        array.bind(new ArrayContext(array));
        try {
          elements.accept(array);
        } finally {
          array.sever();
        }
      }
    } finally {
      sink.write(']');
      postWrite(single);
    }
    return this;
  }

  /**
   * Writes an object. The callback receives the handle to add the object items with, and the object
   * is closed when the callback returns.
   *
   * @param items The callback adding the items, {@code null} for an empty object.
   * @return This handle.
   */
  public JsonValue object(@Nullable Consumer<JsonObject> items) {
    if (!canWrite()) {
      return this;
    }
    JsonSink sink = this.sink;
    boolean single = this.context.preWrite(sink);
    this.context.pause(true);
    sink.write('{');
    try {
      if (items != null) {
        JsonObject object = new JsonObject(sink, this.marshaller);
        try {
          items.accept(object);
        } finally {
          object.sever();
        }
      }
    } finally {
      sink.write('}');
      postWrite(single);
    }
    return this;
  }

  /**
   * Checks whether this handle accepts no more values.
   *
   * @return {@code true} once the single value of the handle was written, {@code false} otherwise.
   */
  public boolean isFinished() {
    return this.context == null;
  }

  /**
   * Gets the first error that occurred while writing to the output stream.
   *
   * @return The first write error, or {@code null} if none occurred or if this handle was severed
   *     when its callback returned.
   */
  @Nullable
  public IOException error() {
    return this.sink == null ? null : this.sink.error();
  }

  private boolean canWrite() {
    return this.sink != null
        && this.context != null
        && !this.paused
        && this.context.isWritable();
  }

  private JsonValue writeToken(byte[] token) {
    if (canWrite()) {
      boolean single = this.context.preWrite(this.sink);
      this.sink.write(token);
      postWrite(single);
    }
    return this;
  }

  private void postWrite(boolean single) {
    if (this.context != null) {
      this.context.pause(false);
      if (single) {
        this.context = null;
      }
    }
  }
}
