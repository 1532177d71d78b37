package datadog.json.stream;

import java.io.OutputStream;
import javax.annotation.Nonnull;

/**
 * Entry point of the streaming JSON writer. The JSON document is written to the output stream as
 * the values are written to the returned root {@link JsonValue}:
 *
 * <pre>{@code
 * JsonValue root = JsonStreamWriter.newStreamWriter(out);
 * root.object(obj -> {
 *   obj.item("name").value("span");
 *   obj.item("tags").array(tags -> tags.value("a").value("b"));
 * });
 * }</pre>
 *
 * <p>The output stream is neither flushed nor closed by the writer.
 */
public final class JsonStreamWriter {
  private JsonStreamWriter() {}

  /**
   * Creates a stream writer marshaling values with the default {@link JsonMarshaller}.
   *
   * @param out The output stream to write the JSON document to.
   * @return The root value of the JSON document.
   */
  public static JsonValue newStreamWriter(@Nonnull OutputStream out) {
    return newStreamWriter(out, JsonMarshaller.getDefault());
  }

  /**
   * Creates a stream writer.
   *
   * @param out The output stream to write the JSON document to.
   * @param marshaller The marshaller to encode strings, numbers and marshaled values with.
   * @return The root value of the JSON document.
   */
  public static JsonValue newStreamWriter(
      @Nonnull OutputStream out, @Nonnull JsonMarshaller marshaller) {
    if (out == null) {
      throw new IllegalArgumentException("out cannot be null");
    }
    if (marshaller == null) {
      throw new IllegalArgumentException("marshaller cannot be null");
    }
    JsonValue root = new JsonValue(new JsonSink(out), marshaller);
    root.bind(new SingleValueContext(root));
    return root;
  }
}
