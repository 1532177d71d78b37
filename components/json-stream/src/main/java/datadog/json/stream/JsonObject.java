package datadog.json.stream;

import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The handle given to {@link JsonValue#object} callbacks to add items to the object being written.
 *
 * <p>Only the most recently added item accepts a value: adding an item drops any previous item that
 * did not get one. Items cannot be added while the value of another item is still being populated,
 * nor once the callback has returned.
 */
public final class JsonObject {
  private final JsonMarshaller marshaller;
  private JsonSink sink;
  private boolean nonEmpty;
  private boolean paused;
  private ObjectItemContext activeItem;

  JsonObject(JsonSink sink, JsonMarshaller marshaller) {
    this.sink = sink;
    this.marshaller = marshaller;
    this.nonEmpty = false;
    this.paused = false;
  }

  /**
   * Adds an item to the object. The item is only written once a value is written to the returned
   * handle.
   *
   * @param key The item key.
   * @return The handle to write the item value to.
   */
  public JsonValue item(@Nonnull String key) {
    if (key == null) {
      throw new IllegalArgumentException("key cannot be null");
    }
    if (this.sink == null || this.paused) {
      return JsonValue.inert(this.sink, this.marshaller);
    }
    JsonValue item = new JsonValue(this.sink, this.marshaller);
    ObjectItemContext context = new ObjectItemContext(this, key);
    item.bind(context);
    this.activeItem = context;
    return item;
  }

  /**
   * Marshals a map and adds its entries as items of the object.
   *
   * @param items The map to marshal.
   * @return This handle.
   * @throws JsonMarshalException if the map cannot be marshaled.
   */
  public JsonObject marshal(@Nullable Map<String, ?> items) throws JsonMarshalException {
    if (items == null || items.isEmpty()) {
      return this;
    }
    byte[] json = this.marshaller.marshal(items);
    // Strip the braces and keep the item list only
    if (json.length > 2 && json[0] == '{' && isWritable()) {
      beginItem();
      this.sink.write(json, 1, json.length - 2);
    }
    return this;
  }

  JsonMarshaller marshaller() {
    return this.marshaller;
  }

  boolean isActiveItem(ObjectItemContext context) {
    return isWritable() && this.activeItem == context;
  }

  void beginItem() {
    if (this.nonEmpty) {
      this.sink.write(',');
    }
    this.nonEmpty = true;
  }

  void setPaused(boolean paused) {
    this.paused = paused;
  }

  void sever() {
    this.sink = null;
    this.activeItem = null;
  }

  private boolean isWritable() {
    return this.sink != null && !this.paused;
  }
}
