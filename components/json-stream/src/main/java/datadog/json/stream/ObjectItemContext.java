package datadog.json.stream;

/**
 * The {@link JsonContext} of an object item: exactly one value, preceded by the item key. The comma
 * before the key depends on the owning {@link JsonObject}, not on the item itself.
 */
final class ObjectItemContext implements JsonContext {
  private final JsonObject owner;
  private final String key;

  ObjectItemContext(JsonObject owner, String key) {
    this.owner = owner;
    this.key = key;
  }

  @Override
  public boolean isWritable() {
    return this.owner.isActiveItem(this);
  }

  @Override
  public boolean preWrite(JsonSink sink) {
    this.owner.beginItem();
    sink.write(this.owner.marshaller().encode(this.key));
    sink.write(':');
    return true;
  }

  @Override
  public void pause(boolean paused) {
    this.owner.setPaused(paused);
  }
}
