package datadog.json.stream;

/** The {@link JsonContext} of a document root: exactly one value, without separator. */
final class SingleValueContext implements JsonContext {
  private final JsonValue owner;

  SingleValueContext(JsonValue owner) {
    this.owner = owner;
  }

  @Override
  public boolean isWritable() {
    return true;
  }

  @Override
  public boolean preWrite(JsonSink sink) {
    return true;
  }

  @Override
  public void pause(boolean paused) {
    this.owner.setPaused(paused);
  }
}
