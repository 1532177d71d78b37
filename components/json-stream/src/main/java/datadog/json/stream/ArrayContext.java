package datadog.json.stream;

/** The {@link JsonContext} of array elements: any number of values, separated by commas. */
final class ArrayContext implements JsonContext {
  private final JsonValue owner;
  private boolean nonEmpty;

  ArrayContext(JsonValue owner) {
    this.owner = owner;
    this.nonEmpty = false;
  }

  @Override
  public boolean isWritable() {
    return true;
  }

  @Override
  public boolean preWrite(JsonSink sink) {
    if (this.nonEmpty) {
      sink.write(',');
    }
    this.nonEmpty = true;
    return false;
  }

  @Override
  public void pause(boolean paused) {
    this.owner.setPaused(paused);
  }
}
