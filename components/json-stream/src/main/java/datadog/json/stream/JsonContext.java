package datadog.json.stream;

/**
 * The {@link JsonContext} decides whether a value can be written through a {@link JsonValue} and
 * writes the separator preceding it. Implementations are {@link SingleValueContext}, {@link
 * ArrayContext} and {@link ObjectItemContext}.
 */
interface JsonContext {
  /**
   * Checks whether the context still accepts a value.
   *
   * @return {@code true} if a value can be written, {@code false} to drop the write.
   */
  boolean isWritable();

  /**
   * Prepares the sink for the next value, writing any separator it needs.
   *
   * @param sink The sink to write the separator to.
   * @return {@code true} if the context accepts a single value only, {@code false} if more values
   *     may follow.
   */
  boolean preWrite(JsonSink sink);

  /**
   * Blocks or unblocks the writes owned by this context while a nested scope is populated.
   *
   * @param paused {@code true} to block writes, {@code false} to allow them again.
   */
  void pause(boolean paused);
}
