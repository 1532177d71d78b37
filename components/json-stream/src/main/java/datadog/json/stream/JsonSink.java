package datadog.json.stream;

import java.io.IOException;
import java.io.OutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards writes to the caller's {@link OutputStream} and latches the first {@link IOException}.
 * Writes keep being attempted after a failure so the emitted structure stays balanced.
 */
final class JsonSink {
  private static final Logger LOGGER = LoggerFactory.getLogger(JsonSink.class);

  private final OutputStream out;
  private IOException error;

  JsonSink(OutputStream out) {
    this.out = out;
  }

  void write(char ch) {
    try {
      this.out.write(ch);
    } catch (IOException e) {
      latch(e);
    }
  }

  void write(byte[] bytes) {
    write(bytes, 0, bytes.length);
  }

  void write(byte[] bytes, int offset, int length) {
    try {
      this.out.write(bytes, offset, length);
    } catch (IOException e) {
      latch(e);
    }
  }

  IOException error() {
    return this.error;
  }

  private void latch(IOException e) {
    if (this.error == null) {
      LOGGER.debug("Failed to write JSON to output stream", e);
      this.error = e;
    }
  }
}
