package datadog.json.stream;

import java.io.IOException;

/** Signals a value could not be marshaled to JSON. Nothing was written to the stream. */
public class JsonMarshalException extends IOException {
  private static final long serialVersionUID = 1L;

  public JsonMarshalException(String message, Throwable cause) {
    super(message, cause);
  }
}
