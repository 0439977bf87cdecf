package io.github.themoah.ybstats.schema;

/**
 * Thrown by a flattener when an HTTP body cannot be interpreted for its kind.
 * Never escapes the collector, which substitutes a synthetic record.
 */
public class MalformedPayloadException extends RuntimeException {

  public MalformedPayloadException(String message) {
    super(message);
  }

  public MalformedPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
