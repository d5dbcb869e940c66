package proxyotel.trace.api;

/**
 * Raised by host accessors when a transaction field or message property cannot be read. It fails
 * the hook invocation that hit it and nothing else.
 */
public class HostAccessException extends RuntimeException {

  public HostAccessException(String message) {
    super(message);
  }

  public HostAccessException(String message, Throwable cause) {
    super(message, cause);
  }
}
