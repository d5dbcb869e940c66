package proxyotel.trace.core.bootstrap;

/** The export pipeline could not be built; the module must not activate. */
public class TracingInitializationException extends Exception {

  public TracingInitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
