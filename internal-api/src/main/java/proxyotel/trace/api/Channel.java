package proxyotel.trace.api;

/** One direction of a proxied stream. */
public interface Channel {

  boolean isResponse();
}
