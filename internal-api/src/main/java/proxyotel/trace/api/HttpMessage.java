package proxyotel.trace.api;

import java.util.function.BiConsumer;

/** Request or response headers of one HTTP message as exposed by the host. */
public interface HttpMessage {

  boolean isResponse();

  /**
   * Visits every header of the message. A header carried on several lines is visited once per
   * value, in message order.
   */
  void forEachHeader(BiConsumer<String, String> visitor);

  /** Replaces all values of the named header with the given value. */
  void setHeader(String name, String value);

  /**
   * Status code of a response message.
   *
   * @throws HostAccessException when called on a request message
   */
  int statusCode();

  /**
   * Reason phrase of a response message.
   *
   * @throws HostAccessException when called on a request message
   */
  String reason();
}
