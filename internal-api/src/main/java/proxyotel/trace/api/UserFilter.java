package proxyotel.trace.api;

/**
 * Stream filter attached to a proxy section. The host creates one instance per stream, so
 * instance fields are private to a single request/response exchange.
 */
public interface UserFilter {

  /** Called once the headers of the request or of the response have been parsed. */
  void httpHeaders(Transaction txn, HttpMessage msg);

  /** Called when the host is done analyzing one direction of the stream. */
  void endAnalyze(Transaction txn, Channel channel);
}
