package proxyotel.trace.api;

import javax.annotation.Nullable;

/**
 * Host view of one proxied HTTP transaction.
 *
 * <p>Scratch variables live as long as the transaction and are the only state shared by the
 * independent hook invocations that touch it. Variable names carry the host's scope prefix, e.g.
 * {@code txn.otel_trace_id}.
 */
public interface Transaction {

  /**
   * @return the value of the field, or {@code null} when the host has no value for it yet
   * @throws HostAccessException when the host fails to evaluate the fetch
   */
  @Nullable
  String fetchString(Fetch fetch);

  /**
   * @return the numeric value of the field, or {@code null} when the host has no value for it yet
   * @throws HostAccessException when the host fails to evaluate the fetch
   */
  @Nullable
  Long fetchLong(Fetch fetch);

  @Nullable
  String getVar(String name);

  @Nullable
  Boolean getBooleanVar(String name);

  void setVar(String name, String value);

  void setVar(String name, boolean value);

  /** Headers of the request as received from the client. */
  HttpMessage requestHeaders();
}
