package proxyotel.trace.api;

/** Transaction fields read by the tracing hooks, named after the host's sample fetches. */
public enum Fetch {
  METHOD("method"),
  /** Request path including the query string. */
  PATHQ("pathq"),
  /** Peer network address. */
  SRC("src"),
  FRONTEND_NAME("fe_name"),
  BACKEND_NAME("be_name"),
  SERVER_NAME("srv_name"),
  /** Final response status code, as seen by the client. */
  TXN_STATUS("txn_status"),
  /** Two-letter session termination state. */
  TERMINATION_STATE("txn_sess_term_state");

  public final String fetchName;

  Fetch(String fetchName) {
    this.fetchName = fetchName;
  }

  @Override
  public String toString() {
    return fetchName;
  }
}
