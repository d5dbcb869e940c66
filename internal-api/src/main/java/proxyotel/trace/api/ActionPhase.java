package proxyotel.trace.api;

/** Rule sets in which a registered action may be used. */
public enum ActionPhase {
  HTTP_REQ("http-req"),
  HTTP_RES("http-res"),
  HTTP_AFTER_RES("http-after-res");

  public final String ruleSet;

  ActionPhase(String ruleSet) {
    this.ruleSet = ruleSet;
  }
}
