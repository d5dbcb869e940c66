package proxyotel.trace.api;

import java.util.List;

/** Body of a custom action invoked from the host's rule sets. */
@FunctionalInterface
public interface ActionHandler {

  /**
   * @param txn the transaction the rule fired for
   * @param args the action arguments, exactly as many as declared at registration
   */
  void execute(Transaction txn, List<String> args);
}
