package proxyotel.trace.api;

import java.util.Set;

/** Registration surface of the embedding proxy. */
public interface ProxyHost {

  /**
   * Identifier of the worker thread running the registration, starting at {@code 0} or {@code 1}
   * for the first worker depending on the host's threading mode.
   */
  int threadId();

  void registerAction(String name, Set<ActionPhase> phases, int argCount, ActionHandler handler);

  void registerFilter(String name, FilterFactory factory);
}
