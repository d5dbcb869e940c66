package proxyotel.trace.api;

import javax.annotation.Nullable;

@FunctionalInterface
public interface FilterFactory {

  /**
   * @param args the raw argument string from the filter declaration, {@code null} when none was
   *     given
   */
  UserFilter create(@Nullable String args);
}
