package proxyotel.trace.api.cache;

import javax.annotation.Nullable;

/**
 * Bounded map from a string key to an in-flight value, shared by all worker threads.
 *
 * <p>Each operation is atomic on its own. Operations on unrelated keys do not wait on each other
 * for longer than a map update.
 *
 * @param <V> value type
 */
public interface CorrelationCache<V> {

  /**
   * Non-destructive lookup.
   *
   * @return the stored value, or {@code null} when the key was never stored, was removed or was
   *     evicted
   */
  @Nullable
  V get(String key);

  /** Inserts or overwrites the value for the key. */
  void store(String key, V value);

  /**
   * Takes the value out of the cache. Only the first of several calls for the same key gets the
   * value.
   *
   * @return the removed value, or {@code null} when there was none
   */
  @Nullable
  V remove(String key);

  /** Current number of entries. */
  int size();
}
