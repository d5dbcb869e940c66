package proxyotel.trace.api.cache;

public final class CorrelationCaches {

  /** Bound of the process-wide correlation cache. */
  public static final int DEFAULT_CAPACITY = 1_000_000;

  private CorrelationCaches() {}

  /**
   * Creates a cache which cannot grow beyond a fixed capacity, evicting least recently used
   * entries first. Entries are expected to be removed explicitly; eviction only reclaims entries
   * whose owner never came back for them.
   *
   * @param capacity the cache's fixed capacity
   * @param <V> the value type
   */
  public static <V> CorrelationCache<V> newFixedSizeLruCache(final int capacity) {
    return new FixedSizeLruCache<>(capacity);
  }
}
