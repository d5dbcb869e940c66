package proxyotel.trace.api.cache;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link CorrelationCache} that never holds more than a fixed number of entries, evicting the
 * least recently used one when full.
 *
 * <p>The key space is split over a power of two number of segments, each an access ordered map
 * guarded by its own lock, so threads working on unrelated keys rarely contend. Recency is tracked
 * per segment: the evicted entry is the least recently used one of the segment receiving the new
 * key.
 *
 * @param <V> value type
 */
final class FixedSizeLruCache<V> implements CorrelationCache<V> {

  static final int MAXIMUM_SEGMENTS = 64;
  // below this many entries per segment, recency becomes too coarse to be useful
  static final int MINIMUM_SEGMENT_CAPACITY = 256;

  private final Segment<V>[] segments;
  private final int mask;

  FixedSizeLruCache(int capacity) {
    this(capacity, segmentCount(capacity));
  }

  @SuppressWarnings("unchecked")
  FixedSizeLruCache(int capacity, int segmentCount) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Cache capacity must be > 0");
    }
    if (segmentCount <= 0 || Integer.bitCount(segmentCount) != 1 || segmentCount > capacity) {
      throw new IllegalArgumentException(
          "Segment count must be a power of two between 1 and the capacity");
    }
    this.segments = new Segment[segmentCount];
    this.mask = segmentCount - 1;
    int base = capacity / segmentCount;
    int remainder = capacity % segmentCount;
    for (int i = 0; i < segmentCount; i++) {
      segments[i] = new Segment<>(i < remainder ? base + 1 : base);
    }
  }

  static int segmentCount(int capacity) {
    int count = 1;
    while (count < MAXIMUM_SEGMENTS && (long) count * 2 * MINIMUM_SEGMENT_CAPACITY <= capacity) {
      count *= 2;
    }
    return count;
  }

  @Override
  public V get(String key) {
    if (key == null) {
      return null;
    }
    Segment<V> segment = segmentFor(key);
    synchronized (segment) {
      return segment.get(key);
    }
  }

  @Override
  public void store(String key, V value) {
    if (key == null || value == null) {
      throw new NullPointerException("key and value must not be null");
    }
    Segment<V> segment = segmentFor(key);
    synchronized (segment) {
      segment.put(key, value);
    }
  }

  @Override
  public V remove(String key) {
    if (key == null) {
      return null;
    }
    Segment<V> segment = segmentFor(key);
    synchronized (segment) {
      return segment.remove(key);
    }
  }

  @Override
  public int size() {
    int size = 0;
    for (Segment<V> segment : segments) {
      synchronized (segment) {
        size += segment.size();
      }
    }
    return size;
  }

  private Segment<V> segmentFor(String key) {
    return segments[spread(key.hashCode()) & mask];
  }

  static int spread(int v) {
    int h = v * 0x9e3775cd;
    h = Integer.reverseBytes(h);
    return h * 0x9e3775cd;
  }

  private static final class Segment<V> extends LinkedHashMap<String, V> {
    private final int capacity;

    Segment(int capacity) {
      super(16, 0.75f, true);
      this.capacity = capacity;
    }

    @Override
    protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
      return size() > capacity;
    }
  }
}
