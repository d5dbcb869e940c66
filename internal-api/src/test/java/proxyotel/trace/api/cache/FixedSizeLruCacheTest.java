package proxyotel.trace.api.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class FixedSizeLruCacheTest {

  @Test
  public void storeThenGet() {
    CorrelationCache<Object> cache = CorrelationCaches.newFixedSizeLruCache(16);
    Object context = new Object();

    cache.store("4bf92f3577b34da6a3ce929d0e0e4736", context);

    assertSame(context, cache.get("4bf92f3577b34da6a3ce929d0e0e4736"));
    assertSame(context, cache.get("4bf92f3577b34da6a3ce929d0e0e4736"));
    assertEquals(1, cache.size());
  }

  @Test
  public void removeTakesOwnershipOnce() {
    CorrelationCache<Object> cache = CorrelationCaches.newFixedSizeLruCache(16);
    Object context = new Object();
    cache.store("key", context);

    assertSame(context, cache.remove("key"));
    assertNull(cache.remove("key"));
    assertNull(cache.get("key"));
    assertEquals(0, cache.size());
  }

  @Test
  public void missingKeys() {
    CorrelationCache<Object> cache = CorrelationCaches.newFixedSizeLruCache(16);

    assertNull(cache.get("missing"));
    assertNull(cache.remove("missing"));
    assertNull(cache.get(null));
    assertNull(cache.remove(null));
  }

  @Test
  public void storeOverwrites() {
    CorrelationCache<String> cache = CorrelationCaches.newFixedSizeLruCache(16);

    cache.store("key", "first");
    cache.store("key", "second");

    assertEquals("second", cache.get("key"));
    assertEquals(1, cache.size());
  }

  @Test
  public void nullsAreRejectedOnStore() {
    CorrelationCache<String> cache = CorrelationCaches.newFixedSizeLruCache(16);

    assertThrows(NullPointerException.class, () -> cache.store(null, "value"));
    assertThrows(NullPointerException.class, () -> cache.store("key", null));
  }

  @Test
  public void evictsLeastRecentlyUsed() {
    CorrelationCache<String> cache = CorrelationCaches.newFixedSizeLruCache(3);
    cache.store("a", "1");
    cache.store("b", "2");
    cache.store("c", "3");

    // touching "a" makes "b" the eldest entry
    cache.get("a");
    cache.store("d", "4");

    assertEquals(3, cache.size());
    assertNull(cache.get("b"));
    assertEquals("1", cache.get("a"));
    assertEquals("3", cache.get("c"));
    assertEquals("4", cache.get("d"));
  }

  @Test
  public void neverExceedsCapacity() {
    int capacity = 4096;
    FixedSizeLruCache<Integer> cache = new FixedSizeLruCache<>(capacity);
    for (int i = 0; i < capacity * 3; i++) {
      cache.store(Integer.toHexString(i), i);
    }

    assertTrue(cache.size() <= capacity);
    // the most recent entry always survives
    assertEquals(capacity * 3 - 1, cache.get(Integer.toHexString(capacity * 3 - 1)));
  }

  @ParameterizedTest
  @CsvSource({"1, 1", "511, 1", "512, 2", "1024, 4", "16384, 64", "1000000, 64"})
  public void segmentCount(int capacity, int expected) {
    assertEquals(expected, FixedSizeLruCache.segmentCount(capacity));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1})
  public void invalidCapacity(int capacity) {
    assertThrows(IllegalArgumentException.class, () -> new FixedSizeLruCache<>(capacity));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 3, 32})
  public void invalidSegmentCount(int segments) {
    assertThrows(IllegalArgumentException.class, () -> new FixedSizeLruCache<>(16, segments));
  }

  @Test
  public void concurrentRequestsDoNotInterfere() throws Exception {
    CorrelationCache<String> cache = CorrelationCaches.newFixedSizeLruCache(100_000);
    int threads = 8;
    int perThread = 2_000;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Integer>> results = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        final int thread = t;
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  int completed = 0;
                  for (int i = 0; i < perThread; i++) {
                    String key = thread + "-" + i;
                    cache.store(key, key);
                    if (key.equals(cache.get(key)) && key.equals(cache.remove(key))) {
                      completed++;
                    }
                  }
                  return completed;
                }));
      }
      start.countDown();
      for (Future<Integer> result : results) {
        assertEquals(perThread, result.get(30, TimeUnit.SECONDS));
      }
      assertEquals(0, cache.size());
    } finally {
      executor.shutdownNow();
    }
  }
}
