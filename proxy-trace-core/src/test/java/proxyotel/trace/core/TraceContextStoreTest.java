package proxyotel.trace.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.context.Context;
import org.junit.jupiter.api.Test;
import proxyotel.trace.api.HostAccessException;
import proxyotel.trace.api.cache.CorrelationCaches;

class TraceContextStoreTest {
  private static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";

  private final TraceContextStore store =
      new TraceContextStore(CorrelationCaches.<Context>newFixedSizeLruCache(16));

  private static Context contextOf(String traceId) {
    SpanContext spanContext =
        SpanContext.create(
            traceId, "00f067aa0ba902b7", TraceFlags.getSampled(), TraceState.getDefault());
    return Context.root().with(Span.wrap(spanContext));
  }

  @Test
  void storedContextIsFoundThroughTheTransaction() {
    FakeTransaction txn = new FakeTransaction();
    Context context = contextOf(TRACE_ID);

    assertEquals(TRACE_ID, store.store(txn, context));

    assertEquals(TRACE_ID, txn.getVar(TraceContextStore.TRACE_ID_VAR));
    assertSame(context, store.get(txn));
    assertSame(context, store.get(txn));
    assertSame(context, store.remove(txn));
    assertNull(store.remove(txn));
    assertNull(store.get(txn));
  }

  @Test
  void otherTransactionsWithTheKeyShareTheContext() {
    FakeTransaction first = new FakeTransaction();
    Context context = contextOf(TRACE_ID);
    store.store(first, context);

    FakeTransaction second = new FakeTransaction();
    second.setVar(TraceContextStore.TRACE_ID_VAR, TRACE_ID);

    assertSame(context, store.get(second));
  }

  @Test
  void lastStoreWins() {
    FakeTransaction txn = new FakeTransaction();
    Context first = contextOf(TRACE_ID);
    Context second = contextOf(TRACE_ID);

    store.store(txn, first);
    store.store(txn, second);

    assertSame(second, store.get(txn));
    assertEquals(1, store.size());
  }

  @Test
  void invalidSpanIsNotStored() {
    FakeTransaction txn = new FakeTransaction();

    assertNull(store.store(txn, Context.root()));

    assertNull(txn.getVar(TraceContextStore.TRACE_ID_VAR));
    assertEquals(0, store.size());
  }

  @Test
  void failedKeyWriteStoresNothing() {
    FakeTransaction txn = new FakeTransaction().readOnly(TraceContextStore.TRACE_ID_VAR);

    assertThrows(HostAccessException.class, () -> store.store(txn, contextOf(TRACE_ID)));

    assertEquals(0, store.size());
  }

  @Test
  void transactionWithoutKeyFindsNothing() {
    FakeTransaction txn = new FakeTransaction();

    assertNull(store.get(txn));
    assertNull(store.remove(txn));
  }

  @Test
  void globalStoreIsShared() {
    assertSame(TraceContextStore.global(), TraceContextStore.global());
  }
}
