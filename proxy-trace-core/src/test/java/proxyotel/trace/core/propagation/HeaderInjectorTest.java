package proxyotel.trace.core.propagation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;
import proxyotel.trace.core.FakeHttpMessage;

class HeaderInjectorTest {

  @Test
  void defaultInjectorWritesEverything() {
    FakeHttpMessage msg = FakeHttpMessage.request();

    HeaderInjector.of(false).set(msg, "X-B3-TraceId", "abc");
    HeaderInjector.of(false).set(msg, "X-B3-Sampled", "1");

    assertEquals("abc", msg.header("x-b3-traceid"));
    assertEquals("1", msg.header("x-b3-sampled"));
  }

  @Test
  void silentInjectorDropsOnlyTheSampledHeader() {
    FakeHttpMessage msg = FakeHttpMessage.request();

    HeaderInjector.of(true).set(msg, "X-B3-TraceId", "abc");
    HeaderInjector.of(true).set(msg, "X-B3-Sampled", "1");
    HeaderInjector.of(true).set(msg, "x-b3-sampled", "1");

    assertEquals("abc", msg.header("x-b3-traceid"));
    assertNull(msg.header("x-b3-sampled"));
  }

  @Test
  void injectorsAreShared() {
    assertSame(HeaderInjector.SILENT, HeaderInjector.of(true));
    assertSame(HeaderInjector.DEFAULT, HeaderInjector.of(false));
  }

  @Test
  void nullCarrierIsIgnored() {
    HeaderInjector.of(false).set(null, "traceparent", "00-abc");
  }
}
