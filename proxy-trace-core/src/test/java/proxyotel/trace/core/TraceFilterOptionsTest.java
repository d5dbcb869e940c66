package proxyotel.trace.core;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TraceFilterOptionsTest {

  @Test
  void clientSpansAreOnByDefault() {
    assertTrue(TraceFilter.Options.parse(null).startClientSpan);
    assertTrue(TraceFilter.Options.parse("").startClientSpan);
  }

  @Test
  void clientSpansCanBeTurnedOff() {
    assertFalse(TraceFilter.Options.parse("start_client_span=false").startClientSpan);
    assertFalse(TraceFilter.Options.parse("other=1;start_client_span=false").startClientSpan);
  }

  @ParameterizedTest
  @ValueSource(strings = {"start_client_span=true", "start_client_span=no", "start_client_span="})
  void anythingButFalseKeepsClientSpans(String args) {
    assertTrue(TraceFilter.Options.parse(args).startClientSpan);
  }
}
