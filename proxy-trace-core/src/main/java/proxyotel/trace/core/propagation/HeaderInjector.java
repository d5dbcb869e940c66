package proxyotel.trace.core.propagation;

import io.opentelemetry.context.propagation.TextMapSetter;
import javax.annotation.Nullable;
import proxyotel.trace.api.HttpMessage;

/**
 * Writes propagation headers onto the request forwarded upstream.
 *
 * <p>When the sampling decision must stay silent, the B3 {@code X-B3-Sampled} header is dropped
 * while the trace and span id headers are still written.
 */
public final class HeaderInjector implements TextMapSetter<HttpMessage> {
  static final String B3_SAMPLED = "x-b3-sampled";

  public static final HeaderInjector DEFAULT = new HeaderInjector(false);
  public static final HeaderInjector SILENT = new HeaderInjector(true);

  private final boolean suppressSampled;

  private HeaderInjector(boolean suppressSampled) {
    this.suppressSampled = suppressSampled;
  }

  public static HeaderInjector of(boolean suppressSampled) {
    return suppressSampled ? SILENT : DEFAULT;
  }

  @Override
  public void set(@Nullable HttpMessage carrier, String key, String value) {
    if (carrier == null) {
      return;
    }
    if (suppressSampled && B3_SAMPLED.equalsIgnoreCase(key)) {
      return;
    }
    carrier.setHeader(key, value);
  }
}
