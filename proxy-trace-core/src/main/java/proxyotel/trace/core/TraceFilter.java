package proxyotel.trace.core;

import io.opentelemetry.context.Context;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proxyotel.trace.api.Channel;
import proxyotel.trace.api.HttpMessage;
import proxyotel.trace.api.Transaction;
import proxyotel.trace.api.UserFilter;

/**
 * Stream filter tracing the upstream side of a request: a client span per forwarded request,
 * and the end of the server span once the response has been analyzed.
 *
 * <p>The host creates one filter per stream, so the open client span is kept in the instance.
 */
public final class TraceFilter implements UserFilter {
  private static final Logger log = LoggerFactory.getLogger(TraceFilter.class);

  public static final String NAME = "opentelemetry-trace";

  private final SpanLifecycle lifecycle;
  private final Options options;
  @Nullable private Context clientContext;

  public TraceFilter(SpanLifecycle lifecycle, Options options) {
    this.lifecycle = lifecycle;
    this.options = options;
  }

  @Override
  public void httpHeaders(Transaction txn, HttpMessage msg) {
    if (!options.startClientSpan) {
      return;
    }
    if (!msg.isResponse()) {
      if (clientContext != null) {
        // the previous attempt got no response headers
        lifecycle.abandonClientSpan(txn, clientContext);
      }
      clientContext = lifecycle.startClientSpan(txn, msg);
    } else if (clientContext != null) {
      Context context = clientContext;
      clientContext = null;
      lifecycle.completeClientSpan(txn, context, msg);
    }
  }

  @Override
  public void endAnalyze(Transaction txn, Channel channel) {
    if (!channel.isResponse()) {
      return;
    }
    if (clientContext != null) {
      Context context = clientContext;
      clientContext = null;
      lifecycle.abandonClientSpan(txn, context);
    }
    lifecycle.completeServerSpan(txn);
  }

  /** Filter arguments, given as {@code name=value} pairs separated by {@code ;}. */
  public static final class Options {
    public static final Options DEFAULT = new Options(true);

    public final boolean startClientSpan;

    Options(boolean startClientSpan) {
      this.startClientSpan = startClientSpan;
    }

    /**
     * Recognizes {@code start_client_span=<bool>}; a value other than {@code true} or {@code
     * false} leaves client spans on. Unknown names are ignored.
     */
    public static Options parse(@Nullable String args) {
      if (args == null || args.isEmpty()) {
        return DEFAULT;
      }
      boolean startClientSpan = true;
      for (String arg : args.split(";")) {
        int eq = arg.indexOf('=');
        String name = eq < 0 ? arg : arg.substring(0, eq);
        String value = eq < 0 ? "" : arg.substring(eq + 1);
        if ("start_client_span".equals(name)) {
          startClientSpan = !"false".equals(value);
        } else if (!name.isEmpty()) {
          log.warn("Ignoring unknown {} filter argument '{}'", NAME, name);
        }
      }
      return startClientSpan ? DEFAULT : new Options(false);
    }

    @Override
    public String toString() {
      return "start_client_span=" + startClientSpan;
    }
  }
}
