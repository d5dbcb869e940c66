package proxyotel.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Explicit module configuration as handed over by the host's configuration table.
 *
 * <p>Nested tables are flattened with dotted keys, so {@code otlp = { endpoint = ... }} is read
 * back as {@code otlp.endpoint}. Values are kept raw; interpretation belongs to {@link
 * ConfigResolver}.
 */
public final class ModuleOptions {
  public static final ModuleOptions EMPTY = new ModuleOptions(Collections.emptyMap());

  private final Map<String, String> values;

  private ModuleOptions(Map<String, String> values) {
    this.values = values;
  }

  public static ModuleOptions fromMap(Map<String, ?> table) {
    Map<String, String> flattened = new LinkedHashMap<>();
    flatten("", table, flattened);
    return new ModuleOptions(Collections.unmodifiableMap(flattened));
  }

  private static void flatten(String prefix, Map<?, ?> table, Map<String, String> into) {
    for (Map.Entry<?, ?> entry : table.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      String key = prefix + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof Map) {
        flatten(key + '.', (Map<?, ?>) value, into);
      } else {
        into.put(key, value.toString());
      }
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Raw value for a dotted key, {@code null} when the key was not configured. */
  @Nullable
  public String get(String key) {
    return values.get(key);
  }

  public Map<String, String> asMap() {
    return values;
  }

  @Override
  public String toString() {
    return "ModuleOptions" + values.keySet();
  }

  public static final class Builder {
    private final Map<String, String> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder serviceName(String serviceName) {
      return set(TracerConfig.SERVICE_NAME, serviceName);
    }

    public Builder sampler(String sampler) {
      return set(TracerConfig.SAMPLER, sampler);
    }

    public Builder propagator(String propagator) {
      return set(TracerConfig.PROPAGATOR, propagator);
    }

    public Builder logLevel(String logLevel) {
      return set(TracerConfig.LOG_LEVEL, logLevel);
    }

    public Builder otlpEndpoint(String endpoint) {
      return set(OtlpConfig.OTLP_ENDPOINT, endpoint);
    }

    public Builder otlpProtocol(String protocol) {
      return set(OtlpConfig.OTLP_PROTOCOL, protocol);
    }

    public Builder otlpHeaders(String headers) {
      return set(OtlpConfig.OTLP_HEADERS, headers);
    }

    public Builder otlpTimeout(String timeoutMillis) {
      return set(OtlpConfig.OTLP_TIMEOUT, timeoutMillis);
    }

    public Builder set(String key, @Nullable String value) {
      if (value == null) {
        values.remove(key);
      } else {
        values.put(key, value);
      }
      return this;
    }

    public ModuleOptions build() {
      return new ModuleOptions(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }
  }
}
