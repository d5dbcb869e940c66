package proxyotel.config;

import static proxyotel.config.ConfigOrigin.DEFAULT;
import static proxyotel.config.ConfigOrigin.EXPLICIT;
import static proxyotel.config.ConfigOrigin.GENERAL_ENV;
import static proxyotel.config.ConfigOrigin.SIGNAL_ENV;
import static proxyotel.config.OtlpConfig.DEFAULT_TIMEOUT_MILLIS;
import static proxyotel.config.OtlpConfig.OTLP_ENDPOINT;
import static proxyotel.config.OtlpConfig.OTLP_ENDPOINT_ENV;
import static proxyotel.config.OtlpConfig.OTLP_HEADERS;
import static proxyotel.config.OtlpConfig.OTLP_HEADERS_ENV;
import static proxyotel.config.OtlpConfig.OTLP_PROTOCOL;
import static proxyotel.config.OtlpConfig.OTLP_PROTOCOL_ENV;
import static proxyotel.config.OtlpConfig.OTLP_TIMEOUT;
import static proxyotel.config.OtlpConfig.OTLP_TIMEOUT_ENV;
import static proxyotel.config.OtlpConfig.OTLP_TRACES_ENDPOINT_ENV;
import static proxyotel.config.OtlpConfig.OTLP_TRACES_HEADERS_ENV;
import static proxyotel.config.OtlpConfig.OTLP_TRACES_PROTOCOL_ENV;
import static proxyotel.config.OtlpConfig.OTLP_TRACES_TIMEOUT_ENV;
import static proxyotel.config.OtlpConfig.TRACES_PATH;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import proxyotel.config.OtlpConfig.Protocol;
import proxyotel.environment.EnvironmentVariables;
import proxyotel.logging.LogLevel;

/**
 * Resolves the exporter configuration from the explicit module options, the OpenTelemetry
 * environment variables and the built-in defaults.
 *
 * <p>Every setting is looked up in the same order: explicit module option, then the environment
 * variable naming the traces signal, then the environment variable shared by all signals, then
 * the default. The first source holding a non-empty, recognized value wins. Unrecognized values are
 * logged and skipped; resolution never fails.
 */
public final class ConfigResolver {
  private static final Logger log = LoggerFactory.getLogger(ConfigResolver.class);

  private final ModuleOptions options;
  private final Function<String, String> environment;

  public ConfigResolver(ModuleOptions options) {
    this(options, EnvironmentVariables::get);
  }

  public ConfigResolver(ModuleOptions options, Function<String, String> environment) {
    this.options = options;
    this.environment = environment;
  }

  public ResolvedConfig resolve() {
    ConfigSetting<Protocol> protocol = resolveProtocol();
    return new ResolvedConfig(
        resolveServiceName(),
        protocol,
        resolveEndpoint(protocol.value),
        resolvePropagator(),
        resolveSampler(),
        resolveLogLevel(),
        resolveHeaders(),
        resolveTimeout());
  }

  public ConfigSetting<String> resolveServiceName() {
    return resolve(
        TracerConfig.SERVICE_NAME,
        null,
        TracerConfig.SERVICE_NAME_ENV,
        Function.identity(),
        TracerConfig.DEFAULT_SERVICE_NAME);
  }

  public ConfigSetting<Protocol> resolveProtocol() {
    return resolve(
        OTLP_PROTOCOL,
        OTLP_TRACES_PROTOCOL_ENV,
        OTLP_PROTOCOL_ENV,
        Protocol::fromString,
        Protocol.HTTP_PROTOBUF);
  }

  /**
   * Resolves the traces endpoint for the given protocol.
   *
   * <p>HTTP protocols get {@code /v1/traces} appended to the base URL, except when the value came
   * from {@code OTEL_EXPORTER_OTLP_TRACES_ENDPOINT}, which is already fully qualified. gRPC
   * endpoints are always used as given.
   */
  public ConfigSetting<String> resolveEndpoint(Protocol protocol) {
    ConfigSetting<String> base =
        resolve(
            OTLP_ENDPOINT,
            OTLP_TRACES_ENDPOINT_ENV,
            OTLP_ENDPOINT_ENV,
            Function.identity(),
            protocol.defaultEndpoint());
    return ConfigSetting.of(base.key, tracesEndpoint(base, protocol), base.origin);
  }

  static String tracesEndpoint(ConfigSetting<String> base, Protocol protocol) {
    if (!protocol.isHttp() || base.origin == SIGNAL_ENV) {
      return base.value;
    }
    String url = base.value;
    int end = url.length();
    while (end > 0 && url.charAt(end - 1) == '/') {
      end--;
    }
    return url.substring(0, end) + '/' + TRACES_PATH;
  }

  public ConfigSetting<SamplerStrategy> resolveSampler() {
    return resolve(
        TracerConfig.SAMPLER,
        TracerConfig.TRACES_SAMPLER_ENV,
        null,
        SamplerStrategy::fromString,
        SamplerStrategy.PARENT_BASED);
  }

  public ConfigSetting<PropagationStyle> resolvePropagator() {
    return resolve(
        TracerConfig.PROPAGATOR,
        null,
        TracerConfig.PROPAGATORS_ENV,
        PropagationStyle::fromList,
        PropagationStyle.W3C);
  }

  public ConfigSetting<LogLevel> resolveLogLevel() {
    return resolve(
        TracerConfig.LOG_LEVEL,
        null,
        TracerConfig.LOG_LEVEL_ENV,
        LogLevel::fromString,
        LogLevel.INFO);
  }

  public ConfigSetting<Map<String, String>> resolveHeaders() {
    return resolve(
        OTLP_HEADERS,
        OTLP_TRACES_HEADERS_ENV,
        OTLP_HEADERS_ENV,
        ConfigResolver::parseHeaders,
        Collections.emptyMap());
  }

  public ConfigSetting<Long> resolveTimeout() {
    return resolve(
        OTLP_TIMEOUT,
        OTLP_TRACES_TIMEOUT_ENV,
        OTLP_TIMEOUT_ENV,
        ConfigResolver::parseTimeout,
        DEFAULT_TIMEOUT_MILLIS);
  }

  private <T> ConfigSetting<T> resolve(
      String key,
      @Nullable String signalEnv,
      @Nullable String generalEnv,
      Function<String, T> parser,
      T defaultValue) {
    T value = parse(key, options.get(key), "module option '" + key + "'", parser);
    if (value != null) {
      return ConfigSetting.of(key, value, EXPLICIT);
    }
    if (signalEnv != null) {
      value = parse(key, environment.apply(signalEnv), signalEnv, parser);
      if (value != null) {
        return ConfigSetting.of(key, value, SIGNAL_ENV);
      }
    }
    if (generalEnv != null) {
      value = parse(key, environment.apply(generalEnv), generalEnv, parser);
      if (value != null) {
        return ConfigSetting.of(key, value, GENERAL_ENV);
      }
    }
    return ConfigSetting.of(key, defaultValue, DEFAULT);
  }

  @Nullable
  private static <T> T parse(
      String key, @Nullable String raw, String source, Function<String, T> parser) {
    if (raw == null || raw.trim().isEmpty()) {
      return null;
    }
    T value = parser.apply(raw);
    if (value == null) {
      log.warn("Ignoring unrecognized {} value '{}' from {}", key, raw, source);
    }
    return value;
  }

  /** Parses a comma-separated list of key=value entries, skipping malformed ones. */
  @Nullable
  static Map<String, String> parseHeaders(String value) {
    Map<String, String> headers = new LinkedHashMap<>();
    int start = 0;
    while (start < value.length()) {
      int end = value.indexOf(',', start);
      if (end < 0) {
        end = value.length();
      }
      if (end > start) {
        String entry = value.substring(start, end);
        int eq = entry.indexOf('=');
        String name = eq > 0 ? entry.substring(0, eq).trim() : "";
        if (name.isEmpty()) {
          log.warn("Skipping malformed OTLP header entry '{}'", entry.trim());
        } else {
          headers.put(name, entry.substring(eq + 1).trim());
        }
      }
      start = end + 1;
    }
    return headers.isEmpty() ? null : Collections.unmodifiableMap(headers);
  }

  @Nullable
  static Long parseTimeout(String value) {
    try {
      long millis = Long.parseLong(value.trim());
      return millis > 0 ? millis : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
