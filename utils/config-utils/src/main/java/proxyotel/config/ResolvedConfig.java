package proxyotel.config;

import java.util.Map;
import proxyotel.config.OtlpConfig.Protocol;
import proxyotel.logging.LogLevel;

/**
 * Immutable snapshot of the exporter configuration, computed once at startup and shared read-only
 * by every worker thread.
 */
public final class ResolvedConfig {
  private final ConfigSetting<String> serviceName;
  private final ConfigSetting<Protocol> protocol;
  private final ConfigSetting<String> endpoint;
  private final ConfigSetting<PropagationStyle> propagator;
  private final ConfigSetting<SamplerStrategy> sampler;
  private final ConfigSetting<LogLevel> logLevel;
  private final ConfigSetting<Map<String, String>> headers;
  private final ConfigSetting<Long> timeoutMillis;

  ResolvedConfig(
      ConfigSetting<String> serviceName,
      ConfigSetting<Protocol> protocol,
      ConfigSetting<String> endpoint,
      ConfigSetting<PropagationStyle> propagator,
      ConfigSetting<SamplerStrategy> sampler,
      ConfigSetting<LogLevel> logLevel,
      ConfigSetting<Map<String, String>> headers,
      ConfigSetting<Long> timeoutMillis) {
    this.serviceName = serviceName;
    this.protocol = protocol;
    this.endpoint = endpoint;
    this.propagator = propagator;
    this.sampler = sampler;
    this.logLevel = logLevel;
    this.headers = headers;
    this.timeoutMillis = timeoutMillis;
  }

  public ConfigSetting<String> getServiceName() {
    return serviceName;
  }

  public ConfigSetting<Protocol> getProtocol() {
    return protocol;
  }

  public ConfigSetting<String> getEndpoint() {
    return endpoint;
  }

  public ConfigSetting<PropagationStyle> getPropagator() {
    return propagator;
  }

  public ConfigSetting<SamplerStrategy> getSampler() {
    return sampler;
  }

  public ConfigSetting<LogLevel> getLogLevel() {
    return logLevel;
  }

  public ConfigSetting<Map<String, String>> getHeaders() {
    return headers;
  }

  public ConfigSetting<Long> getTimeoutMillis() {
    return timeoutMillis;
  }

  /** One-line startup diagnostic. */
  public String describe() {
    return "OpenTelemetry initialized: service="
        + serviceName.value
        + " protocol="
        + protocol.value
        + " ("
        + protocol.origin.value
        + ") endpoint="
        + endpoint.value
        + " ("
        + endpoint.origin.value
        + ") propagator="
        + propagator.value
        + " sampler="
        + sampler.value
        + " log_level="
        + logLevel.value;
  }

  @Override
  public String toString() {
    return "ResolvedConfig{"
        + serviceName
        + ", "
        + protocol
        + ", "
        + endpoint
        + ", "
        + propagator
        + ", "
        + sampler
        + ", "
        + logLevel
        + ", "
        + headers
        + ", "
        + timeoutMillis
        + '}';
  }
}
