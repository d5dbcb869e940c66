package proxyotel.config;

/** Which configuration source produced a resolved value, highest precedence first. */
public enum ConfigOrigin {
  /** set in the module configuration table handed over by the host */
  EXPLICIT("explicit_config"),
  /** set through an environment variable naming the traces signal, e.g. OTEL_TRACES_SAMPLER */
  SIGNAL_ENV("signal_env_var"),
  /** set through an environment variable shared by all signals, e.g. OTEL_EXPORTER_OTLP_ENDPOINT */
  GENERAL_ENV("env_var"),
  /** set when no source supplied a usable value */
  DEFAULT("default");

  public final String value;

  ConfigOrigin(String value) {
    this.value = value;
  }
}
