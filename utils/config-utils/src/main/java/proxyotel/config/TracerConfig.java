package proxyotel.config;

public final class TracerConfig {

  public static final String SERVICE_NAME = "name";
  public static final String SAMPLER = "sampler";
  public static final String PROPAGATOR = "propagator";
  public static final String LOG_LEVEL = "log_level";

  public static final String SERVICE_NAME_ENV = "OTEL_SERVICE_NAME";
  public static final String TRACES_SAMPLER_ENV = "OTEL_TRACES_SAMPLER";
  public static final String PROPAGATORS_ENV = "OTEL_PROPAGATORS";
  public static final String LOG_LEVEL_ENV = "OTEL_LOG_LEVEL";

  public static final String DEFAULT_SERVICE_NAME = "haproxy";

  private TracerConfig() {}
}
