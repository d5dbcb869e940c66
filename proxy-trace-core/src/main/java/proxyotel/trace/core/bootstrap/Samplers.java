package proxyotel.trace.core.bootstrap;

import io.opentelemetry.sdk.trace.samplers.Sampler;
import proxyotel.config.SamplerStrategy;

final class Samplers {

  private Samplers() {}

  static Sampler create(SamplerStrategy strategy) {
    switch (strategy) {
      case ALWAYS_ON:
      case SILENT_ON:
        // silent only changes what is injected downstream
        return Sampler.alwaysOn();
      case ALWAYS_OFF:
        return Sampler.alwaysOff();
      case PARENT_BASED:
      default:
        return Sampler.parentBased(Sampler.alwaysOn());
    }
  }
}
