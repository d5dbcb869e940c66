package proxyotel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ModuleOptionsTest {

  @Test
  void nestedTablesAreFlattened() {
    Map<String, Object> otlp = new HashMap<>();
    otlp.put("endpoint", "http://localhost:4317");
    otlp.put("protocol", "json");
    Map<String, Object> table = new HashMap<>();
    table.put("name", "haproxy");
    table.put("sampler", "AlwaysOn");
    table.put("propagator", "zipkin");
    table.put("otlp", otlp);

    ModuleOptions options = ModuleOptions.fromMap(table);

    assertEquals("haproxy", options.get(TracerConfig.SERVICE_NAME));
    assertEquals("AlwaysOn", options.get(TracerConfig.SAMPLER));
    assertEquals("zipkin", options.get(TracerConfig.PROPAGATOR));
    assertEquals("http://localhost:4317", options.get(OtlpConfig.OTLP_ENDPOINT));
    assertEquals("json", options.get(OtlpConfig.OTLP_PROTOCOL));
    assertNull(options.get(OtlpConfig.OTLP_HEADERS));
  }

  @Test
  void nonStringValuesAreKeptAsText() {
    Map<String, Object> otlp = new HashMap<>();
    otlp.put("timeout", 2500);
    Map<String, Object> table = new HashMap<>();
    table.put("otlp", otlp);
    table.put("sampler", null);

    ModuleOptions options = ModuleOptions.fromMap(table);

    assertEquals("2500", options.get(OtlpConfig.OTLP_TIMEOUT));
    assertNull(options.get(TracerConfig.SAMPLER));
  }

  @Test
  void builderClearsOnNull() {
    ModuleOptions options = ModuleOptions.builder().sampler("AlwaysOn").sampler(null).build();

    assertNull(options.get(TracerConfig.SAMPLER));
  }
}
