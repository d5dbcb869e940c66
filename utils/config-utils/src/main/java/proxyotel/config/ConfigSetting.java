package proxyotel.config;

import java.util.Map;
import java.util.Objects;

/** A resolved configuration value paired with the source that produced it. */
public final class ConfigSetting<T> {
  public final String key;
  public final T value;
  public final ConfigOrigin origin;

  public static <T> ConfigSetting<T> of(String key, T value, ConfigOrigin origin) {
    return new ConfigSetting<>(key, value, origin);
  }

  private ConfigSetting(String key, T value, ConfigOrigin origin) {
    this.key = key;
    this.value = value;
    this.origin = origin;
  }

  public String stringValue() {
    if (value == null) {
      return null;
    } else if (value instanceof Map) {
      return renderMap((Map<?, ?>) value);
    } else {
      return value.toString();
    }
  }

  private static String renderMap(Map<?, ?> map) {
    StringBuilder result = new StringBuilder();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (result.length() > 0) {
        result.append(',');
      }
      // header values may carry credentials
      result.append(entry.getKey()).append("=<hidden>");
    }
    return result.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ConfigSetting<?> that = (ConfigSetting<?>) o;
    return key.equals(that.key) && Objects.equals(value, that.value) && origin == that.origin;
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value, origin);
  }

  @Override
  public String toString() {
    return "ConfigSetting{key='" + key + "', value=" + stringValue() + ", origin=" + origin + '}';
  }
}
