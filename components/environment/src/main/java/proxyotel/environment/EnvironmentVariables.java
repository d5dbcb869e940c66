package proxyotel.environment;

import javax.annotation.Nullable;

/**
 * Safely queries the process environment for configuration overrides.
 *
 * <p>Lookups never throw: a variable that cannot be read is reported as missing.
 */
public final class EnvironmentVariables {
  private EnvironmentVariables() {}

  public static class EnvironmentVariablesProvider {
    public String get(String name) {
      return System.getenv(name);
    }
  }

  // Swapped out by tests to simulate overrides.
  public static volatile EnvironmentVariablesProvider provider = new EnvironmentVariablesProvider();

  /**
   * Gets an environment variable value.
   *
   * @param name The environment variable name.
   * @return The environment variable value, {@code null} if missing, can't be retrieved, or the
   *     environment variable name is {@code null}.
   */
  public static @Nullable String get(String name) {
    return getOrDefault(name, null);
  }

  /**
   * Gets an environment variable value, or default value if missing or can't be retrieved.
   *
   * @param name The environment variable name.
   * @param defaultValue The value returned when the variable is missing or can't be retrieved.
   * @return The environment variable value, {@code defaultValue} otherwise.
   */
  public static String getOrDefault(String name, String defaultValue) {
    if (name == null) {
      return defaultValue;
    }
    try {
      String value = provider.get(name);
      return value == null ? defaultValue : value;
    } catch (SecurityException e) {
      return defaultValue;
    }
  }
}
