package proxyotel.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class LogLevelTest {

  @ParameterizedTest
  @CsvSource({
    "debug, DEBUG",
    "TRACE, DEBUG",
    "Info, INFO",
    "warn, WARN",
    "WARNING, WARN",
    "error, ERROR",
    "fatal, ERROR",
    "none, ERROR"
  })
  void recognizedNames(String name, LogLevel expected) {
    assertEquals(expected, LogLevel.fromString(name));
  }

  @ParameterizedTest
  @ValueSource(strings = {"verbose", "off", "5"})
  void unrecognizedNames(String name) {
    assertNull(LogLevel.fromString(name));
  }
}
