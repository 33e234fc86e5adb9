package com.example.astromech.core.logging;

import com.example.astromech.core.config.ConfigurationException;
import com.example.astromech.core.config.Environment;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the {@code LOG_LEVEL} setting to the library loggers.
 *
 * <p>Accepted values are {@code DEBUG}, {@code INFO}, {@code WARNING}, {@code ERROR} and {@code
 * CRITICAL} (case-insensitive). The default is {@code INFO}. The library logs through {@link
 * System.Logger}, which is backed by {@code java.util.logging} unless the application installs
 * another {@code System.LoggerFinder}.
 */
public final class LogLevels {

  public static final String LEVEL_VARIABLE = "LOG_LEVEL";
  public static final String ROOT_LOGGER_NAME = "com.example.astromech";

  private static final Map<String, Level> LEVELS =
      Map.of(
          "DEBUG", Level.FINE,
          "INFO", Level.INFO,
          "WARNING", Level.WARNING,
          "ERROR", Level.SEVERE,
          "CRITICAL", Level.SEVERE);

  // strong reference, java.util.logging only keeps loggers weakly
  private static final Logger ROOT = Logger.getLogger(ROOT_LOGGER_NAME);

  private LogLevels() {}

  /**
   * Reads {@code LOG_LEVEL} and applies it.
   *
   * @param environment settings source
   * @return the applied level
   * @throws ConfigurationException if the value is not a known level name
   */
  public static Level configure(final Environment environment) {
    final var level = environment.get(LEVEL_VARIABLE).map(LogLevels::parse).orElse(Level.INFO);
    ROOT.setLevel(level);
    // console handlers default to INFO and would drop DEBUG records
    Arrays.stream(Logger.getLogger("").getHandlers())
        .filter(handler -> handler.getLevel().intValue() > level.intValue())
        .forEach(handler -> handler.setLevel(level));
    return level;
  }

  /**
   * Maps a level name to a {@code java.util.logging} level.
   *
   * @param name level name
   * @return the level
   * @throws ConfigurationException if the name is unknown
   */
  public static Level parse(final String name) {
    return Optional.ofNullable(LEVELS.get(name.trim().toUpperCase(Locale.ROOT)))
        .orElseThrow(
            () ->
                new ConfigurationException(
                    "Unknown level in \"%s\": %s".formatted(LEVEL_VARIABLE, name)));
  }
}
