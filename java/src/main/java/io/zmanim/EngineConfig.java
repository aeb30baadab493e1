package io.zmanim;

import java.time.DateTimeException;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide engine defaults, read from the environment once at class load.
 *
 * <ul>
 *   <li>{@code ZMANIM_IGNORE_ELEVATION}: {@code true} to compute visible sunrise and sunset at
 *       sea level by default
 *   <li>{@code ZMANIM_RESOLVER_PARALLELISM}: worker threads for batch resolution, default 1
 *   <li>{@code ZMANIM_PARSE_CACHE_SIZE}: parsed formulas kept per engine, default 1024
 *   <li>{@code ZMANIM_DEFAULT_ZONE}: zone for locations created without one, default UTC
 * </ul>
 *
 * Unparseable values fall back to the default with a warning.
 */
public final class EngineConfig {
  private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

  private EngineConfig() {}

  /** Whether elevation is ignored unless a publisher's options say otherwise. */
  public static final boolean IGNORE_ELEVATION =
      Boolean.parseBoolean(getEnvOrDefault("ZMANIM_IGNORE_ELEVATION", "false"));

  /** Worker threads used by the dependency resolver. */
  public static final int RESOLVER_PARALLELISM = positiveInt("ZMANIM_RESOLVER_PARALLELISM", 1);

  /** Most recently used formula texts whose parse trees an engine keeps. */
  public static final int PARSE_CACHE_SIZE = positiveInt("ZMANIM_PARSE_CACHE_SIZE", 1024);

  /** Zone for locations created without an explicit zone. */
  public static final ZoneId DEFAULT_ZONE = defaultZone();

  private static int positiveInt(String key, int defaultValue) {
    String value = getEnvOrDefault(key, String.valueOf(defaultValue));
    try {
      int n = Integer.parseInt(value.trim());
      if (n >= 1) {
        return n;
      }
    } catch (NumberFormatException e) {
      log.warn("ignoring {}={}: {}", key, value, e.getMessage());
      return defaultValue;
    }
    log.warn("ignoring {}={}: must be at least 1", key, value);
    return defaultValue;
  }

  private static ZoneId defaultZone() {
    String value = getEnvOrDefault("ZMANIM_DEFAULT_ZONE", "UTC");
    try {
      return ZoneId.of(value);
    } catch (DateTimeException e) {
      log.warn("ignoring ZMANIM_DEFAULT_ZONE={}: {}", value, e.getMessage());
      return ZoneId.of("UTC");
    }
  }

  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }
}
