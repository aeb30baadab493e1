package io.zmanim.eval;

import io.zmanim.EngineConfig;

/**
 * Per-publisher evaluation options.
 *
 * @param ignoreElevation compute visible sunrise and sunset at sea level even when an elevation
 *     is known
 */
public record EngineOptions(boolean ignoreElevation) {
  /** The process-wide defaults from {@link EngineConfig}. */
  public static final EngineOptions DEFAULT = new EngineOptions(EngineConfig.IGNORE_ELEVATION);
}
