package io.cardinal.sketch;

import com.google.common.base.Supplier;

public final class CardinalityEstimators
{
  private static final String HLL_PREFIX = "hll";

  private CardinalityEstimators()
  {
  }

  /**
   * Creates an estimator from its name: {@code hll} for the default precision, {@code hll<p>} (e.g. {@code hll12})
   * for precision {@code p}.
   */
  public static CardinalityEstimator<HyperLogLog> get(String name)
  {
    if (name.startsWith(HLL_PREFIX)) {
      String pStr = name.substring(HLL_PREFIX.length());
      if (pStr.isEmpty()) {
        return new HyperLogLog(HllConfig.defaultConfig());
      }
      final int precision;
      try {
        precision = Integer.parseInt(pStr);
      }
      catch (NumberFormatException e) {
        throw new IllegalArgumentException("Unknown estimator : " + name, e);
      }
      return new HyperLogLog(HllConfig.of(precision));
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  public static Supplier<CardinalityEstimator<HyperLogLog>> lazyGet(String name)
  {
    return () -> get(name);
  }
}
