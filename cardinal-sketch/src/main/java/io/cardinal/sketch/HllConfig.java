package io.cardinal.sketch;

import com.google.common.base.Preconditions;

/**
 * Immutable precision settings of a {@link HyperLogLog}.
 *
 * <p>With precision {@code p}, the sketch has {@code m = 2^p} registers. The low {@code p} bits of a hash select
 * the register and the remaining {@code q = 64 - p} bits are used to compute the rank, so a register never holds
 * a value larger than {@code q + 1}.
 */
public final class HllConfig
{
  public static final int MIN_PRECISION = 4;
  public static final int MAX_PRECISION = 18;
  public static final int DEFAULT_PRECISION = 14;

  private static final HllConfig[] CACHE = new HllConfig[MAX_PRECISION + 1];

  static {
    for (int p = MIN_PRECISION; p <= MAX_PRECISION; p++) {
      CACHE[p] = new HllConfig(p);
    }
  }

  private final int p;
  private final int m;
  private final int q;
  private final long registerMask;

  private HllConfig(int precision)
  {
    this.p = precision;
    this.m = 1 << precision;
    this.q = Long.SIZE - precision;
    this.registerMask = m - 1;
  }

  public static HllConfig of(int precision)
  {
    Preconditions.checkArgument(
        precision >= MIN_PRECISION && precision <= MAX_PRECISION,
        "invalid precision [%s] : should be in [%s, %s]",
        precision,
        MIN_PRECISION,
        MAX_PRECISION
    );
    return CACHE[precision];
  }

  public static HllConfig defaultConfig()
  {
    return CACHE[DEFAULT_PRECISION];
  }

  public int precision()
  {
    return p;
  }

  public int numberRegisters()
  {
    return m;
  }

  /**
   * @return number of hash bits left for rank extraction, {@code 64 - p}
   */
  public int rankBits()
  {
    return q;
  }

  /**
   * @return the largest value a register can hold, {@code q + 1}
   */
  public int maxRank()
  {
    return q + 1;
  }

  long registerMask()
  {
    return registerMask;
  }

  public int maxByteSize()
  {
    return m;
  }

  /**
   * @return the theoretical relative standard error, {@code 1.04 / sqrt(m)}
   */
  public double errorRate()
  {
    return 1.04 / Math.sqrt(m);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return p == ((HllConfig) o).p;
  }

  @Override
  public int hashCode()
  {
    return p;
  }

  @Override
  public String toString()
  {
    return "HllConfig{p=" + p + ", m=" + m + '}';
  }
}
