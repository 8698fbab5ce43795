package io.cardinal.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.Funnel;
import com.google.common.primitives.UnsignedBytes;

import java.util.Arrays;

/**
 * HyperLogLog sketch using 64-bits hashes and the improved estimator of {@link ImprovedEstimator}.
 *
 * <p>Differences from the paper
 * <ul>
 *   <li>each register takes 8-bits instead of 6-bits
 *   <li>bucket index and position of 1 are took from the least-significant bits instead of most-significant bits
 * </ul>
 *
 * <p>Instances are not thread-safe. To ingest in parallel, fill one sketch per worker and {@link #merge} them
 * afterwards; merge is commutative and associative, so the reduction order does not matter.
 */
public class HyperLogLog implements CardinalityEstimator<HyperLogLog>
{
  private static final int HISTOGRAM_SIZE = 64;

  private final HllConfig config;
  private final ElementHasher hasher;

  // each register actually only needs 6-bits,
  // we use `byte` here to simplify implementation
  private final byte[] registers;

  public HyperLogLog()
  {
    this(HllConfig.defaultConfig());
  }

  public HyperLogLog(int precision)
  {
    this(HllConfig.of(precision));
  }

  public HyperLogLog(HllConfig config)
  {
    this(config, HashFunctionHasher.defaultHasher());
  }

  public HyperLogLog(HllConfig config, ElementHasher hasher)
  {
    this(config, hasher, new byte[config.numberRegisters()]);
  }

  private HyperLogLog(HllConfig config, ElementHasher hasher, byte[] registers)
  {
    this.config = Preconditions.checkNotNull(config, "config");
    this.hasher = Preconditions.checkNotNull(hasher, "hasher");
    this.registers = registers;
  }

  /**
   * Wraps {@code registers} without copying. The caller must not modify the array afterwards.
   *
   * @throws IllegalArgumentException if the length is not {@code 2^p} or a register exceeds {@code 64 - p + 1}
   */
  public static HyperLogLog withRegisters(HllConfig config, byte[] registers)
  {
    return withRegisters(config, HashFunctionHasher.defaultHasher(), registers);
  }

  public static HyperLogLog withRegisters(HllConfig config, ElementHasher hasher, byte[] registers)
  {
    Preconditions.checkArgument(
        registers.length == config.numberRegisters(),
        "invalid registers length [%s] : should be %s",
        registers.length,
        config.numberRegisters()
    );
    final int maxRank = config.maxRank();
    for (int i = 0; i < registers.length; i++) {
      int value = UnsignedBytes.toInt(registers[i]);
      Preconditions.checkArgument(value <= maxRank, "register [%s] holds %s, max is %s", i, value, maxRank);
    }
    return new HyperLogLog(config, hasher, registers);
  }

  @Override
  public void add(byte[] value)
  {
    addHash(hasher.hashBytes(value));
  }

  @Override
  public void add(long value)
  {
    addHash(hasher.hashLong(value));
  }

  public <T> void add(T value, Funnel<? super T> funnel)
  {
    addHash(hasher.hash(value, funnel));
  }

  /**
   * Adds {@code value} hashed by {@code elementHasher} instead of this sketch's own hasher. Every element of this
   * sketch, and of the sketches it is merged with, must go through the same hasher.
   */
  public <T> void add(T value, Funnel<? super T> funnel, ElementHasher elementHasher)
  {
    addHash(elementHasher.hash(value, funnel));
  }

  @Override
  public void addHash(long hash)
  {
    final int index = (int) (hash & config.registerMask());
    // the sentinel bit at position q caps the rank at q + 1 when the remaining bits are all zero
    final long remaining = (hash >>> config.precision()) | (1L << config.rankBits());
    final byte positionOfOne = (byte) (Long.numberOfTrailingZeros(remaining) + 1);
    // note that both operands can never be negative, so we don't need to use unsigned comparison
    if (registers[index] < positionOfOne) {
      registers[index] = positionOfOne;
    }
  }

  @Override
  public void merge(HyperLogLog that)
  {
    Preconditions.checkArgument(
        registers.length == that.registers.length,
        "cannot merge sketches with %s and %s registers",
        registers.length,
        that.registers.length
    );
    for (int i = 0; i < registers.length; i++) {
      if (registers[i] < that.registers[i]) {
        registers[i] = that.registers[i];
      }
    }
  }

  /**
   * @return {@code histogram[v]} = number of registers holding {@code v}
   */
  public int[] histogram()
  {
    final int[] histogram = new int[HISTOGRAM_SIZE];
    for (byte register : registers) {
      histogram[register]++;
    }
    return histogram;
  }

  @Override
  public long count()
  {
    return ImprovedEstimator.estimate(histogram(), config);
  }

  public double errorRate()
  {
    return config.errorRate();
  }

  public int numEmptyRegisters()
  {
    int zeros = 0;
    for (byte register : registers) {
      if (register == 0) {
        zeros++;
      }
    }
    return zeros;
  }

  public int numberRegisters()
  {
    return config.numberRegisters();
  }

  public int maxByteSize()
  {
    return config.maxByteSize();
  }

  public HllConfig config()
  {
    return config;
  }

  public ElementHasher hasher()
  {
    return hasher;
  }

  /**
   * @return value of register {@code index}, in {@code [0, 64 - p + 1]}
   */
  public int register(int index)
  {
    return registers[index];
  }

  /**
   * @return a copy of the registers
   */
  public byte[] registers()
  {
    return registers.clone();
  }

  public HyperLogLog copy()
  {
    return new HyperLogLog(config, hasher, registers.clone());
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers, `config`, `hasher` reference
  }

  @Override
  public String name()
  {
    return "hll" + config.precision();
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
    return Arrays.equals(registers, ((HyperLogLog) o).registers);
  }

  @Override
  public int hashCode()
  {
    return Arrays.hashCode(registers);
  }

  @Override
  public String toString()
  {
    return "HyperLogLog{p=" + config.precision() + ", emptyRegisters=" + numEmptyRegisters() + '}';
  }
}
