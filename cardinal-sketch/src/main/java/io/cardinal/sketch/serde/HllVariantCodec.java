package io.cardinal.sketch.serde;

import com.google.common.primitives.UnsignedBytes;
import io.cardinal.sketch.ElementHasher;
import io.cardinal.sketch.HashFunctionHasher;
import io.cardinal.sketch.HllConfig;
import io.cardinal.sketch.HyperLogLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a {@link HyperLogLog} to the cheapest lossless {@link HllVariant} and back.
 *
 * <p>A sparse entry costs 3 bytes (2 for the index, 1 for the value) while the full form costs 1 byte per
 * register, so sparse is chosen only when at most a third of the registers are populated. The choice is made
 * again on every call.
 */
public final class HllVariantCodec
{
  private static final Logger LOG = LoggerFactory.getLogger(HllVariantCodec.class);

  // sparse indices are serialized as uint16
  static final int MAX_SPARSE_PRECISION = 16;

  private HllVariantCodec()
  {
  }

  public static HllVariant encode(HyperLogLog hll)
  {
    final int m = hll.numberRegisters();
    final int nonEmpty = m - hll.numEmptyRegisters();

    if (nonEmpty == 0) {
      return HllVariant.empty();
    }
    if (nonEmpty * 3 <= m && hll.config().precision() <= MAX_SPARSE_PRECISION) {
      int[] indices = new int[nonEmpty];
      byte[] values = new byte[nonEmpty];
      int entry = 0;
      for (int i = 0; i < m; i++) {
        int value = hll.register(i);
        if (value != 0) {
          indices[entry] = i;
          values[entry] = (byte) value;
          entry++;
        }
      }
      LOG.debug("Encoding {} as sparse with {} entries", hll.name(), nonEmpty);
      return HllVariant.sparse(indices, values);
    }
    LOG.debug("Encoding {} as full, {} of {} registers populated", hll.name(), nonEmpty, m);
    return HllVariant.full(hll.registers());
  }

  public static HyperLogLog decode(HllConfig config, HllVariant variant) throws HllDecodeException
  {
    return decode(config, HashFunctionHasher.defaultHasher(), variant);
  }

  /**
   * Rebuilds a sketch of precision {@code config}. The result is always a new sketch.
   *
   * @throws HllDecodeException if an index or value does not fit the precision, or the full form has the wrong
   *                            length
   */
  public static HyperLogLog decode(HllConfig config, ElementHasher hasher, HllVariant variant)
      throws HllDecodeException
  {
    final int m = config.numberRegisters();
    final int maxRank = config.maxRank();

    switch (variant.kind()) {
      case EMPTY:
        return new HyperLogLog(config, hasher);
      case SPARSE: {
        HllVariant.Sparse sparse = (HllVariant.Sparse) variant;
        byte[] registers = new byte[m];
        for (int entry = 0; entry < sparse.size(); entry++) {
          int index = sparse.index(entry);
          if (index < 0 || index >= m) {
            throw new HllDecodeException(
                "sparse entry " + entry + " has index " + index + ", should be in [0, " + m + ")"
            );
          }
          registers[index] = checkValue(sparse.value(entry), maxRank, index);
        }
        return HyperLogLog.withRegisters(config, hasher, registers);
      }
      case FULL: {
        HllVariant.Full full = (HllVariant.Full) variant;
        if (full.length() != m) {
          throw new HllDecodeException("full registers length is " + full.length() + ", should be " + m);
        }
        byte[] registers = full.registers();
        for (int i = 0; i < m; i++) {
          checkValue(registers[i], maxRank, i);
        }
        return HyperLogLog.withRegisters(config, hasher, registers);
      }
      default:
        throw new HllDecodeException("unknown variant " + variant.kind());
    }
  }

  private static byte checkValue(byte value, int maxRank, int index) throws HllDecodeException
  {
    int v = UnsignedBytes.toInt(value);
    if (v > maxRank) {
      throw new HllDecodeException("register " + index + " holds " + v + ", max is " + maxRank);
    }
    return value;
  }
}
