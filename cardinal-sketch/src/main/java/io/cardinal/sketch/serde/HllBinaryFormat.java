package io.cardinal.sketch.serde;

import io.cardinal.sketch.ElementHasher;
import io.cardinal.sketch.HashFunctionHasher;
import io.cardinal.sketch.HllConfig;
import io.cardinal.sketch.HyperLogLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Compact binary form of a {@link HllVariant}, all integers little-endian:
 * <pre>
 * Empty  : tag(u8)=0
 * Sparse : tag(u8)=1, count(u32), count * [index(u16), value(u8)]
 * Full   : tag(u8)=2, length(u32), length * value(u8)
 * </pre>
 */
public final class HllBinaryFormat
{
  private static final Logger LOG = LoggerFactory.getLogger(HllBinaryFormat.class);

  private static final int TAG_BYTES = 1;
  private static final int LENGTH_BYTES = Integer.BYTES;
  private static final int SPARSE_ENTRY_BYTES = Short.BYTES + Byte.BYTES;

  private HllBinaryFormat()
  {
  }

  public static byte[] toBytes(HyperLogLog hll)
  {
    return toBytes(HllVariantCodec.encode(hll));
  }

  public static byte[] toBytes(HllVariant variant)
  {
    switch (variant.kind()) {
      case EMPTY:
        return new byte[]{HllVariant.Kind.EMPTY.tag()};
      case SPARSE: {
        HllVariant.Sparse sparse = (HllVariant.Sparse) variant;
        ByteBuffer buffer = ByteBuffer.allocate(TAG_BYTES + LENGTH_BYTES + sparse.size() * SPARSE_ENTRY_BYTES)
                                      .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(HllVariant.Kind.SPARSE.tag());
        buffer.putInt(sparse.size());
        for (int entry = 0; entry < sparse.size(); entry++) {
          buffer.putShort((short) sparse.index(entry));
          buffer.put(sparse.value(entry));
        }
        return buffer.array();
      }
      case FULL: {
        HllVariant.Full full = (HllVariant.Full) variant;
        ByteBuffer buffer = ByteBuffer.allocate(TAG_BYTES + LENGTH_BYTES + full.length())
                                      .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(HllVariant.Kind.FULL.tag());
        buffer.putInt(full.length());
        buffer.put(full.registers());
        return buffer.array();
      }
      default:
        throw new IllegalStateException("unknown variant " + variant.kind());
    }
  }

  public static HyperLogLog fromBytes(HllConfig config, byte[] bytes) throws HllDecodeException
  {
    return fromBytes(config, HashFunctionHasher.defaultHasher(), bytes);
  }

  public static HyperLogLog fromBytes(HllConfig config, ElementHasher hasher, byte[] bytes)
      throws HllDecodeException
  {
    return HllVariantCodec.decode(config, hasher, readVariant(bytes));
  }

  public static HllVariant readVariant(byte[] bytes) throws HllDecodeException
  {
    if (bytes.length < TAG_BYTES) {
      throw fail("empty payload");
    }
    final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    final byte tag = buffer.get();

    if (tag == HllVariant.Kind.EMPTY.tag()) {
      checkNoTrailingBytes(buffer);
      return HllVariant.empty();
    }
    if (tag == HllVariant.Kind.SPARSE.tag()) {
      final long count = readLength(buffer);
      if (count * SPARSE_ENTRY_BYTES != buffer.remaining()) {
        throw fail("sparse payload declares " + count + " entries but carries " + buffer.remaining() + " bytes");
      }
      int[] indices = new int[(int) count];
      byte[] values = new byte[(int) count];
      for (int entry = 0; entry < count; entry++) {
        indices[entry] = Short.toUnsignedInt(buffer.getShort());
        values[entry] = buffer.get();
      }
      return HllVariant.sparse(indices, values);
    }
    if (tag == HllVariant.Kind.FULL.tag()) {
      final long length = readLength(buffer);
      if (length != buffer.remaining()) {
        throw fail("full payload declares " + length + " registers but carries " + buffer.remaining() + " bytes");
      }
      byte[] registers = new byte[(int) length];
      buffer.get(registers);
      return HllVariant.full(registers);
    }
    throw fail("unknown tag " + tag);
  }

  private static long readLength(ByteBuffer buffer) throws HllDecodeException
  {
    if (buffer.remaining() < LENGTH_BYTES) {
      throw fail("truncated payload, missing length");
    }
    return Integer.toUnsignedLong(buffer.getInt());
  }

  private static void checkNoTrailingBytes(ByteBuffer buffer) throws HllDecodeException
  {
    if (buffer.hasRemaining()) {
      throw fail(buffer.remaining() + " trailing bytes after empty sketch");
    }
  }

  private static HllDecodeException fail(String message)
  {
    LOG.debug("Rejecting binary sketch: {}", message);
    return new HllDecodeException(message);
  }
}
