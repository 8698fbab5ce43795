package io.cardinal.sketch;

import com.google.common.hash.Funnel;
import com.google.common.hash.Funnels;

/**
 * Maps an element to the 64-bit hash fed into {@link HyperLogLog#addHash(long)}.
 *
 * <p>Implementations must be deterministic and keep the same seed for the lifetime of every sketch they feed.
 * Sketches filled through different hashers cannot be merged or compared, and nothing detects the mistake.
 */
public interface ElementHasher
{
  <T> long hash(T value, Funnel<? super T> funnel);

  default long hashLong(long value)
  {
    return hash(value, Funnels.longFunnel());
  }

  default long hashBytes(byte[] value)
  {
    return hash(value, Funnels.byteArrayFunnel());
  }
}
