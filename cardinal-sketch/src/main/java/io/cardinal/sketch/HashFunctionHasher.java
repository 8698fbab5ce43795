package io.cardinal.sketch;

import com.google.common.base.Preconditions;
import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * {@link ElementHasher} backed by a Guava {@link HashFunction}. Only the first 64 bits of the hash code are used.
 */
public final class HashFunctionHasher implements ElementHasher
{
  static final int DEFAULT_SEED = 0x355e438b;

  private static final HashFunctionHasher DEFAULT = murmur3(DEFAULT_SEED);

  private final HashFunction hashFunction;

  public HashFunctionHasher(HashFunction hashFunction)
  {
    Preconditions.checkArgument(
        hashFunction.bits() >= Long.SIZE,
        "hash function [%s] produces %s bits, at least 64 are required",
        hashFunction,
        hashFunction.bits()
    );
    this.hashFunction = hashFunction;
  }

  /**
   * The hasher used by sketches that are not given one explicitly: murmur3_128 with a fixed seed, so that
   * sketches built by different processes stay mergeable.
   */
  public static HashFunctionHasher defaultHasher()
  {
    return DEFAULT;
  }

  public static HashFunctionHasher murmur3(int seed)
  {
    return new HashFunctionHasher(Hashing.murmur3_128(seed));
  }

  public static HashFunctionHasher sipHash24(long k0, long k1)
  {
    return new HashFunctionHasher(Hashing.sipHash24(k0, k1));
  }

  @Override
  public <T> long hash(T value, Funnel<? super T> funnel)
  {
    return hashFunction.hashObject(value, funnel).asLong();
  }

  @Override
  public long hashLong(long value)
  {
    return hashFunction.hashLong(value).asLong();
  }

  @Override
  public long hashBytes(byte[] value)
  {
    return hashFunction.hashBytes(value).asLong();
  }

  @Override
  public String toString()
  {
    return "HashFunctionHasher{" + hashFunction + '}';
  }
}
