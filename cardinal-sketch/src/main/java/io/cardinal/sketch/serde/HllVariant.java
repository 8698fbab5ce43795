package io.cardinal.sketch.serde;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Logical shape of a serialized sketch, one of
 * <pre>
 * Empty
 * Sparse { entries: (index: uint16, value: uint8)... }
 * Full   { registers: byte[2^p] }
 * </pre>
 * The precision is not part of the variant, readers must know it from context.
 */
public abstract class HllVariant
{
  public enum Kind
  {
    EMPTY(0), SPARSE(1), FULL(2);

    private final byte tag;

    Kind(int tag)
    {
      this.tag = (byte) tag;
    }

    public byte tag()
    {
      return tag;
    }
  }

  /**
   * Largest index a sparse entry can carry.
   */
  public static final int MAX_SPARSE_INDEX = 0xFFFF;

  private static final Empty EMPTY = new Empty();

  private HllVariant()
  {
  }

  public abstract Kind kind();

  public static Empty empty()
  {
    return EMPTY;
  }

  public static Sparse sparse(int[] indices, byte[] values)
  {
    return new Sparse(indices, values);
  }

  public static Full full(byte[] registers)
  {
    return new Full(registers);
  }

  public static final class Empty extends HllVariant
  {
    private Empty()
    {
    }

    @Override
    public Kind kind()
    {
      return Kind.EMPTY;
    }

    @Override
    public String toString()
    {
      return "Empty";
    }
  }

  public static final class Sparse extends HllVariant
  {
    private final int[] indices;
    private final byte[] values;

    private Sparse(int[] indices, byte[] values)
    {
      Preconditions.checkArgument(
          indices.length == values.length,
          "%s indices but %s values",
          indices.length,
          values.length
      );
      for (int index : indices) {
        Preconditions.checkArgument(
            index >= 0 && index <= MAX_SPARSE_INDEX,
            "sparse index [%s] does not fit in 16 bits",
            index
        );
      }
      this.indices = indices.clone();
      this.values = values.clone();
    }

    @Override
    public Kind kind()
    {
      return Kind.SPARSE;
    }

    public int size()
    {
      return indices.length;
    }

    public int index(int entry)
    {
      return indices[entry];
    }

    public byte value(int entry)
    {
      return values[entry];
    }

    @Override
    public boolean equals(Object o)
    {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Sparse)) {
        return false;
      }
      Sparse that = (Sparse) o;
      return Arrays.equals(indices, that.indices) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode()
    {
      return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
    }

    @Override
    public String toString()
    {
      return "Sparse{entries=" + indices.length + '}';
    }
  }

  public static final class Full extends HllVariant
  {
    private final byte[] registers;

    private Full(byte[] registers)
    {
      this.registers = Preconditions.checkNotNull(registers, "registers").clone();
    }

    @Override
    public Kind kind()
    {
      return Kind.FULL;
    }

    public int length()
    {
      return registers.length;
    }

    /**
     * @return a copy of the registers
     */
    public byte[] registers()
    {
      return registers.clone();
    }

    @Override
    public boolean equals(Object o)
    {
      if (this == o) {
        return true;
      }
      return o instanceof Full && Arrays.equals(registers, ((Full) o).registers);
    }

    @Override
    public int hashCode()
    {
      return Arrays.hashCode(registers);
    }

    @Override
    public String toString()
    {
      return "Full{length=" + registers.length + '}';
    }
  }
}
