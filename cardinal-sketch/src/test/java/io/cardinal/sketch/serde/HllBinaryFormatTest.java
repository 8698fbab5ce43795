package io.cardinal.sketch.serde;

import io.cardinal.sketch.HllConfig;
import io.cardinal.sketch.HyperLogLog;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

public class HllBinaryFormatTest
{
  private static final HllConfig DEFAULT = HllConfig.defaultConfig();
  private static final HllConfig TINY = HllConfig.of(4);

  @Test
  public void testEmptyLayout() throws Exception
  {
    byte[] bytes = HllBinaryFormat.toBytes(new HyperLogLog(DEFAULT));
    Assert.assertArrayEquals(new byte[]{0}, bytes);
    Assert.assertEquals(new HyperLogLog(DEFAULT), HllBinaryFormat.fromBytes(DEFAULT, bytes));
  }

  @Test
  public void testSparseLayout() throws Exception
  {
    byte[] registers = new byte[16];
    registers[1] = 3;
    registers[10] = 61;
    HyperLogLog hll = HyperLogLog.withRegisters(TINY, registers);

    byte[] bytes = HllBinaryFormat.toBytes(hll);
    Assert.assertArrayEquals(
        new byte[]{
            1,
            2, 0, 0, 0,
            1, 0, 3,
            10, 0, 61
        },
        bytes
    );
    Assert.assertEquals(hll, HllBinaryFormat.fromBytes(TINY, bytes));
  }

  @Test
  public void testFullLayout() throws Exception
  {
    byte[] registers = new byte[16];
    for (int i = 0; i < registers.length; i++) {
      registers[i] = (byte) (i + 1);
    }
    HyperLogLog hll = HyperLogLog.withRegisters(TINY, registers);

    byte[] bytes = HllBinaryFormat.toBytes(hll);
    Assert.assertEquals(1 + 4 + 16, bytes.length);
    Assert.assertArrayEquals(new byte[]{2, 16, 0, 0, 0}, Arrays.copyOf(bytes, 5));
    Assert.assertArrayEquals(registers, Arrays.copyOfRange(bytes, 5, bytes.length));
    Assert.assertEquals(hll, HllBinaryFormat.fromBytes(TINY, bytes));
  }

  @Test
  public void testLargeSparseIndex() throws Exception
  {
    HllConfig config = HllConfig.of(16);
    byte[] registers = new byte[config.numberRegisters()];
    registers[65535] = 7;
    registers[40000] = 2;
    HyperLogLog hll = HyperLogLog.withRegisters(config, registers);

    byte[] bytes = HllBinaryFormat.toBytes(hll);
    Assert.assertEquals(1 + 4 + 2 * 3, bytes.length);
    Assert.assertEquals(hll, HllBinaryFormat.fromBytes(config, bytes));
  }

  @Test
  public void testRoundTrip() throws Exception
  {
    for (int size : new int[]{0, 1, 100, 1000, 100_000}) {
      HyperLogLog hll = HllVariantCodecTest.filled(DEFAULT, size, size);
      HyperLogLog decoded = HllBinaryFormat.fromBytes(DEFAULT, HllBinaryFormat.toBytes(hll));
      Assert.assertEquals(hll, decoded);
      Assert.assertEquals(hll.count(), decoded.count());
    }
  }

  @Test
  public void testSparseIsSmallerThanFull()
  {
    HyperLogLog sparse = HllVariantCodecTest.filled(DEFAULT, 100, 1);
    Assert.assertTrue(HllBinaryFormat.toBytes(sparse).length < DEFAULT.maxByteSize());

    HyperLogLog full = HllVariantCodecTest.filled(DEFAULT, 100_000, 1);
    Assert.assertEquals(1 + 4 + DEFAULT.maxByteSize(), HllBinaryFormat.toBytes(full).length);
  }

  @Test
  public void testMalformed()
  {
    byte[][] payloads = {
        {},
        {3},
        {-1},
        {0, 0},
        {1, 1, 0},
        {1, 1, 0, 0, 0, 1, 0},
        {1, 1, 0, 0, 0, 1, 0, 1, 9},
        {1, 2, 0, 0, 0, 1, 0, 1},
        {1, 0, 0, 0, 0, 5},
        {1, 1, 0, 0, 0, 16, 0, 1},
        {1, 1, 0, 0, 0, 2, 0, 62},
        {2, 16, 0, 0},
        {2, 16, 0, 0, 0, 1, 2},
        {2, 2, 0, 0, 0, 1, 2},
        {1, -1, -1, -1, -1}
    };
    for (byte[] payload : payloads) {
      try {
        HllBinaryFormat.fromBytes(TINY, payload);
        Assert.fail("payload " + Arrays.toString(payload) + " should be rejected");
      }
      catch (HllDecodeException e) {
        Assert.assertNotNull(e.getMessage());
      }
    }
  }

  @Test
  public void testEmptySparseIsAccepted() throws Exception
  {
    Assert.assertEquals(new HyperLogLog(TINY), HllBinaryFormat.fromBytes(TINY, new byte[]{1, 0, 0, 0, 0}));
  }
}
