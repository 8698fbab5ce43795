package io.cardinal.sketch;

import org.junit.Assert;
import org.junit.Test;

public class ImprovedEstimatorTest
{
  @Test
  public void testSigmaEdges()
  {
    Assert.assertEquals(Double.POSITIVE_INFINITY, ImprovedEstimator.sigma(1.0), 0.0);
    Assert.assertEquals(0.0, ImprovedEstimator.sigma(0.0), 0.0);
  }

  @Test
  public void testSigmaHalf()
  {
    // 0.5 + 0.5^2 + 0.5^4 * 2 + 0.5^8 * 4 + 0.5^16 * 8 + ...
    Assert.assertEquals(0.8907470740, ImprovedEstimator.sigma(0.5), 1e-9);
  }

  @Test
  public void testSigmaGrowsTowardsOne()
  {
    double previous = 0.0;
    for (int i = 1; i < 10; i++) {
      double x = i / 10.0;
      double sigma = ImprovedEstimator.sigma(x);
      Assert.assertTrue(sigma >= x);
      Assert.assertTrue(sigma > previous);
      previous = sigma;
    }
  }

  @Test
  public void testTauEdges()
  {
    Assert.assertEquals(0.0, ImprovedEstimator.tau(0.0), 0.0);
    Assert.assertEquals(0.0, ImprovedEstimator.tau(1.0), 0.0);
  }

  @Test
  public void testTauBounds()
  {
    for (int i = 1; i < 20; i++) {
      double x = i / 20.0;
      double tau = ImprovedEstimator.tau(x);
      Assert.assertTrue("tau(" + x + ") = " + tau, tau > 0.0);
      Assert.assertTrue("tau(" + x + ") = " + tau, tau < (1.0 - x) / 3.0);
    }
  }

  @Test
  public void testEmptyHistogram()
  {
    HllConfig config = HllConfig.of(10);
    int[] histogram = new int[64];
    histogram[0] = config.numberRegisters();
    Assert.assertEquals(0, ImprovedEstimator.estimate(histogram, config));
  }

  @Test
  public void testAllRegistersSaturated()
  {
    // every register at q + 1 leaves no information about the cardinality, the estimate saturates
    HllConfig config = HllConfig.of(4);
    int[] histogram = new int[64];
    histogram[config.maxRank()] = config.numberRegisters();
    Assert.assertEquals(Long.MAX_VALUE, ImprovedEstimator.estimate(histogram, config));
  }

  @Test
  public void testHigherRanksGiveLargerEstimates()
  {
    HllConfig config = HllConfig.of(4);
    int[] low = new int[64];
    low[0] = 8;
    low[1] = 8;
    int[] high = new int[64];
    high[0] = 8;
    high[20] = 8;
    Assert.assertTrue(ImprovedEstimator.estimate(high, config) > ImprovedEstimator.estimate(low, config));
  }
}
