package io.cardinal.sketch;

/**
 * Improved raw estimator described in "New cardinality estimation algorithms for HyperLogLog sketches",
 * Otmar Ertl, https://arxiv.org/abs/1702.01284.
 *
 * <p>Unlike the original HyperLogLog estimator it needs neither empirical bias tables nor a switch to linear
 * counting: {@link #sigma(double)} corrects for empty registers and {@link #tau(double)} for registers that
 * reached the maximum rank.
 */
final class ImprovedEstimator
{
  private static final double ALPHA_INF = 0.5 / Math.log(2);

  private ImprovedEstimator()
  {
  }

  static long estimate(int[] histogram, HllConfig config)
  {
    final double m = config.numberRegisters();
    final int q = config.rankBits();

    double z = m * tau((m - histogram[q + 1]) / m);
    // descending order is part of the estimator's definition, do not reorder
    for (int i = q; i >= 1; i--) {
      z += histogram[i];
      z *= 0.5;
    }
    z += m * sigma(histogram[0] / m);

    return Math.round(ALPHA_INF * m * m / z);
  }

  static double sigma(double x)
  {
    if (x == 1.0) {
      return Double.POSITIVE_INFINITY;
    }
    double y = 1.0;
    double z = x;
    double zPrime;
    do {
      x *= x;
      zPrime = z;
      z += x * y;
      y += y;
    } while (zPrime != z);
    return z;
  }

  static double tau(double x)
  {
    if (x == 0.0 || x == 1.0) {
      return 0.0;
    }
    double y = 1.0;
    double z = 1.0 - x;
    double zPrime;
    do {
      x = Math.sqrt(x);
      zPrime = z;
      y *= 0.5;
      z -= (1.0 - x) * (1.0 - x) * y;
    } while (zPrime != z);
    return z / 3.0;
  }
}
