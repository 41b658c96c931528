package asl.spr.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.junit.Test;

public class NumericUtilsTest {

  @Test
  public void movingAverageKeepsOnlyFullWindows() {
    double[] data = new double[]{1., 2., 3., 4., 5., 6.};
    double[] smoothed = NumericUtils.centeredMovingAverage(data, 3);
    assertArrayEquals(new double[]{2., 3., 4., 5.}, smoothed, 1E-12);

    smoothed = NumericUtils.centeredMovingAverage(data, 5);
    assertArrayEquals(new double[]{3., 4.}, smoothed, 1E-12);

    assertArrayEquals(data, NumericUtils.centeredMovingAverage(data, 1), 1E-12);
    assertEquals(0, NumericUtils.centeredMovingAverage(data, 7).length);
  }

  @Test(expected = IllegalArgumentException.class)
  public void movingAverageNeedsOddWidth() {
    NumericUtils.centeredMovingAverage(new double[]{1., 2., 3., 4.}, 2);
  }

  @Test
  public void differencesAndMidpoints() {
    double[] x = new double[]{0., 1., 3., 6.};
    assertArrayEquals(new double[]{1., 2., 3.}, NumericUtils.firstDifference(x), 1E-12);
    assertArrayEquals(new double[]{0.5, 2., 4.5}, NumericUtils.midpoints(x), 1E-12);
    assertEquals(0, NumericUtils.firstDifference(new double[]{1.}).length);
  }

  @Test
  public void linspaceIncludesEndpoints() {
    double[] x = NumericUtils.linspace(1., 2., 5);
    assertArrayEquals(new double[]{1., 1.25, 1.5, 1.75, 2.}, x, 1E-12);
  }

  @Test
  public void extremaIndices() {
    double[] x = new double[]{3., -1., 7., 7., -1.};
    assertEquals(2, NumericUtils.argmax(x));
    assertEquals(1, NumericUtils.argmin(x));
    assertEquals(-1., NumericUtils.min(x), 0.);
    assertEquals(-1, NumericUtils.argmax(new double[]{}));
    assertTrue(Double.isNaN(NumericUtils.min(new double[]{})));
  }

  @Test
  public void finiteCheck() {
    assertTrue(NumericUtils.allFinite(new double[]{1., -2., 0.}));
    assertFalse(NumericUtils.allFinite(new double[]{1., Double.NaN}));
    assertFalse(NumericUtils.allFinite(new double[]{Double.NEGATIVE_INFINITY}));
  }

  @Test
  public void cubicFitReproducesCubic() {
    // angles far from zero, as in scan data
    double[] x = new double[21];
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; ++i) {
      x[i] = 61. + 0.01 * i;
      double u = x[i] - 61.1;
      y[i] = 2. - 3. * u + 40. * u * u - 500. * u * u * u;
    }
    UnivariateFunction fit = NumericUtils.fitPolynomial(x, y, 3);
    for (int i = 0; i < x.length; ++i) {
      assertEquals(y[i], fit.value(x[i]), 1E-9);
    }
    double[] values = NumericUtils.evaluate(fit, new double[]{61.05, 61.15});
    assertEquals(fit.value(61.05), values[0], 0.);
    assertEquals(fit.value(61.15), values[1], 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void cubicFitNeedsFourPoints() {
    NumericUtils.fitPolynomial(new double[]{1., 2., 3.}, new double[]{1., 4., 9.}, 3);
  }
}
