package asl.spr.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Class containing methods to serve as math functions on sampled curves: smoothing, differences,
 * extrema and local polynomial fits
 *
 * @author akearns
 */
public class NumericUtils {

  /**
   * 2 * Pi, sometimes also referred to as Tau.
   * The number of radians in a full circle.
   */
  public final static double TAU = Math.PI * 2; // radians in full circle

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.####");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Perform a centered moving average on real-val. data. Only points with a full window on both
   * sides are produced, so the output is shorter than the input by points - 1, and output value i
   * is centered on input value i + points / 2.
   *
   * @param nums Numeric data to be smoothed by use of moving average
   * @param points Number of points to include in moving average (odd value)
   * @return Smoothed data resulting from performing the moving average on input data.
   */
  public static double[] centeredMovingAverage(double[] nums, int points) {
    if (points < 1 || points % 2 == 0) {
      throw new IllegalArgumentException("Moving average width must be a positive odd value");
    }
    if (nums.length < points) {
      return new double[]{};
    }
    DescriptiveStatistics windowStats = new DescriptiveStatistics(points);
    double[] out = new double[nums.length - points + 1];
    for (int i = 0; i < nums.length; ++i) {
      windowStats.addValue(nums[i]);
      if (i >= points - 1) {
        out[i - points + 1] = windowStats.getMean();
      }
    }
    return out;
  }

  /**
   * Get the difference between each pair of consecutive values
   *
   * @param nums Data to take differences of
   * @return Array of length one less than input, where entry i is nums[i + 1] - nums[i]
   */
  public static double[] firstDifference(double[] nums) {
    if (nums.length < 2) {
      return new double[]{};
    }
    double[] out = new double[nums.length - 1];
    for (int i = 0; i < out.length; ++i) {
      out[i] = nums[i + 1] - nums[i];
    }
    return out;
  }

  /**
   * Get the point halfway between each pair of consecutive values, the x-values that a first
   * difference is positioned at
   *
   * @param nums Data to take midpoints of
   * @return Array of length one less than input
   */
  public static double[] midpoints(double[] nums) {
    if (nums.length < 2) {
      return new double[]{};
    }
    double[] out = new double[nums.length - 1];
    for (int i = 0; i < out.length; ++i) {
      out[i] = (nums[i] + nums[i + 1]) / 2.;
    }
    return out;
  }

  /**
   * Get evenly spaced values over an interval, including both endpoints
   *
   * @param start First value
   * @param end Last value
   * @param points Number of values to produce (at least 2)
   * @return Array of evenly spaced values from start to end
   */
  public static double[] linspace(double start, double end, int points) {
    if (points < 2) {
      throw new IllegalArgumentException("Need at least 2 points, got " + points);
    }
    double[] out = new double[points];
    double step = (end - start) / (points - 1);
    for (int i = 0; i < points; ++i) {
      out[i] = start + i * step;
    }
    out[points - 1] = end;
    return out;
  }

  /**
   * Index of the largest value (first one in case of ties)
   *
   * @param nums Data to search, should not contain NaN values
   * @return Index of maximum, or -1 if the array is empty
   */
  public static int argmax(double[] nums) {
    int idx = -1;
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < nums.length; ++i) {
      if (idx < 0 || nums[i] > max) {
        max = nums[i];
        idx = i;
      }
    }
    return idx;
  }

  /**
   * Index of the smallest value (first one in case of ties)
   *
   * @param nums Data to search, should not contain NaN values
   * @return Index of minimum, or -1 if the array is empty
   */
  public static int argmin(double[] nums) {
    int idx = -1;
    double min = Double.POSITIVE_INFINITY;
    for (int i = 0; i < nums.length; ++i) {
      if (idx < 0 || nums[i] < min) {
        min = nums[i];
        idx = i;
      }
    }
    return idx;
  }

  /**
   * Smallest value of an array
   *
   * @param nums Data to search
   * @return Minimum value, NaN if the array is empty
   */
  public static double min(double[] nums) {
    int idx = argmin(nums);
    return idx < 0 ? Double.NaN : nums[idx];
  }

  /**
   * Check that every value is a finite number
   *
   * @param nums Data to check
   * @return False if any value is NaN or infinite
   */
  public static boolean allFinite(double[] nums) {
    for (double num : nums) {
      if (Double.isNaN(num) || Double.isInfinite(num)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Least-squares fit of a polynomial to sampled points. The abscissa is centered and scaled to
   * [-1, 1] before fitting to keep the problem well conditioned; the returned function takes
   * the original x values.
   *
   * @param x Sample positions (at least degree + 1 distinct values)
   * @param y Sample values
   * @param degree Degree of the polynomial
   * @return Fitted polynomial as a function of x
   */
  public static UnivariateFunction fitPolynomial(double[] x, double[] y, int degree) {
    if (x.length != y.length || x.length < degree + 1) {
      throw new IllegalArgumentException("Need at least " + (degree + 1)
          + " matching points for polynomial fit, got " + x.length + " and " + y.length);
    }
    final double center = (x[0] + x[x.length - 1]) / 2.;
    double halfWidth = 0.;
    for (double value : x) {
      halfWidth = Math.max(halfWidth, Math.abs(value - center));
    }
    final double scale = halfWidth > 0. ? halfWidth : 1.;

    WeightedObservedPoints points = new WeightedObservedPoints();
    for (int i = 0; i < x.length; ++i) {
      points.add((x[i] - center) / scale, y[i]);
    }
    double[] coefficients = PolynomialCurveFitter.create(degree).fit(points.toList());
    final PolynomialFunction polynomial = new PolynomialFunction(coefficients);
    return value -> polynomial.value((value - center) / scale);
  }

  /**
   * Evaluate a function at each of a set of points
   *
   * @param function Function to evaluate
   * @param x Points to evaluate at
   * @return Function value at each point
   */
  public static double[] evaluate(UnivariateFunction function, double[] x) {
    double[] out = new double[x.length];
    for (int i = 0; i < x.length; ++i) {
      out[i] = function.value(x[i]);
    }
    return out;
  }

  /**
   * Sets decimalformat object so that infinity can be printed in a report
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }
}
