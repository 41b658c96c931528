package asl.spr.utils;

import asl.spr.exception.NoResonanceFoundException;
import asl.spr.input.ScanFrame;
import asl.spr.output.SPRData;
import java.util.Arrays;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;

/**
 * Finds the surface plasmon resonance angle of a scan, the position of the reflectance minimum.
 * The sampled minimum is refined with a cubic fit over a neighborhood of samples around it.
 *
 * @author akearns - KBRWyle
 */
public class SPRLocator {

  public static final int DEFAULT_POINTS_BELOW = 70;
  public static final int DEFAULT_POINTS_ABOVE = 70;
  public static final int DEFAULT_DENSE_POINTS = 4000;

  private static final int FIT_DEGREE = 3;

  private SPRLocator() {
  }

  public static SPRData locate(ScanFrame frame) throws NoResonanceFoundException {
    return locate(frame, DEFAULT_POINTS_BELOW, DEFAULT_POINTS_ABOVE, DEFAULT_DENSE_POINTS);
  }

  /**
   * Locate the SPR angle of a scan
   *
   * @param frame Scan to analyze
   * @param pointsBelow Samples below the minimum to include in the fit
   * @param pointsAbove Samples above the minimum to include in the fit
   * @param densePoints Number of points the fitted polynomial is evaluated at
   * @return SPR angle and the fitted curve around it
   * @throws NoResonanceFoundException if the minimum is undefined or too close to the scan edge
   */
  public static SPRData locate(ScanFrame frame, int pointsBelow, int pointsAbove,
      int densePoints) throws NoResonanceFoundException {

    double[] angles = frame.getAngles();
    double[] intensities = frame.getIntensities();

    if (intensities.length == 0) {
      throw new NoResonanceFoundException("Scan is empty");
    }
    if (!NumericUtils.allFinite(intensities)) {
      throw new NoResonanceFoundException("Scan has undefined intensities");
    }

    int min = NumericUtils.argmin(intensities);
    int first = min - pointsBelow;
    int last = min + pointsAbove;
    if (first < 0 || last >= intensities.length) {
      throw new NoResonanceFoundException("Minimum at "
          + NumericUtils.DECIMAL_FORMAT.get().format(angles[min])
          + " deg does not leave " + pointsBelow + " samples below and " + pointsAbove
          + " samples above it in a scan of " + intensities.length + " samples");
    }

    double[] fitX = Arrays.copyOfRange(angles, first, last + 1);
    double[] fitY = Arrays.copyOfRange(intensities, first, last + 1);
    UnivariateFunction polynomial;
    try {
      polynomial = NumericUtils.fitPolynomial(fitX, fitY, FIT_DEGREE);
    } catch (MathIllegalStateException | IllegalArgumentException e) {
      throw new NoResonanceFoundException("Polynomial fit around reflectance minimum failed", e);
    }

    double[] denseAngles = NumericUtils.linspace(fitX[0], fitX[fitX.length - 1], densePoints);
    double[] denseValues = NumericUtils.evaluate(polynomial, denseAngles);
    if (!NumericUtils.allFinite(denseValues)) {
      throw new NoResonanceFoundException("Polynomial fit around reflectance minimum diverged");
    }
    double angle = denseAngles[NumericUtils.argmin(denseValues)];

    return new SPRData(angle, denseAngles, denseValues);
  }
}
