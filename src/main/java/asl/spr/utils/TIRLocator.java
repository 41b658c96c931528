package asl.spr.utils;

import asl.spr.exception.NoCriticalAngleFoundException;
import asl.spr.input.AngleRange;
import asl.spr.input.ScanFrame;
import asl.spr.input.ScanSpeed;
import asl.spr.output.TIRData;
import java.util.Arrays;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;

/**
 * Finds the total internal reflection angle of a scan. The reflectance rises steeply at the
 * critical angle, so the TIR angle is taken as the position of the largest slope of the smoothed
 * intensity, refined by a cubic fit to the derivative around its peak.
 *
 * @author akearns - KBRWyle
 */
public class TIRLocator {

  public static final int DEFAULT_DENSE_POINTS = 4000;

  private static final int FIT_DEGREE = 3;

  private TIRLocator() {
  }

  /**
   * Locate the TIR angle, resampling the fitted derivative at the default density
   *
   * @param frame Scan to analyze
   * @param window Angular window the TIR edge is expected in
   * @param speed Scan speed class, determines smoothing and fit neighborhood
   * @return TIR angle and the derivative curves it was derived from
   * @throws NoCriticalAngleFoundException if no TIR edge can be found in the window
   */
  public static TIRData locate(ScanFrame frame, AngleRange window, ScanSpeed speed)
      throws NoCriticalAngleFoundException {
    return locate(frame, window, speed, DEFAULT_DENSE_POINTS);
  }

  /**
   * Locate the TIR angle of a scan
   *
   * @param frame Scan to analyze
   * @param window Angular window the TIR edge is expected in
   * @param speed Scan speed class, determines smoothing and fit neighborhood
   * @param densePoints Number of points the fitted derivative is evaluated at
   * @return TIR angle and the derivative curves it was derived from
   * @throws NoCriticalAngleFoundException if no TIR edge can be found in the window
   */
  public static TIRData locate(ScanFrame frame, AngleRange window, ScanSpeed speed,
      int densePoints) throws NoCriticalAngleFoundException {

    ScanFrame windowed = frame.subRange(window);
    double[] angles = windowed.getAngles();
    double[] intensities = windowed.getIntensities();

    int width = speed.getSmoothingWidth();
    int below = speed.getFitPointsBelow();
    int above = speed.getFitPointsAbove();

    // smoothing loses width - 1 points, differencing one more
    int minimumPoints = width + below + above + 1;
    if (angles.length < minimumPoints) {
      throw new NoCriticalAngleFoundException("Window " + window + " holds " + angles.length
          + " samples, at least " + minimumPoints + " are needed for " + speed + " scans");
    }
    if (!NumericUtils.allFinite(intensities)) {
      throw new NoCriticalAngleFoundException("Scan has undefined intensities in window "
          + window);
    }

    double[] smoothed = NumericUtils.centeredMovingAverage(intensities, width);
    int half = width / 2;
    double[] smoothedAngles = Arrays.copyOfRange(angles, half, angles.length - half);

    double[] derivative = NumericUtils.firstDifference(smoothed);
    double[] derivativeAngles = NumericUtils.midpoints(smoothedAngles);

    int peak = NumericUtils.argmax(derivative);
    if (!(derivative[peak] > 0.)) {
      throw new NoCriticalAngleFoundException("Intensity does not rise anywhere in window "
          + window);
    }

    int first = peak - below;
    int last = peak + above;
    if (first < 0 || last >= derivative.length) {
      throw new NoCriticalAngleFoundException("Steepest point at "
          + NumericUtils.DECIMAL_FORMAT.get().format(derivativeAngles[peak])
          + " deg is too close to the edge of window " + window);
    }

    double[] fitX = Arrays.copyOfRange(derivativeAngles, first, last + 1);
    double[] fitY = Arrays.copyOfRange(derivative, first, last + 1);
    UnivariateFunction polynomial;
    try {
      polynomial = NumericUtils.fitPolynomial(fitX, fitY, FIT_DEGREE);
    } catch (MathIllegalStateException e) {
      throw new NoCriticalAngleFoundException("Polynomial fit to intensity derivative failed", e);
    }

    double[] denseAngles = NumericUtils.linspace(fitX[0], fitX[fitX.length - 1], densePoints);
    double[] denseValues = NumericUtils.evaluate(polynomial, denseAngles);
    if (!NumericUtils.allFinite(denseValues)) {
      throw new NoCriticalAngleFoundException("Polynomial fit to intensity derivative diverged");
    }
    double angle = denseAngles[NumericUtils.argmax(denseValues)];

    return new TIRData(angle, derivativeAngles, derivative, denseAngles, denseValues);
  }
}
