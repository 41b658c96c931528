package asl.spr.output;

/**
 * Result of locating the total internal reflection angle in one scan: the angle itself plus the
 * smoothed derivative of the intensity and the local polynomial fit to it, kept for display.
 */
public class TIRData {

  private final double angle;
  private final double[] derivativeAngles;
  private final double[] derivative;
  private final double[] fitAngles;
  private final double[] fitValues;

  public TIRData(double angle, double[] derivativeAngles, double[] derivative,
      double[] fitAngles, double[] fitValues) {
    this.angle = angle;
    this.derivativeAngles = derivativeAngles;
    this.derivative = derivative;
    this.fitAngles = fitAngles;
    this.fitValues = fitValues;
  }

  /**
   * @return TIR angle in degrees
   */
  public double getAngle() {
    return angle;
  }

  public double[] getDerivativeAngles() {
    return derivativeAngles.clone();
  }

  public double[] getDerivative() {
    return derivative.clone();
  }

  public double[] getFitAngles() {
    return fitAngles.clone();
  }

  public double[] getFitValues() {
    return fitValues.clone();
  }
}
