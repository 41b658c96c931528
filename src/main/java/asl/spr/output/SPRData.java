package asl.spr.output;

/**
 * Result of locating the resonance minimum in one scan, with the local polynomial fit used to
 * refine it.
 */
public class SPRData {

  private final double angle;
  private final double[] fitAngles;
  private final double[] fitValues;

  public SPRData(double angle, double[] fitAngles, double[] fitValues) {
    this.angle = angle;
    this.fitAngles = fitAngles;
    this.fitValues = fitValues;
  }

  /**
   * @return SPR angle in degrees
   */
  public double getAngle() {
    return angle;
  }

  public double[] getFitAngles() {
    return fitAngles.clone();
  }

  public double[] getFitValues() {
    return fitValues.clone();
  }
}
