package asl.spr.output;

import asl.spr.input.FitConfiguration;
import asl.spr.input.FitParameter;
import asl.spr.input.OpticalStack;

/**
 * Outcome of fitting one stack parameter to a measured reflectance trace. Holds the fitted
 * value, the vertical offset between measurement and model found by the offset correction, and
 * the modeled trace over the fitted angular range shifted back to the level of the measurement.
 * The TIR angle and bulk index inferred from the scan are kept as well.
 *
 * The stack that was fit is not changed; use {@link #applyTo(OpticalStack)} to get a stack
 * holding the fitted value and the bulk index it was fit with.
 */
public class FitResult {

  private final FitConfiguration configuration;
  private final double fittedValue;
  private final double offset;
  private final double[] angles;
  private final double[] measured;
  private final double[] modeled;
  private final double tirAngle;
  private final double bulkIndex;
  private final double rms;

  public FitResult(FitConfiguration configuration, double fittedValue, double offset,
      double[] angles, double[] measured, double[] modeled, double tirAngle, double bulkIndex,
      double rms) {
    this.configuration = configuration;
    this.fittedValue = fittedValue;
    this.offset = offset;
    this.angles = angles;
    this.measured = measured;
    this.modeled = modeled;
    this.tirAngle = tirAngle;
    this.bulkIndex = bulkIndex;
    this.rms = rms;
  }

  public FitConfiguration getConfiguration() {
    return configuration;
  }

  public FitParameter getParameter() {
    return configuration.getParameter();
  }

  public double getFittedValue() {
    return fittedValue;
  }

  /**
   * @return Vertical offset subtracted from the measurement in the final fit round
   */
  public double getOffset() {
    return offset;
  }

  /**
   * @return Angles (degrees) of the fitted sub-range
   */
  public double[] getAngles() {
    return angles.clone();
  }

  /**
   * @return Measured intensities over the fitted sub-range, as given (offset not removed)
   */
  public double[] getMeasured() {
    return measured.clone();
  }

  /**
   * @return Modeled intensities at the fitted value, shifted by the offset onto the measurement
   */
  public double[] getModeled() {
    return modeled.clone();
  }

  public double getTIRAngle() {
    return tirAngle;
  }

  public double getBulkIndex() {
    return bulkIndex;
  }

  /**
   * @return Root-mean-square residual of the final fit round
   */
  public double getRMS() {
    return rms;
  }

  /**
   * Produce the stack the fitted trace was modeled on: the bulk index inferred from TIR, the
   * extinction correction of the fitted layer and the fitted value are all written in. Solving
   * the returned stack over the fitted angles gives the modeled trace less the offset.
   *
   * @param stack Stack to copy (normally the one the fit was run on)
   * @return New stack holding the fit's bulk index, extinction correction and fitted value
   */
  public OpticalStack applyTo(OpticalStack stack) {
    return configuration.prepareStack(stack, bulkIndex)
        .withParameter(configuration.getParameter(), fittedValue);
  }
}
