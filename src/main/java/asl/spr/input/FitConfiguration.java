package asl.spr.input;

/**
 * Settings of a single-parameter reflectance fit: what to fit, the solver bounds and starting
 * value, the angular range of measured data to fit against and the extinction coefficient
 * correction applied to the fitted layer during the fit.
 */
public class FitConfiguration {

  public static final AngleRange DEFAULT_SUB_RANGE = new AngleRange(40., 80.);
  public static final double DEFAULT_INITIAL_GUESS = 4.;
  public static final double DEFAULT_LOWER_BOUND = 0.;
  public static final double DEFAULT_UPPER_BOUND = 50.;

  private final FitParameter parameter;
  private final double lowerBound;
  private final double upperBound;
  private final double initialGuess;
  private final AngleRange subRange;
  private final double extinctionOffset;

  /**
   * @param parameter Stack value to fit
   * @param lowerBound Lowest value the solver may use
   * @param upperBound Highest value the solver may use
   * @param initialGuess Starting value of the solver
   * @param subRange Angular range of the measured data included in the fit
   * @param extinctionOffset Offset added to the fitted layer's extinction coefficient
   */
  public FitConfiguration(FitParameter parameter, double lowerBound, double upperBound,
      double initialGuess, AngleRange subRange, double extinctionOffset) {
    if (parameter == null || subRange == null) {
      throw new IllegalArgumentException("Fit parameter and angular sub-range must be given");
    }
    this.parameter = parameter;
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
    this.initialGuess = initialGuess;
    this.subRange = subRange;
    this.extinctionOffset = extinctionOffset;
  }

  /**
   * Get a configuration with the default bounds, starting value and range for a parameter
   *
   * @param parameter Stack value to fit
   * @return Configuration fitting in [0, 50] from 4, over 40 to 80 degrees, without extinction
   * correction
   */
  public static FitConfiguration withDefaults(FitParameter parameter) {
    return new FitConfiguration(parameter, DEFAULT_LOWER_BOUND, DEFAULT_UPPER_BOUND,
        DEFAULT_INITIAL_GUESS, DEFAULT_SUB_RANGE, 0.);
  }

  public FitParameter getParameter() {
    return parameter;
  }

  public double getLowerBound() {
    return lowerBound;
  }

  public double getUpperBound() {
    return upperBound;
  }

  public double getInitialGuess() {
    return initialGuess;
  }

  public AngleRange getSubRange() {
    return subRange;
  }

  public double getExtinctionOffset() {
    return extinctionOffset;
  }

  /**
   * Get the stack the fit is evaluated on: the bulk index replaced and the extinction offset
   * added to the fitted layer. When the fitted value is that layer's extinction coefficient the
   * offset is overwritten by each trial value.
   *
   * @param stack Stack holding every value except the fitted one
   * @param bulkIndex Real index of the bulk medium inferred from the TIR angle
   * @return New stack with the bulk index and extinction correction applied
   */
  public OpticalStack prepareStack(OpticalStack stack, double bulkIndex) {
    OpticalStack prepared = stack.withBulkIndex(bulkIndex);
    if (extinctionOffset != 0.) {
      prepared = prepared.withExtinctionOffset(parameter.getLayer(), extinctionOffset);
    }
    return prepared;
  }

  @Override
  public String toString() {
    return "fit " + parameter + " in [" + lowerBound + ", " + upperBound + "] from "
        + initialGuess + " over " + subRange + ", extinction offset " + extinctionOffset;
  }
}
