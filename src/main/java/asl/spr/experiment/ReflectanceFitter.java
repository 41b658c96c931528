package asl.spr.experiment;

import asl.spr.exception.FitDivergedException;
import asl.spr.exception.NoCriticalAngleFoundException;
import asl.spr.input.AngleRange;
import asl.spr.input.FitConfiguration;
import asl.spr.input.FitParameter;
import asl.spr.input.OpticalStack;
import asl.spr.input.ScanFrame;
import asl.spr.input.ScanSpeed;
import asl.spr.input.SpectrumType;
import asl.spr.output.FitResult;
import asl.spr.output.TIRData;
import asl.spr.utils.FresnelSolver;
import asl.spr.utils.NumericUtils;
import asl.spr.utils.TIRLocator;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Fits a single value of an optical stack (a layer thickness or index component) to a measured
 * reflectance scan.
 *
 * Before fitting, the TIR angle of the full scan is located and the bulk medium index is set from
 * it (bulk index = prism index * sin(TIR angle)). The configured extinction offset is added to the
 * extinction coefficient of the fitted layer. The measurement is then restricted to the
 * configured angular sub-range and fit in three rounds. Each round subtracts the current vertical
 * offset from the measurement and solves for the free value with the Apache Commons
 * Levenberg-Marquardt optimizer, keeping the value inside the configured bounds; after the first
 * two rounds the offset is moved by the difference between the minima of the offset-corrected
 * measurement and of the model, so that the final round fits a measurement aligned with the model.
 * The number of rounds is fixed and is not a convergence test.
 *
 * The stack given to the fitter is never changed. Failure to fit is reported with the
 * configuration that was attempted; no retry is done.
 *
 * @author akearns - KBRWyle
 */
public class ReflectanceFitter {

  /**
   * Number of fit / offset correction rounds
   */
  public static final int ROUNDS = 3;

  /**
   * Default step used in forward-difference derivatives of the model
   */
  public static final double DEFAULT_DERIVATIVE_STEP = 1E-7;

  /**
   * Used in the least squared solver (quit when function output changes by less than this value)
   */
  private static final double F_TOLER = 1E-12;
  /**
   * Used in the least squared solver (limit in change to apply to the fitted value)
   */
  private static final double X_TOLER = 1E-12;
  private static final int MAX_EVALUATIONS = 2000;

  private static final Logger logger = Logger.getLogger(ReflectanceFitter.class);

  private final double derivativeStep;
  private final int tirDensePoints;

  public ReflectanceFitter() {
    this(DEFAULT_DERIVATIVE_STEP, TIRLocator.DEFAULT_DENSE_POINTS);
  }

  /**
   * @param derivativeStep Step of the forward-difference derivative of the model
   * @param tirDensePoints Resampling density used when locating the TIR angle
   */
  public ReflectanceFitter(double derivativeStep, int tirDensePoints) {
    if (!(derivativeStep > 0.)) {
      throw new IllegalArgumentException("Derivative step must be positive: " + derivativeStep);
    }
    this.derivativeStep = derivativeStep;
    this.tirDensePoints = tirDensePoints;
  }

  /**
   * Fit the configured stack value to a scan
   *
   * @param stack Stack holding every value except the fitted one (and the bulk index, which is
   * replaced); the first layer's real index is used as the incident medium index
   * @param config Fitted value, its bounds and initial guess, angular sub-range, extinction offset
   * @param frame Full measured scan (the TIR angle is found on the whole scan)
   * @param tirWindow Window the TIR angle is searched in
   * @param speed Scan speed class of the measurement
   * @return Fitted value, offset and modeled trace
   * @throws FitDivergedException if the configuration cannot be fit or the optimizer fails
   * @throws NoCriticalAngleFoundException if no TIR angle, and so no bulk index, can be found
   */
  public FitResult fit(OpticalStack stack, FitConfiguration config, ScanFrame frame,
      AngleRange tirWindow, ScanSpeed speed)
      throws FitDivergedException, NoCriticalAngleFoundException {

    final FitParameter parameter = config.getParameter();
    double lower = config.getLowerBound();
    double upper = config.getUpperBound();
    double guess = config.getInitialGuess();

    if (!(lower < upper)) {
      throw new FitDivergedException("Lower bound must be below upper bound", config);
    }
    if (!(guess >= lower && guess <= upper)) {
      throw new FitDivergedException("Initial guess is outside of the bounds", config);
    }

    stack.validate();
    // fails fast if the stack has no such value to fit
    stack.withParameter(parameter, guess);

    TIRData tir = TIRLocator.locate(frame, tirWindow, speed, tirDensePoints);
    double incidentIndex = stack.getIndex(0).getReal();
    double bulkIndex = incidentIndex * Math.sin(Math.toRadians(tir.getAngle()));
    logger.info("TIR angle " + NumericUtils.DECIMAL_FORMAT.get().format(tir.getAngle())
        + " deg gives bulk index " + bulkIndex);

    final OpticalStack fitStack = config.prepareStack(stack, bulkIndex);

    ScanFrame selection = frame.subRange(config.getSubRange());
    if (selection.size() < 2) {
      throw new FitDivergedException("Sub-range holds " + selection.size()
          + " samples, at least 2 are needed", config);
    }
    final double[] angles = selection.getAngles();
    double[] measured = selection.getIntensities();
    if (!NumericUtils.allFinite(measured)) {
      throw new FitDivergedException("Measurement has undefined values in the sub-range", config);
    }

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(F_TOLER).
        withParameterRelativeTolerance(X_TOLER);

    double offset = 0.;
    double fitted = guess;
    double rms = Double.NaN;
    double[] model = null;

    for (int round = 0; round < ROUNDS; ++round) {
      double[] observed = new double[measured.length];
      for (int i = 0; i < observed.length; ++i) {
        observed[i] = measured[i] - offset;
      }

      LeastSquaresProblem lsp = new LeastSquaresBuilder().
          start(new double[]{guess}).
          target(observed).
          model(variables -> jacobian(fitStack, parameter, angles, variables)).
          parameterValidator(new BoundsValidator(lower, upper)).
          lazyEvaluation(false).
          maxEvaluations(MAX_EVALUATIONS).
          maxIterations(MAX_EVALUATIONS).
          build();

      LeastSquaresOptimizer.Optimum optimum;
      try {
        optimum = optimizer.optimize(lsp);
      } catch (ConvergenceException | TooManyEvaluationsException
          | TooManyIterationsException e) {
        throw new FitDivergedException("Optimizer failed in fit round " + (round + 1), config, e);
      }

      fitted = optimum.getPoint().getEntry(0);
      rms = optimum.getRMS();
      if (Double.isNaN(fitted) || Double.isInfinite(fitted)) {
        throw new FitDivergedException("Fit produced an undefined value", config);
      }
      model = reflectance(fitStack, parameter, angles, fitted);
      if (!NumericUtils.allFinite(model)) {
        throw new FitDivergedException("Model is undefined at fitted value " + fitted, config);
      }

      logger.debug("Fit round " + (round + 1) + ": " + parameter + " = " + fitted
          + ", offset " + offset + ", RMS " + rms);

      if (round < ROUNDS - 1) {
        offset += NumericUtils.min(observed) - NumericUtils.min(model);
      }
    }

    double[] modeled = new double[model.length];
    for (int i = 0; i < modeled.length; ++i) {
      modeled[i] = model[i] + offset;
    }

    logger.info("Fit of " + parameter + " converged to " + fitted + " (offset " + offset
        + ", RMS " + rms + ")");

    return new FitResult(config, fitted, offset, angles, measured, modeled, tir.getAngle(),
        bulkIndex, rms);
  }

  private static double[] reflectance(OpticalStack stack, FitParameter parameter,
      double[] angles, double value) {
    return FresnelSolver.calculate(stack.withParameter(parameter, value), angles)
        .get(SpectrumType.REFLECTANCE);
  }

  /**
   * Computes the forward change in value of the modeled reflectance for a change in the fitted
   * value
   *
   * @param variables Vector holding the fitted value
   * @return The model at the passed-in point plus its approximate derivative, as a vector and
   * matrix respectively
   */
  private Pair<RealVector, RealMatrix> jacobian(OpticalStack stack, FitParameter parameter,
      double[] angles, RealVector variables) {
    double value = variables.getEntry(0);
    double[] fInit = reflectance(stack, parameter, angles, value);
    double[] fDiff = reflectance(stack, parameter, angles, value + derivativeStep);

    double[][] jacobian = new double[angles.length][1];
    for (int i = 0; i < angles.length; ++i) {
      jacobian[i][0] = (fDiff[i] - fInit[i]) / derivativeStep;
    }

    RealMatrix jMat = MatrixUtils.createRealMatrix(jacobian);
    RealVector fnc = MatrixUtils.createRealVector(fInit);
    return new Pair<>(fnc, jMat);
  }

  /**
   * Keeps the fitted value inside its bounds during optimization
   */
  private static class BoundsValidator implements ParameterValidator {

    private final double lower;
    private final double upper;

    BoundsValidator(double lower, double upper) {
      this.lower = lower;
      this.upper = upper;
    }

    @Override
    public RealVector validate(RealVector params) {
      for (int i = 0; i < params.getDimension(); ++i) {
        double value = params.getEntry(i);
        if (value < lower) {
          params.setEntry(i, lower);
        } else if (value > upper) {
          params.setEntry(i, upper);
        }
      }
      return params;
    }
  }
}
