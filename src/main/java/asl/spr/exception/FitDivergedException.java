package asl.spr.exception;

import asl.spr.input.FitConfiguration;

/**
 * Thrown when the least-squares fit of a stack parameter cannot produce a result. The
 * configuration that was attempted (bounds, initial guess, angular sub-range) is kept so that the
 * caller can adjust it and run the fit again; no retry is done here.
 *
 * @author akearns - KBRWyle
 */
public class FitDivergedException extends AnalysisException {

  private final FitConfiguration configuration;

  public FitDivergedException(String message, FitConfiguration configuration) {
    super(describe(message, configuration));
    this.configuration = configuration;
  }

  public FitDivergedException(String message, FitConfiguration configuration, Throwable cause) {
    super(describe(message, configuration), cause);
    this.configuration = configuration;
  }

  private static String describe(String message, FitConfiguration configuration) {
    return message + " [" + configuration + "]";
  }

  /**
   * Get the fit configuration that failed
   *
   * @return Configuration (parameter, bounds, initial guess, sub-range) used in the failed fit
   */
  public FitConfiguration getConfiguration() {
    return configuration;
  }
}
