package asl.spr.exception;

/**
 * Thrown when the total internal reflection edge cannot be located in a scan, either because the
 * search window holds too few points or because the smoothed derivative has no usable maximum.
 */
public class NoCriticalAngleFoundException extends AnalysisException {

  public NoCriticalAngleFoundException(String message) {
    super(message);
  }

  public NoCriticalAngleFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
