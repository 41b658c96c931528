package asl.spr.exception;

/**
 * Thrown when no resonance minimum can be fit in a scan (minimum too close to the scan edge,
 * non-finite data or a failed polynomial fit).
 */
public class NoResonanceFoundException extends AnalysisException {

  public NoResonanceFoundException(String message) {
    super(message);
  }

  public NoResonanceFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
