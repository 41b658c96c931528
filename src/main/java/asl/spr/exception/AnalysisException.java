package asl.spr.exception;

/**
 * Base type for recoverable failures of an analysis unit (one scan, one fit). Callers decide
 * whether to continue a batch or to abort based on the concrete subtype.
 *
 * @author akearns - KBRWyle
 */
public abstract class AnalysisException extends Exception {

  AnalysisException(String message) {
    super(message);
  }

  AnalysisException(String message, Throwable cause) {
    super(message, cause);
  }
}
