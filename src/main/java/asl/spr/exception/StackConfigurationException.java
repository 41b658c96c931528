package asl.spr.exception;

/**
 * Thrown when an optical stack or analysis setting is malformed (too few layers, mismatched
 * array lengths, unsupported wavelength...). This is a setup mistake and is not recoverable.
 */
public class StackConfigurationException extends IllegalArgumentException {

  public StackConfigurationException(String message) {
    super(message);
  }
}
