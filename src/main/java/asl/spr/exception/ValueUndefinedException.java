package asl.spr.exception;

/**
 * Thrown when a numeric layer value that the calculation needs (thickness of an internal layer,
 * refractive index component) has not been given a concrete value.
 */
public class ValueUndefinedException extends IllegalStateException {

  public ValueUndefinedException(String message) {
    super(message);
  }
}
