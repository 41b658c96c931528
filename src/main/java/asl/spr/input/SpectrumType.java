package asl.spr.input;

/**
 * Kind of intensity a measured trace represents, used when computing residuals against a model.
 */
public enum SpectrumType {
  REFLECTANCE,
  TRANSMITTANCE,
  ABSORPTION
}
