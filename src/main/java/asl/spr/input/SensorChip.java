package asl.spr.input;

import asl.spr.exception.StackConfigurationException;
import org.apache.commons.math3.complex.Complex;
import org.apache.log4j.Logger;

/**
 * Default sensor chip definitions, giving the layer structure and tabulated optical constants of
 * the common sensor types at the instrument's laser wavelengths (670, 785 and 980 nm).
 * The bulk medium defaults to air; it is normally replaced by the index inferred from TIR.
 *
 * Fused silica values: L. V. Rodriguez-de Marcos, J. I. Larruquert, J. A. Mendez,
 * J. A. Aznarez, Self-consistent optical constants of SiO2 and Ta2O5 films,
 * Opt. Mater. Express 6, 3622-3637 (2016).
 *
 * @author akearns - KBRWyle
 */
public enum SensorChip {

  GOLD("Gold sensor", new String[]{"Prism", "Cr", "Au", "Bulk"},
      new double[]{OpticalStack.UNDEFINED, 2.00, 50.00, OpticalStack.UNDEFINED},
      FitParameter.imaginaryIndex(2)) {
    @Override
    double[][] opticalConstants(int wavelength) {
      switch (wavelength) {
        case 670:
          return new double[][]{
              {1.5202, 3.3105, 0.2238, 1.0003},
              {0, 3.4556, 3.9259, 0}};
        case 785:
          return new double[][]{
              {1.5162, 3.3225, 0.2580, 1.0003},
              {0, 3.6148, 4.88, 0}};
        case 980:
          return new double[][]{
              {1.5130, 3.4052, 0.28, 1.0003},
              {0, 3.5678, 6.7406, 0}};
        default:
          return null;
      }
    }
  },
  SILICA("SiO2 sensor", new String[]{"Prism", "Cr", "Au", "SiO2", "Bulk"},
      new double[]{OpticalStack.UNDEFINED, 2.00, 50.00, 14.00, OpticalStack.UNDEFINED},
      FitParameter.thickness(3)) {
    @Override
    double[][] opticalConstants(int wavelength) {
      switch (wavelength) {
        case 670:
          return new double[][]{
              {1.5202, 3.3105, 0.2238, 1.4628, 1.0003},
              {0, 3.4556, 3.9259, 0, 0}};
        case 785:
          return new double[][]{
              {1.5162, 3.3225, 0.2580, 1.4610, 1.0003},
              {0, 3.6148, 4.88, 0, 0}};
        case 980:
          return new double[][]{
              {1.5130, 3.4052, 0.28, 1.4592, 1.0003},
              {0, 3.5678, 6.7406, 0, 0}};
        default:
          return null;
      }
    }
  },
  PALLADIUM("Palladium sensor", new String[]{"Prism", "Cr", "Pd", "Bulk"},
      new double[]{OpticalStack.UNDEFINED, 2.00, 20.00, OpticalStack.UNDEFINED},
      FitParameter.imaginaryIndex(2)) {
    @Override
    double[][] opticalConstants(int wavelength) {
      switch (wavelength) {
        case 670:
          return new double[][]{
              {1.5202, 3.3105, 2.25, 1.0003},
              {0, 3.4556, 4.60, 0}};
        case 785:
          return new double[][]{
              {1.5162, 3.3225, 2.5467, 1.0003},
              {0, 3.6148, 5.1250, 0}};
        case 980:
          return new double[][]{
              {1.5130, 3.4052, 3.0331, 1.0003},
              {0, 3.5678, 6.1010, 0}};
        default:
          return null;
      }
    }
  },
  PLATINUM("Platinum sensor", new String[]{"Prism", "Cr", "Pt", "Bulk"},
      new double[]{OpticalStack.UNDEFINED, 2.00, 20.00, OpticalStack.UNDEFINED},
      FitParameter.imaginaryIndex(2)) {
    @Override
    double[][] opticalConstants(int wavelength) {
      switch (wavelength) {
        case 785:
        case 980:
          // no tabulated values at these wavelengths yet
          logger.warn("Default values for platinum at " + wavelength + " nm are not available, "
              + "using 670 nm values; enter values manually");
          // fall through
        case 670:
          return new double[][]{
              {1.5202, 3.3105, 2.4687, 1.0003},
              {0, 3.4556, 5.2774, 0}};
        default:
          return null;
      }
    }
  };

  private static final Logger logger = Logger.getLogger(SensorChip.class);

  private final String name;
  private final String[] layerNames;
  private final double[] thicknesses;
  private final FitParameter defaultFitParameter;

  SensorChip(String name, String[] layerNames, double[] thicknesses,
      FitParameter defaultFitParameter) {
    this.name = name;
    this.layerNames = layerNames;
    this.thicknesses = thicknesses;
    this.defaultFitParameter = defaultFitParameter;
  }

  /**
   * Tabulated optical constants for the chip's layers
   *
   * @param wavelength Laser wavelength in nm
   * @return Array of real indices (index 0) and extinction coefficients (index 1), or null if
   * the wavelength is not tabulated
   */
  abstract double[][] opticalConstants(int wavelength);

  /**
   * Create the default stack of this chip at a given wavelength
   *
   * @param wavelength Laser wavelength in nm (670, 785 or 980)
   * @param polarization Polarization of the incident light
   * @return Stack holding the default layer structure and optical constants
   * @throws StackConfigurationException if the wavelength has no tabulated values
   */
  public OpticalStack createStack(int wavelength, Polarization polarization) {
    double[][] constants = opticalConstants(wavelength);
    if (constants == null) {
      throw new StackConfigurationException("No default optical constants for " + name
          + " at " + wavelength + " nm");
    }
    Complex[] indices = new Complex[layerNames.length];
    for (int i = 0; i < indices.length; ++i) {
      indices[i] = new Complex(constants[0][i], constants[1][i]);
    }
    return new OpticalStack(layerNames, thicknesses, indices, wavelength, polarization);
  }

  /**
   * Create the default stack of this chip for p-polarized light
   *
   * @param wavelength Laser wavelength in nm (670, 785 or 980)
   * @return Stack holding the default layer structure and optical constants
   */
  public OpticalStack createStack(int wavelength) {
    return createStack(wavelength, Polarization.P);
  }

  /**
   * @return The stack value fit by default for this chip type
   */
  public FitParameter getDefaultFitParameter() {
    return defaultFitParameter;
  }

  public String getName() {
    return name;
  }
}
