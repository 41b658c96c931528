package asl.spr.output;

import asl.spr.input.SpectrumType;

/**
 * Reflectance, transmittance and absorption of an optical stack evaluated at a set of incidence
 * angles. Absorption is what remains of the incident intensity: A = 1 - R - T.
 */
public class FresnelCoefficients {

  private final double[] angles;
  private final double[] reflectance;
  private final double[] transmittance;
  private final double[] absorption;

  public FresnelCoefficients(double[] angles, double[] reflectance, double[] transmittance,
      double[] absorption) {
    this.angles = angles;
    this.reflectance = reflectance;
    this.transmittance = transmittance;
    this.absorption = absorption;
  }

  public double[] getAngles() {
    return angles.clone();
  }

  public double[] getReflectance() {
    return reflectance.clone();
  }

  public double[] getTransmittance() {
    return transmittance.clone();
  }

  public double[] getAbsorption() {
    return absorption.clone();
  }

  /**
   * Get the intensity curve of the requested kind
   *
   * @param type Reflectance, transmittance or absorption
   * @return Values of that intensity at each angle
   */
  public double[] get(SpectrumType type) {
    switch (type) {
      case TRANSMITTANCE:
        return getTransmittance();
      case ABSORPTION:
        return getAbsorption();
      case REFLECTANCE:
      default:
        return getReflectance();
    }
  }

  public int size() {
    return angles.length;
  }
}
