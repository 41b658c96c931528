package asl.spr.input;

/**
 * Polarization of the incident light, selecting which Fresnel amplitude formulas are used.
 */
public enum Polarization {
  /**
   * Transverse electric, electric field perpendicular to the plane of incidence
   */
  S,
  /**
   * Transverse magnetic, the polarization that couples into surface plasmons
   */
  P
}
