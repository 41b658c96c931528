package asl.spr.utils;

import asl.spr.input.AngleRange;
import asl.spr.input.OpticalStack;
import asl.spr.input.Polarization;
import asl.spr.input.SpectrumType;
import asl.spr.output.FresnelCoefficients;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.complex.ComplexField;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.MatrixUtils;

/**
 * Transfer-matrix calculation of the reflectance, transmittance and absorption of a layered
 * optical stack for light incident from the first layer (the prism).
 *
 * For each incidence angle the propagation angle in every layer is found from Snell's law with
 * complex indices, the Fresnel amplitude coefficients of every interface are computed for the
 * stack's polarization, and the characteristic matrices of the internal layers are multiplied in
 * stack order, closed by the matrix of the last interface. Total amplitude coefficients follow
 * from the assembled matrix.
 *
 * All methods are pure functions of their inputs.
 *
 * @author akearns - KBRWyle
 */
public class FresnelSolver {

  private FresnelSolver() {
  }

  /**
   * Calculate reflectance, transmittance and absorption at each of the given angles
   *
   * @param stack Optical stack to evaluate (validated before use)
   * @param angles Incidence angles in the first layer, in degrees
   * @return Intensity coefficients at each angle
   */
  public static FresnelCoefficients calculate(OpticalStack stack, double[] angles) {
    return calculate(stack, angles, false);
  }

  /**
   * Calculate a modeled trace over evenly spaced angles of a range, for display of a stack's
   * response without measured data
   *
   * @param stack Optical stack to evaluate
   * @param range Angular range to cover, endpoints included
   * @param points Number of angles to evaluate (at least 2)
   * @return Intensity coefficients over the range
   */
  public static FresnelCoefficients calculate(OpticalStack stack, AngleRange range, int points) {
    double[] angles = NumericUtils.linspace(range.getLower(), range.getUpper(), points);
    return calculate(stack, angles, false);
  }

  /**
   * Get the difference between the modeled intensity and measured data, as used by a
   * least-squares fit
   *
   * @param stack Optical stack to evaluate (validated before use)
   * @param angles Incidence angles in degrees
   * @param observed Measured intensity at each angle
   * @param type Kind of intensity the measured data represents
   * @return model - observed at each angle
   */
  public static double[] residuals(OpticalStack stack, double[] angles, double[] observed,
      SpectrumType type) {
    if (angles.length != observed.length) {
      throw new IllegalArgumentException("Got " + angles.length + " angles but "
          + observed.length + " observed values");
    }
    double[] model = calculate(stack, angles).get(type);
    double[] residuals = new double[model.length];
    for (int i = 0; i < model.length; ++i) {
      residuals[i] = model[i] - observed[i];
    }
    return residuals;
  }

  /**
   * Calculate intensity coefficients, optionally sending single-interface stacks through the
   * matrix assembly instead of using the interface coefficients directly
   *
   * @param stack Optical stack to evaluate
   * @param angles Incidence angles in degrees
   * @param forceTransferMatrix True if a two-layer stack should be treated like any other
   * @return Intensity coefficients at each angle
   */
  static FresnelCoefficients calculate(OpticalStack stack, double[] angles,
      boolean forceTransferMatrix) {
    stack.validate();

    Complex[] n = stack.getIndices();
    double[] d = stack.getThicknesses();
    double wavelength = stack.getWavelength();
    Polarization polarization = stack.getPolarization();

    double[] reflectance = new double[angles.length];
    double[] transmittance = new double[angles.length];
    double[] absorption = new double[angles.length];

    for (int i = 0; i < angles.length; ++i) {
      double[] intensities =
          calculateAtAngle(n, d, wavelength, polarization, angles[i], forceTransferMatrix);
      reflectance[i] = intensities[0];
      transmittance[i] = intensities[1];
      absorption[i] = intensities[2];
    }

    return new FresnelCoefficients(angles.clone(), reflectance, transmittance, absorption);
  }

  /**
   * Get the propagation angle in each layer. Where the angle is complex (evanescent wave or lossy
   * layer) the imaginary part is made non-positive so that the field decays into the layer.
   *
   * @param n Complex refractive index of each layer
   * @param angle Incidence angle in the first layer, in degrees
   * @return Complex propagation angle (radians) in each layer
   */
  static Complex[] propagationAngles(Complex[] n, double angle) {
    Complex[] theta = new Complex[n.length];
    theta[0] = new Complex(Math.toRadians(angle));
    for (int a = 0; a < n.length - 1; ++a) {
      Complex snell = n[a].divide(n[a + 1]).multiply(theta[a].sin()).asin();
      theta[a + 1] = new Complex(snell.getReal(), -Math.abs(snell.getImaginary()));
    }
    return theta;
  }

  /**
   * Intensity coefficients at a single angle
   *
   * @return Array of reflectance, transmittance and absorption, in that order
   */
  static double[] calculateAtAngle(Complex[] n, double[] d, double wavelength,
      Polarization polarization, double angle, boolean forceTransferMatrix) {

    int layers = n.length;
    Complex[] theta = propagationAngles(n, angle);
    Complex[] cosTheta = new Complex[layers];
    for (int a = 0; a < layers; ++a) {
      cosTheta[a] = theta[a].cos();
    }

    // amplitude coefficients of each interface
    Complex[] r = new Complex[layers - 1];
    Complex[] t = new Complex[layers - 1];
    for (int a = 0; a < layers - 1; ++a) {
      Complex ni = n[a];
      Complex nf = n[a + 1];
      Complex ci = cosTheta[a];
      Complex cf = cosTheta[a + 1];
      Complex twiceIncident = ni.multiply(ci).multiply(2);
      if (polarization == Polarization.S) {
        Complex denom = ni.multiply(ci).add(nf.multiply(cf));
        r[a] = ni.multiply(ci).subtract(nf.multiply(cf)).divide(denom);
        t[a] = twiceIncident.divide(denom);
      } else {
        Complex denom = ni.multiply(cf).add(nf.multiply(ci));
        r[a] = ni.multiply(cf).subtract(nf.multiply(ci)).divide(denom);
        t[a] = twiceIncident.divide(denom);
      }
    }

    Complex rTotal;
    Complex tTotal;
    if (layers == 2 && !forceTransferMatrix) {
      rTotal = r[0];
      tTotal = t[0];
    } else {
      FieldMatrix<Complex> transfer =
          MatrixUtils.createFieldIdentityMatrix(ComplexField.getInstance(), 2);
      for (int a = 0; a < layers - 2; ++a) {
        // phase thickness of internal layer a + 1
        Complex delta = n[a + 1].multiply(cosTheta[a + 1])
            .multiply(NumericUtils.TAU * d[a + 1] / wavelength);
        Complex[][] phase = new Complex[][]{
            {delta.multiply(Complex.I.negate()).exp(), Complex.ZERO},
            {Complex.ZERO, delta.multiply(Complex.I).exp()}};
        transfer = transfer.multiply(interfaceMatrix(r[a], t[a]))
            .multiply(MatrixUtils.createFieldMatrix(phase));
      }
      transfer = transfer.multiply(interfaceMatrix(r[layers - 2], t[layers - 2]));

      rTotal = transfer.getEntry(1, 0).divide(transfer.getEntry(0, 0));
      tTotal = Complex.ONE.divide(transfer.getEntry(0, 0));
    }

    double reflectance = squaredMagnitude(rTotal);

    // power flow normal to the interfaces in the exit medium relative to the incident medium
    Complex exitFlow;
    Complex incidentFlow;
    if (polarization == Polarization.S) {
      exitFlow = n[layers - 1].multiply(cosTheta[layers - 1]);
      incidentFlow = n[0].multiply(cosTheta[0]);
    } else {
      exitFlow = n[layers - 1].multiply(cosTheta[layers - 1].conjugate());
      incidentFlow = n[0].multiply(cosTheta[0].conjugate());
    }
    double transmittance =
        squaredMagnitude(tTotal) * exitFlow.getReal() / incidentFlow.getReal();

    double absorption = 1. - reflectance - transmittance;
    return new double[]{reflectance, transmittance, absorption};
  }

  private static FieldMatrix<Complex> interfaceMatrix(Complex r, Complex t) {
    Complex[][] entries = new Complex[][]{{Complex.ONE, r}, {r, Complex.ONE}};
    return MatrixUtils.createFieldMatrix(entries).scalarMultiply(Complex.ONE.divide(t));
  }

  private static double squaredMagnitude(Complex c) {
    return c.getReal() * c.getReal() + c.getImaginary() * c.getImaginary();
  }
}
