package asl.spr.test;

import asl.spr.input.Configuration;
import asl.spr.input.OpticalStack;
import asl.spr.input.Polarization;
import asl.spr.utils.FresnelSolver;
import org.apache.commons.math3.complex.Complex;

public class TestUtils {

  public static final String TEST_CONFIG_LOCATION = "src/test/resources/test-config.xml";

  /**
   * Wavelength of the laser used in the test stacks (nm)
   */
  public static final double WAVELENGTH = 670.;

  public static final double PRISM_INDEX = 1.5202;
  public static final double AIR_INDEX = 1.0003;

  public static Configuration loadTestConfiguration() {
    return Configuration.getInstance(TEST_CONFIG_LOCATION);
  }

  public static double[] angleGrid(double start, double end, double step) {
    int points = (int) Math.round((end - start) / step) + 1;
    double[] angles = new double[points];
    for (int i = 0; i < points; ++i) {
      angles[i] = start + i * step;
    }
    return angles;
  }

  /**
   * Smooth step rising from low to high, steepest at center
   */
  public static double[] logisticStep(double[] angles, double center, double width, double low,
      double high) {
    double[] out = new double[angles.length];
    for (int i = 0; i < angles.length; ++i) {
      out[i] = low + (high - low) / (1. + Math.exp(-(angles[i] - center) / width));
    }
    return out;
  }

  /**
   * Lorentzian peak of given depth (height) and half width, centered at center
   */
  public static double[] lorentzian(double[] angles, double center, double halfWidth,
      double depth) {
    double[] out = new double[angles.length];
    for (int i = 0; i < angles.length; ++i) {
      double u = (angles[i] - center) / halfWidth;
      out[i] = depth / (1. + u * u);
    }
    return out;
  }

  /**
   * Synthetic SPR scan: a TIR edge from 0.5 up to 1.0 and a resonance dip down to about 0.1
   */
  public static double[] syntheticScan(double[] angles, double tirAngle, double sprAngle) {
    double[] step = logisticStep(angles, tirAngle, 0.05, 0.5, 1.0);
    double[] dip = lorentzian(angles, sprAngle, 0.3, 0.9);
    double[] out = new double[angles.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = step[i] - dip[i];
    }
    return out;
  }

  /**
   * Gold sensor (prism | 2 nm Cr | Au | air) at 670 nm, p-polarized
   */
  public static OpticalStack goldInAir(double goldThickness) {
    return new OpticalStack(
        new String[]{"Prism", "Cr", "Au", "Bulk"},
        new double[]{OpticalStack.UNDEFINED, 2., goldThickness, OpticalStack.UNDEFINED},
        new Complex[]{
            new Complex(PRISM_INDEX), new Complex(3.3105, 3.4556),
            new Complex(0.2238, 3.9259), new Complex(AIR_INDEX)},
        WAVELENGTH, Polarization.P);
  }

  /**
   * Gold sensor with a dielectric (n = 1.45) surface layer, in air
   */
  public static OpticalStack surfaceLayerInAir(double surfaceThickness) {
    return new OpticalStack(
        new String[]{"Prism", "Cr", "Au", "Surface", "Bulk"},
        new double[]{OpticalStack.UNDEFINED, 2., 50., surfaceThickness, OpticalStack.UNDEFINED},
        new Complex[]{
            new Complex(PRISM_INDEX), new Complex(3.3105, 3.4556),
            new Complex(0.2238, 3.9259), new Complex(1.45), new Complex(AIR_INDEX)},
        WAVELENGTH, Polarization.P);
  }

  public static double[] reflectance(OpticalStack stack, double[] angles) {
    return FresnelSolver.calculate(stack, angles).getReflectance();
  }

  public static double[] addOffset(double[] data, double offset) {
    double[] out = new double[data.length];
    for (int i = 0; i < data.length; ++i) {
      out[i] = data[i] + offset;
    }
    return out;
  }

}
