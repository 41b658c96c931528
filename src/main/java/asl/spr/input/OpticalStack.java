package asl.spr.input;

import asl.spr.exception.StackConfigurationException;
import asl.spr.exception.ValueUndefinedException;
import asl.spr.input.FitParameter.Attribute;
import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;

/**
 * Immutable description of a layered optical sensor, ordered from the incident medium (prism)
 * to the bulk medium in contact with the sensor surface. Each layer has a thickness in nm and a
 * complex refractive index n + ik. The two outer layers are semi-infinite and have an undefined
 * thickness (NaN).
 *
 * Changing any value produces a new stack; arrays passed in or returned are always copies, so
 * two analyses holding stacks derived from the same source never share state.
 *
 * @author akearns - KBRWyle
 */
public class OpticalStack {

  /**
   * Thickness value of the semi-infinite boundary layers
   */
  public static final double UNDEFINED = Double.NaN;

  private final String[] layerNames;
  private final double[] thicknesses;
  private final Complex[] indices;
  private final double wavelength;
  private final Polarization polarization;

  /**
   * Create a stack from separate real and imaginary index arrays
   *
   * @param thicknesses Thickness of each layer in nm (NaN for the first and last layer)
   * @param realIndices Real part of refractive index of each layer
   * @param extinctionCoefficients Imaginary part of refractive index of each layer
   * @param wavelength Wavelength of the incident light in nm
   * @param polarization Polarization of the incident light
   */
  public OpticalStack(double[] thicknesses, double[] realIndices, double[] extinctionCoefficients,
      double wavelength, Polarization polarization) {
    this(null, thicknesses, toComplex(realIndices, extinctionCoefficients), wavelength,
        polarization);
  }

  /**
   * Create a stack with named layers
   *
   * @param layerNames Names of layers, used in reports (may be null)
   * @param thicknesses Thickness of each layer in nm (NaN for the first and last layer)
   * @param indices Complex refractive index of each layer
   * @param wavelength Wavelength of the incident light in nm
   * @param polarization Polarization of the incident light
   */
  public OpticalStack(String[] layerNames, double[] thicknesses, Complex[] indices,
      double wavelength, Polarization polarization) {
    if (thicknesses == null || indices == null) {
      throw new StackConfigurationException("Layer thicknesses and indices must be given");
    }
    if (thicknesses.length != indices.length) {
      throw new StackConfigurationException("Number of layer thicknesses ("
          + thicknesses.length + ") does not match number of refractive indices ("
          + indices.length + ")");
    }
    if (layerNames != null && layerNames.length != indices.length) {
      throw new StackConfigurationException("Number of layer names (" + layerNames.length
          + ") does not match number of layers (" + indices.length + ")");
    }
    if (polarization == null) {
      throw new StackConfigurationException("Polarization must be specified");
    }
    this.thicknesses = thicknesses.clone();
    this.indices = indices.clone();
    this.wavelength = wavelength;
    this.polarization = polarization;
    if (layerNames == null) {
      this.layerNames = new String[indices.length];
      for (int i = 0; i < indices.length; ++i) {
        this.layerNames[i] = "Layer " + i;
      }
    } else {
      this.layerNames = layerNames.clone();
    }
  }

  private static Complex[] toComplex(double[] real, double[] imaginary) {
    if (real == null || imaginary == null) {
      throw new StackConfigurationException("Refractive index arrays must be given");
    }
    if (real.length != imaginary.length) {
      throw new StackConfigurationException("Number of real indices (" + real.length
          + ") does not match number of extinction coefficients (" + imaginary.length + ")");
    }
    Complex[] out = new Complex[real.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = new Complex(real[i], imaginary[i]);
    }
    return out;
  }

  /**
   * Check that this stack can be used in a reflectance calculation. Problems in the layer
   * structure are reported before any angle gets evaluated.
   *
   * @throws StackConfigurationException if there are fewer than two layers or the wavelength is
   * not a positive value
   * @throws ValueUndefinedException if an internal layer has no thickness or any refractive index
   * component is not a finite number
   */
  public void validate() {
    if (indices.length < 2) {
      throw new StackConfigurationException(
          "An optical stack needs at least 2 layers, got " + indices.length);
    }
    if (!(wavelength > 0) || Double.isInfinite(wavelength)) {
      throw new StackConfigurationException("Wavelength must be a positive value: " + wavelength);
    }
    for (int i = 0; i < indices.length; ++i) {
      Complex n = indices[i];
      if (n == null || n.isNaN() || n.isInfinite()) {
        throw new ValueUndefinedException("Refractive index of " + layerNames[i] + " (layer " + i
            + ") is undefined");
      }
    }
    for (int i = 1; i < thicknesses.length - 1; ++i) {
      double d = thicknesses[i];
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new ValueUndefinedException("Thickness of internal layer " + layerNames[i]
            + " (layer " + i + ") is undefined");
      }
    }
  }

  public int getNumberOfLayers() {
    return indices.length;
  }

  public Complex getIndex(int layer) {
    return indices[layer];
  }

  public double getThickness(int layer) {
    return thicknesses[layer];
  }

  public String getLayerName(int layer) {
    return layerNames[layer];
  }

  public Complex[] getIndices() {
    return indices.clone();
  }

  public double[] getThicknesses() {
    return thicknesses.clone();
  }

  public String[] getLayerNames() {
    return layerNames.clone();
  }

  /**
   * @return Wavelength of incident light in nm
   */
  public double getWavelength() {
    return wavelength;
  }

  public Polarization getPolarization() {
    return polarization;
  }

  /**
   * Get the current value of the stack entry designated by a fit parameter
   *
   * @param parameter Layer and attribute to read
   * @return The thickness (nm), real index or extinction coefficient of that layer
   */
  public double getParameter(FitParameter parameter) {
    int layer = checkLayer(parameter);
    switch (parameter.getAttribute()) {
      case THICKNESS:
        return thicknesses[layer];
      case REAL_INDEX:
        return indices[layer].getReal();
      case IMAGINARY_INDEX:
        return indices[layer].getImaginary();
      default:
        throw new IllegalArgumentException("Unknown attribute " + parameter.getAttribute());
    }
  }

  /**
   * Get a copy of this stack with the entry designated by the fit parameter replaced
   *
   * @param parameter Layer and attribute to replace
   * @param value New thickness (nm), real index or extinction coefficient
   * @return New stack with the given value substituted; this stack is unchanged
   */
  public OpticalStack withParameter(FitParameter parameter, double value) {
    int layer = checkLayer(parameter);
    double[] newThicknesses = thicknesses.clone();
    Complex[] newIndices = indices.clone();
    Complex n = indices[layer];
    switch (parameter.getAttribute()) {
      case THICKNESS:
        if (layer == 0 || layer == thicknesses.length - 1) {
          throw new StackConfigurationException("Layer " + layer
              + " is a semi-infinite boundary layer and has no thickness to set");
        }
        newThicknesses[layer] = value;
        break;
      case REAL_INDEX:
        newIndices[layer] = new Complex(value, n.getImaginary());
        break;
      case IMAGINARY_INDEX:
        newIndices[layer] = new Complex(n.getReal(), value);
        break;
      default:
        throw new IllegalArgumentException("Unknown attribute " + parameter.getAttribute());
    }
    return new OpticalStack(layerNames, newThicknesses, newIndices, wavelength, polarization);
  }

  /**
   * Get a copy of this stack with the real index of the bulk (last) layer replaced, as done when
   * the bulk index is inferred from a measured TIR angle
   *
   * @param bulkIndex New real refractive index of the bulk medium
   * @return New stack with the bulk index substituted
   */
  public OpticalStack withBulkIndex(double bulkIndex) {
    return withParameter(
        new FitParameter(indices.length - 1, Attribute.REAL_INDEX), bulkIndex);
  }

  /**
   * Get a copy of this stack with an offset added to a layer's extinction coefficient
   *
   * @param layer Index of layer to correct
   * @param offset Value to add to the imaginary part of the layer's index
   * @return New stack with the corrected extinction coefficient
   */
  public OpticalStack withExtinctionOffset(int layer, double offset) {
    FitParameter k = new FitParameter(layer, Attribute.IMAGINARY_INDEX);
    return withParameter(k, getParameter(k) + offset);
  }

  private int checkLayer(FitParameter parameter) {
    int layer = parameter.getLayer();
    if (layer >= indices.length) {
      throw new StackConfigurationException("Layer " + layer + " does not exist in a stack of "
          + indices.length + " layers");
    }
    return layer;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Optical stack (").append(wavelength).append(" nm, ");
    sb.append(polarization).append("-polarized)");
    for (int i = 0; i < indices.length; ++i) {
      sb.append('\n').append(layerNames[i]).append(": d=").append(thicknesses[i]);
      sb.append(" n=").append(indices[i].getReal());
      sb.append(" k=").append(indices[i].getImaginary());
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OpticalStack)) {
      return false;
    }
    OpticalStack other = (OpticalStack) o;
    return Double.compare(wavelength, other.wavelength) == 0
        && polarization == other.polarization
        && Arrays.equals(thicknesses, other.thicknesses)
        && Arrays.equals(indices, other.indices)
        && Arrays.equals(layerNames, other.layerNames);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(thicknesses);
    result = 31 * result + Arrays.hashCode(indices);
    result = 31 * result + Double.hashCode(wavelength);
    result = 31 * result + polarization.hashCode();
    return result;
  }
}
