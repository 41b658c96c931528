package asl.spr.experiment;

import asl.spr.input.OpticalStack;
import asl.spr.input.ScanFrame;
import asl.spr.input.ScanSequence;
import asl.spr.output.FresnelCoefficients;
import asl.spr.utils.FresnelSolver;
import asl.spr.utils.NumericUtils;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Calculates the modeled response of an optical stack over the angles of a measured scan without
 * any fitting, to compare a stack definition against a measurement. The first plot holds the
 * measured scan together with the modeled reflectance, the second the modeled reflectance,
 * transmittance and absorption.
 *
 * @author akearns - KBRWyle
 */
public class FresnelModelExperiment extends Experiment {

  private OpticalStack stack;
  private int scanIndex;
  private FresnelCoefficients coefficients;
  private double modeledMinimumAngle;

  public FresnelModelExperiment() {
    super();
    scanIndex = -1;
  }

  public void setStack(OpticalStack stack) {
    this.stack = stack;
  }

  /**
   * Set the scan of the measurement compared to the model
   *
   * @param scanIndex Index of scan, or a negative value to use the last scan
   */
  public void setScanIndex(int scanIndex) {
    this.scanIndex = scanIndex;
  }

  @Override
  protected void backend(final ScanSequence sequence) {

    int index = scanIndex < 0 ? sequence.size() - 1 : scanIndex;
    ScanFrame frame = scanIndex < 0 ? sequence.getLastFrame() : sequence.getFrame(scanIndex);
    double[] angles = frame.getAngles();

    fireStateChange("Calculating modeled reflectance...");
    coefficients = FresnelSolver.calculate(stack, angles);

    double[] reflectance = coefficients.getReflectance();
    modeledMinimumAngle = angles[NumericUtils.argmin(reflectance)];

    XYSeriesCollection comparison = new XYSeriesCollection();
    comparison.addSeries(toSeries(sequence.getName() + " scan " + index, angles,
        frame.getIntensities()));
    comparison.addSeries(toSeries("Modeled reflectance", angles, reflectance));
    xySeriesData.add(comparison);

    XYSeriesCollection components = new XYSeriesCollection();
    components.addSeries(toSeries("R", angles, reflectance));
    components.addSeries(toSeries("T", angles, coefficients.getTransmittance()));
    components.addSeries(toSeries("A", angles, coefficients.getAbsorption()));
    xySeriesData.add(components);
  }

  @Override
  String[] getDataStrings() {
    return new String[]{
        stack.toString(),
        "Modeled reflectance minimum: "
            + DECIMAL_FORMAT.get().format(modeledMinimumAngle) + " deg"
    };
  }

  public FresnelCoefficients getCoefficients() {
    return coefficients;
  }

  /**
   * @return Angle of lowest modeled reflectance among the scan's angles
   */
  public double getModeledMinimumAngle() {
    return modeledMinimumAngle;
  }

  @Override
  public boolean hasEnoughData(final ScanSequence sequence) {
    return stack != null && sequence != null && sequence.size() > 0
        && sequence.size() > scanIndex;
  }
}
