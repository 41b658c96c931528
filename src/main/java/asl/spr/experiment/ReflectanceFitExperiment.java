package asl.spr.experiment;

import asl.spr.exception.FitDivergedException;
import asl.spr.exception.NoCriticalAngleFoundException;
import asl.spr.input.AngleRange;
import asl.spr.input.Configuration;
import asl.spr.input.FitConfiguration;
import asl.spr.input.OpticalStack;
import asl.spr.input.ScanFrame;
import asl.spr.input.ScanSequence;
import asl.spr.output.FitResult;
import java.text.DecimalFormat;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Fits one value of an optical stack to a scan of a measurement and plots the measured trace
 * against the fitted model. The result includes the stack with the fitted value and the bulk
 * index inferred from TIR written into it; the stack set on this experiment is left as it was,
 * also when the fit fails.
 *
 * The TIR window used for the bulk index follows the configured scan count rule unless set.
 *
 * @author akearns - KBRWyle
 */
public class ReflectanceFitExperiment extends Experiment {

  private final Configuration configuration;
  private OpticalStack stack;
  private FitConfiguration fitConfiguration;
  private AngleRange tirWindow;
  private int scanIndex;
  private FitResult result;
  private OpticalStack fittedStack;

  public ReflectanceFitExperiment() {
    this(Configuration.getInstance());
  }

  public ReflectanceFitExperiment(Configuration configuration) {
    super();
    this.configuration = configuration;
    scanIndex = -1;
  }

  public void setStack(OpticalStack stack) {
    this.stack = stack;
  }

  public void setFitConfiguration(FitConfiguration fitConfiguration) {
    this.fitConfiguration = fitConfiguration;
  }

  public void setTIRWindow(AngleRange tirWindow) {
    this.tirWindow = tirWindow;
  }

  /**
   * Set the scan of the measurement to fit
   *
   * @param scanIndex Index of scan, or a negative value to use the last scan
   */
  public void setScanIndex(int scanIndex) {
    this.scanIndex = scanIndex;
  }

  @Override
  protected void backend(final ScanSequence sequence)
      throws FitDivergedException, NoCriticalAngleFoundException {

    result = null;
    fittedStack = null;

    int index = scanIndex < 0 ? sequence.size() - 1 : scanIndex;
    ScanFrame frame = scanIndex < 0 ? sequence.getLastFrame() : sequence.getFrame(scanIndex);
    AngleRange window = tirWindow;
    if (window == null) {
      window = configuration.getTIRWindowForScanCount(sequence.size());
    }

    ReflectanceFitter fitter = new ReflectanceFitter(configuration.getDerivativeStep(),
        configuration.getTIRDensePoints());

    fireStateChange("Fitting " + fitConfiguration.getParameter() + " to scan " + index + "...");
    result = fitter.fit(stack, fitConfiguration, frame, window, sequence.getScanSpeed());
    fittedStack = result.applyTo(stack);

    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(toSeries(sequence.getName() + " scan " + index, result.getAngles(),
        result.getMeasured()));
    xysc.addSeries(toSeries("Fitted model", result.getAngles(), result.getModeled()));
    xySeriesData.add(xysc);
  }

  @Override
  String[] getDataStrings() {
    DecimalFormat df = DECIMAL_FORMAT.get();
    String unit = result.getParameter().getAttribute().getUnit();
    StringBuilder sb = new StringBuilder();
    sb.append("Fitted ").append(result.getParameter()).append(": ");
    sb.append(df.format(result.getFittedValue()));
    if (!unit.isEmpty()) {
      sb.append(' ').append(unit);
    }
    sb.append('\n');
    sb.append("Offset: ").append(df.format(result.getOffset())).append('\n');
    sb.append("TIR angle: ").append(df.format(result.getTIRAngle())).append(" deg\n");
    sb.append("Bulk index: ").append(df.format(result.getBulkIndex())).append('\n');
    sb.append("RMS residual: ").append(result.getRMS());
    return new String[]{sb.toString()};
  }

  /**
   * @return Result of the last successful fit
   */
  public FitResult getResult() {
    return result;
  }

  /**
   * @return Copy of the stack holding the fitted value and inferred bulk index, null if the last
   * fit failed
   */
  public OpticalStack getFittedStack() {
    return fittedStack;
  }

  @Override
  public boolean hasEnoughData(final ScanSequence sequence) {
    return stack != null && fitConfiguration != null && sequence != null
        && sequence.size() > 0 && sequence.size() > scanIndex;
  }
}
