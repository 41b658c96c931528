package asl.spr.experiment;

import asl.spr.input.AngleRange;
import asl.spr.input.Configuration;
import asl.spr.input.ScanSequence;
import asl.spr.output.Sensorgram;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Produces the sensorgram of a measurement: the SPR and TIR angle of every scan, plotted against
 * the scan time as shifts from the first scan where each angle was found. Scans where an angle
 * could not be found leave a gap in the corresponding curve.
 *
 * Unless a TIR window is set explicitly, the window is chosen from the number of scans in the
 * measurement as defined in the configuration.
 *
 * @author akearns - KBRWyle
 */
public class SensorgramExperiment extends Experiment {

  private final Configuration configuration;
  private AngleRange tirWindow;
  private AngleRange usedWindow;
  private Sensorgram sensorgram;

  public SensorgramExperiment() {
    this(Configuration.getInstance());
  }

  public SensorgramExperiment(Configuration configuration) {
    super();
    this.configuration = configuration;
  }

  /**
   * Set the window the TIR angle is searched in. If not set (or set to null), the window follows
   * the configured scan count rule.
   *
   * @param tirWindow Window to use for every scan of the measurement
   */
  public void setTIRWindow(AngleRange tirWindow) {
    this.tirWindow = tirWindow;
  }

  @Override
  protected void backend(final ScanSequence sequence) throws InterruptedException {

    usedWindow = tirWindow;
    if (usedWindow == null) {
      usedWindow = configuration.getTIRWindowForScanCount(sequence.size());
    }

    SensorgramBuilder builder = new SensorgramBuilder(configuration.getWorkerThreads(),
        configuration.getSPRPointsBelow(), configuration.getSPRPointsAbove(),
        configuration.getSPRDensePoints(), configuration.getTIRDensePoints());

    fireStateChange("Finding SPR and TIR angles of " + sequence.size() + " scans...");
    sensorgram = builder.build(sequence, usedWindow);

    fireStateChange("Building sensorgram plots...");
    double[] times = sensorgram.getTimes();

    XYSeriesCollection sprCollection = new XYSeriesCollection();
    sprCollection.addSeries(
        toSeries(sequence.getName() + " SPR angle shift", times, sensorgram.getSPRShifts()));
    xySeriesData.add(sprCollection);

    XYSeriesCollection tirCollection = new XYSeriesCollection();
    tirCollection.addSeries(
        toSeries(sequence.getName() + " TIR angle shift", times, sensorgram.getTIRShifts()));
    xySeriesData.add(tirCollection);
  }

  @Override
  String[] getDataStrings() {
    StringBuilder sb = new StringBuilder();
    sb.append("TIR window: ").append(usedWindow).append('\n');
    sb.append("Scans: ").append(sensorgram.size()).append('\n');
    sb.append("Scans without SPR angle: ").append(sensorgram.countMissingSPR()).append('\n');
    sb.append("Scans without TIR angle: ").append(sensorgram.countMissingTIR());
    return new String[]{sb.toString()};
  }

  /**
   * @return Sensorgram produced by the last run
   */
  public Sensorgram getSensorgram() {
    return sensorgram;
  }

  /**
   * @return TIR window used in the last run
   */
  public AngleRange getUsedTIRWindow() {
    return usedWindow;
  }

  @Override
  public boolean hasEnoughData(final ScanSequence sequence) {
    return sequence != null && sequence.size() > 0;
  }
}
