package asl.spr.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import asl.spr.input.AngleRange;
import asl.spr.input.Configuration;
import asl.spr.input.ScanSequence;
import asl.spr.input.ScanSpeed;
import asl.spr.output.Sensorgram;
import asl.spr.test.TestUtils;
import java.util.List;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.junit.BeforeClass;
import org.junit.Test;

public class SensorgramExperimentTest {

  private static Configuration configuration;

  @BeforeClass
  public static void loadConfiguration() {
    configuration = TestUtils.loadTestConfiguration();
  }

  private static ScanSequence drifting(int scans) {
    double[] angles = TestUtils.angleGrid(40., 47., 0.01);
    double[][] intensities = new double[scans][];
    double[] times = new double[scans];
    for (int i = 0; i < scans; ++i) {
      intensities[i] = TestUtils.syntheticScan(angles, 41.3, 43.5 + 0.01 * i);
      times[i] = i;
    }
    return new ScanSequence("drift", angles, intensities, times, ScanSpeed.FAST);
  }

  @Test
  public void fewScansUseAirWindow() throws Exception {
    SensorgramExperiment experiment = new SensorgramExperiment(configuration);
    experiment.runExperimentOnData(drifting(5));

    assertEquals(configuration.getAirTIRWindow(), experiment.getUsedTIRWindow());
    Sensorgram sensorgram = experiment.getSensorgram();
    assertEquals(5, sensorgram.size());
    assertEquals(0, sensorgram.countMissingSPR());
    assertEquals(0, sensorgram.countMissingTIR());
    assertEquals(0.04, sensorgram.getSPRShifts()[4], 0.01);
    assertEquals(0., sensorgram.getTIRShifts()[4], 0.01);

    List<XYSeriesCollection> data = experiment.getData();
    assertEquals(2, data.size());
    XYSeries sprSeries = data.get(0).getSeries(0);
    assertEquals(5, sprSeries.getItemCount());
    assertEquals(4., sprSeries.getX(4).doubleValue(), 0.);
    assertTrue(experiment.getReportString().contains("Scans without SPR angle: 0"));
  }

  @Test
  public void manyScansUseLiquidWindow() throws Exception {
    SensorgramExperiment experiment = new SensorgramExperiment(configuration);
    int scans = configuration.getLiquidScanThreshold();
    experiment.runExperimentOnData(drifting(scans));

    // liquid window lies past the end of these scans
    assertEquals(configuration.getLiquidTIRWindow(), experiment.getUsedTIRWindow());
    Sensorgram sensorgram = experiment.getSensorgram();
    assertEquals(scans, sensorgram.countMissingTIR());
    assertEquals(0, sensorgram.countMissingSPR());
    assertEquals(0, experiment.getData().get(1).getSeries(0).getItemCount());
  }

  @Test
  public void explicitWindowOverridesRule() throws Exception {
    SensorgramExperiment experiment = new SensorgramExperiment(configuration);
    AngleRange window = new AngleRange(40.9, 41.8);
    experiment.setTIRWindow(window);
    experiment.runExperimentOnData(drifting(3));
    assertEquals(window, experiment.getUsedTIRWindow());
    assertEquals(41.3, experiment.getSensorgram().getTIRAngles()[0], 0.01);
  }

  @Test
  public void emptyMeasurementNotEnough() {
    SensorgramExperiment experiment = new SensorgramExperiment(configuration);
    assertTrue(!experiment.hasEnoughData(null));
  }
}
