package asl.spr.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import asl.spr.input.AngleRange;
import asl.spr.input.ScanFrame;
import asl.spr.input.ScanSequence;
import asl.spr.input.ScanSpeed;
import asl.spr.output.Sensorgram;
import asl.spr.output.SensorgramPoint;
import asl.spr.test.TestUtils;
import java.util.Arrays;
import org.junit.Test;

public class SensorgramBuilderTest {

  private static final double GRID_STEP = 0.01;
  private static final AngleRange AIR_WINDOW = new AngleRange(40.9, 41.8);
  private static final int SCANS = 12;

  private static double tirAngle(int scan) {
    return 41.3 + 0.002 * scan;
  }

  private static double sprAngle(int scan) {
    return 43.5 + 0.005 * scan;
  }

  private static ScanSequence sequence(int corruptScan, double[] corruption) {
    double[] angles = TestUtils.angleGrid(40., 47., GRID_STEP);
    double[][] intensities = new double[SCANS][];
    double[] times = new double[SCANS];
    for (int i = 0; i < SCANS; ++i) {
      intensities[i] = TestUtils.syntheticScan(angles, tirAngle(i), sprAngle(i));
      times[i] = i * 0.25;
    }
    if (corruptScan >= 0) {
      intensities[corruptScan] = corruption;
    }
    return new ScanSequence("synthetic", angles, intensities, times, ScanSpeed.FAST);
  }

  private static void assertOnlyScanMissing(Sensorgram sensorgram, int missing) {
    assertEquals(SCANS, sensorgram.size());
    assertEquals(1, sensorgram.countMissingSPR());
    assertEquals(1, sensorgram.countMissingTIR());
    for (int i = 0; i < SCANS; ++i) {
      SensorgramPoint point = sensorgram.getPoint(i);
      assertEquals(i, point.getScanIndex());
      assertEquals(i * 0.25, point.getTime(), 0.);
      if (i == missing) {
        assertFalse(point.hasSPRAngle());
        assertFalse(point.hasTIRAngle());
        assertNotNull(point.getSPRFailure());
        assertNotNull(point.getTIRFailure());
      } else {
        assertEquals(sprAngle(i), point.getSPRAngle(), GRID_STEP);
        assertEquals(tirAngle(i), point.getTIRAngle(), GRID_STEP);
      }
    }
  }

  @Test
  public void anglesInScanOrder() throws InterruptedException {
    Sensorgram sensorgram =
        new SensorgramBuilder(4, 70, 70, 4000, 4000).build(sequence(-1, null), AIR_WINDOW);
    assertEquals(SCANS, sensorgram.size());
    assertEquals(0, sensorgram.countMissingSPR());
    assertEquals(0, sensorgram.countMissingTIR());
    for (int i = 0; i < SCANS; ++i) {
      assertEquals(i, sensorgram.getPoint(i).getScanIndex());
      assertEquals(sprAngle(i), sensorgram.getSPRAngles()[i], GRID_STEP);
      assertEquals(tirAngle(i), sensorgram.getTIRAngles()[i], GRID_STEP);
    }
    // shifts follow the injected drift
    double[] sprShifts = sensorgram.getSPRShifts();
    assertEquals(sprAngle(SCANS - 1) - sprAngle(0), sprShifts[SCANS - 1], 2 * GRID_STEP);
  }

  @Test
  public void undefinedScanIsOnlyMissingSample() throws InterruptedException {
    double[] corrupt = new double[TestUtils.angleGrid(40., 47., GRID_STEP).length];
    Arrays.fill(corrupt, Double.NaN);
    Sensorgram sensorgram = new SensorgramBuilder().build(sequence(5, corrupt), AIR_WINDOW);
    assertOnlyScanMissing(sensorgram, 5);
  }

  @Test
  public void flatScanIsOnlyMissingSample() throws InterruptedException {
    double[] corrupt = new double[TestUtils.angleGrid(40., 47., GRID_STEP).length];
    Arrays.fill(corrupt, 0.5);
    Sensorgram sensorgram =
        new SensorgramBuilder(3, 70, 70, 4000, 4000).build(sequence(0, corrupt), AIR_WINDOW);
    assertOnlyScanMissing(sensorgram, 0);
  }

  @Test
  public void tirFailureKeepsResonance() {
    double[] angles = TestUtils.angleGrid(40., 47., GRID_STEP);
    ScanFrame frame = new ScanFrame(angles, TestUtils.syntheticScan(angles, 41.3, 43.5));
    // window holds a single sample of the scan
    SensorgramPoint point = new SensorgramBuilder(1, 70, 70, 4000, 4000)
        .processScan(0, 0., frame, new AngleRange(39., 40.), ScanSpeed.FAST);
    assertTrue(point.hasSPRAngle());
    assertFalse(point.hasTIRAngle());
    assertEquals(43.5, point.getSPRAngle(), GRID_STEP);
  }

  @Test
  public void resonanceFailureKeepsTIR() {
    double[] angles = TestUtils.angleGrid(40., 47., GRID_STEP);
    ScanFrame frame = new ScanFrame(angles, TestUtils.syntheticScan(angles, 41.3, 43.5));
    // neighborhood wider than the scan
    SensorgramPoint point = new SensorgramBuilder(1, 500, 500, 4000, 4000)
        .processScan(0, 0., frame, AIR_WINDOW, ScanSpeed.FAST);
    assertFalse(point.hasSPRAngle());
    assertTrue(point.hasTIRAngle());
    assertEquals(41.3, point.getTIRAngle(), GRID_STEP);
  }

  @Test(expected = IllegalArgumentException.class)
  public void needsWorkerThreads() {
    new SensorgramBuilder(0, 70, 70, 4000, 4000);
  }
}
