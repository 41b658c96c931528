package asl.spr.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import asl.spr.exception.NoCriticalAngleFoundException;
import asl.spr.input.AngleRange;
import asl.spr.input.ScanFrame;
import asl.spr.input.ScanSpeed;
import asl.spr.output.TIRData;
import asl.spr.test.TestUtils;
import java.util.Arrays;
import org.junit.Test;

public class TIRLocatorTest {

  private static final double GRID_STEP = 0.01;
  private static final AngleRange AIR_WINDOW = new AngleRange(40.9, 41.8);

  private static ScanFrame stepScan(double center, double width) {
    double[] angles = TestUtils.angleGrid(40., 47., GRID_STEP);
    return new ScanFrame(angles, TestUtils.logisticStep(angles, center, width, 0.2, 1.0));
  }

  @Test
  public void findsStepForEachScanSpeed() throws NoCriticalAngleFoundException {
    for (ScanSpeed speed : ScanSpeed.values()) {
      for (double width : new double[]{0.02, 0.05, 0.1}) {
        TIRData data = TIRLocator.locate(stepScan(41.3, width), AIR_WINDOW, speed);
        assertEquals(speed + " width " + width, 41.3, data.getAngle(), GRID_STEP);
      }
    }
  }

  @Test
  public void findsStepBetweenGridPoints() throws NoCriticalAngleFoundException {
    TIRData data = TIRLocator.locate(stepScan(41.2345, 0.05), AIR_WINDOW, ScanSpeed.FAST);
    assertEquals(41.2345, data.getAngle(), GRID_STEP);
  }

  @Test
  public void findsCriticalAngleOfGoldSensor() throws NoCriticalAngleFoundException {
    double[] angles = TestUtils.angleGrid(39., 47., GRID_STEP);
    ScanFrame frame =
        new ScanFrame(angles, TestUtils.reflectance(TestUtils.goldInAir(50.), angles));
    double critical = Math.toDegrees(Math.asin(TestUtils.AIR_INDEX / TestUtils.PRISM_INDEX));
    TIRData data = TIRLocator.locate(frame, AIR_WINDOW, ScanSpeed.FAST);
    assertEquals(critical, data.getAngle(), GRID_STEP);
  }

  @Test
  public void diagnosticCurvesCoverFit() throws NoCriticalAngleFoundException {
    TIRData data = TIRLocator.locate(stepScan(41.3, 0.05), AIR_WINDOW, ScanSpeed.MEDIUM, 500);
    assertEquals(500, data.getFitAngles().length);
    assertEquals(500, data.getFitValues().length);
    assertEquals(data.getDerivative().length, data.getDerivativeAngles().length);
    double[] fitAngles = data.getFitAngles();
    assertTrue(data.getAngle() >= fitAngles[0]);
    assertTrue(data.getAngle() <= fitAngles[fitAngles.length - 1]);
  }

  @Test(expected = NoCriticalAngleFoundException.class)
  public void flatScanFails() throws NoCriticalAngleFoundException {
    double[] angles = TestUtils.angleGrid(40., 47., GRID_STEP);
    double[] flat = new double[angles.length];
    Arrays.fill(flat, 0.5);
    TIRLocator.locate(new ScanFrame(angles, flat), AIR_WINDOW, ScanSpeed.FAST);
  }

  @Test(expected = NoCriticalAngleFoundException.class)
  public void undefinedIntensityFails() throws NoCriticalAngleFoundException {
    double[] angles = TestUtils.angleGrid(40., 47., GRID_STEP);
    double[] intensities = TestUtils.logisticStep(angles, 41.3, 0.05, 0.2, 1.0);
    intensities[130] = Double.NaN;
    TIRLocator.locate(new ScanFrame(angles, intensities), AIR_WINDOW, ScanSpeed.FAST);
  }

  @Test(expected = NoCriticalAngleFoundException.class)
  public void windowOutsideScanFails() throws NoCriticalAngleFoundException {
    TIRLocator.locate(stepScan(41.3, 0.05), new AngleRange(60.8, 63.), ScanSpeed.FAST);
  }

  @Test(expected = NoCriticalAngleFoundException.class)
  public void stepAtWindowEdgeFails() throws NoCriticalAngleFoundException {
    // steepest point is the first derivative sample in the window
    TIRLocator.locate(stepScan(40.5, 0.02), AIR_WINDOW, ScanSpeed.FAST);
  }
}
