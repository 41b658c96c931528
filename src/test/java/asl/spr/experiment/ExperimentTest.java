package asl.spr.experiment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.spr.exception.AnalysisException;
import asl.spr.exception.NoResonanceFoundException;
import asl.spr.input.ScanSequence;
import asl.spr.input.ScanSpeed;
import org.jfree.data.xy.XYSeries;
import org.junit.Test;

public class ExperimentTest {

  private static ScanSequence singleScan() {
    return new ScanSequence("mock", new double[]{40., 41.}, new double[][]{{0.5, 1.}},
        new double[]{0.}, ScanSpeed.SLOW);
  }

  @Test
  public void experiment_constructorInitializes() {
    Experiment experiment = new MockExperiment();
    assertTrue(experiment.getInputNames().isEmpty());
    assertEquals("", experiment.getStatus());
    assertNull(experiment.getData());
  }

  @Test
  public void fireStateChange_updatesStatus() {
    MockExperiment experiment = new MockExperiment();
    experiment.fireStateChange("Fired Status Change");
    assertEquals("Fired Status Change", experiment.getStatus());

    assertEquals(1, experiment.numberOfChangesFired);
  }

  @Test
  public void runExperimentOnData_checksDataThenCallsBackend() throws Exception {
    MockExperiment experiment = new MockExperiment();
    experiment.runExperimentOnData(singleScan());

    assertTrue(experiment.hasEnoughDataCalled);
    assertTrue(experiment.backendCalled);
    assertEquals(3, experiment.numberOfChangesFired);
    assertEquals("Calculations done!", experiment.getStatus());
    assertEquals(1, experiment.getInputNames().size());
    assertEquals("mock", experiment.getInputNames().get(0));
    assertTrue(experiment.getData().isEmpty());
  }

  @Test
  public void runExperimentOnData_reinitializesFields() throws Exception {
    MockExperiment experiment = new MockExperiment();
    //Dirty everything
    experiment.dataNames.add("Not Empty");

    experiment.runExperimentOnData(singleScan());
    assertEquals(1, experiment.getInputNames().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void runExperimentOnData_notEnoughData_throwsException() throws Exception {
    MockExperiment experiment = new MockExperiment();
    experiment.dataNames.add("Not Empty");

    experiment.setHasEnoughData = false;
    try {
      experiment.runExperimentOnData(singleScan());
    } catch (IllegalArgumentException e) {
      assertTrue(experiment.hasEnoughDataCalled);
      assertFalse(experiment.backendCalled);

      assertEquals(1, experiment.numberOfChangesFired);

      //These should have been reinitialized still
      assertTrue(experiment.getInputNames().isEmpty());
      throw e;
    }
  }

  @Test
  public void runExperimentOnData_backendFailurePropagates() throws InterruptedException {
    MockExperiment experiment = new MockExperiment();
    experiment.setBackendFails = true;
    try {
      experiment.runExperimentOnData(singleScan());
      fail("Backend failure was not passed on");
    } catch (AnalysisException e) {
      assertTrue(e instanceof NoResonanceFoundException);
      assertEquals(2, experiment.numberOfChangesFired);
      assertEquals("Beginning calculations...", experiment.getStatus());
    }
  }

  @Test
  public void getReportString_defaultIsEmpty() {
    assertEquals("", new MockExperiment().getReportString());
  }

  @Test
  public void toSeries_skipsUndefinedValues() {
    XYSeries series = Experiment.toSeries("curve", new double[]{1., 2., 3.},
        new double[]{4., Double.NaN, 6.});
    assertEquals(2, series.getItemCount());
    assertEquals(3., series.getX(1).doubleValue(), 0.);
    assertEquals("curve", series.getKey());
  }
}
