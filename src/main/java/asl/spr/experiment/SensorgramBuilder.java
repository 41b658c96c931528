package asl.spr.experiment;

import asl.spr.exception.NoCriticalAngleFoundException;
import asl.spr.exception.NoResonanceFoundException;
import asl.spr.input.AngleRange;
import asl.spr.input.ScanFrame;
import asl.spr.input.ScanSequence;
import asl.spr.input.ScanSpeed;
import asl.spr.output.SPRData;
import asl.spr.output.Sensorgram;
import asl.spr.output.SensorgramPoint;
import asl.spr.output.TIRData;
import asl.spr.utils.SPRLocator;
import asl.spr.utils.TIRLocator;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.log4j.Logger;

/**
 * Calculates the SPR and TIR angle of every scan in a measurement. Scans are independent, so each
 * one is processed as a separate task on a fixed pool of worker threads; results are collected by
 * scan index so the sensorgram is in scan order however the tasks finish.
 *
 * A scan where one of the angles cannot be found is kept with that angle marked as missing. The
 * two angles are found independently, so a failed TIR search does not lose the scan's SPR angle
 * and the reverse.
 *
 * @author akearns - KBRWyle
 */
public class SensorgramBuilder {

  private static final Logger logger = Logger.getLogger(SensorgramBuilder.class);

  private final int workerThreads;
  private final int sprPointsBelow;
  private final int sprPointsAbove;
  private final int sprDensePoints;
  private final int tirDensePoints;

  /**
   * Create a builder using one worker per available processor and the default fit neighborhoods
   */
  public SensorgramBuilder() {
    this(Runtime.getRuntime().availableProcessors(), SPRLocator.DEFAULT_POINTS_BELOW,
        SPRLocator.DEFAULT_POINTS_ABOVE, SPRLocator.DEFAULT_DENSE_POINTS,
        TIRLocator.DEFAULT_DENSE_POINTS);
  }

  /**
   * @param workerThreads Number of scans processed at once
   * @param sprPointsBelow Samples below the reflectance minimum used in the SPR fit
   * @param sprPointsAbove Samples above the reflectance minimum used in the SPR fit
   * @param sprDensePoints Resampling density of the SPR fit
   * @param tirDensePoints Resampling density of the TIR fit
   */
  public SensorgramBuilder(int workerThreads, int sprPointsBelow, int sprPointsAbove,
      int sprDensePoints, int tirDensePoints) {
    if (workerThreads < 1) {
      throw new IllegalArgumentException("Need at least one worker thread, got " + workerThreads);
    }
    this.workerThreads = workerThreads;
    this.sprPointsBelow = sprPointsBelow;
    this.sprPointsAbove = sprPointsAbove;
    this.sprDensePoints = sprDensePoints;
    this.tirDensePoints = tirDensePoints;
  }

  /**
   * Find the angles of every scan in the measurement
   *
   * @param sequence Measurement to process
   * @param tirWindow Window the TIR angle is searched in, the same for every scan
   * @return Sensorgram with one point per scan, in scan order
   * @throws InterruptedException if the calling thread is interrupted while waiting for scans to
   * be processed; scans not yet processed are cancelled
   */
  public Sensorgram build(ScanSequence sequence, AngleRange tirWindow)
      throws InterruptedException {

    int scans = sequence.size();
    logger.info("Processing " + scans + " scans of measurement '" + sequence.getName()
        + "' on " + workerThreads + " threads");

    ScanSpeed speed = sequence.getScanSpeed();
    ExecutorService executor = Executors.newFixedThreadPool(workerThreads);
    List<Future<SensorgramPoint>> futures = new ArrayList<>(scans);
    try {
      for (int i = 0; i < scans; ++i) {
        final int scanIndex = i;
        final ScanFrame frame = sequence.getFrame(i);
        final double time = sequence.getTime(i);
        Callable<SensorgramPoint> task =
            () -> processScan(scanIndex, time, frame, tirWindow, speed);
        futures.add(executor.submit(task));
      }

      List<SensorgramPoint> points = new ArrayList<>(scans);
      for (Future<SensorgramPoint> future : futures) {
        try {
          points.add(future.get());
        } catch (ExecutionException e) {
          // detection failures are caught in the task; anything else is a programming error
          throw new IllegalStateException("Unexpected failure processing scan "
              + points.size(), e.getCause());
        }
      }

      Sensorgram sensorgram = new Sensorgram(points);
      logger.info("Sensorgram complete: " + sensorgram.countMissingSPR()
          + " scans without SPR angle, " + sensorgram.countMissingTIR()
          + " scans without TIR angle");
      return sensorgram;
    } catch (InterruptedException e) {
      logger.warn("Sensorgram calculation interrupted, cancelling remaining scans");
      for (Future<SensorgramPoint> future : futures) {
        future.cancel(true);
      }
      throw e;
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Find the SPR and TIR angles of a single scan. Either angle may be missing in the result.
   *
   * @param scanIndex Index of the scan in its measurement
   * @param time Capture time of the scan (minutes)
   * @param frame Scan data
   * @param tirWindow Window the TIR angle is searched in
   * @param speed Scan speed class of the measurement
   * @return Angles found for the scan
   */
  public SensorgramPoint processScan(int scanIndex, double time, ScanFrame frame,
      AngleRange tirWindow, ScanSpeed speed) {

    SPRData spr = null;
    NoResonanceFoundException sprFailure = null;
    try {
      spr = SPRLocator.locate(frame, sprPointsBelow, sprPointsAbove, sprDensePoints);
    } catch (NoResonanceFoundException e) {
      logger.warn("No SPR angle for scan " + scanIndex + ": " + e.getMessage());
      sprFailure = e;
    }

    TIRData tir = null;
    NoCriticalAngleFoundException tirFailure = null;
    try {
      tir = TIRLocator.locate(frame, tirWindow, speed, tirDensePoints);
    } catch (NoCriticalAngleFoundException e) {
      logger.warn("No TIR angle for scan " + scanIndex + ": " + e.getMessage());
      tirFailure = e;
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Scan " + scanIndex + " at " + time + " min: SPR "
          + (spr == null ? "missing" : spr.getAngle()) + ", TIR "
          + (tir == null ? "missing" : tir.getAngle()));
    }

    return new SensorgramPoint(scanIndex, time, spr, sprFailure, tir, tirFailure);
  }
}
