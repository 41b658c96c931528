package asl.spr.input;

import org.apache.log4j.Logger;

/**
 * Instrument scan speed class. Slower scans sample the angular range more densely, so the TIR
 * edge detection smooths over more points and fits a wider (asymmetric) neighborhood for them;
 * the fast class uses a narrow symmetric neighborhood.
 * The step length is the tag written into the measurement file header by the instrument.
 */
public enum ScanSpeed {

  SLOW(1, 7, 4, 6),
  MEDIUM(5, 5, 3, 5),
  FAST(10, 3, 3, 3);

  private static final Logger logger = Logger.getLogger(ScanSpeed.class);

  private final int stepLength;
  private final int smoothingWidth;
  private final int fitPointsBelow;
  private final int fitPointsAbove;

  ScanSpeed(int stepLength, int smoothingWidth, int fitPointsBelow, int fitPointsAbove) {
    this.stepLength = stepLength;
    this.smoothingWidth = smoothingWidth;
    this.fitPointsBelow = fitPointsBelow;
    this.fitPointsAbove = fitPointsAbove;
  }

  /**
   * Get the scan speed class matching the step length tag from a measurement header.
   * Files without a recognized tag are treated as medium speed scans.
   *
   * @param stepLength Step length tag (1, 5 or 10)
   * @return Matching scan speed class
   */
  public static ScanSpeed fromStepLength(int stepLength) {
    for (ScanSpeed speed : values()) {
      if (speed.stepLength == stepLength) {
        return speed;
      }
    }
    logger.warn("Unrecognized scan step length " + stepLength + ", assuming medium scan speed");
    return MEDIUM;
  }

  public int getStepLength() {
    return stepLength;
  }

  /**
   * Width (odd number of samples) of the centered moving average applied before the TIR
   * derivative is taken
   *
   * @return smoothing window width
   */
  public int getSmoothingWidth() {
    return smoothingWidth;
  }

  /**
   * @return Number of derivative samples below the steepest point included in the TIR fit
   */
  public int getFitPointsBelow() {
    return fitPointsBelow;
  }

  /**
   * @return Number of derivative samples above the steepest point included in the TIR fit
   */
  public int getFitPointsAbove() {
    return fitPointsAbove;
  }
}
