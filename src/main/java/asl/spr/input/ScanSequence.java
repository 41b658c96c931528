package asl.spr.input;

/**
 * An ordered series of angular scans taken over the course of a measurement. All scans share a
 * single angle grid; each scan has a capture time (minutes since the start of measurement).
 * The scan speed class applies to the whole measurement.
 *
 * @author akearns - KBRWyle
 */
public class ScanSequence {

  private final double[] angles;
  private final double[][] intensities;
  private final double[] times;
  private final ScanSpeed scanSpeed;
  private final String name;

  /**
   * @param name Name of the measurement (used in plots and reports)
   * @param angles Shared angle grid in degrees, strictly increasing
   * @param intensities Intensity rows, one per scan, each aligned to the angle grid
   * @param times Capture time of each scan in minutes
   * @param scanSpeed Scan speed class of the instrument during this measurement
   */
  public ScanSequence(String name, double[] angles, double[][] intensities, double[] times,
      ScanSpeed scanSpeed) {
    if (angles == null || intensities == null || times == null || scanSpeed == null) {
      throw new IllegalArgumentException("Scan sequence needs angles, intensities, times and "
          + "scan speed");
    }
    if (intensities.length != times.length) {
      throw new IllegalArgumentException("Got " + intensities.length + " scans but "
          + times.length + " capture times");
    }
    ScanFrame.checkAscending(angles);
    this.angles = angles.clone();
    this.intensities = new double[intensities.length][];
    for (int i = 0; i < intensities.length; ++i) {
      if (intensities[i] == null || intensities[i].length != angles.length) {
        throw new IllegalArgumentException("Scan " + i + " is not aligned to the angle grid of "
            + angles.length + " points");
      }
      this.intensities[i] = intensities[i].clone();
    }
    this.times = times.clone();
    this.scanSpeed = scanSpeed;
    this.name = name == null ? "" : name;
  }

  public ScanSequence(double[] angles, double[][] intensities, double[] times,
      ScanSpeed scanSpeed) {
    this("", angles, intensities, times, scanSpeed);
  }

  /**
   * @return Number of scans in the measurement
   */
  public int size() {
    return intensities.length;
  }

  public String getName() {
    return name;
  }

  public double[] getAngles() {
    return angles.clone();
  }

  public double[] getTimes() {
    return times.clone();
  }

  public double getTime(int scanIndex) {
    return times[scanIndex];
  }

  public ScanSpeed getScanSpeed() {
    return scanSpeed;
  }

  /**
   * Get a single scan as an angle/intensity frame
   *
   * @param scanIndex Index of the scan (0 is the first scan taken)
   * @return Frame holding that scan's data on the shared angle grid
   */
  public ScanFrame getFrame(int scanIndex) {
    return new ScanFrame(angles, intensities[scanIndex]);
  }

  /**
   * @return The last scan of the measurement, used as the default reflectance trace
   */
  public ScanFrame getLastFrame() {
    return getFrame(intensities.length - 1);
  }
}
