package asl.spr.input;

import java.util.ArrayList;
import java.util.List;

/**
 * A single angular reflectance scan: intensity as a function of incidence angle. Angles are in
 * degrees and strictly increasing. Intensities are not checked, since corrupted scans (NaN or
 * flat values) are expected to reach the angle detection routines and be reported there.
 */
public class ScanFrame {

  private final double[] angles;
  private final double[] intensities;

  /**
   * @param angles Incidence angles in degrees, strictly increasing
   * @param intensities Measured intensity at each angle
   */
  public ScanFrame(double[] angles, double[] intensities) {
    if (angles == null || intensities == null) {
      throw new IllegalArgumentException("Scan angles and intensities must be given");
    }
    if (angles.length != intensities.length) {
      throw new IllegalArgumentException("Scan has " + angles.length + " angles but "
          + intensities.length + " intensity values");
    }
    checkAscending(angles);
    this.angles = angles.clone();
    this.intensities = intensities.clone();
  }

  static void checkAscending(double[] angles) {
    for (int i = 1; i < angles.length; ++i) {
      if (!(angles[i] > angles[i - 1])) {
        throw new IllegalArgumentException("Scan angles must be strictly increasing (index "
            + i + ": " + angles[i - 1] + " then " + angles[i] + ")");
      }
    }
  }

  public double[] getAngles() {
    return angles.clone();
  }

  public double[] getIntensities() {
    return intensities.clone();
  }

  public int size() {
    return angles.length;
  }

  /**
   * Get the part of this scan whose angles fall inside the given window (inclusive)
   *
   * @param range Angular window to select
   * @return New scan holding only points inside the window (may be empty)
   */
  public ScanFrame subRange(AngleRange range) {
    List<Integer> included = new ArrayList<>();
    for (int i = 0; i < angles.length; ++i) {
      if (range.contains(angles[i])) {
        included.add(i);
      }
    }
    double[] subAngles = new double[included.size()];
    double[] subIntensities = new double[included.size()];
    for (int i = 0; i < subAngles.length; ++i) {
      int idx = included.get(i);
      subAngles[i] = angles[idx];
      subIntensities[i] = intensities[idx];
    }
    return new ScanFrame(subAngles, subIntensities);
  }
}
