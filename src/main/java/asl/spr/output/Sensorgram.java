package asl.spr.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Time series of SPR and TIR angles over the scans of a measurement, one point per scan in the
 * order the scans were taken. Scans where an angle could not be found leave a gap (NaN) in the
 * corresponding series.
 *
 * @author akearns - KBRWyle
 */
public class Sensorgram {

  private final List<SensorgramPoint> points;

  public Sensorgram(List<SensorgramPoint> points) {
    this.points = Collections.unmodifiableList(new ArrayList<>(points));
  }

  public List<SensorgramPoint> getPoints() {
    return points;
  }

  public SensorgramPoint getPoint(int scanIndex) {
    return points.get(scanIndex);
  }

  public int size() {
    return points.size();
  }

  public double[] getTimes() {
    double[] out = new double[points.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = points.get(i).getTime();
    }
    return out;
  }

  /**
   * @return SPR angle of each scan (degrees), NaN where missing
   */
  public double[] getSPRAngles() {
    double[] out = new double[points.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = points.get(i).getSPRAngle();
    }
    return out;
  }

  /**
   * @return TIR angle of each scan (degrees), NaN where missing
   */
  public double[] getTIRAngles() {
    double[] out = new double[points.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = points.get(i).getTIRAngle();
    }
    return out;
  }

  /**
   * Get the SPR angle shift of each scan relative to the first scan with a valid SPR angle, which
   * is how sensorgrams are usually displayed (starting from zero)
   *
   * @return SPR angle shifts in degrees, NaN where missing
   */
  public double[] getSPRShifts() {
    return relativeToFirst(getSPRAngles());
  }

  /**
   * Get the TIR angle shift of each scan relative to the first scan with a valid TIR angle
   *
   * @return TIR angle shifts in degrees, NaN where missing
   */
  public double[] getTIRShifts() {
    return relativeToFirst(getTIRAngles());
  }

  private static double[] relativeToFirst(double[] values) {
    double reference = Double.NaN;
    for (double value : values) {
      if (!Double.isNaN(value)) {
        reference = value;
        break;
      }
    }
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; ++i) {
      out[i] = values[i] - reference;
    }
    return out;
  }

  public int countMissingSPR() {
    int count = 0;
    for (SensorgramPoint point : points) {
      if (!point.hasSPRAngle()) {
        ++count;
      }
    }
    return count;
  }

  public int countMissingTIR() {
    int count = 0;
    for (SensorgramPoint point : points) {
      if (!point.hasTIRAngle()) {
        ++count;
      }
    }
    return count;
  }
}
