package asl.spr.input;

/**
 * Inclusive angular window in degrees, used for TIR search windows and fit sub-ranges.
 */
public class AngleRange {

  private final double lower;
  private final double upper;

  /**
   * Create a new window
   *
   * @param lower Lowest angle included (degrees)
   * @param upper Highest angle included (degrees), must be above lower
   */
  public AngleRange(double lower, double upper) {
    if (!(lower < upper)) {
      throw new IllegalArgumentException(
          "Angle range lower bound must be below upper bound: " + lower + ", " + upper);
    }
    this.lower = lower;
    this.upper = upper;
  }

  public double getLower() {
    return lower;
  }

  public double getUpper() {
    return upper;
  }

  public boolean contains(double angle) {
    return angle >= lower && angle <= upper;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AngleRange)) {
      return false;
    }
    AngleRange other = (AngleRange) o;
    return Double.compare(lower, other.lower) == 0 && Double.compare(upper, other.upper) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(lower) + Double.hashCode(upper);
  }

  @Override
  public String toString() {
    return "[" + lower + ", " + upper + "] deg";
  }
}
