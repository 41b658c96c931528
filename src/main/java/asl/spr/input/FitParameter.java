package asl.spr.input;

/**
 * Designates a single value of an optical stack to be solved for: a layer (0 is the incident
 * medium) and the attribute of that layer.
 *
 * @author akearns - KBRWyle
 */
public class FitParameter {

  /**
   * Layer attributes that can be fit
   */
  public enum Attribute {
    THICKNESS("d", "nm"),
    REAL_INDEX("n", ""),
    IMAGINARY_INDEX("k", "");

    private final String symbol;
    private final String unit;

    Attribute(String symbol, String unit) {
      this.symbol = symbol;
      this.unit = unit;
    }

    public String getSymbol() {
      return symbol;
    }

    public String getUnit() {
      return unit;
    }
  }

  private final int layer;
  private final Attribute attribute;

  public FitParameter(int layer, Attribute attribute) {
    if (layer < 0) {
      throw new IllegalArgumentException("Layer index cannot be negative: " + layer);
    }
    if (attribute == null) {
      throw new IllegalArgumentException("Attribute to fit must be specified");
    }
    this.layer = layer;
    this.attribute = attribute;
  }

  public static FitParameter thickness(int layer) {
    return new FitParameter(layer, Attribute.THICKNESS);
  }

  public static FitParameter realIndex(int layer) {
    return new FitParameter(layer, Attribute.REAL_INDEX);
  }

  public static FitParameter imaginaryIndex(int layer) {
    return new FitParameter(layer, Attribute.IMAGINARY_INDEX);
  }

  public int getLayer() {
    return layer;
  }

  public Attribute getAttribute() {
    return attribute;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FitParameter)) {
      return false;
    }
    FitParameter other = (FitParameter) o;
    return layer == other.layer && attribute == other.attribute;
  }

  @Override
  public int hashCode() {
    return 31 * layer + attribute.hashCode();
  }

  @Override
  public String toString() {
    return attribute.getSymbol() + "[" + layer + "]";
  }
}
