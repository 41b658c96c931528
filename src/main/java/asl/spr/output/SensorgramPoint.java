package asl.spr.output;

import asl.spr.exception.NoCriticalAngleFoundException;
import asl.spr.exception.NoResonanceFoundException;

/**
 * Angles found for one scan of a measurement. The SPR and TIR results are independent: either
 * may be missing (the detection failed for this scan) while the other is present. When a value is
 * missing, the reason it could not be found is kept instead.
 */
public class SensorgramPoint {

  private final int scanIndex;
  private final double time;
  private final SPRData spr;
  private final TIRData tir;
  private final NoResonanceFoundException sprFailure;
  private final NoCriticalAngleFoundException tirFailure;

  public SensorgramPoint(int scanIndex, double time, SPRData spr,
      NoResonanceFoundException sprFailure, TIRData tir,
      NoCriticalAngleFoundException tirFailure) {
    this.scanIndex = scanIndex;
    this.time = time;
    this.spr = spr;
    this.sprFailure = sprFailure;
    this.tir = tir;
    this.tirFailure = tirFailure;
  }

  public int getScanIndex() {
    return scanIndex;
  }

  /**
   * @return Capture time of the scan in minutes
   */
  public double getTime() {
    return time;
  }

  public boolean hasSPRAngle() {
    return spr != null;
  }

  public boolean hasTIRAngle() {
    return tir != null;
  }

  /**
   * @return SPR angle in degrees, or NaN if none was found for this scan
   */
  public double getSPRAngle() {
    return spr == null ? Double.NaN : spr.getAngle();
  }

  /**
   * @return TIR angle in degrees, or NaN if none was found for this scan
   */
  public double getTIRAngle() {
    return tir == null ? Double.NaN : tir.getAngle();
  }

  /**
   * @return Resonance fit diagnostics, or null if missing
   */
  public SPRData getSPRData() {
    return spr;
  }

  /**
   * @return TIR derivative and fit diagnostics, or null if missing
   */
  public TIRData getTIRData() {
    return tir;
  }

  /**
   * @return Reason the SPR angle is missing, or null if it was found
   */
  public NoResonanceFoundException getSPRFailure() {
    return sprFailure;
  }

  /**
   * @return Reason the TIR angle is missing, or null if it was found
   */
  public NoCriticalAngleFoundException getTIRFailure() {
    return tirFailure;
  }
}
