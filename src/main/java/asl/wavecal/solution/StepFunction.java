package asl.wavecal.solution;

import java.util.Arrays;

/**
 * Piecewise-constant pixel correction for one order, modelling discontinuities where detector
 * segments meet. A pixel position x is moved by the sum of the offsets of all knots at or below x;
 * positions before the first knot are not moved.
 */
public class StepFunction {

  private final double[] knots;
  private final double[] offsets;

  /**
   * @param knots Knot positions in pixels, ascending
   * @param offsets Offset contributed by each knot, in pixels
   */
  public StepFunction(double[] knots, double[] offsets) {
    if (knots.length != offsets.length) {
      throw new IllegalArgumentException("Need exactly one offset per knot");
    }
    this.knots = knots.clone();
    this.offsets = offsets.clone();
  }

  /**
   * Evenly spaced knot positions splitting a detector of the given width into (steps + 1)
   * segments
   *
   * @param steps Number of knots
   * @param ncol Detector width in pixels
   * @return Knot positions
   */
  public static double[] evenKnots(int steps, int ncol) {
    double[] knots = new double[steps];
    for (int k = 0; k < steps; ++k) {
      knots[k] = ncol * (k + 1) / (double) (steps + 1);
    }
    return knots;
  }

  /**
   * @param x Raw pixel position
   * @return Corrected pixel position
   */
  public double apply(double x) {
    double shifted = x;
    for (int k = 0; k < knots.length; ++k) {
      if (knots[k] <= x) {
        shifted += offsets[k];
      }
    }
    return shifted;
  }

  /**
   * @param x Raw pixel position
   * @param knot Knot index
   * @return True if the knot's offset applies to the position
   */
  public boolean isActive(double x, int knot) {
    return knots[knot] <= x;
  }

  public double[] getKnots() {
    return knots.clone();
  }

  public double[] getOffsets() {
    return offsets.clone();
  }

  /**
   * @return Number of free parameters (a position and an offset per knot)
   */
  public int getParameterCount() {
    return 2 * knots.length;
  }

  @Override
  public String toString() {
    return "Steps at " + Arrays.toString(knots) + " offsets " + Arrays.toString(offsets);
  }
}
