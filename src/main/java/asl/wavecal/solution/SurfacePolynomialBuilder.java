package asl.wavecal.solution;

import asl.wavecal.input.LineList;
import asl.wavecal.input.ReferenceLine;
import asl.wavecal.utils.NumericUtils;
import java.util.List;

/**
 * Fits a single polynomial surface wavelength(pixel, order) to the flagged lines of all orders.
 * Pixel and order are rescaled to [-1, 1] for the fit to keep the system well conditioned.
 */
public class SurfacePolynomialBuilder implements SolutionBuilder {

  final int degreeX;
  final int degreeY;

  /**
   * @param degreeX Degree in the pixel direction
   * @param degreeY Degree in the order direction
   */
  public SurfacePolynomialBuilder(int degreeX, int degreeY) {
    if (degreeX < 0 || degreeY < 0) {
      throw new IllegalArgumentException(
          "Polynomial degrees must not be negative: " + degreeX + ", " + degreeY);
    }
    this.degreeX = degreeX;
    this.degreeY = degreeY;
  }

  @Override
  public SurfacePolynomialSolution build(LineList lines) {
    List<ReferenceLine> flagged = lines.getFlagged();
    int required = (degreeX + 1) * (degreeY + 1) + 1;
    if (flagged.size() < required) {
      throw new InsufficientLinesException(
          InsufficientLinesException.ALL_ORDERS, required, flagged.size());
    }
    double[] x = new double[flagged.size()];
    double[] y = new double[flagged.size()];
    double[] z = new double[flagged.size()];
    for (int k = 0; k < x.length; ++k) {
      ReferenceLine line = flagged.get(k);
      x[k] = line.getPosition();
      y[k] = line.getOrder();
      z[k] = line.getWavelength();
    }
    return new SurfacePolynomialSolution(NumericUtils.polyfit2d(x, y, z, degreeX, degreeY));
  }

  public int getDegreeX() {
    return degreeX;
  }

  public int getDegreeY() {
    return degreeY;
  }
}
