package asl.wavecal.solution;

import asl.wavecal.input.LineList;
import asl.wavecal.input.ReferenceLine;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.log4j.Logger;

/**
 * Polynomial surface solution with a step correction in each order that has flagged lines.
 * Surface coefficients and all step offsets are fit together, starting from the plain surface.
 * If the nonlinear fit does not converge the plain surface is returned.
 */
public class SteppedSurfaceBuilder extends SurfacePolynomialBuilder {

  private static final Logger logger = Logger.getLogger(SteppedSurfaceBuilder.class);

  private final double[] knots;

  /**
   * @param degreeX Degree in the pixel direction
   * @param degreeY Degree in the order direction
   * @param steps Number of step knots per order
   * @param ncol Number of detector columns (knots are spread evenly over them)
   */
  public SteppedSurfaceBuilder(int degreeX, int degreeY, int steps, int ncol) {
    super(degreeX, degreeY);
    if (steps <= 0) {
      throw new IllegalArgumentException("Stepped solution needs at least one step: " + steps);
    }
    knots = StepFunction.evenKnots(steps, ncol);
  }

  @Override
  public SurfacePolynomialSolution build(LineList lines) {
    SurfacePolynomialSolution plain = super.build(lines);

    List<Integer> orders = new ArrayList<>(lines.groupByOrder(true).keySet());
    List<ReferenceLine> flagged = lines.getFlagged();
    double[] x = new double[flagged.size()];
    double[] y = new double[flagged.size()];
    double[] z = new double[flagged.size()];
    int[] group = new int[flagged.size()];
    for (int k = 0; k < x.length; ++k) {
      ReferenceLine line = flagged.get(k);
      x[k] = line.getPosition();
      y[k] = line.getOrder();
      z[k] = line.getWavelength();
      group[k] = orders.indexOf(line.getOrder());
    }

    StepModelFit fit =
        new StepModelFit(x, y, group, z, knots, orders.size(), degreeX, degreeY);
    try {
      fit.fit(plain.getCoefficients());
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      logger.warn("Step fit failed, using plain polynomial surface", e);
      return plain;
    }

    Map<Integer, StepFunction> steps = new LinkedHashMap<>();
    for (int g = 0; g < orders.size(); ++g) {
      steps.put(orders.get(g), fit.getStepFunction(g));
    }
    return new SurfacePolynomialSolution(fit.getCoefficients(), steps);
  }
}
