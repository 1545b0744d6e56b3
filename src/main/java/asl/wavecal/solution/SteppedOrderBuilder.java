package asl.wavecal.solution;

import asl.wavecal.input.LineList;
import asl.wavecal.input.ReferenceLine;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.log4j.Logger;

/**
 * Per-order polynomial solution with a step correction in each order. The plain per-order fit
 * is used as the starting point of a nonlinear fit of polynomial and step offsets together.
 * Orders whose nonlinear fit does not converge keep their plain polynomial.
 */
public class SteppedOrderBuilder extends OrderPolynomialBuilder {

  private static final Logger logger = Logger.getLogger(SteppedOrderBuilder.class);

  private final double[] knots;

  /**
   * @param degree Polynomial degree
   * @param nord Number of orders on the detector
   * @param steps Number of step knots per order
   * @param ncol Number of detector columns (knots are spread evenly over them)
   */
  public SteppedOrderBuilder(int degree, int nord, int steps, int ncol) {
    super(degree, nord);
    if (steps <= 0) {
      throw new IllegalArgumentException("Stepped solution needs at least one step: " + steps);
    }
    knots = StepFunction.evenKnots(steps, ncol);
  }

  @Override
  public OrderPolynomialSolution build(LineList lines) {
    OrderPolynomialSolution plain = super.build(lines);
    Map<Integer, List<ReferenceLine>> groups = lines.groupByOrder(true);

    Map<Integer, PolynomialFunction> polynomials = new LinkedHashMap<>();
    Map<Integer, StepFunction> steps = new LinkedHashMap<>();
    for (int order : plain.getOrders()) {
      List<ReferenceLine> group = groups.get(order);
      double[] x = new double[group.size()];
      double[] y = new double[group.size()];
      double[] z = new double[group.size()];
      for (int k = 0; k < x.length; ++k) {
        x[k] = group.get(k).getPosition();
        z[k] = group.get(k).getWavelength();
      }
      double[] plainCoeffs = plain.getPolynomial(order).getCoefficients();
      double[][] start = new double[degree + 1][1];
      for (int i = 0; i < plainCoeffs.length; ++i) {
        start[i][0] = plainCoeffs[i];
      }

      StepModelFit fit = new StepModelFit(x, y, new int[x.length], z, knots, 1, degree, 0);
      try {
        fit.fit(start);
      } catch (MathIllegalStateException | MathIllegalArgumentException e) {
        logger.warn("Step fit failed for order " + order + ", using plain polynomial", e);
        polynomials.put(order, plain.getPolynomial(order));
        continue;
      }
      double[][] fitted = fit.getCoefficients();
      double[] coeffs = new double[degree + 1];
      for (int i = 0; i <= degree; ++i) {
        coeffs[i] = fitted[i][0];
      }
      polynomials.put(order, new PolynomialFunction(coeffs));
      steps.put(order, fit.getStepFunction(0));
    }
    return new OrderPolynomialSolution(degree, polynomials, steps);
  }
}
