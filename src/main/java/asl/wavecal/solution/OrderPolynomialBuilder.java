package asl.wavecal.solution;

import asl.wavecal.input.LineList;
import asl.wavecal.input.ReferenceLine;
import asl.wavecal.utils.NumericUtils;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;

/**
 * Fits an independent polynomial (pixel to wavelength) to the flagged lines of every order of the
 * detector. Each order needs more flagged lines than the polynomial has
 * coefficients, so the fit keeps at least one residual degree of freedom.
 */
public class OrderPolynomialBuilder implements SolutionBuilder {

  final int degree;
  final int nord;

  /**
   * @param degree Polynomial degree
   * @param nord Number of orders on the detector; a polynomial is fit for each of them
   */
  public OrderPolynomialBuilder(int degree, int nord) {
    if (degree < 0) {
      throw new IllegalArgumentException("Polynomial degree must not be negative: " + degree);
    }
    this.degree = degree;
    this.nord = nord;
  }

  @Override
  public OrderPolynomialSolution build(LineList lines) {
    Map<Integer, List<ReferenceLine>> groups = lines.groupByOrder(true);
    Map<Integer, PolynomialFunction> polynomials = new LinkedHashMap<>();
    for (int order = 0; order < nord; ++order) {
      List<ReferenceLine> group = groups.getOrDefault(order, Collections.emptyList());
      if (group.size() <= degree + 1) {
        throw new InsufficientLinesException(order, degree + 2, group.size());
      }
      double[] x = new double[group.size()];
      double[] y = new double[group.size()];
      for (int k = 0; k < x.length; ++k) {
        x[k] = group.get(k).getPosition();
        y[k] = group.get(k).getWavelength();
      }
      polynomials.put(order, new PolynomialFunction(NumericUtils.polyfit1d(x, y, degree)));
    }
    return new OrderPolynomialSolution(degree, polynomials);
  }

  public int getDegree() {
    return degree;
  }
}
