package asl.wavecal.solution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;

/**
 * Wavelength solution made of one independent polynomial per order (pixel to wavelength),
 * optionally with a step correction applied to the pixel position first.
 */
public class OrderPolynomialSolution implements WavelengthSolution {

  private final int degree;
  private final Map<Integer, PolynomialFunction> polynomials;
  private final Map<Integer, StepFunction> steps;

  public OrderPolynomialSolution(int degree, Map<Integer, PolynomialFunction> polynomials) {
    this(degree, polynomials, Collections.<Integer, StepFunction>emptyMap());
  }

  /**
   * @param degree Degree of every polynomial
   * @param polynomials Polynomial of each order, keyed on order index
   * @param steps Step correction of each order (orders without an entry are not corrected)
   */
  public OrderPolynomialSolution(int degree, Map<Integer, PolynomialFunction> polynomials,
      Map<Integer, StepFunction> steps) {
    this.degree = degree;
    this.polynomials = Collections.unmodifiableMap(new LinkedHashMap<>(polynomials));
    this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
  }

  @Override
  public double evaluate(double position, int order) {
    PolynomialFunction polynomial = polynomials.get(order);
    if (polynomial == null) {
      throw new IllegalArgumentException("Solution has no polynomial for order " + order);
    }
    StepFunction step = steps.get(order);
    double x = step == null ? position : step.apply(position);
    return polynomial.value(x);
  }

  @Override
  public int getParameterCount() {
    int count = polynomials.size() * (degree + 1);
    for (StepFunction step : steps.values()) {
      count += step.getParameterCount();
    }
    return count;
  }

  public int getDegree() {
    return degree;
  }

  public Set<Integer> getOrders() {
    return polynomials.keySet();
  }

  public PolynomialFunction getPolynomial(int order) {
    return polynomials.get(order);
  }

  /**
   * @param order Order index
   * @return Step correction of the order, or null if it has none
   */
  public StepFunction getStepFunction(int order) {
    return steps.get(order);
  }
}
