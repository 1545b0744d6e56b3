package asl.wavecal.solution;

import asl.wavecal.utils.NumericUtils;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wavelength solution given by a single polynomial surface over (pixel, order), fit jointly to
 * all orders. Orders may carry a step correction that is applied to the pixel position before the
 * surface is evaluated.
 */
public class SurfacePolynomialSolution implements WavelengthSolution {

  private final double[][] coefficients;
  private final Map<Integer, StepFunction> steps;

  public SurfacePolynomialSolution(double[][] coefficients) {
    this(coefficients, Collections.<Integer, StepFunction>emptyMap());
  }

  /**
   * @param coefficients Coefficient grid, coefficients[i][j] multiplying pixel^i * order^j
   * @param steps Step correction of each order (orders without an entry are not corrected)
   */
  public SurfacePolynomialSolution(double[][] coefficients, Map<Integer, StepFunction> steps) {
    this.coefficients = new double[coefficients.length][];
    for (int i = 0; i < coefficients.length; ++i) {
      this.coefficients[i] = coefficients[i].clone();
    }
    this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
  }

  @Override
  public double evaluate(double position, int order) {
    StepFunction step = steps.get(order);
    double x = step == null ? position : step.apply(position);
    return NumericUtils.polyval2d(x, order, coefficients);
  }

  @Override
  public int getParameterCount() {
    int count = coefficients.length * coefficients[0].length;
    for (StepFunction step : steps.values()) {
      count += step.getParameterCount();
    }
    return count;
  }

  /**
   * @return Copy of the coefficient grid, [i][j] multiplying pixel^i * order^j
   */
  public double[][] getCoefficients() {
    double[][] out = new double[coefficients.length][];
    for (int i = 0; i < out.length; ++i) {
      out[i] = coefficients[i].clone();
    }
    return out;
  }

  /**
   * @param order Order index
   * @return Step correction of the order, or null if it has none
   */
  public StepFunction getStepFunction(int order) {
    return steps.get(order);
  }
}
