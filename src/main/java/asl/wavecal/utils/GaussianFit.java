package asl.wavecal.utils;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Least-squares fits of a Gaussian with a constant offset,
 * g(x) = a * exp(-(x - mu)^2 / (2 * s)) + c, where s is the variance.
 * Parameter arrays returned by the fits are always ordered {a, mu, s, c}.
 * <p>
 * Fit failures are reported through the commons-math exceptions thrown by the optimizer
 * ({@link org.apache.commons.math3.exception.MathIllegalStateException} subclasses for
 * non-convergence) and {@link IllegalArgumentException} for unusable input.
 */
public class GaussianFit {

  /**
   * Limit on optimizer evaluations and iterations for a single fit
   */
  static final int MAX_EVALUATIONS = 1000;
  /**
   * Used in the least squared solver (quit when function output changes by less than this value)
   */
  private static final double F_TOLER = 1E-10;
  /**
   * Used in the least squared solver (quit when parameters change by less than this value)
   */
  private static final double X_TOLER = 1E-10;
  /**
   * Smallest variance a fit may reach
   */
  private static final double MIN_VARIANCE = 1E-6;

  /**
   * Value of the Gaussian model at a point
   *
   * @param x Point to evaluate at
   * @param params Parameters {a, mu, s, c}
   * @return Model value
   */
  public static double value(double x, double[] params) {
    double dx = x - params[1];
    return params[0] * Math.exp(-dx * dx / (2 * params[2])) + params[3];
  }

  /**
   * Fit a spectral line. The offset c is fixed at the minimum of the data; amplitude, center and
   * variance are fit within bounds: a in [min(mean(y), y[i]), 1.5 max(y)], mu within the range of
   * x, s in (0, n / 2], where i is the seed index. The seed is the maximum of the data weighted by
   * a triangle peaking at the middle of the window, so a peak near the center is preferred over a
   * brighter one at the edge.
   *
   * @param x Pixel positions (unmasked points only)
   * @param y Intensities at those positions
   * @return Fitted parameters {a, mu, s, c}
   */
  public static double[] fitLine(double[] x, double[] y) {
    if (x.length == 0 || x.length != y.length) {
      throw new IllegalArgumentException("Need matching, non-empty data to fit a line");
    }
    int n = y.length;
    int mid = n / 2;
    double[] weights = new double[n];
    for (int k = 0; k < mid; ++k) {
      weights[k] = mid > 1 ? k / (double) (mid - 1) : 0.;
    }
    int rest = n - mid;
    for (int k = 0; k < rest; ++k) {
      weights[mid + k] = rest > 1 ? 1. - k / (double) (rest - 1) : 1.;
    }
    int seed = 0;
    for (int k = 1; k < n; ++k) {
      if (y[k] * weights[k] > y[seed] * weights[seed]) {
        seed = k;
      }
    }

    double minY = Double.POSITIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;
    double meanY = 0.;
    double minX = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    for (int k = 0; k < n; ++k) {
      minY = Math.min(minY, y[k]);
      maxY = Math.max(maxY, y[k]);
      meanY += y[k] / n;
      minX = Math.min(minX, x[k]);
      maxX = Math.max(maxX, x[k]);
    }
    final double offset = minY;

    double[] lower = {Math.min(meanY, y[seed]), minX, MIN_VARIANCE};
    double[] upper = {1.5 * maxY, maxX, n / 2.};
    double[] start = {y[seed], x[seed], 1.};

    MultivariateJacobianFunction model = point -> {
      double a = point.getEntry(0);
      double mu = point.getEntry(1);
      double s = point.getEntry(2);
      RealVector values = new ArrayRealVector(n);
      RealMatrix jacobian = new Array2DRowRealMatrix(n, 3);
      for (int k = 0; k < n; ++k) {
        double dx = x[k] - mu;
        double e = Math.exp(-dx * dx / (2 * s));
        values.setEntry(k, a * e + offset);
        jacobian.setEntry(k, 0, e);
        jacobian.setEntry(k, 1, a * e * dx / s);
        jacobian.setEntry(k, 2, a * e * dx * dx / (2 * s * s));
      }
      return new Pair<>(values, jacobian);
    };

    double[] fit = optimize(model, start, y, new BoundsValidator(lower, upper));
    return new double[]{fit[0], fit[1], fit[2], offset};
  }

  /**
   * Fit a narrow peak with all four parameters free, seeded at the maximum of the central half of
   * the data with unit variance. The center is kept within the range of x and the variance
   * positive.
   *
   * @param x Pixel positions
   * @param y Intensities at those positions
   * @return Fitted parameters {a, mu, s, c}
   */
  public static double[] fitPeak(double[] x, double[] y) {
    if (x.length < 4 || x.length != y.length) {
      throw new IllegalArgumentException("Need at least 4 matching points to fit a peak");
    }
    int n = y.length;
    int seed = n / 4;
    double minY = y[0];
    for (int k = 0; k < n; ++k) {
      if (k >= n / 4 && k < 3 * n / 4 && y[k] > y[seed]) {
        seed = k;
      }
      minY = Math.min(minY, y[k]);
    }
    double minX = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    for (double value : x) {
      minX = Math.min(minX, value);
      maxX = Math.max(maxX, value);
    }

    double[] lower = {Double.NEGATIVE_INFINITY, minX, MIN_VARIANCE, Double.NEGATIVE_INFINITY};
    double[] upper = {Double.POSITIVE_INFINITY, maxX, Double.POSITIVE_INFINITY,
        Double.POSITIVE_INFINITY};
    double[] start = {y[seed] - minY, x[seed], 1., minY};

    MultivariateJacobianFunction model = point -> {
      double a = point.getEntry(0);
      double mu = point.getEntry(1);
      double s = point.getEntry(2);
      double c = point.getEntry(3);
      RealVector values = new ArrayRealVector(n);
      RealMatrix jacobian = new Array2DRowRealMatrix(n, 4);
      for (int k = 0; k < n; ++k) {
        double dx = x[k] - mu;
        double e = Math.exp(-dx * dx / (2 * s));
        values.setEntry(k, a * e + c);
        jacobian.setEntry(k, 0, e);
        jacobian.setEntry(k, 1, a * e * dx / s);
        jacobian.setEntry(k, 2, a * e * dx * dx / (2 * s * s));
        jacobian.setEntry(k, 3, 1.);
      }
      return new Pair<>(values, jacobian);
    };

    return optimize(model, start, y, new BoundsValidator(lower, upper));
  }

  private static double[] optimize(MultivariateJacobianFunction model, double[] start,
      double[] target, ParameterValidator validator) {
    RealVector startVector = validator.validate(MatrixUtils.createRealVector(start));

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(startVector).
        target(MatrixUtils.createRealVector(target)).
        model(model).
        parameterValidator(validator).
        lazyEvaluation(false).
        maxEvaluations(MAX_EVALUATIONS).
        maxIterations(MAX_EVALUATIONS).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(F_TOLER).
        withParameterRelativeTolerance(X_TOLER);

    LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(lsp);
    return optimum.getPoint().toArray();
  }

  /**
   * Clamps each parameter into its [lower, upper] range after every solver step
   */
  private static class BoundsValidator implements ParameterValidator {

    private final double[] lower;
    private final double[] upper;

    BoundsValidator(double[] lower, double[] upper) {
      this.lower = lower;
      this.upper = upper;
    }

    @Override
    public RealVector validate(RealVector params) {
      RealVector out = params.copy();
      for (int i = 0; i < out.getDimension(); ++i) {
        double value = Math.min(upper[i], out.getEntry(i));
        out.setEntry(i, Math.max(lower[i], value));
      }
      return out;
    }
  }
}
