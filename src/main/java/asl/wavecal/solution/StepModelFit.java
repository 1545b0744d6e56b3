package asl.wavecal.solution;

import asl.wavecal.utils.NumericUtils;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Joint Levenberg-Marquardt fit of polynomial coefficients and step offsets. The model is
 * sum over (i, j) of C[i][j] * u^i * v^j, with u = (x + steps of x's group) / scaleX and
 * v = y / scaleY. Each group (order) has its own offsets at the shared knot positions. A 1D
 * per-order fit is the special case of a single group with degreeY = 0.
 * <p>
 * Fitting happens on scaled coefficients; the start and result are in original units.
 */
class StepModelFit {

  /**
   * Used in the least squared solver (quit when function output changes by less than this value)
   */
  private static final double F_TOLER = 1E-12;
  /**
   * Used in the least squared solver (quit when parameters change by less than this value)
   */
  private static final double X_TOLER = 1E-12;
  private static final int MAX_EVALUATIONS = 1000;

  private final double[] x;
  private final double[] y;
  private final int[] group;
  private final double[] target;
  private final double[] knots;
  private final int groups;
  private final int degreeX;
  private final int degreeY;
  private final double scaleX;
  private final double scaleY;

  private double[][] coefficients;
  private double[][] offsets;

  /**
   * @param x Pixel positions of the lines
   * @param y Second variable (order index), ignored when degreeY is 0
   * @param group Group (step function) index of each line, in [0, groups)
   * @param target Wavelength of each line
   * @param knots Knot positions shared by all groups
   * @param groups Number of groups
   * @param degreeX Degree in pixel direction
   * @param degreeY Degree in order direction
   */
  StepModelFit(double[] x, double[] y, int[] group, double[] target, double[] knots, int groups,
      int degreeX, int degreeY) {
    this.x = x;
    this.y = y;
    this.group = group;
    this.target = target;
    this.knots = knots;
    this.groups = groups;
    this.degreeX = degreeX;
    this.degreeY = degreeY;
    scaleX = NumericUtils.scaleFactor(x);
    scaleY = degreeY == 0 ? 1. : NumericUtils.scaleFactor(y);
  }

  /**
   * Run the fit, starting from the given (step-free) polynomial and zero offsets
   *
   * @param start Coefficients of the plain polynomial fit, [i][j] multiplying x^i * y^j
   */
  void fit(double[][] start) {
    int ncoef = (degreeX + 1) * (degreeY + 1);
    int nstep = knots.length;
    double[] params = new double[ncoef + groups * nstep];
    for (int i = 0; i <= degreeX; ++i) {
      for (int j = 0; j <= degreeY; ++j) {
        params[i * (degreeY + 1) + j] =
            start[i][j] * Math.pow(scaleX, i) * Math.pow(scaleY, j);
      }
    }

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(MatrixUtils.createRealVector(params)).
        target(MatrixUtils.createRealVector(target)).
        model(this::jacobian).
        lazyEvaluation(false).
        maxEvaluations(MAX_EVALUATIONS).
        maxIterations(MAX_EVALUATIONS).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(F_TOLER).
        withParameterRelativeTolerance(X_TOLER);

    double[] result = optimizer.optimize(lsp).getPoint().toArray();

    coefficients = new double[degreeX + 1][degreeY + 1];
    for (int i = 0; i <= degreeX; ++i) {
      for (int j = 0; j <= degreeY; ++j) {
        coefficients[i][j] =
            result[i * (degreeY + 1) + j] / (Math.pow(scaleX, i) * Math.pow(scaleY, j));
      }
    }
    offsets = new double[groups][nstep];
    for (int g = 0; g < groups; ++g) {
      System.arraycopy(result, ncoef + g * nstep, offsets[g], 0, nstep);
    }
  }

  /**
   * @return Fitted coefficients in original units, [i][j] multiplying x^i * y^j
   */
  double[][] getCoefficients() {
    return coefficients;
  }

  /**
   * @param g Group index
   * @return Step function fitted for that group
   */
  StepFunction getStepFunction(int g) {
    return new StepFunction(knots, offsets[g]);
  }

  private Pair<RealVector, RealMatrix> jacobian(RealVector point) {
    int ncoef = (degreeX + 1) * (degreeY + 1);
    int nstep = knots.length;
    double[] params = point.toArray();
    RealVector values = new ArrayRealVector(x.length);
    RealMatrix jacobian = new Array2DRowRealMatrix(x.length, params.length);

    double[] powU = new double[degreeX + 1];
    double[] powV = new double[degreeY + 1];
    for (int k = 0; k < x.length; ++k) {
      int offsetStart = ncoef + group[k] * nstep;
      double shifted = x[k];
      for (int m = 0; m < nstep; ++m) {
        if (knots[m] <= x[k]) {
          shifted += params[offsetStart + m];
        }
      }
      double u = shifted / scaleX;
      double v = y[k] / scaleY;
      powU[0] = 1.;
      for (int i = 1; i <= degreeX; ++i) {
        powU[i] = powU[i - 1] * u;
      }
      powV[0] = 1.;
      for (int j = 1; j <= degreeY; ++j) {
        powV[j] = powV[j - 1] * v;
      }

      double value = 0.;
      double slope = 0.; // derivative of the model with respect to the shifted pixel
      for (int i = 0; i <= degreeX; ++i) {
        for (int j = 0; j <= degreeY; ++j) {
          int idx = i * (degreeY + 1) + j;
          value += params[idx] * powU[i] * powV[j];
          jacobian.setEntry(k, idx, powU[i] * powV[j]);
          if (i > 0) {
            slope += params[idx] * i * powU[i - 1] * powV[j] / scaleX;
          }
        }
      }
      values.setEntry(k, value);
      for (int m = 0; m < nstep; ++m) {
        if (knots[m] <= x[k]) {
          jacobian.setEntry(k, offsetStart + m, slope);
        }
      }
    }
    return new Pair<>(values, jacobian);
  }
}
