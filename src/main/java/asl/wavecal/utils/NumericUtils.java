package asl.wavecal.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Arrays;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Class containing methods to serve as math functions: statistics on masked data, linear least
 * squares and polynomial fitting/evaluation in one and two dimensions, and searching sampled
 * wavelength arrays.
 */
public class NumericUtils {

  /**
   * Speed of light in vacuum, m/s. Residuals are expressed as velocities in these units.
   */
  public static final double SPEED_OF_LIGHT = 299792458.;

  /**
   * Sets decimalformat object so that infinity can be printed in reports
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

  /**
   * Median of the given values (mean of the two middle values for even-length data)
   *
   * @param values Data to get the median of
   * @return Median, or NaN for empty input
   */
  public static double median(double[] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    return new Median().evaluate(values);
  }

  /**
   * Median of the values that are not masked
   *
   * @param values Data to get the median of
   * @param mask True where an entry should be ignored
   * @return Median of the unmasked entries, or NaN if every entry is masked
   */
  public static double median(double[] values, boolean[] mask) {
    double[] valid = new double[values.length];
    int count = 0;
    for (int i = 0; i < values.length; ++i) {
      if (!mask[i]) {
        valid[count] = values[i];
        ++count;
      }
    }
    return median(Arrays.copyOf(valid, count));
  }

  /**
   * Median of the differences between consecutive values
   *
   * @param values Data (at least two points)
   * @return Median spacing of the data
   */
  public static double medianDifference(double[] values) {
    double[] diff = new double[values.length - 1];
    for (int i = 0; i < diff.length; ++i) {
      diff[i] = values[i + 1] - values[i];
    }
    return median(diff);
  }

  /**
   * Solve an overdetermined linear system in the least-squares sense, using the pseudo-inverse
   * from a singular value decomposition (so rank-deficient systems still get the minimum-norm
   * solution)
   *
   * @param design Design matrix, one row per observation
   * @param target Observed values
   * @return Coefficients minimizing the squared residual
   */
  public static double[] leastSquares(double[][] design, double[] target) {
    RealMatrix matrix = MatrixUtils.createRealMatrix(design);
    SingularValueDecomposition svd = new SingularValueDecomposition(matrix);
    return svd.getSolver().solve(new ArrayRealVector(target)).toArray();
  }

  /**
   * Scale factor for polynomial inputs: the largest absolute value, or 1 if everything is zero
   *
   * @param values Inputs to a polynomial
   * @return Value to divide inputs by to bring them into [-1, 1]
   */
  public static double scaleFactor(double[] values) {
    double max = 0.;
    for (double value : values) {
      max = Math.max(max, Math.abs(value));
    }
    return max == 0. ? 1. : max;
  }

  /**
   * Fit a 1D polynomial by least squares. The input is rescaled to [-1, 1] before the fit and the
   * coefficients scaled back afterwards.
   *
   * @param x Independent values
   * @param y Dependent values
   * @param degree Degree of the polynomial
   * @return Coefficients in ascending order of power (constant term first)
   */
  public static double[] polyfit1d(double[] x, double[] y, int degree) {
    double scale = scaleFactor(x);
    double[][] design = new double[x.length][degree + 1];
    for (int i = 0; i < x.length; ++i) {
      double xs = x[i] / scale;
      double power = 1.;
      for (int j = 0; j <= degree; ++j) {
        design[i][j] = power;
        power *= xs;
      }
    }
    double[] coeffs = leastSquares(design, y);
    double factor = 1.;
    for (int j = 0; j <= degree; ++j) {
      coeffs[j] /= factor;
      factor *= scale;
    }
    return coeffs;
  }

  /**
   * Fit a 2D polynomial surface z = sum over i, j of c[i][j] * x^i * y^j, with i up to degreeX
   * and j up to degreeY, by least squares. Both inputs are rescaled to [-1, 1] before the fit and
   * the coefficients scaled back afterwards.
   *
   * @param x First independent variable
   * @param y Second independent variable
   * @param z Dependent values
   * @param degreeX Degree in x
   * @param degreeY Degree in y
   * @return Coefficient grid of shape (degreeX + 1, degreeY + 1)
   */
  public static double[][] polyfit2d(double[] x, double[] y, double[] z, int degreeX,
      int degreeY) {
    double scaleX = scaleFactor(x);
    double scaleY = scaleFactor(y);
    int terms = (degreeX + 1) * (degreeY + 1);
    double[][] design = new double[x.length][terms];
    for (int k = 0; k < x.length; ++k) {
      double xs = x[k] / scaleX;
      double ys = y[k] / scaleY;
      double powerX = 1.;
      for (int i = 0; i <= degreeX; ++i) {
        double powerY = 1.;
        for (int j = 0; j <= degreeY; ++j) {
          design[k][i * (degreeY + 1) + j] = powerX * powerY;
          powerY *= ys;
        }
        powerX *= xs;
      }
    }
    double[] solution = leastSquares(design, z);
    double[][] coeffs = new double[degreeX + 1][degreeY + 1];
    for (int i = 0; i <= degreeX; ++i) {
      for (int j = 0; j <= degreeY; ++j) {
        coeffs[i][j] =
            solution[i * (degreeY + 1) + j] / (Math.pow(scaleX, i) * Math.pow(scaleY, j));
      }
    }
    return coeffs;
  }

  /**
   * Evaluate a 2D polynomial given by a coefficient grid (as produced by polyfit2d)
   *
   * @param x First variable
   * @param y Second variable
   * @param coeffs Coefficient grid, coeffs[i][j] multiplying x^i * y^j
   * @return Value of the polynomial
   */
  public static double polyval2d(double x, double y, double[][] coeffs) {
    double result = 0.;
    for (int i = coeffs.length - 1; i >= 0; --i) {
      double inner = 0.;
      for (int j = coeffs[i].length - 1; j >= 0; --j) {
        inner = inner * y + coeffs[i][j];
      }
      result = result * x + inner;
    }
    return result;
  }

  public static boolean isStrictlyIncreasing(double[] values) {
    for (int i = 1; i < values.length; ++i) {
      if (!(values[i] > values[i - 1])) {
        return false;
      }
    }
    return true;
  }

  /**
   * Find where a value falls in a sampled array. For strictly increasing data this is the index of
   * the first sample greater than the value (so samples[idx - 1] <= value < samples[idx]); for
   * anything else the array is scanned for the first sample at or above the value.
   *
   * @param samples Sampled values (e.g., wavelengths of one order)
   * @param value Value to locate
   * @return Index as described, or samples.length if the value is past the end
   */
  public static int digitize(double[] samples, double value) {
    if (isStrictlyIncreasing(samples)) {
      int low = 0;
      int high = samples.length;
      while (low < high) {
        int mid = (low + high) >>> 1;
        if (samples[mid] <= value) {
          low = mid + 1;
        } else {
          high = mid;
        }
      }
      return low;
    }
    for (int i = 0; i < samples.length; ++i) {
      if (samples[i] >= value) {
        return i;
      }
    }
    return samples.length;
  }

  /**
   * Doppler-equivalent velocity of a wavelength error
   *
   * @param measured Wavelength from a solution
   * @param reference Reference (catalogue) wavelength
   * @return (measured - reference) / reference * c, in m/s
   */
  public static double velocityResidual(double measured, double reference) {
    return (measured - reference) / reference * SPEED_OF_LIGHT;
  }
}
