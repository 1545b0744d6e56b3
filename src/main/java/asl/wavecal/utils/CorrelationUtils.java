package asl.wavecal.utils;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Cross-correlation of images and rows, used to line up a rendered reference spectrum with an
 * observed one. The 2D case is done in frequency space (zero-padded so the result is the linear,
 * not circular, correlation); the 1D windowed case is evaluated directly since only a few shifts
 * are of interest.
 */
public class CorrelationUtils {

  /**
   * Linear cross-correlation of two images, c(dy, dx) = sum over (i, j) of
   * a[i + dy][j + dx] * b[i][j], for every shift where the images overlap.
   * The result is indexed so that out[dy + b.length - 1][dx + b[0].length - 1] is c(dy, dx).
   *
   * @param a Image being searched (e.g., observed spectrum)
   * @param b Template image (e.g., rendered reference lines)
   * @return Correlation of shape (a.length + b.length - 1, a[0].length + b[0].length - 1)
   */
  public static double[][] crossCorrelate2D(double[][] a, double[][] b) {
    int outRows = a.length + b.length - 1;
    int outCols = a[0].length + b[0].length - 1;
    int padRows = nextPowerOfTwo(outRows);
    int padCols = nextPowerOfTwo(outCols);

    Complex[][] aFFT = fft2(pad(a, padRows, padCols), TransformType.FORWARD);
    Complex[][] bFFT = fft2(pad(b, padRows, padCols), TransformType.FORWARD);

    Complex[][] product = new Complex[padRows][padCols];
    for (int i = 0; i < padRows; ++i) {
      for (int j = 0; j < padCols; ++j) {
        product[i][j] = aFFT[i][j].multiply(bFFT[i][j].conjugate());
      }
    }
    Complex[][] circular = fft2(product, TransformType.INVERSE);

    double[][] out = new double[outRows][outCols];
    int rowOffset = b.length - 1;
    int colOffset = b[0].length - 1;
    for (int r = 0; r < outRows; ++r) {
      // negative shifts wrap around to the end of the padded result
      int dy = r - rowOffset;
      int pr = (dy + padRows) % padRows;
      for (int c = 0; c < outCols; ++c) {
        int dx = c - colOffset;
        int pc = (dx + padCols) % padCols;
        out[r][c] = circular[pr][pc].getReal();
      }
    }
    return out;
  }

  /**
   * Find the shift of the template image that best matches the searched image
   *
   * @param a Image being searched
   * @param b Template image
   * @return Array {dy, dx} maximizing the correlation, or null if no positive correlation exists
   */
  public static int[] findBestShift2D(double[][] a, double[][] b) {
    double[][] correlation = crossCorrelate2D(a, b);
    double best = 0.;
    int[] shift = null;
    for (int r = 0; r < correlation.length; ++r) {
      for (int c = 0; c < correlation[r].length; ++c) {
        // small threshold to avoid picking up numerical noise of an all-zero product
        if (correlation[r][c] > best && correlation[r][c] > 1E-12) {
          best = correlation[r][c];
          shift = new int[]{r - (b.length - 1), c - (b[0].length - 1)};
        }
      }
    }
    return shift;
  }

  /**
   * Find the shift, within a bounded window, of a template row that best matches a searched row,
   * c(s) = sum over j of a[j + s] * b[j]
   *
   * @param a Row being searched
   * @param b Template row (same length as a)
   * @param maxShift Largest shift (in either direction) to consider
   * @return Best shift, or null if no shift gives a positive correlation
   */
  public static Integer findBestShift1D(double[] a, double[] b, int maxShift) {
    double best = 0.;
    Integer shift = null;
    for (int s = -maxShift; s <= maxShift; ++s) {
      double sum = 0.;
      int low = Math.max(0, -s);
      int high = Math.min(b.length, a.length - s);
      for (int j = low; j < high; ++j) {
        sum += a[j + s] * b[j];
      }
      if (sum > best) {
        best = sum;
        shift = s;
      }
    }
    return shift;
  }

  private static Complex[][] fft2(Complex[][] data, TransformType type) {
    FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);
    int rows = data.length;
    int cols = data[0].length;
    Complex[][] out = new Complex[rows][];
    for (int i = 0; i < rows; ++i) {
      out[i] = fft.transform(data[i], type);
    }
    Complex[] column = new Complex[rows];
    for (int j = 0; j < cols; ++j) {
      for (int i = 0; i < rows; ++i) {
        column[i] = out[i][j];
      }
      Complex[] transformed = fft.transform(column, type);
      for (int i = 0; i < rows; ++i) {
        out[i][j] = transformed[i];
      }
    }
    return out;
  }

  private static Complex[][] pad(double[][] data, int rows, int cols) {
    Complex[][] out = new Complex[rows][cols];
    for (int i = 0; i < rows; ++i) {
      for (int j = 0; j < cols; ++j) {
        if (i < data.length && j < data[i].length) {
          out[i][j] = new Complex(data[i][j]);
        } else {
          out[i][j] = Complex.ZERO;
        }
      }
    }
    return out;
  }

  private static int nextPowerOfTwo(int n) {
    int p = 1;
    while (p < n) {
      p *= 2;
    }
    return p;
  }
}
