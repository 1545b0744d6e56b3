package asl.wavecal.input;

import java.util.Arrays;

/**
 * Extracted spectrum of an echelle frame, indexed by (order, column), together with a mask of
 * entries that carry no usable signal. Instances are treated as values: operations such as
 * {@link #normalize()} return new spectra rather than changing this one.
 */
public class ObservedSpectrum {

  private final double[][] data;
  private final boolean[][] mask; // true where the entry is invalid

  /**
   * Create a spectrum from extracted data; any non-finite value is masked
   *
   * @param data Intensities, one row per order, all rows the same length
   */
  public ObservedSpectrum(double[][] data) {
    this(data, null);
  }

  /**
   * Create a spectrum from extracted data and a mask of invalid entries. Non-finite values are
   * masked in addition to the entries set in the mask.
   *
   * @param data Intensities, one row per order, all rows the same length
   * @param mask Array of the same shape, true where an entry is invalid (may be null)
   */
  public ObservedSpectrum(double[][] data, boolean[][] mask) {
    if (data.length == 0) {
      throw new IllegalArgumentException("Spectrum must have at least one order");
    }
    int ncol = data[0].length;
    this.data = new double[data.length][];
    this.mask = new boolean[data.length][ncol];
    for (int i = 0; i < data.length; ++i) {
      if (data[i].length != ncol) {
        throw new IllegalArgumentException("All orders must have the same number of columns");
      }
      if (mask != null && mask[i].length != ncol) {
        throw new IllegalArgumentException("Mask shape does not match the data shape");
      }
      this.data[i] = data[i].clone();
      for (int j = 0; j < ncol; ++j) {
        this.mask[i][j] = (mask != null && mask[i][j]) || !Double.isFinite(data[i][j]);
      }
    }
  }

  public int getNumberOfOrders() {
    return data.length;
  }

  public int getNumberOfColumns() {
    return data[0].length;
  }

  public double get(int order, int column) {
    return data[order][column];
  }

  public boolean isMasked(int order, int column) {
    return mask[order][column];
  }

  /**
   * @param order Order index
   * @return True if every column of the order is masked
   */
  public boolean isOrderMasked(int order) {
    for (boolean masked : mask[order]) {
      if (!masked) {
        return false;
      }
    }
    return true;
  }

  /**
   * Get a copy of one order with masked entries replaced by a fill value
   *
   * @param order Order index
   * @param fill Value to use in place of masked entries
   * @return Copy of the order's data
   */
  public double[] getFilledOrder(int order, double fill) {
    double[] out = data[order].clone();
    for (int j = 0; j < out.length; ++j) {
      if (mask[order][j]) {
        out[j] = fill;
      }
    }
    return out;
  }

  /**
   * @param fill Value to use in place of masked entries
   * @return Copy of the whole spectrum with masked entries replaced
   */
  public double[][] getFilled(double fill) {
    double[][] out = new double[data.length][];
    for (int i = 0; i < data.length; ++i) {
      out[i] = getFilledOrder(i, fill);
    }
    return out;
  }

  /**
   * Scale each order to unit peak amplitude. Per order, the smallest positive unmasked value is
   * subtracted and the result divided by the order's maximum; entries that are non-positive
   * afterwards are masked. An order without positive values ends up fully masked.
   *
   * @return New, normalized spectrum
   */
  public ObservedSpectrum normalize() {
    double[][] normData = new double[data.length][];
    boolean[][] normMask = new boolean[data.length][];
    for (int i = 0; i < data.length; ++i) {
      normData[i] = data[i].clone();
      normMask[i] = mask[i].clone();

      double min = Double.POSITIVE_INFINITY;
      for (int j = 0; j < normData[i].length; ++j) {
        if (!normMask[i][j] && normData[i][j] > 0 && normData[i][j] < min) {
          min = normData[i][j];
        }
      }
      if (Double.isInfinite(min)) {
        // nothing positive in this order
        Arrays.fill(normMask[i], true);
        continue;
      }

      double max = Double.NEGATIVE_INFINITY;
      for (int j = 0; j < normData[i].length; ++j) {
        if (!normMask[i][j]) {
          normData[i][j] -= min;
          max = Math.max(max, normData[i][j]);
        }
      }
      for (int j = 0; j < normData[i].length; ++j) {
        if (max > 0) {
          normData[i][j] /= max;
        }
        if (normData[i][j] <= 0) {
          normMask[i][j] = true;
        }
      }
    }
    return new ObservedSpectrum(normData, normMask);
  }
}
