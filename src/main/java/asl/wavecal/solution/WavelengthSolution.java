package asl.wavecal.solution;

/**
 * Mapping from detector position (pixel, order) to wavelength. Implementations are immutable.
 */
public interface WavelengthSolution {

  /**
   * Evaluate the solution at a single point
   *
   * @param position Pixel position along the order (may be fractional)
   * @param order Order index
   * @return Wavelength at that point
   */
  double evaluate(double position, int order);

  /**
   * Number of free parameters of the model, used for information criteria
   *
   * @return Parameter count (not including the noise term)
   */
  int getParameterCount();

  /**
   * Evaluate the solution at a set of points
   *
   * @param positions Pixel positions
   * @param orders Order index of each position
   * @return Wavelengths, same length as the inputs
   */
  default double[] evaluate(double[] positions, int[] orders) {
    if (positions.length != orders.length) {
      throw new IllegalArgumentException("Positions and orders must have the same shape ("
          + positions.length + " vs. " + orders.length + ")");
    }
    double[] out = new double[positions.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = evaluate(positions[i], orders[i]);
    }
    return out;
  }

  /**
   * Evaluate the solution on a 2D grid of points
   *
   * @param positions Pixel positions
   * @param orders Order index of each position, same shape as positions
   * @return Wavelengths, same shape as the inputs
   */
  default double[][] evaluate(double[][] positions, int[][] orders) {
    if (positions.length != orders.length) {
      throw new IllegalArgumentException("Positions and orders must have the same shape");
    }
    double[][] out = new double[positions.length][];
    for (int i = 0; i < out.length; ++i) {
      out[i] = evaluate(positions[i], orders[i]);
    }
    return out;
  }

  /**
   * Evaluate the solution for every pixel of every order of the detector
   *
   * @param nord Number of orders
   * @param ncol Number of columns (pixels per order)
   * @return Wavelength image of shape (nord, ncol)
   */
  default double[][] makeWave(int nord, int ncol) {
    double[][] wave = new double[nord][ncol];
    for (int i = 0; i < nord; ++i) {
      for (int j = 0; j < ncol; ++j) {
        wave[i][j] = evaluate(j, i);
      }
    }
    return wave;
  }
}
