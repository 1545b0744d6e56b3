package asl.wavecal.align;

import asl.wavecal.input.LineList;
import asl.wavecal.input.ObservedSpectrum;
import asl.wavecal.input.ReferenceLine;
import asl.wavecal.utils.CorrelationUtils;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Automatic alignment of a reference line list with an observed spectrum. An image of the
 * reference lines is rendered (each line as a Gaussian over its pixel extent) and cross-correlated
 * with the observed spectrum; the peak of the correlation gives the global order and pixel shift.
 * If a shift window is set, each order is then correlated on its own, over a limited range of
 * pixel shifts, to pick up residual per-order offsets.
 */
public class CorrelationAlignment implements AlignmentStrategy {

  private static final Logger logger = Logger.getLogger(CorrelationAlignment.class);

  private final double shiftWindow;

  /**
   * @param shiftWindow Fraction of the number of columns searched (in total, so half on either
   * side) in the per-order refinement; 0 disables the refinement
   */
  public CorrelationAlignment(double shiftWindow) {
    if (shiftWindow < 0 || shiftWindow > 1) {
      throw new IllegalArgumentException("Shift window must be between 0 and 1: " + shiftWindow);
    }
    this.shiftWindow = shiftWindow;
  }

  /**
   * Render reference lines as an image. Row r of the image holds the lines of order
   * (firstOrder + r); each line is a Gaussian of the line's width and height, centered in its
   * pixel extent and clipped to the image. Where lines overlap the larger value is kept.
   * Lines with a negative order, an order outside the image, or an extent entirely off the image
   * are not drawn.
   *
   * @param lines Lines to render
   * @param firstOrder Order index of the first image row
   * @param rows Number of rows in the image
   * @param columns Number of columns in the image
   * @return Rendered image
   */
  public static double[][] createImageFromLines(LineList lines, int firstOrder, int rows,
      int columns) {
    double[][] image = new double[rows][columns];
    for (ReferenceLine line : lines) {
      int row = line.getOrder() - firstOrder;
      if (line.getOrder() < 0 || row < 0 || row >= rows) {
        continue;
      }
      int xfirst = line.getFirstPixel();
      int xlast = line.getLastPixel();
      int first = Math.max(xfirst, 0);
      int last = Math.min(xlast, columns);
      if (first >= last) {
        continue;
      }
      double center = (xlast - xfirst - 1) / 2.;
      double width = line.getWidth();
      for (int x = first; x < last; ++x) {
        double z = (x - xfirst - center) / width;
        double value = line.getHeight() * Math.exp(-0.5 * z * z);
        image[row][x] = Math.max(image[row][x], value);
      }
    }
    return image;
  }

  @Override
  public AlignmentOffset align(ObservedSpectrum observed, LineList lines) {
    int nord = observed.getNumberOfOrders();
    int ncol = observed.getNumberOfColumns();

    int firstOrder = Integer.MAX_VALUE;
    int lastOrder = Integer.MIN_VALUE;
    for (ReferenceLine line : lines) {
      if (line.getOrder() >= 0) {
        firstOrder = Math.min(firstOrder, line.getOrder());
        lastOrder = Math.max(lastOrder, line.getOrder());
      }
    }
    if (firstOrder > lastOrder) {
      logger.warn("No reference lines to align with, using zero offset");
      return AlignmentOffset.ZERO;
    }

    double[][] observedImage = observed.getFilled(0.);
    double[][] referenceImage =
        createImageFromLines(lines, firstOrder, lastOrder - firstOrder + 1, ncol);

    int[] best = CorrelationUtils.findBestShift2D(observedImage, referenceImage);
    if (best == null) {
      logger.warn("Cross-correlation found no matching peak, using zero offset");
      return AlignmentOffset.ZERO;
    }
    // best[0] is the observed row matching the first reference row
    int orderShift = best[0] - firstOrder;
    int pixelShift = best[1];
    logger.debug("Global alignment offset: order " + orderShift + ", pixel " + pixelShift);

    Map<Integer, Integer> orderShifts = new LinkedHashMap<>();
    int width = ((int) (ncol * shiftWindow)) / 2;
    if (width > 0) {
      LineList shifted = lines.copy();
      shifted.applyOffset(new AlignmentOffset(orderShift, pixelShift));
      double[][] shiftedImage = createImageFromLines(shifted, 0, nord, ncol);
      for (int i = 0; i < nord; ++i) {
        Integer shift = CorrelationUtils.findBestShift1D(observedImage[i], shiftedImage[i], width);
        if (shift != null && shift != 0) {
          orderShifts.put(i, shift);
        }
      }
      logger.debug("Per-order pixel shifts: " + orderShifts);
    }

    return new AlignmentOffset(orderShift, pixelShift, orderShifts);
  }

  public double getShiftWindow() {
    return shiftWindow;
  }
}
