package asl.wavecal.experiment;

import asl.wavecal.input.Configuration;
import asl.wavecal.input.DataStore;
import asl.wavecal.input.LineList;
import asl.wavecal.input.ObservedSpectrum;
import asl.wavecal.input.ReferenceLine;
import asl.wavecal.output.CalResult;
import asl.wavecal.utils.GaussianFit;
import asl.wavecal.utils.NumericUtils;
import asl.wavecal.utils.PeakUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Refinement of an existing wavelength calibration using a laser frequency comb exposure, whose
 * peaks are exactly evenly spaced in frequency: f(n) = f0 + n * fr.
 * <p>
 * In every order the comb peaks are detected and centered, and each is given a running mode
 * number (corrected for peaks that were missed or detected twice). The existing wavelength image
 * gives the frequency of each peak, and a straight line through (mode number, frequency) gives
 * the order's anchor frequency and spacing. The mode numbers of each order are then shifted by
 * a whole number so its anchor matches the anchor of the reference order, which puts all orders
 * on one absolute numbering. A single line through all peaks of all orders gives the global f0
 * and fr, from which every peak gets an exact wavelength. A solution is fit to these peaks,
 * peaks beyond the residual threshold are dropped once, and the refit solution is evaluated
 * over the detector.
 * <p>
 * Diagnostic data (getData) holds the residuals of the comb peaks against pixel position, the
 * difference between the old and new wavelength image for each order, and, if gas lamp lines
 * were given, their residuals in the comb solution.
 */
public class FrequencyCombExperiment extends CalibrationExperiment {

  private static final Logger logger = Logger.getLogger(FrequencyCombExperiment.class);

  private LineList gasLampLines;
  private double[][] previousWave;

  private double anchorFrequency;
  private double repetitionFrequency;
  private Map<Integer, Double> orderAnchors;
  private Map<Integer, Double> orderSpacings;
  private Map<Integer, Integer> modeOffsets;

  public FrequencyCombExperiment() {
    this(new Configuration());
  }

  public FrequencyCombExperiment(Configuration config) {
    super(config);
    gasLampLines = null;
  }

  /**
   * Give the line list of the gas lamp calibration, so that its residuals in the comb solution
   * are included in the diagnostic data
   *
   * @param lines Gas lamp lines (only flagged lines are used), or null
   */
  public void setGasLampLines(LineList lines) {
    gasLampLines = lines;
  }

  @Override
  public boolean hasEnoughData(DataStore dataStore) {
    return dataStore != null && dataStore.combSpectrumIsSet()
        && dataStore.wavelengthImageIsSet();
  }

  @Override
  protected void backend(DataStore dataStore) {
    ObservedSpectrum comb = dataStore.getCombSpectrum();
    dataNames.add("Frequency comb spectrum (" + comb.getNumberOfOrders() + " orders, "
        + comb.getNumberOfColumns() + " columns)");
    dataNames.add("Wavelength image");

    frequencyComb(comb, dataStore.getWavelengthImage());

    fireStateChange("Collecting comb residuals...");
    xySeriesData.add(createPeakResidualPlot());
    xySeriesData.add(createDifferencePlot());
    if (gasLampLines != null) {
      xySeriesData.add(createGasLampResidualPlot());
    }
  }

  /**
   * Refine a wavelength image with a frequency comb spectrum of the same shape
   *
   * @param comb Observed frequency comb spectrum, shape (nord, ncol)
   * @param wave Wavelength image from a previous calibration, same shape
   * @return Refined wavelength image
   */
  public double[][] frequencyComb(ObservedSpectrum comb, double[][] wave) {
    int rows = comb.getNumberOfOrders();
    int columns = comb.getNumberOfColumns();
    if (wave.length != rows) {
      throw new IllegalArgumentException("Wavelength image has " + wave.length
          + " orders, comb spectrum has " + rows);
    }
    for (double[] row : wave) {
      if (row.length != columns) {
        throw new IllegalArgumentException("Wavelength image rows must have " + columns
            + " columns to match the comb spectrum");
      }
    }
    setDetectorShape(rows, columns);
    previousWave = wave;

    double[] pixels = new double[columns];
    for (int j = 0; j < columns; ++j) {
      pixels[j] = j;
    }
    SplineInterpolator interpolator = new SplineInterpolator();

    Map<Integer, double[]> peaksByOrder = new LinkedHashMap<>();
    Map<Integer, int[]> modesByOrder = new LinkedHashMap<>();
    Map<Integer, double[]> freqsByOrder = new LinkedHashMap<>();
    orderAnchors = new LinkedHashMap<>();
    orderSpacings = new LinkedHashMap<>();
    modeOffsets = new LinkedHashMap<>();

    fireStateChange("Finding comb peaks...");
    for (int i = 0; i < rows; ++i) {
      double[] peaks = findPeaks(comb, i);
      if (peaks == null) {
        logger.warn("Fewer than 2 frequency comb peaks in order " + i + ", skipping it");
        continue;
      }
      int[] modes = assignModeNumbers(peaks, config.getMissedPeakFactor(),
          config.getSpuriousPeakFactor());

      PolynomialSplineFunction spline = interpolator.interpolate(pixels, wave[i]);
      double[] freqs = new double[peaks.length];
      SimpleRegression regression = new SimpleRegression();
      for (int k = 0; k < peaks.length; ++k) {
        freqs[k] = NumericUtils.SPEED_OF_LIGHT / spline.value(peaks[k]);
        regression.addData(modes[k], freqs[k]);
      }
      peaksByOrder.put(i, peaks);
      modesByOrder.put(i, modes);
      freqsByOrder.put(i, freqs);
      orderAnchors.put(i, regression.getIntercept());
      orderSpacings.put(i, regression.getSlope());
    }

    if (peaksByOrder.isEmpty()) {
      throw new IllegalArgumentException("No order of the comb spectrum has enough peaks");
    }

    int reference = config.getReferenceOrder();
    if (!orderAnchors.containsKey(reference)) {
      reference = orderAnchors.keySet().iterator().next();
    }
    double f0 = orderAnchors.get(reference);

    // put every order on the mode numbering of the reference order
    SimpleRegression global = new SimpleRegression();
    for (int i : peaksByOrder.keySet()) {
      double fd = orderAnchors.get(i);
      double fr = orderSpacings.get(i);
      int nOffset = (int) Math.round((f0 - fd) / fr);
      int[] modes = modesByOrder.get(i);
      double[] freqs = freqsByOrder.get(i);
      for (int k = 0; k < modes.length; ++k) {
        modes[k] -= nOffset;
        global.addData(modes[k], freqs[k]);
      }
      modeOffsets.put(i, nOffset);
      logger.debug(String.format("LFC Order: %d, f0: %.3f, fr: %.5f, n0: %d",
          i, fd + nOffset * fr, fr, nOffset));
    }

    anchorFrequency = global.getIntercept();
    repetitionFrequency = global.getSlope();
    logger.debug(String.format("Laser Frequency Comb Anchor Frequency: %.3f", anchorFrequency));
    logger.debug(
        String.format("Laser Frequency Comb Repeating Frequency: %.5f", repetitionFrequency));

    lines = new LineList();
    for (int i : peaksByOrder.keySet()) {
      double[] peaks = peaksByOrder.get(i);
      int[] modes = modesByOrder.get(i);
      for (int k = 0; k < peaks.length; ++k) {
        double wavelength =
            NumericUtils.SPEED_OF_LIGHT / (anchorFrequency + modes[k] * repetitionFrequency);
        lines.add(new ReferenceLine(wavelength, peaks[k], i, 1., 1.));
      }
    }

    fireStateChange("Fitting solution to comb peaks...");
    solution = buildSolution(lines);
    double[] residual = calculateResidual(solution, lines);
    for (int k = 0; k < residual.length; ++k) {
      lines.get(k).setFlagged(Math.abs(residual[k]) < config.getThreshold());
    }
    solution = buildSolution(lines);
    waveImage = makeWave(solution);
    score = calculateAIC(lines, solution);

    logger.info("Laser Frequency Comb solution based on " + lines.countFlagged() + " lines.");
    return waveImage;
  }

  /**
   * Detect and center the comb peaks of one order. Peaks must rise above the median of the order
   * and have at least the configured width; a first pass gives the typical peak spacing, and the
   * second pass drops peaks closer than a quarter of it to a higher peak. Each peak is then
   * centered by a Gaussian fit over half the mean spacing on either side (keeping the pixel
   * position if the fit fails).
   *
   * @param comb Comb spectrum
   * @param order Order index
   * @return Peak centers in pixels, ascending, or null if fewer than 2 peaks were found
   */
  double[] findPeaks(ObservedSpectrum comb, int order) {
    int columns = comb.getNumberOfColumns();
    double[] raw = comb.getFilledOrder(order, 0.);
    boolean[] mask = new boolean[columns];
    double min = Double.POSITIVE_INFINITY;
    for (int j = 0; j < columns; ++j) {
      mask[j] = comb.isMasked(order, j) || raw[j] <= 0;
      if (!mask[j]) {
        min = Math.min(min, raw[j]);
      }
    }
    if (Double.isInfinite(min)) {
      return null;
    }
    double[] c = new double[columns];
    for (int j = 0; j < columns; ++j) {
      c[j] = mask[j] ? 0. : raw[j] - min;
    }

    double width = config.getCombPeakWidth();
    double height = NumericUtils.median(c, mask);
    int[] peaks = PeakUtils.findPeaks(c, height, 0, width);
    if (peaks.length < 2) {
      return null;
    }
    int distance = (int) Math.floor(NumericUtils.medianDifference(toDouble(peaks)) / 4);
    peaks = PeakUtils.findPeaks(c, height, distance, width);
    if (peaks.length < 2) {
      return null;
    }

    int half = (int) Math.floor((peaks[peaks.length - 1] - peaks[0])
        / (double) (peaks.length - 1) / 2);
    double[] centers = new double[peaks.length];
    for (int k = 0; k < peaks.length; ++k) {
      centers[k] = peaks[k];
      int low = Math.max(peaks[k] - half, 0);
      int high = Math.min(peaks[k] + half, columns - 1);
      double[] x = new double[high - low + 1];
      double[] y = new double[x.length];
      for (int j = low; j <= high; ++j) {
        x[j - low] = j;
        y[j - low] = c[j];
      }
      try {
        double center = GaussianFit.fitPeak(x, y)[1];
        if (Double.isFinite(center)) {
          centers[k] = center;
        }
      } catch (MathIllegalStateException | IllegalArgumentException e) {
        logger.debug("Could not center comb peak at pixel " + peaks[k] + " of order " + order);
      }
    }
    return centers;
  }

  /**
   * Give consecutive mode numbers to a series of comb peaks, correcting for missed and doubled
   * peaks: after a gap larger than missedFactor times the median spacing all following numbers
   * go up by one, and after a gap smaller than spuriousFactor times the median spacing they go
   * down by one.
   *
   * @param peaks Peak positions, ascending
   * @param missedFactor Relative gap size above which a peak is taken as missed
   * @param spuriousFactor Relative gap size below which a peak is taken as spurious
   * @return Mode number of each peak, starting from 0
   */
  public static int[] assignModeNumbers(double[] peaks, double missedFactor,
      double spuriousFactor) {
    int[] modes = new int[peaks.length];
    for (int k = 0; k < modes.length; ++k) {
      modes[k] = k;
    }
    if (peaks.length < 2) {
      return modes;
    }
    double median = NumericUtils.medianDifference(peaks);
    for (int j = 0; j + 1 < peaks.length; ++j) {
      double diff = peaks[j + 1] - peaks[j];
      int change = 0;
      if (diff > missedFactor * median) {
        change = 1;
      } else if (diff < spuriousFactor * median) {
        change = -1;
      }
      for (int k = j + 1; k < modes.length && change != 0; ++k) {
        modes[k] += change;
      }
    }
    return modes;
  }

  private static double[] toDouble(int[] values) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; ++i) {
      out[i] = values[i];
    }
    return out;
  }

  private XYSeriesCollection createPeakResidualPlot() {
    Map<Integer, XYSeries> perOrder = new LinkedHashMap<>();
    double[] residual = calculateResidual(solution, lines);
    for (int k = 0; k < residual.length; ++k) {
      ReferenceLine line = lines.get(k);
      if (Double.isNaN(residual[k])) {
        continue;
      }
      int order = line.getOrder();
      if (!perOrder.containsKey(order)) {
        perOrder.put(order, new XYSeries("Comb peaks, order " + order));
      }
      perOrder.get(order).add(line.getPosition(), residual[k]);
    }
    XYSeriesCollection xysc = new XYSeriesCollection();
    for (XYSeries series : perOrder.values()) {
      xysc.addSeries(series);
    }
    return xysc;
  }

  private XYSeriesCollection createDifferencePlot() {
    XYSeriesCollection xysc = new XYSeriesCollection();
    for (int i = 0; i < nord; ++i) {
      XYSeries series = new XYSeries("Gas lamp - comb, order " + i);
      for (int j = 0; j < ncol; ++j) {
        series.add(j, previousWave[i][j] - waveImage[i][j]);
      }
      xysc.addSeries(series);
    }
    return xysc;
  }

  private XYSeriesCollection createGasLampResidualPlot() {
    XYSeries series = new XYSeries("Gas lamp lines in comb solution");
    for (ReferenceLine line : gasLampLines) {
      if (!line.isFlagged() || line.getOrder() < 0 || line.getOrder() >= nord) {
        continue;
      }
      double predicted = solution.evaluate(line.getPosition(), line.getOrder());
      series.add(line.getOrder(), NumericUtils.velocityResidual(predicted, line.getWavelength()));
    }
    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(series);
    return xysc;
  }

  /**
   * Residuals, in m/s, of gas lamp lines in the comb solution of the last run
   *
   * @param gasLamp Gas lamp lines
   * @return Residual of each line (NaN for unflagged lines)
   */
  public double[] getGasLampResiduals(LineList gasLamp) {
    return calculateResidual(solution, gasLamp);
  }

  @Override
  public CalResult getResult() {
    return CalResult.buildFrequencyCombData(
        score, anchorFrequency, repetitionFrequency, waveImage, solution, lines);
  }

  /**
   * @return Global anchor frequency f0 (same units as speed of light / wavelength)
   */
  public double getAnchorFrequency() {
    return anchorFrequency;
  }

  /**
   * @return Global mode spacing fr
   */
  public double getRepetitionFrequency() {
    return repetitionFrequency;
  }

  /**
   * @return Anchor frequency of each order from its own mode numbering, before correction
   */
  public Map<Integer, Double> getOrderAnchors() {
    return Collections.unmodifiableMap(orderAnchors);
  }

  /**
   * @return Anchor frequency of each order after its mode numbers were shifted onto the
   * reference order's numbering
   */
  public Map<Integer, Double> getCorrectedOrderAnchors() {
    Map<Integer, Double> corrected = new LinkedHashMap<>();
    for (int i : orderAnchors.keySet()) {
      corrected.put(i, orderAnchors.get(i) + modeOffsets.get(i) * orderSpacings.get(i));
    }
    return corrected;
  }

  /**
   * @return Mode spacing fitted in each order
   */
  public Map<Integer, Double> getOrderSpacings() {
    return Collections.unmodifiableMap(orderSpacings);
  }

  /**
   * @return Shift applied to each order's mode numbers
   */
  public Map<Integer, Integer> getModeOffsets() {
    return Collections.unmodifiableMap(modeOffsets);
  }

  /**
   * @return Orders in which comb peaks were found in the last run
   */
  public List<Integer> getCalibratedOrders() {
    return new ArrayList<>(orderAnchors.keySet());
  }
}
