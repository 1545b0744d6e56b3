package asl.wavecal.experiment;

import asl.wavecal.align.AlignmentOffset;
import asl.wavecal.align.AlignmentStrategy;
import asl.wavecal.align.CorrelationAlignment;
import asl.wavecal.align.FixedOffsetAlignment;
import asl.wavecal.input.Configuration;
import asl.wavecal.input.DataStore;
import asl.wavecal.input.LineList;
import asl.wavecal.input.ObservedSpectrum;
import asl.wavecal.input.ReferenceLine;
import asl.wavecal.output.CalResult;
import asl.wavecal.solution.WavelengthSolution;
import asl.wavecal.utils.GaussianFit;
import asl.wavecal.utils.NumericUtils;
import asl.wavecal.utils.PeakUtils;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Wavelength calibration of an echelle spectrum from a line lamp (arc) exposure and a catalogue
 * of reference lines.
 * <p>
 * The observed spectrum is normalized order by order, and the catalogue is shifted onto it using
 * an alignment strategy (cross-correlation by default, or a fixed offset). Each catalogue line is
 * then located on the detector by fitting a Gaussian around its expected position. After that a
 * fixed number of refinement passes follows, each of which builds a solution from the lines in
 * use, identifies further catalogue lines that match peaks of the spectrum under that solution,
 * and discards the worst outliers one at a time until every line in use is within the residual
 * threshold. A final solution, its wavelength image and its AIC are kept.
 * <p>
 * Line fit failures are not errors: the line is simply left out of the solution. Too few lines
 * for the configured polynomial raises
 * {@link asl.wavecal.solution.InsufficientLinesException}.
 * <p>
 * Diagnostic data (getData) holds the residuals of accepted and rejected lines against order,
 * and the residuals of accepted lines against pixel position, one series per order.
 */
public class WavelengthCalibrationExperiment extends CalibrationExperiment {

  private static final Logger logger = Logger.getLogger(WavelengthCalibrationExperiment.class);

  private AlignmentStrategy alignmentStrategy;
  private AlignmentOffset offset;
  private ObservedSpectrum normalized;

  public WavelengthCalibrationExperiment() {
    this(new Configuration());
  }

  public WavelengthCalibrationExperiment(Configuration config) {
    super(config);
    alignmentStrategy = null;
  }

  /**
   * Use a specific alignment strategy instead of the one chosen by the configuration
   * (correlation, or the configured fixed offset in manual mode)
   *
   * @param strategy Alignment strategy, or null to go back to the configured one
   */
  public void setAlignmentStrategy(AlignmentStrategy strategy) {
    alignmentStrategy = strategy;
  }

  AlignmentStrategy getEffectiveAlignmentStrategy() {
    if (alignmentStrategy != null) {
      return alignmentStrategy;
    }
    if (config.isManualAlignment()) {
      return new FixedOffsetAlignment(config.getOrderOffset(), config.getPixelOffset());
    }
    return new CorrelationAlignment(config.getShiftWindow());
  }

  @Override
  public boolean hasEnoughData(DataStore dataStore) {
    return dataStore != null && dataStore.arcSpectrumIsSet()
        && dataStore.referenceLinesAreSet();
  }

  @Override
  protected void backend(DataStore dataStore) {
    ObservedSpectrum arc = dataStore.getArcSpectrum();
    LineList catalogue = dataStore.getReferenceLines();
    dataNames.add("Arc spectrum (" + arc.getNumberOfOrders() + " orders, "
        + arc.getNumberOfColumns() + " columns)");
    dataNames.add("Reference lines (" + catalogue.size() + ")");

    execute(arc, catalogue);

    fireStateChange("Collecting line residuals...");
    xySeriesData.addAll(createResidualPlots());
  }

  /**
   * Run the whole calibration. The catalogue given is not changed; the lines of the run, with
   * their final positions and flags, are available from {@link #getLines()} afterwards.
   *
   * @param observed Observed line lamp spectrum, shape (nord, ncol)
   * @param catalogue Reference line catalogue
   * @return Wavelength image of shape (nord, ncol)
   */
  public double[][] execute(ObservedSpectrum observed, LineList catalogue) {
    setDetectorShape(observed.getNumberOfOrders(), observed.getNumberOfColumns());
    lines = catalogue.copy();

    fireStateChange("Normalizing spectrum and reference lines...");
    normalized = normalize(observed, lines);

    fireStateChange("Aligning reference lines with the observation...");
    offset = getEffectiveAlignmentStrategy().align(normalized, lines);
    logger.debug(offset);
    lines.applyOffset(offset);

    lines.resetOriginalPositions();
    lines.setAllFlags(true);

    fireStateChange("Fitting line positions...");
    fitLines(normalized, lines);

    for (int i = 0; i < config.getIterations(); ++i) {
      fireStateChange("Refinement iteration " + (i + 1) + " of " + config.getIterations());
      logger.info("Wavelength calibration iteration: " + i);
      WavelengthSolution current = buildSolution(lines);
      double[][] wave = makeWave(current);
      autoId(normalized, wave, lines);
      rejectLines(lines);
    }

    logger.info("Number of lines used for wavelength calibration: " + lines.countFlagged());

    fireStateChange("Building final solution...");
    solution = buildSolution(lines);
    waveImage = makeWave(solution);
    score = calculateAIC(lines, solution);
    return waveImage;
  }

  /**
   * Normalize an observed spectrum, and scale the heights of the given lines so the strongest
   * line of each order has height 1 (the lines are changed in place)
   *
   * @param observed Observed spectrum
   * @param lines Lines to rescale
   * @return Normalized copy of the spectrum
   */
  public static ObservedSpectrum normalize(ObservedSpectrum observed, LineList lines) {
    lines.normalizeHeights();
    return observed.normalize();
  }

  /**
   * Locate each flagged line on the detector: fit a Gaussian to the observed data within the
   * configured number of line widths around the expected position and move the line to the
   * fitted center. Lines outside the detector, or whose fit fails, are unflagged.
   *
   * @param observed Normalized observed spectrum
   * @param lines Lines to locate (changed in place)
   */
  public void fitLines(ObservedSpectrum observed, LineList lines) {
    int rows = observed.getNumberOfOrders();
    int columns = observed.getNumberOfColumns();
    int failed = 0;
    for (ReferenceLine line : lines) {
      if (!line.isFlagged()) {
        continue;
      }
      double posm = line.getPosition();
      int order = line.getOrder();
      if (posm < 0 || posm >= columns || order < 0 || order >= rows) {
        line.setFlagged(false);
        continue;
      }
      double half = line.getWidth() * config.getFitWindowWidths();
      int low = Math.max((int) (posm - half), 0);
      int high = Math.min((int) (posm + half), columns);

      double[] x = new double[Math.max(high - low, 0)];
      double[] y = new double[x.length];
      int count = 0;
      for (int j = low; j < high; ++j) {
        if (!observed.isMasked(order, j)) {
          x[count] = j;
          y[count] = observed.get(order, j);
          ++count;
        }
      }

      try {
        double[] params =
            GaussianFit.fitLine(Arrays.copyOf(x, count), Arrays.copyOf(y, count));
        if (Double.isFinite(params[1])) {
          line.setPosition(params[1]);
        } else {
          line.setFlagged(false);
          ++failed;
        }
      } catch (MathIllegalStateException | IllegalArgumentException e) {
        line.setFlagged(false);
        ++failed;
      }
    }
    logger.debug("Gaussian fit failed for " + failed + " lines");
  }

  /**
   * Identify unflagged catalogue lines in the observation using the current solution. For each
   * unflagged line whose wavelength lies within its order's wavelength range, peaks of the
   * observed spectrum (above the median of the search window) are searched within the configured
   * number of line widths of the predicted position. If the best peak's residual is below the
   * threshold, the line is flagged and moved to that peak.
   *
   * @param observed Normalized observed spectrum
   * @param wave Wavelength image of the current solution
   * @param lines Lines (changed in place)
   * @return Number of newly identified lines
   */
  public int autoId(ObservedSpectrum observed, double[][] wave, LineList lines) {
    int rows = observed.getNumberOfOrders();
    int columns = observed.getNumberOfColumns();
    int counter = 0;
    for (ReferenceLine line : lines) {
      if (line.isFlagged()) {
        continue;
      }
      int order = line.getOrder();
      if (order < 0 || order >= rows) {
        continue;
      }
      double[] row = wave[order];
      double wl = line.getWavelength();
      if (wl < row[0] || wl >= row[row.length - 1]) {
        continue;
      }

      int idx = NumericUtils.digitize(row, wl);
      double width = line.getWidth() * config.getSearchWindowWidths();
      int low = Math.max((int) (idx - width), 0);
      int high = Math.min((int) (idx + width), columns);
      if (high <= low) {
        continue;
      }

      double[] vec = Arrays.copyOfRange(observed.getFilledOrder(order, 0.), low, high);
      boolean[] mask = new boolean[vec.length];
      boolean allMasked = true;
      for (int j = 0; j < vec.length; ++j) {
        mask[j] = observed.isMasked(order, low + j);
        allMasked &= mask[j];
      }
      if (allMasked) {
        continue;
      }

      int[] peaks = PeakUtils.findPeaks(vec, NumericUtils.median(vec, mask));
      int best = -1;
      double bestResidual = Double.POSITIVE_INFINITY;
      for (int p = 0; p < peaks.length; ++p) {
        double residual = Math.abs(wl - row[low + peaks[p]]) / wl * NumericUtils.SPEED_OF_LIGHT;
        if (residual < bestResidual) {
          bestResidual = residual;
          best = p;
        }
      }
      if (best >= 0 && bestResidual < config.getThreshold()) {
        line.setFlagged(true);
        line.setPosition(low + peaks[best]);
        ++counter;
      }
    }
    logger.info("AutoID identified " + counter + " new lines");
    return counter;
  }

  /**
   * Unflag the line with the largest absolute residual
   *
   * @param residual Residual of each line (NaN for unflagged lines)
   * @param lines Lines (changed in place)
   * @return Index of the unflagged line, or -1 if no line had a residual
   */
  public static int rejectOutlier(double[] residual, LineList lines) {
    int worst = -1;
    for (int i = 0; i < residual.length; ++i) {
      if (Double.isNaN(residual[i])) {
        continue;
      }
      if (worst < 0 || Math.abs(residual[i]) > Math.abs(residual[worst])) {
        worst = i;
      }
    }
    if (worst >= 0) {
      lines.get(worst).setFlagged(false);
    }
    return worst;
  }

  /**
   * Discard outliers one at a time: build a solution, and while any flagged line's residual is
   * above the threshold, unflag the worst line and rebuild. Every pass removes one line, so this
   * ends after at most as many passes as there are flagged lines (or when the builder runs out of
   * lines).
   *
   * @param lines Lines (changed in place)
   * @return Number of discarded lines
   */
  public int rejectLines(LineList lines) {
    WavelengthSolution current = buildSolution(lines);
    double[] residual = calculateResidual(current, lines);
    int nbad = 0;
    while (exceedsThreshold(residual)) {
      rejectOutlier(residual, lines);
      current = buildSolution(lines);
      residual = calculateResidual(current, lines);
      ++nbad;
    }
    logger.info("Discarding " + nbad + " lines");
    solution = current;
    return nbad;
  }

  private boolean exceedsThreshold(double[] residual) {
    for (double value : residual) {
      if (Math.abs(value) > config.getThreshold()) {
        return true;
      }
    }
    return false;
  }

  private List<XYSeriesCollection> createResidualPlots() {
    XYSeries accepted = new XYSeries("Accepted lines");
    XYSeries rejected = new XYSeries("Rejected lines");
    Map<Integer, XYSeries> perOrder = new LinkedHashMap<>();
    for (ReferenceLine line : lines) {
      int order = line.getOrder();
      if (order < 0 || order >= nord) {
        continue;
      }
      double predicted = solution.evaluate(line.getPosition(), order);
      double residual = NumericUtils.velocityResidual(predicted, line.getWavelength());
      if (line.isFlagged()) {
        accepted.add(order, residual);
        if (!perOrder.containsKey(order)) {
          perOrder.put(order, new XYSeries("Order " + order));
        }
        perOrder.get(order).add(line.getPosition(), residual);
      } else {
        rejected.add(order, residual);
      }
    }
    XYSeriesCollection byOrder = new XYSeriesCollection();
    byOrder.addSeries(accepted);
    byOrder.addSeries(rejected);
    XYSeriesCollection byPixel = new XYSeriesCollection();
    for (XYSeries series : perOrder.values()) {
      byPixel.addSeries(series);
    }
    return Arrays.asList(byOrder, byPixel);
  }

  @Override
  public CalResult getResult() {
    return CalResult.buildWavecalData(score, waveImage, solution, lines);
  }

  /**
   * @return Offset the reference lines were shifted by in the last run
   */
  public AlignmentOffset getAlignmentOffset() {
    return offset;
  }

  /**
   * @return Normalized observation used in the last run
   */
  public ObservedSpectrum getNormalizedSpectrum() {
    return normalized;
  }
}
