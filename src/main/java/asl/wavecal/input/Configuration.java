package asl.wavecal.input;

import asl.wavecal.solution.SolutionMode;
import java.io.File;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Parameters of a calibration run: solution shape and degrees, refinement threshold and
 * iteration count, alignment options, line fitting windows and frequency comb peak detection
 * settings. Defaults are read from the XML file embedded in the jar and can be overridden by an
 * external XML file with the same layout; a file that cannot be read leaves the defaults in place.
 *
 * Experiments read the configuration once at the start of a run and treat it as read-only.
 */
public class Configuration {

  public static final String DEFAULT_CONFIG_PATH = "wavecal-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private SolutionMode mode = SolutionMode.TWO_D;
  private int degreeX = 6;
  private int degreeY = 6;
  private int steps = 0;

  private double threshold = 100.; // m/s
  private int iterations = 3;

  private boolean manualAlignment = false;
  private int orderOffset = 0;
  private int pixelOffset = 0;
  private double shiftWindow = 0.01;

  private double fitWindowWidths = 5.;
  private double searchWindowWidths = 10.;

  private double combPeakWidth = 3.;
  private double missedPeakFactor = 1.5;
  private double spuriousPeakFactor = 0.5;
  private int referenceOrder = 0;

  /**
   * Create a configuration from the embedded defaults
   */
  public Configuration() {
    URL embedded = Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
    if (embedded == null) {
      logger.error("Config XML file not part of resources, using built-in values");
      return;
    }
    try {
      load(new XMLConfiguration(embedded));
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading embedded XML file, using built-in values", e);
    }
  }

  /**
   * Create a configuration from the embedded defaults, overridden by the values in a file
   *
   * @param configLocation Path of an XML configuration file
   */
  public Configuration(String configLocation) {
    this();
    logger.info("Attempting reading in config file from " + configLocation);
    File file = new File(configLocation);
    if (!file.exists()) {
      logger.warn("Could not find specified config location: " + configLocation
          + ", using defaults");
      return;
    }
    try {
      XMLConfiguration config = new XMLConfiguration(file);
      load(config);
      loadedConfigPath = file.getAbsolutePath();
      logger.info("Successfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Copy constructor
   *
   * @param other Configuration to copy all values from
   */
  public Configuration(Configuration other) {
    loadedConfigPath = other.loadedConfigPath;
    mode = other.mode;
    degreeX = other.degreeX;
    degreeY = other.degreeY;
    steps = other.steps;
    threshold = other.threshold;
    iterations = other.iterations;
    manualAlignment = other.manualAlignment;
    orderOffset = other.orderOffset;
    pixelOffset = other.pixelOffset;
    shiftWindow = other.shiftWindow;
    fitWindowWidths = other.fitWindowWidths;
    searchWindowWidths = other.searchWindowWidths;
    combPeakWidth = other.combPeakWidth;
    missedPeakFactor = other.missedPeakFactor;
    spuriousPeakFactor = other.spuriousPeakFactor;
    referenceOrder = other.referenceOrder;
  }

  private void load(XMLConfiguration config) {
    String modeParam = config.getString("Fit.Mode");
    if (modeParam != null) {
      setMode(SolutionMode.fromString(modeParam.trim()));
    }
    setDegreeX(config.getInt("Fit.DegreeX", degreeX));
    setDegreeY(config.getInt("Fit.DegreeY", degreeY));
    setSteps(config.getInt("Fit.Steps", steps));

    setThreshold(config.getDouble("Refinement.Threshold", threshold));
    setIterations(config.getInt("Refinement.Iterations", iterations));

    manualAlignment = config.getBoolean("Alignment.Manual", manualAlignment);
    orderOffset = config.getInt("Alignment.OrderOffset", orderOffset);
    pixelOffset = config.getInt("Alignment.PixelOffset", pixelOffset);
    setShiftWindow(config.getDouble("Alignment.ShiftWindow", shiftWindow));

    setFitWindowWidths(config.getDouble("LineFitting.WindowWidths", fitWindowWidths));
    setSearchWindowWidths(config.getDouble("LineFitting.SearchWidths", searchWindowWidths));

    combPeakWidth = config.getDouble("FrequencyComb.PeakWidth", combPeakWidth);
    missedPeakFactor = config.getDouble("FrequencyComb.MissedPeakFactor", missedPeakFactor);
    spuriousPeakFactor =
        config.getDouble("FrequencyComb.SpuriousPeakFactor", spuriousPeakFactor);
    referenceOrder = config.getInt("FrequencyComb.ReferenceOrder", referenceOrder);
  }

  /**
   * @return Path of the external file values were loaded from, or the embedded resource name
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Fit.Mode: whether the solution is one polynomial per order (1D) or one surface (2D)
   *
   * @return Solution mode
   */
  public SolutionMode getMode() {
    return mode;
  }

  public void setMode(SolutionMode mode) {
    this.mode = mode;
  }

  /**
   * Fit.DegreeX: polynomial degree along the pixel direction (the only degree used in 1D mode)
   *
   * @return Degree in pixel direction
   */
  public int getDegreeX() {
    return degreeX;
  }

  public void setDegreeX(int degreeX) {
    if (degreeX < 0) {
      throw new IllegalArgumentException("Polynomial degree must not be negative: " + degreeX);
    }
    this.degreeX = degreeX;
  }

  /**
   * Fit.DegreeY: polynomial degree along the order direction (2D mode only)
   *
   * @return Degree in order direction
   */
  public int getDegreeY() {
    return degreeY;
  }

  public void setDegreeY(int degreeY) {
    if (degreeY < 0) {
      throw new IllegalArgumentException("Polynomial degree must not be negative: " + degreeY);
    }
    this.degreeY = degreeY;
  }

  /**
   * Fit.Steps: number of step knots per order, 0 for a solution without steps
   *
   * @return Number of steps
   */
  public int getSteps() {
    return steps;
  }

  public void setSteps(int steps) {
    if (steps < 0) {
      throw new IllegalArgumentException("Number of steps must not be negative: " + steps);
    }
    this.steps = steps;
  }

  /**
   * Refinement.Threshold: largest residual, in m/s, for a line to stay in (or be added to) the fit
   *
   * @return Residual threshold
   */
  public double getThreshold() {
    return threshold;
  }

  public void setThreshold(double threshold) {
    if (!(threshold > 0)) {
      throw new IllegalArgumentException("Residual threshold must be positive: " + threshold);
    }
    this.threshold = threshold;
  }

  /**
   * Refinement.Iterations: number of identification and rejection passes. This is a fixed count;
   * the loop does not stop early when the line set stops changing.
   *
   * @return Number of iterations
   */
  public int getIterations() {
    return iterations;
  }

  public void setIterations(int iterations) {
    if (iterations < 0) {
      throw new IllegalArgumentException("Iteration count must not be negative: " + iterations);
    }
    this.iterations = iterations;
  }

  public boolean isManualAlignment() {
    return manualAlignment;
  }

  public void setManualAlignment(boolean manualAlignment) {
    this.manualAlignment = manualAlignment;
  }

  public int getOrderOffset() {
    return orderOffset;
  }

  public void setOrderOffset(int orderOffset) {
    this.orderOffset = orderOffset;
  }

  public int getPixelOffset() {
    return pixelOffset;
  }

  public void setPixelOffset(int pixelOffset) {
    this.pixelOffset = pixelOffset;
  }

  /**
   * Alignment.ShiftWindow: fraction of the detector width searched when aligning single orders;
   * 0 turns the per-order alignment off
   *
   * @return Shift window fraction
   */
  public double getShiftWindow() {
    return shiftWindow;
  }

  public void setShiftWindow(double shiftWindow) {
    if (shiftWindow < 0 || shiftWindow > 1) {
      throw new IllegalArgumentException("Shift window must be between 0 and 1: " + shiftWindow);
    }
    this.shiftWindow = shiftWindow;
  }

  public double getFitWindowWidths() {
    return fitWindowWidths;
  }

  public void setFitWindowWidths(double fitWindowWidths) {
    if (!(fitWindowWidths > 0)) {
      throw new IllegalArgumentException("Fit window must be positive: " + fitWindowWidths);
    }
    this.fitWindowWidths = fitWindowWidths;
  }

  public double getSearchWindowWidths() {
    return searchWindowWidths;
  }

  public void setSearchWindowWidths(double searchWindowWidths) {
    if (!(searchWindowWidths > 0)) {
      throw new IllegalArgumentException("Search window must be positive: " + searchWindowWidths);
    }
    this.searchWindowWidths = searchWindowWidths;
  }

  /**
   * FrequencyComb.PeakWidth: smallest width (pixels, at half prominence) of an accepted comb
   * peak; 0 or less disables the width test
   *
   * @return Minimum comb peak width
   */
  public double getCombPeakWidth() {
    return combPeakWidth;
  }

  public void setCombPeakWidth(double combPeakWidth) {
    this.combPeakWidth = combPeakWidth;
  }

  public double getMissedPeakFactor() {
    return missedPeakFactor;
  }

  public void setMissedPeakFactor(double missedPeakFactor) {
    this.missedPeakFactor = missedPeakFactor;
  }

  public double getSpuriousPeakFactor() {
    return spuriousPeakFactor;
  }

  public void setSpuriousPeakFactor(double spuriousPeakFactor) {
    this.spuriousPeakFactor = spuriousPeakFactor;
  }

  /**
   * FrequencyComb.ReferenceOrder: order whose anchor frequency fixes the absolute mode numbers of
   * all orders (if that order has no comb peaks, the first order with peaks is used)
   *
   * @return Reference order index
   */
  public int getReferenceOrder() {
    return referenceOrder;
  }

  public void setReferenceOrder(int referenceOrder) {
    this.referenceOrder = referenceOrder;
  }
}
