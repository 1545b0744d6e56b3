package asl.wavecal.experiment;

import asl.wavecal.input.Configuration;
import asl.wavecal.input.LineList;
import asl.wavecal.input.ReferenceLine;
import asl.wavecal.output.CalResult;
import asl.wavecal.output.ModelScore;
import asl.wavecal.solution.SolutionBuilder;
import asl.wavecal.solution.WavelengthSolution;
import asl.wavecal.utils.NumericUtils;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared parts of the calibration experiments: building a wavelength solution in the configured
 * mode, evaluating it over the detector, measuring line residuals in velocity units and scoring
 * the final model. Subclasses set the detector shape (via {@link #setDetectorShape(int, int)})
 * before building anything.
 */
public abstract class CalibrationExperiment extends Experiment {

  final Configuration config;
  int nord;
  int ncol;
  SolutionBuilder builder;

  LineList lines;
  WavelengthSolution solution;
  double[][] waveImage;
  ModelScore score;

  /**
   * @param config Run parameters; a copy is kept, so later changes by the caller do not affect
   * this experiment
   */
  CalibrationExperiment(Configuration config) {
    super();
    this.config = new Configuration(config);
  }

  /**
   * Set the detector shape and create the solution builder for it
   *
   * @param nord Number of orders
   * @param ncol Number of columns
   */
  void setDetectorShape(int nord, int ncol) {
    this.nord = nord;
    this.ncol = ncol;
    builder = config.getMode().createBuilder(
        config.getDegreeX(), config.getDegreeY(), config.getSteps(), nord, ncol);
  }

  /**
   * Fit a wavelength solution to the flagged lines
   *
   * @param lines Line list (only flagged lines are used)
   * @return Fitted solution
   */
  public WavelengthSolution buildSolution(LineList lines) {
    return builder.build(lines);
  }

  /**
   * Residual of every line against a solution, as a velocity: (solution - catalogue) / catalogue
   * times the speed of light, evaluated at the line's fitted position. Lines that are not flagged
   * get NaN.
   *
   * @param solution Wavelength solution
   * @param lines Lines to get residuals for
   * @return Residuals in m/s, one per line in list order
   */
  public static double[] calculateResidual(WavelengthSolution solution, LineList lines) {
    double[] residual = new double[lines.size()];
    for (int i = 0; i < residual.length; ++i) {
      ReferenceLine line = lines.get(i);
      if (!line.isFlagged()) {
        residual[i] = Double.NaN;
        continue;
      }
      double predicted = solution.evaluate(line.getPosition(), line.getOrder());
      residual[i] = NumericUtils.velocityResidual(predicted, line.getWavelength());
    }
    return residual;
  }

  /**
   * Evaluate a solution over the whole detector
   *
   * @param solution Wavelength solution
   * @return Wavelength image of shape (nord, ncol)
   */
  public double[][] makeWave(WavelengthSolution solution) {
    return solution.makeWave(nord, ncol);
  }

  /**
   * Score a solution against the flagged lines it was fit to, at their fitted positions
   *
   * @param lines Line list
   * @param solution Solution fit to the flagged lines
   * @return AIC, AICc and log-likelihood of the fit
   */
  public static ModelScore calculateAIC(LineList lines, WavelengthSolution solution) {
    List<ReferenceLine> flagged = lines.getFlagged();
    double[] predicted = new double[flagged.size()];
    double[] observed = new double[flagged.size()];
    for (int i = 0; i < predicted.length; ++i) {
      ReferenceLine line = flagged.get(i);
      predicted[i] = solution.evaluate(line.getPosition(), line.getOrder());
      observed[i] = line.getWavelength();
    }
    return ModelScore.calculate(predicted, observed, solution.getParameterCount());
  }

  /**
   * @return Result maps of the last run
   */
  public abstract CalResult getResult();

  @Override
  String[] getDataStrings() {
    List<String> strings = new ArrayList<>();
    DecimalFormat format = DECIMAL_FORMAT.get();
    strings.add("Solution mode: " + config.getMode() + (config.getSteps() > 0 ?
        " with " + config.getSteps() + " steps per order" : ""));
    if (lines != null) {
      strings.add("Lines used: " + lines.countFlagged() + " of " + lines.size());
    }
    if (score != null) {
      strings.add("AIC: " + format.format(score.getAIC()));
      strings.add("AICc: " + format.format(score.getAICc()));
      strings.add("Log-likelihood: " + format.format(score.getLogLikelihood()));
    }
    return strings.toArray(new String[0]);
  }

  public Configuration getConfiguration() {
    return new Configuration(config);
  }

  /**
   * @return Line list of the last run, with final positions and flags
   */
  public LineList getLines() {
    return lines;
  }

  public WavelengthSolution getSolution() {
    return solution;
  }

  public double[][] getWavelengthImage() {
    return waveImage;
  }

  public ModelScore getScore() {
    return score;
  }

  public int getNumberOfOrders() {
    return nord;
  }

  public int getNumberOfColumns() {
    return ncol;
  }
}
