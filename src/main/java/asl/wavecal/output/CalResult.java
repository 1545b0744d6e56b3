package asl.wavecal.output;

import asl.wavecal.input.LineList;
import asl.wavecal.solution.WavelengthSolution;
import java.util.HashMap;
import java.util.Map;

/**
 * Result of a calibration in a form that is easy for callers to consume: a map from string
 * descriptors to the scalar results (stored as double arrays, matching the other results), plus
 * the wavelength image, the solution it was made from, and the final line list.
 */
public class CalResult {

  /**
   * Get data from a wavelength calibration result
   *
   * @param score Model score of the final solution
   * @param wavelengthImage Wavelength of every (order, column)
   * @param solution Final solution
   * @param lines Final line list, with flags set for the lines used
   * @return object holding these values in easily-accessed maps with variable descriptions
   */
  public static CalResult buildWavecalData(ModelScore score, double[][] wavelengthImage,
      WavelengthSolution solution, LineList lines) {
    CalResult out = new CalResult(wavelengthImage, solution, lines);
    out.putScore(score);
    out.numerMap.put("Lines_used", new double[]{lines.countFlagged()});
    out.numerMap.put("Lines_total", new double[]{lines.size()});
    return out;
  }

  /**
   * Get data from a frequency comb calibration result
   *
   * @param score Model score of the comb solution
   * @param anchorFrequency Fitted anchor frequency f0
   * @param repetitionFrequency Fitted mode spacing fr
   * @param wavelengthImage Refined wavelength of every (order, column)
   * @param solution Comb solution
   * @param lines Comb line list (one line per detected peak)
   * @return object holding these values in easily-accessed maps with variable descriptions
   */
  public static CalResult buildFrequencyCombData(ModelScore score, double anchorFrequency,
      double repetitionFrequency, double[][] wavelengthImage, WavelengthSolution solution,
      LineList lines) {
    CalResult out = buildWavecalData(score, wavelengthImage, solution, lines);
    out.numerMap.put("Anchor_frequency", new double[]{anchorFrequency});
    out.numerMap.put("Repetition_frequency", new double[]{repetitionFrequency});
    return out;
  }

  private final Map<String, double[]> numerMap;
  private final double[][] wavelengthImage;
  private final WavelengthSolution solution;
  private final LineList lines;

  private CalResult(double[][] wavelengthImage, WavelengthSolution solution, LineList lines) {
    numerMap = new HashMap<>();
    this.wavelengthImage = wavelengthImage;
    this.solution = solution;
    this.lines = lines;
  }

  private void putScore(ModelScore score) {
    numerMap.put("AIC", new double[]{score.getAIC()});
    numerMap.put("AICc", new double[]{score.getAICc()});
    numerMap.put("Log_likelihood", new double[]{score.getLogLikelihood()});
  }

  /**
   * Return the map of numeric data
   * @return map of double arrays representing calculation results, keyed by strings with
   * descriptions of the given numbers (i.e., AIC, number of lines used)
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }

  public double[][] getWavelengthImage() {
    return wavelengthImage;
  }

  public WavelengthSolution getSolution() {
    return solution;
  }

  public LineList getLines() {
    return lines;
  }
}
