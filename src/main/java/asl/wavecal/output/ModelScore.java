package asl.wavecal.output;

/**
 * Goodness of fit of a wavelength solution, penalized by model complexity. The residuals are
 * taken as Gaussian with unknown variance, giving
 * log L = -n/2 * (1 + ln(2 pi) + ln(RSS / n)), AIC = 2k - 2 log L and the small-sample
 * AICc = AIC + (2k^2 + 2k) / (n - k - 1), where k counts the model parameters plus one for the
 * noise level. AICc is infinite when n - k - 1 is not positive.
 */
public class ModelScore {

  private final int points;
  private final int parameters;
  private final double rss;
  private final double logLikelihood;
  private final double aic;
  private final double aicc;

  private ModelScore(int points, int parameters, double rss) {
    this.points = points;
    this.parameters = parameters;
    this.rss = rss;
    double n = points;
    double k = parameters;
    logLikelihood = -n / 2. * (1 + Math.log(2 * Math.PI) + Math.log(rss / n));
    aic = 2 * k - 2 * logLikelihood;
    double denominator = n - k - 1;
    if (denominator > 0) {
      aicc = aic + (2 * k * k + 2 * k) / denominator;
    } else {
      aicc = Double.POSITIVE_INFINITY;
    }
  }

  /**
   * Score a model's predictions against the observed values
   *
   * @param predicted Model values
   * @param observed Observed values, same length
   * @param modelParameters Number of free model parameters (the noise term is added to this)
   * @return Score
   */
  public static ModelScore calculate(double[] predicted, double[] observed,
      int modelParameters) {
    if (predicted.length != observed.length) {
      throw new IllegalArgumentException("Predicted and observed values must match in length");
    }
    double rss = 0.;
    for (int i = 0; i < predicted.length; ++i) {
      double diff = predicted[i] - observed[i];
      rss += diff * diff;
    }
    return new ModelScore(predicted.length, modelParameters + 1, rss);
  }

  public double getLogLikelihood() {
    return logLikelihood;
  }

  public double getAIC() {
    return aic;
  }

  public double getAICc() {
    return aicc;
  }

  /**
   * @return Number of data points scored
   */
  public int getPoints() {
    return points;
  }

  /**
   * @return Number of parameters, including the noise term
   */
  public int getParameters() {
    return parameters;
  }

  public double getResidualSumOfSquares() {
    return rss;
  }

  @Override
  public String toString() {
    return "AIC: " + aic + ", AICc: " + aicc + ", log-likelihood: " + logLikelihood
        + " (" + points + " points, " + parameters + " parameters)";
  }
}
