package asl.wavecal.solution;

/**
 * Thrown when a wavelength solution is requested with no more usable lines than the model has
 * free polynomial coefficients. This points at a configuration problem (degree too high for the
 * line list) rather than noisy data, so it is not recovered from inside a calibration run.
 */
public class InsufficientLinesException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Order value used when the shortfall is for the whole (2D) solution rather than one order
   */
  public static final int ALL_ORDERS = -1;

  private final int order;
  private final int required;
  private final int available;

  /**
   * @param order Order lacking lines, or {@link #ALL_ORDERS}
   * @param required Number of lines the model needs
   * @param available Number of flagged lines that were given
   */
  public InsufficientLinesException(int order, int required, int available) {
    super(buildMessage(order, required, available));
    this.order = order;
    this.required = required;
    this.available = available;
  }

  private static String buildMessage(int order, int required, int available) {
    String where = order == ALL_ORDERS ? "the 2D solution" : "order " + order;
    return "Not enough data points for " + where + ": need at least " + required
        + " flagged lines, got " + available;
  }

  public int getOrder() {
    return order;
  }

  public int getRequired() {
    return required;
  }

  public int getAvailable() {
    return available;
  }
}
