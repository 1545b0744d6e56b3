package asl.wavecal.input;

/**
 * A single entry of a reference line catalogue. Holds the laboratory wavelength of the line,
 * where it is expected (and, once fitted, where it was found) on the detector, the order it
 * belongs to, the Gaussian shape used to render it, and whether it currently takes part in the
 * wavelength solution.
 *
 * Lines are mutated in place over the course of a calibration run, so callers wanting to keep an
 * untouched catalogue should work on a {@link LineList#copy()}.
 */
public class ReferenceLine {

  /**
   * Number of line widths on either side of the center covered by a default extent
   */
  static final double DEFAULT_EXTENT_WIDTHS = 5.;

  private double wll; // catalogue wavelength
  private double posm; // current (fitted) pixel position
  private double posc; // pixel position before fitting
  private int xfirst;
  private int xlast;
  private double width;
  private double height;
  private int order;
  private boolean flag;

  /**
   * Create a line whose rendering extent is derived from its position and width
   *
   * @param wll Catalogue wavelength
   * @param posm Expected pixel position
   * @param order Order index the line falls in
   * @param width Gaussian width of the line (pixels)
   * @param height Peak height of the line
   */
  public ReferenceLine(double wll, double posm, int order, double width, double height) {
    this(wll, posm, defaultFirst(posm, width), defaultLast(posm, width), order, width, height);
  }

  /**
   * Create a line with an explicit pixel extent
   *
   * @param wll Catalogue wavelength
   * @param posm Expected pixel position
   * @param xfirst First pixel covered by the line (inclusive)
   * @param xlast Last pixel covered by the line (exclusive)
   * @param order Order index the line falls in
   * @param width Gaussian width of the line (pixels)
   * @param height Peak height of the line
   */
  public ReferenceLine(double wll, double posm, int xfirst, int xlast, int order,
      double width, double height) {
    this.wll = wll;
    this.posm = posm;
    this.posc = posm;
    this.xfirst = xfirst;
    this.xlast = xlast;
    this.order = order;
    this.width = width;
    this.height = height;
    this.flag = true;
  }

  /**
   * Copy constructor
   *
   * @param other Line to copy all fields from
   */
  public ReferenceLine(ReferenceLine other) {
    wll = other.wll;
    posm = other.posm;
    posc = other.posc;
    xfirst = other.xfirst;
    xlast = other.xlast;
    order = other.order;
    width = other.width;
    height = other.height;
    flag = other.flag;
  }

  private static int defaultFirst(double posm, double width) {
    int radius = (int) Math.ceil(width * DEFAULT_EXTENT_WIDTHS);
    return (int) Math.floor(posm) - radius;
  }

  private static int defaultLast(double posm, double width) {
    int radius = (int) Math.ceil(width * DEFAULT_EXTENT_WIDTHS);
    return (int) Math.floor(posm) + radius + 1;
  }

  /**
   * Move the line on the detector, used when applying an alignment offset
   *
   * @param orderShift Number of orders to move the line by
   * @param pixelShift Number of pixels to move the line by
   */
  public void shift(int orderShift, int pixelShift) {
    order += orderShift;
    posm += pixelShift;
    xfirst += pixelShift;
    xlast += pixelShift;
  }

  public double getWavelength() {
    return wll;
  }

  public double getPosition() {
    return posm;
  }

  public void setPosition(double posm) {
    this.posm = posm;
  }

  public double getOriginalPosition() {
    return posc;
  }

  public void setOriginalPosition(double posc) {
    this.posc = posc;
  }

  public int getFirstPixel() {
    return xfirst;
  }

  public int getLastPixel() {
    return xlast;
  }

  public double getWidth() {
    return width;
  }

  public double getHeight() {
    return height;
  }

  public void setHeight(double height) {
    this.height = height;
  }

  public int getOrder() {
    return order;
  }

  public void setOrder(int order) {
    this.order = order;
  }

  /**
   * @return True if the line is currently used in the wavelength solution
   */
  public boolean isFlagged() {
    return flag;
  }

  public void setFlagged(boolean flag) {
    this.flag = flag;
  }

  @Override
  public String toString() {
    return String.format("Line[wll=%.4f, order=%d, posm=%.3f, flag=%b]", wll, order, posm, flag);
  }
}
