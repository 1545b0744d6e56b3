package asl.wavecal.solution;

/**
 * Shape of the wavelength solution: independent polynomials per order, or one polynomial surface
 * over all orders. Each mode creates the matching builder, stepped or plain.
 */
public enum SolutionMode {

  ONE_D("1D") {
    @Override
    public SolutionBuilder createBuilder(int degreeX, int degreeY, int steps, int nord, int ncol) {
      if (steps > 0) {
        return new SteppedOrderBuilder(degreeX, nord, steps, ncol);
      }
      return new OrderPolynomialBuilder(degreeX, nord);
    }
  },
  TWO_D("2D") {
    @Override
    public SolutionBuilder createBuilder(int degreeX, int degreeY, int steps, int nord, int ncol) {
      if (steps > 0) {
        return new SteppedSurfaceBuilder(degreeX, degreeY, steps, ncol);
      }
      return new SurfacePolynomialBuilder(degreeX, degreeY);
    }
  };

  private final String name;

  SolutionMode(String name) {
    this.name = name;
  }

  /**
   * Get the mode matching its configuration name ("1D" or "2D", case insensitive)
   *
   * @param name Mode name
   * @return Matching mode
   * @throws IllegalArgumentException if the name is not a known mode
   */
  public static SolutionMode fromString(String name) {
    for (SolutionMode mode : values()) {
      if (mode.name.equalsIgnoreCase(name)) {
        return mode;
      }
    }
    throw new IllegalArgumentException(
        "Fit mode not understood. Expected '1D' or '2D' but got " + name);
  }

  /**
   * Create a builder for this mode
   *
   * @param degreeX Polynomial degree along the pixel direction (the only degree used in 1D)
   * @param degreeY Polynomial degree along the order direction (2D only)
   * @param steps Number of step knots per order; 0 for a plain polynomial
   * @param nord Number of orders on the detector
   * @param ncol Number of columns on the detector
   * @return Solution builder
   */
  public abstract SolutionBuilder createBuilder(int degreeX, int degreeY, int steps, int nord,
      int ncol);

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
