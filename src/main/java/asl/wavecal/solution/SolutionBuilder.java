package asl.wavecal.solution;

import asl.wavecal.input.LineList;

/**
 * Fits a wavelength solution to the flagged lines of a line list
 */
public interface SolutionBuilder {

  /**
   * Fit a solution to the lines currently flagged in the list, using their fitted positions
   *
   * @param lines Line list (only flagged lines are used)
   * @return Fitted solution
   * @throws InsufficientLinesException if there are no more flagged lines than free coefficients
   */
  WavelengthSolution build(LineList lines);
}
