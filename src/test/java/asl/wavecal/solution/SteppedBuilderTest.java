package asl.wavecal.solution;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import asl.wavecal.input.LineList;
import asl.wavecal.input.ReferenceLine;
import org.junit.Test;

public class SteppedBuilderTest {

  private static final int COLUMNS = 1000;

  private static double stepped(double x, int order, double offset) {
    double shifted = x >= 500. ? x + offset : x;
    return 5000. + 10. * order + 0.05 * shifted + 1E-6 * shifted * shifted;
  }

  private static LineList createSteppedLines(double[] offsets) {
    LineList lines = new LineList();
    for (int order = 0; order < offsets.length; ++order) {
      for (int k = 0; k < 50; ++k) {
        double x = 10. + 20. * k + 0.1 * order;
        lines.add(new ReferenceLine(stepped(x, order, offsets[order]), x, order, 1., 1.));
      }
    }
    return lines;
  }

  @Test
  public void steppedOrderBuilder_recoversStep() {
    LineList lines = createSteppedLines(new double[]{2.});
    OrderPolynomialSolution solution = new SteppedOrderBuilder(2, 1, 1, COLUMNS).build(lines);

    StepFunction step = solution.getStepFunction(0);
    assertEquals(500., step.getKnots()[0], 0.);
    assertEquals(2., step.getOffsets()[0], 1E-3);
    for (ReferenceLine line : lines) {
      assertEquals(line.getWavelength(), solution.evaluate(line.getPosition(), 0), 1E-5);
    }
    assertEquals(3 + 2, solution.getParameterCount());
  }

  @Test
  public void steppedSurfaceBuilder_recoversStepPerOrder() {
    double[] offsets = {2., 1., -1.5};
    LineList lines = createSteppedLines(offsets);
    SurfacePolynomialSolution solution = new SteppedSurfaceBuilder(2, 1, 1, COLUMNS).build(lines);

    for (int order = 0; order < offsets.length; ++order) {
      assertEquals(offsets[order], solution.getStepFunction(order).getOffsets()[0], 1E-3);
    }
    for (ReferenceLine line : lines) {
      assertEquals(line.getWavelength(),
          solution.evaluate(line.getPosition(), line.getOrder()), 1E-5);
    }
    assertEquals(6 + 3 * 2, solution.getParameterCount());
  }

  @Test
  public void steppedSurfaceBuilder_beatsPlainSurface() {
    LineList lines = createSteppedLines(new double[]{2., 2., 2.});
    SurfacePolynomialSolution plain = new SurfacePolynomialBuilder(2, 1).build(lines);
    SurfacePolynomialSolution stepped = new SteppedSurfaceBuilder(2, 1, 1, COLUMNS).build(lines);
    double plainError = 0.;
    double steppedError = 0.;
    for (ReferenceLine line : lines) {
      plainError = Math.max(plainError, Math.abs(
          plain.evaluate(line.getPosition(), line.getOrder()) - line.getWavelength()));
      steppedError = Math.max(steppedError, Math.abs(
          stepped.evaluate(line.getPosition(), line.getOrder()) - line.getWavelength()));
    }
    assertEquals(0., steppedError, 1E-5);
    assertTrue(plainError > 100 * steppedError);
  }

  @Test(expected = IllegalArgumentException.class)
  public void constructor_noSteps_throwsException() {
    new SteppedSurfaceBuilder(2, 1, 0, COLUMNS);
  }
}
