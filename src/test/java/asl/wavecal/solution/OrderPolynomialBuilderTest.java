package asl.wavecal.solution;

import static org.junit.Assert.assertEquals;

import asl.wavecal.input.LineList;
import asl.wavecal.input.ReferenceLine;
import asl.wavecal.test.TestUtils;
import org.junit.Test;

public class OrderPolynomialBuilderTest {

  @Test
  public void build_fitsEachOrderSeparately() {
    LineList lines = TestUtils.createCatalogue(false);
    OrderPolynomialSolution solution =
        new OrderPolynomialBuilder(2, TestUtils.ORDERS).build(lines);

    assertEquals(TestUtils.ORDERS, solution.getOrders().size());
    for (int i = 0; i < TestUtils.ORDERS; ++i) {
      double[] coeffs = solution.getPolynomial(i).getCoefficients();
      assertEquals(5000. + 10. * i, coeffs[0], 1E-7);
      assertEquals(0.05, coeffs[1], 1E-10);
      assertEquals(1E-6, coeffs[2], 1E-13);
    }
    assertEquals(TestUtils.ORDERS * 3, solution.getParameterCount());
  }

  @Test
  public void build_orderWithTooFewLines_throwsException() {
    LineList lines = TestUtils.createCatalogue(false);
    int unflagged = 0;
    for (ReferenceLine line : lines) {
      if (line.getOrder() == 3 && unflagged < 7) {
        line.setFlagged(false);
        ++unflagged;
      }
    }
    try {
      new OrderPolynomialBuilder(2, TestUtils.ORDERS).build(lines);
    } catch (InsufficientLinesException e) {
      assertEquals(3, e.getOrder());
      assertEquals(4, e.getRequired());
      assertEquals(3, e.getAvailable());
      return;
    }
    throw new AssertionError("Expected an InsufficientLinesException");
  }

  @Test
  public void build_oneLineMoreThanCoefficients_succeeds() {
    LineList lines = TestUtils.createCatalogue(false);
    int unflagged = 0;
    for (ReferenceLine line : lines) {
      if (line.getOrder() == 3 && unflagged < 6) {
        line.setFlagged(false);
        ++unflagged;
      }
    }
    OrderPolynomialSolution solution =
        new OrderPolynomialBuilder(2, TestUtils.ORDERS).build(lines);
    assertEquals(1E-6, solution.getPolynomial(3).getCoefficients()[2], 1E-12);
  }

  @Test(expected = InsufficientLinesException.class)
  public void build_orderWithoutLines_throwsException() {
    new OrderPolynomialBuilder(1, TestUtils.ORDERS + 1).build(TestUtils.createCatalogue(false));
  }

  @Test(expected = IllegalArgumentException.class)
  public void evaluate_unknownOrder_throwsException() {
    OrderPolynomialSolution solution =
        new OrderPolynomialBuilder(2, TestUtils.ORDERS).build(TestUtils.createCatalogue(false));
    solution.evaluate(10., TestUtils.ORDERS);
  }
}
