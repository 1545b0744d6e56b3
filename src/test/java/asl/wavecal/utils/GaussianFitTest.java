package asl.wavecal.utils;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class GaussianFitTest {

  @Test
  public void fitLine_recoversCenterAndVariance() {
    double[] x = new double[21];
    double[] y = new double[21];
    double[] truth = {3., 10.3, 2.25, 0.};
    for (int i = 0; i < x.length; ++i) {
      x[i] = i;
      y[i] = GaussianFit.value(x[i], truth);
    }
    double[] fit = GaussianFit.fitLine(x, y);
    assertEquals(10.3, fit[1], 1E-3);
    assertEquals(2.25, fit[2], 1E-2);
    assertEquals(3., fit[0], 1E-2);
  }

  @Test
  public void fitLine_prefersPeakNearWindowCenter() {
    double[] x = new double[21];
    double[] y = new double[21];
    double[] central = {1., 10.2, 1., 0.};
    double[] edge = {1.2, 1., 1., 0.};
    for (int i = 0; i < x.length; ++i) {
      x[i] = i;
      y[i] = GaussianFit.value(x[i], central) + GaussianFit.value(x[i], edge);
    }
    double[] fit = GaussianFit.fitLine(x, y);
    assertEquals(10.2, fit[1], 0.05);
  }

  @Test
  public void fitPeak_recoversAllParameters() {
    double[] x = new double[12];
    double[] y = new double[12];
    double[] truth = {5., 7.6, 1.44, 2.};
    for (int i = 0; i < x.length; ++i) {
      x[i] = i + 2;
      y[i] = GaussianFit.value(x[i], truth);
    }
    double[] fit = GaussianFit.fitPeak(x, y);
    for (int i = 0; i < truth.length; ++i) {
      assertEquals(truth[i], fit[i], 1E-4);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void fitPeak_tooFewPoints_throwsException() {
    GaussianFit.fitPeak(new double[]{0., 1., 2.}, new double[]{0., 1., 0.});
  }

  @Test(expected = IllegalArgumentException.class)
  public void fitLine_noPoints_throwsException() {
    GaussianFit.fitLine(new double[0], new double[0]);
  }
}
