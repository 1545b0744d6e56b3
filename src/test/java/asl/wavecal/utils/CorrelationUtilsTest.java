package asl.wavecal.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class CorrelationUtilsTest {

  @Test
  public void crossCorrelate2D_matchesDirectSum() {
    double[][] a = {{1., 2., 0., 1.}, {0., 3., 1., 2.}, {4., 0., 1., 1.}};
    double[][] b = {{1., 0., 2.}, {0., 1., 1.}};
    double[][] out = CorrelationUtils.crossCorrelate2D(a, b);
    assertEquals(a.length + b.length - 1, out.length);
    assertEquals(a[0].length + b[0].length - 1, out[0].length);

    for (int dy = -(b.length - 1); dy < a.length; ++dy) {
      for (int dx = -(b[0].length - 1); dx < a[0].length; ++dx) {
        double expected = 0.;
        for (int i = 0; i < b.length; ++i) {
          for (int j = 0; j < b[0].length; ++j) {
            int ai = i + dy;
            int aj = j + dx;
            if (ai >= 0 && ai < a.length && aj >= 0 && aj < a[0].length) {
              expected += a[ai][aj] * b[i][j];
            }
          }
        }
        assertEquals(expected, out[dy + b.length - 1][dx + b[0].length - 1], 1E-9);
      }
    }
  }

  @Test
  public void findBestShift2D_recoversShift() {
    double[][] a = new double[6][40];
    double[][] b = new double[4][40];
    b[0][10] = 1.;
    b[1][20] = 2.;
    b[3][5] = 1.;
    // a holds b moved down 2 rows and left 3 columns
    a[2][7] = 1.;
    a[3][17] = 2.;
    a[5][2] = 1.;
    assertArrayEquals(new int[]{2, -3}, CorrelationUtils.findBestShift2D(a, b));
  }

  @Test
  public void findBestShift2D_noOverlap_returnsNull() {
    assertNull(CorrelationUtils.findBestShift2D(new double[3][8], new double[2][8]));
  }

  @Test
  public void findBestShift1D_recoversShiftWithinWindow() {
    double[] a = new double[30];
    double[] b = new double[30];
    b[10] = 1.;
    a[14] = 1.;
    assertEquals(Integer.valueOf(4), CorrelationUtils.findBestShift1D(a, b, 5));
    assertNull(CorrelationUtils.findBestShift1D(a, b, 3));
  }
}
