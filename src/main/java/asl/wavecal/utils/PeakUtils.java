package asl.wavecal.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Peak detection in sampled 1D data. Peaks are local maxima (the middle sample of a flat top),
 * optionally filtered, in this order, by a minimum height, a minimum distance between peaks
 * (lower peaks close to a higher one are dropped) and a minimum width (measured at half the
 * peak's prominence).
 */
public class PeakUtils {

  /**
   * Find all local maxima at or above a given height
   *
   * @param x Data to search
   * @param minHeight Smallest accepted peak value
   * @return Indices of the peaks, ascending
   */
  public static int[] findPeaks(double[] x, double minHeight) {
    return findPeaks(x, minHeight, 0, 0.);
  }

  /**
   * Find local maxima of a data series
   *
   * @param x Data to search
   * @param minHeight Smallest accepted peak value (NaN disables the test)
   * @param minDistance Smallest accepted distance between peaks in samples (values below 1
   * disable the test)
   * @param minWidth Smallest accepted width at half prominence, in samples (values of 0 or below
   * disable the test)
   * @return Indices of the peaks, ascending
   */
  public static int[] findPeaks(double[] x, double minHeight, int minDistance, double minWidth) {
    int[] peaks = localMaxima(x);

    if (!Double.isNaN(minHeight)) {
      List<Integer> kept = new ArrayList<>();
      for (int peak : peaks) {
        if (x[peak] >= minHeight) {
          kept.add(peak);
        }
      }
      peaks = toArray(kept);
    }

    if (minDistance > 1 && peaks.length > 1) {
      peaks = selectByDistance(x, peaks, minDistance);
    }

    if (minWidth > 0) {
      List<Integer> kept = new ArrayList<>();
      for (int peak : peaks) {
        if (width(x, peak) >= minWidth) {
          kept.add(peak);
        }
      }
      peaks = toArray(kept);
    }

    return peaks;
  }

  /**
   * Indices of all local maxima; for a flat top the middle sample (rounded down) is used.
   * The first and last samples are never peaks.
   *
   * @param x Data to search
   * @return Indices of maxima, ascending
   */
  static int[] localMaxima(double[] x) {
    List<Integer> peaks = new ArrayList<>();
    int i = 1;
    int last = x.length - 1;
    while (i < last) {
      if (x[i - 1] < x[i]) {
        int ahead = i + 1;
        while (ahead < last && x[ahead] == x[i]) {
          ++ahead;
        }
        if (x[ahead] < x[i]) {
          peaks.add((i + ahead - 1) / 2);
          i = ahead;
        }
      }
      ++i;
    }
    return toArray(peaks);
  }

  private static int[] selectByDistance(double[] x, int[] peaks, int minDistance) {
    boolean[] keep = new boolean[peaks.length];
    Arrays.fill(keep, true);
    Integer[] byHeight = new Integer[peaks.length];
    for (int i = 0; i < peaks.length; ++i) {
      byHeight[i] = i;
    }
    Arrays.sort(byHeight, Comparator.comparingDouble(i -> x[peaks[i]]));

    // highest peaks claim their neighborhood first
    for (int n = byHeight.length - 1; n >= 0; --n) {
      int j = byHeight[n];
      if (!keep[j]) {
        continue;
      }
      int k = j - 1;
      while (k >= 0 && peaks[j] - peaks[k] < minDistance) {
        keep[k] = false;
        --k;
      }
      k = j + 1;
      while (k < peaks.length && peaks[k] - peaks[j] < minDistance) {
        keep[k] = false;
        ++k;
      }
    }

    List<Integer> kept = new ArrayList<>();
    for (int i = 0; i < peaks.length; ++i) {
      if (keep[i]) {
        kept.add(peaks[i]);
      }
    }
    return toArray(kept);
  }

  /**
   * Width of a peak at half of its prominence, with linear interpolation between samples
   *
   * @param x Data containing the peak
   * @param peak Index of the peak
   * @return Width in samples
   */
  static double width(double[] x, int peak) {
    // walk out to the bases: the lowest points before the data rises above the peak again
    double leftMin = x[peak];
    int leftBase = peak;
    int i = peak;
    while (i >= 0 && x[i] <= x[peak]) {
      if (x[i] < leftMin) {
        leftMin = x[i];
        leftBase = i;
      }
      --i;
    }
    double rightMin = x[peak];
    int rightBase = peak;
    i = peak;
    while (i < x.length && x[i] <= x[peak]) {
      if (x[i] < rightMin) {
        rightMin = x[i];
        rightBase = i;
      }
      ++i;
    }
    double prominence = x[peak] - Math.max(leftMin, rightMin);
    double height = x[peak] - prominence * 0.5;

    i = peak;
    while (leftBase < i && height < x[i]) {
      --i;
    }
    double left = i;
    if (x[i] < height) {
      left += (height - x[i]) / (x[i + 1] - x[i]);
    }

    i = peak;
    while (i < rightBase && height < x[i]) {
      ++i;
    }
    double right = i;
    if (x[i] < height) {
      right -= (height - x[i]) / (x[i - 1] - x[i]);
    }
    return right - left;
  }

  private static int[] toArray(List<Integer> values) {
    int[] out = new int[values.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = values.get(i);
    }
    return out;
  }
}
