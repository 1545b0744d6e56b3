package asl.wavecal.input;

import asl.wavecal.align.AlignmentOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Ordered, mutable collection of reference lines. The order of entries carries no meaning beyond
 * keeping residual arrays aligned with the lines they were calculated from; grouping is by each
 * line's order index.
 */
public class LineList implements Iterable<ReferenceLine> {

  private final List<ReferenceLine> lines;

  public LineList() {
    lines = new ArrayList<>();
  }

  /**
   * Create a list holding the given lines (the lines themselves are not copied)
   *
   * @param lines Lines to hold
   */
  public LineList(Collection<ReferenceLine> lines) {
    this.lines = new ArrayList<>(lines);
  }

  /**
   * Deep copy of this list, so that a calibration run can mutate lines without touching the
   * caller's catalogue
   *
   * @return New list of copied lines
   */
  public LineList copy() {
    LineList out = new LineList();
    for (ReferenceLine line : lines) {
      out.add(new ReferenceLine(line));
    }
    return out;
  }

  public void add(ReferenceLine line) {
    lines.add(line);
  }

  public ReferenceLine get(int index) {
    return lines.get(index);
  }

  public int size() {
    return lines.size();
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  @Override
  public Iterator<ReferenceLine> iterator() {
    return lines.iterator();
  }

  /**
   * @return Lines currently taking part in the wavelength solution, in list order
   */
  public List<ReferenceLine> getFlagged() {
    List<ReferenceLine> out = new ArrayList<>();
    for (ReferenceLine line : lines) {
      if (line.isFlagged()) {
        out.add(line);
      }
    }
    return out;
  }

  public int countFlagged() {
    int count = 0;
    for (ReferenceLine line : lines) {
      if (line.isFlagged()) {
        ++count;
      }
    }
    return count;
  }

  public void setAllFlags(boolean flag) {
    for (ReferenceLine line : lines) {
      line.setFlagged(flag);
    }
  }

  /**
   * Store the current pixel position of every line as its original (pre-fit) position
   */
  public void resetOriginalPositions() {
    for (ReferenceLine line : lines) {
      line.setOriginalPosition(line.getPosition());
    }
  }

  /**
   * @return Every distinct order index present in the list, ascending
   */
  public SortedSet<Integer> getOrders() {
    SortedSet<Integer> orders = new TreeSet<>();
    for (ReferenceLine line : lines) {
      orders.add(line.getOrder());
    }
    return orders;
  }

  public int getMinOrder() {
    return getOrders().first();
  }

  public int getMaxOrder() {
    return getOrders().last();
  }

  /**
   * Group the lines by order index
   *
   * @param flaggedOnly If true only flagged lines are included
   * @return Map from order index (ascending) to the lines in that order
   */
  public Map<Integer, List<ReferenceLine>> groupByOrder(boolean flaggedOnly) {
    Map<Integer, List<ReferenceLine>> groups = new LinkedHashMap<>();
    for (int order : getOrders()) {
      groups.put(order, new ArrayList<>());
    }
    for (ReferenceLine line : lines) {
      if (flaggedOnly && !line.isFlagged()) {
        continue;
      }
      groups.get(line.getOrder()).add(line);
    }
    if (flaggedOnly) {
      groups.values().removeIf(List::isEmpty);
    }
    return groups;
  }

  /**
   * Scale line heights so that the strongest line in each order has height 1.
   * This operates in-place on the lines of this list.
   */
  public void normalizeHeights() {
    for (List<ReferenceLine> group : groupByOrder(false).values()) {
      double top = Double.NEGATIVE_INFINITY;
      for (ReferenceLine line : group) {
        top = Math.max(top, line.getHeight());
      }
      if (top <= 0 || Double.isInfinite(top)) {
        continue;
      }
      for (ReferenceLine line : group) {
        line.setHeight(line.getHeight() / top);
      }
    }
  }

  /**
   * Apply an alignment offset to the lines. The global shift is applied to every line first, then
   * each per-order pixel shift is applied to the lines that (after the global shift) fall in that
   * order.
   *
   * @param offset Offset to apply
   */
  public void applyOffset(AlignmentOffset offset) {
    for (ReferenceLine line : lines) {
      line.shift(offset.getOrderShift(), offset.getPixelShift());
    }
    for (Map.Entry<Integer, Integer> entry : offset.getOrderPixelShifts().entrySet()) {
      int order = entry.getKey();
      int shift = entry.getValue();
      for (ReferenceLine line : lines) {
        if (line.getOrder() == order) {
          line.shift(0, shift);
        }
      }
    }
  }

  public double[] getPositions() {
    double[] out = new double[lines.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = lines.get(i).getPosition();
    }
    return out;
  }

  public int[] getOrderIndices() {
    int[] out = new int[lines.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = lines.get(i).getOrder();
    }
    return out;
  }

  public boolean[] getFlags() {
    boolean[] out = new boolean[lines.size()];
    for (int i = 0; i < out.length; ++i) {
      out[i] = lines.get(i).isFlagged();
    }
    return out;
  }
}
