package asl.wavecal.align;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Integer shift to move reference lines onto the observed spectrum: a global (order, pixel)
 * shift applied to every line, plus optional per-order pixel shifts applied afterwards to the
 * lines of a single (already shifted) order.
 */
public class AlignmentOffset {

  /**
   * No shift at all
   */
  public static final AlignmentOffset ZERO = new AlignmentOffset(0, 0);

  private final int orderShift;
  private final int pixelShift;
  private final Map<Integer, Integer> orderPixelShifts;

  public AlignmentOffset(int orderShift, int pixelShift) {
    this(orderShift, pixelShift, Collections.<Integer, Integer>emptyMap());
  }

  /**
   * @param orderShift Shift in order index applied to all lines
   * @param pixelShift Shift in pixels applied to all lines
   * @param orderPixelShifts Map from order index to an additional pixel shift for that order
   */
  public AlignmentOffset(int orderShift, int pixelShift, Map<Integer, Integer> orderPixelShifts) {
    this.orderShift = orderShift;
    this.pixelShift = pixelShift;
    this.orderPixelShifts = Collections.unmodifiableMap(new LinkedHashMap<>(orderPixelShifts));
  }

  public int getOrderShift() {
    return orderShift;
  }

  public int getPixelShift() {
    return pixelShift;
  }

  /**
   * @return Per-order pixel shifts, keyed on order index (read-only)
   */
  public Map<Integer, Integer> getOrderPixelShifts() {
    return orderPixelShifts;
  }

  @Override
  public String toString() {
    return "Offset order: " + orderShift + ", Offset pixel: " + pixelShift
        + (orderPixelShifts.isEmpty() ? "" : ", per-order shifts: " + orderPixelShifts);
  }
}
