package asl.wavecal.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import asl.wavecal.align.AlignmentOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

public class LineListTest {

  private LineList lines;

  @Before
  public void setUp() {
    lines = new LineList();
    lines.add(new ReferenceLine(5000., 100., 0, 2., 4.));
    lines.add(new ReferenceLine(5010., 300., 0, 2., 8.));
    lines.add(new ReferenceLine(5100., 150., 2, 2., 3.));
  }

  @Test
  public void referenceLine_defaultExtent_isFiveWidthsAroundPosition() {
    ReferenceLine line = new ReferenceLine(5000., 100.4, 0, 2., 1.);
    assertEquals(90, line.getFirstPixel());
    assertEquals(111, line.getLastPixel());
    assertEquals(100.4, line.getOriginalPosition(), 0.);
    assertTrue(line.isFlagged());
  }

  @Test
  public void copy_isDeep() {
    LineList copy = lines.copy();
    copy.get(0).setPosition(1.);
    copy.get(1).setFlagged(false);
    assertEquals(100., lines.get(0).getPosition(), 0.);
    assertTrue(lines.get(1).isFlagged());
    assertNotSame(lines.get(2), copy.get(2));
  }

  @Test
  public void normalizeHeights_scalesPerOrder() {
    lines.normalizeHeights();
    assertEquals(0.5, lines.get(0).getHeight(), 1E-12);
    assertEquals(1., lines.get(1).getHeight(), 1E-12);
    assertEquals(1., lines.get(2).getHeight(), 1E-12);
  }

  @Test
  public void applyOffset_shiftsGlobalThenPerOrder() {
    Map<Integer, Integer> perOrder = new HashMap<>();
    perOrder.put(1, 3);
    lines.applyOffset(new AlignmentOffset(1, -10, perOrder));

    assertArrayEquals(new int[]{1, 1, 3}, lines.getOrderIndices());
    assertArrayEquals(new double[]{93., 293., 140.}, lines.getPositions(), 1E-12);
    assertEquals(83, lines.get(0).getFirstPixel());
    assertEquals(104, lines.get(0).getLastPixel());
  }

  @Test
  public void groupByOrder_flaggedOnly_dropsEmptyOrders() {
    lines.get(2).setFlagged(false);
    Map<Integer, List<ReferenceLine>> groups = lines.groupByOrder(true);
    assertEquals(1, groups.size());
    assertEquals(2, groups.get(0).size());

    Map<Integer, List<ReferenceLine>> all = lines.groupByOrder(false);
    assertEquals(2, all.size());
    assertEquals(0, lines.getMinOrder());
    assertEquals(2, lines.getMaxOrder());
  }

  @Test
  public void flags_countAndReset() {
    lines.get(0).setFlagged(false);
    assertEquals(2, lines.countFlagged());
    assertEquals(2, lines.getFlagged().size());
    assertArrayEquals(new boolean[]{false, true, true}, lines.getFlags());

    lines.setAllFlags(true);
    assertEquals(3, lines.countFlagged());
    lines.setAllFlags(false);
    assertFalse(lines.get(2).isFlagged());
  }

  @Test
  public void resetOriginalPositions_copiesCurrentPositions() {
    lines.get(0).setPosition(101.5);
    assertEquals(100., lines.get(0).getOriginalPosition(), 0.);
    lines.resetOriginalPositions();
    assertEquals(101.5, lines.get(0).getOriginalPosition(), 0.);
  }
}
