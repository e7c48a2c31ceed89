package cafe.woden.multisplit.geometry;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.model.LeafNode;
import cafe.woden.multisplit.model.PaneNode;
import cafe.woden.multisplit.model.SizeConstraints;
import cafe.woden.multisplit.model.SplitNode;
import cafe.woden.multisplit.model.TreeState;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GeometryCalculatorTest {

  private static final PaneId A = PaneId.of("a");
  private static final PaneId B = PaneId.of("b");
  private static final PaneId C = PaneId.of("c");

  private static LeafNode leaf(PaneId id) {
    return new LeafNode(id, WidgetId.of(id.value()));
  }

  private static SplitNode split(
      String id, Orientation orientation, List<Double> ratios, PaneNode... children) {
    return new SplitNode(NodeId.of(id), orientation, ratios, List.of(children));
  }

  @Test
  void lastChildTakesTheRemainder() {
    SplitNode root = split("s", Orientation.HORIZONTAL, List.of(0.3, 0.7), leaf(A), leaf(B));

    LayoutGeometry g = new GeometryCalculator().calculate(root, Rect.of(0, 0, 1000, 600));

    assertEquals(Rect.of(0, 0, 300, 600), g.panes().get(A));
    assertEquals(Rect.of(300, 0, 700, 600), g.panes().get(B));
  }

  @Test
  void roundingErrorGoesToLastChild() {
    SplitNode root =
        split("s", Orientation.VERTICAL, List.of(1.0 / 3, 1.0 / 3, 1.0 / 3), leaf(A), leaf(B), leaf(C));

    LayoutGeometry g = new GeometryCalculator().calculate(root, Rect.of(10, 20, 50, 100));

    assertEquals(Rect.of(10, 20, 50, 33), g.panes().get(A));
    assertEquals(Rect.of(10, 53, 50, 33), g.panes().get(B));
    assertEquals(Rect.of(10, 86, 50, 34), g.panes().get(C));
  }

  @Test
  void nestedLeavesTileTheRootWithoutOverlap() {
    SplitNode root =
        split(
            "outer",
            Orientation.HORIZONTAL,
            List.of(0.37, 0.63),
            leaf(A),
            split("inner", Orientation.VERTICAL, List.of(0.41, 0.59), leaf(B), leaf(C)));
    Rect bounds = Rect.of(3, 7, 1001, 703);

    LayoutGeometry g = new GeometryCalculator().calculate(root, bounds);

    assertEquals(bounds.area(), g.paneArea());
    List<Rect> rects = new ArrayList<>(g.panes().values());
    for (int i = 0; i < rects.size(); i++) {
      assertTrue(bounds.contains(rects.get(i).x(), rects.get(i).y()));
      for (int j = i + 1; j < rects.size(); j++) {
        assertFalse(rects.get(i).intersects(rects.get(j)), rects.get(i) + " overlaps " + rects.get(j));
      }
    }
    assertEquals(g.panes().get(A).right(), g.splits().get(NodeId.of("inner")).x());
    assertFalse(g.overflow());
  }

  @Test
  void minimumSizeGrowsPaneAndShrinksSiblings() {
    LeafNode small = new LeafNode(A, WidgetId.of("a"), new SizeConstraints(200, 0));
    SplitNode root = split("s", Orientation.HORIZONTAL, List.of(0.1, 0.9), small, leaf(B));

    LayoutGeometry g = new GeometryCalculator().calculate(root, Rect.of(0, 0, 1000, 100));

    assertEquals(200, g.panes().get(A).width());
    assertEquals(800, g.panes().get(B).width());
    assertFalse(g.overflow());
  }

  @Test
  void minimumsBeyondAvailableSpaceOverflow() {
    GeometryCalculator calc =
        new GeometryCalculator(new GeometryOptions(0, new SizeConstraints(600, 0)));
    SplitNode root = split("s", Orientation.HORIZONTAL, List.of(0.5, 0.5), leaf(A), leaf(B));

    LayoutGeometry g = calc.calculate(root, Rect.of(0, 0, 1000, 100));

    assertEquals(600, g.panes().get(A).width());
    assertEquals(600, g.panes().get(B).width());
    assertTrue(g.overflow());
  }

  @Test
  void distributeWithoutMinimumsMatchesPlainRounding() {
    assertArrayEquals(
        new int[] {125, 250, 625},
        GeometryCalculator.distribute(List.of(0.125, 0.25, 0.625), new int[3], 1000));
    assertArrayEquals(
        new int[] {0, 0}, GeometryCalculator.distribute(List.of(0.5, 0.5), new int[2], 0));
  }

  @Test
  void dividersAreReservedAndReported() {
    GeometryCalculator calc = new GeometryCalculator(new GeometryOptions(4, SizeConstraints.NONE));
    SplitNode root = split("s", Orientation.HORIZONTAL, List.of(0.5, 0.5), leaf(A), leaf(B));

    LayoutGeometry g = calc.calculate(root, Rect.of(0, 0, 1000, 50));

    assertEquals(Rect.of(0, 0, 498, 50), g.panes().get(A));
    assertEquals(Rect.of(502, 0, 498, 50), g.panes().get(B));
    Divider divider = g.dividers().get(0);
    assertEquals(new Divider(NodeId.of("s"), 0, Orientation.HORIZONTAL, Rect.of(498, 0, 4, 50)), divider);
    assertEquals(1000L * 50, g.paneArea() + divider.rect().area());
  }

  @Test
  void maximizedPaneFillsBoundsAlone() {
    SplitNode root = split("s", Orientation.HORIZONTAL, List.of(0.5, 0.5), leaf(A), leaf(B));
    Rect bounds = Rect.of(0, 0, 800, 600);

    LayoutGeometry g =
        new GeometryCalculator().calculateVisible(new TreeState(root, B, B), bounds);

    assertEquals(Map.of(B, bounds), g.panes());
  }

  @Test
  void minimumExtentSumsAlongAxisAndMaxesAcross() {
    GeometryCalculator calc = new GeometryCalculator(new GeometryOptions(2, SizeConstraints.NONE));
    LeafNode wide = new LeafNode(A, WidgetId.of("a"), new SizeConstraints(100, 40));
    LeafNode tall = new LeafNode(B, WidgetId.of("b"), new SizeConstraints(60, 90));
    SplitNode root = split("s", Orientation.HORIZONTAL, List.of(0.5, 0.5), wide, tall);

    assertEquals(162, calc.minimumExtent(root, Orientation.HORIZONTAL));
    assertEquals(90, calc.minimumExtent(root, Orientation.VERTICAL));
  }

  @Test
  void emptyTreeHasNoPanes() {
    LayoutGeometry g = new GeometryCalculator().calculate(null, Rect.of(0, 0, 10, 10));

    assertTrue(g.panes().isEmpty());
  }
}
