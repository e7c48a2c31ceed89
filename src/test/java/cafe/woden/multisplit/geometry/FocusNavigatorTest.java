package cafe.woden.multisplit.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import cafe.woden.multisplit.api.Direction;
import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.model.LeafNode;
import cafe.woden.multisplit.model.SplitNode;
import cafe.woden.multisplit.model.TreeState;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FocusNavigatorTest {

  private static final PaneId A = PaneId.of("a");
  private static final PaneId B = PaneId.of("b");
  private static final PaneId C = PaneId.of("c");

  // A | (B over C)
  private static final TreeState STATE =
      TreeState.of(
          new SplitNode(
              NodeId.of("outer"),
              Orientation.HORIZONTAL,
              List.of(0.5, 0.5),
              List.of(
                  new LeafNode(A, WidgetId.of("a")),
                  new SplitNode(
                      NodeId.of("inner"),
                      Orientation.VERTICAL,
                      List.of(0.5, 0.5),
                      List.of(new LeafNode(B, WidgetId.of("b")), new LeafNode(C, WidgetId.of("c")))))));

  private final FocusNavigator navigator = new FocusNavigator();

  @Test
  void movesToOverlappingNeighbourPreferringTreeOrderOnTies() {
    assertEquals(Optional.of(B), navigator.neighbor(STATE, A, Direction.RIGHT));
    assertEquals(Optional.of(A), navigator.neighbor(STATE, C, Direction.LEFT));
    assertEquals(Optional.of(C), navigator.neighbor(STATE, B, Direction.DOWN));
    assertEquals(Optional.of(B), navigator.neighbor(STATE, C, Direction.UP));
  }

  @Test
  void noNeighbourBeyondTheEdge() {
    assertEquals(Optional.empty(), navigator.neighbor(STATE, A, Direction.LEFT));
    assertEquals(Optional.empty(), navigator.neighbor(STATE, B, Direction.UP));
    assertEquals(Optional.empty(), navigator.neighbor(STATE, PaneId.of("ghost"), Direction.UP));
  }

  @Test
  void nextAndPreviousCycleInTreeOrder() {
    assertEquals(Optional.of(B), navigator.next(STATE, A));
    assertEquals(Optional.of(A), navigator.next(STATE, C));
    assertEquals(Optional.of(C), navigator.previous(STATE, A));
    assertEquals(Optional.empty(), navigator.next(TreeState.of(new LeafNode(A, WidgetId.of("a"))), A));
  }
}
