package cafe.woden.multisplit.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.multisplit.api.Direction;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.geometry.FocusNavigator;
import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.TreeState;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FocusCommandsTest {

  private static final PaneId P1 = PaneId.of("pane-1");
  private static final PaneId P2 = PaneId.of("pane-2");

  private PaneTree tree;

  @BeforeEach
  void setUp() {
    tree = new PaneTree();
    tree.initialize(WidgetId.of("left"));
    tree.insertSplit(P1, Orientation.HORIZONTAL, WidgetId.of("right"), 0.5);
  }

  @Test
  void setFocusUndoReturnsFocus() {
    SetFocusCommand focus = new SetFocusCommand(P2);

    assertTrue(focus.execute(tree));
    assertEquals(Optional.of(P2), tree.focusedPaneId());
    assertTrue(focus.undo(tree));
    assertEquals(Optional.of(P1), tree.focusedPaneId());
  }

  @Test
  void focusingFocusedPaneDoesNothing() {
    SetFocusCommand focus = new SetFocusCommand(P1);

    assertFalse(focus.execute(tree));
    assertTrue(focus.failure().isEmpty());
  }

  @Test
  void focusAwayFromMaximizedPaneRestoresAndUndoMaximizesAgain() {
    tree.toggleMaximize(P2);
    TreeState maximized = tree.snapshot();
    SetFocusCommand focus = new SetFocusCommand(P1);

    assertTrue(focus.execute(tree));
    assertFalse(tree.isMaximized());

    assertTrue(focus.undo(tree));
    assertEquals(maximized, tree.snapshot());
  }

  @Test
  void focusUnknownPaneIsRefused() {
    SetFocusCommand focus = new SetFocusCommand(PaneId.of("ghost"));

    assertFalse(focus.execute(tree));
    assertEquals(LayoutError.Kind.PANE_NOT_FOUND, focus.failure().orElseThrow().kind());
  }

  @Test
  void toggleMaximizeActsOnFocusedPaneAndUndoes() {
    tree.setFocus(P2);
    ToggleMaximizeCommand toggle = new ToggleMaximizeCommand();

    assertTrue(toggle.execute(tree));
    assertEquals(Optional.of(P2), tree.maximizedPaneId());
    assertEquals(Optional.of(P2), toggle.toggledPaneId());

    assertTrue(toggle.undo(tree));
    assertFalse(tree.isMaximized());
  }

  @Test
  void secondToggleRestores() {
    new ToggleMaximizeCommand().execute(tree);

    ToggleMaximizeCommand restore = new ToggleMaximizeCommand();
    assertTrue(restore.execute(tree));
    assertFalse(tree.isMaximized());

    assertTrue(restore.undo(tree));
    assertEquals(Optional.of(P1), tree.maximizedPaneId());
  }

  @Test
  void navigateMovesToSpatialNeighbour() {
    NavigateFocusCommand right = new NavigateFocusCommand(Direction.RIGHT, new FocusNavigator());

    assertTrue(right.execute(tree));
    assertEquals(Optional.of(P2), tree.focusedPaneId());

    assertTrue(right.undo(tree));
    assertEquals(Optional.of(P1), tree.focusedPaneId());
  }

  @Test
  void navigateWithoutNeighbourReportsFalse() {
    NavigateFocusCommand left = new NavigateFocusCommand(Direction.LEFT, new FocusNavigator());
    NavigateFocusCommand up = new NavigateFocusCommand(Direction.UP, new FocusNavigator());

    assertFalse(left.execute(tree));
    assertFalse(up.execute(tree));
    assertEquals(Optional.of(P1), tree.focusedPaneId());
  }
}
