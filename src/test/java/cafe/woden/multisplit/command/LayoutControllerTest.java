package cafe.woden.multisplit.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.SplitNode;
import cafe.woden.multisplit.model.TreeState;
import cafe.woden.multisplit.signal.LayoutSignal;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LayoutControllerTest {

  private static final PaneId P1 = PaneId.of("pane-1");
  private static final PaneId P2 = PaneId.of("pane-2");

  private PaneTree tree;
  private LayoutController controller;

  @BeforeEach
  void setUp() {
    tree = new PaneTree();
    controller = new LayoutController(tree, 3);
    tree.initialize(WidgetId.of("a"));
  }

  private SplitCommand split(PaneId target) {
    return new SplitCommand(target, Orientation.HORIZONTAL, WidgetId.of("x"), 0.5);
  }

  @Test
  void undoAndRedoWalkTheHistory() {
    TreeState initial = tree.snapshot();
    assertTrue(controller.execute(split(P1)));
    TreeState split = tree.snapshot();

    assertTrue(controller.undo());
    assertEquals(initial, tree.snapshot());
    assertTrue(controller.canRedo());

    assertTrue(controller.redo());
    assertEquals(split, tree.snapshot());
    assertFalse(controller.canRedo());
  }

  @Test
  void newCommandClearsRedo() {
    controller.execute(split(P1));
    controller.undo();

    controller.execute(new ToggleMaximizeCommand());

    assertFalse(controller.canRedo());
    assertEquals(1, controller.undoDepth());
  }

  @Test
  void historyIsBoundedDroppingOldest() {
    controller.execute(split(P1));
    controller.execute(new SetFocusCommand(P2));
    controller.execute(new ToggleMaximizeCommand());
    controller.execute(new ToggleMaximizeCommand());

    assertEquals(3, controller.undoDepth());
    assertTrue(controller.undo());
    assertTrue(controller.undo());
    assertTrue(controller.undo());
    assertFalse(controller.undo());
    assertEquals(2, tree.paneCount(), "the split fell off the history");
  }

  @Test
  void refusedCommandIsNotRecorded() {
    assertFalse(controller.execute(new RemoveCommand(P1)));

    assertEquals(LayoutError.Kind.LAST_PANE, controller.lastFailure().orElseThrow().kind());
    assertFalse(controller.canUndo());
  }

  @Test
  void consecutiveRatioChangesCollapseIntoOneUndoStep() {
    controller.execute(split(P1));
    NodeId node = ((SplitNode) tree.root().orElseThrow()).nodeId();
    Instant t0 = Instant.parse("2026-03-01T10:00:00Z");
    Duration window = Duration.ofMillis(500);

    for (int i = 1; i <= 5; i++) {
      double left = 0.5 - i * 0.05;
      controller.execute(
          new SetRatiosCommand(node, List.of(left, 1.0 - left), t0.plusMillis(i * 100L), window));
    }

    assertEquals(2, controller.undoDepth());
    assertTrue(controller.undo());
    assertEquals(List.of(0.5, 0.5), tree.findSplit(node).orElseThrow().ratios());
  }

  @Test
  void publishesCommandExecutedAndUndone() {
    TestSubscriber<LayoutSignal> signals = tree.signals().signals().test();

    controller.execute(split(P1));
    controller.undo();

    assertTrue(signals.values().contains(new LayoutSignal.CommandExecuted("Split pane pane-1 right")));
    assertTrue(signals.values().contains(new LayoutSignal.CommandUndone("Split pane pane-1 right")));
  }

  @Test
  void failedUndoStaysOnTheStack() {
    PaneCommand stubborn = mock(PaneCommand.class);
    when(stubborn.execute(any())).thenReturn(true);
    when(stubborn.undo(any())).thenReturn(false);
    when(stubborn.description()).thenReturn("stubborn");
    when(stubborn.failure())
        .thenReturn(Optional.of(LayoutError.invalidTransition("cannot", null)));

    controller.execute(stubborn);

    assertFalse(controller.undo());
    assertTrue(controller.canUndo());
    assertEquals(
        LayoutError.Kind.INVALID_TRANSITION, controller.lastFailure().orElseThrow().kind());
    verify(stubborn).undo(tree);
  }

  @Test
  void clearHistoryForgetsEverything() {
    controller.execute(split(P1));
    controller.undo();
    controller.execute(new SetFocusCommand(P1));

    controller.clearHistory();

    assertFalse(controller.canUndo());
    assertFalse(controller.canRedo());
  }
}
