package cafe.woden.multisplit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.multisplit.api.Direction;
import cafe.woden.multisplit.command.SetRatiosCommand;
import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;
import cafe.woden.multisplit.api.WherePosition;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.PaneIdGenerator;
import cafe.woden.multisplit.model.SizeConstraints;
import cafe.woden.multisplit.model.SplitNode;
import cafe.woden.multisplit.model.TreeState;
import cafe.woden.multisplit.persist.LayoutFormatException;
import cafe.woden.multisplit.reconcile.ReconcileOperation;
import cafe.woden.multisplit.signal.LayoutSignal;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PaneLayoutTest {

  private static final PaneId P1 = PaneId.of("pane-1");
  private static final PaneId P2 = PaneId.of("pane-2");
  private static final PaneId P3 = PaneId.of("pane-3");

  @TempDir Path tempDir;

  private PaneLayout layout;

  @BeforeEach
  void setUp() {
    layout =
        PaneLayoutFactory.standalone()
            .create(
                PaneIdGenerator.sequential("pane"),
                Clock.fixed(Instant.parse("2026-05-01T12:00:00Z"), ZoneOffset.UTC));
    layout.initialize(WidgetId.of("editor"));
  }

  @Test
  void splitWhileMaximizedAutoRestoresFirst() {
    layout.splitPane(P1, WidgetId.of("terminal"), WherePosition.BOTTOM, 0.5);
    layout.focusPane(P2);
    assertTrue(layout.toggleMaximize());
    assertEquals(Optional.of(P2), layout.maximizedPane());

    Optional<PaneId> created = layout.insertSplit(P1, Orientation.HORIZONTAL, WidgetId.of("logs"), 0.5);

    assertEquals(Optional.of(P3), created);
    assertEquals(3, layout.paneIds().size());
    assertEquals(Optional.empty(), layout.maximizedPane());
  }

  @Test
  void removingSolePaneFailsWithLastPane() {
    TreeState before = layout.snapshot();

    assertFalse(layout.removePane(P1));

    assertEquals(LayoutError.Kind.LAST_PANE, layout.lastFailure().orElseThrow().kind());
    assertEquals(before, layout.snapshot());
  }

  @Test
  void transactionWithInvalidRatiosEmitsNoChange() {
    layout.insertSplit(P1, Orientation.HORIZONTAL, WidgetId.of("b"), 0.5);
    NodeId split = ((SplitNode) layout.snapshot().root()).nodeId();
    TreeState before = layout.snapshot();
    TestSubscriber<LayoutSignal.Changed> changed =
        layout.signals(LayoutSignal.Changed.class).test();

    boolean ok =
        layout.runTransaction(
            "resize",
            tx -> {
              tx.execute(new SetRatiosCommand(split, List.of(0.3, 0.7)));
              tx.execute(new SetRatiosCommand(split, List.of(0.9, 0.6)));
            });

    assertFalse(ok);
    assertEquals(LayoutError.Kind.INVALID_RATIOS, layout.lastFailure().orElseThrow().kind());
    assertEquals(before, layout.snapshot());
    changed.assertNoValues();
  }

  @Test
  void ratioDragCollapsesIntoOneUndoStepWithSameClockInstant() {
    layout.insertSplit(P1, Orientation.HORIZONTAL, WidgetId.of("b"), 0.5);
    NodeId split = ((SplitNode) layout.snapshot().root()).nodeId();

    layout.setRatios(split, List.of(0.4, 0.6));
    layout.setRatios(split, List.of(0.35, 0.65));
    layout.setRatios(split, List.of(0.3, 0.7));

    assertEquals(2, layout.controller().undoDepth());
    assertTrue(layout.undo());
    assertEquals(List.of(0.5, 0.5), ((SplitNode) layout.snapshot().root()).ratios());
    assertTrue(layout.redo());
    assertEquals(List.of(0.3, 0.7), ((SplitNode) layout.snapshot().root()).ratios());
  }

  @Test
  void navigationAndCyclingMoveFocus() {
    layout.insertSplit(P1, Orientation.HORIZONTAL, WidgetId.of("b"), 0.5);
    layout.insertSplit(P2, Orientation.VERTICAL, WidgetId.of("c"), 0.5);

    assertTrue(layout.navigateFocus(Direction.RIGHT));
    assertEquals(Optional.of(P2), layout.focusedPane());
    assertTrue(layout.navigateFocus(Direction.DOWN));
    assertEquals(Optional.of(P3), layout.focusedPane());
    assertFalse(layout.navigateFocus(Direction.DOWN));

    assertTrue(layout.focusNext());
    assertEquals(Optional.of(P1), layout.focusedPane());
    assertTrue(layout.focusPrevious());
    assertEquals(Optional.of(P3), layout.focusedPane());
  }

  @Test
  void constraintsFeedGeometryAndUndo() {
    layout.insertSplit(P1, Orientation.HORIZONTAL, WidgetId.of("b"), 0.9);

    assertTrue(layout.setConstraints(P2, new SizeConstraints(300, 0)));
    assertEquals(300, layout.geometry(Rect.of(0, 0, 1000, 500)).panes().get(P2).width());

    assertTrue(layout.undo());
    assertEquals(100, layout.geometry(Rect.of(0, 0, 1000, 500)).panes().get(P2).width());
  }

  @Test
  void reconcileAgainstEarlierSnapshot() {
    TreeState single = layout.snapshot();
    layout.insertSplit(P1, Orientation.VERTICAL, WidgetId.of("terminal"), 0.5);

    assertThat(layout.reconcile(single))
        .containsExactly(new ReconcileOperation.Create(P2, WidgetId.of("terminal")));
  }

  @Test
  void saveAndLoadRoundTripsThroughFile() throws Exception {
    layout.insertSplit(P1, Orientation.HORIZONTAL, WidgetId.of("b"), 0.25);
    layout.focusPane(P2);
    layout.toggleMaximize();
    TreeState saved = layout.snapshot();
    Path file = tempDir.resolve("layout.json");
    layout.saveLayout(file);

    PaneLayout other = PaneLayoutFactory.standalone().create();
    other.loadLayout(file);

    assertEquals(saved.root(), other.snapshot().root());
    assertEquals(Optional.of(P2), other.focusedPane());
    assertEquals(Optional.empty(), other.maximizedPane());
    assertFalse(other.canUndo());
  }

  @Test
  void loadingClearsHistoryAndRejectsBadInput() throws Exception {
    String json = layout.toJson();
    layout.insertSplit(P1, Orientation.HORIZONTAL, WidgetId.of("b"), 0.5);
    assertTrue(layout.canUndo());

    layout.fromJson(json);

    assertEquals(List.of(P1), layout.paneIds());
    assertFalse(layout.canUndo());
    assertThrows(LayoutFormatException.class, () -> layout.fromJson("{\"version\": \"9\"}"));
    assertEquals(List.of(P1), layout.paneIds());
  }

  @Test
  void newPaneAfterLoadSkipsIdsAlreadyInUse() throws Exception {
    layout.insertSplit(P1, Orientation.HORIZONTAL, WidgetId.of("b"), 0.5);
    layout.insertSplit(P2, Orientation.HORIZONTAL, WidgetId.of("c"), 0.5);
    String json = layout.toJson();

    PaneLayout fresh = PaneLayoutFactory.standalone().create();
    fresh.fromJson(json);
    Optional<PaneId> created = fresh.insertSplit(P3, Orientation.VERTICAL, WidgetId.of("d"), 0.5);

    assertEquals(Optional.of(PaneId.of("pane-4")), created);
    assertTrue(fresh.validate().isEmpty());
  }

  @Test
  void loadingDuringTransactionIsAProgrammingError() {
    String json = layout.toJson();

    try (var tx = layout.beginTransaction("open")) {
      assertThrows(IllegalStateException.class, () -> layout.fromJson(json));
    }
  }
}
