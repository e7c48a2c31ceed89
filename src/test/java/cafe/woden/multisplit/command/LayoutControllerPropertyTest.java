package cafe.woden.multisplit.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.WherePosition;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.PaneTrees;
import cafe.woden.multisplit.model.SplitNode;
import cafe.woden.multisplit.model.TreeState;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class LayoutControllerPropertyTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  @Test
  void randomCommandSequencesKeepTreeValidAndUndoToStart() {
    Random random = new Random(0x5B117L);
    for (int run = 0; run < 200; run++) {
      PaneTree tree = new PaneTree();
      LayoutController controller = new LayoutController(tree, 1_000);
      tree.initialize(WidgetId.of("w0"));
      TreeState start = tree.snapshot();
      List<String> trail = new ArrayList<>();

      for (int step = 0; step < 40; step++) {
        String applied = applyRandomCommand(random, tree, controller, step);
        trail.add(applied);
        List<String> violations = tree.validate();
        assertTrue(violations.isEmpty(), () -> "after " + trail + ": " + violations);
        assertUniquePaneIds(tree, trail);
      }

      while (controller.canUndo()) {
        assertTrue(controller.undo(), () -> "undo failed after " + trail);
        assertTrue(tree.validate().isEmpty(), () -> "invalid tree while undoing " + trail);
      }
      TreeState end = tree.snapshot();
      final int r = run;
      assertTrue(
          PaneTrees.structurallyEquals(start.root(), end.root(), PaneTrees.RATIO_TOLERANCE),
          () -> "run " + r + " did not undo back to the start: " + trail);
      assertEquals(start.focusedPaneId(), end.focusedPaneId());
      assertEquals(start.maximizedPaneId(), end.maximizedPaneId());
    }
  }

  private static String applyRandomCommand(
      Random random, PaneTree tree, LayoutController controller, int step) {
    List<PaneId> panes = tree.paneIds();
    PaneId pane = panes.get(random.nextInt(panes.size()));
    switch (random.nextInt(6)) {
      case 0 -> {
        WherePosition[] positions = WherePosition.values();
        WherePosition position = positions[random.nextInt(positions.length)];
        double ratio = 0.05 + 0.9 * random.nextDouble();
        controller.execute(
            new SplitCommand(pane, position, WidgetId.of("w" + (step + 1)), ratio));
        return "split " + pane + " " + position;
      }
      case 1 -> {
        controller.execute(new RemoveCommand(pane));
        return "remove " + pane;
      }
      case 2 -> {
        controller.execute(new SetFocusCommand(pane));
        return "focus " + pane;
      }
      case 3 -> {
        controller.execute(new ToggleMaximizeCommand());
        return "toggle maximize";
      }
      case 4 -> {
        List<SplitNode> splits = PaneTrees.splits(tree.snapshot().root());
        if (splits.isEmpty()) return "no split to resize";
        SplitNode split = splits.get(random.nextInt(splits.size()));
        NodeId nodeId = split.nodeId();
        controller.execute(
            new SetRatiosCommand(
                nodeId,
                randomRatios(random, split.size()),
                T0.plusSeconds(step),
                Duration.ofMillis(500)));
        return "resize " + nodeId;
      }
      default -> {
        controller.undo();
        return "undo";
      }
    }
  }

  private static List<Double> randomRatios(Random random, int count) {
    List<Double> weights = new ArrayList<>(count);
    double total = 0;
    for (int i = 0; i < count; i++) {
      double w = 1 + random.nextInt(9);
      weights.add(w);
      total += w;
    }
    List<Double> ratios = new ArrayList<>(count);
    for (double w : weights) ratios.add(w / total);
    return ratios;
  }

  private static void assertUniquePaneIds(PaneTree tree, List<String> trail) {
    List<PaneId> ids = tree.paneIds();
    assertEquals(ids.size(), new HashSet<>(ids).size(), () -> "duplicate pane id after " + trail);
  }
}
