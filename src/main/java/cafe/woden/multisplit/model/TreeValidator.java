package cafe.woden.multisplit.model;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.PaneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Read-only structural self-check of a {@link TreeState}. */
public final class TreeValidator {

  private TreeValidator() {}

  /** Returns one message per violated invariant; empty when the state is valid. */
  public static List<String> validate(TreeState state) {
    List<String> violations = new ArrayList<>();
    if (state == null) {
      violations.add("state is null");
      return violations;
    }
    Set<PaneId> panes = new HashSet<>();
    Set<NodeId> splits = new HashSet<>();
    if (state.root() != null) {
      visit(state.root(), panes, splits, violations);
    }
    if (state.focusedPaneId() != null && !panes.contains(state.focusedPaneId())) {
      violations.add("focused pane " + state.focusedPaneId() + " does not exist");
    }
    if (state.maximizedPaneId() != null && !panes.contains(state.maximizedPaneId())) {
      violations.add("maximized pane " + state.maximizedPaneId() + " does not exist");
    }
    return violations;
  }

  public static boolean isValid(TreeState state) {
    return validate(state).isEmpty();
  }

  private static void visit(
      PaneNode node, Set<PaneId> panes, Set<NodeId> splits, List<String> violations) {
    if (node instanceof LeafNode leaf) {
      if (!panes.add(leaf.paneId())) {
        violations.add("duplicate pane id " + leaf.paneId());
      }
      return;
    }
    SplitNode split = (SplitNode) node;
    if (!splits.add(split.nodeId())) {
      violations.add("duplicate split id " + split.nodeId());
    }
    if (split.size() < 2) {
      violations.add("split " + split.nodeId() + " has " + split.size() + " children (minimum 2)");
    }
    Optional<String> ratioProblem = PaneTrees.ratioProblem(split.ratios(), split.size());
    ratioProblem.ifPresent(p -> violations.add("split " + split.nodeId() + ": " + p));
    for (PaneNode child : split.children()) {
      visit(child, panes, splits, violations);
    }
  }
}
