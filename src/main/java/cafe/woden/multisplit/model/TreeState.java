package cafe.woden.multisplit.model;

import cafe.woden.multisplit.api.PaneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a pane tree: its root plus the focused and maximized pane ids.
 *
 * <p>Focus and maximize are plain ids looked up on demand; a lookup miss means "no pane".
 */
public record TreeState(PaneNode root, PaneId focusedPaneId, PaneId maximizedPaneId) {

  public static final TreeState EMPTY = new TreeState(null, null, null);

  public static TreeState of(PaneNode root) {
    PaneId first = root == null ? null : PaneTrees.firstLeaf(root).paneId();
    return new TreeState(root, first, null);
  }

  public Optional<PaneNode> rootNode() {
    return Optional.ofNullable(root);
  }

  public Optional<PaneId> focused() {
    return Optional.ofNullable(focusedPaneId);
  }

  public Optional<PaneId> maximized() {
    return Optional.ofNullable(maximizedPaneId);
  }

  public boolean isEmpty() {
    return root == null;
  }

  public TreeState withRoot(PaneNode nextRoot) {
    return new TreeState(nextRoot, focusedPaneId, maximizedPaneId);
  }

  public TreeState withFocus(PaneId nextFocus) {
    return new TreeState(root, nextFocus, maximizedPaneId);
  }

  public TreeState withMaximized(PaneId nextMaximized) {
    return new TreeState(root, focusedPaneId, nextMaximized);
  }

  /** Equal structure, ids and focus state, with ratios compared within {@code tolerance}. */
  public boolean structurallyEquals(TreeState other, double tolerance) {
    if (other == null) return false;
    if (!Objects.equals(focusedPaneId, other.focusedPaneId)) return false;
    if (!Objects.equals(maximizedPaneId, other.maximizedPaneId)) return false;
    return PaneTrees.structurallyEquals(root, other.root, tolerance);
  }
}
