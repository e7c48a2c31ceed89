package cafe.woden.multisplit.model;

import cafe.woden.multisplit.api.PaneId;
import java.util.List;
import java.util.Objects;

/** Why a tree operation was refused. */
public record LayoutError(Kind kind, String message, PaneId paneId) {

  public enum Kind {
    /** The operation referenced a pane or split absent from the tree. */
    PANE_NOT_FOUND,
    /** Ratios failed the length, positivity or sum check. */
    INVALID_RATIOS,
    /** Removal of the only remaining pane. */
    LAST_PANE,
    /** A candidate tree broke a structural invariant. Indicates a bug, not a user error. */
    INVALID_STRUCTURE,
    /** Focus is pinned to the maximized pane. */
    FOCUS_LOCKED,
    /** The requested state change is not a legal transition from the current state. */
    INVALID_TRANSITION
  }

  public LayoutError {
    Objects.requireNonNull(kind, "kind");
    message = Objects.toString(message, "");
  }

  public static LayoutError paneNotFound(PaneId paneId) {
    return new LayoutError(Kind.PANE_NOT_FOUND, "pane not found: " + paneId, paneId);
  }

  public static LayoutError splitNotFound(Object nodeId) {
    return new LayoutError(Kind.PANE_NOT_FOUND, "split not found: " + nodeId, null);
  }

  public static LayoutError invalidRatios(List<Double> ratios, String reason) {
    return new LayoutError(Kind.INVALID_RATIOS, "invalid ratios " + ratios + ": " + reason, null);
  }

  public static LayoutError lastPane(PaneId paneId) {
    return new LayoutError(Kind.LAST_PANE, "cannot remove the last pane: " + paneId, paneId);
  }

  public static LayoutError invalidStructure(List<String> violations) {
    return new LayoutError(Kind.INVALID_STRUCTURE, String.join("; ", violations), null);
  }

  public static LayoutError focusLocked(PaneId requested, PaneId maximized) {
    return new LayoutError(
        Kind.FOCUS_LOCKED,
        "focus is locked to maximized pane " + maximized + ", refused " + requested,
        requested);
  }

  public static LayoutError invalidTransition(String message, PaneId paneId) {
    return new LayoutError(Kind.INVALID_TRANSITION, message, paneId);
  }
}
