package cafe.woden.multisplit.api;

import java.util.Optional;

/** Where a new pane is placed relative to the pane being split. */
public enum WherePosition {
  LEFT,
  RIGHT,
  TOP,
  BOTTOM,
  /** Insert before the target inside its parent split. */
  BEFORE,
  /** Insert after the target inside its parent split. */
  AFTER,
  /** Replace the target pane with a new one. */
  REPLACE;

  /** Orientation of the split this position creates, if it creates one. */
  public Optional<Orientation> orientation() {
    return switch (this) {
      case LEFT, RIGHT -> Optional.of(Orientation.HORIZONTAL);
      case TOP, BOTTOM -> Optional.of(Orientation.VERTICAL);
      default -> Optional.empty();
    };
  }

  public boolean newPaneFirst() {
    return this == LEFT || this == TOP || this == BEFORE;
  }

  /** Position used by a plain orientation split: the new pane goes after the target. */
  public static WherePosition after(Orientation orientation) {
    return orientation == Orientation.HORIZONTAL ? RIGHT : BOTTOM;
  }
}
