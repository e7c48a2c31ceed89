package cafe.woden.multisplit.geometry;

import cafe.woden.multisplit.api.Direction;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;
import cafe.woden.multisplit.model.PaneTrees;
import cafe.woden.multisplit.model.TreeState;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the pane focus should move to.
 *
 * <p>Spatial moves lay the tree out on a fixed virtual canvas (ratios only, no minimum sizes) and
 * pick, among panes lying entirely beyond the current pane's edge, the one that overlaps it on the
 * perpendicular axis, then the nearest, then the one with the largest overlap, then the earliest in
 * tree order.
 */
public final class FocusNavigator {

  static final Rect CANVAS = new Rect(0, 0, 10_000, 10_000);

  private final GeometryCalculator calculator = new GeometryCalculator(GeometryOptions.NONE);

  public Optional<PaneId> neighbor(TreeState state, PaneId from, Direction direction) {
    if (state == null || state.root() == null || from == null || direction == null) {
      return Optional.empty();
    }
    Map<PaneId, Rect> rects = calculator.calculate(state.root(), CANVAS).panes();
    Rect current = rects.get(from);
    if (current == null) return Optional.empty();

    PaneId best = null;
    int bestOverlapRank = Integer.MAX_VALUE;
    int bestGap = Integer.MAX_VALUE;
    int bestOverlap = Integer.MIN_VALUE;
    for (Map.Entry<PaneId, Rect> e : rects.entrySet()) {
      if (e.getKey().equals(from)) continue;
      Rect candidate = e.getValue();
      int gap = gap(current, candidate, direction);
      if (gap < 0) continue;
      int overlap = overlap(current, candidate, direction.axis());
      int overlapRank = overlap > 0 ? 0 : 1;
      boolean better =
          overlapRank < bestOverlapRank
              || (overlapRank == bestOverlapRank && gap < bestGap)
              || (overlapRank == bestOverlapRank && gap == bestGap && overlap > bestOverlap);
      if (better) {
        best = e.getKey();
        bestOverlapRank = overlapRank;
        bestGap = gap;
        bestOverlap = overlap;
      }
    }
    return Optional.ofNullable(best);
  }

  /** Next pane in depth-first order, wrapping around. */
  public Optional<PaneId> next(TreeState state, PaneId from) {
    return cycle(state, from, 1);
  }

  /** Previous pane in depth-first order, wrapping around. */
  public Optional<PaneId> previous(TreeState state, PaneId from) {
    return cycle(state, from, -1);
  }

  private static Optional<PaneId> cycle(TreeState state, PaneId from, int step) {
    if (state == null) return Optional.empty();
    List<PaneId> order = PaneTrees.paneIds(state.root());
    if (order.size() < 2) return Optional.empty();
    int idx = order.indexOf(from);
    if (idx < 0) return Optional.of(order.get(0));
    return Optional.of(order.get(Math.floorMod(idx + step, order.size())));
  }

  private static int gap(Rect from, Rect to, Direction direction) {
    return switch (direction) {
      case RIGHT -> to.x() - from.right();
      case LEFT -> from.x() - to.right();
      case DOWN -> to.y() - from.bottom();
      case UP -> from.y() - to.bottom();
    };
  }

  private static int overlap(Rect a, Rect b, Orientation movementAxis) {
    if (movementAxis == Orientation.HORIZONTAL) {
      return Math.min(a.bottom(), b.bottom()) - Math.max(a.y(), b.y());
    }
    return Math.min(a.right(), b.right()) - Math.max(a.x(), b.x());
  }
}
