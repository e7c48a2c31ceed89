package cafe.woden.multisplit.geometry;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;
import cafe.woden.multisplit.model.LeafNode;
import cafe.woden.multisplit.model.PaneNode;
import cafe.woden.multisplit.model.PaneTrees;
import cafe.woden.multisplit.model.SizeConstraints;
import cafe.woden.multisplit.model.SplitNode;
import cafe.woden.multisplit.model.TreeState;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns split ratios into pixel rectangles.
 *
 * <p>Along a split's axis child {@code i < n} gets {@code round(r_i * E)} and the last child gets
 * whatever is left, so children always cover the extent exactly. The cross axis is passed through
 * unchanged. Children smaller than their minimum are pinned at it and the rest share what remains
 * in proportion to their ratios; if even the minimums do not fit, every child gets its minimum and
 * the result is flagged as overflowing.
 *
 * <p>Stateless and safe to share.
 */
public final class GeometryCalculator {

  private final GeometryOptions options;

  public GeometryCalculator(GeometryOptions options) {
    this.options = options == null ? GeometryOptions.NONE : options;
  }

  public GeometryCalculator() {
    this(GeometryOptions.NONE);
  }

  public GeometryOptions options() {
    return options;
  }

  public LayoutGeometry calculate(PaneNode root, Rect bounds) {
    Objects.requireNonNull(bounds, "bounds");
    if (root == null) return LayoutGeometry.empty(bounds);
    Pass pass = new Pass();
    layout(root, bounds, pass);
    return new LayoutGeometry(bounds, pass.panes, pass.splits, pass.dividers, pass.overflow);
  }

  /** Like {@link #calculate(PaneNode, Rect)}, but a maximized pane takes the whole bounds alone. */
  public LayoutGeometry calculateVisible(TreeState state, Rect bounds) {
    Objects.requireNonNull(state, "state");
    PaneId maximized = state.maximizedPaneId();
    if (maximized != null) {
      var leaf = PaneTrees.findLeaf(state.root(), maximized);
      if (leaf.isPresent()) return calculate(leaf.get(), bounds);
    }
    return calculate(state.root(), bounds);
  }

  /** Smallest extent {@code node} can take along {@code axis}. */
  public int minimumExtent(PaneNode node, Orientation axis) {
    if (node instanceof LeafNode leaf) {
      return effectiveMinimum(leaf).min(axis);
    }
    SplitNode split = (SplitNode) node;
    if (split.orientation() == axis) {
      int sum = options.dividerWidth() * Math.max(0, split.size() - 1);
      for (PaneNode child : split.children()) sum += minimumExtent(child, axis);
      return sum;
    }
    int max = 0;
    for (PaneNode child : split.children()) max = Math.max(max, minimumExtent(child, axis));
    return max;
  }

  private SizeConstraints effectiveMinimum(LeafNode leaf) {
    SizeConstraints own = leaf.constraints();
    SizeConstraints floor = options.minimumPane();
    return new SizeConstraints(
        Math.max(own.minWidth(), floor.minWidth()), Math.max(own.minHeight(), floor.minHeight()));
  }

  private void layout(PaneNode node, Rect rect, Pass pass) {
    if (node instanceof LeafNode leaf) {
      pass.panes.put(leaf.paneId(), rect);
      return;
    }
    SplitNode split = (SplitNode) node;
    pass.splits.put(split.nodeId(), rect);
    Orientation axis = split.orientation();
    int n = split.size();
    int divider = options.dividerWidth();
    int available = Math.max(0, rect.extent(axis) - divider * (n - 1));

    int[] mins = new int[n];
    for (int i = 0; i < n; i++) mins[i] = minimumExtent(split.children().get(i), axis);
    int[] sizes = distribute(split.ratios(), mins, available);
    long used = 0;
    for (int s : sizes) used += s;
    if (used > available) pass.overflow = true;

    int pos = rect.start(axis);
    for (int i = 0; i < n; i++) {
      layout(split.children().get(i), rect.slice(axis, pos, sizes[i]), pass);
      pos += sizes[i];
      if (i < n - 1 && divider > 0) {
        pass.dividers.add(new Divider(split.nodeId(), i, axis, rect.slice(axis, pos, divider)));
        pos += divider;
      }
    }
  }

  /**
   * Splits {@code extent} into one size per ratio, honouring {@code mins}.
   *
   * <p>Without active minimums this is exactly {@code round(r_i * extent)} for all but the last
   * entry, which takes the remainder.
   */
  static int[] distribute(List<Double> ratios, int[] mins, int extent) {
    int n = ratios.size();
    int[] sizes = new int[n];
    long totalMin = 0;
    for (int m : mins) totalMin += m;
    if (totalMin >= extent) {
      System.arraycopy(mins, 0, sizes, 0, n);
      return sizes;
    }

    boolean[] pinned = new boolean[n];
    boolean anyPinned = false;
    while (true) {
      int free = extent;
      double weight = 0;
      int lastFree = -1;
      for (int i = 0; i < n; i++) {
        if (pinned[i]) {
          free -= mins[i];
        } else {
          weight += ratios.get(i);
          lastFree = i;
        }
      }
      if (lastFree < 0) {
        System.arraycopy(mins, 0, sizes, 0, n);
        sizes[n - 1] += free;
        return sizes;
      }

      int used = 0;
      for (int i = 0; i < n; i++) {
        if (pinned[i]) {
          sizes[i] = mins[i];
        } else if (i != lastFree) {
          double share = anyPinned ? ratios.get(i) / weight : ratios.get(i);
          sizes[i] = (int) Math.round(share * free);
          used += sizes[i];
        }
      }
      sizes[lastFree] = free - used;

      boolean violated = false;
      for (int i = 0; i < n; i++) {
        if (!pinned[i] && sizes[i] < mins[i]) {
          pinned[i] = true;
          violated = true;
        }
      }
      if (!violated) return sizes;
      anyPinned = true;
    }
  }

  private static final class Pass {
    private final Map<PaneId, Rect> panes = new LinkedHashMap<>();
    private final Map<NodeId, Rect> splits = new LinkedHashMap<>();
    private final List<Divider> dividers = new ArrayList<>();
    private boolean overflow;
  }
}
