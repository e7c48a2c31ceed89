package cafe.woden.multisplit.reconcile;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;
import cafe.woden.multisplit.geometry.LayoutGeometry;
import cafe.woden.multisplit.model.LeafNode;
import cafe.woden.multisplit.model.PaneNode;
import cafe.woden.multisplit.model.PaneTrees;
import cafe.woden.multisplit.model.TreeState;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the widget lifecycle operations that turn a previously rendered tree into a new one.
 *
 * <p>Leaves are matched by {@link PaneId}, never by position: a pane present in both trees is
 * never destroyed and recreated, however its surrounding splits changed. Split nodes carry no
 * identity here. Operations come out grouped and ordered as {@code Destroy} (old tree order),
 * {@code Create}, {@code Move}, {@code UpdateRect} (new tree order).
 *
 * <p>A survivor is moved when its order relative to the other survivors changed; the survivors
 * along the longest run that kept its order stay put.
 *
 * <p>Stateless and safe to share.
 */
public final class TreeReconciler {

  private static final Logger log = LoggerFactory.getLogger(TreeReconciler.class);

  public List<ReconcileOperation> reconcile(TreeState previous, TreeState next) {
    return reconcile(
        previous == null ? null : previous.root(), next == null ? null : next.root());
  }

  /** Structural diff only: create, destroy and move. */
  public List<ReconcileOperation> reconcile(PaneNode previous, PaneNode next) {
    return reconcile(previous, next, null, null);
  }

  /**
   * Structural diff plus an {@code UpdateRect} for every created pane and every survivor whose
   * rectangle differs between the two geometries. Either geometry may be null.
   */
  public List<ReconcileOperation> reconcile(
      PaneNode previous,
      PaneNode next,
      LayoutGeometry previousGeometry,
      LayoutGeometry nextGeometry) {
    Map<PaneId, LeafNode> before = index(previous);
    Map<PaneId, LeafNode> after = index(next);

    List<ReconcileOperation> destroys = new ArrayList<>();
    List<ReconcileOperation> creates = new ArrayList<>();
    List<PaneId> survivorsInOldOrder = new ArrayList<>();
    for (PaneId id : before.keySet()) {
      if (after.containsKey(id)) {
        survivorsInOldOrder.add(id);
      } else {
        destroys.add(new ReconcileOperation.Destroy(id));
      }
    }
    for (LeafNode leaf : after.values()) {
      if (!before.containsKey(leaf.paneId())) {
        creates.add(new ReconcileOperation.Create(leaf.paneId(), leaf.widgetId()));
      }
    }

    Set<PaneId> moved = movedSurvivors(survivorsInOldOrder, new ArrayList<>(after.keySet()));
    List<ReconcileOperation> moves = new ArrayList<>();
    List<ReconcileOperation> rects = new ArrayList<>();
    for (PaneId id : after.keySet()) {
      if (moved.contains(id)) moves.add(new ReconcileOperation.Move(id));
      if (nextGeometry == null) continue;
      Rect nextRect = nextGeometry.panes().get(id);
      if (nextRect == null) continue;
      Rect previousRect =
          (previousGeometry == null || !before.containsKey(id))
              ? null
              : previousGeometry.panes().get(id);
      if (!Objects.equals(previousRect, nextRect)) {
        rects.add(new ReconcileOperation.UpdateRect(id, nextRect));
      }
    }

    List<ReconcileOperation> out =
        new ArrayList<>(destroys.size() + creates.size() + moves.size() + rects.size());
    out.addAll(destroys);
    out.addAll(creates);
    out.addAll(moves);
    out.addAll(rects);
    if (log.isDebugEnabled() && !out.isEmpty()) {
      log.debug(
          "[multisplit] reconcile: destroy={} create={} move={} rect={}",
          destroys.size(),
          creates.size(),
          moves.size(),
          rects.size());
    }
    return List.copyOf(out);
  }

  private static Map<PaneId, LeafNode> index(PaneNode root) {
    Map<PaneId, LeafNode> out = new LinkedHashMap<>();
    for (LeafNode leaf : PaneTrees.leaves(root)) out.put(leaf.paneId(), leaf);
    return out;
  }

  /**
   * Survivors outside the longest subsequence whose new-tree order matches their old-tree order.
   */
  static Set<PaneId> movedSurvivors(List<PaneId> survivorsInOldOrder, List<PaneId> newOrder) {
    int n = survivorsInOldOrder.size();
    if (n < 2) return Set.of();
    Map<PaneId, Integer> newIndex = new LinkedHashMap<>();
    for (int i = 0; i < newOrder.size(); i++) newIndex.put(newOrder.get(i), i);

    int[] seq = new int[n];
    for (int i = 0; i < n; i++) seq[i] = newIndex.get(survivorsInOldOrder.get(i));

    // Patience sorting: tails[k] is the index into seq of the smallest tail of a run of length k+1.
    int[] tails = new int[n];
    int[] prev = new int[n];
    Arrays.fill(prev, -1);
    int length = 0;
    for (int i = 0; i < n; i++) {
      int lo = 0;
      int hi = length;
      while (lo < hi) {
        int mid = (lo + hi) >>> 1;
        if (seq[tails[mid]] < seq[i]) lo = mid + 1;
        else hi = mid;
      }
      if (lo > 0) prev[i] = tails[lo - 1];
      tails[lo] = i;
      if (lo == length) length++;
    }

    Set<PaneId> stable = new HashSet<>();
    for (int i = tails[length - 1]; i >= 0; i = prev[i]) {
      stable.add(survivorsInOldOrder.get(i));
    }
    Set<PaneId> moved = new HashSet<>();
    for (PaneId id : survivorsInOldOrder) {
      if (!stable.contains(id)) moved.add(id);
    }
    return moved;
  }
}
