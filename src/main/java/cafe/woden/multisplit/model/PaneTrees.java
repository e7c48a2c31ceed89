package cafe.woden.multisplit.model;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.PaneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/** Pure queries and copy-on-write transforms over immutable {@link PaneNode} trees. */
public final class PaneTrees {

  /** Allowed deviation of a split's ratio sum from 1.0. */
  public static final double RATIO_TOLERANCE = 1e-3;

  private PaneTrees() {}

  /** Leaves in depth-first order. */
  public static List<LeafNode> leaves(PaneNode root) {
    if (root == null) return List.of();
    List<LeafNode> out = new ArrayList<>();
    collectLeaves(root, out);
    return Collections.unmodifiableList(out);
  }

  private static void collectLeaves(PaneNode node, List<LeafNode> out) {
    if (node instanceof LeafNode leaf) {
      out.add(leaf);
    } else if (node instanceof SplitNode split) {
      for (PaneNode child : split.children()) collectLeaves(child, out);
    }
  }

  public static List<PaneId> paneIds(PaneNode root) {
    return leaves(root).stream().map(LeafNode::paneId).toList();
  }

  public static List<SplitNode> splits(PaneNode root) {
    if (root == null) return List.of();
    List<SplitNode> out = new ArrayList<>();
    collectSplits(root, out);
    return Collections.unmodifiableList(out);
  }

  private static void collectSplits(PaneNode node, List<SplitNode> out) {
    if (node instanceof SplitNode split) {
      out.add(split);
      for (PaneNode child : split.children()) collectSplits(child, out);
    }
  }

  public static LeafNode firstLeaf(PaneNode node) {
    PaneNode cur = Objects.requireNonNull(node, "node");
    while (cur instanceof SplitNode split) {
      cur = split.children().get(0);
    }
    return (LeafNode) cur;
  }

  public static LeafNode lastLeaf(PaneNode node) {
    PaneNode cur = Objects.requireNonNull(node, "node");
    while (cur instanceof SplitNode split) {
      cur = split.children().get(split.children().size() - 1);
    }
    return (LeafNode) cur;
  }

  public static Optional<LeafNode> findLeaf(PaneNode root, PaneId paneId) {
    if (root == null || paneId == null) return Optional.empty();
    if (root instanceof LeafNode leaf) {
      return leaf.paneId().equals(paneId) ? Optional.of(leaf) : Optional.empty();
    }
    for (PaneNode child : ((SplitNode) root).children()) {
      Optional<LeafNode> found = findLeaf(child, paneId);
      if (found.isPresent()) return found;
    }
    return Optional.empty();
  }

  public static Optional<SplitNode> findSplit(PaneNode root, NodeId nodeId) {
    if (!(root instanceof SplitNode split) || nodeId == null) return Optional.empty();
    if (split.nodeId().equals(nodeId)) return Optional.of(split);
    for (PaneNode child : split.children()) {
      Optional<SplitNode> found = findSplit(child, nodeId);
      if (found.isPresent()) return found;
    }
    return Optional.empty();
  }

  /** The split that directly contains the leaf, or empty when the leaf is the root or absent. */
  public static Optional<SplitNode> parentOf(PaneNode root, PaneId paneId) {
    if (!(root instanceof SplitNode split) || paneId == null) return Optional.empty();
    for (PaneNode child : split.children()) {
      if (child instanceof LeafNode leaf && leaf.paneId().equals(paneId)) return Optional.of(split);
    }
    for (PaneNode child : split.children()) {
      Optional<SplitNode> found = parentOf(child, paneId);
      if (found.isPresent()) return found;
    }
    return Optional.empty();
  }

  public static int indexOfLeaf(SplitNode parent, PaneId paneId) {
    List<PaneNode> children = parent.children();
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) instanceof LeafNode leaf && leaf.paneId().equals(paneId)) return i;
    }
    return -1;
  }

  public static int depth(PaneNode node) {
    if (node == null) return 0;
    if (node instanceof LeafNode) return 1;
    int max = 0;
    for (PaneNode child : ((SplitNode) node).children()) {
      max = Math.max(max, depth(child));
    }
    return 1 + max;
  }

  /** Describes what is wrong with {@code ratios} for a split of {@code expectedCount}, if anything. */
  public static Optional<String> ratioProblem(List<Double> ratios, int expectedCount) {
    if (ratios == null || ratios.isEmpty()) return Optional.of("no ratios");
    if (ratios.size() != expectedCount) {
      return Optional.of("expected " + expectedCount + " ratios but got " + ratios.size());
    }
    double sum = 0;
    for (Double r : ratios) {
      if (r == null || r.isNaN() || r.isInfinite()) return Optional.of("non-finite ratio");
      if (r <= 0) return Optional.of("ratios must be positive");
      sum += r;
    }
    if (Math.abs(sum - 1.0) > RATIO_TOLERANCE) {
      return Optional.of("ratios sum to " + sum + ", expected 1.0");
    }
    return Optional.empty();
  }

  public static List<Double> normalize(List<Double> ratios) {
    double total = 0;
    for (double r : ratios) total += r;
    List<Double> out = new ArrayList<>(ratios.size());
    if (total <= 0) {
      for (int i = 0; i < ratios.size(); i++) out.add(1.0 / ratios.size());
      return List.copyOf(out);
    }
    for (double r : ratios) out.add(r / total);
    return List.copyOf(out);
  }

  public static List<Double> equalRatios(int count) {
    List<Double> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) out.add(1.0 / count);
    return List.copyOf(out);
  }

  /** Replaces the leaf {@code paneId} with {@code fn(leaf)}. Returns {@code root} if not found. */
  public static PaneNode replaceLeaf(
      PaneNode root, PaneId paneId, UnaryOperator<PaneNode> fn) {
    if (root instanceof LeafNode leaf) {
      return leaf.paneId().equals(paneId) ? fn.apply(leaf) : leaf;
    }
    SplitNode split = (SplitNode) root;
    List<PaneNode> next = new ArrayList<>(split.children().size());
    boolean changed = false;
    for (PaneNode child : split.children()) {
      PaneNode replaced = replaceLeaf(child, paneId, fn);
      changed |= replaced != child;
      next.add(replaced);
    }
    return changed ? split.withChildren(next, split.ratios()) : split;
  }

  /** Replaces the split {@code nodeId} with {@code fn(split)}. Returns {@code root} if not found. */
  public static PaneNode replaceSplit(
      PaneNode root, NodeId nodeId, UnaryOperator<SplitNode> fn) {
    if (!(root instanceof SplitNode split)) return root;
    if (split.nodeId().equals(nodeId)) return fn.apply(split);
    List<PaneNode> next = new ArrayList<>(split.children().size());
    boolean changed = false;
    for (PaneNode child : split.children()) {
      PaneNode replaced = replaceSplit(child, nodeId, fn);
      changed |= replaced != child;
      next.add(replaced);
    }
    return changed ? split.withChildren(next, split.ratios()) : split;
  }

  /**
   * Removes the leaf {@code paneId}. A split left with a single child collapses into that child;
   * the survivors of a split that keeps two or more children have their ratios renormalised.
   *
   * @return the new root, or {@code null} when the removed leaf was the root
   */
  public static PaneNode removeLeaf(PaneNode root, PaneId paneId) {
    if (root instanceof LeafNode leaf) {
      return leaf.paneId().equals(paneId) ? null : leaf;
    }
    SplitNode split = (SplitNode) root;
    List<PaneNode> keptChildren = new ArrayList<>(split.children().size());
    List<Double> keptRatios = new ArrayList<>(split.children().size());
    boolean changed = false;
    boolean dropped = false;
    for (int i = 0; i < split.children().size(); i++) {
      PaneNode child = split.children().get(i);
      PaneNode next = removeLeaf(child, paneId);
      if (next == null) {
        changed = true;
        dropped = true;
        continue;
      }
      changed |= next != child;
      keptChildren.add(next);
      keptRatios.add(split.ratios().get(i));
    }
    if (!changed) return split;
    if (keptChildren.isEmpty()) return null;
    if (keptChildren.size() == 1) return keptChildren.get(0);
    return split.withChildren(keptChildren, dropped ? normalize(keptRatios) : keptRatios);
  }

  public static boolean structurallyEquals(PaneNode a, PaneNode b, double tolerance) {
    if (a == null || b == null) return a == b;
    if (a instanceof LeafNode la) {
      return b instanceof LeafNode lb && la.equals(lb);
    }
    if (!(b instanceof SplitNode sb)) return false;
    SplitNode sa = (SplitNode) a;
    if (!sa.nodeId().equals(sb.nodeId()) || sa.orientation() != sb.orientation()) return false;
    if (sa.size() != sb.size() || sa.ratios().size() != sb.ratios().size()) return false;
    for (int i = 0; i < sa.ratios().size(); i++) {
      if (Math.abs(sa.ratios().get(i) - sb.ratios().get(i)) > tolerance) return false;
    }
    for (int i = 0; i < sa.size(); i++) {
      if (!structurallyEquals(sa.children().get(i), sb.children().get(i), tolerance)) return false;
    }
    return true;
  }
}
