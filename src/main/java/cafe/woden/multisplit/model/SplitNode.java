package cafe.woden.multisplit.model;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import java.util.List;
import java.util.Objects;

/**
 * Divides its extent along {@code orientation} among {@code children}, child {@code i} receiving
 * {@code ratios.get(i)} of it.
 *
 * <p>Structural invariants (matching lengths, at least two children, positive ratios summing to
 * one) are checked by {@link TreeValidator}, not here, so that a broken candidate can be reported
 * instead of thrown.
 */
public record SplitNode(
    NodeId nodeId, Orientation orientation, List<Double> ratios, List<PaneNode> children)
    implements PaneNode {

  public SplitNode {
    Objects.requireNonNull(nodeId, "nodeId");
    Objects.requireNonNull(orientation, "orientation");
    ratios = List.copyOf(Objects.requireNonNull(ratios, "ratios"));
    children = List.copyOf(Objects.requireNonNull(children, "children"));
  }

  public SplitNode withRatios(List<Double> next) {
    return new SplitNode(nodeId, orientation, next, children);
  }

  public SplitNode withChildren(List<PaneNode> nextChildren, List<Double> nextRatios) {
    return new SplitNode(nodeId, orientation, nextRatios, nextChildren);
  }

  public int size() {
    return children.size();
  }
}
