package cafe.woden.multisplit.geometry;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one geometry pass. Independent of the tree it was computed from.
 *
 * @param panes leaf rectangles in depth-first order
 * @param splits rectangle assigned to each split node
 * @param overflow true when some split could not fit its children's minimum sizes
 */
public record LayoutGeometry(
    Rect bounds,
    Map<PaneId, Rect> panes,
    Map<NodeId, Rect> splits,
    List<Divider> dividers,
    boolean overflow) {

  public static LayoutGeometry empty(Rect bounds) {
    return new LayoutGeometry(bounds, Map.of(), Map.of(), List.of(), false);
  }

  public LayoutGeometry {
    panes = Collections.unmodifiableMap(new LinkedHashMap<>(panes));
    splits = Collections.unmodifiableMap(new LinkedHashMap<>(splits));
    dividers = List.copyOf(dividers);
  }

  public Optional<Rect> paneRect(PaneId paneId) {
    return Optional.ofNullable(panes.get(paneId));
  }

  public long paneArea() {
    long total = 0;
    for (Rect r : panes.values()) total += r.area();
    return total;
  }
}
