package cafe.woden.multisplit.geometry;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.Rect;

/** Gap between child {@code index} and {@code index + 1} of a split. */
public record Divider(NodeId splitId, int index, Orientation orientation, Rect rect) {}
