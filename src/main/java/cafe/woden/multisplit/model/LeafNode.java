package cafe.woden.multisplit.model;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.WidgetId;
import java.util.Objects;

public record LeafNode(PaneId paneId, WidgetId widgetId, SizeConstraints constraints)
    implements PaneNode {

  public LeafNode {
    Objects.requireNonNull(paneId, "paneId");
    Objects.requireNonNull(widgetId, "widgetId");
    constraints = constraints == null ? SizeConstraints.NONE : constraints;
  }

  public LeafNode(PaneId paneId, WidgetId widgetId) {
    this(paneId, widgetId, SizeConstraints.NONE);
  }

  public LeafNode withConstraints(SizeConstraints next) {
    return new LeafNode(paneId, widgetId, next);
  }
}
