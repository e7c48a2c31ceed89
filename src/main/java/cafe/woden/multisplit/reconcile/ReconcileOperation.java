package cafe.woden.multisplit.reconcile;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;
import cafe.woden.multisplit.api.WidgetId;
import java.util.Objects;

/** One widget lifecycle step a view must apply to go from one rendered tree to the next. */
public sealed interface ReconcileOperation
    permits ReconcileOperation.Create,
        ReconcileOperation.Destroy,
        ReconcileOperation.Move,
        ReconcileOperation.UpdateRect {

  PaneId paneId();

  /** A pane appeared; its widget must be provided. */
  record Create(PaneId paneId, WidgetId widgetId) implements ReconcileOperation {
    public Create {
      Objects.requireNonNull(paneId, "paneId");
      Objects.requireNonNull(widgetId, "widgetId");
    }
  }

  /** A pane disappeared; its widget must be released. */
  record Destroy(PaneId paneId) implements ReconcileOperation {
    public Destroy {
      Objects.requireNonNull(paneId, "paneId");
    }
  }

  /** A surviving pane changed its position relative to the other survivors. */
  record Move(PaneId paneId) implements ReconcileOperation {
    public Move {
      Objects.requireNonNull(paneId, "paneId");
    }
  }

  /** A pane must be placed at a new rectangle. */
  record UpdateRect(PaneId paneId, Rect rect) implements ReconcileOperation {
    public UpdateRect {
      Objects.requireNonNull(paneId, "paneId");
      Objects.requireNonNull(rect, "rect");
    }
  }
}
