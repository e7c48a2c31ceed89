package cafe.woden.multisplit.signal;

import cafe.woden.multisplit.api.PaneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Notifications published by a pane tree.
 *
 * <p>Per mutation the order is fixed: {@link AboutToChange} before anything is applied, then
 * {@link Changed}, then {@link LayoutChanged}. Focus moves add {@link NodeChanged}; maximize
 * toggles add {@link MaximizeChanged}. Inside a transaction the structural trio is published once.
 */
public sealed interface LayoutSignal
    permits LayoutSignal.AboutToChange,
        LayoutSignal.Changed,
        LayoutSignal.LayoutChanged,
        LayoutSignal.NodeChanged,
        LayoutSignal.MaximizeChanged,
        LayoutSignal.FocusChanged,
        LayoutSignal.PaneAdded,
        LayoutSignal.PaneRemoved,
        LayoutSignal.CommandExecuted,
        LayoutSignal.CommandUndone {

  record AboutToChange() implements LayoutSignal {}

  record Changed() implements LayoutSignal {}

  record LayoutChanged() implements LayoutSignal {}

  record NodeChanged(PaneId paneId) implements LayoutSignal {
    public NodeChanged {
      Objects.requireNonNull(paneId, "paneId");
    }
  }

  record MaximizeChanged(Optional<PaneId> maximized) implements LayoutSignal {
    public MaximizeChanged {
      maximized = maximized == null ? Optional.empty() : maximized;
    }
  }

  /** Either side may be null when there was (or is) no focused pane. */
  record FocusChanged(PaneId previous, PaneId current) implements LayoutSignal {}

  record PaneAdded(PaneId paneId) implements LayoutSignal {}

  record PaneRemoved(PaneId paneId) implements LayoutSignal {}

  record CommandExecuted(String description) implements LayoutSignal {
    public CommandExecuted {
      description = Objects.toString(description, "");
    }
  }

  record CommandUndone(String description) implements LayoutSignal {
    public CommandUndone {
      description = Objects.toString(description, "");
    }
  }
}
