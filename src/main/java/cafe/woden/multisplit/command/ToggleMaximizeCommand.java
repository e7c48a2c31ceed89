package cafe.woden.multisplit.command;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.LayoutResult;
import cafe.woden.multisplit.model.PaneTree;
import java.util.Optional;

/** Maximizes the focused pane, or restores it if it is the maximized one. */
public final class ToggleMaximizeCommand extends AbstractPaneCommand {

  private PaneId toggled;
  private PaneId previousFocus;
  private PaneId previousMaximized;

  public Optional<PaneId> toggledPaneId() {
    return Optional.ofNullable(toggled);
  }

  @Override
  protected boolean doExecute(PaneTree tree) {
    Optional<PaneId> focused = tree.focusedPaneId();
    if (focused.isEmpty()) return refuse(LayoutError.paneNotFound(null));
    PaneId focusBefore = focused.get();
    PaneId maximizedBefore = tree.maximizedPaneId().orElse(null);
    LayoutResult<Optional<PaneId>> result = tree.toggleMaximize(focusBefore);
    if (!result.isOk()) return refuse(result);
    toggled = focusBefore;
    previousFocus = focusBefore;
    previousMaximized = maximizedBefore;
    return true;
  }

  @Override
  protected boolean doUndo(PaneTree tree) {
    var result = tree.restoreFocusState(previousFocus, previousMaximized);
    if (!result.isOk()) return refuse(result);
    return true;
  }

  @Override
  public String description() {
    return toggled == null ? "Toggle maximize" : "Toggle maximize " + toggled;
  }
}
