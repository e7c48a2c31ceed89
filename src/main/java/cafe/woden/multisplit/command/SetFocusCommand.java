package cafe.woden.multisplit.command;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.model.LayoutResult;
import cafe.woden.multisplit.model.PaneTree;
import java.util.Optional;

/**
 * Moves focus to a pane. Moving away from a maximized pane restores it (or is refused, under the
 * lock policy). Focusing the pane that already has focus does nothing and reports false with no
 * failure; a transaction skips it.
 */
public final class SetFocusCommand extends AbstractPaneCommand {

  private final PaneId paneId;

  private PaneId previousFocus;
  private PaneId previousMaximized;

  public SetFocusCommand(PaneId paneId) {
    this.paneId = paneId;
  }

  public PaneId paneId() {
    return paneId;
  }

  @Override
  protected boolean doExecute(PaneTree tree) {
    if (paneId != null && tree.focusedPaneId().equals(Optional.of(paneId))) return false;
    PaneId focusBefore = tree.focusedPaneId().orElse(null);
    PaneId maximizedBefore = tree.maximizedPaneId().orElse(null);
    LayoutResult<PaneId> result = tree.setFocus(paneId);
    if (!result.isOk()) return refuse(result);
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
    return "Focus pane " + paneId;
  }
}
