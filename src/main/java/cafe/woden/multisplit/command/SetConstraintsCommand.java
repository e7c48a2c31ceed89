package cafe.woden.multisplit.command;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.model.LayoutResult;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.SizeConstraints;
import java.util.Objects;

public final class SetConstraintsCommand extends AbstractPaneCommand {

  private final PaneId paneId;
  private final SizeConstraints constraints;
  private SizeConstraints previous;

  public SetConstraintsCommand(PaneId paneId, SizeConstraints constraints) {
    this.paneId = paneId;
    this.constraints = Objects.requireNonNull(constraints, "constraints");
  }

  @Override
  protected boolean doExecute(PaneTree tree) {
    LayoutResult<SizeConstraints> result = tree.setConstraints(paneId, constraints);
    if (!result.isOk()) return refuse(result);
    previous = result.value();
    return true;
  }

  @Override
  protected boolean doUndo(PaneTree tree) {
    LayoutResult<SizeConstraints> result = tree.setConstraints(paneId, previous);
    if (!result.isOk()) return refuse(result);
    return true;
  }

  @Override
  public String description() {
    return "Set constraints for pane " + paneId;
  }
}
