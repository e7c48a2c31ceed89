package cafe.woden.multisplit.command;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.model.LayoutResult;
import cafe.woden.multisplit.model.LeafNode;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.TreeState;
import java.util.Optional;

/** Removes a pane, collapsing any split left with a single child. Undo puts the pane back. */
public final class RemoveCommand extends AbstractPaneCommand {

  private final PaneId paneId;

  private LeafNode removed;
  private TreeState before;
  private TreeState after;

  public RemoveCommand(PaneId paneId) {
    this.paneId = paneId;
  }

  public Optional<LeafNode> removed() {
    return Optional.ofNullable(removed);
  }

  @Override
  protected boolean doExecute(PaneTree tree) {
    TreeState snapshot = tree.snapshot();
    LayoutResult<LeafNode> result = tree.removeLeaf(paneId);
    if (!result.isOk()) return refuse(result);
    removed = result.value();
    before = snapshot;
    after = tree.snapshot();
    return true;
  }

  @Override
  protected boolean doUndo(PaneTree tree) {
    return rewind(tree, after, before);
  }

  @Override
  public String description() {
    return "Remove pane " + paneId;
  }
}
