package cafe.woden.multisplit.command;

import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.LayoutResult;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.TreeState;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/** Tracks execution state and the last refusal for concrete commands. */
abstract class AbstractPaneCommand implements PaneCommand {

  private boolean executed;
  private LayoutError failure;

  @Override
  public final boolean execute(PaneTree tree) {
    if (executed) return false;
    failure = null;
    executed = doExecute(tree);
    return executed;
  }

  @Override
  public final boolean undo(PaneTree tree) {
    if (!executed) return false;
    boolean undone = doUndo(tree);
    if (undone) executed = false;
    return undone;
  }

  public boolean isExecuted() {
    return executed;
  }

  void markExecuted() {
    executed = true;
  }

  @Override
  public Optional<LayoutError> failure() {
    return Optional.ofNullable(failure);
  }

  protected abstract boolean doExecute(PaneTree tree);

  protected abstract boolean doUndo(PaneTree tree);

  protected boolean refuse(LayoutError error) {
    this.failure = error;
    return false;
  }

  protected boolean refuse(LayoutResult<?> result) {
    return refuse(result.error());
  }

  /** Restores {@code before} only if the tree still holds exactly {@code after}. */
  protected boolean rewind(PaneTree tree, TreeState after, TreeState before) {
    if (!tree.snapshot().equals(after)) {
      return refuse(
          LayoutError.invalidTransition(
              "tree changed since '" + description() + "' ran; cannot undo it", null));
    }
    return tree.restore(before).isOk();
  }

  /** Runs a multi-step body as one published change unless a batch is already open. */
  protected static boolean atomically(PaneTree tree, BooleanSupplier body) {
    if (tree.inBatch()) return body.getAsBoolean();
    tree.beginBatch();
    boolean ok = false;
    try {
      ok = body.getAsBoolean();
      return ok;
    } finally {
      tree.endBatch(ok);
    }
  }
}
