package cafe.woden.multisplit.command;

import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.signal.LayoutSignal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs commands against one {@link PaneTree} and keeps their undo/redo history.
 *
 * <p>The undo stack holds at most {@code maxUndoLevels} entries, dropping the oldest. A command
 * that can merge into the top of the stack is folded into it instead of pushed. Executing a new
 * command clears the redo stack.
 */
@ApplicationLayer
public final class LayoutController {

  private static final Logger log = LoggerFactory.getLogger(LayoutController.class);

  public static final int DEFAULT_MAX_UNDO_LEVELS = 100;

  private final PaneTree tree;
  private final int maxUndoLevels;

  private final Deque<PaneCommand> undoStack = new ArrayDeque<>();
  private final Deque<PaneCommand> redoStack = new ArrayDeque<>();

  private TransactionContext transaction;
  private LayoutError lastFailure;

  public LayoutController(PaneTree tree, int maxUndoLevels) {
    this.tree = Objects.requireNonNull(tree, "tree");
    this.maxUndoLevels = maxUndoLevels <= 0 ? DEFAULT_MAX_UNDO_LEVELS : maxUndoLevels;
  }

  public LayoutController(PaneTree tree) {
    this(tree, DEFAULT_MAX_UNDO_LEVELS);
  }

  public PaneTree tree() {
    return tree;
  }

  public int maxUndoLevels() {
    return maxUndoLevels;
  }

  /**
   * Executes {@code command}. Inside an open transaction the command joins it; otherwise a
   * successful command is recorded for undo.
   */
  public boolean execute(PaneCommand command) {
    Objects.requireNonNull(command, "command");
    lastFailure = null;
    if (transaction != null) {
      TransactionContext tx = transaction;
      boolean ok = tx.execute(command);
      if (!ok) lastFailure = tx.failure().orElse(null);
      return ok;
    }
    if (!command.execute(tree)) {
      lastFailure = command.failure().orElse(null);
      log.debug(
          "[multisplit] '{}' refused: {}",
          command.description(),
          lastFailure == null ? "nothing to do" : lastFailure.message());
      return false;
    }
    log.debug("[multisplit] executed '{}'", command.description());
    redoStack.clear();
    PaneCommand top = undoStack.peekLast();
    if (top != null && top.canMerge(command)) {
      top.mergeWith(command);
    } else {
      push(command);
    }
    tree.signals().publish(new LayoutSignal.CommandExecuted(command.description()));
    return true;
  }

  /** Why the last {@link #execute}, {@link #undo} or {@link #redo} failed, if it did. */
  public Optional<LayoutError> lastFailure() {
    return Optional.ofNullable(lastFailure);
  }

  public boolean canUndo() {
    return transaction == null && !undoStack.isEmpty();
  }

  public boolean canRedo() {
    return transaction == null && !redoStack.isEmpty();
  }

  public boolean undo() {
    if (!canUndo()) return false;
    lastFailure = null;
    PaneCommand command = undoStack.pollLast();
    if (!command.undo(tree)) {
      lastFailure = command.failure().orElse(null);
      undoStack.addLast(command);
      log.debug("[multisplit] undo of '{}' failed", command.description());
      return false;
    }
    redoStack.addLast(command);
    log.debug("[multisplit] undid '{}'", command.description());
    tree.signals().publish(new LayoutSignal.CommandUndone(command.description()));
    return true;
  }

  public boolean redo() {
    if (!canRedo()) return false;
    lastFailure = null;
    PaneCommand command = redoStack.pollLast();
    if (!command.execute(tree)) {
      lastFailure = command.failure().orElse(null);
      redoStack.addLast(command);
      log.debug("[multisplit] redo of '{}' failed", command.description());
      return false;
    }
    push(command);
    log.debug("[multisplit] redid '{}'", command.description());
    tree.signals().publish(new LayoutSignal.CommandExecuted(command.description()));
    return true;
  }

  public int undoDepth() {
    return undoStack.size();
  }

  public int redoDepth() {
    return redoStack.size();
  }

  public Optional<String> undoDescription() {
    return Optional.ofNullable(undoStack.peekLast()).map(PaneCommand::description);
  }

  public Optional<String> redoDescription() {
    return Optional.ofNullable(redoStack.peekLast()).map(PaneCommand::description);
  }

  public void clearHistory() {
    undoStack.clear();
    redoStack.clear();
  }

  public boolean inTransaction() {
    return transaction != null;
  }

  /**
   * Opens a transaction. Commands given to {@link #execute} or to the returned context join it
   * until it is committed or rolled back.
   *
   * @throws IllegalStateException if a transaction is already open
   */
  public TransactionContext beginTransaction(String description) {
    if (transaction != null) {
      throw new IllegalStateException(
          "transaction '" + transaction.description() + "' is still open; transactions do not nest");
    }
    transaction = new TransactionContext(tree, description, this::finish);
    return transaction;
  }

  /**
   * Runs {@code body} in a transaction and commits it unless the body left it rolled back. An
   * exception from the body rolls back and propagates.
   */
  public boolean runTransaction(String description, Consumer<TransactionContext> body) {
    Objects.requireNonNull(body, "body");
    try (TransactionContext tx = beginTransaction(description)) {
      body.accept(tx);
      if (!tx.isOpen()) {
        lastFailure = tx.failure().orElse(null);
        return false;
      }
      boolean ok = tx.commit();
      if (!ok) lastFailure = tx.failure().orElse(null);
      return ok;
    }
  }

  private void finish(TransactionContext tx) {
    if (transaction == tx) transaction = null;
    if (tx.state() != TransactionContext.State.COMMITTED || tx.executed().isEmpty()) return;
    CompositeCommand composite = CompositeCommand.ofExecuted(tx.description(), tx.executed());
    redoStack.clear();
    push(composite);
    tree.signals().publish(new LayoutSignal.CommandExecuted(composite.description()));
  }

  private void push(PaneCommand command) {
    undoStack.addLast(command);
    while (undoStack.size() > maxUndoLevels) undoStack.pollFirst();
  }
}
