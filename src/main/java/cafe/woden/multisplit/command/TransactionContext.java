package cafe.woden.multisplit.command;

import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.TreeState;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A group of commands applied as one atomic change.
 *
 * <p>While open, the tree publishes no {@code Changed}/{@code LayoutChanged}. The first command
 * that fails rolls back every command already executed, in reverse order, and the context stops
 * accepting commands. {@link #commit()} publishes one change for the whole group. Closing a
 * context that was never committed rolls it back.
 *
 * <p>Obtained from {@link LayoutController#beginTransaction(String)}.
 */
public final class TransactionContext implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TransactionContext.class);

  public enum State {
    OPEN,
    COMMITTED,
    ROLLED_BACK
  }

  private final PaneTree tree;
  private final String description;
  private final TreeState base;
  private final Consumer<TransactionContext> onFinish;
  private final List<PaneCommand> executed = new ArrayList<>();

  private State state = State.OPEN;
  private LayoutError failure;

  TransactionContext(PaneTree tree, String description, Consumer<TransactionContext> onFinish) {
    this.tree = Objects.requireNonNull(tree, "tree");
    this.description = Objects.toString(description, "Transaction");
    this.onFinish = Objects.requireNonNull(onFinish, "onFinish");
    this.base = tree.snapshot();
    tree.beginBatch();
    log.debug("[multisplit] transaction '{}' started", this.description);
  }

  public State state() {
    return state;
  }

  public boolean isOpen() {
    return state == State.OPEN;
  }

  public String description() {
    return description;
  }

  /** Why the transaction rolled back. Empty while open, after commit, or after a plain rollback. */
  public Optional<LayoutError> failure() {
    return Optional.ofNullable(failure);
  }

  /** Commands executed so far, in order. */
  public List<PaneCommand> executed() {
    return List.copyOf(executed);
  }

  /**
   * Runs {@code command} inside the transaction. A refusal rolls the whole transaction back and
   * returns false; so does any call once the transaction is no longer open. A command that had
   * nothing to do, such as focusing the pane that already has focus, is skipped and counts as
   * success.
   */
  public boolean execute(PaneCommand command) {
    Objects.requireNonNull(command, "command");
    if (state != State.OPEN) return false;
    if (command.execute(tree)) {
      executed.add(command);
      return true;
    }
    Optional<LayoutError> refusal = command.failure();
    if (refusal.isEmpty() && !alreadyExecuted(command)) {
      log.debug(
          "[multisplit] transaction '{}' skipped '{}': nothing to do",
          description,
          command.description());
      return true;
    }
    failure =
        refusal.orElseGet(
            () ->
                LayoutError.invalidTransition(
                    "'" + command.description() + "' was already executed", null));
    log.debug(
        "[multisplit] transaction '{}' failed at '{}': {}",
        description,
        command.description(),
        failure.message());
    rollback();
    return false;
  }

  private static boolean alreadyExecuted(PaneCommand command) {
    return command instanceof AbstractPaneCommand c && c.isExecuted();
  }

  /**
   * Publishes the group as one change. Fails, rolling back, if the resulting tree does not
   * validate. Returns false if the transaction was not open.
   */
  public boolean commit() {
    if (state != State.OPEN) return false;
    List<String> violations = tree.validate();
    if (!violations.isEmpty()) {
      log.warn("[multisplit] transaction '{}' left an invalid tree: {}", description, violations);
      failure = LayoutError.invalidStructure(violations);
      rollback();
      return false;
    }
    tree.endBatch(true);
    state = State.COMMITTED;
    log.debug("[multisplit] transaction '{}' committed ({} commands)", description, executed.size());
    onFinish.accept(this);
    return true;
  }

  /** Undoes every executed command in reverse order and discards the batched signals. */
  public void rollback() {
    if (state != State.OPEN) return;
    for (int i = executed.size() - 1; i >= 0; i--) {
      PaneCommand command = executed.get(i);
      if (!command.undo(tree)) {
        log.warn("[multisplit] could not undo '{}' during rollback", command.description());
      }
    }
    if (!tree.snapshot().equals(base)) {
      log.warn("[multisplit] rollback of '{}' did not reach the starting state; restoring it", description);
      tree.restore(base);
    }
    tree.endBatch(false);
    state = State.ROLLED_BACK;
    log.debug("[multisplit] transaction '{}' rolled back", description);
    onFinish.accept(this);
  }

  @Override
  public void close() {
    if (state == State.OPEN) rollback();
  }
}
