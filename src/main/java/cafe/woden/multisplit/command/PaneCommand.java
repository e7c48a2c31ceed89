package cafe.woden.multisplit.command;

import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.PaneTree;
import java.util.Optional;

/**
 * One reversible, all-or-nothing change to a {@link PaneTree}.
 *
 * <p>{@code execute} returning false means nothing was mutated and nothing was published. {@code
 * undo} reverses the change from state captured during {@code execute}.
 */
public interface PaneCommand {

  boolean execute(PaneTree tree);

  boolean undo(PaneTree tree);

  /** True if {@code other}, already executed, can be folded into this command's undo step. */
  default boolean canMerge(PaneCommand other) {
    return false;
  }

  /** Folds {@code other} into this command. Only called after {@link #canMerge} returned true. */
  default void mergeWith(PaneCommand other) {
    throw new UnsupportedOperationException(description() + " does not merge");
  }

  String description();

  /** Why the last {@code execute} was refused; empty if it succeeded or had nothing to do. */
  Optional<LayoutError> failure();
}
