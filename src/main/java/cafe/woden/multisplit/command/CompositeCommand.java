package cafe.woden.multisplit.command;

import cafe.woden.multisplit.model.PaneTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Commands applied and reverted as one step. Undo runs them in reverse order. */
public final class CompositeCommand extends AbstractPaneCommand {

  private static final Logger log = LoggerFactory.getLogger(CompositeCommand.class);

  private final String description;
  private final List<PaneCommand> commands;

  public CompositeCommand(String description, List<PaneCommand> commands) {
    this.description = Objects.toString(description, "Transaction");
    this.commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
  }

  /** Wraps commands that have already been executed, e.g. by a committed transaction. */
  static CompositeCommand ofExecuted(String description, List<PaneCommand> executed) {
    CompositeCommand composite = new CompositeCommand(description, executed);
    composite.markExecuted();
    return composite;
  }

  public List<PaneCommand> commands() {
    return commands;
  }

  @Override
  protected boolean doExecute(PaneTree tree) {
    return atomically(
        tree,
        () -> {
          List<PaneCommand> done = new ArrayList<>(commands.size());
          for (PaneCommand command : commands) {
            if (!command.execute(tree)) {
              command.failure().ifPresent(this::refuse);
              unwind(tree, done);
              return false;
            }
            done.add(command);
          }
          return true;
        });
  }

  @Override
  protected boolean doUndo(PaneTree tree) {
    return atomically(
        tree,
        () -> {
          List<PaneCommand> undone = new ArrayList<>(commands.size());
          for (int i = commands.size() - 1; i >= 0; i--) {
            PaneCommand command = commands.get(i);
            if (!command.undo(tree)) {
              command.failure().ifPresent(this::refuse);
              log.warn(
                  "[multisplit] undo of '{}' failed at '{}'; re-applying", description, command.description());
              for (int j = undone.size() - 1; j >= 0; j--) undone.get(j).execute(tree);
              return false;
            }
            undone.add(command);
          }
          return true;
        });
  }

  private static void unwind(PaneTree tree, List<PaneCommand> done) {
    for (int i = done.size() - 1; i >= 0; i--) {
      PaneCommand command = done.get(i);
      if (!command.undo(tree)) {
        log.warn("[multisplit] could not unwind '{}'", command.description());
      }
    }
  }

  @Override
  public String description() {
    return description;
  }
}
