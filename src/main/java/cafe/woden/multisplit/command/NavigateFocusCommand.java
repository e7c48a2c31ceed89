package cafe.woden.multisplit.command;

import cafe.woden.multisplit.api.Direction;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.geometry.FocusNavigator;
import cafe.woden.multisplit.model.PaneTree;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/** Moves focus to the spatial neighbour of the focused pane. False when there is none. */
public final class NavigateFocusCommand extends AbstractPaneCommand {

  private final Direction direction;
  private final FocusNavigator navigator;
  private SetFocusCommand delegate;

  public NavigateFocusCommand(Direction direction, FocusNavigator navigator) {
    this.direction = Objects.requireNonNull(direction, "direction");
    this.navigator = Objects.requireNonNull(navigator, "navigator");
  }

  @Override
  protected boolean doExecute(PaneTree tree) {
    Optional<PaneId> focused = tree.focusedPaneId();
    if (focused.isEmpty()) return false;
    Optional<PaneId> target = navigator.neighbor(tree.snapshot(), focused.get(), direction);
    if (target.isEmpty()) return false;
    SetFocusCommand focus = new SetFocusCommand(target.get());
    if (!focus.execute(tree)) {
      return focus.failure().map(this::refuse).orElse(false);
    }
    delegate = focus;
    return true;
  }

  @Override
  protected boolean doUndo(PaneTree tree) {
    if (delegate.undo(tree)) return true;
    return delegate.failure().map(this::refuse).orElse(false);
  }

  @Override
  public String description() {
    return "Navigate focus " + direction.name().toLowerCase(Locale.ROOT);
  }
}
