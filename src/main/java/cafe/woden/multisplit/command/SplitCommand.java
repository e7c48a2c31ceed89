package cafe.woden.multisplit.command;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.WherePosition;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.LayoutResult;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.PaneTrees;
import cafe.woden.multisplit.model.SplitNode;
import cafe.woden.multisplit.model.TreeState;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a pane. Splitting while a pane is maximized always leaves maximize mode first, as part of
 * the same change.
 *
 * <p>The ids generated on the first run are reused when the command is redone.
 */
public final class SplitCommand extends AbstractPaneCommand {

  private static final Logger log = LoggerFactory.getLogger(SplitCommand.class);

  private final PaneId target;
  private final WherePosition position;
  private final WidgetId widgetId;
  private final double ratio;

  private PaneId createdPaneId;
  private NodeId createdNodeId;
  private TreeState before;
  private TreeState after;

  public SplitCommand(PaneId target, WherePosition position, WidgetId widgetId, double ratio) {
    this.target = target;
    this.position = Objects.requireNonNull(position, "position");
    this.widgetId = Objects.requireNonNull(widgetId, "widgetId");
    this.ratio = ratio;
  }

  public SplitCommand(PaneId target, Orientation orientation, WidgetId widgetId, double ratio) {
    this(
        target,
        WherePosition.after(Objects.requireNonNull(orientation, "orientation")),
        widgetId,
        ratio);
  }

  public Optional<PaneId> createdPaneId() {
    return Optional.ofNullable(createdPaneId);
  }

  @Override
  protected boolean doExecute(PaneTree tree) {
    Optional<LayoutError> refused = tree.checkInsert(target, position, ratio, createdPaneId);
    if (refused.isPresent()) return refuse(refused.get());

    TreeState snapshot = tree.snapshot();
    AtomicReference<LayoutResult<PaneId>> inserted = new AtomicReference<>();
    boolean ok =
        atomically(
            tree,
            () -> {
              if (tree.isMaximized()) {
                log.debug("[multisplit] leaving maximize mode before splitting {}", target);
                if (!tree.restoreMaximize().isOk()) return false;
              }
              LayoutResult<PaneId> result =
                  tree.insertPane(target, position, widgetId, ratio, createdPaneId, createdNodeId);
              inserted.set(result);
              if (!result.isOk()) {
                tree.restore(snapshot);
                return false;
              }
              return true;
            });
    if (!ok) {
      return inserted.get() == null
          ? refuse(LayoutError.invalidTransition("could not leave maximize mode", target))
          : refuse(inserted.get());
    }

    createdPaneId = inserted.get().value();
    if (position.orientation().isPresent()) {
      createdNodeId =
          PaneTrees.parentOf(tree.snapshot().root(), createdPaneId)
              .map(SplitNode::nodeId)
              .orElse(null);
    }
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
    return "Split pane " + target + " " + position.name().toLowerCase(Locale.ROOT);
  }
}
