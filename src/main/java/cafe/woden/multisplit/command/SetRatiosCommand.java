package cafe.woden.multisplit.command;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.model.LayoutResult;
import cafe.woden.multisplit.model.PaneTree;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Changes the ratios of one split.
 *
 * <p>Successive changes to the same split issued within the merge window of each other (a
 * continuous divider drag) collapse into a single undo step that returns to the ratios before the
 * first of them.
 */
public final class SetRatiosCommand extends AbstractPaneCommand {

  public static final Duration DEFAULT_MERGE_WINDOW = Duration.ofMillis(500);

  private final NodeId nodeId;
  private final Duration mergeWindow;
  private List<Double> ratios;
  private Instant lastIssuedAt;
  private List<Double> previousRatios;

  public SetRatiosCommand(
      NodeId nodeId, List<Double> ratios, Instant issuedAt, Duration mergeWindow) {
    this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
    this.ratios = List.copyOf(Objects.requireNonNull(ratios, "ratios"));
    this.lastIssuedAt = issuedAt == null ? Instant.now() : issuedAt;
    this.mergeWindow =
        (mergeWindow == null || mergeWindow.isNegative()) ? DEFAULT_MERGE_WINDOW : mergeWindow;
  }

  public SetRatiosCommand(NodeId nodeId, List<Double> ratios) {
    this(nodeId, ratios, Instant.now(), DEFAULT_MERGE_WINDOW);
  }

  public NodeId nodeId() {
    return nodeId;
  }

  public List<Double> ratios() {
    return ratios;
  }

  @Override
  protected boolean doExecute(PaneTree tree) {
    LayoutResult<List<Double>> result = tree.setRatios(nodeId, ratios);
    if (!result.isOk()) return refuse(result);
    previousRatios = result.value();
    return true;
  }

  @Override
  protected boolean doUndo(PaneTree tree) {
    LayoutResult<List<Double>> result = tree.setRatios(nodeId, previousRatios);
    if (!result.isOk()) return refuse(result);
    return true;
  }

  @Override
  public boolean canMerge(PaneCommand other) {
    if (!(other instanceof SetRatiosCommand next)) return false;
    if (!isExecuted() || !next.isExecuted()) return false;
    if (!nodeId.equals(next.nodeId)) return false;
    Duration gap = Duration.between(lastIssuedAt, next.lastIssuedAt);
    return !gap.isNegative() && gap.compareTo(mergeWindow) <= 0;
  }

  @Override
  public void mergeWith(PaneCommand other) {
    SetRatiosCommand next = (SetRatiosCommand) other;
    this.ratios = next.ratios;
    this.lastIssuedAt = next.lastIssuedAt;
  }

  @Override
  public String description() {
    return "Adjust split ratios";
  }
}
