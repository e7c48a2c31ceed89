package cafe.woden.multisplit.model;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.WherePosition;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.signal.LayoutSignal;
import cafe.woden.multisplit.signal.LayoutSignalBus;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of one pane tree: the root node plus the focused and maximized pane ids.
 *
 * <p>Every mutation builds a candidate {@link TreeState}, validates it with {@link TreeValidator}
 * and only then swaps it in, so a refused operation leaves the tree untouched and publishes
 * nothing. A successful mutation publishes {@code AboutToChange}, swaps the state, then publishes
 * {@code Changed} and {@code LayoutChanged} followed by the detail signals (pane added/removed,
 * focus, maximize).
 *
 * <p>Between {@link #beginBatch()} and {@link #endBatch(boolean)} only the first {@code
 * AboutToChange} is published; the rest is published once when the batch ends with {@code
 * publish=true}, or dropped otherwise.
 *
 * <p>Not thread-safe. All calls must come from the thread that owns the tree.
 */
public final class PaneTree {

  private static final Logger log = LoggerFactory.getLogger(PaneTree.class);

  private static final int MAX_ID_ATTEMPTS = 64;

  private final LayoutSignalBus signals;
  private final PaneIdGenerator ids;
  private final FocusPolicy focusPolicy;
  private final SizeConstraints defaultConstraints;

  private TreeState state = TreeState.EMPTY;

  private boolean batchOpen;
  private boolean batchAnnounced;
  private boolean batchDirty;
  private TreeState batchBase;

  public PaneTree(
      LayoutSignalBus signals,
      PaneIdGenerator ids,
      FocusPolicy focusPolicy,
      SizeConstraints defaultConstraints) {
    this.signals = Objects.requireNonNull(signals, "signals");
    this.ids = Objects.requireNonNull(ids, "ids");
    this.focusPolicy = focusPolicy == null ? FocusPolicy.AUTO_RESTORE : focusPolicy;
    this.defaultConstraints = defaultConstraints == null ? SizeConstraints.NONE : defaultConstraints;
  }

  public PaneTree() {
    this(
        new LayoutSignalBus(),
        PaneIdGenerator.sequential("pane"),
        FocusPolicy.AUTO_RESTORE,
        SizeConstraints.NONE);
  }

  public LayoutSignalBus signals() {
    return signals;
  }

  public FocusPolicy focusPolicy() {
    return focusPolicy;
  }

  public SizeConstraints defaultConstraints() {
    return defaultConstraints;
  }

  public TreeState snapshot() {
    return state;
  }

  public Optional<PaneNode> root() {
    return state.rootNode();
  }

  public boolean isEmpty() {
    return state.isEmpty();
  }

  public Optional<PaneId> focusedPaneId() {
    return state.focused();
  }

  public Optional<PaneId> maximizedPaneId() {
    return state.maximized();
  }

  public boolean isMaximized() {
    return state.maximizedPaneId() != null;
  }

  public List<PaneId> paneIds() {
    return PaneTrees.paneIds(state.root());
  }

  public int paneCount() {
    return PaneTrees.leaves(state.root()).size();
  }

  public boolean contains(PaneId paneId) {
    return findLeaf(paneId).isPresent();
  }

  public Optional<LeafNode> findLeaf(PaneId paneId) {
    return PaneTrees.findLeaf(state.root(), paneId);
  }

  public Optional<SplitNode> findSplit(NodeId nodeId) {
    return PaneTrees.findSplit(state.root(), nodeId);
  }

  public List<String> validate() {
    return TreeValidator.validate(state);
  }

  /** Replaces whatever the tree holds with a single focused leaf. */
  public LayoutResult<PaneId> initialize(WidgetId widgetId) {
    Objects.requireNonNull(widgetId, "widgetId");
    PaneId paneId = freshPaneId();
    LeafNode leaf = new LeafNode(paneId, widgetId, defaultConstraints);
    return apply(new TreeState(leaf, paneId, null)).map(ignored -> paneId);
  }

  /**
   * Replaces the leaf {@code target} with a split holding it and a new leaf placed after it. The
   * new leaf receives {@code ratio} of the extent.
   */
  public LayoutResult<PaneId> insertSplit(
      PaneId target, Orientation orientation, WidgetId widgetId, double ratio) {
    Objects.requireNonNull(orientation, "orientation");
    return insertPane(target, WherePosition.after(orientation), widgetId, ratio);
  }

  public LayoutResult<PaneId> insertPane(
      PaneId target, WherePosition position, WidgetId widgetId, double ratio) {
    return insertPane(target, position, widgetId, ratio, null, null);
  }

  /**
   * Inserts a new leaf relative to {@code target}.
   *
   * <p>{@code paneId} and {@code nodeId} request specific identifiers for the new leaf and split,
   * so that replaying an undone split recreates the same pane; {@code null} means generate.
   */
  public LayoutResult<PaneId> insertPane(
      PaneId target,
      WherePosition position,
      WidgetId widgetId,
      double ratio,
      PaneId paneId,
      NodeId nodeId) {
    Objects.requireNonNull(position, "position");
    Objects.requireNonNull(widgetId, "widgetId");
    Optional<LayoutError> refused = checkInsert(target, position, ratio, paneId);
    if (refused.isPresent()) return LayoutResult.failure(refused.get());

    PaneNode root = state.root();
    PaneId newId = paneId != null ? paneId : freshPaneId();
    LeafNode newLeaf = new LeafNode(newId, widgetId, defaultConstraints);

    TreeState next;
    switch (position) {
      case LEFT, RIGHT, TOP, BOTTOM -> {
        Orientation orientation = position.orientation().orElseThrow();
        NodeId splitId =
            (nodeId != null && PaneTrees.findSplit(root, nodeId).isEmpty())
                ? nodeId
                : freshNodeId();
        boolean newFirst = position.newPaneFirst();
        PaneNode nextRoot =
            PaneTrees.replaceLeaf(
                root,
                target,
                old ->
                    new SplitNode(
                        splitId,
                        orientation,
                        newFirst ? List.of(ratio, 1.0 - ratio) : List.of(1.0 - ratio, ratio),
                        newFirst ? List.of(newLeaf, old) : List.of(old, newLeaf)));
        next = state.withRoot(nextRoot);
      }
      case BEFORE, AFTER -> {
        SplitNode parent = PaneTrees.parentOf(root, target).orElseThrow();
        int idx = PaneTrees.indexOfLeaf(parent, target);
        List<PaneNode> children = new ArrayList<>(parent.children());
        children.add(position.newPaneFirst() ? idx : idx + 1, newLeaf);
        PaneNode nextRoot =
            PaneTrees.replaceSplit(
                root,
                parent.nodeId(),
                p -> p.withChildren(children, PaneTrees.equalRatios(children.size())));
        next = state.withRoot(nextRoot);
      }
      case REPLACE -> {
        PaneNode nextRoot = PaneTrees.replaceLeaf(root, target, old -> newLeaf);
        next = state.withRoot(nextRoot);
        if (target.equals(state.focusedPaneId())) next = next.withFocus(newId);
        if (target.equals(state.maximizedPaneId())) next = next.withMaximized(null);
      }
      default -> throw new IllegalArgumentException("unsupported position " + position);
    }
    return apply(next).map(ignored -> newId);
  }

  /** The refusal {@link #insertPane} would return, without mutating anything. */
  public Optional<LayoutError> checkInsert(
      PaneId target, WherePosition position, double ratio, PaneId requestedPaneId) {
    if (target == null || !contains(target)) {
      return Optional.of(LayoutError.paneNotFound(target));
    }
    if (position.orientation().isPresent() && !(ratio > 0.0 && ratio < 1.0)) {
      return Optional.of(
          LayoutError.invalidRatios(List.of(ratio), "split ratio must lie strictly in (0, 1)"));
    }
    if ((position == WherePosition.BEFORE || position == WherePosition.AFTER)
        && PaneTrees.parentOf(state.root(), target).isEmpty()) {
      return Optional.of(
          LayoutError.invalidTransition("the root pane has no parent to insert into", target));
    }
    if (requestedPaneId != null && contains(requestedPaneId)) {
      return Optional.of(
          LayoutError.invalidTransition("pane id already in use: " + requestedPaneId, requestedPaneId));
    }
    return Optional.empty();
  }

  /**
   * Deletes the leaf. A parent split left with one child collapses into it. Focus on the removed
   * pane moves to the pane that takes its place; maximize on it is cleared.
   */
  public LayoutResult<LeafNode> removeLeaf(PaneId paneId) {
    Optional<LeafNode> leaf = findLeaf(paneId);
    if (leaf.isEmpty()) return LayoutResult.failure(LayoutError.paneNotFound(paneId));
    PaneNode root = state.root();
    if (root instanceof LeafNode) return LayoutResult.failure(LayoutError.lastPane(paneId));

    SplitNode parent = PaneTrees.parentOf(root, paneId).orElseThrow();
    int idx = PaneTrees.indexOfLeaf(parent, paneId);
    PaneNode nextRoot = PaneTrees.removeLeaf(root, paneId);

    TreeState next = state.withRoot(nextRoot);
    if (state.focusedPaneId() == null || paneId.equals(state.focusedPaneId())) {
      PaneId successor =
          idx < parent.size() - 1
              ? PaneTrees.firstLeaf(parent.children().get(idx + 1)).paneId()
              : PaneTrees.lastLeaf(parent.children().get(idx - 1)).paneId();
      next = next.withFocus(successor);
    }
    if (paneId.equals(state.maximizedPaneId())) next = next.withMaximized(null);
    return apply(next).map(ignored -> leaf.get());
  }

  /** Sets the ratios of split {@code nodeId}; returns the previous ratios. */
  public LayoutResult<List<Double>> setRatios(NodeId nodeId, List<Double> ratios) {
    Optional<SplitNode> split = findSplit(nodeId);
    if (split.isEmpty()) return LayoutResult.failure(LayoutError.splitNotFound(nodeId));
    Optional<String> problem = PaneTrees.ratioProblem(ratios, split.get().size());
    if (problem.isPresent()) {
      return LayoutResult.failure(LayoutError.invalidRatios(ratios, problem.get()));
    }
    List<Double> previous = split.get().ratios();
    List<Double> copy = List.copyOf(ratios);
    PaneNode nextRoot = PaneTrees.replaceSplit(state.root(), nodeId, s -> s.withRatios(copy));
    return apply(state.withRoot(nextRoot)).map(ignored -> previous);
  }

  /**
   * Moves focus to {@code paneId}; returns the previously focused pane (may be null). Leaving a
   * maximized pane restores it or is refused, depending on the {@link FocusPolicy}.
   */
  public LayoutResult<PaneId> setFocus(PaneId paneId) {
    Optional<LayoutError> refused = checkFocus(paneId);
    if (refused.isPresent()) return LayoutResult.failure(refused.get());
    PaneId previous = state.focusedPaneId();
    TreeState next = state.withFocus(paneId);
    if (state.maximizedPaneId() != null && !state.maximizedPaneId().equals(paneId)) {
      next = next.withMaximized(null);
    }
    if (next.equals(state)) return LayoutResult.ok(previous);
    return apply(next).map(ignored -> previous);
  }

  public Optional<LayoutError> checkFocus(PaneId paneId) {
    if (paneId == null || !contains(paneId)) {
      return Optional.of(LayoutError.paneNotFound(paneId));
    }
    PaneId maximized = state.maximizedPaneId();
    if (maximized != null
        && !maximized.equals(paneId)
        && focusPolicy == FocusPolicy.LOCK_TO_MAXIMIZED) {
      return Optional.of(LayoutError.focusLocked(paneId, maximized));
    }
    return Optional.empty();
  }

  /**
   * {@code Normal -> Maximized(paneId)} (also focusing it) or {@code Maximized(paneId) -> Normal}.
   * Returns the maximized pane after the toggle, empty for Normal.
   */
  public LayoutResult<Optional<PaneId>> toggleMaximize(PaneId paneId) {
    if (paneId == null || !contains(paneId)) {
      return LayoutResult.failure(LayoutError.paneNotFound(paneId));
    }
    PaneId maximized = state.maximizedPaneId();
    if (maximized == null) {
      TreeState next = state.withMaximized(paneId).withFocus(paneId);
      return apply(next).map(ignored -> Optional.of(paneId));
    }
    if (maximized.equals(paneId)) {
      return apply(state.withMaximized(null)).map(ignored -> Optional.empty());
    }
    return LayoutResult.failure(
        LayoutError.invalidTransition(
            "pane " + maximized + " is maximized; restore it before maximizing " + paneId,
            paneId));
  }

  /** Leaves maximize mode. Returns the pane that was maximized, or null if already Normal. */
  public LayoutResult<PaneId> restoreMaximize() {
    PaneId maximized = state.maximizedPaneId();
    if (maximized == null) return LayoutResult.ok(null);
    return apply(state.withMaximized(null)).map(ignored -> maximized);
  }

  /** Sets focus and maximize together, e.g. to undo a focus move that auto-restored maximize. */
  public LayoutResult<TreeState> restoreFocusState(PaneId focused, PaneId maximized) {
    TreeState next = state.withFocus(focused).withMaximized(maximized);
    if (next.equals(state)) return LayoutResult.ok(state);
    TreeState previous = state;
    return apply(next).map(ignored -> previous);
  }

  /** Replaces the minimum size of a leaf; returns the previous constraints. */
  public LayoutResult<SizeConstraints> setConstraints(PaneId paneId, SizeConstraints constraints) {
    Objects.requireNonNull(constraints, "constraints");
    Optional<LeafNode> leaf = findLeaf(paneId);
    if (leaf.isEmpty()) return LayoutResult.failure(LayoutError.paneNotFound(paneId));
    SizeConstraints previous = leaf.get().constraints();
    PaneNode nextRoot =
        PaneTrees.replaceLeaf(
            state.root(), paneId, old -> ((LeafNode) old).withConstraints(constraints));
    return apply(state.withRoot(nextRoot)).map(ignored -> previous);
  }

  /** Swaps in a whole state, e.g. a snapshot captured before a command. Returns the old state. */
  public LayoutResult<TreeState> restore(TreeState target) {
    Objects.requireNonNull(target, "target");
    TreeState previous = state;
    if (target.equals(state)) return LayoutResult.ok(previous);
    return apply(target).map(ignored -> previous);
  }

  /** Tears the whole tree down, including its last pane. */
  public void clear() {
    if (state.isEmpty()) return;
    apply(TreeState.EMPTY);
  }

  public boolean inBatch() {
    return batchOpen;
  }

  public void beginBatch() {
    if (batchOpen) throw new IllegalStateException("a batch is already open on this tree");
    batchOpen = true;
    batchAnnounced = false;
    batchDirty = false;
    batchBase = state;
  }

  /**
   * Closes the batch. With {@code publish=true} and at least one applied mutation, publishes one
   * {@code Changed}/{@code LayoutChanged} pair and the detail signals for the net change.
   */
  public void endBatch(boolean publish) {
    if (!batchOpen) throw new IllegalStateException("no batch is open on this tree");
    TreeState base = batchBase;
    boolean dirty = batchDirty;
    batchOpen = false;
    batchAnnounced = false;
    batchDirty = false;
    batchBase = null;
    if (publish && dirty) {
      signals.publish(new LayoutSignal.Changed());
      signals.publish(new LayoutSignal.LayoutChanged());
      details(base, state).forEach(signals::publish);
    }
  }

  private LayoutResult<TreeState> apply(TreeState next) {
    List<String> violations = TreeValidator.validate(next);
    if (!violations.isEmpty()) {
      log.warn("[multisplit] refused mutation that breaks tree invariants: {}", violations);
      return LayoutResult.failure(LayoutError.invalidStructure(violations));
    }
    TreeState previous = state;
    if (batchOpen) {
      if (!batchAnnounced) {
        signals.publish(new LayoutSignal.AboutToChange());
        batchAnnounced = true;
      }
      state = next;
      batchDirty = true;
      return LayoutResult.ok(next);
    }
    signals.publish(new LayoutSignal.AboutToChange());
    state = next;
    signals.publish(new LayoutSignal.Changed());
    signals.publish(new LayoutSignal.LayoutChanged());
    details(previous, next).forEach(signals::publish);
    return LayoutResult.ok(next);
  }

  private static List<LayoutSignal> details(TreeState before, TreeState after) {
    List<LayoutSignal> out = new ArrayList<>();
    Set<PaneId> beforeIds = new LinkedHashSet<>(PaneTrees.paneIds(before.root()));
    Set<PaneId> afterIds = new LinkedHashSet<>(PaneTrees.paneIds(after.root()));
    for (PaneId id : beforeIds) {
      if (!afterIds.contains(id)) out.add(new LayoutSignal.PaneRemoved(id));
    }
    for (PaneId id : afterIds) {
      if (!beforeIds.contains(id)) out.add(new LayoutSignal.PaneAdded(id));
    }
    if (!Objects.equals(before.focusedPaneId(), after.focusedPaneId())) {
      out.add(new LayoutSignal.FocusChanged(before.focusedPaneId(), after.focusedPaneId()));
      if (after.focusedPaneId() != null) {
        out.add(new LayoutSignal.NodeChanged(after.focusedPaneId()));
      }
    }
    if (!Objects.equals(before.maximizedPaneId(), after.maximizedPaneId())) {
      out.add(new LayoutSignal.MaximizeChanged(after.maximized()));
    }
    return out;
  }

  // A sequential generator can collide with every id of a loaded layout before it gets past them.
  private PaneId freshPaneId() {
    int attempts = paneCount() + MAX_ID_ATTEMPTS;
    for (int i = 0; i < attempts; i++) {
      PaneId candidate = ids.nextPaneId();
      if (!contains(candidate)) return candidate;
    }
    throw new IllegalStateException("pane id generator keeps returning ids already in use");
  }

  private NodeId freshNodeId() {
    int attempts = PaneTrees.splits(state.root()).size() + MAX_ID_ATTEMPTS;
    for (int i = 0; i < attempts; i++) {
      NodeId candidate = ids.nextNodeId();
      if (findSplit(candidate).isEmpty()) return candidate;
    }
    throw new IllegalStateException("split id generator keeps returning ids already in use");
  }
}
