package cafe.woden.multisplit;

import cafe.woden.multisplit.api.Direction;
import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.Orientation;
import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;
import cafe.woden.multisplit.api.WherePosition;
import cafe.woden.multisplit.api.WidgetId;
import cafe.woden.multisplit.api.WidgetProvider;
import cafe.woden.multisplit.command.LayoutController;
import cafe.woden.multisplit.command.NavigateFocusCommand;
import cafe.woden.multisplit.command.PaneCommand;
import cafe.woden.multisplit.command.RemoveCommand;
import cafe.woden.multisplit.command.SetConstraintsCommand;
import cafe.woden.multisplit.command.SetFocusCommand;
import cafe.woden.multisplit.command.SetRatiosCommand;
import cafe.woden.multisplit.command.SplitCommand;
import cafe.woden.multisplit.command.ToggleMaximizeCommand;
import cafe.woden.multisplit.command.TransactionContext;
import cafe.woden.multisplit.config.MultiSplitProperties;
import cafe.woden.multisplit.geometry.FocusNavigator;
import cafe.woden.multisplit.geometry.GeometryCalculator;
import cafe.woden.multisplit.geometry.LayoutGeometry;
import cafe.woden.multisplit.model.LayoutError;
import cafe.woden.multisplit.model.LayoutResult;
import cafe.woden.multisplit.model.PaneIdGenerator;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.SizeConstraints;
import cafe.woden.multisplit.model.TreeState;
import cafe.woden.multisplit.persist.LayoutFormatException;
import cafe.woden.multisplit.persist.LayoutJsonCodec;
import cafe.woden.multisplit.reconcile.ReconcileOperation;
import cafe.woden.multisplit.reconcile.TreeReconciler;
import cafe.woden.multisplit.signal.LayoutSignal;
import cafe.woden.multisplit.signal.LayoutSignalBus;
import cafe.woden.multisplit.view.PaneViewSink;
import cafe.woden.multisplit.view.PaneViewSynchronizer;
import io.reactivex.rxjava3.core.Flowable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One window's split-pane layout: the tree, its undo history, and the entry points a host UI
 * calls.
 *
 * <p>Every change goes through a command so it can be undone, and joins the open transaction if
 * there is one. Refusals come back as {@code false} or empty, with the reason in {@link
 * #lastFailure()}.
 *
 * <p>Not thread-safe. Obtain instances from {@link PaneLayoutFactory}.
 */
@ApplicationLayer
public final class PaneLayout {

  private static final Logger log = LoggerFactory.getLogger(PaneLayout.class);

  private final PaneTree tree;
  private final LayoutController controller;
  private final GeometryCalculator calculator;
  private final TreeReconciler reconciler;
  private final LayoutJsonCodec codec;
  private final FocusNavigator navigator = new FocusNavigator();
  private final PaneIdGenerator ids;
  private final Duration ratioMergeWindow;
  private final Clock clock;

  private LayoutError lastFailure;

  PaneLayout(
      MultiSplitProperties props,
      PaneIdGenerator ids,
      Clock clock,
      GeometryCalculator calculator,
      TreeReconciler reconciler,
      LayoutJsonCodec codec) {
    Objects.requireNonNull(props, "props");
    this.ids = Objects.requireNonNull(ids, "ids");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.ratioMergeWindow = props.ratioMergeWindow();
    this.tree =
        new PaneTree(
            new LayoutSignalBus(),
            ids,
            props.focusPolicy(),
            MultiSplitConfiguration.defaultConstraints(props));
    this.controller = new LayoutController(tree, props.maxUndoLevels());
  }

  public Flowable<LayoutSignal> signals() {
    return tree.signals().signals();
  }

  public <T extends LayoutSignal> Flowable<T> signals(Class<T> type) {
    return tree.signals().signals(type);
  }

  public PaneTree tree() {
    return tree;
  }

  public LayoutController controller() {
    return controller;
  }

  public TreeState snapshot() {
    return tree.snapshot();
  }

  public List<PaneId> paneIds() {
    return tree.paneIds();
  }

  public Optional<PaneId> focusedPane() {
    return tree.focusedPaneId();
  }

  public Optional<PaneId> maximizedPane() {
    return tree.maximizedPaneId();
  }

  public List<String> validate() {
    return tree.validate();
  }

  public Optional<LayoutError> lastFailure() {
    return Optional.ofNullable(lastFailure);
  }

  /** Replaces the layout with a single pane showing {@code widgetId} and forgets the history. */
  public PaneId initialize(WidgetId widgetId) {
    requireNoTransaction("initialize");
    PaneId paneId = tree.initialize(widgetId).orElseThrow();
    controller.clearHistory();
    log.debug("[multisplit] initialized layout with pane {} ({})", paneId, widgetId);
    return paneId;
  }

  public Optional<PaneId> splitPane(
      PaneId target, WidgetId widgetId, WherePosition position, double ratio) {
    SplitCommand command = new SplitCommand(target, position, widgetId, ratio);
    return run(command) ? command.createdPaneId() : Optional.empty();
  }

  /** Splits {@code target} and puts the new pane after it along {@code orientation}. */
  public Optional<PaneId> insertSplit(
      PaneId target, Orientation orientation, WidgetId widgetId, double ratio) {
    SplitCommand command = new SplitCommand(target, orientation, widgetId, ratio);
    return run(command) ? command.createdPaneId() : Optional.empty();
  }

  public boolean removePane(PaneId paneId) {
    return run(new RemoveCommand(paneId));
  }

  public boolean focusPane(PaneId paneId) {
    return run(new SetFocusCommand(paneId));
  }

  public boolean navigateFocus(Direction direction) {
    return run(new NavigateFocusCommand(direction, navigator));
  }

  public boolean focusNext() {
    return tree.focusedPaneId()
        .flatMap(from -> navigator.next(tree.snapshot(), from))
        .map(this::focusPane)
        .orElse(false);
  }

  public boolean focusPrevious() {
    return tree.focusedPaneId()
        .flatMap(from -> navigator.previous(tree.snapshot(), from))
        .map(this::focusPane)
        .orElse(false);
  }

  /** Maximizes the focused pane, or restores it if it is already maximized. */
  public boolean toggleMaximize() {
    return run(new ToggleMaximizeCommand());
  }

  public boolean setRatios(NodeId nodeId, List<Double> ratios) {
    return run(new SetRatiosCommand(nodeId, ratios, clock.instant(), ratioMergeWindow));
  }

  public boolean setConstraints(PaneId paneId, SizeConstraints constraints) {
    return run(new SetConstraintsCommand(paneId, constraints));
  }

  public boolean execute(PaneCommand command) {
    return run(command);
  }

  public boolean undo() {
    boolean ok = controller.undo();
    lastFailure = controller.lastFailure().orElse(null);
    return ok;
  }

  public boolean redo() {
    boolean ok = controller.redo();
    lastFailure = controller.lastFailure().orElse(null);
    return ok;
  }

  public boolean canUndo() {
    return controller.canUndo();
  }

  public boolean canRedo() {
    return controller.canRedo();
  }

  public void clearHistory() {
    controller.clearHistory();
  }

  public TransactionContext beginTransaction(String description) {
    return controller.beginTransaction(description);
  }

  public boolean runTransaction(String description, Consumer<TransactionContext> body) {
    boolean ok = controller.runTransaction(description, body);
    lastFailure = controller.lastFailure().orElse(null);
    return ok;
  }

  /** Rectangles for the visible panes: all of them, or only the maximized one. */
  public LayoutGeometry geometry(Rect bounds) {
    return calculator.calculateVisible(tree.snapshot(), bounds);
  }

  /** Operations that bring a view showing {@code previous} up to date with the current tree. */
  public List<ReconcileOperation> reconcile(TreeState previous) {
    return reconciler.reconcile(previous, tree.snapshot());
  }

  public <H> PaneViewSynchronizer<H> bindView(WidgetProvider<H> provider, PaneViewSink<H> sink) {
    return new PaneViewSynchronizer<>(tree, provider, sink, calculator, reconciler);
  }

  public String toJson() {
    return codec.encode(tree.snapshot());
  }

  /**
   * Replaces the layout with a saved one. The loaded layout is never maximized and the undo
   * history is cleared. On failure the current layout is kept.
   */
  public void fromJson(String json) throws LayoutFormatException {
    requireNoTransaction("load a layout");
    TreeState loaded = codec.decode(json, ids);
    LayoutResult<TreeState> result = tree.restore(loaded);
    if (!result.isOk()) {
      throw new LayoutFormatException("layout rejected: " + result.error().message());
    }
    controller.clearHistory();
    log.debug("[multisplit] loaded layout with {} panes", tree.paneCount());
  }

  public void saveLayout(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    Files.writeString(file, toJson(), StandardCharsets.UTF_8);
    log.debug("[multisplit] saved layout to {}", file);
  }

  public void loadLayout(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    fromJson(Files.readString(file, StandardCharsets.UTF_8));
    log.debug("[multisplit] loaded layout from {}", file);
  }

  private boolean run(PaneCommand command) {
    boolean ok = controller.execute(command);
    lastFailure = ok ? null : controller.lastFailure().orElse(null);
    return ok;
  }

  private void requireNoTransaction(String what) {
    if (controller.inTransaction()) {
      throw new IllegalStateException("cannot " + what + " while a transaction is open");
    }
  }
}
