package cafe.woden.multisplit.view;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;
import cafe.woden.multisplit.api.WidgetProvider;
import cafe.woden.multisplit.geometry.GeometryCalculator;
import cafe.woden.multisplit.geometry.LayoutGeometry;
import cafe.woden.multisplit.model.LeafNode;
import cafe.woden.multisplit.model.PaneTree;
import cafe.woden.multisplit.model.PaneTrees;
import cafe.woden.multisplit.model.TreeState;
import cafe.woden.multisplit.reconcile.ReconcileOperation;
import cafe.woden.multisplit.reconcile.TreeReconciler;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a host's widgets in step with a {@link PaneTree}.
 *
 * <p>Remembers the tree and geometry it last rendered plus one handle per live pane. Each {@link
 * #render(Rect)} reconciles that against the current tree and applies the result: the provider
 * creates widgets for new panes and is told before a removed pane's handle is dropped, while the
 * sink receives reorders and rectangles. Panes hidden behind a maximized pane keep their handles.
 * If the provider fails, the widgets created earlier in that render are closed again and the
 * render can simply be retried.
 *
 * <p>Must run on the thread that owns the tree.
 */
public final class PaneViewSynchronizer<H> {

  private static final Logger log = LoggerFactory.getLogger(PaneViewSynchronizer.class);

  private final PaneTree tree;
  private final WidgetProvider<H> provider;
  private final PaneViewSink<H> sink;
  private final GeometryCalculator calculator;
  private final TreeReconciler reconciler;

  private final Map<PaneId, H> handles = new LinkedHashMap<>();
  private TreeState rendered = TreeState.EMPTY;
  private LayoutGeometry renderedGeometry;

  public PaneViewSynchronizer(
      PaneTree tree,
      WidgetProvider<H> provider,
      PaneViewSink<H> sink,
      GeometryCalculator calculator,
      TreeReconciler reconciler) {
    this.tree = Objects.requireNonNull(tree, "tree");
    this.provider = Objects.requireNonNull(provider, "provider");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
  }

  /** Reconciles the current tree into the host and returns the operations applied. */
  public List<ReconcileOperation> render(Rect bounds) {
    Objects.requireNonNull(bounds, "bounds");
    TreeState next = tree.snapshot();
    LayoutGeometry nextGeometry = calculator.calculateVisible(next, bounds);
    List<ReconcileOperation> ops =
        reconciler.reconcile(rendered.root(), next.root(), renderedGeometry, nextGeometry);

    List<ReconcileOperation.Create> created = new ArrayList<>();
    for (ReconcileOperation op : ops) {
      if (op instanceof ReconcileOperation.Destroy destroy) {
        destroy(destroy.paneId());
      } else if (op instanceof ReconcileOperation.Create create) {
        H handle;
        try {
          handle = create(create);
        } catch (WidgetProviderException e) {
          closeCreated(created, e);
          throw e;
        }
        handles.put(create.paneId(), handle);
        created.add(create);
      } else if (op instanceof ReconcileOperation.Move move) {
        H handle = handles.get(move.paneId());
        if (handle != null) sink.reorder(move.paneId(), handle);
      }
    }
    updateVisibility(nextGeometry);
    for (ReconcileOperation op : ops) {
      if (op instanceof ReconcileOperation.UpdateRect update) {
        H handle = handles.get(update.paneId());
        if (handle != null) sink.place(update.paneId(), handle, update.rect());
      }
    }

    rendered = next;
    renderedGeometry = nextGeometry;
    return ops;
  }

  /** Releases every live widget through the provider, as if the tree had been emptied. */
  public void dispose() {
    for (PaneId paneId : List.copyOf(handles.keySet())) destroy(paneId);
    rendered = TreeState.EMPTY;
    renderedGeometry = null;
  }

  public Optional<H> handle(PaneId paneId) {
    return Optional.ofNullable(handles.get(paneId));
  }

  public Map<PaneId, H> handles() {
    return Collections.unmodifiableMap(handles);
  }

  private H create(ReconcileOperation.Create create) {
    try {
      return provider.provideWidget(create.widgetId(), create.paneId());
    } catch (RuntimeException e) {
      throw new WidgetProviderException(create.widgetId(), create.paneId(), e);
    }
  }

  /**
   * Releases the widgets a failed render created. The rendered tree has not advanced, so the next
   * render issues the same creates again.
   */
  private void closeCreated(
      List<ReconcileOperation.Create> created, WidgetProviderException failure) {
    for (int i = created.size() - 1; i >= 0; i--) {
      ReconcileOperation.Create create = created.get(i);
      H handle = handles.remove(create.paneId());
      if (handle == null) continue;
      try {
        provider.widgetClosing(create.widgetId(), create.paneId(), handle);
      } catch (RuntimeException e) {
        failure.addSuppressed(e);
      }
    }
    log.debug(
        "[multisplit] provider failed for {}; released {} widget(s) created in the same render",
        failure.paneId(),
        created.size());
  }

  private void destroy(PaneId paneId) {
    H handle = handles.remove(paneId);
    if (handle == null) return;
    Optional<LeafNode> leaf = PaneTrees.findLeaf(rendered.root(), paneId);
    if (leaf.isEmpty()) {
      log.debug("[multisplit] no rendered leaf for {}; dropping its handle", paneId);
      return;
    }
    provider.widgetClosing(leaf.get().widgetId(), paneId, handle);
  }

  private void updateVisibility(LayoutGeometry nextGeometry) {
    for (Map.Entry<PaneId, H> e : handles.entrySet()) {
      PaneId paneId = e.getKey();
      boolean visible = nextGeometry.panes().containsKey(paneId);
      boolean created = PaneTrees.findLeaf(rendered.root(), paneId).isEmpty();
      boolean wasVisible =
          created || (renderedGeometry != null && renderedGeometry.panes().containsKey(paneId));
      if (wasVisible != visible) sink.setVisible(paneId, e.getValue(), visible);
    }
  }
}
