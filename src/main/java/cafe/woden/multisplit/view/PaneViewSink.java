package cafe.woden.multisplit.view;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.Rect;

/** Where the synchroniser sends placement updates for live widget handles. */
public interface PaneViewSink<H> {

  void place(PaneId paneId, H handle, Rect rect);

  /** The pane's position among its siblings changed; re-attach it in tree order. */
  void reorder(PaneId paneId, H handle);

  /** A live pane was hidden (another pane is maximized) or shown again. */
  default void setVisible(PaneId paneId, H handle, boolean visible) {}
}
