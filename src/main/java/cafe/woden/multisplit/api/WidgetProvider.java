package cafe.woden.multisplit.api;

/**
 * Port implemented by the host UI: creates and releases the visual content named by a {@link
 * WidgetId}. The layout engine never calls it; the view synchroniser does, in response to
 * reconciliation operations.
 *
 * @param <H> the host's widget handle type
 */
public interface WidgetProvider<H> {

  H provideWidget(WidgetId widgetId, PaneId paneId);

  /** Called before the handle for {@code paneId} is discarded. */
  default void widgetClosing(WidgetId widgetId, PaneId paneId, H handle) {}
}
