package cafe.woden.multisplit.view;

import cafe.woden.multisplit.api.PaneId;
import cafe.woden.multisplit.api.WidgetId;

/** The host's widget provider failed to create a widget for a pane. */
public class WidgetProviderException extends RuntimeException {

  private final transient WidgetId widgetId;
  private final transient PaneId paneId;

  public WidgetProviderException(WidgetId widgetId, PaneId paneId, Throwable cause) {
    super("widget provider failed for widget " + widgetId + " in pane " + paneId, cause);
    this.widgetId = widgetId;
    this.paneId = paneId;
  }

  public WidgetId widgetId() {
    return widgetId;
  }

  public PaneId paneId() {
    return paneId;
  }
}
