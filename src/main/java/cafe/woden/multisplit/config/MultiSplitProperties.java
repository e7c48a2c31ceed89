package cafe.woden.multisplit.config;

import cafe.woden.multisplit.model.FocusPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Split-pane layout defaults, bound from {@code multisplit.*}. */
@ConfigurationProperties(prefix = "multisplit")
public record MultiSplitProperties(
    /** Undo history depth; the oldest entries are dropped beyond it. Default: 100. */
    Integer maxUndoLevels,

    /**
     * Ratio changes on the same split closer together than this collapse into one undo step.
     * Default: 500ms.
     */
    Duration ratioMergeWindow,

    /** What happens to focus requests while a pane is maximized. Default: AUTO_RESTORE. */
    FocusPolicy focusPolicy,

    /** Prefix for generated pane ids. Default: "pane". */
    String paneIdPrefix,

    Geometry geometry
) {

  /** Pixel layout settings. */
  public record Geometry(
      /** Width of the divider between two siblings. Default: 0. */
      Integer dividerWidth,

      /** Default minimum pane width for new panes. Default: 50. */
      Integer minPaneWidth,

      /** Default minimum pane height for new panes. Default: 50. */
      Integer minPaneHeight
  ) {
    public Geometry {
      if (dividerWidth == null || dividerWidth < 0) dividerWidth = 0;
      if (minPaneWidth == null || minPaneWidth < 0) minPaneWidth = 50;
      if (minPaneHeight == null || minPaneHeight < 0) minPaneHeight = 50;
    }
  }

  public MultiSplitProperties {
    if (maxUndoLevels == null || maxUndoLevels <= 0) maxUndoLevels = 100;
    if (ratioMergeWindow == null || ratioMergeWindow.isNegative()) {
      ratioMergeWindow = Duration.ofMillis(500);
    }
    if (focusPolicy == null) focusPolicy = FocusPolicy.AUTO_RESTORE;
    if (paneIdPrefix == null || paneIdPrefix.isBlank()) paneIdPrefix = "pane";
    paneIdPrefix = paneIdPrefix.trim();
    if (geometry == null) geometry = new Geometry(null, null, null);
  }

  public static MultiSplitProperties defaults() {
    return new MultiSplitProperties(null, null, null, null, null);
  }
}
