package cafe.woden.multisplit.model;

/** What happens when focus is asked to leave a maximized pane. */
public enum FocusPolicy {
  /** Leave maximize mode, then move focus. */
  AUTO_RESTORE,
  /** Refuse the focus move while a pane is maximized. */
  LOCK_TO_MAXIMIZED
}
