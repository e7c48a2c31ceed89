package cafe.woden.multisplit.model;

import cafe.woden.multisplit.api.NodeId;
import cafe.woden.multisplit.api.PaneId;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/** Source of fresh pane and split identifiers. */
public interface PaneIdGenerator {

  PaneId nextPaneId();

  NodeId nextNodeId();

  /** {@code prefix-1}, {@code prefix-2}, ... for panes and {@code split-1}, ... for splits. */
  static PaneIdGenerator sequential(String prefix) {
    String p = normalizePrefix(prefix);
    AtomicLong panes = new AtomicLong();
    AtomicLong nodes = new AtomicLong();
    return new PaneIdGenerator() {
      @Override
      public PaneId nextPaneId() {
        return new PaneId(p + "-" + panes.incrementAndGet());
      }

      @Override
      public NodeId nextNodeId() {
        return new NodeId("split-" + nodes.incrementAndGet());
      }
    };
  }

  /** Random ids, safe to mix with ids loaded from a saved layout. */
  static PaneIdGenerator random(String prefix) {
    String p = normalizePrefix(prefix);
    return new PaneIdGenerator() {
      @Override
      public PaneId nextPaneId() {
        return new PaneId(p + "-" + shortUuid());
      }

      @Override
      public NodeId nextNodeId() {
        return new NodeId("split-" + shortUuid());
      }
    };
  }

  private static String normalizePrefix(String prefix) {
    String p = Objects.toString(prefix, "").trim();
    return p.isEmpty() ? "pane" : p;
  }

  private static String shortUuid() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }
}
