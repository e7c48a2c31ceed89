package cafe.woden.multisplit.api;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Address of a split node, used to target ratio changes. Not tracked across reconciliation. */
@ValueObject
public record NodeId(String value) {

  public NodeId {
    value = Objects.toString(value, "").trim();
    if (value.isEmpty()) throw new IllegalArgumentException("node id must not be blank");
  }

  public static NodeId of(String value) {
    return new NodeId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
