package cafe.woden.multisplit.api;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Identifier of a leaf pane.
 *
 * <p>Assigned once when the leaf is created and never reassigned. It survives reorders, resizes
 * and moves, and disappears only when its leaf is removed.
 */
@ValueObject
public record PaneId(String value) {

  public PaneId {
    value = Objects.toString(value, "").trim();
    if (value.isEmpty()) throw new IllegalArgumentException("pane id must not be blank");
  }

  public static PaneId of(String value) {
    return new PaneId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
