package cafe.woden.multisplit.api;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** Caller-defined name of the content a leaf displays. Stored and round-tripped, never parsed. */
@ValueObject
public record WidgetId(String value) {

  public WidgetId {
    value = Objects.requireNonNull(value, "value");
  }

  public static WidgetId of(String value) {
    return new WidgetId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
