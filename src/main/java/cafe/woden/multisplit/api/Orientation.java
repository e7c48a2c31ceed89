package cafe.woden.multisplit.api;

import java.util.Locale;
import java.util.Objects;

/** Axis along which a split divides its extent. */
public enum Orientation {
  /** Children side by side; the split divides width. */
  HORIZONTAL("horizontal"),
  /** Children stacked; the split divides height. */
  VERTICAL("vertical");

  private final String wireName;

  Orientation(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Orientation fromWireName(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    for (Orientation o : values()) {
      if (o.wireName.equals(s)) return o;
    }
    throw new IllegalArgumentException("unknown orientation: " + raw);
  }
}
