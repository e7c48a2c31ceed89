package cafe.woden.multisplit.model;

import cafe.woden.multisplit.api.Orientation;
import org.jmolecules.ddd.annotation.ValueObject;

/** Minimum extents a pane asks for. The geometry calculator grows panes up to these values. */
@ValueObject
public record SizeConstraints(int minWidth, int minHeight) {

  public static final SizeConstraints NONE = new SizeConstraints(0, 0);

  public SizeConstraints {
    if (minWidth < 0 || minHeight < 0) {
      throw new IllegalArgumentException(
          "minimum sizes must be non-negative: " + minWidth + "x" + minHeight);
    }
  }

  public int min(Orientation axis) {
    return axis == Orientation.HORIZONTAL ? minWidth : minHeight;
  }
}
