package cafe.woden.multisplit.geometry;

import cafe.woden.multisplit.model.SizeConstraints;

/**
 * Knobs of the geometry calculator.
 *
 * @param dividerWidth pixels reserved between adjacent children of a split
 * @param minimumPane floor applied to every pane on top of its own constraints
 */
public record GeometryOptions(int dividerWidth, SizeConstraints minimumPane) {

  public static final GeometryOptions NONE = new GeometryOptions(0, SizeConstraints.NONE);

  public GeometryOptions {
    if (dividerWidth < 0) {
      throw new IllegalArgumentException("divider width must be non-negative: " + dividerWidth);
    }
    if (minimumPane == null) minimumPane = SizeConstraints.NONE;
  }
}
