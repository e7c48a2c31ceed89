package cafe.woden.multisplit.api;

import org.jmolecules.ddd.annotation.ValueObject;

/** Integer pixel rectangle. Coordinates may be negative; extents may not. */
@ValueObject
public record Rect(int x, int y, int width, int height) {

  public Rect {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("rect extents must be non-negative: " + width + "x" + height);
    }
  }

  public static Rect of(int x, int y, int width, int height) {
    return new Rect(x, y, width, height);
  }

  public int right() {
    return x + width;
  }

  public int bottom() {
    return y + height;
  }

  public long area() {
    return (long) width * height;
  }

  public int extent(Orientation axis) {
    return axis == Orientation.HORIZONTAL ? width : height;
  }

  public int start(Orientation axis) {
    return axis == Orientation.HORIZONTAL ? x : y;
  }

  public int end(Orientation axis) {
    return axis == Orientation.HORIZONTAL ? right() : bottom();
  }

  /** Copy with the given start and extent along {@code axis}; the cross axis is kept. */
  public Rect slice(Orientation axis, int start, int extent) {
    return axis == Orientation.HORIZONTAL
        ? new Rect(start, y, extent, height)
        : new Rect(x, start, width, extent);
  }

  public boolean contains(int px, int py) {
    return x <= px && px < right() && y <= py && py < bottom();
  }

  public boolean intersects(Rect other) {
    if (other == null) return false;
    return !(right() <= other.x
        || other.right() <= x
        || bottom() <= other.y
        || other.bottom() <= y);
  }
}
