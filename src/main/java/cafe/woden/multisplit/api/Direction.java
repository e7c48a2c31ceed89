package cafe.woden.multisplit.api;

/** Cardinal directions for spatial focus navigation. */
public enum Direction {
  LEFT,
  RIGHT,
  UP,
  DOWN;

  public Orientation axis() {
    return (this == LEFT || this == RIGHT) ? Orientation.HORIZONTAL : Orientation.VERTICAL;
  }

  public boolean forward() {
    return this == RIGHT || this == DOWN;
  }
}
