package cafe.woden.multisplit.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a tree operation. Expected refusals come back as a {@link LayoutError}; they are
 * never thrown.
 */
public record LayoutResult<T>(T value, LayoutError error) {

  public static <T> LayoutResult<T> ok(T value) {
    return new LayoutResult<>(value, null);
  }

  public static <T> LayoutResult<T> failure(LayoutError error) {
    return new LayoutResult<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isOk() {
    return error == null;
  }

  public Optional<LayoutError> failure() {
    return Optional.ofNullable(error);
  }

  public boolean failedWith(LayoutError.Kind kind) {
    return error != null && error.kind() == kind;
  }

  public <R> LayoutResult<R> map(Function<? super T, ? extends R> fn) {
    if (!isOk()) return failure(error);
    return ok(fn.apply(value));
  }

  /** Returns the value, or throws {@link IllegalStateException} describing the failure. */
  public T orElseThrow() {
    if (!isOk()) throw new IllegalStateException(error.kind() + ": " + error.message());
    return value;
  }
}
