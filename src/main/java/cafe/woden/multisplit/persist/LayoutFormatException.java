package cafe.woden.multisplit.persist;

import java.io.IOException;

/** A saved layout could not be read: malformed JSON, unknown version, or a tree that fails validation. */
public class LayoutFormatException extends IOException {

  public LayoutFormatException(String message) {
    super(message);
  }

  public LayoutFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
