package weft;

/**
 * Raised when the layout primitives are misused, never for input that simply
 * does not fit the page.
 */
public class LayoutException extends RuntimeException {
  public final Object causingState;

  public LayoutException(String msg, Object causingState) {
    super(msg + ": " + causingState);
    this.causingState = causingState;
  }
}
