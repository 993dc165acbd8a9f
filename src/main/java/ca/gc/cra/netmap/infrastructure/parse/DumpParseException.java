package ca.gc.cra.netmap.infrastructure.parse;

/**
 * The dump as a whole cannot be used: its format is unknown or unsupported, or the vantage host
 * cannot be established. Individual bad lines never raise this.
 *
 * @since 0.1.0
 */
public final class DumpParseException extends Exception {
  public DumpParseException(String message) {
    super(message);
  }
}
