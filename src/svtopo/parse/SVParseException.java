package svtopo.parse;

/**
 * Thrown when no syntax tree can be built for a source.
 */
public class SVParseException extends Exception {
  private static final long serialVersionUID = 1L;

  public SVParseException(String message) { super(message); }

  public SVParseException(String message, Throwable cause) { super(message, cause); }
}
