package fsa.json;

/**
 * JSON document which does not describe a valid automaton.
 */
public class AutomatonFormatException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = -2710934825367719054L;

  /**
   * Location of the offending value inside the document (eg. {@code delta[2].images}).
   */
  public final String field;

  public AutomatonFormatException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public AutomatonFormatException(String field, String message, Throwable cause) {
    super(field + ": " + message, cause);
    this.field = field;
  }
}
