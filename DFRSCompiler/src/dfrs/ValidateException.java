package dfrs;

public class ValidateException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    UNKNOWN_EVENT,
    UNKNOWN_ACTION,
    UNKNOWN_FUNCTION,
    UNKNOWN_GAME_VALUE,
    MISSING_ARGUMENT,
    WRONG_ARGUMENT_TYPE,
    TOO_MANY_ARGUMENTS,
    UNKNOWN_TAG,
    INVALID_TAG_OPTION;
  }

  private final Kind kind;

  public ValidateException(Kind kind, Lexer.Range range, String errorMsg) {
    super(range, errorMsg);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
