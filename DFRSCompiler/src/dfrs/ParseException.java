package dfrs;

public class ParseException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    INVALID_TOKEN,
    INVALID_EOF,
    UNKNOWN_VARIABLE,
    INVALID_CALL,
    INVALID_COMPLEX_NUMBER,
    INVALID_LOCATION,
    INVALID_VECTOR,
    INVALID_SOUND,
    INVALID_POTION,
    INVALID_PARTICLE,
    INVALID_ITEM,
    INVALID_TYPE,
    INVALID_USE;
  }

  private final Kind kind;

  public ParseException(Kind kind, Lexer.Range range, String errorMsg) {
    super(range, errorMsg);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
