package dfrs;

public class LexException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    INVALID_NUMBER,
    INVALID_TOKEN,
    UNTERMINATED_STRING,
    UNTERMINATED_TEXT,
    UNTERMINATED_VARIABLE;
  }

  private final Kind kind;

  public LexException(Kind kind, Lexer.Range range, String errorMsg) {
    super(range, errorMsg);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
