package dfrs;

import java.util.Arrays;
import java.util.Optional;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Token {

  public enum Kind {
    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    AT("@"),
    COLON(":"),
    EXCLAMATION_MARK("!"),
    DOT("."),
    COMMA(","),
    EQUAL("="),
    SEMICOLON(";"),
    QUESTION_MARK("?"),
    DOLLAR("$"),
    TILDE("~"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    OPEN_PAREN_SQUARE("["),
    CLOSE_PAREN_SQUARE("]"),
    OPEN_PAREN_CURLY("{"),
    CLOSE_PAREN_CURLY("}"),

    NUMBER("Number"),
    STRING("String"),
    TEXT("Text"),
    VARIABLE("Variable"),
    IDENTIFIER("Identifier"),
    KEYWORD("Keyword"),
    SELECTOR("Selector");

    private final String repr;

    private Kind(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    public boolean isPunctuation() {
      return ordinal() < NUMBER.ordinal();
    }

    public static Optional<Kind> forSymbol(int ch) {
      return Arrays.stream(values())
          .filter(k -> k.isPunctuation() && k.repr.codePointAt(0) == ch)
          .findFirst();
    }
  }

  public enum Keyword {
    P("p"),
    E("e"),
    G("g"),
    V("v"),
    C("c"),
    S("s"),
    IF_P("ifp"),
    IF_E("ife"),
    IF_G("ifg"),
    IF_V("ifv"),
    ELSE("else"),
    LINE("line"),
    LOCAL("local"),
    GAME("game"),
    SAVE("save"),
    FN("fn"),
    PROC("proc"),
    START("start"),
    CALL("call"),
    REPEAT("repeat"),
    USE("use");

    private final String repr;

    private Keyword(String repr) {
      this.repr = repr;
    }

    public String repr() {
      return repr;
    }

    public static Optional<Keyword> forName(String name) {
      return Arrays.stream(values()).filter(k -> k.repr.equals(name)).findFirst();
    }
  }

  public abstract Kind kind();

  // Literal contents for strings, texts, variables and identifiers; source text otherwise.
  public abstract String text();

  public abstract double number();

  public abstract Optional<Keyword> keyword();

  public abstract Optional<Selector> selector();

  public abstract Lexer.Range range();

  public static Token punctuation(Kind kind, Lexer.Range range) {
    return new AutoValue_Token(kind, kind.repr(), 0, Optional.empty(), Optional.empty(), range);
  }

  public static Token number(double value, Lexer.Range range) {
    return new AutoValue_Token(
        Kind.NUMBER,
        ArgValue.formatNumber(value),
        value,
        Optional.empty(),
        Optional.empty(),
        range);
  }

  public static Token literal(Kind kind, String value, Lexer.Range range) {
    return new AutoValue_Token(kind, value, 0, Optional.empty(), Optional.empty(), range);
  }

  public static Token keyword(Keyword keyword, Lexer.Range range) {
    return new AutoValue_Token(
        Kind.KEYWORD, keyword.repr(), 0, Optional.of(keyword), Optional.empty(), range);
  }

  public static Token selector(Selector selector, Lexer.Range range) {
    return new AutoValue_Token(
        Kind.SELECTOR, selector.dfrsName(), 0, Optional.empty(), Optional.of(selector), range);
  }

  public boolean is(Kind kind) {
    return kind() == kind;
  }

  public boolean is(Keyword keyword) {
    return keyword().isPresent() && keyword().get() == keyword;
  }

  // How the token is named in diagnostics.
  public String describe() {
    switch (kind()) {
      case KEYWORD:
        return "Keyword:" + text();
      default:
        return kind().repr();
    }
  }
}
