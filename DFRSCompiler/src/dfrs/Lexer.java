package dfrs;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Produces a tokenization of the input. */
public class Lexer {
  public static class Pos implements Comparable<Pos> {
    private static final Pos ORIGIN = new Pos(1, 1);

    // Used for nodes the compiler synthesizes, such as defaulted tags.
    public static Pos origin() {
      return ORIGIN;
    }

    private final int line;
    private final int column;

    public Pos(int line, int column) {
      this.line = line;
      this.column = column;
    }

    public int line() {
      return line;
    }

    public int column() {
      return column;
    }

    public Pos addColumns(int columns) {
      return new Pos(line, column + columns);
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.comparingInt(Pos::line).thenComparingInt(Pos::column).compare(this, pos);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Pos)) return false;
      Pos that = (Pos) o;
      return line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
      return Objects.hash(line, column);
    }

    @Override
    public String toString() {
      return line + ":" + column;
    }
  }

  @AutoValue
  public abstract static class Range {
    public abstract Pos start();

    public abstract Pos end();

    public static Range create(Pos start, Pos end) {
      return new AutoValue_Lexer_Range(start, end);
    }

    public static Range at(Pos pos) {
      return create(pos, pos);
    }

    public static Range origin() {
      return at(Pos.origin());
    }

    public Range to(Range other) {
      return create(start(), other.end());
    }

    public boolean encloses(Range other) {
      return start().compareTo(other.start()) <= 0 && end().compareTo(other.end()) >= 0;
    }

    @Override
    public String toString() {
      return start() + "-" + end();
    }
  }

  private enum State {
    CODE,
    COMMENT;
  }

  private static final int EOF = -1;

  private final int[] chars;
  private int index = -1;
  private int ch = EOF;
  private int line = 1;
  private int col = 0;
  private boolean nextCharInNewLine = false;
  private State state = State.CODE;

  private final List<Token> tokens = new ArrayList<>();

  public Lexer(String source) {
    this.chars = source.codePoints().toArray();
  }

  public ImmutableList<Token> lex() throws LexException {
    int slashes = 0;
    advance();
    while (ch != EOF) {
      if (ch != '/') slashes = 0;

      switch (state) {
        case COMMENT:
          if (ch == '\n') state = State.CODE;
          advance();
          break;
        case CODE:
          switch (ch) {
            case ' ':
            case '\t':
            case '\n':
            case '\r':
              advance();
              break;
            case '/':
              if (++slashes == 2) {
                // The first slash was already emitted as a division.
                tokens.remove(tokens.size() - 1);
                state = State.COMMENT;
              } else {
                tokens.add(Token.punctuation(Token.Kind.DIVIDE, Range.at(pos())));
              }
              advance();
              break;
            case '-':
              tokens.add(readMinusOrNumber());
              break;
            case '\'':
              tokens.add(
                  readQuoted(
                      Token.Kind.STRING,
                      LexException.Kind.UNTERMINATED_STRING,
                      "Unterminated string"));
              break;
            case '"':
              tokens.add(
                  readQuoted(
                      Token.Kind.TEXT, LexException.Kind.UNTERMINATED_TEXT, "Unterminated text"));
              break;
            case '`':
              tokens.add(
                  readQuoted(
                      Token.Kind.VARIABLE,
                      LexException.Kind.UNTERMINATED_VARIABLE,
                      "Unterminated variable"));
              break;
            default:
              tokens.add(readOther());
              break;
          }
          break;
      }
    }

    return ImmutableList.copyOf(tokens);
  }

  private Token readOther() throws LexException {
    Optional<Token.Kind> punctuation = Token.Kind.forSymbol(ch);
    if (punctuation.isPresent()) {
      Token token = Token.punctuation(punctuation.get(), Range.at(pos()));
      advance();
      return token;
    } else if (isDigit(ch)) {
      return readNumber();
    } else if (isIdentifierStart(ch)) {
      return readWord();
    }

    throw new LexException(
        LexException.Kind.INVALID_TOKEN,
        Range.at(pos()),
        String.format("Invalid token '%s'", new String(Character.toChars(ch))));
  }

  private Token readMinusOrNumber() throws LexException {
    Pos minusPos = pos();
    int oldIndex = index;
    int oldCh = ch;
    int oldLine = line;
    int oldCol = col;
    boolean oldNextCharInNewLine = nextCharInNewLine;

    try {
      return readNumber();
    } catch (LexException ex) {
      index = oldIndex;
      ch = oldCh;
      line = oldLine;
      col = oldCol;
      nextCharInNewLine = oldNextCharInNewLine;
      advance();
      return Token.punctuation(Token.Kind.MINUS, Range.at(minusPos));
    }
  }

  private Token readNumber() throws LexException {
    Pos start = pos();
    StringBuilder number = new StringBuilder();
    boolean hasDot = false;
    while (ch != EOF && (isDigit(ch) || ch == '.' || ch == '_' || ch == '-')) {
      if (ch == '_') {
        advance();
        continue;
      }

      if (ch == '.') {
        if (hasDot) throw invalidNumber(start);
        hasDot = true;
      } else if (ch == '-' && number.length() > 0) {
        throw invalidNumber(start);
      }

      number.appendCodePoint(ch);
      advance();
    }

    String text = number.toString();
    if (text.isEmpty() || text.equals("-")) throw invalidNumber(start);

    try {
      return Token.number(Double.parseDouble(text), Range.create(start, pos()));
    } catch (NumberFormatException ex) {
      throw invalidNumber(start);
    }
  }

  private Token readQuoted(Token.Kind kind, LexException.Kind errorKind, String errorMsg)
      throws LexException {
    Pos start = pos();
    int quote = ch;
    StringBuilder contents = new StringBuilder();
    boolean escaped = false;
    while (true) {
      advance();
      if (ch == EOF) {
        throw new LexException(errorKind, Range.create(start, pos()), errorMsg);
      } else if (!escaped && ch == quote) {
        advance();
        return Token.literal(kind, contents.toString(), Range.create(start, pos()));
      }

      if (!escaped && ch == '\\') {
        escaped = true;
      } else {
        contents.appendCodePoint(ch);
        escaped = false;
      }
    }
  }

  private Token readWord() {
    Pos start = pos();
    StringBuilder word = new StringBuilder();
    while (ch != EOF && (isIdentifierStart(ch) || isDigit(ch))) {
      word.appendCodePoint(ch);
      advance();
    }

    String text = word.toString();
    Range range = Range.create(start, pos());
    Optional<Token.Keyword> keyword = Token.Keyword.forName(text);
    if (keyword.isPresent()) return Token.keyword(keyword.get(), range);

    Optional<Selector> selector = Selector.forDfrsName(text);
    if (selector.isPresent()) return Token.selector(selector.get(), range);

    return Token.literal(Token.Kind.IDENTIFIER, text, range);
  }

  private LexException invalidNumber(Pos start) {
    return new LexException(
        LexException.Kind.INVALID_NUMBER, Range.create(start, pos()), "Invalid number");
  }

  private void advance() {
    index++;
    col++;
    ch = index < chars.length ? chars[index] : EOF;
    if (nextCharInNewLine) {
      nextCharInNewLine = false;
      line++;
      col = 1;
    }
    if (ch == '\n') nextCharInNewLine = true;
  }

  private Pos pos() {
    return new Pos(line, col);
  }

  private static boolean isDigit(int ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isIdentifierStart(int ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
  }
}
