package dfrs;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class LexerTest {

  private static ImmutableList<Token> lex(String source) throws LexException {
    return new Lexer(source).lex();
  }

  private static List<Token.Kind> kinds(String source) throws LexException {
    return lex(source).stream().map(Token::kind).collect(Collectors.toList());
  }

  private static LexException.Kind lexError(String source) {
    return assertThrows(LexException.class, () -> lex(source)).kind();
  }

  @Test
  public void emptySource() throws LexException {
    assertThat(lex("")).isEmpty();
    assertThat(lex("  \n\t\r\n")).isEmpty();
  }

  @Test
  public void actionStatement() throws LexException {
    ImmutableList<Token> tokens = lex("p:all.sendMessage(\"hi\");");

    assertThat(tokens.stream().map(Token::kind).collect(Collectors.toList()))
        .containsExactly(
            Token.Kind.KEYWORD,
            Token.Kind.COLON,
            Token.Kind.SELECTOR,
            Token.Kind.DOT,
            Token.Kind.IDENTIFIER,
            Token.Kind.OPEN_PAREN,
            Token.Kind.TEXT,
            Token.Kind.CLOSE_PAREN,
            Token.Kind.SEMICOLON)
        .inOrder();
    assertThat(tokens.get(0).keyword()).hasValue(Token.Keyword.P);
    assertThat(tokens.get(2).selector()).hasValue(Selector.ALL_PLAYERS);
    assertThat(tokens.get(4).text()).isEqualTo("sendMessage");
    assertThat(tokens.get(6).text()).isEqualTo("hi");
  }

  @Test
  public void keywordsAreWholeWords() throws LexException {
    ImmutableList<Token> tokens = lex("ifp ifpx line lines");

    assertThat(tokens.get(0).keyword()).hasValue(Token.Keyword.IF_P);
    assertThat(tokens.get(1).kind()).isEqualTo(Token.Kind.IDENTIFIER);
    assertThat(tokens.get(2).keyword()).hasValue(Token.Keyword.LINE);
    assertThat(tokens.get(3).kind()).isEqualTo(Token.Kind.IDENTIFIER);
  }

  @Test
  public void numbers() throws LexException {
    ImmutableList<Token> tokens = lex("12 -3.5 1_000 0.25");

    assertThat(tokens.stream().map(Token::number).collect(Collectors.toList()))
        .containsExactly(12.0, -3.5, 1000.0, 0.25)
        .inOrder();
  }

  @Test
  public void minusWithoutDigitsIsPunctuation() throws LexException {
    assertThat(kinds("a - b"))
        .containsExactly(Token.Kind.IDENTIFIER, Token.Kind.MINUS, Token.Kind.IDENTIFIER)
        .inOrder();
  }

  @Test
  public void invalidNumbers() {
    assertThat(lexError("1.2.3")).isEqualTo(LexException.Kind.INVALID_NUMBER);
    assertThat(lexError("4-2")).isEqualTo(LexException.Kind.INVALID_NUMBER);
  }

  @Test
  public void quotedLiterals() throws LexException {
    ImmutableList<Token> tokens = lex("'str' \"text\" `var name`");

    assertThat(tokens.get(0).kind()).isEqualTo(Token.Kind.STRING);
    assertThat(tokens.get(0).text()).isEqualTo("str");
    assertThat(tokens.get(1).kind()).isEqualTo(Token.Kind.TEXT);
    assertThat(tokens.get(1).text()).isEqualTo("text");
    assertThat(tokens.get(2).kind()).isEqualTo(Token.Kind.VARIABLE);
    assertThat(tokens.get(2).text()).isEqualTo("var name");
  }

  @Test
  public void escapes() throws LexException {
    ImmutableList<Token> tokens = lex("'it\\'s' \"say \\\"hi\\\"\" 'back\\\\slash'");

    assertThat(tokens.get(0).text()).isEqualTo("it's");
    assertThat(tokens.get(1).text()).isEqualTo("say \"hi\"");
    assertThat(tokens.get(2).text()).isEqualTo("back\\slash");
  }

  @Test
  public void unterminatedLiterals() {
    assertThat(lexError("'abc")).isEqualTo(LexException.Kind.UNTERMINATED_STRING);
    assertThat(lexError("\"abc")).isEqualTo(LexException.Kind.UNTERMINATED_TEXT);
    assertThat(lexError("`abc")).isEqualTo(LexException.Kind.UNTERMINATED_VARIABLE);
  }

  @Test
  public void lineComments() throws LexException {
    assertThat(kinds("p // comment ; with tokens\ne"))
        .containsExactly(Token.Kind.KEYWORD, Token.Kind.KEYWORD)
        .inOrder();
    assertThat(kinds("a / b")).contains(Token.Kind.DIVIDE);
  }

  @Test
  public void invalidCharacter() {
    LexException ex = assertThrows(LexException.class, () -> lex("p.a(#);"));

    assertThat(ex.kind()).isEqualTo(LexException.Kind.INVALID_TOKEN);
    assertThat(ex.range().start()).isEqualTo(new Lexer.Pos(1, 5));
  }

  @Test
  public void positionsTrackLines() throws LexException {
    ImmutableList<Token> tokens = lex("p\n  e");

    assertThat(tokens.get(0).range().start()).isEqualTo(new Lexer.Pos(1, 1));
    assertThat(tokens.get(1).range().start()).isEqualTo(new Lexer.Pos(2, 3));
  }

  @Test
  public void singleCharacterTokens() throws LexException {
    for (Token.Kind kind : Token.Kind.values()) {
      if (!kind.isPunctuation()) continue;

      ImmutableList<Token> tokens = lex(kind.repr());

      assertThat(tokens).hasSize(1);
      assertThat(tokens.get(0).kind()).isEqualTo(kind);
      assertThat(tokens.get(0).range().start()).isEqualTo(new Lexer.Pos(1, 1));
    }
  }

  @Test
  public void tokenRanges() throws LexException {
    ImmutableList<Token> tokens = lex("+  -\n*/\n'abc'`test`  \n123 ");

    assertThat(tokens.stream().map(Token::kind).collect(Collectors.toList()))
        .containsExactly(
            Token.Kind.PLUS,
            Token.Kind.MINUS,
            Token.Kind.MULTIPLY,
            Token.Kind.DIVIDE,
            Token.Kind.STRING,
            Token.Kind.VARIABLE,
            Token.Kind.NUMBER)
        .inOrder();
    assertThat(tokens.stream().map(Token::range).collect(Collectors.toList()))
        .containsExactly(
            range(1, 1, 1, 1),
            range(1, 4, 1, 4),
            range(2, 1, 2, 1),
            range(2, 2, 2, 2),
            range(3, 1, 3, 6),
            range(3, 6, 3, 12),
            range(4, 1, 4, 4))
        .inOrder();
    assertThat(tokens.get(4).text()).isEqualTo("abc");
    assertThat(tokens.get(5).text()).isEqualTo("test");
    assertThat(tokens.get(6).number()).isEqualTo(123.0);
  }

  @Test
  public void malformedDecimals() throws LexException {
    assertThat(lexError("0.0.0")).isEqualTo(LexException.Kind.INVALID_NUMBER);
    assertThat(lexError("1.-2")).isEqualTo(LexException.Kind.INVALID_NUMBER);
    assertThat(lexError("0..")).isEqualTo(LexException.Kind.INVALID_NUMBER);
    assertThat(lex("172_424.51").get(0).number()).isEqualTo(172424.51);
  }

  private static Lexer.Range range(int startLine, int startColumn, int endLine, int endColumn) {
    return Lexer.Range.create(
        new Lexer.Pos(startLine, startColumn), new Lexer.Pos(endLine, endColumn));
  }
}
