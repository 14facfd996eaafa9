package dfrs;

import java.util.Arrays;
import java.util.Optional;

/** The conditional prefixes `ifp`, `ife`, `ifg` and `ifv`. */
public enum ConditionalKind {
  PLAYER(Token.Keyword.IF_P, Codeblock.IF_PLAYER),
  ENTITY(Token.Keyword.IF_E, Codeblock.IF_ENTITY),
  GAME(Token.Keyword.IF_G, Codeblock.IF_GAME),
  VARIABLE(Token.Keyword.IF_V, Codeblock.IF_VARIABLE);

  private final Token.Keyword keyword;
  private final Codeblock codeblock;

  private ConditionalKind(Token.Keyword keyword, Codeblock codeblock) {
    this.keyword = keyword;
    this.codeblock = codeblock;
  }

  public Token.Keyword keyword() {
    return keyword;
  }

  public Codeblock codeblock() {
    return codeblock;
  }

  public boolean takesSelector() {
    return codeblock.hasTarget();
  }

  public static Optional<ConditionalKind> forKeyword(Token.Keyword keyword) {
    return Arrays.stream(values()).filter(k -> k.keyword == keyword).findFirst();
  }

  public static Optional<ConditionalKind> forCodeblock(Codeblock codeblock) {
    return Arrays.stream(values()).filter(k -> k.codeblock == codeblock).findFirst();
  }
}
