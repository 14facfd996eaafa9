package dfrs;

import java.util.Arrays;
import java.util.Optional;

/** The statement prefixes `p`, `e`, `g`, `v`, `c` and `s`. */
public enum ActionKind {
  PLAYER(Token.Keyword.P, Codeblock.PLAYER_ACTION),
  ENTITY(Token.Keyword.E, Codeblock.ENTITY_ACTION),
  GAME(Token.Keyword.G, Codeblock.GAME_ACTION),
  VARIABLE(Token.Keyword.V, Codeblock.SET_VARIABLE),
  CONTROL(Token.Keyword.C, Codeblock.CONTROL),
  SELECT(Token.Keyword.S, Codeblock.SELECT_OBJECT);

  private final Token.Keyword keyword;
  private final Codeblock codeblock;

  private ActionKind(Token.Keyword keyword, Codeblock codeblock) {
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

  public static Optional<ActionKind> forKeyword(Token.Keyword keyword) {
    return Arrays.stream(values()).filter(k -> k.keyword == keyword).findFirst();
  }

  public static Optional<ActionKind> forCodeblock(Codeblock codeblock) {
    return Arrays.stream(values()).filter(k -> k.codeblock == codeblock).findFirst();
  }
}
