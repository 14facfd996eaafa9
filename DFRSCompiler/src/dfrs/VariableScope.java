package dfrs;

import java.util.Arrays;
import java.util.Optional;

public enum VariableScope {
  LINE(Token.Keyword.LINE, "line"),
  LOCAL(Token.Keyword.LOCAL, "local"),
  GAME(Token.Keyword.GAME, "unsaved"),
  SAVE(Token.Keyword.SAVE, "saved");

  private final Token.Keyword keyword;
  private final String wireName;

  private VariableScope(Token.Keyword keyword, String wireName) {
    this.keyword = keyword;
    this.wireName = wireName;
  }

  public Token.Keyword keyword() {
    return keyword;
  }

  public String wireName() {
    return wireName;
  }

  // Game and save variables outlive the unit that declares them.
  public boolean isGlobal() {
    return this == GAME || this == SAVE;
  }

  public static Optional<VariableScope> forKeyword(Token.Keyword keyword) {
    return Arrays.stream(values()).filter(s -> s.keyword == keyword).findFirst();
  }

  public static Optional<VariableScope> forWireName(String name) {
    return Arrays.stream(values()).filter(s -> s.wireName.equals(name)).findFirst();
  }
}
