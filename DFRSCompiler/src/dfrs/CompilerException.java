package dfrs;

import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Lexer.Range range;
  private final String errorMsg;

  public CompilerException(Lexer.Range range, String errorMsg) {
    super(errorMsg);
    this.range = range;
    this.errorMsg = errorMsg;
  }

  public Lexer.Range range() {
    return range;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public void print() {
    System.out.println(
        String.format(
            "ERROR: %d:%d %s", range.start().line(), range.start().column(), errorMsg));
  }

  public void print(String source) {
    System.out.println(format(source));
  }

  // Renders the message followed by the offending source line, with the range underlined.
  public String format(String source) {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("ERROR: %s at %s%n", errorMsg, range.start()));

    List<String> lines = Splitter.on('\n').splitToList(source);
    int line = range.start().line();
    if (line < 1 || line > lines.size()) return sb.toString();

    String lineText = lines.get(line - 1);
    String gutter = Integer.toString(line);
    int start = Math.max(range.start().column(), 1);
    int end =
        range.end().line() == line
            ? Math.max(range.end().column(), start + 1)
            : lineText.length() + 1;

    sb.append(Strings.repeat(" ", gutter.length())).append(" |").append(System.lineSeparator());
    sb.append(gutter).append(" | ").append(lineText).append(System.lineSeparator());
    sb.append(Strings.repeat(" ", gutter.length()))
        .append(" | ")
        .append(Strings.repeat(" ", start - 1))
        .append(Strings.repeat("^", end - start));
    return sb.toString();
  }
}
