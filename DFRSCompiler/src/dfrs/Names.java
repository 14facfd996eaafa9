package dfrs;

import java.util.Iterator;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/** Conversions between action dump names and the identifiers the language uses. */
public final class Names {

  private static final Splitter WORDS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

  // Order matters: compound operators must be rewritten before their single-char parts.
  private static final String[][] OPERATORS = {
    {"+=", "addDirect"},
    {"-=", "subDirect"},
    {"<=", "lessEqual"},
    {">=", "greaterEqual"},
    {">", "greater"},
    {"<", "less"},
    {"!=", "notEqual"},
    {"+", "add"},
    {"-", "sub"},
    {"%", "mod"},
    {"/", "div"},
    {"=", "equal"},
  };

  private Names() {}

  /** "Send Message" -> "sendMessage", "+=" -> "addDirect", "x" -> "mul". */
  public static String toDfrsName(String name) {
    String replaced = name.trim();
    for (String[] operator : OPERATORS) {
      replaced = replaced.replace(operator[0], operator[1]);
    }
    replaced = CharMatcher.is(' ').removeFrom(replaced);
    if (replaced.equals("x")) replaced = "mul";
    if (replaced.isEmpty()) return replaced;

    return Character.toLowerCase(replaced.charAt(0)) + replaced.substring(1);
  }

  /** "Alignment Mode" -> "alignmentMode". */
  public static String toCamelCase(String name) {
    StringBuilder sb = new StringBuilder();
    Iterator<String> words = WORDS.split(name).iterator();
    if (words.hasNext()) sb.append(Ascii.toLowerCase(words.next()));
    while (words.hasNext()) {
      String word = words.next();
      sb.append(Character.toUpperCase(word.charAt(0)));
      sb.append(Ascii.toLowerCase(word.substring(1)));
    }
    return sb.toString();
  }

  /** Rewrites a wire variable name into a legal identifier. */
  public static String sanitizeVariable(String name) {
    return name.replace('-', '_')
        .replace("%", "")
        .replace(' ', '_')
        .replace('(', '_')
        .replace(")", "");
  }
}
