package dfrs;

import com.google.auto.value.AutoValue;

/** An argument value bound to the wire slot it is written to. */
@AutoValue
public abstract class Arg {
  public abstract ArgValue value();

  public abstract int index();

  public abstract Lexer.Range range();

  public ArgType type() {
    return value().type();
  }

  public Arg withIndex(int index) {
    return create(value(), index, range());
  }

  public Arg withValue(ArgValue value) {
    return create(value, index(), range());
  }

  public static Arg create(ArgValue value, int index, Lexer.Range range) {
    return new AutoValue_Arg(value, index, range);
  }
}
