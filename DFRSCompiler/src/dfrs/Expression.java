package dfrs;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/** A statement inside an event, function or process body. */
public abstract class Expression {

  public enum Type {
    ACTION,
    CONDITIONAL,
    VARIABLE,
    CALL,
    START,
    REPEAT;
  }

  private final Type type;
  private final Lexer.Range range;

  protected Expression(Type type, Lexer.Range range) {
    this.type = type;
    this.range = range;
  }

  public final Type type() {
    return type;
  }

  public final Lexer.Range range() {
    return range;
  }

  @SuppressWarnings("unchecked")
  public <T extends Expression> T cast() {
    return (T) this;
  }

  /**
   * A statement with a name and an argument list checked against the action catalog. Validation
   * rewrites the name to its wire name and replaces the arguments with their slotted form.
   */
  public abstract static class Invocation extends Expression {
    private String name;
    private ImmutableList<Arg> args;
    private final Lexer.Range nameRange;
    private Optional<ActionCatalog.Action> definition = Optional.empty();

    protected Invocation(
        Type type, String name, List<Arg> args, Lexer.Range range, Lexer.Range nameRange) {
      super(type, range);
      this.name = name;
      this.args = ImmutableList.copyOf(args);
      this.nameRange = nameRange;
    }

    public String name() {
      return name;
    }

    public ImmutableList<Arg> args() {
      return args;
    }

    public Lexer.Range nameRange() {
      return nameRange;
    }

    public Optional<ActionCatalog.Action> definition() {
      return definition;
    }

    public void resolve(String name, List<Arg> args, ActionCatalog.Action definition) {
      this.name = name;
      this.args = ImmutableList.copyOf(args);
      this.definition = Optional.of(definition);
    }
  }

  public static class Action extends Invocation {
    private final ActionKind kind;
    private final Selector selector;

    public Action(
        ActionKind kind,
        Selector selector,
        String name,
        List<Arg> args,
        Lexer.Range range,
        Lexer.Range nameRange) {
      super(Type.ACTION, name, args, range, nameRange);
      this.kind = kind;
      this.selector = selector;
    }

    public ActionKind kind() {
      return kind;
    }

    public Selector selector() {
      return selector;
    }
  }

  public static class Conditional extends Invocation {
    private final ConditionalKind kind;
    private final Selector selector;
    private final boolean inverted;
    private final ImmutableList<Expression> body;
    private final Optional<ImmutableList<Expression>> elseBody;

    public Conditional(
        ConditionalKind kind,
        Selector selector,
        boolean inverted,
        String name,
        List<Arg> args,
        Iterable<Expression> body,
        Optional<ImmutableList<Expression>> elseBody,
        Lexer.Range range,
        Lexer.Range nameRange) {
      super(Type.CONDITIONAL, name, args, range, nameRange);
      this.kind = kind;
      this.selector = selector;
      this.inverted = inverted;
      this.body = ImmutableList.copyOf(body);
      this.elseBody = elseBody;
    }

    public ConditionalKind kind() {
      return kind;
    }

    public Selector selector() {
      return selector;
    }

    public boolean inverted() {
      return inverted;
    }

    public ImmutableList<Expression> body() {
      return body;
    }

    public Optional<ImmutableList<Expression>> elseBody() {
      return elseBody;
    }
  }

  public static class Repeat extends Invocation {
    private final ImmutableList<Expression> body;

    public Repeat(
        String name,
        List<Arg> args,
        Iterable<Expression> body,
        Lexer.Range range,
        Lexer.Range nameRange) {
      super(Type.REPEAT, name, args, range, nameRange);
      this.body = ImmutableList.copyOf(body);
    }

    public ImmutableList<Expression> body() {
      return body;
    }
  }

  public static class Call extends Invocation {
    // Calls spelled with a quoted wire name skip the function lookup by DSL name.
    private final boolean byWireName;

    public Call(
        String name, boolean byWireName, List<Arg> args, Lexer.Range range, Lexer.Range nameRange) {
      super(Type.CALL, name, args, range, nameRange);
      this.byWireName = byWireName;
    }

    public boolean byWireName() {
      return byWireName;
    }
  }

  public static class Start extends Invocation {
    public Start(String name, List<Arg> args, Lexer.Range range, Lexer.Range nameRange) {
      super(Type.START, name, args, range, nameRange);
    }
  }

  // Declares a variable, optionally assigning it the result of an action.
  public static class Variable extends Expression {
    private final VariableScope scope;
    private final String dfrsName;
    private final String wireName;
    private final Optional<ArgType> declaredType;
    private final Optional<Action> action;

    public Variable(
        VariableScope scope,
        String dfrsName,
        String wireName,
        Optional<ArgType> declaredType,
        Optional<Action> action,
        Lexer.Range range) {
      super(Type.VARIABLE, range);
      this.scope = scope;
      this.dfrsName = dfrsName;
      this.wireName = wireName;
      this.declaredType = declaredType;
      this.action = action;
    }

    public VariableScope scope() {
      return scope;
    }

    public String dfrsName() {
      return dfrsName;
    }

    public String wireName() {
      return wireName;
    }

    public Optional<ArgType> declaredType() {
      return declaredType;
    }

    public Optional<Action> action() {
      return action;
    }

    public ArgValue.Variable toArgValue() {
      return new ArgValue.Variable(dfrsName, wireName, scope, declaredType);
    }
  }
}
