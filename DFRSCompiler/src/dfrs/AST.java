package dfrs;

import java.util.Optional;
import java.util.stream.Stream;

import com.google.common.collect.ImmutableList;

/** The root of a parsed source file. */
public class AST {

  public static class Use {
    private final String file;
    private final Lexer.Range range;

    public Use(String file, Lexer.Range range) {
      this.file = file;
      this.range = range;
    }

    public String file() {
      return file;
    }

    public Lexer.Range range() {
      return range;
    }
  }

  public static class Event {
    private String name;
    private Codeblock codeblock = Codeblock.PLAYER_EVENT;
    private Optional<ActionCatalog.Action> definition = Optional.empty();
    private final boolean cancelled;
    private final ImmutableList<Expression> body;
    private final Lexer.Range range;
    private final Lexer.Range nameRange;

    public Event(
        String name,
        boolean cancelled,
        Iterable<Expression> body,
        Lexer.Range range,
        Lexer.Range nameRange) {
      this.name = name;
      this.cancelled = cancelled;
      this.body = ImmutableList.copyOf(body);
      this.range = range;
      this.nameRange = nameRange;
    }

    /** The DSL name until validation, the wire name afterwards. */
    public String name() {
      return name;
    }

    public Codeblock codeblock() {
      return codeblock;
    }

    public Optional<ActionCatalog.Action> definition() {
      return definition;
    }

    public boolean cancelled() {
      return cancelled;
    }

    public ImmutableList<Expression> body() {
      return body;
    }

    public Lexer.Range range() {
      return range;
    }

    public Lexer.Range nameRange() {
      return nameRange;
    }

    public void resolve(ActionCatalog.Action definition) {
      this.name = definition.wireName();
      this.codeblock = definition.codeblock();
      this.definition = Optional.of(definition);
    }
  }

  public static class Param {
    private final String name;
    private final ParamType type;
    private final boolean optional;
    private final boolean plural;
    private final Optional<ArgValue> defaultValue;

    public Param(
        String name,
        ParamType type,
        boolean optional,
        boolean plural,
        Optional<ArgValue> defaultValue) {
      this.name = name;
      this.type = type;
      this.optional = optional;
      this.plural = plural;
      this.defaultValue = defaultValue;
    }

    public String name() {
      return name;
    }

    public ParamType type() {
      return type;
    }

    public boolean optional() {
      return optional;
    }

    public boolean plural() {
      return plural;
    }

    public Optional<ArgValue> defaultValue() {
      return defaultValue;
    }
  }

  public static class Function {
    private final String dfrsName;
    private final String wireName;
    private final ImmutableList<Param> params;
    private final ImmutableList<Expression> body;
    private final Lexer.Range range;
    private final Lexer.Range nameRange;

    public Function(
        String dfrsName,
        String wireName,
        Iterable<Param> params,
        Iterable<Expression> body,
        Lexer.Range range,
        Lexer.Range nameRange) {
      this.dfrsName = dfrsName;
      this.wireName = wireName;
      this.params = ImmutableList.copyOf(params);
      this.body = ImmutableList.copyOf(body);
      this.range = range;
      this.nameRange = nameRange;
    }

    public String dfrsName() {
      return dfrsName;
    }

    public String wireName() {
      return wireName;
    }

    public ImmutableList<Param> params() {
      return params;
    }

    public ImmutableList<Expression> body() {
      return body;
    }

    public Lexer.Range range() {
      return range;
    }

    public Lexer.Range nameRange() {
      return nameRange;
    }
  }

  public static class Process {
    private final String name;
    private final ImmutableList<Expression> body;
    private final Lexer.Range range;
    private final Lexer.Range nameRange;

    public Process(
        String name, Iterable<Expression> body, Lexer.Range range, Lexer.Range nameRange) {
      this.name = name;
      this.body = ImmutableList.copyOf(body);
      this.range = range;
      this.nameRange = nameRange;
    }

    public String name() {
      return name;
    }

    public ImmutableList<Expression> body() {
      return body;
    }

    public Lexer.Range range() {
      return range;
    }

    public Lexer.Range nameRange() {
      return nameRange;
    }
  }

  private final ImmutableList<Use> uses;
  private final ImmutableList<Event> events;
  private final ImmutableList<Function> functions;
  private final ImmutableList<Process> processes;
  private final Lexer.Range range;

  public AST(
      Iterable<Use> uses,
      Iterable<Event> events,
      Iterable<Function> functions,
      Iterable<Process> processes,
      Lexer.Range range) {
    this.uses = ImmutableList.copyOf(uses);
    this.events = ImmutableList.copyOf(events);
    this.functions = ImmutableList.copyOf(functions);
    this.processes = ImmutableList.copyOf(processes);
    this.range = range;
  }

  public ImmutableList<Use> uses() {
    return uses;
  }

  public ImmutableList<Event> events() {
    return events;
  }

  public ImmutableList<Function> functions() {
    return functions;
  }

  public ImmutableList<Process> processes() {
    return processes;
  }

  public Lexer.Range range() {
    return range;
  }

  /** Adds the functions and processes of a used file to this one. */
  public AST include(AST used) {
    return new AST(
        uses,
        events,
        Stream.concat(functions.stream(), used.functions.stream())
            .collect(ImmutableList.toImmutableList()),
        Stream.concat(processes.stream(), used.processes.stream())
            .collect(ImmutableList.toImmutableList()),
        range);
  }
}
