package dfrs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * Resolves names in a parsed file against the action catalog and checks every argument list.
 * Validation rewrites the tree in place: names become wire names and arguments are given their
 * wire slots. Function signatures and variable types are collected per file and start empty
 * on every call to {@link #validate}.
 */
public class Validator {
  private static final Logger logger = LoggerFactory.getLogger(Validator.class);

  private static final ActionCatalog.ArgOption ANY_OPTION =
      ActionCatalog.ArgOption.create("", ArgType.ANY, false, false);

  private final ActionCatalog catalog;
  private final CompilerOptions options;
  private final VariableTypeContext variableTypes = new VariableTypeContext();
  private final Map<String, ActionCatalog.Action> functions = new HashMap<>();

  public Validator(ActionCatalog catalog) {
    this(catalog, CompilerOptions.defaults());
  }

  public Validator(ActionCatalog catalog, CompilerOptions options) {
    this.catalog = catalog;
    this.options = options;
  }

  public AST validate(AST ast) throws ValidateException {
    functions.clear();
    variableTypes.clear();
    for (AST.Function function : ast.functions()) {
      functions.put(function.dfrsName(), functionEntry(function));
    }

    for (AST.Function function : ast.functions()) {
      variableTypes.enterUnit();
      for (AST.Param param : function.params()) {
        if (param.type().isVariableType() && !param.plural()) {
          variableTypes.bind(
              new ArgValue.Variable(
                  param.name(), param.name(), VariableScope.LINE, Optional.empty()),
              param.type().argType());
        }
      }
      validateBody(function.body());
    }

    for (AST.Process process : ast.processes()) {
      variableTypes.enterUnit();
      validateBody(process.body());
    }

    for (AST.Event event : ast.events()) {
      variableTypes.enterUnit();
      ActionCatalog.Action definition =
          catalog
              .event(event.name())
              .orElseThrow(
                  () ->
                      new ValidateException(
                          ValidateException.Kind.UNKNOWN_EVENT,
                          event.nameRange(),
                          String.format("Unknown event '%s'", event.name())));
      event.resolve(definition);
      validateBody(event.body());
    }

    logger.debug(
        "Validated {} events, {} functions, {} processes",
        ast.events().size(),
        ast.functions().size(),
        ast.processes().size());
    return ast;
  }

  // Calls are checked against a synthetic entry that mirrors the function's parameters.
  private static ActionCatalog.Action functionEntry(AST.Function function) {
    ImmutableList<ActionCatalog.ArgSlot> slots =
        function.params().stream()
            .map(
                p ->
                    ActionCatalog.ArgSlot.of(
                        ActionCatalog.ArgOption.create(
                            p.name(),
                            p.type().argType(),
                            p.optional() || p.defaultValue().isPresent(),
                            p.plural())))
            .collect(ImmutableList.toImmutableList());
    String dfrsName = "fn " + function.dfrsName();
    return ActionCatalog.Action.create(
        dfrsName,
        function.wireName(),
        Codeblock.CALL_FUNCTION,
        ImmutableList.of(),
        Optional.empty(),
        ImmutableList.of(),
        ImmutableList.of(ActionCatalog.ArgBranch.create(slots)),
        "### " + dfrsName + "  \n");
  }

  // Accepts any number of untyped arguments.
  private static ActionCatalog.Action permissiveEntry(String name, List<Arg> args) {
    ImmutableList<ActionCatalog.ArgSlot> slots =
        args.stream()
            .filter(a -> a.value().kind() != ArgValue.Kind.TAG)
            .map(a -> ActionCatalog.ArgSlot.of(ANY_OPTION))
            .collect(ImmutableList.toImmutableList());
    return ActionCatalog.Action.create(
        "internal",
        name,
        Codeblock.CALL_FUNCTION,
        ImmutableList.of(),
        Optional.empty(),
        ImmutableList.of(),
        ImmutableList.of(ActionCatalog.ArgBranch.create(slots)),
        "");
  }

  private void validateBody(List<Expression> body) throws ValidateException {
    for (Expression expression : body) {
      validateExpression(expression);
    }
  }

  private void validateExpression(Expression expression) throws ValidateException {
    switch (expression.type()) {
      case ACTION:
        {
          Expression.Action action = expression.cast();
          validateAction(action, action.args());
          break;
        }
      case CONDITIONAL:
        validateConditional(expression.cast());
        break;
      case REPEAT:
        validateRepeat(expression.cast());
        break;
      case CALL:
        validateCall(expression.cast());
        break;
      case START:
        validateStart(expression.cast());
        break;
      case VARIABLE:
        {
          Expression.Variable variable = expression.cast();
          if (variable.declaredType().isPresent()) {
            variableTypes.bind(variable.toArgValue(), variable.declaredType().get());
          }
          if (variable.action().isPresent()) {
            // The assigned variable becomes the first argument of the action.
            Expression.Action action = variable.action().get();
            List<Arg> args = new ArrayList<>();
            args.add(Arg.create(variable.toArgValue(), 0, variable.range()));
            args.addAll(action.args());
            validateAction(action, args);
          }
          break;
        }
      default:
        throw new AssertionError(expression.type());
    }
  }

  private void validateAction(Expression.Action action, List<Arg> args)
      throws ValidateException {
    ActionCatalog.Action definition =
        lookup(action.kind().codeblock(), action.name(), action.nameRange());
    List<Arg> validated =
        startsWithCondition(args)
            ? validateCondition(args, action.range())
            : validateArgs(args, definition, action.range());
    action.resolve(definition.wireName(), validated, definition);
  }

  private void validateConditional(Expression.Conditional conditional) throws ValidateException {
    ActionCatalog.Action definition =
        lookup(conditional.kind().codeblock(), conditional.name(), conditional.nameRange());
    conditional.resolve(
        definition.wireName(),
        validateArgs(conditional.args(), definition, conditional.range()),
        definition);

    validateBody(conditional.body());
    if (conditional.elseBody().isPresent()) validateBody(conditional.elseBody().get());
  }

  private void validateRepeat(Expression.Repeat repeat) throws ValidateException {
    ActionCatalog.Action definition =
        lookup(Codeblock.REPEAT, repeat.name(), repeat.nameRange());
    List<Arg> validated =
        startsWithCondition(repeat.args())
            ? validateCondition(repeat.args(), repeat.range())
            : validateArgs(repeat.args(), definition, repeat.range());
    repeat.resolve(definition.wireName(), validated, definition);

    validateBody(repeat.body());
  }

  private void validateCall(Expression.Call call) throws ValidateException {
    ActionCatalog.Action definition;
    if (call.byWireName()) {
      definition = permissiveEntry(call.name(), call.args());
    } else if (functions.containsKey(call.name())) {
      definition = functions.get(call.name());
    } else if (options.strictCalls()) {
      throw new ValidateException(
          ValidateException.Kind.UNKNOWN_FUNCTION,
          call.nameRange(),
          String.format("Unknown function '%s'", call.name()));
    } else {
      logger.debug("Call to undeclared function '{}' accepts any arguments", call.name());
      definition = permissiveEntry(call.name(), call.args());
    }

    call.resolve(
        definition.wireName(), validateArgs(call.args(), definition, call.range()), definition);
  }

  private void validateStart(Expression.Start start) throws ValidateException {
    ActionCatalog.Action definition =
        catalog.actions(Codeblock.START_PROCESS).stream()
            .findFirst()
            .orElseGet(() -> permissiveEntry(start.name(), start.args()));
    start.resolve(start.name(), validateArgs(start.args(), definition, start.range()), definition);
  }

  private ActionCatalog.Action lookup(Codeblock codeblock, String name, Lexer.Range range)
      throws ValidateException {
    return catalog
        .get(codeblock, name)
        .orElseThrow(
            () ->
                new ValidateException(
                    ValidateException.Kind.UNKNOWN_ACTION,
                    range,
                    String.format("Unknown action '%s'", name)));
  }

  private static boolean startsWithCondition(List<Arg> args) {
    return !args.isEmpty() && args.get(0).value().kind() == ArgValue.Kind.CONDITION;
  }

  /**
   * Validates a conditional used as the first argument of an action or repeat against the
   * conditional tables, and reattaches it with its resolved name and arguments.
   */
  private List<Arg> validateCondition(List<Arg> args, Lexer.Range range)
      throws ValidateException {
    Arg conditionArg = args.get(0);
    ArgValue.Condition condition = conditionArg.value().cast();
    if (args.size() > 1) {
      throw new ValidateException(
          ValidateException.Kind.TOO_MANY_ARGUMENTS,
          args.get(1).range(),
          String.format("Too many arguments for action '%s'", condition.name()));
    }

    ActionCatalog.Action definition =
        lookup(condition.conditionalKind().codeblock(), condition.name(), conditionArg.range());
    List<Arg> validated = validateArgs(condition.args(), definition, conditionArg.range());
    ArgValue.Condition resolved = condition.withNameAndArgs(definition.wireName(), validated);
    return ImmutableList.of(conditionArg.withValue(resolved).withIndex(0));
  }

  /**
   * Matches positional arguments against the branches of the definition, then resolves tags. The
   * result holds the positional arguments in wire slot order followed by one tag per declared tag.
   */
  List<Arg> validateArgs(List<Arg> args, ActionCatalog.Action definition, Lexer.Range range)
      throws ValidateException {
    List<Arg> tags = new ArrayList<>();
    List<ArgumentMatcher.Input> inputs = new ArrayList<>();
    for (Arg arg : args) {
      if (arg.value().kind() == ArgValue.Kind.TAG) {
        tags.add(arg);
      } else {
        inputs.add(resolveInput(arg, inputs.isEmpty(), definition));
      }
    }

    Optional<ArgumentMatcher.Failure> failure =
        ArgumentMatcher.match(definition.branches(), inputs);
    if (failure.isPresent()) throw matchError(failure.get(), definition, range);

    List<Arg> validated = new ArrayList<>();
    for (int i = 0; i < inputs.size(); i++) {
      validated.add(inputs.get(i).arg().withIndex(i));
    }
    validated.addAll(validateTags(tags, definition));
    return validated;
  }

  private ArgumentMatcher.Input resolveInput(
      Arg arg, boolean first, ActionCatalog.Action definition) throws ValidateException {
    switch (arg.value().kind()) {
      case GAME_VALUE:
        {
          ArgValue.GameValue value = arg.value().cast();
          ActionCatalog.GameValue gameValue =
              catalog
                  .gameValue(value.dfrsName())
                  .orElseThrow(
                      () ->
                          new ValidateException(
                              ValidateException.Kind.UNKNOWN_GAME_VALUE,
                              arg.range(),
                              String.format("Unknown game_value '%s'", value.dfrsName())));
          return ArgumentMatcher.Input.create(
              arg.withValue(value.resolve(gameValue.wireName(), gameValue.type())),
              gameValue.type());
        }
      case VARIABLE:
        {
          ArgValue.Variable variable = arg.value().cast();
          if (first && definition.returnType().isPresent()) {
            variableTypes.bind(variable, definition.returnType().get());
          }
          return ArgumentMatcher.Input.create(arg, variableTypes.typeOf(variable));
        }
      default:
        return ArgumentMatcher.Input.of(arg);
    }
  }

  private static ValidateException matchError(
      ArgumentMatcher.Failure failure, ActionCatalog.Action definition, Lexer.Range range) {
    ImmutableList<ActionCatalog.ArgOption> options = failure.options();
    switch (failure.kind()) {
      case MISSING_ARGUMENT:
        {
          String msg;
          if (options.size() == 1) {
            msg = String.format("Missing argument '%s'", options.get(0).description());
          } else {
            msg =
                options.stream()
                    .map(o -> "\n     - " + o.description())
                    .collect(Collectors.joining("", "Missing argument, possible options:", ""));
          }
          return new ValidateException(ValidateException.Kind.MISSING_ARGUMENT, range, msg);
        }
      case WRONG_ARGUMENT_TYPE:
        {
          ArgumentMatcher.Input found = failure.found().get();
          String msg;
          if (options.size() == 1) {
            msg =
                String.format(
                    "Wrong argument type for '%s', expected '%s' but found '%s'",
                    options.get(0).description(), options.get(0).type(), found.type());
          } else {
            msg =
                options.stream()
                    .map(o -> String.format("\n     - %s (%s)", o.type(), o.description()))
                    .collect(
                        Collectors.joining(
                            "",
                            String.format(
                                "Wrong argument type, found '%s' but expected one of",
                                found.type()),
                            ""));
          }
          return new ValidateException(
              ValidateException.Kind.WRONG_ARGUMENT_TYPE, found.arg().range(), msg);
        }
      case TOO_MANY_ARGUMENTS:
        return new ValidateException(
            ValidateException.Kind.TOO_MANY_ARGUMENTS,
            failure.found().get().arg().range(),
            String.format("Too many arguments for action '%s'", definition.dfrsName()));
      default:
        throw new AssertionError(failure.kind());
    }
  }

  /** Checks the supplied tags and fills in the default option of every tag left out. */
  private static List<Arg> validateTags(List<Arg> given, ActionCatalog.Action definition)
      throws ValidateException {
    Map<String, Arg> supplied = new HashMap<>();
    for (Arg arg : given) {
      ArgValue.Tag tag = arg.value().cast();
      Optional<ActionCatalog.TagDefinition> tagDefinition = definition.tag(tag.name());
      if (!tagDefinition.isPresent()) {
        throw new ValidateException(
            ValidateException.Kind.UNKNOWN_TAG,
            arg.range(),
            String.format(
                "Unknown tag '%s', found tags: %s",
                tag.name(),
                definition.tags().stream()
                    .map(ActionCatalog.TagDefinition::dfrsName)
                    .collect(Collectors.toList())));
      }

      ActionCatalog.TagDefinition def = tagDefinition.get();
      Optional<String> option = tagOption(tag.value());
      if (!option.isPresent() || !def.options().contains(option.get())) {
        throw new ValidateException(
            ValidateException.Kind.INVALID_TAG_OPTION,
            arg.range(),
            String.format(
                "Invalid option '%s' for tag '%s', expected one of %s",
                option.orElse(tag.value().toString()), tag.name(), def.options()));
      }
      supplied.put(def.dfrsName(), arg);
    }

    List<Arg> tags = new ArrayList<>();
    for (ActionCatalog.TagDefinition def : definition.tags()) {
      Arg arg = supplied.get(def.dfrsName());
      if (arg != null) {
        ArgValue.Tag tag = arg.value().cast();
        tags.add(
            Arg.create(
                new ArgValue.Tag(
                    def.wireName(),
                    new ArgValue.TextLiteral(tagOption(tag.value()).get()),
                    Optional.of(def)),
                def.slot(),
                arg.range()));
      } else {
        tags.add(
            Arg.create(
                new ArgValue.Tag(
                    def.wireName(),
                    new ArgValue.TextLiteral(def.defaultOption()),
                    Optional.of(def)),
                def.slot(),
                Lexer.Range.origin()));
      }
    }
    return tags;
  }

  private static Optional<String> tagOption(ArgValue value) {
    switch (value.kind()) {
      case TEXT:
        return Optional.of(value.<ArgValue.TextLiteral>cast().text());
      case STRING:
        return Optional.of(value.<ArgValue.StringLiteral>cast().string());
      default:
        return Optional.empty();
    }
  }
}
