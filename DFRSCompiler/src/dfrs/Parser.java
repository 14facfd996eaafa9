package dfrs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/** Recursive descent parser from a token stream to an {@link AST}. */
public class Parser {
  private final ImmutableList<Token> tokens;
  private int index = -1;
  private Token current = null;

  // Variables in scope; line and local ones are dropped after each top level item.
  private final List<Expression.Variable> variables = new ArrayList<>();

  public Parser(List<Token> tokens) {
    this.tokens = ImmutableList.copyOf(tokens);
  }

  public AST parse() throws ParseException {
    List<AST.Use> uses = new ArrayList<>();
    List<AST.Event> events = new ArrayList<>();
    List<AST.Function> functions = new ArrayList<>();
    List<AST.Process> processes = new ArrayList<>();

    Optional<Token> token = advance();
    while (token.isPresent()) {
      Token next = token.get();
      if (next.is(Token.Kind.AT)) {
        events.add(event());
      } else if (next.is(Token.Keyword.FN)) {
        functions.add(function());
      } else if (next.is(Token.Keyword.PROC)) {
        processes.add(process());
      } else if (next.is(Token.Keyword.GAME)) {
        variable(VariableScope.GAME, Optional.empty());
      } else if (next.is(Token.Keyword.SAVE)) {
        variable(VariableScope.SAVE, Optional.empty());
      } else if (next.is(Token.Keyword.USE)) {
        uses.add(use());
      } else {
        throw invalidToken(
            next, "@", "Keyword:fn", "Keyword:proc", "Keyword:game", "Keyword:save", "Keyword:use");
      }

      token = advance();
      variables.removeIf(v -> !v.scope().isGlobal());
    }

    Lexer.Pos start = new Lexer.Pos(1, 0);
    Lexer.Pos end = tokens.isEmpty() ? start : tokens.get(tokens.size() - 1).range().end();
    return new AST(uses, events, functions, processes, Lexer.Range.create(start, end));
  }

  private AST.Event event() throws ParseException {
    Lexer.Pos start = current.range().start();
    Token nameToken = advanceOrThrow("<any>");
    String name = name(nameToken);

    boolean cancelled = false;
    Token token = advanceOrThrow("{", "!");
    if (token.is(Token.Kind.EXCLAMATION_MARK)) {
      cancelled = true;
      require(Token.Kind.OPEN_PAREN_CURLY);
    } else if (!token.is(Token.Kind.OPEN_PAREN_CURLY)) {
      throw invalidToken(token, "{", "!");
    }

    ImmutableList<Expression> body = body();
    return new AST.Event(name, cancelled, body, rangeFrom(start), nameToken.range());
  }

  private AST.Function function() throws ParseException {
    Lexer.Pos start = current.range().start();
    Token nameToken = advanceOrThrow("<any>");
    String dfrsName = name(nameToken);
    String wireName = dfrsName;

    Token token = advanceOrThrow("(", ":");
    if (token.is(Token.Kind.COLON)) {
      token = advanceOrThrow("Variable");
      if (!token.is(Token.Kind.VARIABLE)) throw invalidToken(token, "Variable");
      wireName = token.text();
      require(Token.Kind.OPEN_PAREN);
    } else if (!token.is(Token.Kind.OPEN_PAREN)) {
      throw invalidToken(token, "(", ":");
    }

    List<AST.Param> params = new ArrayList<>();
    while (true) {
      token = advanceOrThrow("Identifier", ")");
      if (token.is(Token.Kind.CLOSE_PAREN)) break;
      if (!token.is(Token.Kind.IDENTIFIER)) throw invalidToken(token, "Identifier", ")");
      Token paramToken = token;

      require(Token.Kind.COLON);
      Token typeToken = advanceOrThrow("Identifier");
      if (!typeToken.is(Token.Kind.IDENTIFIER)) throw invalidToken(typeToken, "Identifier");
      ParamType type =
          ParamType.forDfrsName(typeToken.text())
              .orElseThrow(
                  () ->
                      new ParseException(
                          ParseException.Kind.INVALID_TYPE,
                          typeToken.range(),
                          "Unknown type: " + typeToken.text()));

      boolean optional = false;
      boolean plural = false;
      Optional<ArgValue> defaultValue = Optional.empty();
      token = advanceOrThrow(",", ")");
      while (!token.is(Token.Kind.COMMA) && !token.is(Token.Kind.CLOSE_PAREN)) {
        if (token.is(Token.Kind.MULTIPLY) && !plural) {
          plural = true;
        } else if (token.is(Token.Kind.QUESTION_MARK) && !optional) {
          optional = true;
        } else if (token.is(Token.Kind.EQUAL) && !defaultValue.isPresent()) {
          defaultValue = Optional.of(defaultValue());
        } else {
          throw invalidToken(token, ",", ")", "*", "?", "=");
        }
        token = advanceOrThrow(",", ")");
      }

      declare(
          new Expression.Variable(
              VariableScope.LINE,
              paramToken.text(),
              paramToken.text(),
              Optional.empty(),
              Optional.empty(),
              paramToken.range()));
      params.add(new AST.Param(paramToken.text(), type, optional, plural, defaultValue));
      if (token.is(Token.Kind.CLOSE_PAREN)) break;
    }

    require(Token.Kind.OPEN_PAREN_CURLY);
    ImmutableList<Expression> body = body();
    return new AST.Function(dfrsName, wireName, params, body, rangeFrom(start), nameToken.range());
  }

  private ArgValue defaultValue() throws ParseException {
    Token token = advanceOrThrow("<any>");
    switch (token.kind()) {
      case NUMBER:
        return new ArgValue.NumberLiteral(token.number());
      case TEXT:
        return new ArgValue.TextLiteral(token.text());
      case STRING:
        return new ArgValue.StringLiteral(token.text());
      case IDENTIFIER:
        switch (token.text()) {
          case "Location":
            return location().value();
          case "Vector":
            return vector().value();
          case "Sound":
            return sound().value();
          case "Potion":
            return potion().value();
          default:
            break;
        }
        break;
      default:
        break;
    }
    throw invalidToken(
        token, "Number", "Text", "String", "Location", "Vector", "Sound", "Potion");
  }

  private AST.Process process() throws ParseException {
    Lexer.Pos start = current.range().start();
    Token nameToken = advanceOrThrow("<any>");
    String name = name(nameToken);

    require(Token.Kind.OPEN_PAREN_CURLY);
    ImmutableList<Expression> body = body();
    return new AST.Process(name, body, rangeFrom(start), nameToken.range());
  }

  private AST.Use use() throws ParseException {
    Token token = advanceOrThrow("Text");
    if (!token.is(Token.Kind.TEXT)) {
      throw new ParseException(
          ParseException.Kind.INVALID_USE, token.range(), "Invalid use statement");
    }
    require(Token.Kind.SEMICOLON);
    return new AST.Use(token.text(), token.range());
  }

  // Reads expressions up to and including the closing curly brace.
  private ImmutableList<Expression> body() throws ParseException {
    ImmutableList.Builder<Expression> body = ImmutableList.builder();
    while (true) {
      Token token = advanceOrThrow("}");
      if (token.is(Token.Kind.CLOSE_PAREN_CURLY)) return body.build();
      body.add(expression());
    }
  }

  private Expression expression() throws ParseException {
    Token token = current;
    if (token.is(Token.Kind.KEYWORD)) {
      Token.Keyword keyword = token.keyword().get();
      Optional<ActionKind> actionKind = ActionKind.forKeyword(keyword);
      if (actionKind.isPresent()) return action(actionKind.get());

      Optional<ConditionalKind> conditionalKind = ConditionalKind.forKeyword(keyword);
      if (conditionalKind.isPresent()) return conditional(conditionalKind.get());

      switch (keyword) {
        case LINE:
          return variable(VariableScope.LINE, Optional.empty());
        case LOCAL:
          return variable(VariableScope.LOCAL, Optional.empty());
        case START:
          return start();
        case CALL:
          return callByName();
        case REPEAT:
          return repeat();
        default:
          break;
      }
    } else if (token.is(Token.Kind.IDENTIFIER) || token.is(Token.Kind.SELECTOR)) {
      Optional<Expression.Variable> known = lookupVariable(token.text());
      if (known.isPresent()) return variable(known.get().scope(), known);

      if (token.is(Token.Kind.IDENTIFIER)) {
        if (peekIs(Token.Kind.OPEN_PAREN)) return call(token, false);
        if (peek().isPresent()) throw invalidToken(peek().get(), "(");
      }
    } else if (token.is(Token.Kind.STRING)) {
      if (peekIs(Token.Kind.OPEN_PAREN)) return call(token, true);
      if (peek().isPresent()) throw invalidToken(peek().get(), "(");
    }

    throw invalidToken(token, "Keyword:e", "Keyword:p");
  }

  private Expression.Action action(ActionKind kind) throws ParseException {
    Lexer.Pos start = current.range().start();
    Selector selector = Selector.DEFAULT;

    Token token = advanceOrThrow(".", ":");
    if (token.is(Token.Kind.COLON)) {
      if (!kind.takesSelector()) throw invalidToken(token, ".");
      Token selectorToken = advanceOrThrow("<selector>");
      selector =
          selectorToken.selector().orElseThrow(() -> invalidToken(selectorToken, "<selector>"));
      require(Token.Kind.DOT);
    } else if (!token.is(Token.Kind.DOT)) {
      throw invalidToken(token, ".", ":");
    }

    Token nameToken = advanceOrThrow("<any>");
    String name = name(nameToken);
    List<Arg> args = readParams();
    require(Token.Kind.SEMICOLON);
    return new Expression.Action(kind, selector, name, args, rangeFrom(start), nameToken.range());
  }

  private Expression.Conditional conditional(ConditionalKind kind) throws ParseException {
    Lexer.Pos start = current.range().start();
    Token token = advanceOrThrow("<any>");

    boolean inverted = false;
    if (token.is(Token.Kind.EXCLAMATION_MARK)) {
      inverted = true;
      token = advanceOrThrow("<any>");
    }

    Selector selector = Selector.DEFAULT;
    if (kind.takesSelector() && token.is(Token.Kind.SELECTOR) && peekIs(Token.Kind.COLON)) {
      selector = token.selector().get();
      require(Token.Kind.COLON);
      token = advanceOrThrow("<any>");
    }

    Token nameToken = token;
    String name = name(nameToken);
    List<Arg> args = readParams();

    require(Token.Kind.OPEN_PAREN_CURLY);
    ImmutableList<Expression> body = body();

    Optional<ImmutableList<Expression>> elseBody = Optional.empty();
    if (peek().isPresent() && peek().get().is(Token.Keyword.ELSE)) {
      advance();
      require(Token.Kind.OPEN_PAREN_CURLY);
      elseBody = Optional.of(body());
    }

    return new Expression.Conditional(
        kind,
        selector,
        inverted,
        name,
        args,
        body,
        elseBody,
        rangeFrom(start),
        nameToken.range());
  }

  private Expression.Repeat repeat() throws ParseException {
    Lexer.Pos start = current.range().start();
    Token nameToken = advanceOrThrow("<any>");
    String name = name(nameToken);
    List<Arg> args = readParams();

    require(Token.Kind.OPEN_PAREN_CURLY);
    ImmutableList<Expression> body = body();
    return new Expression.Repeat(name, args, body, rangeFrom(start), nameToken.range());
  }

  private Expression.Call call(Token nameToken, boolean byWireName) throws ParseException {
    Lexer.Pos start = current.range().start();
    List<Arg> args = readParams();
    require(Token.Kind.SEMICOLON);
    return new Expression.Call(
        nameToken.text(), byWireName, args, rangeFrom(start), nameToken.range());
  }

  // call("function", args...);
  private Expression.Call callByName() throws ParseException {
    Lexer.Pos start = current.range().start();
    Lexer.Range keywordRange = current.range();
    List<Arg> args = readParams();
    Arg nameArg = leadingName(args, keywordRange, "function");
    require(Token.Kind.SEMICOLON);
    return new Expression.Call(
        nameArg.value().<ArgValue.TextLiteral>cast().text(),
        true,
        reindex(args.subList(1, args.size())),
        rangeFrom(start),
        nameArg.range());
  }

  // start("process", args...);
  private Expression.Start start() throws ParseException {
    Lexer.Pos start = current.range().start();
    Lexer.Range keywordRange = current.range();
    List<Arg> args = readParams();
    Arg nameArg = leadingName(args, keywordRange, "process");
    require(Token.Kind.SEMICOLON);
    return new Expression.Start(
        nameArg.value().<ArgValue.TextLiteral>cast().text(),
        reindex(args.subList(1, args.size())),
        rangeFrom(start),
        nameArg.range());
  }

  private static Arg leadingName(List<Arg> args, Lexer.Range range, String what)
      throws ParseException {
    if (args.isEmpty()) {
      throw new ParseException(
          ParseException.Kind.INVALID_CALL,
          range,
          String.format("Invalid function call: Missing %s name", what));
    } else if (args.get(0).value().kind() != ArgValue.Kind.TEXT) {
      throw new ParseException(
          ParseException.Kind.INVALID_CALL,
          args.get(0).range(),
          String.format("Invalid function call: Invalid %s name param type", what));
    }
    return args.get(0);
  }

  private Expression.Variable variable(VariableScope scope, Optional<Expression.Variable> known)
      throws ParseException {
    Lexer.Pos start = current.range().start();

    String dfrsName;
    String wireName;
    Optional<ArgType> declaredType;
    if (known.isPresent()) {
      dfrsName = known.get().dfrsName();
      wireName = known.get().wireName();
      declaredType = known.get().declaredType();
    } else {
      dfrsName = name(advanceOrThrow("<any>"));
      wireName = dfrsName;
      declaredType = Optional.empty();
    }

    Token token = advanceOrThrow("=", ";");
    if (token.is(Token.Kind.TILDE)) {
      token = advanceOrThrow("Variable");
      if (!token.is(Token.Kind.VARIABLE)) throw invalidToken(token, "Variable");
      wireName = token.text();
      token = advanceOrThrow("=", ";");
    }

    if (token.is(Token.Kind.COLON)) {
      Token typeToken = advanceOrThrow("Identifier");
      if (!typeToken.is(Token.Kind.IDENTIFIER)) throw invalidToken(typeToken, "Identifier");
      ParamType type =
          ParamType.forDfrsName(typeToken.text())
              .filter(ParamType::isVariableType)
              .orElseThrow(
                  () ->
                      new ParseException(
                          ParseException.Kind.INVALID_TYPE,
                          typeToken.range(),
                          "Unknown type: " + typeToken.text()));
      declaredType = Optional.of(type.argType());
      token = advanceOrThrow("=", ";");
    }

    Optional<Expression.Action> action = Optional.empty();
    if (token.is(Token.Kind.EQUAL)) {
      Token actionToken = advanceOrThrow("Keyword:p");
      Optional<ActionKind> kind = actionToken.keyword().flatMap(ActionKind::forKeyword);
      if (!kind.isPresent()) throw invalidToken(actionToken, "Keyword:p");
      action = Optional.of(action(kind.get()));
    } else if (!token.is(Token.Kind.SEMICOLON)) {
      throw invalidToken(token, "=", ";");
    }

    Expression.Variable node =
        new Expression.Variable(scope, dfrsName, wireName, declaredType, action, rangeFrom(start));
    declare(node);
    return node;
  }

  /** Reads a parenthesized, comma separated list of values. */
  private List<Arg> readParams() throws ParseException {
    require(Token.Kind.OPEN_PAREN);

    List<Arg> params = new ArrayList<>();
    Optional<Token> trailingComma = Optional.empty();
    while (true) {
      Token token = advanceOrThrow(")");
      if (token.is(Token.Kind.CLOSE_PAREN)) {
        if (trailingComma.isPresent()) throw invalidToken(trailingComma.get(), ")");
        break;
      }

      params.add(readParam(token));
      trailingComma = Optional.empty();

      token = advanceOrThrow(",", ")");
      if (token.is(Token.Kind.CLOSE_PAREN)) break;
      if (!token.is(Token.Kind.COMMA)) throw invalidToken(token, ",", ")");
      trailingComma = Optional.of(token);
    }
    return reindex(params);
  }

  private Arg readParam(Token token) throws ParseException {
    switch (token.kind()) {
      case NUMBER:
        return Arg.create(new ArgValue.NumberLiteral(token.number()), 0, token.range());
      case TEXT:
        return Arg.create(new ArgValue.TextLiteral(token.text()), 0, token.range());
      case STRING:
        return Arg.create(new ArgValue.StringLiteral(token.text()), 0, token.range());
      case DOLLAR:
        return gameValue();
      case KEYWORD:
        {
          Optional<ConditionalKind> kind = ConditionalKind.forKeyword(token.keyword().get());
          if (kind.isPresent()) return condition(kind.get());
          break;
        }
      case IDENTIFIER:
      case SELECTOR:
        {
          if (peekIs(Token.Kind.EQUAL)) return tag(token);
          if (token.is(Token.Kind.IDENTIFIER)) {
            switch (token.text()) {
              case "Number":
                return complexNumber();
              case "Location":
                return location();
              case "Vector":
                return vector();
              case "Sound":
                return sound();
              case "Potion":
                return potion();
              case "Particle":
                return particle();
              case "Item":
                return item();
              case "null":
                return Arg.create(ArgValue.Empty.instance(), 0, token.range());
              default:
                break;
            }
          }

          Optional<Expression.Variable> variable = lookupVariable(token.text());
          if (!variable.isPresent()) {
            throw new ParseException(
                ParseException.Kind.UNKNOWN_VARIABLE,
                token.range(),
                "Unknown variable: " + token.text());
          }
          return Arg.create(variable.get().toArgValue(), 0, token.range());
        }
      default:
        break;
    }
    throw invalidToken(token, ")");
  }

  private Arg tag(Token nameToken) throws ParseException {
    require(Token.Kind.EQUAL);
    Token token = advanceOrThrow("String", "Text");

    ArgValue value;
    switch (token.kind()) {
      case STRING:
        value = new ArgValue.StringLiteral(token.text());
        break;
      case TEXT:
        value = new ArgValue.TextLiteral(token.text());
        break;
      case NUMBER:
        value = new ArgValue.NumberLiteral(token.number());
        break;
      case IDENTIFIER:
        if (token.text().equals("Vector")) {
          value = vector().value();
          break;
        }
        throw invalidToken(token, "String", "Text");
      default:
        throw invalidToken(token, "String", "Text");
    }

    return Arg.create(
        new ArgValue.Tag(nameToken.text(), value, Optional.empty()),
        0,
        Lexer.Range.create(nameToken.range().start(), current.range().end()));
  }

  // $[selector:]name
  private Arg gameValue() throws ParseException {
    Lexer.Pos start = current.range().start();
    Token token = advanceOrThrow("<any>", "<selector>");

    Selector selector = Selector.DEFAULT;
    if (token.is(Token.Kind.SELECTOR) && peekIs(Token.Kind.COLON)) {
      selector = token.selector().get();
      require(Token.Kind.COLON);
      token = advanceOrThrow("<any>");
    }
    if (!token.is(Token.Kind.IDENTIFIER) && !token.is(Token.Kind.SELECTOR)) {
      throw invalidToken(token, "<any>", "<selector>");
    }

    return Arg.create(new ArgValue.GameValue(token.text(), selector), 0, rangeFrom(start));
  }

  // A conditional used as a value: ifX [!] [selector:] name(args)
  private Arg condition(ConditionalKind kind) throws ParseException {
    Lexer.Pos start = current.range().start();
    Token token = advanceOrThrow("<any>");

    boolean inverted = false;
    if (token.is(Token.Kind.EXCLAMATION_MARK)) {
      inverted = true;
      token = advanceOrThrow("<any>");
    }

    Selector selector = Selector.DEFAULT;
    if (kind.takesSelector() && token.is(Token.Kind.SELECTOR) && peekIs(Token.Kind.COLON)) {
      selector = token.selector().get();
      require(Token.Kind.COLON);
      token = advanceOrThrow("<any>");
    }

    String name = name(token);
    List<Arg> args = readParams();
    return Arg.create(
        new ArgValue.Condition(name, args, selector, kind, inverted), 0, rangeFrom(start));
  }

  // Number("expression")
  private Arg complexNumber() throws ParseException {
    Lexer.Pos start = current.range().start();
    List<Arg> params = readParams();
    ParseException.Kind kind = ParseException.Kind.INVALID_COMPLEX_NUMBER;

    if (params.isEmpty()) throw constructorError(kind, "Not enough arguments");
    if (params.get(0).value().kind() != ArgValue.Kind.TEXT) {
      throw constructorError(kind, "Invalid value, should be text");
    }
    if (params.size() > 1) throw constructorError(kind, "Too many arguments");

    String expression = params.get(0).value().<ArgValue.TextLiteral>cast().text();
    return Arg.create(new ArgValue.ComplexNumber(expression), 0, rangeFrom(start));
  }

  // Location(x, y, z[, pitch[, yaw]])
  private Arg location() throws ParseException {
    Lexer.Pos start = current.range().start();
    List<Arg> params = readParams();
    ParseException.Kind kind = ParseException.Kind.INVALID_LOCATION;

    if (params.size() < 3) throw constructorError(kind, "Not enough arguments");
    double x = number(params.get(0), kind, "Invalid x coordinate");
    double y = number(params.get(1), kind, "Invalid y coordinate");
    double z = number(params.get(2), kind, "Invalid z coordinate");
    Optional<Double> pitch = Optional.empty();
    Optional<Double> yaw = Optional.empty();
    if (params.size() >= 4) pitch = Optional.of(number(params.get(3), kind, "Invalid pitch"));
    if (params.size() >= 5) yaw = Optional.of(number(params.get(4), kind, "Invalid yaw"));
    if (params.size() > 5) throw constructorError(kind, "Too many arguments");

    return Arg.create(new ArgValue.Location(x, y, z, pitch, yaw), 0, rangeFrom(start));
  }

  // Vector(x, y, z)
  private Arg vector() throws ParseException {
    Lexer.Pos start = current.range().start();
    List<Arg> params = readParams();
    ParseException.Kind kind = ParseException.Kind.INVALID_VECTOR;

    if (params.size() < 3) throw constructorError(kind, "Not enough arguments");
    double x = number(params.get(0), kind, "Invalid x coordinate");
    double y = number(params.get(1), kind, "Invalid y coordinate");
    double z = number(params.get(2), kind, "Invalid z coordinate");
    if (params.size() > 3) throw constructorError(kind, "Too many arguments");

    return Arg.create(new ArgValue.Vector(x, y, z), 0, rangeFrom(start));
  }

  // Sound(name, volume, pitch[, 'variant'])
  private Arg sound() throws ParseException {
    Lexer.Pos start = current.range().start();
    List<Arg> params = readParams();
    ParseException.Kind kind = ParseException.Kind.INVALID_SOUND;

    if (params.size() < 3) throw constructorError(kind, "Not enough arguments");
    String sound = stringOrText(params.get(0), kind, "Invalid sound type");
    double volume = number(params.get(1), kind, "Invalid volume");
    double pitch = number(params.get(2), kind, "Invalid pitch");
    Optional<String> variant = Optional.empty();
    if (params.size() >= 4) {
      if (params.get(3).value().kind() != ArgValue.Kind.STRING) {
        throw constructorError(kind, "Invalid variant");
      }
      variant = Optional.of(params.get(3).value().<ArgValue.StringLiteral>cast().string());
    }
    if (params.size() > 4) throw constructorError(kind, "Too many arguments");

    return Arg.create(new ArgValue.Sound(sound, volume, pitch, variant), 0, rangeFrom(start));
  }

  // Potion(name, amplifier, duration)
  private Arg potion() throws ParseException {
    Lexer.Pos start = current.range().start();
    List<Arg> params = readParams();
    ParseException.Kind kind = ParseException.Kind.INVALID_POTION;

    if (params.size() < 3) throw constructorError(kind, "Not enough arguments");
    String potion = stringOrText(params.get(0), kind, "Invalid potion type");
    double amplifier = number(params.get(1), kind, "Invalid amplifier");
    double duration = number(params.get(2), kind, "Invalid duration");
    if (params.size() > 3) throw constructorError(kind, "Too many arguments");

    return Arg.create(
        new ArgValue.Potion(potion, (int) amplifier, (int) duration), 0, rangeFrom(start));
  }

  // Particle(name, amount, horizontal, vertical, [property=value]...)
  private Arg particle() throws ParseException {
    Lexer.Pos start = current.range().start();
    List<Arg> params = readParams();
    ParseException.Kind kind = ParseException.Kind.INVALID_PARTICLE;

    if (params.size() < 4) throw constructorError(kind, "Not enough arguments");
    String particle = stringOrText(params.get(0), kind, "Invalid particle type");
    int amount = (int) number(params.get(1), kind, "Invalid particle amount");
    double horizontal = number(params.get(2), kind, "Invalid particle horizontal spread");
    double vertical = number(params.get(3), kind, "Invalid particle vertical spread");

    ArgValue.ParticleData data = new ArgValue.ParticleData();
    for (Arg param : params.subList(4, params.size())) {
      if (param.value().kind() != ArgValue.Kind.TAG) {
        throw constructorError(kind, "Too many arguments");
      }
      ArgValue.Tag tag = param.value().cast();
      ArgValue value = tag.value();
      switch (tag.name()) {
        case "motion":
          if (value.kind() != ArgValue.Kind.VECTOR) {
            throw constructorError(kind, "Expected motion to be vector");
          }
          data.setMotion(value.cast());
          break;
        case "motionVariation":
          data.setMotionVariation(
              (int) number(value, kind, "Expected motion variation to be number"));
          break;
        case "rgb":
          data.setRgb((int) number(value, kind, "Expected rgb to be number"));
          break;
        case "rgbFade":
          data.setRgbFade((int) number(value, kind, "Expected rgb fade to be number"));
          break;
        case "colorVariation":
          data.setColorVariation(
              (int) number(value, kind, "Expected color variation to be number"));
          break;
        case "material":
          if (value.kind() != ArgValue.Kind.TEXT) {
            throw constructorError(kind, "Expected material to be text");
          }
          data.setMaterial(value.<ArgValue.TextLiteral>cast().text());
          break;
        case "size":
          data.setSize(number(value, kind, "Expected size to be number"));
          break;
        case "sizeVariation":
          data.setSizeVariation((int) number(value, kind, "Expected size variation to be number"));
          break;
        case "roll":
          data.setRoll(number(value, kind, "Expected roll to be number"));
          break;
        default:
          throw constructorError(kind, "Unknown tag");
      }
    }

    return Arg.create(
        new ArgValue.Particle(particle, amount, horizontal, vertical, data), 0, rangeFrom(start));
  }

  // Item("nbt") or Item(id='material', count=n, other='components')
  private Arg item() throws ParseException {
    Lexer.Pos start = current.range().start();
    List<Arg> params = readParams();
    ParseException.Kind kind = ParseException.Kind.INVALID_ITEM;

    if (params.isEmpty()) throw constructorError(kind, "Not enough arguments");
    ArgValue first = params.get(0).value();
    if (first.kind() == ArgValue.Kind.TAG) {
      return Arg.create(new ArgValue.Item(componentItem(params)), 0, rangeFrom(start));
    }

    String item = stringOrText(params.get(0), kind, "Invalid item arg type");
    if (params.size() > 1) throw constructorError(kind, "Too many arguments");
    return Arg.create(new ArgValue.Item(item), 0, rangeFrom(start));
  }

  private String componentItem(List<Arg> params) throws ParseException {
    ParseException.Kind kind = ParseException.Kind.INVALID_ITEM;
    Optional<String> id = Optional.empty();
    double count = 1;
    Optional<String> other = Optional.empty();

    for (Arg param : params) {
      if (param.value().kind() != ArgValue.Kind.TAG) {
        throw new ParseException(kind, param.range(), "Invalid Item: Unexpected value");
      }
      ArgValue.Tag tag = param.value().cast();
      switch (tag.name()) {
        case "id":
          if (tag.value().kind() != ArgValue.Kind.STRING) {
            throw new ParseException(kind, param.range(), "Invalid Item: Invalid id type");
          }
          id = Optional.of(tag.value().<ArgValue.StringLiteral>cast().string());
          break;
        case "count":
          if (tag.value().kind() != ArgValue.Kind.NUMBER) {
            throw new ParseException(kind, param.range(), "Invalid Item: Invalid count type");
          }
          count = tag.value().<ArgValue.NumberLiteral>cast().number();
          break;
        case "other":
          if (tag.value().kind() != ArgValue.Kind.STRING) {
            throw new ParseException(kind, param.range(), "Invalid Item: Invalid other type");
          }
          other = Optional.of(tag.value().<ArgValue.StringLiteral>cast().string());
          break;
        default:
          throw new ParseException(kind, param.range(), "Invalid Item: Unknown item property");
      }
    }

    if (!id.isPresent()) throw constructorError(kind, "Missing id property");
    return String.format(
        "{id:\"%s\",count:%s,components:{%s}}",
        id.get(), ArgValue.formatNumber(count), other.orElse(""));
  }

  private double number(Arg arg, ParseException.Kind kind, String msg) throws ParseException {
    return number(arg.value(), kind, msg);
  }

  private double number(ArgValue value, ParseException.Kind kind, String msg)
      throws ParseException {
    if (value.kind() != ArgValue.Kind.NUMBER) throw constructorError(kind, msg);
    return value.<ArgValue.NumberLiteral>cast().number();
  }

  private String stringOrText(Arg arg, ParseException.Kind kind, String msg)
      throws ParseException {
    switch (arg.value().kind()) {
      case STRING:
        return arg.value().<ArgValue.StringLiteral>cast().string();
      case TEXT:
        return arg.value().<ArgValue.TextLiteral>cast().text();
      default:
        throw constructorError(kind, msg);
    }
  }

  private ParseException constructorError(ParseException.Kind kind, String msg) {
    String constructor;
    switch (kind) {
      case INVALID_COMPLEX_NUMBER:
        constructor = "Number";
        break;
      case INVALID_LOCATION:
        constructor = "Location";
        break;
      case INVALID_VECTOR:
        constructor = "Vector";
        break;
      case INVALID_SOUND:
        constructor = "Sound";
        break;
      case INVALID_POTION:
        constructor = "Potion";
        break;
      case INVALID_PARTICLE:
        constructor = "Particle";
        break;
      case INVALID_ITEM:
        constructor = "Item";
        break;
      default:
        throw new AssertionError(kind);
    }
    return new ParseException(
        kind, current.range(), String.format("Invalid %s: %s", constructor, msg));
  }

  private static List<Arg> reindex(List<Arg> args) {
    List<Arg> reindexed = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      reindexed.add(args.get(i).withIndex(i));
    }
    return reindexed;
  }

  private Optional<Expression.Variable> lookupVariable(String name) {
    return variables.stream().filter(v -> v.dfrsName().equals(name)).findFirst();
  }

  private void declare(Expression.Variable variable) {
    variables.removeIf(v -> v.dfrsName().equals(variable.dfrsName()));
    variables.add(variable);
  }

  // Selector names are also legal names of actions, events and variables.
  private String name(Token token) throws ParseException {
    if (token.is(Token.Kind.IDENTIFIER) || token.is(Token.Kind.SELECTOR)) return token.text();
    throw invalidToken(token, "<any>");
  }

  private Lexer.Range rangeFrom(Lexer.Pos start) {
    return Lexer.Range.create(start, current.range().end());
  }

  private Optional<Token> peek() {
    return index + 1 < tokens.size() ? Optional.of(tokens.get(index + 1)) : Optional.empty();
  }

  private boolean peekIs(Token.Kind kind) {
    return peek().isPresent() && peek().get().is(kind);
  }

  private Optional<Token> advance() {
    index++;
    current = index < tokens.size() ? tokens.get(index) : null;
    return Optional.ofNullable(current);
  }

  private Token advanceOrThrow(String... expected) throws ParseException {
    Lexer.Pos end =
        tokens.isEmpty() ? new Lexer.Pos(1, 0) : tokens.get(tokens.size() - 1).range().end();
    Optional<Token> token = advance();
    if (!token.isPresent()) {
      throw new ParseException(
          ParseException.Kind.INVALID_EOF,
          Lexer.Range.at(end),
          "Invalid EOF" + expectedSuffix(expected));
    }
    return token.get();
  }

  private Token require(Token.Kind kind) throws ParseException {
    Token token = advanceOrThrow(kind.repr());
    if (!token.is(kind)) throw invalidToken(token, kind.repr());
    return token;
  }

  private static ParseException invalidToken(Token found, String... expected) {
    return new ParseException(
        ParseException.Kind.INVALID_TOKEN,
        found.range(),
        String.format("Invalid token '%s'%s", found.describe(), expectedSuffix(expected)));
  }

  private static String expectedSuffix(String... expected) {
    if (expected.length == 0) return "";
    return Arrays.stream(expected)
        .map(e -> "'" + e + "'")
        .collect(Collectors.joining(", ", ", expected: ", ""));
  }
}
