package dfrs;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ValidatorTest {

  private static ActionCatalog catalog;

  @BeforeAll
  public static void loadCatalog() {
    catalog = ActionCatalog.load();
  }

  private static AST parse(String source) throws CompilerException {
    return new Parser(new Lexer(source).lex()).parse();
  }

  private static AST validate(String source, CompilerOptions options) throws CompilerException {
    return new Validator(catalog, options).validate(parse(source));
  }

  private static AST validate(String source) throws CompilerException {
    return validate(source, CompilerOptions.defaults());
  }

  private static void assertValid(String source) throws CompilerException {
    validate(source);
  }

  private static ValidateException.Kind validateError(String source) {
    return assertThrows(ValidateException.class, () -> validate(source)).kind();
  }

  private static ImmutableList<Expression> eventBody(String statements) throws CompilerException {
    return validate("@join {\n" + statements + "\n}").events().get(0).body();
  }

  private static List<Integer> indices(List<Arg> args) {
    return args.stream().map(Arg::index).collect(Collectors.toList());
  }

  @Test
  public void resolvesWireNamesAndDefaultTags() throws CompilerException {
    AST ast = validate("@join { p.sendMessage(\"hi\"); }");

    AST.Event event = ast.events().get(0);
    assertThat(event.name()).isEqualTo("Join");
    assertThat(event.codeblock()).isEqualTo(Codeblock.PLAYER_EVENT);

    Expression.Action action = event.body().get(0).cast();
    assertThat(action.name()).isEqualTo("SendMessage");
    assertThat(action.definition()).isPresent();
    assertThat(indices(action.args())).containsExactly(0, 25, 26).inOrder();

    ArgValue.Tag alignment = action.args().get(1).value().cast();
    assertThat(alignment.name()).isEqualTo("Alignment Mode");
    assertThat(alignment.value().<ArgValue.TextLiteral>cast().text()).isEqualTo("Regular");
    ArgValue.Tag merging = action.args().get(2).value().cast();
    assertThat(merging.value().<ArgValue.TextLiteral>cast().text()).isEqualTo("Add spaces");
  }

  @Test
  public void entityEvents() throws CompilerException {
    AST ast = validate("@entityDmgEntity { }");

    assertThat(ast.events().get(0).codeblock()).isEqualTo(Codeblock.ENTITY_EVENT);
    assertThat(ast.events().get(0).name()).isEqualTo("EntityDmgEntity");
  }

  @Test
  public void unknownNames() {
    assertThat(validateError("@explode { }")).isEqualTo(ValidateException.Kind.UNKNOWN_EVENT);
    assertThat(validateError("@join { p.fly(); }"))
        .isEqualTo(ValidateException.Kind.UNKNOWN_ACTION);
    assertThat(validateError("@join { e.sendMessage(\"a\"); }"))
        .isEqualTo(ValidateException.Kind.UNKNOWN_ACTION);
    assertThat(validateError("@join { ifp isSneaking() { p.fly(); } }"))
        .isEqualTo(ValidateException.Kind.UNKNOWN_ACTION);
    assertThat(validateError("@join { p.teleport($nowhere); }"))
        .isEqualTo(ValidateException.Kind.UNKNOWN_GAME_VALUE);
  }

  @Test
  public void suppliedTags() throws CompilerException {
    Expression.Action text =
        eventBody("p.sendMessage(\"a\", alignmentMode=\"Centered\");").get(0).cast();
    ArgValue.Tag tag = text.args().get(1).value().cast();
    assertThat(tag.value().<ArgValue.TextLiteral>cast().text()).isEqualTo("Centered");
    assertThat(text.args().get(1).index()).isEqualTo(25);

    // Strings are accepted as tag options too.
    Expression.Action string = eventBody("c.wait(20, timeUnit='Seconds');").get(0).cast();
    ArgValue.Tag unit = string.args().get(1).value().cast();
    assertThat(unit.value().<ArgValue.TextLiteral>cast().text()).isEqualTo("Seconds");
  }

  @Test
  public void tagErrors() {
    assertThat(validateError("@join { p.sendMessage(\"a\", volume=\"Loud\"); }"))
        .isEqualTo(ValidateException.Kind.UNKNOWN_TAG);
    assertThat(validateError("@join { p.sendMessage(\"a\", alignmentMode=\"Left\"); }"))
        .isEqualTo(ValidateException.Kind.INVALID_TAG_OPTION);
  }

  @Test
  public void argumentCountErrors() {
    assertThat(validateError("@join { p.teleport(); }"))
        .isEqualTo(ValidateException.Kind.MISSING_ARGUMENT);
    assertThat(validateError("@join { p.teleport(Location(0, 0, 0), 1); }"))
        .isEqualTo(ValidateException.Kind.TOO_MANY_ARGUMENTS);
    assertThat(validateError("@join { p.teleport(\"spawn\"); }"))
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
  }

  @Test
  public void nullFillsOptionalSlots() throws CompilerException {
    assertValid("@join { p.playSound(Sound(\"Pling\", 1, 1), null); }");
    assertThat(validateError("@join { p.teleport(null); }"))
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
  }

  @Test
  public void assignmentPrependsTheVariable() throws CompilerException {
    Expression.Variable variable = eventBody("line x = v.randomNumber(1, 10);").get(0).cast();

    Expression.Action action = variable.action().get();
    assertThat(action.name()).isEqualTo("RandomNumber");
    assertThat(indices(action.args())).containsExactly(0, 1, 2, 26).inOrder();
    ArgValue.Variable target = action.args().get(0).value().cast();
    assertThat(target.wireName()).isEqualTo("x");
  }

  @Test
  public void returnTypesFlowIntoLaterUses() {
    assertThat(
            validateError("@join { line x = v.randomNumber(1, 10); p.sendMessage(x); }"))
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
  }

  @Test
  public void declaredTypes() throws CompilerException {
    assertThat(validateError("@join { line x : number; p.sendMessage(x); }"))
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
    assertValid("@join { line t : text; p.sendMessage(t); }");
    // Untyped variables are accepted anywhere.
    assertValid("@join { line u; p.sendMessage(u); p.teleport(u); }");
  }

  @Test
  public void parameterTypes() throws CompilerException {
    assertValid("fn greet(msg: text) { p.sendMessage(msg); }");
    assertThat(validateError("fn f(n: number) { p.sendMessage(n); }"))
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
  }

  @Test
  public void conditionArguments() throws CompilerException {
    ImmutableList<Expression> body =
        eventBody("s.playersCond(ifp isSneaking());\nrepeat while(ifv greater(1, 2)) { }");

    Expression.Action select = body.get(0).cast();
    assertThat(select.name()).isEqualTo("PlayersCond");
    assertThat(select.args()).hasSize(1);
    ArgValue.Condition sneaking = select.args().get(0).value().cast();
    assertThat(sneaking.name()).isEqualTo("IsSneaking");

    Expression.Repeat repeat = body.get(1).cast();
    assertThat(repeat.name()).isEqualTo("While");
    ArgValue.Condition greater = repeat.args().get(0).value().cast();
    assertThat(greater.name()).isEqualTo(">");
    assertThat(indices(greater.args())).containsExactly(0, 1).inOrder();
  }

  @Test
  public void conditionErrors() {
    assertThat(validateError("@join { s.playersCond(ifp isSneaking(), 1); }"))
        .isEqualTo(ValidateException.Kind.TOO_MANY_ARGUMENTS);
    assertThat(validateError("@join { repeat while(ifv greater(1)) { } }"))
        .isEqualTo(ValidateException.Kind.MISSING_ARGUMENT);
    assertThat(validateError("@join { s.playersCond(ifp isFlying()); }"))
        .isEqualTo(ValidateException.Kind.UNKNOWN_ACTION);
  }

  @Test
  public void alternativeArgumentGroups() throws CompilerException {
    assertValid("@join { ifv inRange(1, 0, 10) { } }");
    assertValid("@join { ifv inRange(1, Location(0, 0, 0), Location(1, 1, 1)) { } }");
    assertThat(validateError("@join { ifv inRange(1, 0, Location(0, 0, 0)) { } }"))
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
  }

  @Test
  public void gameValues() throws CompilerException {
    Expression.Action teleport = eventBody("p.teleport($all:location);").get(0).cast();

    ArgValue.GameValue location = teleport.args().get(0).value().cast();
    assertThat(location.wireName()).hasValue("Location");
    assertThat(location.valueType()).hasValue(ArgType.LOCATION);
    assertThat(validateError("@join { p.teleport($playerCount); }"))
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
  }

  @Test
  public void functionCalls() throws CompilerException {
    AST ast = validate("fn greet: `Greet`(msg: text) { }\n@join { greet(\"hi\"); }");

    Expression.Call call = ast.events().get(0).body().get(0).cast();
    assertThat(call.name()).isEqualTo("Greet");
    assertThat(indices(call.args())).containsExactly(0);

    assertThat(validateError("fn greet(msg: text) { }\n@join { greet(1); }"))
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
    assertThat(validateError("fn greet(msg: text) { }\n@join { greet(); }"))
        .isEqualTo(ValidateException.Kind.MISSING_ARGUMENT);
    assertValid("fn greet(msg: text?) { }\n@join { greet(); }");
  }

  @Test
  public void undeclaredFunctions() throws CompilerException {
    assertValid("@join { helper(1, \"a\"); call(\"Other\", 2); }");

    CompilerOptions strict = CompilerOptions.builder().setStrictCalls(true).build();
    ValidateException ex =
        assertThrows(ValidateException.class, () -> validate("@join { helper(1); }", strict));
    assertThat(ex.kind()).isEqualTo(ValidateException.Kind.UNKNOWN_FUNCTION);
    // Calls by wire name are never checked.
    validate("@join { call(\"Other\", 2); }", strict);
  }

  @Test
  public void processStarts() throws CompilerException {
    Expression.Start start =
        eventBody("start(\"loop\", localVariables=\"Copy\");").get(0).cast();

    assertThat(start.name()).isEqualTo("loop");
    assertThat(indices(start.args())).containsExactly(25, 26).inOrder();
    ArgValue.Tag local = start.args().get(0).value().cast();
    assertThat(local.name()).isEqualTo("Local Variables");
    assertThat(local.value().<ArgValue.TextLiteral>cast().text()).isEqualTo("Copy");
  }

  @Test
  public void functionsDoNotCarryOverBetweenFiles() throws CompilerException {
    Validator validator = new Validator(catalog);
    validator.validate(parse("fn foo(a: number) { }"));

    // Undeclared in this file, so the call accepts any arguments.
    validator.validate(parse("@join { foo(\"text\"); }"));

    Validator strict =
        new Validator(catalog, CompilerOptions.builder().setStrictCalls(true).build());
    strict.validate(parse("fn foo(a: number) { }"));
    ValidateException ex =
        assertThrows(ValidateException.class, () -> strict.validate(parse("@join { foo(1); }")));
    assertThat(ex.kind()).isEqualTo(ValidateException.Kind.UNKNOWN_FUNCTION);
  }

  @Test
  public void globalTypesDoNotCarryOverBetweenFiles() throws CompilerException {
    Validator validator = new Validator(catalog);
    validator.validate(parse("save total;\n@join { total = v.randomNumber(1, 10); }"));

    validator.validate(parse("save total;\n@join { p.sendMessage(total); }"));
  }
}
