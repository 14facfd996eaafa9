package dfrs;

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ArgumentMatcherTest {

  private static final ArgValue NUMBER = new ArgValue.NumberLiteral(1);
  private static final ArgValue TEXT = new ArgValue.TextLiteral("a");
  private static final ArgValue LOCATION =
      new ArgValue.Location(0, 0, 0, Optional.empty(), Optional.empty());
  private static final ArgValue NULL = ArgValue.Empty.instance();

  private static ActionCatalog.ArgSlot slot(ArgType type) {
    return slot(type, false, false);
  }

  private static ActionCatalog.ArgSlot slot(ArgType type, boolean optional, boolean plural) {
    return ActionCatalog.ArgSlot.of(
        ActionCatalog.ArgOption.create(type.name(), type, optional, plural));
  }

  private static ActionCatalog.ArgBranch branch(ActionCatalog.ArgSlot... slots) {
    return ActionCatalog.ArgBranch.create(ImmutableList.copyOf(slots));
  }

  private static List<ArgumentMatcher.Input> inputs(ArgValue... values) {
    List<ArgumentMatcher.Input> inputs = new ArrayList<>();
    for (ArgValue value : values) {
      inputs.add(
          ArgumentMatcher.Input.of(Arg.create(value, inputs.size(), Lexer.Range.origin())));
    }
    return inputs;
  }

  private static Optional<ArgumentMatcher.Failure> match(
      ActionCatalog.ArgBranch branch, ArgValue... values) {
    return ArgumentMatcher.match(ImmutableList.of(branch), inputs(values));
  }

  @Test
  public void exactMatch() {
    assertThat(match(branch(slot(ArgType.NUMBER), slot(ArgType.TEXT)), NUMBER, TEXT)).isEmpty();
  }

  @Test
  public void missingArgument() {
    ArgumentMatcher.Failure failure =
        match(branch(slot(ArgType.NUMBER), slot(ArgType.NUMBER)), NUMBER).get();

    assertThat(failure.kind()).isEqualTo(ValidateException.Kind.MISSING_ARGUMENT);
    assertThat(failure.consumed()).isEqualTo(1);
    assertThat(failure.options()).hasSize(1);
  }

  @Test
  public void optionalSlotsMayBeLeftOut() {
    assertThat(match(branch(slot(ArgType.NUMBER), slot(ArgType.NUMBER, true, false)), NUMBER))
        .isEmpty();
    assertThat(match(branch(slot(ArgType.NUMBER, true, false), slot(ArgType.TEXT)), TEXT))
        .isEmpty();
  }

  @Test
  public void wrongType() {
    ArgumentMatcher.Failure failure = match(branch(slot(ArgType.NUMBER)), TEXT).get();

    assertThat(failure.kind()).isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
    assertThat(failure.found().get().arg().index()).isEqualTo(0);
  }

  @Test
  public void tooManyArguments() {
    ArgumentMatcher.Failure failure = match(branch(slot(ArgType.NUMBER)), NUMBER, NUMBER).get();

    assertThat(failure.kind()).isEqualTo(ValidateException.Kind.TOO_MANY_ARGUMENTS);
    assertThat(failure.found().get().arg().index()).isEqualTo(1);
  }

  @Test
  public void pluralSlotGivesBackInputs() {
    ActionCatalog.ArgBranch branch =
        branch(slot(ArgType.NUMBER, false, true), slot(ArgType.NUMBER));

    assertThat(match(branch, NUMBER, NUMBER, NUMBER)).isEmpty();
    assertThat(match(branch, NUMBER, NUMBER)).isEmpty();
    assertThat(match(branch, NUMBER).get().kind())
        .isEqualTo(ValidateException.Kind.MISSING_ARGUMENT);
  }

  @Test
  public void pluralSlotNeedsOneValueUnlessOptional() {
    assertThat(match(branch(slot(ArgType.TEXT, false, true))).get().kind())
        .isEqualTo(ValidateException.Kind.MISSING_ARGUMENT);
    assertThat(match(branch(slot(ArgType.TEXT, true, true)))).isEmpty();
    assertThat(match(branch(slot(ArgType.TEXT, true, true)), TEXT, TEXT, TEXT)).isEmpty();
  }

  @Test
  public void nullOnlyFillsOptionalSlots() {
    assertThat(match(branch(slot(ArgType.NUMBER, true, false), slot(ArgType.TEXT)), NULL, TEXT))
        .isEmpty();
    assertThat(match(branch(slot(ArgType.NUMBER), slot(ArgType.TEXT)), NULL, TEXT).get().kind())
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
  }

  @Test
  public void anyMatchesEverything() {
    assertThat(match(branch(slot(ArgType.ANY), slot(ArgType.ANY)), NUMBER, LOCATION)).isEmpty();
  }

  @Test
  public void variableSlotsTakeVariablesOfAnyType() {
    ArgValue.Variable variable =
        new ArgValue.Variable("x", "x", VariableScope.LINE, Optional.empty());
    ArgumentMatcher.Input typed =
        ArgumentMatcher.Input.create(
            Arg.create(variable, 0, Lexer.Range.origin()), ArgType.NUMBER);

    assertThat(
            ArgumentMatcher.accepts(
                typed, ActionCatalog.ArgOption.create("", ArgType.VARIABLE, false, false)))
        .isTrue();
    assertThat(
            ArgumentMatcher.accepts(
                typed, ActionCatalog.ArgOption.create("", ArgType.TEXT, false, false)))
        .isFalse();
    assertThat(
            ArgumentMatcher.accepts(
                typed, ActionCatalog.ArgOption.create("", ArgType.NUMBER, false, false)))
        .isTrue();
  }

  @Test
  public void furthestBranchIsReported() {
    ImmutableList<ActionCatalog.ArgBranch> branches =
        ImmutableList.of(
            branch(slot(ArgType.NUMBER), slot(ArgType.NUMBER)),
            branch(slot(ArgType.LOCATION), slot(ArgType.LOCATION)));

    assertThat(ArgumentMatcher.match(branches, inputs(LOCATION, LOCATION))).isEmpty();

    ArgumentMatcher.Failure failure =
        ArgumentMatcher.match(branches, inputs(NUMBER, LOCATION)).get();
    assertThat(failure.kind()).isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
    assertThat(failure.consumed()).isEqualTo(1);
    assertThat(failure.found().get().arg().index()).isEqualTo(1);
  }

  @Test
  public void noBranchesAcceptsNoArguments() {
    assertThat(ArgumentMatcher.match(ImmutableList.of(), inputs())).isEmpty();
    assertThat(ArgumentMatcher.match(ImmutableList.of(), inputs(NUMBER)).get().kind())
        .isEqualTo(ValidateException.Kind.TOO_MANY_ARGUMENTS);
  }

  @Test
  public void eitherSingleSlotBranchMatches() {
    ImmutableList<ActionCatalog.ArgBranch> branches =
        ImmutableList.of(branch(slot(ArgType.NUMBER)), branch(slot(ArgType.TEXT)));

    assertThat(ArgumentMatcher.match(branches, inputs(NUMBER))).isEmpty();
    assertThat(ArgumentMatcher.match(branches, inputs(TEXT))).isEmpty();
    assertThat(ArgumentMatcher.match(branches, inputs(LOCATION))).isPresent();
  }

  @Test
  public void mixedNumberAndTextBranches() {
    ActionCatalog.ArgSlot numberOrText =
        ActionCatalog.ArgSlot.create(
            ImmutableList.of(
                ActionCatalog.ArgOption.create("n", ArgType.NUMBER, false, false),
                ActionCatalog.ArgOption.create("t", ArgType.TEXT, false, false)));
    ImmutableList<ActionCatalog.ArgBranch> branches =
        ImmutableList.of(
            branch(slot(ArgType.NUMBER), slot(ArgType.NUMBER)),
            branch(slot(ArgType.TEXT), numberOrText),
            branch(slot(ArgType.NUMBER), slot(ArgType.TEXT)));

    assertThat(ArgumentMatcher.match(branches, inputs(NUMBER, NUMBER))).isEmpty();
    assertThat(ArgumentMatcher.match(branches, inputs(TEXT, NUMBER))).isEmpty();
    assertThat(ArgumentMatcher.match(branches, inputs(TEXT, TEXT))).isEmpty();
    assertThat(ArgumentMatcher.match(branches, inputs(NUMBER, TEXT))).isEmpty();

    assertThat(ArgumentMatcher.match(branches, inputs(NUMBER, LOCATION)).get().kind())
        .isEqualTo(ValidateException.Kind.WRONG_ARGUMENT_TYPE);
    assertThat(ArgumentMatcher.match(branches, inputs(LOCATION, TEXT))).isPresent();
    assertThat(ArgumentMatcher.match(branches, inputs(TEXT)).get().kind())
        .isEqualTo(ValidateException.Kind.MISSING_ARGUMENT);
  }
}
