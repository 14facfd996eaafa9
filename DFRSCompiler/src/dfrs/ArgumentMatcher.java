package dfrs;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Matches positional argument values against the argument branches of a catalog entry. Matching is
 * a pure function of its inputs; a plural slot consumes greedily and gives inputs back when later
 * slots cannot otherwise be satisfied.
 */
public final class ArgumentMatcher {

  /** A positional argument together with the type it presents to matching. */
  @AutoValue
  public abstract static class Input {
    public abstract Arg arg();

    public abstract ArgType type();

    public static Input create(Arg arg, ArgType type) {
      return new AutoValue_ArgumentMatcher_Input(arg, type);
    }

    public static Input of(Arg arg) {
      return create(arg, arg.type());
    }
  }

  /** Why a branch did not match, and how many inputs it consumed before failing. */
  @AutoValue
  public abstract static class Failure {
    public abstract ValidateException.Kind kind();

    public abstract int consumed();

    public abstract ImmutableList<ActionCatalog.ArgOption> options();

    public abstract Optional<Input> found();

    static Failure missing(int consumed, List<ActionCatalog.ArgOption> options) {
      return new AutoValue_ArgumentMatcher_Failure(
          ValidateException.Kind.MISSING_ARGUMENT,
          consumed,
          ImmutableList.copyOf(options),
          Optional.empty());
    }

    static Failure wrongType(int consumed, List<ActionCatalog.ArgOption> options, Input found) {
      return new AutoValue_ArgumentMatcher_Failure(
          ValidateException.Kind.WRONG_ARGUMENT_TYPE,
          consumed,
          ImmutableList.copyOf(options),
          Optional.of(found));
    }

    static Failure tooMany(int consumed, Input found) {
      return new AutoValue_ArgumentMatcher_Failure(
          ValidateException.Kind.TOO_MANY_ARGUMENTS,
          consumed,
          ImmutableList.of(),
          Optional.of(found));
    }
  }

  private ArgumentMatcher() {}

  /**
   * Tries every branch in order. Returns empty if one of them accepts all inputs, otherwise the
   * failure of the branch that got furthest (the earliest one on ties).
   */
  public static Optional<Failure> match(
      List<ActionCatalog.ArgBranch> branches, List<Input> inputs) {
    if (branches.isEmpty()) {
      return tryBranch(ActionCatalog.ArgBranch.create(ImmutableList.of()), inputs);
    }

    Failure best = null;
    for (ActionCatalog.ArgBranch branch : branches) {
      Optional<Failure> failure = tryBranch(branch, inputs);
      if (!failure.isPresent()) return Optional.empty();
      best = further(best, failure.get());
    }
    return Optional.of(best);
  }

  public static Optional<Failure> tryBranch(ActionCatalog.ArgBranch branch, List<Input> inputs) {
    return matchFrom(branch.slots(), 0, inputs, 0);
  }

  public static boolean accepts(Input input, ActionCatalog.ArgOption option) {
    ArgValue value = input.arg().value();
    if (value.kind() == ArgValue.Kind.EMPTY) return option.optional();
    if (value.kind() == ArgValue.Kind.VARIABLE && option.type() == ArgType.VARIABLE) return true;
    return input.type().matches(option.type());
  }

  private static Optional<Failure> matchFrom(
      List<ActionCatalog.ArgSlot> slots, int slotIndex, List<Input> inputs, int inputIndex) {
    if (slotIndex == slots.size()) {
      if (inputIndex == inputs.size()) return Optional.empty();
      return Optional.of(Failure.tooMany(inputIndex, inputs.get(inputIndex)));
    }

    ActionCatalog.ArgSlot slot = slots.get(slotIndex);
    boolean optional = slot.options().stream().anyMatch(ActionCatalog.ArgOption::optional);
    if (inputIndex == inputs.size()) {
      if (optional) return matchFrom(slots, slotIndex + 1, inputs, inputIndex);
      return Optional.of(Failure.missing(inputIndex, slot.options()));
    }

    Input input = inputs.get(inputIndex);
    Failure best = null;
    for (ActionCatalog.ArgOption option : slot.options()) {
      if (!accepts(input, option)) continue;

      int end = inputIndex + 1;
      if (option.plural()) {
        while (end < inputs.size() && accepts(inputs.get(end), option)) end++;
      }
      // Plural options try the longest run first, then give inputs back one at a time.
      for (int stop = end; stop > inputIndex; stop--) {
        Optional<Failure> rest = matchFrom(slots, slotIndex + 1, inputs, stop);
        if (!rest.isPresent()) return rest;
        best = further(best, rest.get());
      }
    }

    if (optional) {
      Optional<Failure> rest = matchFrom(slots, slotIndex + 1, inputs, inputIndex);
      if (!rest.isPresent()) return rest;
      best = further(best, rest.get());
    }

    if (best == null || best.consumed() <= inputIndex) {
      // Nothing downstream got past this input: report the mismatch here.
      return Optional.of(Failure.wrongType(inputIndex, slot.options(), input));
    }
    return Optional.of(best);
  }

  private static Failure further(Failure best, Failure candidate) {
    if (best == null || candidate.consumed() > best.consumed()) return candidate;
    return best;
  }
}
