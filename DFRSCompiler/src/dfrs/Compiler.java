package dfrs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/**
 * Generates code lines from a validated {@link AST}. Every function, process and event becomes one
 * unit; nested bodies are flattened into bracket blocks.
 */
public class Compiler {
  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  private static final int HINT_SLOT = 25;
  private static final int HIDDEN_TAG_SLOT = 26;

  @AutoValue
  public abstract static class Unit {
    public abstract String name();

    public abstract Codeline codeline();

    public String json() {
      return codeline().toJson();
    }

    public static Unit create(String name, Codeline codeline) {
      return new AutoValue_Compiler_Unit(name, codeline);
    }
  }

  private final CompilerOptions options;

  public Compiler() {
    this(CompilerOptions.defaults());
  }

  public Compiler(CompilerOptions options) {
    this.options = options;
  }

  public ImmutableList<Unit> compile(AST ast) {
    ImmutableList.Builder<Unit> units = ImmutableList.builder();
    for (AST.Function function : ast.functions()) {
      units.add(
          unit(
              String.format("Function %s %s", function.dfrsName(), function.wireName()),
              function(function)));
    }
    for (AST.Process process : ast.processes()) {
      units.add(unit("Process " + process.name(), process(process)));
    }
    for (AST.Event event : ast.events()) {
      units.add(unit("Event " + event.name(), event(event)));
    }
    return units.build();
  }

  private Unit unit(String name, Codeline codeline) {
    Unit unit = Unit.create(name, codeline);
    if (options.debugCompile()) logger.debug("{}: {}", name, unit.json());
    return unit;
  }

  private Codeline event(AST.Event event) {
    Codeline.Block header =
        Codeline.Block.of(event.codeblock())
            .withAction(event.name())
            .withArgs(ImmutableList.of());
    if (event.cancelled()) header.withAttribute("LS-CANCEL");

    List<Codeline.Block> blocks = new ArrayList<>();
    blocks.add(header);
    body(event.body(), blocks);
    return new Codeline(blocks);
  }

  private Codeline function(AST.Function function) {
    List<Codeline.SlotItem> items = new ArrayList<>();
    items.add(
        new Codeline.SlotItem(
            new Codeline.ArgItem(new ItemData.Id("function"), "hint"), HINT_SLOT));
    items.add(hiddenTag(Codeblock.FUNCTION));

    for (int slot = 0; slot < function.params().size(); slot++) {
      AST.Param param = function.params().get(slot);
      Optional<Codeline.ArgItem> defaultValue =
          param.defaultValue().flatMap(v -> argItem(v, "", ""));
      ItemData data =
          new ItemData.FunctionParam(
              defaultValue,
              param.name(),
              param.optional(),
              param.plural(),
              param.type().wireName());
      items.add(new Codeline.SlotItem(new Codeline.ArgItem(data, "pn_el"), slot));
    }

    List<Codeline.Block> blocks = new ArrayList<>();
    blocks.add(
        Codeline.Block.of(Codeblock.FUNCTION).withArgs(items).withData(function.wireName()));
    body(function.body(), blocks);
    return new Codeline(blocks);
  }

  private Codeline process(AST.Process process) {
    List<Codeline.Block> blocks = new ArrayList<>();
    blocks.add(
        Codeline.Block.of(Codeblock.PROCESS)
            .withArgs(ImmutableList.of(hiddenTag(Codeblock.PROCESS)))
            .withData(process.name()));
    body(process.body(), blocks);
    return new Codeline(blocks);
  }

  private static Codeline.SlotItem hiddenTag(Codeblock codeblock) {
    ItemData tag = new ItemData.Tag("dynamic", codeblock.wireBlock(), "False", "Is Hidden");
    return new Codeline.SlotItem(new Codeline.ArgItem(tag, "bl_tag"), HIDDEN_TAG_SLOT);
  }

  private void body(List<Expression> body, List<Codeline.Block> blocks) {
    for (Expression expression : body) {
      expression(expression, blocks);
    }
  }

  private void expression(Expression expression, List<Codeline.Block> blocks) {
    switch (expression.type()) {
      case ACTION:
        blocks.add(action(expression.cast()));
        break;
      case CONDITIONAL:
        conditional(expression.cast(), blocks);
        break;
      case REPEAT:
        repeat(expression.cast(), blocks);
        break;
      case CALL:
        {
          Expression.Call call = expression.cast();
          blocks.add(
              Codeline.Block.of(Codeblock.CALL_FUNCTION)
                  .withArgs(items(call.args(), call.name(), Codeblock.CALL_FUNCTION.wireBlock()))
                  .withData(call.name()));
          break;
        }
      case START:
        {
          Expression.Start start = expression.cast();
          blocks.add(
              Codeline.Block.of(Codeblock.START_PROCESS)
                  .withArgs(items(start.args(), "dynamic", Codeblock.START_PROCESS.wireBlock()))
                  .withData(start.name()));
          break;
        }
      case VARIABLE:
        {
          // Declarations alone produce nothing.
          Expression.Variable variable = expression.cast();
          if (variable.action().isPresent()) blocks.add(action(variable.action().get()));
          break;
        }
      default:
        throw new AssertionError(expression.type());
    }
  }

  private Codeline.Block action(Expression.Action action) {
    Codeblock codeblock = action.kind().codeblock();
    Codeline.Block block = Codeline.Block.of(codeblock).withAction(action.name());

    Optional<ArgValue.Condition> condition = leadingCondition(action.args());
    if (condition.isPresent()) {
      subAction(block, condition.get());
      if (action.kind().takesSelector()) block.withTarget(condition.get().selector());
    } else {
      block.withArgs(items(action.args(), action.name(), codeblock.wireBlock()));
      if (action.kind().takesSelector()) block.withTarget(action.selector());
    }
    return block;
  }

  private void conditional(Expression.Conditional conditional, List<Codeline.Block> blocks) {
    Codeblock codeblock = conditional.kind().codeblock();
    Codeline.Block block =
        Codeline.Block.of(codeblock)
            .withAction(conditional.name())
            .withArgs(items(conditional.args(), conditional.name(), codeblock.wireBlock()));
    if (conditional.kind().takesSelector()) block.withTarget(conditional.selector());
    if (conditional.inverted()) block.withAttribute("NOT");

    blocks.add(block);
    bracketed(conditional.body(), false, blocks);
    if (conditional.elseBody().isPresent()) {
      blocks.add(Codeline.Block.elseBlock());
      bracketed(conditional.elseBody().get(), false, blocks);
    }
  }

  private void repeat(Expression.Repeat repeat, List<Codeline.Block> blocks) {
    Codeline.Block block = Codeline.Block.of(Codeblock.REPEAT).withAction(repeat.name());

    Optional<ArgValue.Condition> condition = leadingCondition(repeat.args());
    if (condition.isPresent()) {
      subAction(block, condition.get());
      if (condition.get().conditionalKind().takesSelector()) {
        block.withTarget(condition.get().selector());
      }
    } else {
      block.withArgs(items(repeat.args(), repeat.name(), Codeblock.REPEAT.wireBlock()));
    }

    blocks.add(block);
    bracketed(repeat.body(), true, blocks);
  }

  private void bracketed(List<Expression> body, boolean repeat, List<Codeline.Block> blocks) {
    blocks.add(Codeline.Block.bracket(true, repeat));
    body(body, blocks);
    blocks.add(Codeline.Block.bracket(false, repeat));
  }

  // The condition's arguments take the place of the block's own.
  private void subAction(Codeline.Block block, ArgValue.Condition condition) {
    String name = condition.name();
    if (condition.conditionalKind() == ConditionalKind.ENTITY
        && CharMatcher.is(' ').removeFrom(name).equals("NameEquals")) {
      // Entity and player conditions share this name; the runtime tells them apart by prefix.
      name = "ENameEquals";
    }
    block
        .withArgs(
            items(condition.args(), name, condition.conditionalKind().codeblock().wireBlock()))
        .withSubAction(name);
    if (condition.inverted()) block.withAttribute("NOT");
  }

  private static Optional<ArgValue.Condition> leadingCondition(List<Arg> args) {
    if (args.isEmpty() || args.get(0).value().kind() != ArgValue.Kind.CONDITION) {
      return Optional.empty();
    }
    return Optional.of(args.get(0).value().cast());
  }

  private List<Codeline.SlotItem> items(List<Arg> args, String action, String block) {
    List<Codeline.SlotItem> items = new ArrayList<>();
    for (Arg arg : args) {
      Optional<Codeline.ArgItem> item = argItem(arg.value(), action, block);
      if (item.isPresent()) items.add(new Codeline.SlotItem(item.get(), arg.index()));
    }
    return items;
  }

  /** Converts a value to its wire item. Empty values have none; tags name their owning block. */
  static Optional<Codeline.ArgItem> argItem(ArgValue value, String action, String block) {
    switch (value.kind()) {
      case EMPTY:
        return Optional.empty();
      case NUMBER:
        return item(
            new ItemData.Simple(
                ArgValue.formatNumber(value.<ArgValue.NumberLiteral>cast().number())),
            "num");
      case COMPLEX_NUMBER:
        return item(
            new ItemData.Simple(value.<ArgValue.ComplexNumber>cast().expression()), "num");
      case STRING:
        return item(new ItemData.Simple(value.<ArgValue.StringLiteral>cast().string()), "txt");
      case TEXT:
        return item(new ItemData.Simple(value.<ArgValue.TextLiteral>cast().text()), "comp");
      case LOCATION:
        {
          ArgValue.Location loc = value.cast();
          return item(
              new ItemData.Location(
                  false,
                  loc.x(),
                  loc.y(),
                  loc.z(),
                  loc.pitch().orElse(0.0),
                  loc.yaw().orElse(0.0)),
              "loc");
        }
      case VECTOR:
        {
          ArgValue.Vector vec = value.cast();
          return item(new ItemData.Vector(vec.x(), vec.y(), vec.z()), "vec");
        }
      case SOUND:
        {
          ArgValue.Sound sound = value.cast();
          return item(
              new ItemData.Sound(sound.sound(), sound.variant(), sound.volume(), sound.pitch()),
              "snd");
        }
      case POTION:
        {
          ArgValue.Potion potion = value.cast();
          return item(
              new ItemData.Potion(potion.potion(), potion.amplifier(), potion.duration()), "pot");
        }
      case PARTICLE:
        {
          ArgValue.Particle particle = value.cast();
          return item(
              new ItemData.Particle(
                  particle.particle(),
                  particle.amount(),
                  particle.horizontal(),
                  particle.vertical(),
                  particle.data()),
              "part");
        }
      case ITEM:
        return item(new ItemData.Item(value.<ArgValue.Item>cast().item()), "item");
      case TAG:
        {
          ArgValue.Tag tag = value.cast();
          if (tag.value().kind() != ArgValue.Kind.TEXT) {
            throw new IllegalStateException("Tag '" + tag.name() + "' was not validated");
          }
          String option = tag.value().<ArgValue.TextLiteral>cast().text();
          return item(new ItemData.Tag(action, block, option, tag.name()), "bl_tag");
        }
      case VARIABLE:
        {
          ArgValue.Variable variable = value.cast();
          return item(
              new ItemData.Variable(variable.wireName(), variable.scope().wireName()), "var");
        }
      case GAME_VALUE:
        {
          ArgValue.GameValue gameValue = value.cast();
          String wireName =
              gameValue
                  .wireName()
                  .orElseThrow(
                      () ->
                          new IllegalStateException(
                              "Game value '" + gameValue.dfrsName() + "' was not validated"));
          return item(
              new ItemData.GameValue(wireName, gameValue.selector().wireName()), "g_val");
        }
      case CONDITION:
        throw new IllegalStateException("Conditions are only allowed as the first argument");
      default:
        throw new AssertionError(value.kind());
    }
  }

  private static Optional<Codeline.ArgItem> item(ItemData data, String id) {
    return Optional.of(new Codeline.ArgItem(data, id));
  }
}
