package dfrs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Turns a code line back into source. Blocks or items it does not understand are skipped with a
 * warning comment rather than failing the whole line. A decompiler keeps state while it works and
 * must not be shared between threads.
 */
public class Decompiler {
  private static final Logger logger = LoggerFactory.getLogger(Decompiler.class);

  private static final Pattern PLAIN_NUMBER = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

  // Blocks whose first argument may be the variable an action writes to.
  private static final ImmutableSet<Codeblock> ASSIGNING =
      ImmutableSet.of(
          Codeblock.PLAYER_ACTION,
          Codeblock.ENTITY_ACTION,
          Codeblock.GAME_ACTION,
          Codeblock.SET_VARIABLE);

  private final ActionCatalog catalog;

  private final StringBuilder out = new StringBuilder();
  private final List<String> warnings = new ArrayList<>();
  private int indentation;

  // Wire variable name -> source name.
  private final Map<String, String> names = new HashMap<>();
  private final Set<String> declared = new HashSet<>();
  private final Set<String> unitDeclarations = new TreeSet<>();

  public Decompiler(ActionCatalog catalog) {
    this.catalog = catalog;
  }

  /**
   * Decompiles a compressed template or the raw JSON of a code line.
   *
   * @throws IllegalArgumentException if the input can't be decoded
   */
  public String decompile(String template) {
    String json = CodeTemplates.isJson(template) ? template : CodeTemplates.decompress(template);
    return decompile(Codeline.fromJson(json));
  }

  public String decompile(Codeline codeline) {
    out.setLength(0);
    warnings.clear();
    names.clear();
    declared.clear();
    unitDeclarations.clear();
    indentation = 0;

    for (String global : collectVariables(codeline.blocks())) {
      add(global);
    }

    boolean inUnit = false;
    for (Codeline.Block block : codeline.blocks()) {
      if (block.isBracket()) {
        bracket(block);
      } else if ("block".equals(block.id())) {
        inUnit |= block(block);
      } else {
        warn("Unhandled block id '" + block.id() + "'");
        add("");
      }
    }

    if (inUnit) {
      indentation--;
      add("}");
    }
    return out.toString();
  }

  /**
   * Registers every variable the line uses. Returns the game and save declarations; line and local
   * declarations are kept for the start of the unit, except for variables first seen as the target
   * of an assignment, which are declared where they are assigned.
   */
  private Set<String> collectVariables(List<Codeline.Block> blocks) {
    Set<String> globals = new TreeSet<>();
    Set<String> params = new HashSet<>();
    Set<String> seen = new HashSet<>();
    for (Codeline.Block block : blocks) {
      for (Codeline.SlotItem item : block.items()) {
        if (item.item().data().kind() == ItemData.Kind.FUNCTION_PARAM) {
          String name = item.item().data().<ItemData.FunctionParam>cast().name();
          params.add(name);
          declared.add(VariableScope.LINE.wireName() + ":" + name);
        }
      }
    }

    for (Codeline.Block block : blocks) {
      ImmutableList<Codeline.SlotItem> items = block.items();
      for (int i = 0; i < items.size(); i++) {
        ItemData data = items.get(i).item().data();
        if (data.kind() != ItemData.Kind.VARIABLE) continue;

        ItemData.Variable variable = data.cast();
        String declaration = declaration(variable.name());
        Optional<VariableScope> scope = VariableScope.forWireName(variable.scope());
        if (!scope.isPresent()) {
          warn("Unknown variable scope '" + variable.scope() + "'");
          continue;
        }
        if (!seen.add(key(variable))) continue;

        switch (scope.get()) {
          case GAME:
          case SAVE:
            globals.add(scope.get().keyword().repr() + " " + declaration + ";");
            declared.add(key(variable));
            break;
          case LINE:
          case LOCAL:
            if (i == 0 && assignmentTarget(block).isPresent()) break;
            // Parameters are declared by the function header.
            if (scope.get() == VariableScope.LINE && params.contains(variable.name())) break;
            unitDeclarations.add(scope.get().keyword().repr() + " " + declaration + ";");
            declared.add(key(variable));
            break;
          default:
            throw new AssertionError(scope.get());
        }
      }
    }
    return globals;
  }

  // "name" or, when the wire name is no legal identifier, "name ~ `wire name`".
  private String declaration(String wireName) {
    String name = Names.sanitizeVariable(wireName);
    names.put(wireName, name);
    return name.equals(wireName) ? name : String.format("%s ~ `%s`", name, wireName);
  }

  private static String key(ItemData.Variable variable) {
    return variable.scope() + ":" + variable.name();
  }

  /** The line or local variable an action writes to, if the block is such an assignment. */
  private Optional<ItemData.Variable> assignmentTarget(Codeline.Block block) {
    Optional<Codeblock> codeblock = block.block().flatMap(Codeblock::forWireBlock);
    if (!codeblock.isPresent() || !ASSIGNING.contains(codeblock.get())) return Optional.empty();
    if (block.subAction().isPresent() || !block.action().isPresent()) return Optional.empty();

    ImmutableList<Codeline.SlotItem> items = block.items();
    if (items.isEmpty() || items.get(0).slot() != 0) return Optional.empty();
    ItemData data = items.get(0).item().data();
    if (data.kind() != ItemData.Kind.VARIABLE) return Optional.empty();

    ItemData.Variable variable = data.cast();
    if (!variable.scope().equals(VariableScope.LINE.wireName())
        && !variable.scope().equals(VariableScope.LOCAL.wireName())) {
      return Optional.empty();
    }
    boolean returns =
        catalog
            .getByWireName(codeblock.get(), block.action().get())
            .flatMap(ActionCatalog.Action::returnType)
            .isPresent();
    return returns ? Optional.of(variable) : Optional.empty();
  }

  private void bracket(Codeline.Block block) {
    if (block.isOpen()) {
      indentation++;
    } else {
      indentation--;
      add("}");
    }
  }

  // Returns whether the block opened a unit.
  private boolean block(Codeline.Block block) {
    if (!block.block().isPresent()) {
      warn("Block without kind");
      add("");
      return false;
    }
    Optional<Codeblock> codeblock = Codeblock.forWireBlock(block.block().get());
    if (!codeblock.isPresent()) {
      warn("Unhandled block '" + block.block().get() + "'");
      add("");
      return false;
    }

    switch (codeblock.get()) {
      case PLAYER_EVENT:
      case ENTITY_EVENT:
        event(block, codeblock.get());
        return true;
      case FUNCTION:
        function(block);
        return true;
      case PROCESS:
        openUnit(String.format("proc %s {", block.data().orElse("")));
        return true;
      case PLAYER_ACTION:
      case ENTITY_ACTION:
      case GAME_ACTION:
      case SET_VARIABLE:
      case CONTROL:
      case SELECT_OBJECT:
        action(block, ActionKind.forCodeblock(codeblock.get()).get());
        return false;
      case IF_PLAYER:
      case IF_ENTITY:
      case IF_GAME:
      case IF_VARIABLE:
        conditional(block, ConditionalKind.forCodeblock(codeblock.get()).get());
        return false;
      case REPEAT:
        repeat(block);
        return false;
      case ELSE:
        add("else {");
        return false;
      case CALL_FUNCTION:
        invocation("call", block);
        return false;
      case START_PROCESS:
        invocation("start", block);
        return false;
      default:
        throw new AssertionError(codeblock.get());
    }
  }

  private void openUnit(String header) {
    add(header);
    indentation++;
    for (String declaration : unitDeclarations) {
      add(declaration);
    }
  }

  private void event(Codeline.Block block, Codeblock codeblock) {
    String wireName = block.action().orElse("");
    String name = dfrsName(codeblock, wireName);
    boolean cancelled = block.attribute().map("LS-CANCEL"::equals).orElse(false);
    openUnit(String.format("@%s%s {", name, cancelled ? "!" : ""));
  }

  private void function(Codeline.Block block) {
    List<String> params = new ArrayList<>();
    for (Codeline.SlotItem item : block.items()) {
      if (item.item().data().kind() != ItemData.Kind.FUNCTION_PARAM) continue;
      ItemData.FunctionParam param = item.item().data().cast();

      String type = ParamType.forWireName(param.type()).map(ParamType::dfrsName).orElse("any");
      if (!ParamType.forWireName(param.type()).isPresent()) {
        warn("Unknown parameter type '" + param.type() + "'");
      }
      StringBuilder sb = new StringBuilder();
      sb.append(param.name()).append(": ").append(type);
      if (param.optional()) sb.append('?');
      if (param.plural()) sb.append('*');
      if (param.defaultValue().isPresent()) {
        Optional<String> value = value(param.defaultValue().get());
        if (value.isPresent()) sb.append('=').append(value.get());
      }
      params.add(sb.toString());
    }

    String wireName = block.data().orElse("");
    String name = Names.sanitizeVariable(wireName);
    String header =
        name.equals(wireName)
            ? String.format("fn %s(%s) {", name, String.join(", ", params))
            : String.format("fn %s: `%s`(%s) {", name, wireName, String.join(", ", params));
    openUnit(header);
  }

  private void action(Codeline.Block block, ActionKind kind) {
    String wireName = block.action().orElse("");
    Optional<ActionCatalog.Action> definition =
        catalog.getByWireName(kind.codeblock(), wireName);
    String name = dfrsName(kind.codeblock(), wireName);

    String selector = "";
    if (kind.takesSelector() && !block.subAction().isPresent()) {
      selector = selector(block).map(s -> ":" + s).orElse("");
    }
    String call = kind.keyword().repr() + selector + "." + name;

    Optional<ItemData.Variable> target = assignmentTarget(block);
    if (target.isPresent()) {
      ImmutableList<Codeline.SlotItem> items = block.items();
      String params = params(items.subList(1, items.size()), 1, definition);
      add(String.format("%s = %s(%s);", assignee(target.get()), call, params));
      return;
    }
    add(String.format("%s(%s);", call, params(block, definition)));
  }

  // Declares the variable on its first assignment.
  private String assignee(ItemData.Variable variable) {
    if (declared.add(key(variable))) {
      VariableScope scope = VariableScope.forWireName(variable.scope()).get();
      return scope.keyword().repr() + " " + declaration(variable.name());
    }
    return names.get(variable.name());
  }

  private void conditional(Codeline.Block block, ConditionalKind kind) {
    String wireName = block.action().orElse("");
    Optional<ActionCatalog.Action> definition =
        catalog.getByWireName(kind.codeblock(), wireName);
    boolean inverted = block.attribute().map("NOT"::equals).orElse(false);
    String selector = kind.takesSelector() ? selector(block).map(s -> s + ":").orElse("") : "";

    add(
        String.format(
            "%s %s%s%s(%s) {",
            kind.keyword().repr(),
            inverted ? "!" : "",
            selector,
            dfrsName(kind.codeblock(), wireName),
            params(block, definition)));
  }

  private void repeat(Codeline.Block block) {
    String wireName = block.action().orElse("");
    Optional<ActionCatalog.Action> definition =
        catalog.getByWireName(Codeblock.REPEAT, wireName);
    add(
        String.format(
            "repeat %s(%s) {",
            dfrsName(Codeblock.REPEAT, wireName),
            params(block, definition)));
  }

  private void invocation(String keyword, Codeline.Block block) {
    String name = quote(block.data().orElse(""), '"');
    Optional<ActionCatalog.Action> definition =
        keyword.equals("start")
            ? catalog.actions(Codeblock.START_PROCESS).stream().findFirst()
            : Optional.empty();
    String params = params(block, definition);
    add(
        params.isEmpty()
            ? String.format("%s(%s);", keyword, name)
            : String.format("%s(%s, %s);", keyword, name, params));
  }

  private String params(Codeline.Block block, Optional<ActionCatalog.Action> definition) {
    if (!block.subAction().isPresent()) return params(block.items(), 0, definition);

    String subAction = block.subAction().get();
    for (ConditionalKind kind : ConditionalKind.values()) {
      Optional<ActionCatalog.Action> condition = condition(kind, subAction);
      if (!condition.isPresent()) continue;

      boolean inverted = block.attribute().map("NOT"::equals).orElse(false);
      String selector = kind.takesSelector() ? selector(block).map(s -> s + ":").orElse("") : "";
      return String.format(
          "%s %s%s%s(%s)",
          kind.keyword().repr(),
          inverted ? "!" : "",
          selector,
          condition.get().dfrsName(),
          params(block.items(), 0, condition));
    }

    warn("Unknown sub action '" + subAction + "'");
    return params(block.items(), 0, Optional.empty());
  }

  private Optional<ActionCatalog.Action> condition(ConditionalKind kind, String subAction) {
    if (kind == ConditionalKind.ENTITY && subAction.equals("ENameEquals")) {
      return catalog.actions(kind.codeblock()).stream()
          .filter(a -> CharMatcher.is(' ').removeFrom(a.wireName()).equals("NameEquals"))
          .findFirst();
    }
    return catalog.getByWireName(kind.codeblock(), subAction);
  }

  /**
   * Renders positional items in slot order, with `null` for skipped slots, followed by the tags
   * whose option differs from the default.
   */
  private String params(
      List<Codeline.SlotItem> items, int firstSlot, Optional<ActionCatalog.Action> definition) {
    List<String> params = new ArrayList<>();
    List<String> tags = new ArrayList<>();
    int slot = firstSlot;
    for (Codeline.SlotItem item : items) {
      ItemData data = item.item().data();
      switch (data.kind()) {
        case TAG:
          tag(data.cast(), definition).ifPresent(tags::add);
          break;
        case ID:
        case FUNCTION_PARAM:
          break;
        default:
          {
            Optional<String> value = value(item.item());
            if (!value.isPresent()) break;
            for (; slot < item.slot(); slot++) {
              params.add("null");
            }
            params.add(value.get());
            slot = item.slot() + 1;
            break;
          }
      }
    }
    params.addAll(tags);
    return String.join(", ", params);
  }

  private Optional<String> tag(ItemData.Tag tag, Optional<ActionCatalog.Action> definition) {
    if (!definition.isPresent()) return Optional.empty();
    Optional<ActionCatalog.TagDefinition> tagDefinition =
        definition.get().tagByWireName(tag.tag());
    if (!tagDefinition.isPresent()) {
      warn(String.format("Unknown tag '%s' of '%s'", tag.tag(), definition.get().dfrsName()));
      return Optional.empty();
    }
    if (tag.option().equals(tagDefinition.get().defaultOption())) return Optional.empty();
    return Optional.of(tagDefinition.get().dfrsName() + "=" + quote(tag.option(), '"'));
  }

  private Optional<String> value(Codeline.ArgItem item) {
    ItemData data = item.data();
    switch (data.kind()) {
      case SIMPLE:
        {
          String name = data.<ItemData.Simple>cast().name();
          switch (item.id()) {
            case "comp":
              return Optional.of(quote(name, '"'));
            case "txt":
              return Optional.of(quote(name, '\''));
            case "num":
              return Optional.of(
                  PLAIN_NUMBER.matcher(name).matches()
                      ? name
                      : String.format("Number(%s)", quote(name, '"')));
            default:
              warn("Unhandled simple item '" + item.id() + "'");
              return Optional.empty();
          }
        }
      case ITEM:
        return Optional.of(
            String.format("Item(%s)", quote(data.<ItemData.Item>cast().item(), '\'')));
      case GAME_VALUE:
        {
          ItemData.GameValue gameValue = data.cast();
          String name =
              catalog
                  .gameValueByWireName(gameValue.type())
                  .map(ActionCatalog.GameValue::dfrsName)
                  .orElseGet(() -> Names.toDfrsName(gameValue.type()));
          String selector =
              Selector.forWireName(gameValue.target())
                  .filter(s -> s != Selector.DEFAULT)
                  .map(s -> s.dfrsName() + ":")
                  .orElse("");
          return Optional.of("$" + selector + name);
        }
      case VARIABLE:
        {
          String wireName = data.<ItemData.Variable>cast().name();
          return Optional.of(names.getOrDefault(wireName, Names.sanitizeVariable(wireName)));
        }
      case LOCATION:
        {
          ItemData.Location loc = data.cast();
          StringBuilder sb = new StringBuilder("Location(");
          sb.append(number(loc.x())).append(", ");
          sb.append(number(loc.y())).append(", ");
          sb.append(number(loc.z()));
          if (loc.pitch() != 0 || loc.yaw() != 0) {
            sb.append(", ").append(number(loc.pitch()));
            sb.append(", ").append(number(loc.yaw()));
          }
          return Optional.of(sb.append(')').toString());
        }
      case VECTOR:
        {
          ItemData.Vector vec = data.cast();
          return Optional.of(vector(vec.x(), vec.y(), vec.z()));
        }
      case SOUND:
        {
          ItemData.Sound sound = data.cast();
          return Optional.of(
              String.format(
                  "Sound(%s, %s, %s%s)",
                  quote(sound.sound(), '"'),
                  number(sound.volume()),
                  number(sound.pitch()),
                  sound.variant().map(v -> ", " + quote(v, '\'')).orElse("")));
        }
      case POTION:
        {
          ItemData.Potion potion = data.cast();
          return Optional.of(
              String.format(
                  "Potion(%s, %d, %d)",
                  quote(potion.potion(), '"'), potion.amplifier(), potion.duration()));
        }
      case PARTICLE:
        return Optional.of(particle(data.cast()));
      case ID:
      case TAG:
      case FUNCTION_PARAM:
        return Optional.empty();
      case UNKNOWN:
        warn("Unhandled item '" + item.id() + "'");
        return Optional.empty();
      default:
        throw new AssertionError(data.kind());
    }
  }

  private static String particle(ItemData.Particle particle) {
    ArgValue.ParticleData data = particle.data();
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "Particle(%s, %d, %s, %s",
            quote(particle.particle(), '"'),
            particle.amount(),
            number(particle.horizontal()),
            number(particle.vertical())));
    data.motion().ifPresent(m -> sb.append(", motion=").append(vector(m.x(), m.y(), m.z())));
    data.motionVariation().ifPresent(v -> sb.append(", motionVariation=").append(v));
    data.rgb().ifPresent(v -> sb.append(", rgb=").append(v));
    data.rgbFade().ifPresent(v -> sb.append(", rgbFade=").append(v));
    data.colorVariation().ifPresent(v -> sb.append(", colorVariation=").append(v));
    data.material().ifPresent(v -> sb.append(", material=").append(quote(v, '"')));
    data.size().ifPresent(v -> sb.append(", size=").append(number(v)));
    data.sizeVariation().ifPresent(v -> sb.append(", sizeVariation=").append(v));
    data.roll().ifPresent(v -> sb.append(", roll=").append(number(v)));
    return sb.append(')').toString();
  }

  private static String vector(double x, double y, double z) {
    return String.format("Vector(%s, %s, %s)", number(x), number(y), number(z));
  }

  private static String number(double value) {
    return ArgValue.formatNumber(value);
  }

  private static String quote(String text, char quote) {
    String escaped = text.replace("\\", "\\\\").replace(String.valueOf(quote), "\\" + quote);
    return quote + escaped + quote;
  }

  private Optional<String> selector(Codeline.Block block) {
    if (!block.target().isPresent()) return Optional.empty();
    Optional<Selector> selector = Selector.forWireName(block.target().get());
    if (!selector.isPresent()) {
      warn("Unknown selector '" + block.target().get() + "'");
      return Optional.empty();
    }
    return selector.filter(s -> s != Selector.DEFAULT).map(Selector::dfrsName);
  }

  private String dfrsName(Codeblock codeblock, String wireName) {
    Optional<ActionCatalog.Action> action = catalog.getByWireName(codeblock, wireName);
    if (action.isPresent()) return action.get().dfrsName();
    warn(String.format("Unknown %s '%s'", codeblock.wireBlock(), wireName));
    return Names.toDfrsName(wireName);
  }

  private void warn(String message) {
    logger.warn(message);
    warnings.add(message);
  }

  // Writes a line followed by any warnings raised while building it.
  private void add(String line) {
    String indent = Strings.repeat("  ", Math.max(indentation, 0));
    if (!line.isEmpty()) out.append(indent).append(line).append('\n');
    for (String warning : warnings) {
      out.append(indent).append("// WARN: ").append(warning).append('\n');
    }
    warnings.clear();
  }
}
