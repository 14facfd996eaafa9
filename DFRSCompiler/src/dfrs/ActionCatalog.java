package dfrs;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import com.google.common.io.Files;
import com.google.common.io.Resources;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * The queryable form of the action dump. A catalog is built once and shared read-only between any
 * number of parsers, validators and decompilers.
 */
public class ActionCatalog {
  private static final Logger logger = LoggerFactory.getLogger(ActionCatalog.class);

  public static final String RESOURCE = "dfrs/action_dump.json";
  public static final String DUMP_PROPERTY = "dfrs.actionDump";

  /** One candidate type for an argument slot. */
  @AutoValue
  public abstract static class ArgOption {
    public abstract String description();

    public abstract ArgType type();

    public abstract boolean optional();

    public abstract boolean plural();

    public static ArgOption create(
        String description, ArgType type, boolean optional, boolean plural) {
      return new AutoValue_ActionCatalog_ArgOption(description, type, optional, plural);
    }

    @Override
    public final String toString() {
      return String.format(
          "%s (%s%s%s)", description(), type(), plural() ? "*" : "", optional() ? "?" : "");
    }
  }

  /** One argument position; exactly one of its options is chosen per call. */
  @AutoValue
  public abstract static class ArgSlot {
    public abstract ImmutableList<ArgOption> options();

    public static ArgSlot create(Iterable<ArgOption> options) {
      return new AutoValue_ActionCatalog_ArgSlot(ImmutableList.copyOf(options));
    }

    public static ArgSlot of(ArgOption option) {
      return create(ImmutableList.of(option));
    }
  }

  /** A complete, alternative way to satisfy an action's arguments. */
  @AutoValue
  public abstract static class ArgBranch {
    public abstract ImmutableList<ArgSlot> slots();

    public static ArgBranch create(Iterable<ArgSlot> slots) {
      return new AutoValue_ActionCatalog_ArgBranch(ImmutableList.copyOf(slots));
    }
  }

  @AutoValue
  public abstract static class TagDefinition {
    public abstract String dfrsName();

    public abstract String wireName();

    public abstract int slot();

    public abstract String defaultOption();

    public abstract ImmutableList<String> options();

    public static TagDefinition create(
        String dfrsName,
        String wireName,
        int slot,
        String defaultOption,
        Iterable<String> options) {
      return new AutoValue_ActionCatalog_TagDefinition(
          dfrsName, wireName, slot, defaultOption, ImmutableList.copyOf(options));
    }
  }

  @AutoValue
  public abstract static class Action {
    public abstract String dfrsName();

    public abstract String wireName();

    public abstract Codeblock codeblock();

    public abstract ImmutableList<String> aliases();

    public abstract Optional<ArgType> returnType();

    public abstract ImmutableList<TagDefinition> tags();

    public abstract ImmutableList<ArgBranch> branches();

    // Markdown, for hover documentation.
    public abstract String description();

    public Optional<TagDefinition> tag(String dfrsName) {
      return tags().stream().filter(t -> t.dfrsName().equals(dfrsName)).findFirst();
    }

    public Optional<TagDefinition> tagByWireName(String wireName) {
      return tags().stream().filter(t -> t.wireName().equals(wireName)).findFirst();
    }

    public static Action create(
        String dfrsName,
        String wireName,
        Codeblock codeblock,
        Iterable<String> aliases,
        Optional<ArgType> returnType,
        Iterable<TagDefinition> tags,
        Iterable<ArgBranch> branches,
        String description) {
      return new AutoValue_ActionCatalog_Action(
          dfrsName,
          wireName,
          codeblock,
          ImmutableList.copyOf(aliases),
          returnType,
          ImmutableList.copyOf(tags),
          ImmutableList.copyOf(branches),
          description);
    }
  }

  @AutoValue
  public abstract static class GameValue {
    public abstract String dfrsName();

    public abstract String wireName();

    public abstract ArgType type();

    public abstract String category();

    public abstract ImmutableList<String> aliases();

    public static GameValue create(
        String dfrsName, String wireName, ArgType type, String category, Iterable<String> aliases) {
      return new AutoValue_ActionCatalog_GameValue(
          dfrsName, wireName, type, category, ImmutableList.copyOf(aliases));
    }
  }

  private final ImmutableListMultimap<Codeblock, Action> actions;
  private final ImmutableList<GameValue> gameValues;
  // Lookup indexes; on a name clash the earlier dump entry wins.
  private final ImmutableTable<Codeblock, String, Action> actionsByName;
  private final ImmutableTable<Codeblock, String, Action> actionsByWireName;
  private final ImmutableMap<String, GameValue> gameValuesByName;
  private final ImmutableMap<String, GameValue> gameValuesByWireName;
  private final ImmutableSet<String> particles;
  private final ImmutableSet<String> sounds;
  private final ImmutableSet<String> potions;

  private ActionCatalog(
      ImmutableListMultimap<Codeblock, Action> actions,
      ImmutableList<GameValue> gameValues,
      ImmutableSet<String> particles,
      ImmutableSet<String> sounds,
      ImmutableSet<String> potions) {
    this.actions = actions;
    this.gameValues = gameValues;
    this.particles = particles;
    this.sounds = sounds;
    this.potions = potions;

    Table<Codeblock, String, Action> byName = HashBasedTable.create();
    Table<Codeblock, String, Action> byWireName = HashBasedTable.create();
    for (Action action : actions.values()) {
      putIfAbsent(byName, action.codeblock(), action.dfrsName(), action);
      putIfAbsent(byWireName, action.codeblock(), action.wireName(), action);
      for (String alias : action.aliases()) {
        putIfAbsent(byWireName, action.codeblock(), alias, action);
      }
    }
    this.actionsByName = ImmutableTable.copyOf(byName);
    this.actionsByWireName = ImmutableTable.copyOf(byWireName);

    Map<String, GameValue> valuesByName = new HashMap<>();
    Map<String, GameValue> valuesByWireName = new HashMap<>();
    for (GameValue value : gameValues) {
      valuesByName.putIfAbsent(value.dfrsName(), value);
      valuesByWireName.putIfAbsent(value.wireName(), value);
      for (String alias : value.aliases()) {
        valuesByWireName.putIfAbsent(alias, value);
      }
    }
    this.gameValuesByName = ImmutableMap.copyOf(valuesByName);
    this.gameValuesByWireName = ImmutableMap.copyOf(valuesByWireName);
  }

  private static void putIfAbsent(
      Table<Codeblock, String, Action> table, Codeblock codeblock, String name, Action action) {
    if (!table.contains(codeblock, name)) table.put(codeblock, name, action);
  }

  public static ActionCatalog create(Iterable<Action> actions, Iterable<GameValue> gameValues) {
    ImmutableListMultimap.Builder<Codeblock, Action> byCodeblock = ImmutableListMultimap.builder();
    for (Action action : actions) {
      byCodeblock.put(action.codeblock(), action);
    }
    return new ActionCatalog(
        byCodeblock.build(),
        ImmutableList.copyOf(gameValues),
        ImmutableSet.of(),
        ImmutableSet.of(),
        ImmutableSet.of());
  }

  /**
   * Loads the bundled action dump, or the file named by the {@value #DUMP_PROPERTY} system
   * property.
   */
  public static ActionCatalog load() {
    String path = System.getProperty(DUMP_PROPERTY);
    try {
      if (path != null) {
        logger.info("Loading action dump from {}", path);
        return fromJson(Files.asCharSource(new File(path), UTF_8).read());
      }
      return fromJson(Resources.toString(Resources.getResource(RESOURCE), UTF_8));
    } catch (IOException | IllegalArgumentException ex) {
      throw new IllegalStateException("Failed to read action dump", ex);
    }
  }

  public static ActionCatalog fromJson(String json) {
    ActionDump dump;
    try {
      dump = new Gson().fromJson(json, ActionDump.class);
    } catch (JsonParseException ex) {
      throw new IllegalStateException("Malformed action dump", ex);
    }
    if (dump == null) throw new IllegalStateException("Empty action dump");
    return fromDump(dump);
  }

  public static ActionCatalog fromDump(ActionDump dump) {
    ImmutableListMultimap.Builder<Codeblock, Action> actions = ImmutableListMultimap.builder();
    int count = 0;
    for (ActionDump.Action raw : dump.actions) {
      Optional<Codeblock> codeblock = Codeblock.forCatalogName(raw.codeblockName);
      if (!codeblock.isPresent()) {
        logger.debug("Skipping '{}' of unknown block '{}'", raw.name, raw.codeblockName);
        continue;
      } else if (isPlaceholder(raw, codeblock.get())) {
        continue;
      }

      actions.put(codeblock.get(), toAction(raw, codeblock.get()));
      count++;
    }

    ImmutableList<GameValue> gameValues =
        dump.gameValues.stream()
            .map(
                raw ->
                    GameValue.create(
                        Names.toDfrsName(raw.icon.name),
                        raw.icon.name,
                        raw.icon.returnType == null
                            ? ArgType.ANY
                            : ArgType.forCatalogName(raw.icon.returnType).orElse(ArgType.ANY),
                        raw.category == null ? "" : raw.category,
                        raw.aliases))
            .collect(ImmutableList.toImmutableList());

    logger.debug("Loaded {} actions and {} game values", count, gameValues.size());
    return new ActionCatalog(
        actions.build(),
        gameValues,
        dump.particles.stream().map(p -> p.particle).collect(ImmutableSet.toImmutableSet()),
        dump.sounds.stream().map(s -> s.sound).collect(ImmutableSet.toImmutableSet()),
        dump.potions.stream().map(p -> p.potion).collect(ImmutableSet.toImmutableSet()));
  }

  // Legacy entries in the dump: no arguments, no return values and a stone icon.
  private static boolean isPlaceholder(ActionDump.Action raw, Codeblock codeblock) {
    return raw.icon.arguments.isEmpty()
        && raw.icon.returnValues.isEmpty()
        && raw.icon.material.equals("STONE")
        && codeblock != Codeblock.START_PROCESS;
  }

  private static Action toAction(ActionDump.Action raw, Codeblock codeblock) {
    String dfrsName = Names.toDfrsName(raw.name);
    ImmutableList<TagDefinition> tags =
        raw.tags.stream()
            .map(
                tag ->
                    TagDefinition.create(
                        Names.toCamelCase(tag.name),
                        tag.name,
                        tag.slot,
                        tag.defaultOption,
                        tag.options.stream().map(o -> o.name).collect(Collectors.toList())))
            .collect(ImmutableList.toImmutableList());

    return Action.create(
        dfrsName,
        raw.name,
        codeblock,
        raw.aliases,
        returnType(raw.icon),
        tags,
        branches(raw.icon.arguments),
        describe(dfrsName, raw.icon));
  }

  private static Optional<ArgType> returnType(ActionDump.Icon icon) {
    if (!icon.returnValues.isEmpty()) {
      return ArgType.forCatalogName(icon.returnValues.get(0).type);
    }
    if (!icon.arguments.isEmpty()) {
      List<String> description = icon.arguments.get(0).description;
      if (!description.isEmpty() && description.get(description.size() - 1).endsWith("to set")) {
        return Optional.of(ArgType.ANY);
      }
    }
    return Optional.empty();
  }

  /**
   * Builds the argument branches of an action. Empty type entries separate sequential groups of
   * arguments and "OR" entries separate alternatives within a group. A group whose alternatives are
   * all single arguments collapses into one slot; otherwise each alternative is its own sequence of
   * slots, and every combination of alternatives becomes a branch.
   */
  static ImmutableList<ArgBranch> branches(List<ActionDump.Argument> arguments) {
    List<List<List<ArgOption>>> groups = new ArrayList<>();
    List<List<ArgOption>> group = new ArrayList<>();
    List<ArgOption> alternative = new ArrayList<>();
    for (ActionDump.Argument argument : arguments) {
      Optional<ArgType> type = ArgType.forCatalogName(argument.type);
      if (type.isPresent()) {
        String description = argument.description.isEmpty() ? "" : argument.description.get(0);
        alternative.add(
            ArgOption.create(description, type.get(), argument.optional, argument.plural));
        continue;
      }

      if (!alternative.isEmpty()) group.add(alternative);
      alternative = new ArrayList<>();
      if (argument.type.isEmpty()) {
        if (!group.isEmpty()) groups.add(group);
        group = new ArrayList<>();
      }
    }
    if (!alternative.isEmpty()) group.add(alternative);
    if (!group.isEmpty()) groups.add(group);

    List<List<ArgSlot>> branches = new ArrayList<>();
    branches.add(ImmutableList.of());
    for (List<List<ArgOption>> alternatives : groups) {
      List<List<ArgSlot>> next = new ArrayList<>();
      for (List<ArgSlot> prefix : branches) {
        for (List<ArgSlot> choice : slotChoices(alternatives)) {
          next.add(ImmutableList.<ArgSlot>builder().addAll(prefix).addAll(choice).build());
        }
      }
      branches = next;
    }

    return branches.stream().map(ArgBranch::create).collect(ImmutableList.toImmutableList());
  }

  private static List<List<ArgSlot>> slotChoices(List<List<ArgOption>> alternatives) {
    List<List<ArgSlot>> choices = new ArrayList<>();
    if (alternatives.size() > 1 && alternatives.stream().allMatch(a -> a.size() == 1)) {
      List<ArgOption> options =
          alternatives.stream().map(a -> a.get(0)).collect(Collectors.toList());
      choices.add(ImmutableList.of(ArgSlot.create(options)));
      return choices;
    }

    for (List<ArgOption> alternative : alternatives) {
      choices.add(alternative.stream().map(ArgSlot::of).collect(Collectors.toList()));
    }
    return choices;
  }

  private static String describe(String dfrsName, ActionDump.Icon icon) {
    StringBuilder sb = new StringBuilder();
    sb.append("### ").append(dfrsName).append("  \n");
    sb.append(String.join(" ", icon.description)).append("  \n");
    for (List<String> info : icon.additionalInfo) {
      sb.append(String.join(" ", info)).append("  \n");
    }
    if (!icon.arguments.isEmpty()) {
      sb.append("  ***  \n### Arguments:  \n");
      for (ActionDump.Argument argument : icon.arguments) {
        if (argument.type.equals("OR")) {
          sb.append("OR  \n");
        } else if (argument.type.isEmpty()) {
          sb.append("  \n");
        } else {
          sb.append(
              String.format(
                  "%s - %s%s%s  \n",
                  String.join(" ", argument.description),
                  argument.type,
                  argument.plural ? "*" : "",
                  argument.optional ? "?" : ""));
        }
      }
    }
    return sb.toString();
  }

  public ImmutableList<Action> actions(Codeblock codeblock) {
    return actions.get(codeblock);
  }

  public Optional<Action> get(Codeblock codeblock, String dfrsName) {
    return Optional.ofNullable(actionsByName.get(codeblock, dfrsName));
  }

  public Optional<Action> getByWireName(Codeblock codeblock, String wireName) {
    return Optional.ofNullable(actionsByWireName.get(codeblock, wireName));
  }

  /** Looks up an event by DSL name, player events first. */
  public Optional<Action> event(String dfrsName) {
    Optional<Action> event = get(Codeblock.PLAYER_EVENT, dfrsName);
    return event.isPresent() ? event : get(Codeblock.ENTITY_EVENT, dfrsName);
  }

  public Optional<GameValue> gameValue(String dfrsName) {
    return Optional.ofNullable(gameValuesByName.get(dfrsName));
  }

  public Optional<GameValue> gameValueByWireName(String wireName) {
    return Optional.ofNullable(gameValuesByWireName.get(wireName));
  }

  public ImmutableList<GameValue> gameValues() {
    return gameValues;
  }

  public ImmutableSet<String> particles() {
    return particles;
  }

  public ImmutableSet<String> sounds() {
    return sounds;
  }

  public ImmutableSet<String> potions() {
    return potions;
  }
}
