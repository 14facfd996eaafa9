package dfrs;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ActionCatalogTest {

  private static ActionCatalog catalog;

  @BeforeAll
  public static void loadCatalog() {
    catalog = ActionCatalog.load();
  }

  private static ActionDump.Argument argument(String type) {
    ActionDump.Argument argument = new ActionDump.Argument();
    argument.type = type;
    argument.description = ImmutableList.of(type.toLowerCase());
    return argument;
  }

  private static List<List<ArgType>> branchTypes(String... types) {
    List<ActionDump.Argument> arguments =
        Arrays.stream(types).map(ActionCatalogTest::argument).collect(Collectors.toList());
    return ActionCatalog.branches(arguments).stream()
        .map(
            b ->
                b.slots().stream()
                    .map(s -> s.options().get(0).type())
                    .collect(Collectors.toList()))
        .collect(Collectors.toList());
  }

  @Test
  public void actionNames() {
    ActionCatalog.Action sendMessage = catalog.get(Codeblock.PLAYER_ACTION, "sendMessage").get();

    assertThat(sendMessage.wireName()).isEqualTo("SendMessage");
    assertThat(sendMessage.codeblock()).isEqualTo(Codeblock.PLAYER_ACTION);
    assertThat(catalog.getByWireName(Codeblock.PLAYER_ACTION, "Send Message"))
        .hasValue(sendMessage);
    assertThat(catalog.get(Codeblock.SET_VARIABLE, "addDirect").get().wireName()).isEqualTo("+=");
    assertThat(catalog.get(Codeblock.IF_VARIABLE, "greater").get().wireName()).isEqualTo(">");
    assertThat(catalog.get(Codeblock.ENTITY_ACTION, "sendMessage")).isEmpty();
  }

  @Test
  public void tags() {
    ActionCatalog.Action sendMessage = catalog.get(Codeblock.PLAYER_ACTION, "sendMessage").get();

    assertThat(
            sendMessage.tags().stream()
                .map(ActionCatalog.TagDefinition::dfrsName)
                .collect(Collectors.toList()))
        .containsExactly("alignmentMode", "textValueMerging")
        .inOrder();
    ActionCatalog.TagDefinition alignment = sendMessage.tag("alignmentMode").get();
    assertThat(alignment.wireName()).isEqualTo("Alignment Mode");
    assertThat(alignment.slot()).isEqualTo(25);
    assertThat(alignment.defaultOption()).isEqualTo("Regular");
    assertThat(alignment.options()).containsExactly("Regular", "Centered");
    assertThat(sendMessage.tagByWireName("Text Value Merging")).isPresent();
  }

  @Test
  public void returnTypes() {
    assertThat(catalog.get(Codeblock.SET_VARIABLE, "randomNumber").get().returnType())
        .hasValue(ArgType.NUMBER);
    assertThat(catalog.get(Codeblock.SET_VARIABLE, "string").get().returnType())
        .hasValue(ArgType.STRING);
    // A first argument described as the variable to set makes the result untyped.
    assertThat(catalog.get(Codeblock.SET_VARIABLE, "equal").get().returnType())
        .hasValue(ArgType.ANY);
    assertThat(catalog.get(Codeblock.SET_VARIABLE, "addDirect").get().returnType()).isEmpty();
    assertThat(catalog.get(Codeblock.PLAYER_ACTION, "sendMessage").get().returnType()).isEmpty();
  }

  @Test
  public void placeholdersAndUnknownBlocksAreSkipped() {
    assertThat(catalog.get(Codeblock.PLAYER_ACTION, "legacy")).isEmpty();
    assertThat(catalog.get(Codeblock.START_PROCESS, "dynamic")).isPresent();
    for (Codeblock codeblock : Codeblock.values()) {
      assertThat(catalog.get(codeblock, "unused")).isEmpty();
    }
  }

  @Test
  public void events() {
    assertThat(catalog.event("join").get().codeblock()).isEqualTo(Codeblock.PLAYER_EVENT);
    assertThat(catalog.event("entityDmgEntity").get().codeblock())
        .isEqualTo(Codeblock.ENTITY_EVENT);
    assertThat(catalog.event("explode")).isEmpty();
  }

  @Test
  public void gameValues() {
    ActionCatalog.GameValue playerCount = catalog.gameValue("playerCount").get();
    assertThat(playerCount.wireName()).isEqualTo("Player Count");
    assertThat(playerCount.type()).isEqualTo(ArgType.NUMBER);

    assertThat(catalog.gameValue("location").get().type()).isEqualTo(ArgType.LOCATION);
    assertThat(catalog.gameValueByWireName("Health").get().dfrsName())
        .isEqualTo("currentHealth");
  }

  @Test
  public void soundsParticlesAndPotions() {
    assertThat(catalog.sounds()).contains("Pling");
    assertThat(catalog.particles()).containsExactly("Cloud", "Dust");
    assertThat(catalog.potions()).contains("Speed");
  }

  @Test
  public void groupsWithSequenceAlternativesBranch() {
    ActionCatalog.Action inRange = catalog.get(Codeblock.IF_VARIABLE, "inRange").get();

    assertThat(inRange.branches()).hasSize(2);
    assertThat(
            branchTypes("ANY_TYPE", "", "NUMBER", "NUMBER", "OR", "LOCATION", "LOCATION"))
        .containsExactly(
            ImmutableList.of(ArgType.ANY, ArgType.NUMBER, ArgType.NUMBER),
            ImmutableList.of(ArgType.ANY, ArgType.LOCATION, ArgType.LOCATION))
        .inOrder();
  }

  @Test
  public void singleAlternativesShareASlot() {
    List<ActionDump.Argument> arguments =
        ImmutableList.of(argument("NUMBER"), argument("OR"), argument("LOCATION"));

    ImmutableList<ActionCatalog.ArgBranch> branches = ActionCatalog.branches(arguments);

    assertThat(branches).hasSize(1);
    assertThat(branches.get(0).slots()).hasSize(1);
    assertThat(
            branches.get(0).slots().get(0).options().stream()
                .map(ActionCatalog.ArgOption::type)
                .collect(Collectors.toList()))
        .containsExactly(ArgType.NUMBER, ArgType.LOCATION)
        .inOrder();
  }

  @Test
  public void noArgumentsIsOneEmptyBranch() {
    assertThat(branchTypes()).containsExactly(ImmutableList.of());
  }

  @Test
  public void typeNames() {
    assertThat(ArgType.forCatalogName("COMPONENT")).hasValue(ArgType.TEXT);
    assertThat(ArgType.forCatalogName("BLOCK_TAG")).hasValue(ArgType.STRING);
    assertThat(ArgType.forCatalogName("DICT")).hasValue(ArgType.VARIABLE);
    assertThat(ArgType.forCatalogName("SPAWN_EGG")).hasValue(ArgType.ITEM);
    assertThat(ArgType.forCatalogName("OR")).isEmpty();
    assertThrows(IllegalStateException.class, () -> ArgType.forCatalogName("WIDGET"));
  }

  @Test
  public void malformedDump() {
    assertThrows(IllegalStateException.class, () -> ActionCatalog.fromJson("[1, 2"));
    assertThrows(IllegalStateException.class, () -> ActionCatalog.fromJson(""));
  }

  @Test
  public void everyCombinationOfAlternativesIsKept() {
    List<String> types = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      if (i > 0) types.add("");
      types.addAll(ImmutableList.of("NUMBER", "NUMBER", "OR", "TEXT"));
    }

    List<List<ArgType>> branches = branchTypes(types.toArray(new String[0]));

    assertThat(branches).hasSize(128);
    assertThat(branches.get(127)).containsExactlyElementsIn(Collections.nCopies(7, ArgType.TEXT));
  }

  @Test
  public void lookupsByAlias() {
    ActionCatalog.Action sendMessage = catalog.get(Codeblock.PLAYER_ACTION, "sendMessage").get();

    for (String alias : sendMessage.aliases()) {
      assertThat(catalog.getByWireName(Codeblock.PLAYER_ACTION, alias)).hasValue(sendMessage);
    }
    assertThat(catalog.getByWireName(Codeblock.PLAYER_ACTION, "sendMessage")).isEmpty();
    assertThat(catalog.gameValueByWireName("Player Count"))
        .isEqualTo(catalog.gameValue("playerCount"));
  }
}
