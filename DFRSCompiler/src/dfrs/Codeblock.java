package dfrs;

import java.util.Arrays;
import java.util.Optional;

/** Block families of the action dump, with the identifiers they carry on the wire. */
public enum Codeblock {
  PLAYER_ACTION("PLAYER ACTION", "player_action"),
  ENTITY_ACTION("ENTITY ACTION", "entity_action"),
  GAME_ACTION("GAME ACTION", "game_action"),
  SET_VARIABLE("SET VARIABLE", "set_var"),
  CONTROL("CONTROL", "control"),
  SELECT_OBJECT("SELECT OBJECT", "select_obj"),
  IF_PLAYER("IF PLAYER", "if_player"),
  IF_ENTITY("IF ENTITY", "if_entity"),
  IF_GAME("IF GAME", "if_game"),
  IF_VARIABLE("IF VARIABLE", "if_var"),
  REPEAT("REPEAT", "repeat"),
  ELSE("ELSE", "else"),
  START_PROCESS("START PROCESS", "start_process"),
  CALL_FUNCTION("CALL FUNCTION", "call_func"),
  FUNCTION("FUNCTION", "func"),
  PROCESS("PROCESS", "process"),
  PLAYER_EVENT("PLAYER EVENT", "event"),
  ENTITY_EVENT("ENTITY EVENT", "entity_event");

  private final String catalogName;
  private final String wireBlock;

  private Codeblock(String catalogName, String wireBlock) {
    this.catalogName = catalogName;
    this.wireBlock = wireBlock;
  }

  public String catalogName() {
    return catalogName;
  }

  public String wireBlock() {
    return wireBlock;
  }

  // Only these blocks serialize a target selector.
  public boolean hasTarget() {
    return this == PLAYER_ACTION || this == ENTITY_ACTION || this == IF_PLAYER || this == IF_ENTITY;
  }

  public static Optional<Codeblock> forCatalogName(String name) {
    return Arrays.stream(values()).filter(c -> c.catalogName.equals(name)).findFirst();
  }

  public static Optional<Codeblock> forWireBlock(String block) {
    return Arrays.stream(values()).filter(c -> c.wireBlock.equals(block)).findFirst();
  }
}
