package dfrs;

import java.util.Arrays;
import java.util.Optional;

/** Declared types of function parameters and variables, with their wire names. */
public enum ParamType {
  STRING("string", "txt", ArgType.STRING),
  TEXT("text", "comp", ArgType.TEXT),
  NUMBER("number", "num", ArgType.NUMBER),
  LOCATION("location", "loc", ArgType.LOCATION),
  VECTOR("vector", "vec", ArgType.VECTOR),
  SOUND("sound", "snd", ArgType.SOUND),
  PARTICLE("particle", "par", ArgType.PARTICLE),
  POTION("potion", "pot", ArgType.POTION),
  ITEM("item", "item", ArgType.ITEM),
  ANY("any", "any", ArgType.ANY),
  VARIABLE("variable", "var", ArgType.VARIABLE),
  LIST("list", "list", ArgType.VARIABLE),
  DICT("dict", "dict", ArgType.VARIABLE);

  private final String dfrsName;
  private final String wireName;
  private final ArgType argType;

  private ParamType(String dfrsName, String wireName, ArgType argType) {
    this.dfrsName = dfrsName;
    this.wireName = wireName;
    this.argType = argType;
  }

  public String dfrsName() {
    return dfrsName;
  }

  public String wireName() {
    return wireName;
  }

  public ArgType argType() {
    return argType;
  }

  // Variables may only be declared with a value type.
  public boolean isVariableType() {
    return ordinal() <= ITEM.ordinal();
  }

  public static Optional<ParamType> forDfrsName(String name) {
    return Arrays.stream(values()).filter(t -> t.dfrsName.equals(name)).findFirst();
  }

  public static Optional<ParamType> forWireName(String name) {
    return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
  }
}
