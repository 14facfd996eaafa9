package dfrs;

import java.util.Optional;

/** Types an argument slot can require, and the types argument values resolve to. */
public enum ArgType {
  EMPTY,
  NUMBER,
  STRING,
  TEXT,
  LOCATION,
  POTION,
  SOUND,
  VECTOR,
  PARTICLE,
  ITEM,
  VARIABLE,
  TAG,
  CONDITION,
  ANY;

  public boolean matches(ArgType other) {
    return this == other || this == ANY || other == ANY;
  }

  /**
   * Maps an argument or return type name of the action dump. Separators ("OR" and the empty
   * string) have no type and map to {@link Optional#empty()}.
   *
   * @throws IllegalStateException if the name is not a known dump type
   */
  public static Optional<ArgType> forCatalogName(String name) {
    switch (name) {
      case "":
      case "OR":
        return Optional.empty();
      case "NUMBER":
        return Optional.of(NUMBER);
      case "COMPONENT":
        return Optional.of(TEXT);
      case "TEXT":
      case "BLOCK_TAG":
      case "BYTE":
        return Optional.of(STRING);
      case "LOCATION":
        return Optional.of(LOCATION);
      case "POTION":
        return Optional.of(POTION);
      case "SOUND":
        return Optional.of(SOUND);
      case "VECTOR":
        return Optional.of(VECTOR);
      case "PARTICLE":
        return Optional.of(PARTICLE);
      case "LIST":
      case "DICT":
      case "VARIABLE":
        return Optional.of(VARIABLE);
      case "ITEM":
      case "BLOCK":
      case "PROJECTILE":
      case "SPAWN_EGG":
      case "VEHICLE":
      case "ENTITY_TYPE":
        return Optional.of(ITEM);
      case "ANY_TYPE":
        return Optional.of(ANY);
      case "NONE":
        return Optional.of(EMPTY);
      default:
        throw new IllegalStateException("Unknown argument type in action dump: " + name);
    }
  }
}
