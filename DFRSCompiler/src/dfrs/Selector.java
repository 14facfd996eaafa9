package dfrs;

import java.util.Arrays;
import java.util.Optional;

/** Target qualifier of player/entity actions, conditionals and game values. */
public enum Selector {
  DEFAULT("default", "Default"),
  SELECTION("selection", "Selection"),
  KILLER("killer", "Killer"),
  DAMAGER("damager", "Damager"),
  SHOOTER("shooter", "Shooter"),
  VICTIM("victim", "Victim"),
  ALL_PLAYERS("all", "AllPlayers"),
  PROJECTILE("projectile", "Projectile"),
  ALL_ENTITIES("allEntities", "AllEntities"),
  ALL_MOBS("allMobs", "AllMobs"),
  LAST_SPAWNED("last", "LastSpawned");

  private final String dfrsName;
  private final String wireName;

  private Selector(String dfrsName, String wireName) {
    this.dfrsName = dfrsName;
    this.wireName = wireName;
  }

  public String dfrsName() {
    return dfrsName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<Selector> forDfrsName(String name) {
    return Arrays.stream(values()).filter(s -> s.dfrsName.equals(name)).findFirst();
  }

  public static Optional<Selector> forWireName(String name) {
    return Arrays.stream(values()).filter(s -> s.wireName.equals(name)).findFirst();
  }
}
