package dfrs;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * The structure of the action dump file published by the runtime. Instances are populated by Gson;
 * fields the compiler does not use are left out and ignored while reading.
 */
public class ActionDump {

  public List<Block> codeblocks = new ArrayList<>();

  public List<Action> actions = new ArrayList<>();

  public List<GameValue> gameValues = new ArrayList<>();

  public List<Particle> particles = new ArrayList<>();

  public List<Sound> sounds = new ArrayList<>();

  public List<Potion> potions = new ArrayList<>();

  public static class Block {
    public String name;
    public String identifier;
    public Icon item;
  }

  public static class Action {
    public String name;
    public String codeblockName;
    public List<Tag> tags = new ArrayList<>();
    public List<String> aliases = new ArrayList<>();
    public Icon icon = new Icon();

    /** Conditional blocks whose conditions this action accepts as a sub-action, if any. */
    public List<String> subActionBlocks;
  }

  public static class Tag {
    public String name;
    public List<TagOption> options = new ArrayList<>();
    public String defaultOption;
    public int slot;
  }

  public static class TagOption {
    public String name;
    public List<String> aliases = new ArrayList<>();
  }

  public static class Icon {
    public String material = "";
    public String name = "";
    public List<String> description = new ArrayList<>();
    public List<List<String>> additionalInfo = new ArrayList<>();
    public List<Argument> arguments = new ArrayList<>();
    public List<ReturnValue> returnValues = new ArrayList<>();
    public String returnType;
  }

  public static class Argument {
    @SerializedName(value = "type", alternate = "text")
    public String type = "";
    public boolean plural;
    public boolean optional;
    public List<String> description = new ArrayList<>();
  }

  public static class ReturnValue {
    @SerializedName(value = "type", alternate = "text")
    public String type = "";
    public List<String> description = new ArrayList<>();
  }

  public static class GameValue {
    public List<String> aliases = new ArrayList<>();
    public String category;
    public Icon icon = new Icon();
  }

  public static class Particle {
    public String particle;
    public String category;
    public List<String> fields = new ArrayList<>();
  }

  public static class Sound {
    public String sound;
  }

  public static class Potion {
    public String potion;
  }
}
