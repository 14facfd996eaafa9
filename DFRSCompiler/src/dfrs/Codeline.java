package dfrs;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * One compiled unit as the runtime stores it: a header block followed by the blocks of its body,
 * with nesting expressed by bracket blocks.
 */
public class Codeline {
  private static final Gson GSON =
      new GsonBuilder()
          .registerTypeHierarchyAdapter(ItemData.class, new ItemData.Serializer())
          .registerTypeAdapter(ArgItem.class, new ArgItem.Deserializer())
          .disableHtmlEscaping()
          .create();

  private List<Block> blocks;

  public Codeline(List<Block> blocks) {
    this.blocks = new ArrayList<>(blocks);
  }

  public ImmutableList<Block> blocks() {
    return blocks == null ? ImmutableList.of() : ImmutableList.copyOf(blocks);
  }

  public String toJson() {
    return GSON.toJson(this);
  }

  /**
   * Reads a code line from its JSON text.
   *
   * @throws IllegalArgumentException if the text is not a code line
   */
  public static Codeline fromJson(String json) {
    Codeline codeline;
    try {
      codeline = GSON.fromJson(json, Codeline.class);
    } catch (JsonParseException | IllegalStateException ex) {
      throw new IllegalArgumentException("Malformed code template: " + ex.getMessage(), ex);
    }
    if (codeline == null || codeline.blocks == null) {
      throw new IllegalArgumentException("Malformed code template: no blocks");
    }
    return codeline;
  }

  /**
   * A block or a bracket. Fields that are null are left out of the JSON; declaration order is the
   * order the runtime writes them in.
   */
  public static class Block {
    private String id;
    private String block;
    private Args args;
    private String action;
    private String target;
    private String data;
    private String attribute;
    private String subAction;
    private String direct;
    private String type;

    private Block() {}

    public static Block of(Codeblock codeblock) {
      Block b = new Block();
      b.id = "block";
      b.block = codeblock.wireBlock();
      return b;
    }

    // Else blocks carry nothing but their kind.
    public static Block elseBlock() {
      Block b = new Block();
      b.id = "block";
      b.block = Codeblock.ELSE.wireBlock();
      return b;
    }

    public static Block bracket(boolean open, boolean repeat) {
      Block b = new Block();
      b.id = "bracket";
      b.direct = open ? "open" : "close";
      b.type = repeat ? "repeat" : "norm";
      return b;
    }

    public Block withArgs(List<SlotItem> items) {
      args = new Args(items);
      return this;
    }

    public Block withAction(String action) {
      this.action = action;
      return this;
    }

    public Block withTarget(Selector selector) {
      target = selector.wireName();
      return this;
    }

    public Block withData(String data) {
      this.data = data;
      return this;
    }

    public Block withAttribute(String attribute) {
      this.attribute = attribute;
      return this;
    }

    public Block withSubAction(String subAction) {
      this.subAction = subAction;
      return this;
    }

    public String id() {
      return id;
    }

    public boolean isBracket() {
      return "bracket".equals(id);
    }

    public boolean isOpen() {
      return "open".equals(direct);
    }

    public boolean isRepeatBracket() {
      return "repeat".equals(type);
    }

    public Optional<String> block() {
      return Optional.ofNullable(block);
    }

    public ImmutableList<SlotItem> items() {
      if (args == null || args.items == null) return ImmutableList.of();
      return ImmutableList.copyOf(args.items);
    }

    public Optional<String> action() {
      return Optional.ofNullable(action);
    }

    public Optional<String> target() {
      return Optional.ofNullable(target);
    }

    public Optional<String> data() {
      return Optional.ofNullable(data);
    }

    public Optional<String> attribute() {
      return Optional.ofNullable(attribute);
    }

    public Optional<String> subAction() {
      return Optional.ofNullable(subAction);
    }
  }

  static class Args {
    private List<SlotItem> items;

    Args(List<SlotItem> items) {
      this.items = new ArrayList<>(items);
    }
  }

  /** An argument item placed in a chest slot of its block. */
  public static class SlotItem {
    private ArgItem item;
    private int slot;

    public SlotItem(ArgItem item, int slot) {
      this.item = item;
      this.slot = slot;
    }

    public ArgItem item() {
      return item;
    }

    public int slot() {
      return slot;
    }
  }

  public static class ArgItem {
    private ItemData data;
    private String id;

    public ArgItem(ItemData data, String id) {
      this.data = data;
      this.id = id;
    }

    public ItemData data() {
      return data;
    }

    public String id() {
      return id;
    }

    // The shape of `data` depends on the sibling `id`.
    static class Deserializer implements JsonDeserializer<ArgItem> {
      @Override
      public ArgItem deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context)
          throws JsonParseException {
        if (!json.isJsonObject()) throw new JsonParseException("Argument item is no object");
        JsonObject object = json.getAsJsonObject();
        if (!object.has("id") || !object.has("data") || !object.get("data").isJsonObject()) {
          throw new JsonParseException("Argument item without id or data");
        }
        String id = object.get("id").getAsString();
        return new ArgItem(ItemData.parse(id, object.getAsJsonObject("data")), id);
      }
    }
  }
}
