package dfrs;

import java.lang.reflect.Type;
import java.util.Optional;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * The `data` payload of an argument item on the wire. Every variant has its own field names, so
 * each one writes and reads itself by hand.
 */
public abstract class ItemData {

  public enum Kind {
    SIMPLE,
    ID,
    ITEM,
    GAME_VALUE,
    VARIABLE,
    LOCATION,
    VECTOR,
    SOUND,
    POTION,
    TAG,
    FUNCTION_PARAM,
    PARTICLE,
    UNKNOWN;
  }

  private final Kind kind;

  protected ItemData(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  @SuppressWarnings("unchecked")
  public <T extends ItemData> T cast() {
    return (T) this;
  }

  public abstract JsonObject toJson();

  static class Serializer implements JsonSerializer<ItemData> {
    @Override
    public JsonElement serialize(ItemData src, Type typeOfSrc, JsonSerializationContext context) {
      return src.toJson();
    }
  }

  /** Reads the payload of an item whose `id` is {@code id}. */
  public static ItemData parse(String id, JsonObject json) {
    switch (id) {
      case "txt":
      case "comp":
      case "num":
        return new Simple(string(json, "name"));
      case "hint":
        return new Id(string(json, "id"));
      case "item":
        return new Item(string(json, "item"));
      case "g_val":
        return new GameValue(string(json, "type"), string(json, "target"));
      case "var":
        return new Variable(string(json, "name"), string(json, "scope"));
      case "loc":
        {
          JsonObject loc = object(json, "loc");
          return new Location(
              json.has("isBlock") && json.get("isBlock").getAsBoolean(),
              number(loc, "x"),
              number(loc, "y"),
              number(loc, "z"),
              loc.has("pitch") ? number(loc, "pitch") : 0,
              loc.has("yaw") ? number(loc, "yaw") : 0);
        }
      case "vec":
        return new Vector(number(json, "x"), number(json, "y"), number(json, "z"));
      case "snd":
        return new Sound(
            string(json, "sound"),
            json.has("variant") ? Optional.of(string(json, "variant")) : Optional.empty(),
            number(json, "vol"),
            number(json, "pitch"));
      case "pot":
        return new Potion(
            string(json, "pot"), (int) number(json, "amp"), (int) number(json, "dur"));
      case "bl_tag":
        return new Tag(
            string(json, "action"),
            string(json, "block"),
            string(json, "option"),
            string(json, "tag"));
      case "pn_el":
        {
          Optional<Codeline.ArgItem> defaultValue = Optional.empty();
          if (json.has("default_value")) {
            JsonObject item = object(json, "default_value");
            String itemId = string(item, "id");
            defaultValue =
                Optional.of(new Codeline.ArgItem(parse(itemId, object(item, "data")), itemId));
          }
          return new FunctionParam(
              defaultValue,
              string(json, "name"),
              json.has("optional") && json.get("optional").getAsBoolean(),
              json.has("plural") && json.get("plural").getAsBoolean(),
              string(json, "type"));
        }
      case "part":
        {
          JsonObject cluster = object(json, "cluster");
          JsonObject data = json.has("data") ? object(json, "data") : new JsonObject();
          ArgValue.ParticleData particleData = new ArgValue.ParticleData();
          if (data.has("x") && data.has("y") && data.has("z")) {
            particleData.setMotion(
                new ArgValue.Vector(number(data, "x"), number(data, "y"), number(data, "z")));
          }
          if (data.has("motionVariation")) {
            particleData.setMotionVariation((int) number(data, "motionVariation"));
          }
          if (data.has("rgb")) particleData.setRgb((int) number(data, "rgb"));
          if (data.has("rgb_fade")) particleData.setRgbFade((int) number(data, "rgb_fade"));
          if (data.has("colorVariation")) {
            particleData.setColorVariation((int) number(data, "colorVariation"));
          }
          if (data.has("material")) particleData.setMaterial(string(data, "material"));
          if (data.has("size")) particleData.setSize(number(data, "size"));
          if (data.has("sizeVariation")) {
            particleData.setSizeVariation((int) number(data, "sizeVariation"));
          }
          if (data.has("roll")) particleData.setRoll(number(data, "roll"));
          return new Particle(
              string(json, "particle"),
              (int) number(cluster, "amount"),
              number(cluster, "horizontal"),
              number(cluster, "vertical"),
              particleData);
        }
      default:
        return new Unknown(json);
    }
  }

  private static JsonElement field(JsonObject json, String name) {
    JsonElement element = json.get(name);
    if (element == null || element.isJsonNull()) {
      throw new JsonParseException("Missing field '" + name + "'");
    }
    return element;
  }

  private static String string(JsonObject json, String name) {
    return field(json, name).getAsString();
  }

  private static double number(JsonObject json, String name) {
    return field(json, name).getAsDouble();
  }

  private static JsonObject object(JsonObject json, String name) {
    JsonElement element = field(json, name);
    if (!element.isJsonObject()) throw new JsonParseException("Field '" + name + "' is no object");
    return element.getAsJsonObject();
  }

  // Text, string and number values: {name}.
  public static class Simple extends ItemData {
    private final String name;

    public Simple(String name) {
      super(Kind.SIMPLE);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      json.addProperty("name", name);
      return json;
    }
  }

  public static class Id extends ItemData {
    private final String id;

    public Id(String id) {
      super(Kind.ID);
      this.id = id;
    }

    public String id() {
      return id;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      json.addProperty("id", id);
      return json;
    }
  }

  public static class Item extends ItemData {
    private final String item;

    public Item(String item) {
      super(Kind.ITEM);
      this.item = item;
    }

    public String item() {
      return item;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      json.addProperty("item", item);
      return json;
    }
  }

  public static class GameValue extends ItemData {
    private final String type;
    private final String target;

    public GameValue(String type, String target) {
      super(Kind.GAME_VALUE);
      this.type = type;
      this.target = target;
    }

    public String type() {
      return type;
    }

    public String target() {
      return target;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      json.addProperty("type", type);
      json.addProperty("target", target);
      return json;
    }
  }

  public static class Variable extends ItemData {
    private final String name;
    private final String scope;

    public Variable(String name, String scope) {
      super(Kind.VARIABLE);
      this.name = name;
      this.scope = scope;
    }

    public String name() {
      return name;
    }

    public String scope() {
      return scope;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      json.addProperty("name", name);
      json.addProperty("scope", scope);
      return json;
    }
  }

  // Pitch and yaw are always written, as 0 when unset.
  public static class Location extends ItemData {
    private final boolean isBlock;
    private final double x;
    private final double y;
    private final double z;
    private final double pitch;
    private final double yaw;

    public Location(boolean isBlock, double x, double y, double z, double pitch, double yaw) {
      super(Kind.LOCATION);
      this.isBlock = isBlock;
      this.x = x;
      this.y = y;
      this.z = z;
      this.pitch = pitch;
      this.yaw = yaw;
    }

    public boolean isBlock() {
      return isBlock;
    }

    public double x() {
      return x;
    }

    public double y() {
      return y;
    }

    public double z() {
      return z;
    }

    public double pitch() {
      return pitch;
    }

    public double yaw() {
      return yaw;
    }

    @Override
    public JsonObject toJson() {
      JsonObject loc = new JsonObject();
      loc.addProperty("x", x);
      loc.addProperty("y", y);
      loc.addProperty("z", z);
      loc.addProperty("pitch", pitch);
      loc.addProperty("yaw", yaw);

      JsonObject json = new JsonObject();
      json.addProperty("isBlock", isBlock);
      json.add("loc", loc);
      return json;
    }
  }

  public static class Vector extends ItemData {
    private final double x;
    private final double y;
    private final double z;

    public Vector(double x, double y, double z) {
      super(Kind.VECTOR);
      this.x = x;
      this.y = y;
      this.z = z;
    }

    public double x() {
      return x;
    }

    public double y() {
      return y;
    }

    public double z() {
      return z;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      json.addProperty("x", x);
      json.addProperty("y", y);
      json.addProperty("z", z);
      return json;
    }
  }

  public static class Sound extends ItemData {
    private final String sound;
    private final Optional<String> variant;
    private final double volume;
    private final double pitch;

    public Sound(String sound, Optional<String> variant, double volume, double pitch) {
      super(Kind.SOUND);
      this.sound = sound;
      this.variant = variant;
      this.volume = volume;
      this.pitch = pitch;
    }

    public String sound() {
      return sound;
    }

    public Optional<String> variant() {
      return variant;
    }

    public double volume() {
      return volume;
    }

    public double pitch() {
      return pitch;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      json.addProperty("sound", sound);
      if (variant.isPresent()) json.addProperty("variant", variant.get());
      json.addProperty("vol", volume);
      json.addProperty("pitch", pitch);
      return json;
    }
  }

  public static class Potion extends ItemData {
    private final String potion;
    private final int amplifier;
    private final int duration;

    public Potion(String potion, int amplifier, int duration) {
      super(Kind.POTION);
      this.potion = potion;
      this.amplifier = amplifier;
      this.duration = duration;
    }

    public String potion() {
      return potion;
    }

    public int amplifier() {
      return amplifier;
    }

    public int duration() {
      return duration;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      json.addProperty("pot", potion);
      json.addProperty("amp", amplifier);
      json.addProperty("dur", duration);
      return json;
    }
  }

  public static class Tag extends ItemData {
    private final String action;
    private final String block;
    private final String option;
    private final String tag;

    public Tag(String action, String block, String option, String tag) {
      super(Kind.TAG);
      this.action = action;
      this.block = block;
      this.option = option;
      this.tag = tag;
    }

    public String action() {
      return action;
    }

    public String block() {
      return block;
    }

    public String option() {
      return option;
    }

    public String tag() {
      return tag;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      json.addProperty("action", action);
      json.addProperty("block", block);
      json.addProperty("option", option);
      json.addProperty("tag", tag);
      return json;
    }
  }

  public static class FunctionParam extends ItemData {
    private final Optional<Codeline.ArgItem> defaultValue;
    private final String name;
    private final boolean optional;
    private final boolean plural;
    private final String type;

    public FunctionParam(
        Optional<Codeline.ArgItem> defaultValue,
        String name,
        boolean optional,
        boolean plural,
        String type) {
      super(Kind.FUNCTION_PARAM);
      this.defaultValue = defaultValue;
      this.name = name;
      this.optional = optional;
      this.plural = plural;
      this.type = type;
    }

    public Optional<Codeline.ArgItem> defaultValue() {
      return defaultValue;
    }

    public String name() {
      return name;
    }

    public boolean optional() {
      return optional;
    }

    public boolean plural() {
      return plural;
    }

    public String type() {
      return type;
    }

    @Override
    public JsonObject toJson() {
      JsonObject json = new JsonObject();
      if (defaultValue.isPresent()) {
        JsonObject item = new JsonObject();
        item.add("data", defaultValue.get().data().toJson());
        item.addProperty("id", defaultValue.get().id());
        json.add("default_value", item);
      }
      json.addProperty("name", name);
      json.addProperty("optional", optional);
      json.addProperty("plural", plural);
      json.addProperty("type", type);
      return json;
    }
  }

  public static class Particle extends ItemData {
    private final String particle;
    private final int amount;
    private final double horizontal;
    private final double vertical;
    private final ArgValue.ParticleData data;

    public Particle(
        String particle,
        int amount,
        double horizontal,
        double vertical,
        ArgValue.ParticleData data) {
      super(Kind.PARTICLE);
      this.particle = particle;
      this.amount = amount;
      this.horizontal = horizontal;
      this.vertical = vertical;
      this.data = data;
    }

    public String particle() {
      return particle;
    }

    public int amount() {
      return amount;
    }

    public double horizontal() {
      return horizontal;
    }

    public double vertical() {
      return vertical;
    }

    public ArgValue.ParticleData data() {
      return data;
    }

    @Override
    public JsonObject toJson() {
      JsonObject cluster = new JsonObject();
      cluster.addProperty("amount", amount);
      cluster.addProperty("horizontal", horizontal);
      cluster.addProperty("vertical", vertical);

      JsonObject dataJson = new JsonObject();
      if (data.motion().isPresent()) {
        dataJson.addProperty("x", data.motion().get().x());
        dataJson.addProperty("y", data.motion().get().y());
        dataJson.addProperty("z", data.motion().get().z());
      }
      data.motionVariation().ifPresent(v -> dataJson.addProperty("motionVariation", v));
      data.rgb().ifPresent(v -> dataJson.addProperty("rgb", v));
      data.rgbFade().ifPresent(v -> dataJson.addProperty("rgb_fade", v));
      data.colorVariation().ifPresent(v -> dataJson.addProperty("colorVariation", v));
      data.material().ifPresent(v -> dataJson.addProperty("material", v));
      data.size().ifPresent(v -> dataJson.addProperty("size", v));
      data.sizeVariation().ifPresent(v -> dataJson.addProperty("sizeVariation", v));
      data.roll().ifPresent(v -> dataJson.addProperty("roll", v));

      JsonObject json = new JsonObject();
      json.addProperty("particle", particle);
      json.add("cluster", cluster);
      json.add("data", dataJson);
      return json;
    }
  }

  // A payload whose item id is not known; kept verbatim.
  public static class Unknown extends ItemData {
    private final JsonObject json;

    public Unknown(JsonObject json) {
      super(Kind.UNKNOWN);
      this.json = json;
    }

    @Override
    public JsonObject toJson() {
      return json.deepCopy();
    }
  }
}
