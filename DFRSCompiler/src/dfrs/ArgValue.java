package dfrs;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/** A value passed to an action, conditional, call or function parameter default. */
public abstract class ArgValue {

  public enum Kind {
    EMPTY,
    NUMBER,
    COMPLEX_NUMBER,
    STRING,
    TEXT,
    LOCATION,
    VECTOR,
    SOUND,
    POTION,
    PARTICLE,
    ITEM,
    TAG,
    VARIABLE,
    GAME_VALUE,
    CONDITION;
  }

  private final Kind kind;

  protected ArgValue(Kind kind) {
    this.kind = kind;
  }

  public final Kind kind() {
    return kind;
  }

  /** The type this value presents to argument matching. */
  public abstract ArgType type();

  @SuppressWarnings("unchecked")
  public <T extends ArgValue> T cast() {
    return (T) this;
  }

  /** Formats a number the way the wire format and the source syntax spell it. */
  public static String formatNumber(double value) {
    if (value == 0) return "0";
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  public static class Empty extends ArgValue {
    private static final Empty INSTANCE = new Empty();

    private Empty() {
      super(Kind.EMPTY);
    }

    public static Empty instance() {
      return INSTANCE;
    }

    @Override
    public ArgType type() {
      return ArgType.EMPTY;
    }

    @Override
    public String toString() {
      return "null";
    }
  }

  public static class NumberLiteral extends ArgValue {
    private final double number;

    public NumberLiteral(double number) {
      super(Kind.NUMBER);
      this.number = number;
    }

    public double number() {
      return number;
    }

    @Override
    public ArgType type() {
      return ArgType.NUMBER;
    }

    @Override
    public String toString() {
      return formatNumber(number);
    }
  }

  // A number whose value is an expression evaluated by the runtime, e.g. "%math(1+%var(x))".
  public static class ComplexNumber extends ArgValue {
    private final String expression;

    public ComplexNumber(String expression) {
      super(Kind.COMPLEX_NUMBER);
      this.expression = expression;
    }

    public String expression() {
      return expression;
    }

    @Override
    public ArgType type() {
      return ArgType.NUMBER;
    }

    @Override
    public String toString() {
      return "Number(\"" + expression + "\")";
    }
  }

  public static class StringLiteral extends ArgValue {
    private final String string;

    public StringLiteral(String string) {
      super(Kind.STRING);
      this.string = string;
    }

    public String string() {
      return string;
    }

    @Override
    public ArgType type() {
      return ArgType.STRING;
    }

    @Override
    public String toString() {
      return "'" + string + "'";
    }
  }

  public static class TextLiteral extends ArgValue {
    private final String text;

    public TextLiteral(String text) {
      super(Kind.TEXT);
      this.text = text;
    }

    public String text() {
      return text;
    }

    @Override
    public ArgType type() {
      return ArgType.TEXT;
    }

    @Override
    public String toString() {
      return "\"" + text + "\"";
    }
  }

  public static class Location extends ArgValue {
    private final double x;
    private final double y;
    private final double z;
    private final Optional<Double> pitch;
    private final Optional<Double> yaw;

    public Location(double x, double y, double z, Optional<Double> pitch, Optional<Double> yaw) {
      super(Kind.LOCATION);
      this.x = x;
      this.y = y;
      this.z = z;
      this.pitch = pitch;
      this.yaw = yaw;
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

    public Optional<Double> pitch() {
      return pitch;
    }

    public Optional<Double> yaw() {
      return yaw;
    }

    @Override
    public ArgType type() {
      return ArgType.LOCATION;
    }

    @Override
    public String toString() {
      return String.format(
          "Location(%s, %s, %s)", formatNumber(x), formatNumber(y), formatNumber(z));
    }
  }

  public static class Vector extends ArgValue {
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
    public ArgType type() {
      return ArgType.VECTOR;
    }

    @Override
    public String toString() {
      return String.format("Vector(%s, %s, %s)", formatNumber(x), formatNumber(y), formatNumber(z));
    }
  }

  public static class Sound extends ArgValue {
    private final String sound;
    private final double volume;
    private final double pitch;
    private final Optional<String> variant;

    public Sound(String sound, double volume, double pitch, Optional<String> variant) {
      super(Kind.SOUND);
      this.sound = sound;
      this.volume = volume;
      this.pitch = pitch;
      this.variant = variant;
    }

    public String sound() {
      return sound;
    }

    public double volume() {
      return volume;
    }

    public double pitch() {
      return pitch;
    }

    public Optional<String> variant() {
      return variant;
    }

    @Override
    public ArgType type() {
      return ArgType.SOUND;
    }

    @Override
    public String toString() {
      return String.format(
          "Sound(\"%s\", %s, %s)", sound, formatNumber(volume), formatNumber(pitch));
    }
  }

  public static class Potion extends ArgValue {
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
    public ArgType type() {
      return ArgType.POTION;
    }

    @Override
    public String toString() {
      return String.format("Potion(\"%s\", %d, %d)", potion, amplifier, duration);
    }
  }

  /** Optional particle properties; each one is only written to the wire when set. */
  public static class ParticleData {
    private Optional<Vector> motion = Optional.empty();
    private Optional<Integer> motionVariation = Optional.empty();
    private Optional<Integer> rgb = Optional.empty();
    private Optional<Integer> rgbFade = Optional.empty();
    private Optional<Integer> colorVariation = Optional.empty();
    private Optional<String> material = Optional.empty();
    private Optional<Double> size = Optional.empty();
    private Optional<Integer> sizeVariation = Optional.empty();
    private Optional<Double> roll = Optional.empty();

    public Optional<Vector> motion() {
      return motion;
    }

    public ParticleData setMotion(Vector motion) {
      this.motion = Optional.of(motion);
      return this;
    }

    public Optional<Integer> motionVariation() {
      return motionVariation;
    }

    public ParticleData setMotionVariation(int motionVariation) {
      this.motionVariation = Optional.of(motionVariation);
      return this;
    }

    public Optional<Integer> rgb() {
      return rgb;
    }

    public ParticleData setRgb(int rgb) {
      this.rgb = Optional.of(rgb);
      return this;
    }

    public Optional<Integer> rgbFade() {
      return rgbFade;
    }

    public ParticleData setRgbFade(int rgbFade) {
      this.rgbFade = Optional.of(rgbFade);
      return this;
    }

    public Optional<Integer> colorVariation() {
      return colorVariation;
    }

    public ParticleData setColorVariation(int colorVariation) {
      this.colorVariation = Optional.of(colorVariation);
      return this;
    }

    public Optional<String> material() {
      return material;
    }

    public ParticleData setMaterial(String material) {
      this.material = Optional.of(material);
      return this;
    }

    public Optional<Double> size() {
      return size;
    }

    public ParticleData setSize(double size) {
      this.size = Optional.of(size);
      return this;
    }

    public Optional<Integer> sizeVariation() {
      return sizeVariation;
    }

    public ParticleData setSizeVariation(int sizeVariation) {
      this.sizeVariation = Optional.of(sizeVariation);
      return this;
    }

    public Optional<Double> roll() {
      return roll;
    }

    public ParticleData setRoll(double roll) {
      this.roll = Optional.of(roll);
      return this;
    }
  }

  public static class Particle extends ArgValue {
    private final String particle;
    private final int amount;
    private final double horizontal;
    private final double vertical;
    private final ParticleData data;

    public Particle(
        String particle, int amount, double horizontal, double vertical, ParticleData data) {
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

    public ParticleData data() {
      return data;
    }

    @Override
    public ArgType type() {
      return ArgType.PARTICLE;
    }

    @Override
    public String toString() {
      return String.format(
          "Particle(\"%s\", %d, %s, %s)",
          particle, amount, formatNumber(horizontal), formatNumber(vertical));
    }
  }

  public static class Item extends ArgValue {
    private final String item;

    public Item(String item) {
      super(Kind.ITEM);
      this.item = item;
    }

    public String item() {
      return item;
    }

    @Override
    public ArgType type() {
      return ArgType.ITEM;
    }

    @Override
    public String toString() {
      return "Item(\"" + item + "\")";
    }
  }

  public static class Tag extends ArgValue {
    private final String name;
    private final ArgValue value;
    private final Optional<ActionCatalog.TagDefinition> definition;

    public Tag(String name, ArgValue value, Optional<ActionCatalog.TagDefinition> definition) {
      super(Kind.TAG);
      this.name = name;
      this.value = value;
      this.definition = definition;
    }

    public String name() {
      return name;
    }

    public ArgValue value() {
      return value;
    }

    public Optional<ActionCatalog.TagDefinition> definition() {
      return definition;
    }

    @Override
    public ArgType type() {
      return ArgType.TAG;
    }

    @Override
    public String toString() {
      return name + "=" + value;
    }
  }

  public static class Variable extends ArgValue {
    private final String dfrsName;
    private final String wireName;
    private final VariableScope scope;
    private final Optional<ArgType> declaredType;

    public Variable(
        String dfrsName, String wireName, VariableScope scope, Optional<ArgType> declaredType) {
      super(Kind.VARIABLE);
      this.dfrsName = dfrsName;
      this.wireName = wireName;
      this.scope = scope;
      this.declaredType = declaredType;
    }

    public String dfrsName() {
      return dfrsName;
    }

    public String wireName() {
      return wireName;
    }

    public VariableScope scope() {
      return scope;
    }

    public Optional<ArgType> declaredType() {
      return declaredType;
    }

    @Override
    public ArgType type() {
      return ArgType.VARIABLE;
    }

    @Override
    public String toString() {
      return dfrsName;
    }
  }

  public static class GameValue extends ArgValue {
    private final String dfrsName;
    private final Optional<String> wireName;
    private final Selector selector;
    private final Optional<ArgType> valueType;

    public GameValue(String dfrsName, Selector selector) {
      this(dfrsName, Optional.empty(), selector, Optional.empty());
    }

    private GameValue(
        String dfrsName,
        Optional<String> wireName,
        Selector selector,
        Optional<ArgType> valueType) {
      super(Kind.GAME_VALUE);
      this.dfrsName = dfrsName;
      this.wireName = wireName;
      this.selector = selector;
      this.valueType = valueType;
    }

    public String dfrsName() {
      return dfrsName;
    }

    public Optional<String> wireName() {
      return wireName;
    }

    public Selector selector() {
      return selector;
    }

    public Optional<ArgType> valueType() {
      return valueType;
    }

    public GameValue resolve(String wireName, ArgType valueType) {
      return new GameValue(dfrsName, Optional.of(wireName), selector, Optional.of(valueType));
    }

    @Override
    public ArgType type() {
      return ArgType.ANY;
    }

    @Override
    public String toString() {
      return "$" + (selector == Selector.DEFAULT ? "" : selector.dfrsName() + ":") + dfrsName;
    }
  }

  // A conditional used as the first argument of an action or repeat.
  public static class Condition extends ArgValue {
    private final String name;
    private final ImmutableList<Arg> args;
    private final Selector selector;
    private final ConditionalKind conditionalKind;
    private final boolean inverted;

    public Condition(
        String name,
        Iterable<Arg> args,
        Selector selector,
        ConditionalKind conditionalKind,
        boolean inverted) {
      super(Kind.CONDITION);
      this.name = name;
      this.args = ImmutableList.copyOf(args);
      this.selector = selector;
      this.conditionalKind = conditionalKind;
      this.inverted = inverted;
    }

    public String name() {
      return name;
    }

    public ImmutableList<Arg> args() {
      return args;
    }

    public Selector selector() {
      return selector;
    }

    public ConditionalKind conditionalKind() {
      return conditionalKind;
    }

    public boolean inverted() {
      return inverted;
    }

    public Condition withNameAndArgs(String name, Iterable<Arg> args) {
      return new Condition(name, args, selector, conditionalKind, inverted);
    }

    @Override
    public ArgType type() {
      return ArgType.CONDITION;
    }

    @Override
    public String toString() {
      return String.format(
          "%s %s%s(%s)",
          conditionalKind.keyword().repr(),
          inverted ? "!" : "",
          name,
          args.stream().map(a -> a.value().toString()).collect(Collectors.joining(", ")));
    }
  }
}
