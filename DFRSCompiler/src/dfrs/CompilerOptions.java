package dfrs;

import com.google.auto.value.AutoValue;

/** Switches for one compiler run. */
@AutoValue
public abstract class CompilerOptions {
  // Calls to undeclared functions fail instead of accepting any arguments.
  public abstract boolean strictCalls();

  public abstract boolean debugTokens();

  public abstract boolean debugNodes();

  public abstract boolean debugCompile();

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setStrictCalls(false)
        .setDebugTokens(false)
        .setDebugNodes(false)
        .setDebugCompile(false);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setStrictCalls(boolean strictCalls);

    public abstract Builder setDebugTokens(boolean debugTokens);

    public abstract Builder setDebugNodes(boolean debugNodes);

    public abstract Builder setDebugCompile(boolean debugCompile);

    public abstract CompilerOptions build();
  }
}
