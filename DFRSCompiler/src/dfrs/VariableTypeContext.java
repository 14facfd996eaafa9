package dfrs;

import java.util.Optional;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

/**
 * Types bound to variables while validating one file. A variable is bound by its declaration or by
 * being the target of an action with a return type; later reads see that type.
 */
public class VariableTypeContext {
  private final Table<VariableScope, String, ArgType> types = HashBasedTable.create();

  public void bind(ArgValue.Variable variable, ArgType type) {
    // A generic "set" result never widens a known type.
    if (type == ArgType.ANY && types.contains(variable.scope(), variable.wireName())) return;
    types.put(variable.scope(), variable.wireName(), type);
  }

  public Optional<ArgType> lookup(ArgValue.Variable variable) {
    return Optional.ofNullable(types.get(variable.scope(), variable.wireName()));
  }

  /** The bound type, else the declared one, else {@link ArgType#ANY}. */
  public ArgType typeOf(ArgValue.Variable variable) {
    return lookup(variable).orElse(variable.declaredType().orElse(ArgType.ANY));
  }

  public void clear() {
    types.clear();
  }

  /** Forgets line and local variables when moving on to the next event, function or process. */
  public void enterUnit() {
    types.row(VariableScope.LINE).clear();
    types.row(VariableScope.LOCAL).clear();
  }
}
