package syncc.frontend;

import java.util.Objects;
import java.util.Optional;

/**
 * A variable of a node together with its inferred type and clock.
 * @param init declared initial value of a memory (a constant or a global constant name); empty otherwise
 */
public record VarDecl(String name, Type type, Clock clock, Role role, Optional<Expr> init) {
  public enum Role {
    INPUT("input"),
    OUTPUT("output"),
    LOCAL("local"),
    /** State-holding variable; reading it yields the value of the previous step. */
    MEMORY("memory");

    public final String serialName;
    private Role(String serialName) { this.serialName = serialName; }
    @Override
    public String toString() {
      return serialName;
    }
  }

  public VarDecl {
    Objects.requireNonNull(name);
    Objects.requireNonNull(type);
    Objects.requireNonNull(clock);
    Objects.requireNonNull(role);
    Objects.requireNonNull(init);
  }
  public VarDecl(String name, Type type, Clock clock, Role role) { this(name, type, clock, role, Optional.empty()); }

  public boolean isMemory() { return role == Role.MEMORY; }
  public boolean isInput() { return role == Role.INPUT; }
  public boolean isOutput() { return role == Role.OUTPUT; }

  @Override
  public String toString() {
    return name + ": " + type + (clock.isBase() ? "" : " :: " + clock);
  }
}
