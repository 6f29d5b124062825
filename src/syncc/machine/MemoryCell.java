package syncc.machine;

import syncc.frontend.Type;

/**
 * State variable of a machine.
 * @param init value assigned by the reset procedure, a {@link Value.Literal} or {@link Value.ConstRef}
 */
public record MemoryCell(String name, Type type, Value init) {
  @Override
  public String toString() {
    return name + ": " + type + " = " + init;
  }
}
