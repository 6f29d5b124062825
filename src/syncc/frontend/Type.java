package syncc.frontend;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Concrete stream value types, as computed by the external type inference.
 */
public enum Type {
  INT("int", Long.valueOf(0)),
  REAL("real", Double.valueOf(0.0)),
  BOOL("bool", Boolean.FALSE);

  public final String serialName;
  private final Object defaultValue;

  private Type(String serialName, Object defaultValue) {
    this.serialName = serialName;
    this.defaultValue = defaultValue;
  }

  /** The value a memory of this type is reset to when no initial value is declared. */
  public Object getDefaultValue() { return defaultValue; }

  public static Optional<Type> fromSerialName(String serialName) {
    return Stream.of(Type.values()).filter(typeVal -> typeVal.serialName.equals(serialName)).findAny();
  }

  /** Returns the type of a literal value (Long, Double or Boolean). */
  public static Type ofLiteral(Object value) {
    if (value instanceof Boolean)
      return BOOL;
    if (value instanceof Double)
      return REAL;
    if (value instanceof Long)
      return INT;
    throw new IllegalArgumentException("Not a literal value: " + value);
  }

  @Override
  public String toString() {
    return serialName;
  }
}
