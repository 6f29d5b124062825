package syncc.frontend;

/** Global constant {@code const name : type = value}. */
public record ConstDecl(String name, Type type, Object value) {
  public ConstDecl {
    if (Type.ofLiteral(value) != type)
      throw new IllegalArgumentException("Constant " + name + " has a " + Type.ofLiteral(value) + " value but is declared " + type);
  }
}
