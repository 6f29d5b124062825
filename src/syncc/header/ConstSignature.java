package syncc.header;

import java.io.Serializable;
import syncc.frontend.ConstDecl;
import syncc.frontend.Type;

/** Exported global constant. The value is kept in its textual form so it survives YAML without type drift. */
public class ConstSignature implements Serializable {
  private static final long serialVersionUID = 1L;

  String name = "";
  String type = "";
  String value = "";

  public ConstSignature() {}

  public static ConstSignature of(ConstDecl decl) {
    ConstSignature ret = new ConstSignature();
    ret.name = decl.name();
    ret.type = decl.type().serialName;
    ret.value = String.valueOf(decl.value());
    return ret;
  }

  public String getName() {
    return name;
  }
  public void setName(String name) {
    this.name = name;
  }
  public String getType() {
    return type;
  }
  public void setType(String type) {
    this.type = type;
  }
  public String getValue() {
    return value;
  }
  public void setValue(String value) {
    this.value = value;
  }

  /**
   * @throws IllegalArgumentException if the type is unknown or the value does not parse as that type
   */
  public ConstDecl asConstDecl() {
    Type typeVal = Type.fromSerialName(type).orElseThrow(() -> new IllegalArgumentException("Unknown type '" + type + "' of constant " + name));
    Object parsed;
    switch (typeVal) {
    case INT:
      parsed = Long.parseLong(value.trim());
      break;
    case REAL:
      parsed = Double.parseDouble(value.trim());
      break;
    default:
      if (!value.trim().equals("true") && !value.trim().equals("false"))
        throw new IllegalArgumentException("Constant " + name + " is not a bool: " + value);
      parsed = Boolean.parseBoolean(value.trim());
      break;
    }
    return new ConstDecl(name, typeVal, parsed);
  }

  @Override
  public String toString() {
    return "const " + name + ": " + type + " = " + value;
  }
}
