package syncc.header;

import java.io.Serializable;
import syncc.frontend.Clock;
import syncc.frontend.Type;
import syncc.frontend.VarDecl;

/** Interface variable of an exported node. */
public class PortSignature implements Serializable {
  private static final long serialVersionUID = 1L;

  String name = "";
  /** Type serial name ({@link Type#serialName}) */
  String type = "";
  /** Clock in textual form, see {@link Clock#parse(String)} */
  String clock = "base";

  public PortSignature() {}
  public PortSignature(String name, String type, String clock) {
    this.name = name;
    this.type = type;
    this.clock = clock;
  }

  public static PortSignature of(VarDecl var) { return new PortSignature(var.name(), var.type().serialName, var.clock().toString()); }

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
  public String getClock() {
    return clock;
  }
  public void setClock(String clock) {
    this.clock = clock;
  }

  /**
   * Converts the port back to a variable declaration.
   * @throws IllegalArgumentException if the type or clock cannot be parsed
   */
  public VarDecl asVarDecl(VarDecl.Role role) {
    Type typeVal = Type.fromSerialName(type).orElseThrow(() -> new IllegalArgumentException("Unknown type '" + type + "' of " + name));
    return new VarDecl(name, typeVal, Clock.parse(clock), role);
  }

  @Override
  public String toString() {
    return name + ": " + type + ("base".equals(clock) ? "" : " :: " + clock);
  }
}
