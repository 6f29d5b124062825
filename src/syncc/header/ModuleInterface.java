package syncc.header;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import syncc.frontend.Program;

/**
 * Exported interface of a module: node signatures with concrete types and clocks, and global constants.
 * Read from {@code .dfi} interface files and stored in compiled headers.
 */
public class ModuleInterface implements Serializable {
  private static final long serialVersionUID = 1L;

  String module = "";
  List<NodeSignature> nodes = new ArrayList<>();
  List<ConstSignature> constants = new ArrayList<>();

  public ModuleInterface() {}

  /** Computes the interface of a source module from its declarations. */
  public static ModuleInterface extract(Program program) {
    ModuleInterface ret = new ModuleInterface();
    ret.module = program.getModuleName();
    program.getConstants().forEach(decl -> ret.constants.add(ConstSignature.of(decl)));
    program.getNodes().forEach(node -> ret.nodes.add(NodeSignature.of(node)));
    return ret;
  }

  public String getModule() {
    return module;
  }
  public void setModule(String module) {
    this.module = module;
  }
  public List<NodeSignature> getNodes() {
    return nodes;
  }
  public void setNodes(List<NodeSignature> nodes) {
    this.nodes = nodes;
  }
  public List<ConstSignature> getConstants() {
    return constants;
  }
  public void setConstants(List<ConstSignature> constants) {
    this.constants = constants;
  }

  public Optional<NodeSignature> findNode(String name) { return nodes.stream().filter(node -> node.getName().equals(name)).findFirst(); }
  public Optional<ConstSignature> findConstant(String name) {
    return constants.stream().filter(decl -> decl.getName().equals(name)).findFirst();
  }

  /** Deterministic textual form; the content marker of compiled headers is computed over it. */
  public String canonicalText() {
    StringBuilder sb = new StringBuilder("module ").append(module).append('\n');
    for (ConstSignature decl : constants)
      sb.append(decl).append('\n');
    for (NodeSignature node : nodes)
      sb.append(node).append('\n');
    return sb.toString();
  }

  @Override
  public String toString() {
    return canonicalText();
  }
}
