package syncc.frontend;

import java.util.List;
import java.util.Optional;

/**
 * A compilation unit: imported modules, global constants and nodes, in declaration order.
 */
public class Program {
  private final String moduleName;
  private final List<String> imports;
  private final List<ConstDecl> constants;
  private final List<Node> nodes;

  public Program(String moduleName, List<String> imports, List<ConstDecl> constants, List<Node> nodes) {
    this.moduleName = moduleName;
    this.imports = List.copyOf(imports);
    this.constants = List.copyOf(constants);
    this.nodes = List.copyOf(nodes);
  }

  public String getModuleName() { return moduleName; }
  public List<String> getImports() { return imports; }
  public List<ConstDecl> getConstants() { return constants; }
  public List<Node> getNodes() { return nodes; }

  public Optional<Node> findNode(String name) { return nodes.stream().filter(node -> node.getName().equals(name)).findFirst(); }

  /** Returns a copy with the nodes replaced (e.g. reordered or rewritten by scheduling). */
  public Program withNodes(List<Node> newNodes) { return new Program(moduleName, imports, constants, newNodes); }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("module ").append(moduleName).append('\n');
    for (String imp : imports)
      sb.append("#open ").append(imp).append('\n');
    for (ConstDecl c : constants)
      sb.append("const ").append(c.name()).append(": ").append(c.type()).append(" = ").append(c.value()).append('\n');
    for (Node node : nodes)
      sb.append(node);
    return sb.toString();
  }
}
