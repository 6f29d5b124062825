package syncc.header;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import syncc.frontend.Node;
import syncc.frontend.VarDecl;

/** The caller-visible part of a node. */
public class NodeSignature implements Serializable {
  private static final long serialVersionUID = 1L;

  String name = "";
  boolean stateless = false;
  List<PortSignature> inputs = new ArrayList<>();
  List<PortSignature> outputs = new ArrayList<>();

  public NodeSignature() {}

  public static NodeSignature of(Node node) {
    NodeSignature ret = new NodeSignature();
    ret.name = node.getName();
    ret.stateless = node.isStateless();
    node.getInputs().forEach(var -> ret.inputs.add(PortSignature.of(var)));
    node.getOutputs().forEach(var -> ret.outputs.add(PortSignature.of(var)));
    return ret;
  }

  public String getName() {
    return name;
  }
  public void setName(String name) {
    this.name = name;
  }
  public boolean isStateless() {
    return stateless;
  }
  public void setStateless(boolean stateless) {
    this.stateless = stateless;
  }
  public List<PortSignature> getInputs() {
    return inputs;
  }
  public void setInputs(List<PortSignature> inputs) {
    this.inputs = inputs;
  }
  public List<PortSignature> getOutputs() {
    return outputs;
  }
  public void setOutputs(List<PortSignature> outputs) {
    this.outputs = outputs;
  }

  public List<VarDecl> inputDecls() { return inputs.stream().map(port -> port.asVarDecl(VarDecl.Role.INPUT)).toList(); }
  public List<VarDecl> outputDecls() { return outputs.stream().map(port -> port.asVarDecl(VarDecl.Role.OUTPUT)).toList(); }

  @Override
  public String toString() {
    return (stateless ? "function " : "node ") + name + " (" + String.join("; ", inputs.stream().map(PortSignature::toString).toList()) + ") returns (" +
        String.join("; ", outputs.stream().map(PortSignature::toString).toList()) + ")";
  }
}
