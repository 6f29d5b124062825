package syncc.header;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.error.HeaderDependencyMismatchException;
import syncc.error.InterfaceCompatibilityException;
import syncc.error.InterfaceCompatibilityException.Field;
import syncc.error.InterfaceCompatibilityException.Mismatch;
import syncc.frontend.Clock;
import syncc.frontend.Equation;
import syncc.frontend.Expr;
import syncc.frontend.Node;
import syncc.frontend.Program;
import syncc.frontend.VarDecl;

/**
 * Consistency checks between compiled headers, declared interfaces and the interface computed from a source module.
 */
public class HeaderChecker {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Checks that a compiled header can be used as a dependency.
   * @param requireInterface whether only headers compiled from interface files are accepted
   */
  public static void checkDependency(CompiledHeader header, String module, String compilerVersion, boolean requireInterface)
      throws HeaderDependencyMismatchException {
    if (!compilerVersion.equals(header.getCompilerVersion()))
      throw new HeaderDependencyMismatchException(module, String.format("compiled by version %s, this is version %s", header.getCompilerVersion(),
                                                                        compilerVersion));
    if (requireInterface && !header.isFromInterface())
      throw new HeaderDependencyMismatchException(module, "header was extracted from source, an interface-derived header is required");
  }

  /**
   * Compares a declared interface with the computed one. Every node of the declared interface must exist in the
   * computed one with the same arity, stateless flag, port types and port clocks. Clocks are compared after mapping
   * the declared port names to the computed ones by position.
   * @throws InterfaceCompatibilityException listing all mismatches
   */
  public static void checkCompatibility(ModuleInterface declared, ModuleInterface computed) throws InterfaceCompatibilityException {
    ArrayList<Mismatch> mismatches = new ArrayList<>();
    for (NodeSignature decl : declared.getNodes()) {
      Optional<NodeSignature> comp = computed.findNode(decl.getName());
      if (comp.isEmpty()) {
        mismatches.add(new Mismatch(decl.getName(), "", Field.MISSING, "node", "none"));
        continue;
      }
      compareNode(decl, comp.get(), mismatches);
    }
    for (ConstSignature decl : declared.getConstants()) {
      Optional<ConstSignature> comp = computed.findConstant(decl.getName());
      if (comp.isEmpty())
        mismatches.add(new Mismatch(decl.getName(), "", Field.MISSING, "constant", "none"));
      else if (!decl.getType().equals(comp.get().getType()))
        mismatches.add(new Mismatch(decl.getName(), "", Field.TYPE, decl.getType(), comp.get().getType()));
    }
    if (!mismatches.isEmpty()) {
      mismatches.forEach(mismatch -> logger.error("Interface {}: {}", declared.getModule(), mismatch));
      throw new InterfaceCompatibilityException(mismatches);
    }
  }

  private static void compareNode(NodeSignature decl, NodeSignature comp, List<Mismatch> mismatches) {
    String node = decl.getName();
    if (decl.isStateless() != comp.isStateless())
      mismatches.add(new Mismatch(node, "", Field.STATELESS, String.valueOf(decl.isStateless()), String.valueOf(comp.isStateless())));
    if (decl.getInputs().size() != comp.getInputs().size() || decl.getOutputs().size() != comp.getOutputs().size()) {
      mismatches.add(new Mismatch(node, "", Field.ARITY, arity(decl), arity(comp)));
      return;
    }
    HashMap<String, String> portMap = new HashMap<>();
    for (int i = 0; i < decl.getInputs().size(); ++i)
      portMap.put(decl.getInputs().get(i).getName(), comp.getInputs().get(i).getName());
    for (int i = 0; i < decl.getOutputs().size(); ++i)
      portMap.put(decl.getOutputs().get(i).getName(), comp.getOutputs().get(i).getName());
    ArrayList<PortSignature> declPorts = new ArrayList<>(decl.getInputs());
    declPorts.addAll(decl.getOutputs());
    ArrayList<PortSignature> compPorts = new ArrayList<>(comp.getInputs());
    compPorts.addAll(comp.getOutputs());
    for (int i = 0; i < declPorts.size(); ++i) {
      PortSignature declPort = declPorts.get(i);
      PortSignature compPort = compPorts.get(i);
      if (!declPort.getType().equals(compPort.getType()))
        mismatches.add(new Mismatch(node, compPort.getName(), Field.TYPE, declPort.getType(), compPort.getType()));
      Clock declClock = Clock.parse(declPort.getClock()).rename(name -> portMap.getOrDefault(name, name));
      Clock compClock = Clock.parse(compPort.getClock());
      if (!declClock.equals(compClock))
        mismatches.add(new Mismatch(node, compPort.getName(), Field.CLOCK, declClock.toString(), compClock.toString()));
    }
  }

  private static String arity(NodeSignature sig) { return sig.getInputs().size() + " -> " + sig.getOutputs().size(); }

  /**
   * Checks the calls to imported nodes: argument and result counts must match the imported signature, and the
   * result variables must have the signature's output types.
   * @param imported signatures of the imported nodes, by node name
   */
  public static void checkCallSites(Program program, Map<String, NodeSignature> imported) throws InterfaceCompatibilityException {
    ArrayList<Mismatch> mismatches = new ArrayList<>();
    for (Node node : program.getNodes()) {
      for (Equation eq : node.getEquations()) {
        if (!(eq.rhs() instanceof Expr.Call))
          continue;
        Expr.Call call = (Expr.Call)eq.rhs();
        NodeSignature sig = imported.get(call.node());
        if (sig == null)
          continue;
        if (call.args().size() != sig.getInputs().size() || eq.lhs().size() != sig.getOutputs().size()) {
          mismatches.add(new Mismatch(call.node(), "", Field.ARITY, arity(sig), call.args().size() + " -> " + eq.lhs().size()));
          continue;
        }
        for (int i = 0; i < eq.lhs().size(); ++i) {
          PortSignature port = sig.getOutputs().get(i);
          Optional<VarDecl> result = node.lookupVariable(eq.lhs().get(i));
          if (result.isPresent() && !result.get().type().serialName.equals(port.getType()))
            mismatches.add(new Mismatch(call.node(), port.getName(), Field.TYPE, port.getType(), result.get().type().serialName));
        }
      }
    }
    if (!mismatches.isEmpty()) {
      mismatches.forEach(mismatch -> logger.error("Call to imported {}", mismatch));
      throw new InterfaceCompatibilityException(mismatches);
    }
  }
}
