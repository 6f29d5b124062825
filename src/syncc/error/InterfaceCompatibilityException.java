package syncc.error;

import java.util.List;
import java.util.stream.Collectors;

public class InterfaceCompatibilityException extends CompilerException {
  private static final long serialVersionUID = 1L;

  /** The part of a node signature that disagrees. */
  public enum Field {
    TYPE("type"),
    CLOCK("clock"),
    ARITY("arity"),
    STATELESS("stateless"),
    MISSING("missing");

    public final String serialName;
    private Field(String serialName) { this.serialName = serialName; }
    @Override
    public String toString() {
      return serialName;
    }
  }

  /**
   * A single disagreement.
   * @param node the exported node
   * @param port the interface variable, or empty for node-level fields
   */
  public static record Mismatch(String node, String port, Field field, String declared, String computed) {
    @Override
    public String toString() {
      return String.format("node %s%s: %s mismatch, declared %s but computed %s", node, port.isEmpty() ? "" : ", variable " + port,
                           field, declared, computed);
    }
  }

  private final List<Mismatch> mismatches;

  public InterfaceCompatibilityException(List<Mismatch> mismatches) {
    super(ErrorKind.INTERFACE_COMPATIBILITY, "Interface mismatch: " + mismatches.stream().map(Mismatch::toString).collect(Collectors.joining("; ")));
    if (mismatches.isEmpty())
      throw new IllegalArgumentException("no mismatch");
    this.mismatches = List.copyOf(mismatches);
  }

  public List<Mismatch> getMismatches() { return mismatches; }
  /** The first offending node. */
  public String getNode() { return mismatches.get(0).node(); }
  /** The first offending field. */
  public Field getField() { return mismatches.get(0).field(); }
}
