package syncc.backend;

import java.util.Optional;
import java.util.stream.Stream;

/** The code generators the core can hand its result to, by their command line name. */
public enum BackendKind {
  /** Sequential imperative code; the only backend that maintains compiled headers. */
  IMPERATIVE("C"),
  /** Verification conditions; machines are passed on unoptimized. */
  VERIFICATION("horn"),
  /** Dataflow source text. */
  DATAFLOW_ROUNDTRIP("lustre");

  public final String serialName;
  private BackendKind(String serialName) { this.serialName = serialName; }

  public static Optional<BackendKind> fromSerialName(String serialName) {
    return Stream.of(BackendKind.values()).filter(kind -> kind.serialName.equals(serialName)).findAny();
  }

  public boolean usesHeaders() { return this == IMPERATIVE; }
  public boolean allowsOptimization() { return this != VERIFICATION; }

  @Override
  public String toString() {
    return serialName;
  }
}
