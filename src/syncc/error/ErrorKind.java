package syncc.error;

/** Tag of every fatal compilation error. */
public enum ErrorKind {
  /** Same-step dependency cycle among equations, or recursive node calls. */
  CAUSALITY_CYCLE,
  /** A call refers to a node without a finalized machine (internal consistency). */
  UNRESOLVED_CALL,
  /** An equation cannot be lowered to machine instructions (internal consistency). */
  UNSUPPORTED_CONSTRUCT,
  /** A compiled header is corrupt or has an unknown format marker. */
  HEADER_FORMAT,
  /** A compiled header's provenance or compiler version is not acceptable as a dependency. */
  HEADER_DEPENDENCY_MISMATCH,
  /** Declared and computed node signatures disagree. */
  INTERFACE_COMPATIBILITY,
  /** A node declared as a function holds state. */
  STATELESS_VIOLATION,
  /** A program or interface file does not follow the interchange format. */
  PROGRAM_FORMAT
}
