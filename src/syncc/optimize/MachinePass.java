package syncc.optimize;

import syncc.machine.Machine;

/**
 * A pure machine-to-machine transformation. Passes preserve the input/output behaviour of the machine and are
 * idempotent: applying a pass to its own output returns an equal machine.
 */
public interface MachinePass {
  String getName();

  /** Lowest optimization level that enables the pass. */
  int getMinLevel();

  Machine apply(Machine machine);
}
