package syncc.optimize;

import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import syncc.machine.Machine;
import syncc.machine.MachineTable;

/**
 * Runs the machine passes enabled by the optimization level, in a fixed order: constant unfolding, common
 * subexpression elimination, instruction fusion, slot reuse.
 */
public class MachineOptimizer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final int level;
  private final List<MachinePass> passes;

  /**
   * @param level optimization level; 0 and 1 disable all passes
   * @param constants values of the global constants visible to the unit
   */
  public MachineOptimizer(int level, Map<String, Object> constants) {
    this.level = level;
    this.passes = List.of(new ConstantUnfolding(constants), new CommonSubexpressionElimination(), new InstructionFusion(), new VariableReuse());
  }

  public int getLevel() { return level; }

  public List<MachinePass> getEnabledPasses() { return passes.stream().filter(pass -> level >= pass.getMinLevel()).toList(); }

  public Machine optimize(Machine machine) {
    Machine cur = machine;
    for (MachinePass pass : getEnabledPasses()) {
      cur = pass.apply(cur);
      logger.trace("After {}:\n{}", pass.getName(), cur);
    }
    return cur;
  }

  /** Replaces every machine of the table (except imported interfaces) by its optimized version. */
  public void optimizeAll(MachineTable table) {
    for (int i = 0; i < table.size(); ++i) {
      if (!table.get(i).isInterfaceOnly())
        table.replace(i, optimize(table.get(i)));
    }
  }
}
