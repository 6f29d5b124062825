package syncc.backend;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import syncc.frontend.Program;
import syncc.machine.Machine;
import syncc.schedule.NodeSchedule;
import syncc.schedule.UnusedVariableWarning;

/**
 * Everything a backend gets to see of a compiled unit. All parts are immutable.
 * @param program the program with every node's equations in scheduled order
 * @param machines machines of the unit's own nodes, callees first
 * @param importedMachines interface-only machines of the imported nodes the unit calls
 */
public record CompilationResult(String moduleName, Path destination, Program program, Map<String, NodeSchedule> schedules, List<Machine> machines,
                                List<Machine> importedMachines, List<UnusedVariableWarning> warnings) {
  public CompilationResult {
    schedules = Collections.unmodifiableMap(new LinkedHashMap<>(schedules));
    machines = List.copyOf(machines);
    importedMachines = List.copyOf(importedMachines);
    warnings = List.copyOf(warnings);
  }
}
