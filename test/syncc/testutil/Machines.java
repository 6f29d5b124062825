package syncc.testutil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import syncc.error.CompilerException;
import syncc.frontend.Node;
import syncc.frontend.Program;
import syncc.machine.Machine;
import syncc.machine.MachineTable;
import syncc.machine.MachineTranslator;
import syncc.schedule.NodeSchedule;
import syncc.schedule.NodeSorter;
import syncc.schedule.Scheduler;

/** Scheduling and translation of whole programs, without the checks and header handling of the driver. */
public class Machines {

  public static MachineTable translate(Program program) throws CompilerException { return translate(program, Map.of()); }

  public static MachineTable translate(Program program, Map<String, Machine> imported) throws CompilerException {
    LinkedHashMap<String, NodeSchedule> schedules = new LinkedHashMap<>();
    for (Node node : NodeSorter.sort(program).getNodes())
      schedules.put(node.getName(), Scheduler.schedule(node));
    MachineTable table = new MachineTable();
    new MachineTranslator(schedules, imported, table).translateAll(new ArrayList<>(schedules.keySet()));
    return table;
  }
}
