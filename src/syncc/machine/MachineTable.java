package syncc.machine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Arena of the machines of a compilation unit. Machines refer to their sub-instances by arena index; the memo maps
 * node names to indices, so every node is translated exactly once.
 */
public class MachineTable {
  private final ArrayList<Machine> machines = new ArrayList<>();
  private final HashMap<String, Integer> memo = new HashMap<>();

  /** Adds a machine; returns its index. A node name may only be added once. */
  public int add(Machine machine) {
    if (memo.containsKey(machine.getName()))
      throw new IllegalStateException("Machine " + machine.getName() + " is already in the table");
    machines.add(machine);
    memo.put(machine.getName(), machines.size() - 1);
    return machines.size() - 1;
  }

  /** Replaces the machine at an index by a transformed version of the same node. */
  public void replace(int index, Machine machine) {
    if (!machines.get(index).getName().equals(machine.getName()))
      throw new IllegalArgumentException("Cannot replace machine " + machines.get(index).getName() + " by " + machine.getName());
    machines.set(index, machine);
  }

  public Machine get(int index) { return machines.get(index); }
  public Optional<Integer> indexOf(String nodeName) { return Optional.ofNullable(memo.get(nodeName)); }
  public Optional<Machine> lookup(String nodeName) { return indexOf(nodeName).map(machines::get); }
  public int size() { return machines.size(); }

  /** All machines, callees before callers. */
  public List<Machine> all() { return Collections.unmodifiableList(machines); }

  /** The machine of an instance of {@code owner}. */
  public Machine instanceMachine(Machine owner, String instance) {
    Machine.Instance inst = owner.getInstances().get(instance);
    if (inst == null)
      throw new IllegalArgumentException("Machine " + owner.getName() + " has no instance " + instance);
    return machines.get(inst.machineIndex());
  }
}
