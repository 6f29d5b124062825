package syncc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import syncc.backend.BackendKind;
import syncc.error.ProgramFormatException;
import syncc.frontend.ConstDecl;
import syncc.frontend.Program;
import syncc.header.CompiledHeader;
import syncc.header.ConstSignature;
import syncc.header.NodeSignature;
import syncc.machine.Machine;
import syncc.machine.MachineTable;
import syncc.schedule.NodeSchedule;
import syncc.schedule.UnusedVariableWarning;
import syncc.ui.SyncCConfig;

/**
 * Tables shared by the phases of one compilation unit. Entries are added once and never replaced, except for
 * machines, which the optimizer replaces by their optimized version.
 */
public class CompilationContext {
  private final SyncCConfig config;
  private final BackendKind backend;

  private final LinkedHashMap<String, CompiledHeader> headers = new LinkedHashMap<>();
  private final LinkedHashMap<String, NodeSignature> importedNodes = new LinkedHashMap<>();
  /** Imported module that declares each imported node and constant */
  private final HashMap<String, String> exporters = new HashMap<>();
  private final LinkedHashMap<String, Object> constants = new LinkedHashMap<>();
  private final LinkedHashMap<String, NodeSchedule> schedules = new LinkedHashMap<>();
  private final MachineTable machines = new MachineTable();
  private final ArrayList<UnusedVariableWarning> warnings = new ArrayList<>();

  public CompilationContext(SyncCConfig config, BackendKind backend) {
    this.config = config;
    this.backend = backend;
  }

  public SyncCConfig getConfig() { return config; }
  public BackendKind getBackend() { return backend; }

  /**
   * Registers the header of an imported module with its nodes and constants.
   * @throws ProgramFormatException if a node or constant of the header is already exported by another imported module
   */
  public void addImport(String module, CompiledHeader header) throws ProgramFormatException {
    if (headers.putIfAbsent(module, header) != null)
      throw new IllegalStateException("Module " + module + " is imported twice");
    for (NodeSignature node : header.getContents().getNodes())
      claimImportedName(node.getName(), module);
    for (ConstSignature decl : header.getContents().getConstants())
      claimImportedName(decl.getName(), module);
    for (NodeSignature node : header.getContents().getNodes())
      importedNodes.put(node.getName(), node);
    for (ConstSignature decl : header.getContents().getConstants()) {
      ConstDecl constDecl = decl.asConstDecl();
      constants.put(constDecl.name(), constDecl.value());
    }
  }

  private void claimImportedName(String name, String module) throws ProgramFormatException {
    String previous = exporters.putIfAbsent(name, module);
    if (previous != null)
      throw new ProgramFormatException(String.format("%s is declared by both imported modules %s and %s", name, previous, module));
  }

  public void addConstants(Program program) {
    for (ConstDecl decl : program.getConstants())
      constants.put(decl.name(), decl.value());
  }

  public Map<String, CompiledHeader> getHeaders() { return Collections.unmodifiableMap(headers); }
  public Map<String, NodeSignature> getImportedNodes() { return Collections.unmodifiableMap(importedNodes); }
  /** Values of the own and imported global constants. */
  public Map<String, Object> getConstants() { return Collections.unmodifiableMap(constants); }

  /** Interface-only machines of the imported nodes, by name. */
  public Map<String, Machine> importedMachines() {
    LinkedHashMap<String, Machine> ret = new LinkedHashMap<>();
    importedNodes.forEach((name, sig) -> ret.put(name, Machine.interfaceOnly(name, sig.isStateless(), sig.inputDecls(), sig.outputDecls())));
    return ret;
  }

  public void addSchedule(NodeSchedule schedule) {
    schedules.put(schedule.getNode().getName(), schedule);
    warnings.addAll(schedule.getWarnings());
  }
  public Map<String, NodeSchedule> getSchedules() { return Collections.unmodifiableMap(schedules); }

  public MachineTable getMachines() { return machines; }
  public List<UnusedVariableWarning> getWarnings() { return Collections.unmodifiableList(warnings); }
}
