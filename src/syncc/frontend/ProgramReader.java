package syncc.frontend;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import syncc.error.ProgramFormatException;

/**
 * Reads a normalized, typed and clocked program in the YAML interchange format written by the front end.
 * <pre>
 * module: counters
 * imports: [lib]
 * constants:
 *   - {name: N, type: int, value: 3}
 * nodes:
 *   - node: counter
 *     inputs:  [{name: x, type: int}]
 *     outputs: [{name: out, type: int}]
 *     memories: [{name: c, type: int, init: 0}]
 *     equations:
 *       - "c = 0 fby c + 1"
 *       - "out = c"
 * </pre>
 */
public class ProgramReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static Program read(Path file) throws ProgramFormatException, IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return read(in, file.toString());
    }
  }

  public static Program read(InputStream in, String sourceName) throws ProgramFormatException {
    Object root;
    try {
      root = new Yaml(new LoaderOptions()).load(in);
    } catch (YAMLException e) {
      throw new ProgramFormatException("Unable to parse program file " + sourceName + ": " + e.getMessage(), e);
    }
    return fromYaml(root, sourceName);
  }

  public static Program readString(String yaml) throws ProgramFormatException {
    Object root;
    try {
      root = new Yaml(new LoaderOptions()).load(yaml);
    } catch (YAMLException e) {
      throw new ProgramFormatException("Unable to parse program: " + e.getMessage(), e);
    }
    return fromYaml(root, "<string>");
  }

  @SuppressWarnings("unchecked")
  private static Program fromYaml(Object root, String sourceName) throws ProgramFormatException {
    if (!(root instanceof Map))
      throw new ProgramFormatException("Program file " + sourceName + " must contain a mapping");
    Map<String, Object> top = (Map<String, Object>)root;
    String module = requireString(top, "module", sourceName);

    List<String> imports = new ArrayList<>();
    for (Object imp : listOf(top, "imports", sourceName))
      imports.add(String.valueOf(imp));

    List<ConstDecl> constants = new ArrayList<>();
    for (Map<String, Object> constDesc : mapsOf(top, "constants", sourceName)) {
      String name = requireString(constDesc, "name", sourceName);
      Type type = readType(constDesc, name, sourceName);
      Object value = literal(constDesc.get("value"), type, "constant " + name);
      constants.add(new ConstDecl(name, type, value));
    }

    List<Node> nodes = new ArrayList<>();
    for (Map<String, Object> nodeDesc : mapsOf(top, "nodes", sourceName)) {
      nodes.add(readNode(nodeDesc, sourceName));
    }
    logger.debug("Read module {} with {} nodes and {} constants from {}", module, nodes.size(), constants.size(), sourceName);
    return new Program(module, imports, constants, nodes);
  }

  private static Node readNode(Map<String, Object> nodeDesc, String sourceName) throws ProgramFormatException {
    String name = requireString(nodeDesc, "node", sourceName);
    boolean stateless = Boolean.TRUE.equals(nodeDesc.get("stateless"));
    List<VarDecl> inputs = readVars(nodeDesc, "inputs", VarDecl.Role.INPUT, name, sourceName);
    List<VarDecl> outputs = readVars(nodeDesc, "outputs", VarDecl.Role.OUTPUT, name, sourceName);
    List<VarDecl> locals = readVars(nodeDesc, "locals", VarDecl.Role.LOCAL, name, sourceName);
    List<VarDecl> memories = readVars(nodeDesc, "memories", VarDecl.Role.MEMORY, name, sourceName);
    List<Equation> equations = new ArrayList<>();
    for (Object eqText : listOf(nodeDesc, "equations", sourceName))
      equations.add(ExprReader.readEquation(String.valueOf(eqText)));
    List<Expr> assertions = new ArrayList<>();
    for (Object assertText : listOf(nodeDesc, "assertions", sourceName))
      assertions.add(ExprReader.readExpr(String.valueOf(assertText)));
    try {
      return new Node(name, stateless, inputs, outputs, locals, memories, equations, assertions);
    } catch (IllegalArgumentException e) {
      throw new ProgramFormatException(e.getMessage() + " (" + sourceName + ")", e);
    }
  }

  private static List<VarDecl> readVars(Map<String, Object> nodeDesc, String key, VarDecl.Role role, String node, String sourceName)
      throws ProgramFormatException {
    List<VarDecl> ret = new ArrayList<>();
    for (Map<String, Object> varDesc : mapsOf(nodeDesc, key, sourceName)) {
      String name = requireString(varDesc, "name", sourceName);
      Type type = readType(varDesc, node + "." + name, sourceName);
      Clock clock;
      try {
        clock = Clock.parse((String)varDesc.get("clock"));
      } catch (IllegalArgumentException | ClassCastException e) {
        throw new ProgramFormatException(String.format("Invalid clock of %s.%s in %s", node, name, sourceName), e);
      }
      Optional<Expr> init = Optional.empty();
      Object initDesc = varDesc.get("init");
      if (initDesc != null) {
        if (role != VarDecl.Role.MEMORY)
          throw new ProgramFormatException(String.format("Only memories can have an initial value (%s.%s in %s)", node, name, sourceName));
        if (initDesc instanceof String)
          init = Optional.of(ExprReader.readExpr((String)initDesc));
        else
          init = Optional.of(new Expr.Const(literal(initDesc, type, node + "." + name)));
      }
      ret.add(new VarDecl(name, type, clock, role, init));
    }
    return ret;
  }

  private static Type readType(Map<String, Object> desc, String what, String sourceName) throws ProgramFormatException {
    String typeName = requireString(desc, "type", sourceName);
    return Type.fromSerialName(typeName)
        .orElseThrow(() -> new ProgramFormatException(String.format("Unknown type '%s' of %s in %s", typeName, what, sourceName)));
  }

  /** Converts a YAML scalar to the literal representation of the given type. */
  static Object literal(Object yamlValue, Type type, String what) throws ProgramFormatException {
    switch (type) {
    case BOOL:
      if (yamlValue instanceof Boolean)
        return yamlValue;
      break;
    case INT:
      if (yamlValue instanceof Integer || yamlValue instanceof Long)
        return ((Number)yamlValue).longValue();
      break;
    case REAL:
      if (yamlValue instanceof Number)
        return ((Number)yamlValue).doubleValue();
      break;
    }
    throw new ProgramFormatException(String.format("Value '%s' of %s does not have type %s", yamlValue, what, type));
  }

  private static String requireString(Map<String, Object> map, String key, String sourceName) throws ProgramFormatException {
    Object val = map.get(key);
    if (val == null)
      throw new ProgramFormatException(String.format("Missing '%s' entry in %s", key, sourceName));
    return String.valueOf(val);
  }

  private static List<?> listOf(Map<String, Object> map, String key, String sourceName) throws ProgramFormatException {
    Object val = map.get(key);
    if (val == null)
      return List.of();
    if (!(val instanceof List))
      throw new ProgramFormatException(String.format("Entry '%s' in %s must be a list", key, sourceName));
    return (List<?>)val;
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> mapsOf(Map<String, Object> map, String key, String sourceName) throws ProgramFormatException {
    List<Map<String, Object>> ret = new ArrayList<>();
    for (Object entry : listOf(map, key, sourceName)) {
      if (!(entry instanceof Map))
        throw new ProgramFormatException(String.format("Entries of '%s' in %s must be mappings", key, sourceName));
      ret.add((Map<String, Object>)entry);
    }
    return ret;
  }
}
