package syncc.frontend;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import syncc.error.ProgramFormatException;

class ProgramReaderTest {

  static final String COUNTER = """
      module: counters
      imports: [lib]
      constants:
        - {name: N, type: int, value: 3}
      nodes:
        - node: counter
          inputs:  [{name: x, type: int}, {name: c, type: bool}]
          outputs: [{name: out, type: int}]
          locals:  [{name: s, type: int, clock: base on not c}]
          memories: [{name: m, type: int, init: N}]
          equations:
            - "m = pre (m + x)"
            - "s = x when not c"
            - "out = merge c (true -> m when c) (false -> s)"
          assertions:
            - "x >= 0"
      """;

  @Test
  void testRead() throws ProgramFormatException {
    Program program = ProgramReader.readString(COUNTER);
    Assertions.assertEquals("counters", program.getModuleName());
    Assertions.assertEquals(List.of("lib"), program.getImports());
    Assertions.assertEquals(List.of(new ConstDecl("N", Type.INT, 3L)), program.getConstants());

    Node node = program.findNode("counter").orElseThrow();
    Assertions.assertFalse(node.isStateless());
    Assertions.assertEquals(List.of("x", "c", "out", "s", "m"), Node.names(node.getAllVariables()));
    Assertions.assertEquals(Clock.on(Clock.BASE, "c", false), node.lookupVariable("s").orElseThrow().clock());
    Assertions.assertEquals(Optional.of(new Expr.Var("N")), node.lookupVariable("m").orElseThrow().init());
    Assertions.assertTrue(node.isMemory("m"));
    Assertions.assertEquals(3, node.getEquations().size());
    Assertions.assertEquals(1, node.getAssertions().size());
  }

  @Test
  void testLiteralInit() throws ProgramFormatException {
    Program program = ProgramReader.readString("""
        module: m
        nodes:
          - node: f
            stateless: true
            inputs:  [{name: a, type: real}]
            outputs: [{name: b, type: real}]
            equations: ["b = a * 2.0"]
          - node: g
            outputs: [{name: o, type: bool}]
            memories: [{name: p, type: bool, init: true}]
            equations: ["p = pre (not p)", "o = p"]
        """);
    Assertions.assertTrue(program.findNode("f").orElseThrow().isStateless());
    Assertions.assertEquals(Optional.of(new Expr.Const(true)), program.findNode("g").orElseThrow().lookupVariable("p").orElseThrow().init());
  }

  @Test
  void testMalformedPrograms() {
    // not a mapping
    Assertions.assertThrows(ProgramFormatException.class, () -> ProgramReader.readString("- a\n- b\n"));
    // no module name
    Assertions.assertThrows(ProgramFormatException.class, () -> ProgramReader.readString("nodes: []\n"));
    // unknown type
    Assertions.assertThrows(ProgramFormatException.class, () -> ProgramReader.readString("""
        module: m
        nodes:
          - node: f
            inputs: [{name: a, type: string}]
        """));
    // initial value of a non-memory
    Assertions.assertThrows(ProgramFormatException.class, () -> ProgramReader.readString("""
        module: m
        nodes:
          - node: f
            outputs: [{name: a, type: int, init: 0}]
        """));
    // duplicate variable
    Assertions.assertThrows(ProgramFormatException.class, () -> ProgramReader.readString("""
        module: m
        nodes:
          - node: f
            inputs: [{name: a, type: int}]
            outputs: [{name: a, type: int}]
        """));
    // constant of the wrong type
    Assertions.assertThrows(ProgramFormatException.class, () -> ProgramReader.readString("""
        module: m
        constants: [{name: K, type: bool, value: 3}]
        """));
    // bad clock
    Assertions.assertThrows(ProgramFormatException.class, () -> ProgramReader.readString("""
        module: m
        nodes:
          - node: f
            inputs: [{name: a, type: int, clock: on c}]
        """));
    Assertions.assertThrows(ProgramFormatException.class, () -> ProgramReader.readString("module: [unclosed"));
  }
}
