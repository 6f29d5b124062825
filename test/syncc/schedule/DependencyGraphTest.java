package syncc.schedule;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import syncc.error.CompilerException;
import syncc.frontend.Node;
import syncc.frontend.ProgramReader;
import syncc.schedule.DependencyGraph.Edge;
import syncc.schedule.DependencyGraph.EdgeKind;

class DependencyGraphTest {

  @Test
  void testBuild() throws CompilerException {
    Node node = ProgramReader.readString("""
        module: m
        constants: [{name: N, type: int, value: 1}]
        nodes:
          - node: f
            inputs:  [{name: x, type: int}, {name: c, type: bool}]
            outputs: [{name: o, type: int}]
            locals:  [{name: a, type: int}, {name: s, type: int, clock: base on c}]
            memories: [{name: m, type: int}]
            equations: ["m = pre (m + a)", "a = x + m", "s = x when c", "o = a + m + N"]
        """).findNode("f").orElseThrow();
    DependencyGraph graph = DependencyGraphBuilder.build(node);
    Assertions.assertEquals(List.of("x", "c", "o", "a", "s", "m"), graph.vertices());
    // a is read by the memory update and reads the memory: the data edge wins
    Assertions.assertEquals(Optional.of(EdgeKind.DATA), graph.edgeKind("a", "m"));
    Assertions.assertEquals(Optional.of(EdgeKind.MEMORY), graph.edgeKind("o", "m"));
    Assertions.assertFalse(graph.hasEdge("m", "m"));
    Assertions.assertTrue(graph.hasEdge("c", "s"));
    Assertions.assertEquals(Set.of(new Edge("x", "a", EdgeKind.DATA), new Edge("x", "s", EdgeKind.DATA), new Edge("c", "s", EdgeKind.DATA),
                                   new Edge("a", "m", EdgeKind.DATA), new Edge("a", "o", EdgeKind.DATA), new Edge("o", "m", EdgeKind.MEMORY)),
                            Set.copyOf(graph.edges()));
    Assertions.assertEquals(Set.of("x"), graph.predecessors("a").keySet());
    Assertions.assertThrows(IllegalArgumentException.class, () -> graph.addEdge("a", "nope", EdgeKind.DATA));
  }

  @Test
  void testComponents() {
    List<List<Integer>> successors = List.of(List.of(1), List.of(2), List.of(1, 3), List.of(), List.of(4));
    Assertions.assertEquals(List.of(List.of(0), List.of(1, 2), List.of(3), List.of(4)), StronglyConnected.components(successors));
    Assertions.assertEquals(List.of(List.of(1, 2), List.of(4)), StronglyConnected.cyclicComponents(successors));
  }
}
