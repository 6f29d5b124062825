package syncc.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import syncc.error.CausalityCycleException;
import syncc.error.CompilerException;
import syncc.frontend.Equation;
import syncc.frontend.ExprReader;
import syncc.frontend.Node;
import syncc.frontend.Program;
import syncc.frontend.ProgramReader;
import syncc.frontend.VarDecl;
import syncc.testutil.TestProgramBuilder;

class SchedulerTest {

  static Node readNode(String yaml) throws CompilerException { return ProgramReader.readString(yaml).getNodes().get(0); }

  /** Checks that every same-step read comes after its definition and every memory read before its update. */
  static void assertValidOrder(NodeSchedule schedule) {
    Node node = schedule.getNode();
    List<Equation> order = schedule.getOrder();
    Assertions.assertEquals(node.getEquations(), order);
    for (int i = 0; i < order.size(); ++i) {
      Equation eq = order.get(i);
      for (String read : DependencyGraphBuilder.sameStepReads(node, eq)) {
        var readVar = node.lookupVariable(read);
        if (readVar.isEmpty() || readVar.get().isInput() || eq.lhs().contains(read))
          continue;
        int defPos = schedule.positionOf(read);
        if (readVar.get().isMemory())
          Assertions.assertTrue(defPos > i, () -> String.format("memory %s updated before it is read by %s\n%s", read, eq, node));
        else
          Assertions.assertTrue(defPos >= 0 && defPos < i, () -> String.format("%s read by %s before it is defined\n%s", read, eq, node));
      }
    }
  }

  @Test
  void testCounterReadsBeforeUpdate() throws CompilerException {
    NodeSchedule schedule = Scheduler.schedule(readNode("""
        module: m
        nodes:
          - node: counter
            outputs: [{name: out, type: int}]
            memories: [{name: c, type: int}]
            equations: ["c = 0 fby c + 1", "out = c"]
        """));
    Assertions.assertTrue(schedule.positionOf("out") < schedule.positionOf("c"));
    Assertions.assertEquals(2, schedule.getFanIn("c"));
    Assertions.assertTrue(schedule.getWarnings().isEmpty());
    assertValidOrder(schedule);
  }

  @Test
  void testSameStepCycle() throws CompilerException {
    Node node = readNode("""
        module: m
        nodes:
          - node: f
            inputs:  [{name: x, type: int}]
            outputs: [{name: a, type: int}]
            locals:  [{name: b, type: int}]
            equations: ["b = a", "a = b + x"]
        """);
    CausalityCycleException e = Assertions.assertThrows(CausalityCycleException.class, () -> Scheduler.schedule(node));
    Assertions.assertEquals("f", e.getScope());
    Assertions.assertEquals(List.of("a", "b"), e.getNames());
  }

  @Test
  void testDelayedReads() throws CompilerException {
    // the counter with c as a plain local: reading pre c is no same-step dependency
    Node counter = readNode("""
        module: m
        nodes:
          - node: counter
            outputs: [{name: out, type: int}]
            locals:  [{name: c, type: int}]
            equations: ["out = c", "c = 0 -> pre c + 1"]
        """);
    Assertions.assertFalse(DependencyGraphBuilder.build(counter).hasEdge("c", "c"));
    NodeSchedule schedule = Scheduler.schedule(counter);
    Assertions.assertTrue(schedule.positionOf("c") < schedule.positionOf("out"));
    Assertions.assertEquals(2, schedule.getFanIn("c"));
    assertValidOrder(schedule);

    // a cycle that passes through pre or the second operand of fby is no causality error
    NodeSchedule loop = Scheduler.schedule(readNode("""
        module: m
        nodes:
          - node: f
            inputs:  [{name: x, type: int}]
            outputs: [{name: o, type: int}]
            locals:  [{name: a, type: int}, {name: b, type: int}, {name: o2, type: int}]
            equations: ["o = b", "b = a + x", "a = 0 -> pre b", "o2 = 1 fby o"]
        """));
    Assertions.assertEquals(List.of("a = (0 -> (pre b))", "b = (a + x)", "o = b", "o2 = (1 fby o)"),
                            loop.getOrder().stream().map(Equation::toString).toList());
  }

  @Test
  void testDelayedMemoryDefinition() throws CompilerException {
    NodeSchedule schedule = Scheduler.schedule(readNode("""
        module: m
        nodes:
          - node: counter
            outputs: [{name: out, type: int}]
            memories: [{name: c, type: int}]
            equations: ["c = 0 -> pre c + 1", "out = c"]
        """));
    Assertions.assertTrue(schedule.positionOf("out") < schedule.positionOf("c"));
    Assertions.assertTrue(schedule.getWarnings().isEmpty());
    assertValidOrder(schedule);
  }

  @Test
  void testMemoryCycleIsBroken() throws CompilerException {
    NodeSchedule schedule = Scheduler.schedule(readNode("""
        module: m
        nodes:
          - node: swap
            outputs: [{name: o1, type: int}, {name: o2, type: int}]
            memories: [{name: m1, type: int}, {name: m2, type: int}]
            equations: ["m1 = 0 fby m2", "m2 = 1 fby m1", "o1 = m1", "o2 = m2"]
        """));
    Node node = schedule.getNode();
    VarDecl copy = node.lookupVariable("m1_copy").orElseThrow();
    Assertions.assertEquals(VarDecl.Role.LOCAL, copy.role());
    Assertions.assertTrue(node.getEquations().contains(new Equation("m2", ExprReader.readExpr("1 fby m1_copy"))));
    Assertions.assertTrue(schedule.positionOf("m1_copy") < schedule.positionOf("m1"));
    assertValidOrder(schedule);
  }

  @Test
  void testUnusedVariables() throws CompilerException {
    NodeSchedule schedule = Scheduler.schedule(readNode("""
        module: m
        nodes:
          - node: f
            inputs:  [{name: x, type: int}, {name: y, type: int}]
            outputs: [{name: o, type: int}]
            locals:  [{name: l, type: int}]
            memories: [{name: p, type: int}]
            equations: ["o = x + x", "l = 2", "p = 0 fby x"]
        """));
    Assertions.assertEquals(3, schedule.getFanIn("x"));
    Assertions.assertEquals(0, schedule.getFanIn("y"));
    Assertions.assertEquals(List.of("y", "l", "p"), new ArrayList<>(schedule.getUnused()));
    Assertions.assertEquals(List.of(new UnusedVariableWarning("f", "y", VarDecl.Role.INPUT), new UnusedVariableWarning("f", "p", VarDecl.Role.MEMORY)),
                            schedule.getWarnings());
  }

  @Test
  void testForeignGraph() throws CompilerException {
    Node node = readNode("""
        module: m
        nodes:
          - node: f
            outputs: [{name: o, type: int}]
            equations: ["o = 1"]
        """);
    Node other = node.withEquations(node.getEquations());
    Assertions.assertThrows(IllegalArgumentException.class, () -> Scheduler.schedule(node, DependencyGraphBuilder.build(other)));
  }

  @RepeatedTest(64)
  void testSchedule_random() throws CompilerException {
    long seed = new Random().nextLong();
    try {
      testSchedule(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testSchedule with seed " + seed);
      throw t;
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 42, 68392, -6733423670758169604L, 5893163784830298700L})
  void testSchedule(long seed) throws CompilerException {
    Random rand = new Random(seed);
    Program program = new TestProgramBuilder(rand).build(3);
    for (Node node : program.getNodes()) {
      NodeSchedule schedule = Scheduler.schedule(node);
      assertValidOrder(schedule);

      // same input, same schedule
      Assertions.assertEquals(schedule.getOrder(), Scheduler.schedule(node).getOrder());

      if (schedule.getNode().getLocals().size() == node.getLocals().size()) {
        // without inserted copies, the listing order of the equations does not matter
        ArrayList<Equation> shuffled = new ArrayList<>(node.getEquations());
        Collections.shuffle(shuffled, rand);
        Assertions.assertEquals(schedule.getOrder(), Scheduler.schedule(node.withEquations(shuffled)).getOrder());
      }
    }
  }
}
