package syncc.optimize;

import static syncc.optimize.CommonSubexpressionEliminationTest.apply;
import static syncc.optimize.CommonSubexpressionEliminationTest.lit;
import static syncc.optimize.CommonSubexpressionEliminationTest.machine;
import static syncc.optimize.CommonSubexpressionEliminationTest.ref;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import syncc.error.CompilerException;
import syncc.frontend.Operator;
import syncc.machine.Instruction;
import syncc.machine.Instruction.Assign;
import syncc.machine.Instruction.Branch;
import syncc.machine.Instruction.StateAssign;
import syncc.machine.Machine;
import syncc.machine.Value;

class InstructionFusionTest {

  @Test
  void testChain() throws CompilerException {
    Machine f = ConstantUnfoldingTest.machineOf("""
        module: m
        nodes:
          - node: f
            inputs:  [{name: x, type: int}, {name: y, type: int}]
            outputs: [{name: o, type: int}]
            locals:  [{name: a, type: int}, {name: b, type: int}]
            equations: ["o = b - 1", "b = a * 2", "a = x + y"]
        """, "f");
    Machine fused = new InstructionFusion().apply(f);
    Value expected = apply(Operator.SUB, apply(Operator.MUL, apply(Operator.ADD, ref("x"), ref("y")), lit(2)), lit(1));
    Assertions.assertEquals(List.of(new Assign("o", expected)), fused.getStep());
    Assertions.assertTrue(fused.getLocals().isEmpty());
  }

  @Test
  void testIntoBranch() {
    Machine f = machine(List.of("x", "c"), List.of("o"), List.of("a"), false,
                        List.of(new Assign("a", apply(Operator.ADD, ref("x"), lit(1))),
                                new Branch(ref("c"), List.of(new Assign("o", ref("a"))), List.of(new Assign("o", lit(0))))));
    Machine fused = new InstructionFusion().apply(f);
    Assertions.assertEquals(List.of(new Branch(ref("c"), List.of(new Assign("o", apply(Operator.ADD, ref("x"), lit(1)))), List.of(new Assign("o", lit(0))))),
                            fused.getStep());
  }

  @Test
  void testJoinedBranches() {
    Machine f = machine(List.of("x", "c"), List.of("o"), List.of("s"), false,
                        List.of(new Branch(ref("c"), List.of(new Assign("s", ref("x"))), List.of()),
                                new Branch(ref("c"), List.of(new Assign("o", ref("s"))), List.of(new Assign("o", lit(0))))));
    Machine fused = new InstructionFusion().apply(f);
    Assertions.assertEquals(List.of(new Branch(ref("c"), List.of(new Assign("o", ref("x"))), List.of(new Assign("o", lit(0))))), fused.getStep());
    Assertions.assertTrue(fused.getLocals().isEmpty());
  }

  @Test
  void testBlocked() {
    // the memory is overwritten between the assignment and its reader
    Machine memory = machine(List.of("x"), List.of("o"), List.of("a"), true,
                             List.of(new Assign("a", apply(Operator.ADD, new Value.StateRef("m"), ref("x"))), new StateAssign("m", ref("x")),
                                     new Assign("o", apply(Operator.MUL, ref("a"), lit(2)))));
    Assertions.assertEquals(memory, new InstructionFusion().apply(memory));

    // an operand is overwritten in the consuming branch before the read
    Machine operand = machine(List.of("x", "c"), List.of("o"), List.of("a", "b"), false,
                              List.of(new Assign("b", ref("x")), new Assign("a", apply(Operator.NEG, ref("b"))),
                                      new Branch(ref("c"), List.of(new Assign("b", lit(1)), new Assign("o", ref("a"))), List.of(new Assign("o", ref("b"))))));
    Machine fusedOperand = new InstructionFusion().apply(operand);
    Assertions.assertTrue(Instruction.flatten(fusedOperand.getStep()).contains(new Assign("o", ref("a"))));

    // two readers
    Machine shared = machine(List.of("x"), List.of("o1", "o2"), List.of("a"), false,
                             List.of(new Assign("a", apply(Operator.ADD, ref("x"), lit(1))), new Assign("o1", ref("a")), new Assign("o2", ref("a"))));
    Assertions.assertEquals(shared, new InstructionFusion().apply(shared));
  }
}
