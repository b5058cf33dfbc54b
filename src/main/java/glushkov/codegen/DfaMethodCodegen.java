package glushkov.codegen;

import glushkov.graph.Dfa;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Functionality for generating the body of a DFA checking function.
 *
 * <p>This uses the natural mapping of a DFA into the control-flow graph of the
 * bytecode method: states are represented by blocks, with transitions encoded
 * as jumps to other blocks. The dead state has no block: transitions into it
 * jump straight to the failure block.
 *
 * <p>The generated method has signature {@code (CharSequence) -> boolean}.
 *
 * @param <Q> states of the DFA
 */
class DfaMethodCodegen<Q> extends BytecodeHelpers {

  /**
   * DFA for which code is generated.
   */
  private final Dfa<Q> dfa;

  /**
   * If set, the generated method will include code that prints to "standard"
   * error output for: start of the run, states entered, final output.
   */
  private final boolean printDebugInfo;

  /**
   * Offset for argument of type {@code CharSequence}, corresponding to the
   * input string.
   */
  private final int inputLocal = 0;

  /**
   * Offset for a local of type {@code int} tracking the (ascending) offset in
   * the input string.
   */
  private final int offsetLocal = 1;

  /**
   * Offset for a local of type {@code int} holding the length of the input.
   */
  private final int lengthLocal = 2;

  /**
   * States of the DFA, numbered by their position in this list. The initial
   * state is first.
   */
  private final List<Q> states;

  /**
   * Labels associated with DFA states, in the same order as {@link #states}.
   */
  private final List<Label> stateLabels;

  private final Map<Q, Integer> stateIds;

  /**
   * Label for the block which ends in a positive match being returned.
   */
  private final Label returnSuccess = new Label();

  /**
   * Label for the block which ends in a negative match being returned.
   */
  private final Label returnFailure = new Label();

  DfaMethodCodegen(
    MethodVisitor mv,
    Dfa<Q> dfa,
    boolean printDebugInfo
  ) {
    super(mv);
    this.dfa = dfa;
    this.printDebugInfo = printDebugInfo;

    this.states = List.copyOf(dfa.allStates());
    this.stateLabels = new ArrayList<>();
    this.stateIds = new HashMap<>();
    for (Q state : states) {
      stateIds.put(state, stateLabels.size());
      stateLabels.add(new Label());
    }
  }

  int stateCount() {
    return states.size();
  }

  void visitDfa() {

    // Offset starts before the first character (each state block increments it)
    mv.visitInsn(Opcodes.ICONST_M1);
    mv.visitVarInsn(Opcodes.ISTORE, offsetLocal);
    mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
    Method.LENGTH.invoke(mv);
    mv.visitVarInsn(Opcodes.ISTORE, lengthLocal);

    // Track entry into DFA
    if (printDebugInfo) {
      printErrLine("[DFA] starting run on: ", inputLocal);
    }

    // Jump to the first state
    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.get(stateIds.get(dfa.initial())));

    // Lay out the blocks for each state
    for (int id = 0; id < states.size(); id++) {
      final Q state = states.get(id);
      mv.visitLabel(stateLabels.get(id));

      if (printDebugInfo) {
        printErrLine("[DFA] entering " + id);
      }

      // Increment the offset and, if it reaches the length, return whether we are in an accepting state
      mv.visitIincInsn(offsetLocal, 1);
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      mv.visitVarInsn(Opcodes.ILOAD, lengthLocal);
      mv.visitJumpInsn(Opcodes.IF_ICMPGE, dfa.isAccepting(state) ? returnSuccess : returnFailure);

      // Get the next character
      mv.visitVarInsn(Opcodes.ALOAD, inputLocal);
      mv.visitVarInsn(Opcodes.ILOAD, offsetLocal);
      Method.CHAR_AT.invoke(mv);

      visitTransition(state);
    }

    visitReturn(returnSuccess, true);
    visitReturn(returnFailure, false);
  }

  /**
   * Emit the jump out of a state, on the character at the top of the stack.
   *
   * @param state state whose outgoing transitions are emitted
   */
  private void visitTransition(Q state) {
    final List<Integer> symbols = new ArrayList<>();
    final List<Label> targets = new ArrayList<>();

    // Alphabet is sorted, as required for the switch
    for (char symbol : dfa.alphabet()) {
      final Integer target = stateIds.get(dfa.transition(state, symbol));
      if (target != null) {
        symbols.add((int) symbol);
        targets.add(stateLabels.get(target));
      }
    }

    branchOnInt(
      returnFailure,
      symbols.stream().mapToInt(Integer::intValue).toArray(),
      targets.toArray(new Label[0])
    );
  }

  private void visitReturn(Label label, boolean success) {
    mv.visitLabel(label);
    if (printDebugInfo) {
      final var outcome = success ? "successful" : "unsuccessful";
      printErrLine("[DFA] exiting run (" + outcome + ")");
    }
    pushInt(success ? 1 : 0);
    mv.visitInsn(Opcodes.IRETURN);
  }
}
