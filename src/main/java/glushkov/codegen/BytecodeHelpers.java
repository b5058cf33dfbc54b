package glushkov.codegen;

import java.io.PrintStream;
import java.util.Arrays;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Base for code generators, with helpers that keep emitted bytecode short.
 *
 * <p>The code array of a method is capped at 64KiB and a DFA with many states
 * turns into a long method body, so constants and branches use the most
 * compact instructions available.
 */
class BytecodeHelpers {

  private static final String SYSTEM_CLASS_NAME = Type.getInternalName(System.class);
  private static final String PRINTSTREAM_DESC = Type.getDescriptor(PrintStream.class);

  /**
   * A {@code tableswitch} is used when at least this fraction of its entries
   * are real (non-default) targets.
   */
  private static final double MIN_TABLE_DENSITY = 0.5;

  /**
   * Method visitor into which code will be emitted.
   */
  protected final MethodVisitor mv;

  BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  private void getSystemErr() {
    mv.visitFieldInsn(Opcodes.GETSTATIC, SYSTEM_CLASS_NAME, "err", PRINTSTREAM_DESC);
  }

  /**
   * Emit code printing a line to "standard" error.
   *
   * @param message constant line to print
   */
  protected void printErrLine(String message) {
    getSystemErr();
    mv.visitLdcInsn(message);
    Method.PRINTLN.invoke(mv);
  }

  /**
   * Emit code printing a constant prefix followed by the string form of an
   * object held in a local (and then a newline) to "standard" error.
   *
   * @param prefix constant printed first
   * @param local index of the local holding an object
   */
  protected void printErrLine(String prefix, int local) {
    getSystemErr();
    mv.visitLdcInsn(prefix);
    Method.PRINT.invoke(mv);
    getSystemErr();
    mv.visitVarInsn(Opcodes.ALOAD, local);
    Method.OBJECT_TOSTRING.invoke(mv);
    Method.PRINTLN.invoke(mv);
  }

  /**
   * Emit a multi-way branch on the {@code int} at the top of the stack
   * (which is consumed).
   *
   * <p>Small cases become comparisons, dense cases become a
   * {@code tableswitch} (with gaps jumping to the fallback) and everything
   * else becomes a {@code lookupswitch}.
   *
   * @param fallback label to jump to if no key matches
   * @param keys keys, sorted in ascending order
   * @param targets label to jump to for each key
   */
  protected void branchOnInt(Label fallback, int[] keys, Label[] targets) {
    switch (keys.length) {
      case 0:
        mv.visitInsn(Opcodes.POP);
        mv.visitJumpInsn(Opcodes.GOTO, fallback);
        return;

      case 1:
        if (keys[0] == 0) {
          mv.visitJumpInsn(Opcodes.IFEQ, targets[0]);
        } else {
          pushInt(keys[0]);
          mv.visitJumpInsn(Opcodes.IF_ICMPEQ, targets[0]);
        }
        mv.visitJumpInsn(Opcodes.GOTO, fallback);
        return;

      default:
        final int min = keys[0];
        final int max = keys[keys.length - 1];
        final long span = (long) max - min + 1;
        if (keys.length >= span * MIN_TABLE_DENSITY) {
          final var table = new Label[(int) span];
          Arrays.fill(table, fallback);
          for (int i = 0; i < keys.length; i++) {
            table[keys[i] - min] = targets[i];
          }
          mv.visitTableSwitchInsn(min, max, fallback, table);
        } else {
          mv.visitLookupSwitchInsn(fallback, keys, targets);
        }
    }
  }

  /**
   * Push an {@code int} constant, avoiding the constant pool when possible.
   *
   * @param value constant to push
   */
  protected void pushInt(int value) {
    if (value >= -1 && value <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + value);
    } else if (value == (byte) value) {
      mv.visitIntInsn(Opcodes.BIPUSH, value);
    } else if (value == (short) value) {
      mv.visitIntInsn(Opcodes.SIPUSH, value);
    } else {
      mv.visitLdcInsn(value);
    }
  }
}
