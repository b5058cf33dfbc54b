package glushkov.codegen;

import glushkov.graph.Dfa;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.concurrent.atomic.AtomicLong;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;

/**
 * Compilation of DFAs into classes implementing {@link CompiledMatcher}.
 *
 * <p>The generated class has no state: the pattern and state count are
 * constants, and {@code matches} delegates to a static method whose body is
 * the DFA laid out as basic blocks (see {@link DfaMethodCodegen}).
 */
public final class CompiledDfa {

  // Used to give every generated class a distinct name
  private static final AtomicLong CLASS_COUNTER = new AtomicLong();

  private CompiledDfa() { }

  /**
   * Code generator for a compiled DFA matcher.
   *
   * @param pattern pattern from which the DFA was built
   * @param dfa deterministic automaton (explored fully during generation)
   * @param className internal name of the class to generate
   * @param printDebugInfo print debug info and generate code which prints debug info to STDERR
   * @return class writer holding the generated class
   */
  public static <Q> ClassWriter generateMatcherClass(
    String pattern,
    Dfa<Q> dfa,
    String className,
    boolean printDebugInfo
  ) {

    // With `COMPUTE_FRAMES`, the arguments to `visitMaxs` are ignored
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V11,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      className,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.COMPILEDMATCHER_CLASS_NAME }
    );

    // No-argument constructor: all of the matcher's data is in its code
    {
      final var mv = Method.OBJECT_INIT.declare(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.OBJECT_INIT.invoke(mv);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    final var codegen = new DfaMethodCodegen<Q>(
      Method.MATCHES_STATIC.declare(cw, Opcodes.ACC_PRIVATE),
      dfa,
      printDebugInfo
    );
    codegen.mv.visitCode();
    codegen.visitDfa();
    codegen.mv.visitMaxs(0, 0);
    codegen.mv.visitEnd();

    declareConstant(cw, Method.PATTERN, pattern, Opcodes.ARETURN);
    declareConstant(cw, Method.STATE_COUNT, codegen.stateCount(), Opcodes.IRETURN);

    // `matches` forwards its argument to `matchesStatic`
    {
      final var mv = Method.MATCHES.declare(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 1);
      Method.MATCHES_STATIC.invoke(mv, className);
      mv.visitInsn(Opcodes.IRETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();

    if (printDebugInfo) {
      System.err.println("[DFA compilation] " + className + ": " + codegen.stateCount() + " states for " + pattern);
    }
    return cw;
  }

  // Instance method returning a constant from the constant pool
  private static void declareConstant(ClassWriter cw, Method method, Object value, int returnOpcode) {
    final var mv = method.declare(cw, Opcodes.ACC_PUBLIC);
    mv.visitCode();
    mv.visitLdcInsn(value);
    mv.visitInsn(returnOpcode);
    mv.visitMaxs(0, 0);
    mv.visitEnd();
  }

  /**
   * Compile a DFA into a matcher.
   *
   * <p>The matcher is an instance of a fresh hidden class, which is unloaded
   * once the matcher is no longer reachable.
   *
   * @param pattern pattern from which the DFA was built
   * @param dfa deterministic automaton
   * @param printDebugInfo print debug info and generate code which prints debug info to STDERR
   * @return compiled matcher
   */
  public static <Q> CompiledMatcher compile(String pattern, Dfa<Q> dfa, boolean printDebugInfo) {
    final String className = Method.COMPILEDMATCHER_CLASS_NAME + "$Generated" + CLASS_COUNTER.incrementAndGet();
    final byte[] classBytes = generateMatcherClass(pattern, dfa, className, printDebugInfo).toByteArray();

    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
      return (CompiledMatcher) constructor.invoke();
    } catch (Throwable error) {
      throw new IllegalStateException("Failed to construct matcher for " + pattern, error);
    }
  }
}
