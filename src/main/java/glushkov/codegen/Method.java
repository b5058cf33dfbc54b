package glushkov.codegen;

import java.io.PrintStream;
import java.lang.invoke.MethodType;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Methods declared or called by generated matchers.
 *
 * <p>Each constant knows its owner, descriptor and how it is invoked, so that
 * call sites in the code generator are one-liners.
 */
enum Method {
  OBJECT_INIT(Object.class, "<init>", Opcodes.INVOKESPECIAL, MethodType.methodType(void.class)),
  OBJECT_TOSTRING(Object.class, "toString", Opcodes.INVOKEVIRTUAL, MethodType.methodType(String.class)),
  PRINTLN(PrintStream.class, "println", Opcodes.INVOKEVIRTUAL, MethodType.methodType(void.class, String.class)),
  PRINT(PrintStream.class, "print", Opcodes.INVOKEVIRTUAL, MethodType.methodType(void.class, String.class)),
  LENGTH(CharSequence.class, "length", Opcodes.INVOKEINTERFACE, MethodType.methodType(int.class)),
  CHAR_AT(CharSequence.class, "charAt", Opcodes.INVOKEINTERFACE, MethodType.methodType(char.class, int.class)),

  // Implemented by the generated class
  PATTERN(CompiledMatcher.class, "pattern", Opcodes.INVOKEINTERFACE, MethodType.methodType(String.class)),
  STATE_COUNT(CompiledMatcher.class, "stateCount", Opcodes.INVOKEINTERFACE, MethodType.methodType(int.class)),
  MATCHES(
    CompiledMatcher.class,
    "matches",
    Opcodes.INVOKEINTERFACE,
    MethodType.methodType(boolean.class, CharSequence.class)
  ),

  // Private to the generated class, which is the owner at call sites
  MATCHES_STATIC(
    null,
    "matchesStatic",
    Opcodes.INVOKESTATIC,
    MethodType.methodType(boolean.class, CharSequence.class)
  );

  static final String OBJECT_CLASS_NAME = Type.getInternalName(Object.class);
  static final String COMPILEDMATCHER_CLASS_NAME = Type.getInternalName(CompiledMatcher.class);

  /**
   * Internal name of the class declaring the method, or {@code null} for the
   * generated class.
   */
  final String owner;
  final String name;
  final String descriptor;

  /**
   * One of the {@code Opcodes.INVOKE*} codes.
   */
  final int invokeSort;

  Method(Class<?> owner, String name, int invokeSort, MethodType type) {
    this.owner = owner == null ? null : Type.getInternalName(owner);
    this.name = name;
    this.descriptor = type.descriptorString();
    this.invokeSort = invokeSort;
  }

  /**
   * Start declaring this method on a class (static methods get
   * {@code ACC_STATIC} added).
   *
   * @param cv class on which the method is declared
   * @param accessFlags access flags other than {@code ACC_STATIC}
   * @return visitor for the method body
   */
  MethodVisitor declare(ClassVisitor cv, int accessFlags) {
    final int staticFlag = invokeSort == Opcodes.INVOKESTATIC ? Opcodes.ACC_STATIC : 0;
    return cv.visitMethod(accessFlags | staticFlag, name, descriptor, null, null);
  }

  /**
   * Emit a call to this method on its own owner.
   */
  void invoke(MethodVisitor mv) {
    invoke(mv, owner);
  }

  /**
   * Emit a call to this method, declared on a given class.
   *
   * @param mv method inside of which the call is made
   * @param ownerClassName internal name of the declaring class
   */
  void invoke(MethodVisitor mv, String ownerClassName) {
    mv.visitMethodInsn(
      invokeSort,
      ownerClassName,
      name,
      descriptor,
      invokeSort == Opcodes.INVOKEINTERFACE
    );
  }
}
