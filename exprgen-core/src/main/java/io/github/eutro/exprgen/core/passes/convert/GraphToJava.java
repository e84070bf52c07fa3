package io.github.eutro.exprgen.core.passes.convert;

import io.github.eutro.exprgen.core.conf.FunctionTable;
import io.github.eutro.exprgen.core.ir.BranchTracker;
import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ExpressionType;
import io.github.eutro.exprgen.core.ir.ReturnType;
import io.github.eutro.exprgen.core.passes.IRPass;
import io.github.eutro.exprgen.core.runtime.CompiledFunction;
import io.github.eutro.exprgen.core.runtime.DefiningClassLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodTooLargeException;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.objectweb.asm.Opcodes.*;

/**
 * A pass which compiles a graph into a class implementing {@link CompiledFunction}.
 * <p>
 * Inputs and outputs are read from and written to arrays, at the index of their
 * name in the lists given to the constructor. Every variable becomes a local,
 * booleans being stored as ints, and if/else/end-if become conditional jumps.
 * Function calls become static calls to the methods in the {@link FunctionTable}.
 * <p>
 * The whole graph goes into a single method, so it is bound by the JVM's limits on
 * one method: 65535 local slots (two per scalar variable, one per boolean), and 64KiB of code,
 * roughly a few thousand expressions. Graphs over the first limit are rejected by {@link #run(ExpressionGraph)},
 * and over the second by {@link #toBytes(ClassNode)}, with an {@link IllegalStateException} as the root cause.
 */
public class GraphToJava implements IRPass<ExpressionGraph, ClassNode> {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphToJava.class);

    private static final String EVALUATE_DESC = Type.getMethodDescriptor(
            Type.VOID_TYPE,
            Type.getType(double[].class),
            Type.getType(double[].class)
    );
    private static final int INPUTS_LOCAL = 1;
    private static final int OUTPUTS_LOCAL = 2;
    private static final int FIRST_VAR_LOCAL = 3;
    private static final int MAX_LOCALS = 0xFFFF;

    private final String className;
    private final Map<String, Integer> inputs = new HashMap<>();
    private final Map<String, Integer> outputs = new HashMap<>();
    private final FunctionTable functions;

    /**
     * Construct a compiler.
     *
     * @param className The internal name of the class to generate.
     * @param inputs    The names of the inputs, in the order of the input array.
     * @param outputs   The names of the outputs, in the order of the output array.
     * @param functions The functions that may be called.
     */
    public GraphToJava(String className, List<String> inputs, List<String> outputs, FunctionTable functions) {
        this.className = className;
        for (int i = 0; i < inputs.size(); i++) {
            this.inputs.put(inputs.get(i), i);
        }
        for (int i = 0; i < outputs.size(); i++) {
            this.outputs.put(outputs.get(i), i);
        }
        this.functions = functions;
    }

    public GraphToJava(String className, List<String> inputs, List<String> outputs) {
        this(className, inputs, outputs, FunctionTable.DEFAULT);
    }

    @Override
    public ClassNode run(ExpressionGraph graph) {
        ClassNode cn = new ClassNode();
        cn.visit(
                Opcodes.V1_8,
                ACC_PUBLIC | ACC_SUPER | ACC_FINAL,
                className,
                null,
                Type.getInternalName(Object.class),
                new String[]{Type.getInternalName(CompiledFunction.class)}
        );

        MethodNode init = new MethodNode(ACC_PUBLIC, "<init>", "()V", null, null);
        init.visitCode();
        init.visitVarInsn(ALOAD, 0);
        init.visitMethodInsn(INVOKESPECIAL, Type.getInternalName(Object.class), "<init>", "()V", false);
        init.visitInsn(RETURN);
        init.visitMaxs(0, 0);
        init.visitEnd();
        cn.methods.add(init);

        MethodNode mn = new MethodNode(ACC_PUBLIC, "evaluate", EVALUATE_DESC, null, null);
        try {
            new MethodCompiler(graph, mn).compile();
        } catch (RuntimeException e) {
            throw new RuntimeException("error generating code for class " + className, e);
        }
        cn.methods.add(mn);
        return cn;
    }

    /**
     * Write a generated class to bytes, computing frames.
     *
     * @param cn The class.
     * @return The class file.
     * @throws IllegalStateException If the generated method is too large for the JVM.
     */
    public static byte[] toBytes(ClassNode cn) {
        ClassWriter cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
        cn.accept(cw);
        try {
            return cw.toByteArray();
        } catch (MethodTooLargeException e) {
            throw new IllegalStateException(String.format(
                    "graph is too large to compile into one method\n  class: %s\n  code size: %d bytes",
                    cn.name,
                    e.getCodeSize()), e);
        }
    }

    /**
     * Define a generated class in a new class loader, and instantiate it.
     *
     * @param cn The class, as generated by this pass.
     * @return The instance.
     */
    public static CompiledFunction load(ClassNode cn) {
        byte[] bytes = toBytes(cn);
        LOGGER.debug("defining {} ({} bytes)", cn.name, bytes.length);
        Class<?> clazz = new DefiningClassLoader(CompiledFunction.class.getClassLoader())
                .define(cn.name, bytes);
        try {
            return (CompiledFunction) clazz.getConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("failed to instantiate " + cn.name, e);
        }
    }

    private static class Branch {
        final Label elseLabel = new Label();
        final Label endLabel = new Label();
        boolean hasElse;
    }

    private class MethodCompiler {
        private final ExpressionGraph graph;
        private final MethodNode mn;
        private final Map<ExpressionId, Integer> locals = new HashMap<>();
        private final Map<ExpressionId, ReturnType> types = new HashMap<>();

        MethodCompiler(ExpressionGraph graph, MethodNode mn) {
            this.graph = graph;
            this.mn = mn;
        }

        void compile() {
            mn.visitCode();
            allocateLocals();

            BranchTracker tracker = new BranchTracker();
            Deque<Branch> branches = new ArrayDeque<>();
            for (ExpressionId id : graph.ids()) {
                Expression expr = graph.get(id);
                tracker.visit(id, expr);
                try {
                    compileExpr(expr, branches);
                } catch (RuntimeException e) {
                    throw new RuntimeException("error compiling " + id + ": " + expr, e);
                }
            }
            tracker.finish(graph);

            mn.visitInsn(RETURN);
            mn.visitMaxs(0, 0);
            mn.visitEnd();
        }

        private void allocateLocals() {
            int next = FIRST_VAR_LOCAL;
            for (ExpressionId id : graph.ids()) {
                Expression expr = graph.get(id);
                if (!expr.definesValue()
                        || expr.getType() == ExpressionType.OUTPUT_ASSIGNMENT
                        || !id.equals(expr.getLhsId())) {
                    continue;
                }
                ReturnType type = expr.getReturnType();
                int size = type == ReturnType.BOOLEAN ? 1 : 2;
                if (next + size > MAX_LOCALS) {
                    throw new IllegalStateException(String.format(
                            "graph has too many variables to compile into one method\n  at: %s\n  locals: %d",
                            id,
                            next + size));
                }
                locals.put(id, next);
                types.put(id, type);
                // every path must see the local assigned, even through untaken branches
                if (type == ReturnType.BOOLEAN) {
                    mn.visitInsn(ICONST_0);
                    mn.visitVarInsn(ISTORE, next);
                    next += 1;
                } else {
                    mn.visitInsn(DCONST_0);
                    mn.visitVarInsn(DSTORE, next);
                    next += 2;
                }
            }
        }

        private void compileExpr(Expression expr, Deque<Branch> branches) {
            List<ExpressionId> operands = expr.getOperands();
            switch (expr.getType()) {
                case COMPILE_TIME_CONSTANT:
                    pushDouble(expr.getValue());
                    store(expr.getLhsId());
                    break;
                case INPUT_ASSIGNMENT:
                    mn.visitVarInsn(ALOAD, INPUTS_LOCAL);
                    pushInt(indexOf(inputs, "input", expr.getName()));
                    mn.visitInsn(DALOAD);
                    store(expr.getLhsId());
                    break;
                case OUTPUT_ASSIGNMENT:
                    mn.visitVarInsn(ALOAD, OUTPUTS_LOCAL);
                    pushInt(indexOf(outputs, "output", expr.getName()));
                    load(operands.get(0));
                    mn.visitInsn(DASTORE);
                    break;
                case ASSIGNMENT:
                    load(operands.get(0));
                    store(expr.getLhsId());
                    break;
                case BINARY_ARITHMETIC:
                    load(operands.get(0));
                    load(operands.get(1));
                    mn.visitInsn(arithmeticOpcode(expr.getName()));
                    store(expr.getLhsId());
                    break;
                case UNARY_ARITHMETIC:
                    load(operands.get(0));
                    switch (expr.getName()) {
                        case "-":
                            mn.visitInsn(DNEG);
                            break;
                        case "+":
                            break;
                        default:
                            throw new IllegalArgumentException("unknown unary operator: " + expr.getName());
                    }
                    store(expr.getLhsId());
                    break;
                case BINARY_COMPARISON:
                    compileComparison(expr.getName(), operands.get(0), operands.get(1));
                    store(expr.getLhsId());
                    break;
                case LOGICAL_NEGATION:
                    load(operands.get(0));
                    mn.visitInsn(ICONST_1);
                    mn.visitInsn(IXOR);
                    store(expr.getLhsId());
                    break;
                case FUNCTION_CALL: {
                    FunctionTable.Entry function = functions.get(expr.getName(), operands.size());
                    if (function.getReturnType() != expr.getReturnType()) {
                        throw new IllegalArgumentException(String.format(
                                "function %s returns %s, called for %s",
                                function.getName(),
                                function.getReturnType(),
                                expr.getReturnType()));
                    }
                    for (ExpressionId operand : operands) {
                        load(operand);
                    }
                    mn.visitMethodInsn(
                            INVOKESTATIC,
                            function.getOwnerInternalName(),
                            function.getMethodName(),
                            function.getDescriptor(),
                            false
                    );
                    store(expr.getLhsId());
                    break;
                }
                case IF: {
                    Branch branch = new Branch();
                    load(operands.get(0));
                    mn.visitJumpInsn(IFEQ, branch.elseLabel);
                    branches.push(branch);
                    break;
                }
                case ELSE: {
                    Branch branch = branches.getFirst();
                    mn.visitJumpInsn(GOTO, branch.endLabel);
                    mn.visitLabel(branch.elseLabel);
                    branch.hasElse = true;
                    break;
                }
                case END_IF: {
                    Branch branch = branches.pop();
                    if (!branch.hasElse) {
                        mn.visitLabel(branch.elseLabel);
                    }
                    mn.visitLabel(branch.endLabel);
                    break;
                }
                case COMMENT:
                case NOP:
                    break;
            }
        }

        private void compileComparison(String op, ExpressionId l, ExpressionId r) {
            ReturnType operandType = typeOf(l);
            if (operandType == ReturnType.BOOLEAN) {
                load(l);
                load(r);
                switch (op) {
                    case "&&":
                        mn.visitInsn(IAND);
                        break;
                    case "||":
                        mn.visitInsn(IOR);
                        break;
                    case "!=":
                        mn.visitInsn(IXOR);
                        break;
                    case "==":
                        mn.visitInsn(IXOR);
                        mn.visitInsn(ICONST_1);
                        mn.visitInsn(IXOR);
                        break;
                    default:
                        throw new IllegalArgumentException("unknown boolean comparison: " + op);
                }
                return;
            }

            int cmp;
            int jumpIfFalse;
            // dcmpg/dcmpl are picked so that NaN makes the comparison false
            switch (op) {
                case "<":
                    cmp = DCMPG;
                    jumpIfFalse = IFGE;
                    break;
                case "<=":
                    cmp = DCMPG;
                    jumpIfFalse = IFGT;
                    break;
                case ">":
                    cmp = DCMPL;
                    jumpIfFalse = IFLE;
                    break;
                case ">=":
                    cmp = DCMPL;
                    jumpIfFalse = IFLT;
                    break;
                case "==":
                    cmp = DCMPL;
                    jumpIfFalse = IFNE;
                    break;
                case "!=":
                    cmp = DCMPL;
                    jumpIfFalse = IFEQ;
                    break;
                default:
                    throw new IllegalArgumentException("unknown scalar comparison: " + op);
            }
            load(l);
            load(r);
            mn.visitInsn(cmp);
            Label falseLabel = new Label();
            Label endLabel = new Label();
            mn.visitJumpInsn(jumpIfFalse, falseLabel);
            mn.visitInsn(ICONST_1);
            mn.visitJumpInsn(GOTO, endLabel);
            mn.visitLabel(falseLabel);
            mn.visitInsn(ICONST_0);
            mn.visitLabel(endLabel);
        }

        private int arithmeticOpcode(String op) {
            switch (op) {
                case "+":
                    return DADD;
                case "-":
                    return DSUB;
                case "*":
                    return DMUL;
                case "/":
                    return DDIV;
                default:
                    throw new IllegalArgumentException("unknown arithmetic operator: " + op);
            }
        }

        private int indexOf(Map<String, Integer> names, String kind, String name) {
            Integer index = names.get(name);
            if (index == null) {
                throw new IllegalArgumentException(String.format("unknown %s: %s", kind, name));
            }
            return index;
        }

        private ReturnType typeOf(ExpressionId var) {
            ReturnType type = types.get(var);
            if (type == null) {
                throw new IllegalStateException(var + " is not a variable");
            }
            return type;
        }

        private void load(ExpressionId var) {
            mn.visitVarInsn(typeOf(var) == ReturnType.BOOLEAN ? ILOAD : DLOAD, locals.get(var));
        }

        private void store(ExpressionId var) {
            mn.visitVarInsn(typeOf(var) == ReturnType.BOOLEAN ? ISTORE : DSTORE, locals.get(var));
        }

        private void pushDouble(double value) {
            if (Double.doubleToRawLongBits(value) == 0L) {
                mn.visitInsn(DCONST_0);
            } else if (value == 1.0) {
                mn.visitInsn(DCONST_1);
            } else {
                mn.visitLdcInsn(value);
            }
        }

        private void pushInt(int value) {
            if (value >= -1 && value <= 5) {
                mn.visitInsn(ICONST_0 + value);
            } else if (value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE) {
                mn.visitIntInsn(BIPUSH, value);
            } else if (value >= Short.MIN_VALUE && value <= Short.MAX_VALUE) {
                mn.visitIntInsn(SIPUSH, value);
            } else {
                mn.visitLdcInsn(value);
            }
        }
    }
}
