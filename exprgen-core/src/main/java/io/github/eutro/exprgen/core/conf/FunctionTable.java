package io.github.eutro.exprgen.core.conf;

import io.github.eutro.exprgen.core.ir.ReturnType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The functions that {@link io.github.eutro.exprgen.core.ir.ExpressionType#FUNCTION_CALL function calls}
 * may name, and the static Java methods that implement them.
 * <p>
 * Every function takes only scalar ({@code double}) arguments, and returns either
 * a {@code double} or a {@code boolean}.
 */
public final class FunctionTable {
    /**
     * The default functions, mostly from {@link Math}, with some C names as aliases.
     */
    public static final FunctionTable DEFAULT = builder()
            .registerAll(Math.class, 1, ReturnType.SCALAR,
                    "sin", "cos", "tan", "asin", "acos", "atan",
                    "sinh", "cosh", "tanh", "exp", "log", "log10",
                    "sqrt", "cbrt", "abs", "floor", "ceil")
            .registerAll(Math.class, 2, ReturnType.SCALAR, "atan2", "pow", "hypot")
            .register("fabs", Math.class, "abs", 1, ReturnType.SCALAR)
            .register("fmin", Math.class, "min", 2, ReturnType.SCALAR)
            .register("fmax", Math.class, "max", 2, ReturnType.SCALAR)
            .register("isfinite", Double.class, "isFinite", 1, ReturnType.BOOLEAN)
            .register("isinf", Double.class, "isInfinite", 1, ReturnType.BOOLEAN)
            .register("isnan", Double.class, "isNaN", 1, ReturnType.BOOLEAN)
            .build();

    private final Map<String, Entry> entries;

    private FunctionTable(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Look up a function by the name used in the IR.
     *
     * @param name The name.
     * @return The function, or null if there is none with that name.
     */
    public @Nullable Entry lookup(String name) {
        return entries.get(name);
    }

    /**
     * Look up a function by the name used in the IR, with the given number of arguments.
     *
     * @param name  The name.
     * @param arity The number of arguments it is called with.
     * @return The function.
     * @throws IllegalArgumentException If there is no such function.
     */
    public @NotNull Entry get(String name, int arity) {
        Entry entry = lookup(name);
        if (entry == null) {
            throw new IllegalArgumentException("unknown function: " + name);
        }
        if (entry.arity != arity) {
            throw new IllegalArgumentException(String.format(
                    "function %s takes %d arguments, called with %d",
                    name,
                    entry.arity,
                    arity));
        }
        return entry;
    }

    /**
     * A function, implemented by a public static method.
     */
    public static final class Entry {
        private final String name;
        private final Class<?> owner;
        private final String methodName;
        private final int arity;
        private final ReturnType returnType;
        private final MethodHandle handle;

        private Entry(String name, Class<?> owner, String methodName, int arity, ReturnType returnType) {
            if (returnType == ReturnType.NONE) {
                throw new IllegalArgumentException("function " + name + " must return a value");
            }
            this.name = name;
            this.owner = owner;
            this.methodName = methodName;
            this.arity = arity;
            this.returnType = returnType;
            try {
                handle = MethodHandles.publicLookup().findStatic(owner, methodName, methodType());
            } catch (NoSuchMethodException | IllegalAccessException e) {
                throw new IllegalArgumentException("no method for function " + name, e);
            }
        }

        private MethodType methodType() {
            Class<?>[] params = new Class<?>[arity];
            Arrays.fill(params, double.class);
            return MethodType.methodType(returnType == ReturnType.BOOLEAN ? boolean.class : double.class, params);
        }

        public String getName() {
            return name;
        }

        public int getArity() {
            return arity;
        }

        public ReturnType getReturnType() {
            return returnType;
        }

        /**
         * Get the internal name of the class that declares the implementing method.
         *
         * @return The internal name.
         */
        public String getOwnerInternalName() {
            return Type.getInternalName(owner);
        }

        public String getMethodName() {
            return methodName;
        }

        /**
         * Get the JVM descriptor of the implementing method.
         *
         * @return The descriptor.
         */
        public String getDescriptor() {
            return methodType().toMethodDescriptorString();
        }

        /**
         * Get how the function is called in Java source code.
         *
         * @return The qualified method name, like {@code Math.sin}.
         */
        public String getSourceName() {
            return owner.getSimpleName() + "." + methodName;
        }

        /**
         * Get a handle to the implementing method.
         *
         * @return The method handle.
         */
        public MethodHandle getHandle() {
            return handle;
        }

        @Override
        public String toString() {
            return name + "/" + arity + " -> " + getSourceName();
        }
    }

    public static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Register a function.
         *
         * @param name       The name used in the IR.
         * @param owner      The class declaring the implementing method.
         * @param methodName The name of the implementing method.
         * @param arity      The number of scalar arguments.
         * @param returnType The return type.
         * @return This builder.
         * @throws IllegalArgumentException If there is no such public static method.
         */
        public Builder register(String name, Class<?> owner, String methodName, int arity, ReturnType returnType) {
            entries.put(name, new Entry(name, owner, methodName, arity, returnType));
            return this;
        }

        /**
         * Register several functions, each implemented by a method of the same name.
         *
         * @param owner      The class declaring the implementing methods.
         * @param arity      The number of scalar arguments.
         * @param returnType The return type.
         * @param names      The names.
         * @return This builder.
         */
        public Builder registerAll(Class<?> owner, int arity, ReturnType returnType, String... names) {
            for (String name : names) {
                register(name, owner, name, arity, returnType);
            }
            return this;
        }

        public FunctionTable build() {
            return new FunctionTable(entries);
        }
    }
}
