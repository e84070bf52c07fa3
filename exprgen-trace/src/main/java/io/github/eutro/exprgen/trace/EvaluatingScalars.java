package io.github.eutro.exprgen.trace;

import io.github.eutro.exprgen.core.conf.FunctionTable;
import io.github.eutro.exprgen.core.ir.ReturnType;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Scalars} that compute directly on numbers, taking only one branch of each conditional.
 */
public final class EvaluatingScalars implements Scalars<Double, Boolean> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EvaluatingScalars.class);

    private final Map<String, Double> inputs;
    private final Map<String, Double> outputs = new LinkedHashMap<>();
    private final FunctionTable functions;

    /**
     * Construct evaluating scalars.
     *
     * @param inputs    The values of the inputs, by name.
     * @param functions The functions that may be called.
     */
    public EvaluatingScalars(Map<String, Double> inputs, FunctionTable functions) {
        this.inputs = inputs;
        this.functions = functions;
    }

    public EvaluatingScalars(Map<String, Double> inputs) {
        this(inputs, FunctionTable.DEFAULT);
    }

    /**
     * Get the outputs written so far.
     *
     * @return The outputs, by name, in the order they were first written.
     */
    @Contract(pure = true)
    public Map<String, Double> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    @Override
    public @NotNull ExecutionMode mode() {
        return ExecutionMode.EVALUATE;
    }

    @Override
    public Double constant(double value) {
        return value;
    }

    @Override
    public @NotNull Double input(String name) {
        Double value = inputs.get(name);
        if (value == null) {
            throw new IllegalArgumentException("no value for input: " + name);
        }
        return value;
    }

    @Override
    public void output(String name, Double value) {
        outputs.put(name, value);
    }

    @Override
    public Double add(Double a, Double b) {
        return a + b;
    }

    @Override
    public Double sub(Double a, Double b) {
        return a - b;
    }

    @Override
    public Double mul(Double a, Double b) {
        return a * b;
    }

    @Override
    public Double div(Double a, Double b) {
        return a / b;
    }

    @Override
    public Double negate(Double a) {
        return -a;
    }

    @Override
    public Double call(String function, List<Double> args) {
        return (Double) invoke(function, ReturnType.SCALAR, args);
    }

    @Override
    public Boolean predicate(String function, List<Double> args) {
        return (Boolean) invoke(function, ReturnType.BOOLEAN, args);
    }

    private Object invoke(String function, ReturnType returnType, List<Double> args) {
        FunctionTable.Entry entry = functions.get(function, args.size());
        if (entry.getReturnType() != returnType) {
            throw new IllegalArgumentException(String.format(
                    "function %s returns %s, not %s",
                    function,
                    entry.getReturnType(),
                    returnType));
        }
        try {
            return entry.getHandle().invokeWithArguments(new ArrayList<Object>(args));
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException("error calling " + function, t);
        }
    }

    @Override
    public Boolean lt(Double a, Double b) {
        return a.doubleValue() < b.doubleValue();
    }

    @Override
    public Boolean le(Double a, Double b) {
        return a.doubleValue() <= b.doubleValue();
    }

    @Override
    public Boolean gt(Double a, Double b) {
        return a.doubleValue() > b.doubleValue();
    }

    @Override
    public Boolean ge(Double a, Double b) {
        return a.doubleValue() >= b.doubleValue();
    }

    @Override
    public Boolean eq(Double a, Double b) {
        return a.doubleValue() == b.doubleValue();
    }

    @Override
    public Boolean ne(Double a, Double b) {
        return a.doubleValue() != b.doubleValue();
    }

    @Override
    public Boolean and(Boolean a, Boolean b) {
        return a && b;
    }

    @Override
    public Boolean or(Boolean a, Boolean b) {
        return a || b;
    }

    @Override
    public Boolean not(Boolean a) {
        return !a;
    }

    @Override
    public Local<Double> local(Double initial) {
        return new Local<Double>() {
            private Double value = initial;

            @Override
            public Double get() {
                return value;
            }

            @Override
            public void set(Double value) {
                this.value = value;
            }
        };
    }

    @Override
    public void branch(Boolean condition, Runnable ifTrue, Runnable ifFalse) {
        if (condition) {
            ifTrue.run();
        } else {
            ifFalse.run();
        }
    }

    @Override
    public void branch(Boolean condition, Runnable ifTrue) {
        if (condition) {
            ifTrue.run();
        }
    }

    @Override
    public void comment(String text) {
        LOGGER.trace("// {}", text);
    }
}
