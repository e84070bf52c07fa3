package io.github.eutro.exprgen.core.conf;

import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ReturnType;

/**
 * Formatting choices for {@link io.github.eutro.exprgen.core.passes.convert.GraphToSource generated source code}.
 */
public final class SourceConventions {
    /**
     * Java source, with variables named {@code v_0}, {@code v_1}, ...,
     * indented by two spaces, calling functions from the {@link FunctionTable#DEFAULT default table}.
     */
    public static final SourceConventions DEFAULT = builder().build();

    private final String variablePrefix;
    private final String scalarType;
    private final String booleanType;
    private final String indent;
    private final FunctionTable functions;

    private SourceConventions(Builder builder) {
        this.variablePrefix = builder.variablePrefix;
        this.scalarType = builder.scalarType;
        this.booleanType = builder.booleanType;
        this.indent = builder.indent;
        this.functions = builder.functions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String variableName(ExpressionId id) {
        return variablePrefix + id.index();
    }

    /**
     * Get the name of the type of variables holding values of the given type.
     *
     * @param returnType The return type of the defining expression.
     * @return The type name.
     */
    public String typeName(ReturnType returnType) {
        switch (returnType) {
            case SCALAR:
                return scalarType;
            case BOOLEAN:
                return booleanType;
            default:
                throw new IllegalArgumentException("no variables of type " + returnType);
        }
    }

    /**
     * Format a constant as a source literal, such that it reads back as exactly the same value.
     *
     * @param value The value.
     * @return The literal.
     */
    public String formatConstant(double value) {
        if (Double.isNaN(value)) return "Double.NaN";
        if (value == Double.POSITIVE_INFINITY) return "Double.POSITIVE_INFINITY";
        if (value == Double.NEGATIVE_INFINITY) return "Double.NEGATIVE_INFINITY";
        return Double.toString(value);
    }

    public String getIndent() {
        return indent;
    }

    public FunctionTable getFunctions() {
        return functions;
    }

    public static final class Builder {
        private String variablePrefix = "v_";
        private String scalarType = "double";
        private String booleanType = "boolean";
        private String indent = "  ";
        private FunctionTable functions = FunctionTable.DEFAULT;

        private Builder() {
        }

        public Builder variablePrefix(String variablePrefix) {
            this.variablePrefix = variablePrefix;
            return this;
        }

        public Builder scalarType(String scalarType) {
            this.scalarType = scalarType;
            return this;
        }

        public Builder booleanType(String booleanType) {
            this.booleanType = booleanType;
            return this;
        }

        public Builder indent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder functions(FunctionTable functions) {
            this.functions = functions;
            return this;
        }

        public SourceConventions build() {
            return new SourceConventions(this);
        }
    }
}
