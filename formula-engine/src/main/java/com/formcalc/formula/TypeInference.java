package com.formcalc.formula;

import java.util.Map;

/**
 * Best-effort static result type of a formula tree, given the types of the fields it reads.
 */
public class TypeInference {

    private final FunctionRegistry registry;

    public TypeInference(FunctionRegistry registry) {
        this.registry = registry;
    }

    public ResultType infer(FormulaNode node, Map<String, ResultType> fieldTypes) {
        if (node instanceof FormulaNode.Literal literal) {
            return switch (literal.getValue().getType()) {
                case NUMBER -> ResultType.NUMBER;
                case TEXT -> ResultType.TEXT;
                case BOOLEAN -> ResultType.BOOLEAN;
                case NULL -> ResultType.UNKNOWN;
            };
        }
        if (node instanceof FormulaNode.FieldReference ref) {
            return fieldTypes.getOrDefault(ref.getName(), ResultType.UNKNOWN);
        }
        if (node instanceof FormulaNode.UnaryOp op) {
            return op.getOperator() == FormulaNode.UnaryOperator.NOT ? ResultType.BOOLEAN : ResultType.NUMBER;
        }
        if (node instanceof FormulaNode.BinaryOp op) {
            if (op.getOperator().isComparison()) {
                return ResultType.BOOLEAN;
            }
            if (op.getOperator().isLogical()) {
                // and/or yield one of their operands
                ResultType left = infer(op.getLeft(), fieldTypes);
                return left == infer(op.getRight(), fieldTypes) ? left : ResultType.UNKNOWN;
            }
            return ResultType.NUMBER;
        }
        if (node instanceof FormulaNode.FunctionCall call) {
            FormulaFunction function = registry.get(call.getName());
            return function == null ? ResultType.UNKNOWN : function.getResultType();
        }
        return ResultType.UNKNOWN;
    }
}
