package com.formcalc.formula;

import com.formcalc.formula.FormulaNode.BinaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-walking interpreter for formula trees. Holds no per-evaluation state, so one
 * instance may serve many threads as long as its function registry is not modified.
 */
public class FormulaEvaluator {

    private final FunctionRegistry registry;

    public FormulaEvaluator(FunctionRegistry registry) {
        this.registry = registry;
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    /**
     * Evaluate the tree against the snapshot. The first failing sub-expression aborts
     * the whole formula and its error is returned.
     */
    public Outcome<FormulaValue> evaluate(FormulaNode ast, FieldSnapshot snapshot) {
        try {
            return Outcome.success(evaluateNode(ast, snapshot));
        } catch (FormulaException e) {
            return Outcome.failure(e.getError());
        }
    }

    private FormulaValue evaluateNode(FormulaNode node, FieldSnapshot snapshot) {
        if (node instanceof FormulaNode.Literal literal) {
            return literal.getValue();
        }
        if (node instanceof FormulaNode.FieldReference ref) {
            return snapshot.get(ref.getName()).orElseThrow(() -> new FormulaException(
                    FormulaError.forFields(ErrorKind.UNDEFINED_FIELD,
                            "Undefined field '" + ref.getName() + "'", List.of(ref.getName()))));
        }
        if (node instanceof FormulaNode.UnaryOp op) {
            return evaluateUnary(op, snapshot);
        }
        if (node instanceof FormulaNode.BinaryOp op) {
            return evaluateBinary(op, snapshot);
        }
        if (node instanceof FormulaNode.FunctionCall call) {
            return evaluateCall(call, snapshot);
        }
        throw new IllegalStateException("Unknown formula node: " + node);
    }

    private FormulaValue evaluateUnary(FormulaNode.UnaryOp op, FieldSnapshot snapshot) {
        FormulaValue operand = evaluateNode(op.getOperand(), snapshot);
        switch (op.getOperator()) {
            case NOT:
                return FormulaValue.of(!operand.isTruthy());
            case MINUS:
                requireNumber(op.getOperator().getSymbol(), operand);
                return Arithmetic.negate(operand);
            case PLUS:
                requireNumber(op.getOperator().getSymbol(), operand);
                return operand;
            default:
                throw new IllegalStateException("Unknown unary operator: " + op.getOperator());
        }
    }

    private FormulaValue evaluateBinary(FormulaNode.BinaryOp op, FieldSnapshot snapshot) {
        BinaryOperator operator = op.getOperator();
        FormulaValue left = evaluateNode(op.getLeft(), snapshot);

        // and/or short-circuit and yield the operand that decided the result
        if (operator == BinaryOperator.OR) {
            return left.isTruthy() ? left : evaluateNode(op.getRight(), snapshot);
        }
        if (operator == BinaryOperator.AND) {
            return left.isTruthy() ? evaluateNode(op.getRight(), snapshot) : left;
        }

        FormulaValue right = evaluateNode(op.getRight(), snapshot);

        switch (operator) {
            case EQUAL:
                return FormulaValue.of(left.sameAs(right));
            case NOT_EQUAL:
                return FormulaValue.of(!left.sameAs(right));
            case LESS_THAN:
                return FormulaValue.of(compare(operator, left, right) < 0);
            case LESS_EQUAL:
                return FormulaValue.of(compare(operator, left, right) <= 0);
            case GREATER_THAN:
                return FormulaValue.of(compare(operator, left, right) > 0);
            case GREATER_EQUAL:
                return FormulaValue.of(compare(operator, left, right) >= 0);
            default:
                break;
        }

        requireNumbers(operator, left, right);
        switch (operator) {
            case ADD:
                return Arithmetic.add(left, right);
            case SUBTRACT:
                return Arithmetic.subtract(left, right);
            case MULTIPLY:
                return Arithmetic.multiply(left, right);
            case DIVIDE:
                return Arithmetic.divide(left, right);
            case MODULO:
                return Arithmetic.modulo(left, right);
            case POWER:
                return Arithmetic.power(left, right);
            default:
                throw new IllegalStateException("Unknown binary operator: " + operator);
        }
    }

    private FormulaValue evaluateCall(FormulaNode.FunctionCall call, FieldSnapshot snapshot) {
        List<FormulaValue> args = new ArrayList<>(call.getArguments().size());
        for (FormulaNode arg : call.getArguments()) {
            args.add(evaluateNode(arg, snapshot));
        }

        FormulaFunction function = registry.get(call.getName());
        if (function == null) {
            throw new FormulaException(ErrorKind.UNKNOWN_FUNCTION, "Unknown function '" + call.getName() + "'");
        }
        return function.apply(List.copyOf(args));
    }

    private static int compare(BinaryOperator operator, FormulaValue left, FormulaValue right) {
        boolean comparable = (left.isNumber() && right.isNumber()) || (left.isText() && right.isText());
        if (!comparable) {
            throw mismatch(operator.getSymbol(), left, right);
        }
        return Arithmetic.compare(left, right);
    }

    private static void requireNumbers(BinaryOperator operator, FormulaValue left, FormulaValue right) {
        if (!left.isNumber() || !right.isNumber()) {
            throw mismatch(operator.getSymbol(), left, right);
        }
    }

    private static void requireNumber(String operator, FormulaValue operand) {
        if (!operand.isNumber()) {
            throw new FormulaException(ErrorKind.TYPE_MISMATCH,
                    "Operator '" + operator + "' requires NUMBER, got " + operand.getType());
        }
    }

    private static FormulaException mismatch(String operator, FormulaValue left, FormulaValue right) {
        return new FormulaException(ErrorKind.TYPE_MISMATCH,
                "Operator '" + operator + "' cannot be applied to " + left.getType() + " and " + right.getType());
    }
}
