package com.formcalc.formula;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Node of a parsed formula. The variant set is closed: the only subclasses are the
 * nested {@link Literal}, {@link FieldReference}, {@link UnaryOp}, {@link BinaryOp}
 * and {@link FunctionCall}. Nodes are immutable and compare structurally.
 */
public abstract class FormulaNode {

    private final int depth;

    private FormulaNode(int depth) {
        this.depth = depth;
    }

    /**
     * Height of the tree rooted here; a leaf has depth 1.
     */
    public int getDepth() {
        return depth;
    }

    private static int maxDepth(List<FormulaNode> nodes) {
        int max = 0;
        for (FormulaNode node : nodes) {
            max = Math.max(max, node.getDepth());
        }
        return max;
    }

    public enum UnaryOperator {
        PLUS("+"),
        MINUS("-"),
        NOT("not");

        private final String symbol;

        UnaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    public enum BinaryOperator {
        OR("or"),
        AND("and"),
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_EQUAL(">="),
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),
        POWER("**");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN
                    || this == LESS_EQUAL || this == GREATER_THAN || this == GREATER_EQUAL;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    public static Literal literal(FormulaValue value) {
        return new Literal(value);
    }

    public static FieldReference field(String name) {
        return new FieldReference(name);
    }

    public static UnaryOp unary(UnaryOperator operator, FormulaNode operand) {
        return new UnaryOp(operator, operand);
    }

    public static BinaryOp binary(BinaryOperator operator, FormulaNode left, FormulaNode right) {
        return new BinaryOp(operator, left, right);
    }

    public static FunctionCall call(String name, List<FormulaNode> arguments) {
        return new FunctionCall(name, arguments);
    }

    public static final class Literal extends FormulaNode {
        private final FormulaValue value;

        private Literal(FormulaValue value) {
            super(1);
            this.value = Objects.requireNonNull(value, "value");
        }

        public FormulaValue getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Literal(" + value + ")";
        }
    }

    public static final class FieldReference extends FormulaNode {
        private final String name;

        private FieldReference(String name) {
            super(1);
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Field name must not be empty");
            }
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FieldReference other && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "FieldReference(" + name + ")";
        }
    }

    public static final class UnaryOp extends FormulaNode {
        private final UnaryOperator operator;
        private final FormulaNode operand;

        private UnaryOp(UnaryOperator operator, FormulaNode operand) {
            super(1 + Objects.requireNonNull(operand, "operand").getDepth());
            this.operator = Objects.requireNonNull(operator, "operator");
            this.operand = Objects.requireNonNull(operand, "operand");
        }

        public UnaryOperator getOperator() {
            return operator;
        }

        public FormulaNode getOperand() {
            return operand;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UnaryOp other && operator == other.operator && operand.equals(other.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, operand);
        }

        @Override
        public String toString() {
            return "UnaryOp(" + operator.getSymbol() + ", " + operand + ")";
        }
    }

    public static final class BinaryOp extends FormulaNode {
        private final BinaryOperator operator;
        private final FormulaNode left;
        private final FormulaNode right;

        private BinaryOp(BinaryOperator operator, FormulaNode left, FormulaNode right) {
            super(1 + Math.max(Objects.requireNonNull(left, "left").getDepth(),
                    Objects.requireNonNull(right, "right").getDepth()));
            this.operator = Objects.requireNonNull(operator, "operator");
            this.left = Objects.requireNonNull(left, "left");
            this.right = Objects.requireNonNull(right, "right");
        }

        public BinaryOperator getOperator() {
            return operator;
        }

        public FormulaNode getLeft() {
            return left;
        }

        public FormulaNode getRight() {
            return right;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BinaryOp other && operator == other.operator
                    && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(operator, left, right);
        }

        @Override
        public String toString() {
            return "BinaryOp(" + operator.getSymbol() + ", " + left + ", " + right + ")";
        }
    }

    public static final class FunctionCall extends FormulaNode {
        private final String name;
        private final List<FormulaNode> arguments;

        private FunctionCall(String name, List<FormulaNode> arguments) {
            super(1 + maxDepth(arguments));
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Function name must not be empty");
            }
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        public String getName() {
            return name;
        }

        public List<FormulaNode> getArguments() {
            return arguments;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FunctionCall other && name.equals(other.name) && arguments.equals(other.arguments);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, arguments);
        }

        @Override
        public String toString() {
            return "FunctionCall(" + name + ", ["
                    + arguments.stream().map(FormulaNode::toString).collect(Collectors.joining(", ")) + "])";
        }
    }
}
