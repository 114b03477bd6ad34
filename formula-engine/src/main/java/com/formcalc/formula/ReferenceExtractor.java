package com.formcalc.formula;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only walks over a formula tree.
 */
public final class ReferenceExtractor {

    private ReferenceExtractor() {
    }

    /**
     * Names of every field the formula reads, duplicates collapsed.
     */
    public static Set<String> extract(FormulaNode node) {
        Set<String> names = new TreeSet<>();
        collectFields(node, names);
        return Collections.unmodifiableSet(names);
    }

    /**
     * Names of every function the formula calls, as written.
     */
    public static Set<String> functionNames(FormulaNode node) {
        Set<String> names = new TreeSet<>();
        collectFunctions(node, names);
        return Collections.unmodifiableSet(names);
    }

    private static void collectFields(FormulaNode node, Set<String> names) {
        if (node instanceof FormulaNode.FieldReference ref) {
            names.add(ref.getName());
        } else if (node instanceof FormulaNode.UnaryOp op) {
            collectFields(op.getOperand(), names);
        } else if (node instanceof FormulaNode.BinaryOp op) {
            collectFields(op.getLeft(), names);
            collectFields(op.getRight(), names);
        } else if (node instanceof FormulaNode.FunctionCall call) {
            for (FormulaNode arg : call.getArguments()) {
                collectFields(arg, names);
            }
        }
        // literals reference nothing
    }

    private static void collectFunctions(FormulaNode node, Set<String> names) {
        if (node instanceof FormulaNode.UnaryOp op) {
            collectFunctions(op.getOperand(), names);
        } else if (node instanceof FormulaNode.BinaryOp op) {
            collectFunctions(op.getLeft(), names);
            collectFunctions(op.getRight(), names);
        } else if (node instanceof FormulaNode.FunctionCall call) {
            names.add(call.getName());
            for (FormulaNode arg : call.getArguments()) {
                collectFunctions(arg, names);
            }
        }
    }
}
