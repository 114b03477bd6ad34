package com.formcalc.formula;

import java.util.Objects;
import java.util.Set;

/**
 * Formula text as authored, paired with its parsed tree.
 */
public final class Formula {

    private final String text;
    private final FormulaNode ast;

    private Formula(String text, FormulaNode ast) {
        this.text = text;
        this.ast = ast;
    }

    /**
     * @throws FormulaException with kind SYNTAX
     */
    public static Formula compile(String text) {
        return new Formula(text, FormulaParser.parse(text));
    }

    public String getText() {
        return text;
    }

    public FormulaNode getAst() {
        return ast;
    }

    public Set<String> getFieldReferences() {
        return ReferenceExtractor.extract(ast);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula other)) return false;
        return text.equals(other.text) && ast.equals(other.ast);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, ast);
    }

    @Override
    public String toString() {
        return text;
    }
}
