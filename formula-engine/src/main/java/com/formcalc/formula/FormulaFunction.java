package com.formcalc.formula;

import java.util.List;

/**
 * A function callable from formulas. Arguments arrive already evaluated, left to right.
 */
public interface FormulaFunction {

    ResultType getResultType();

    int getMinArgs();

    /**
     * Maximum argument count, or {@link BaseFunction#VARIADIC} for no limit.
     */
    int getMaxArgs();

    /**
     * @throws FormulaException with kind FUNCTION_ARGUMENT (or an arithmetic kind) when the arguments are unusable
     */
    FormulaValue apply(List<FormulaValue> args);
}
