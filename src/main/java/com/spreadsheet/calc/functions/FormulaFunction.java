package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.evaluator.EvaluationContext;
import com.spreadsheet.calc.evaluator.FormulaValue;

import java.util.List;

/**
 * Implementation of a built-in function. Arguments arrive already evaluated,
 * and their count has been checked against the declared arity.
 */
@FunctionalInterface
public interface FormulaFunction {

    FormulaValue apply(List<FormulaValue> args, EvaluationContext ctx);
}
