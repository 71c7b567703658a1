package com.spreadsheet.calc.formula;

/**
 * A node of a parsed formula. Trees are immutable and acyclic.
 * toString() renders the node back as formula text without the leading '='.
 */
public abstract class FormulaExpr {

    public abstract <R> R accept(FormulaVisitor<R> visitor);
}
