package com.spreadsheet.calc.services;

/**
 * What a calculation pass did. Returned to callers and serialized as-is by the REST layer.
 */
public class CalculationStats {

    private int formulaCount;
    private int cellsCalculated;
    private int iterations;
    private int circularReferences;
    private int volatileCells;
    private int errors;
    private boolean converged = true;

    public int getFormulaCount() {
        return formulaCount;
    }

    void setFormulaCount(int formulaCount) {
        this.formulaCount = formulaCount;
    }

    public int getCellsCalculated() {
        return cellsCalculated;
    }

    void incrementCellsCalculated() {
        cellsCalculated++;
    }

    public int getIterations() {
        return iterations;
    }

    void setIterations(int iterations) {
        this.iterations = iterations;
    }

    public int getCircularReferences() {
        return circularReferences;
    }

    void setCircularReferences(int circularReferences) {
        this.circularReferences = circularReferences;
    }

    public int getVolatileCells() {
        return volatileCells;
    }

    void setVolatileCells(int volatileCells) {
        this.volatileCells = volatileCells;
    }

    public int getErrors() {
        return errors;
    }

    void incrementErrors() {
        errors++;
    }

    public boolean isConverged() {
        return converged;
    }

    void setConverged(boolean converged) {
        this.converged = converged;
    }

    @Override
    public String toString() {
        return "CalculationStats{formulaCount=" + formulaCount
                + ", cellsCalculated=" + cellsCalculated
                + ", iterations=" + iterations
                + ", circularReferences=" + circularReferences
                + ", volatileCells=" + volatileCells
                + ", errors=" + errors
                + ", converged=" + converged + "}";
    }
}
