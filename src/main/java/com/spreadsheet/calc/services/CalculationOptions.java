package com.spreadsheet.calc.services;

/**
 * Settings for one calculation pass. Also bound from the JSON body of a calculate request,
 * so fields left out keep their defaults.
 */
public class CalculationOptions {

    private boolean iterative = false;
    private int maxIterations = 100;
    private double maxChange = 0.001;
    // Full recalculation is the only mode; the flag is carried for callers that set it
    private boolean forceFullCalculation = true;
    private boolean calculateVolatile = true;

    public CalculationOptions() {
    }

    public static CalculationOptions iterative(int maxIterations, double maxChange) {
        CalculationOptions options = new CalculationOptions();
        options.setIterative(true);
        options.setMaxIterations(maxIterations);
        options.setMaxChange(maxChange);
        return options;
    }

    public boolean isIterative() {
        return iterative;
    }

    public void setIterative(boolean iterative) {
        this.iterative = iterative;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public double getMaxChange() {
        return maxChange;
    }

    public void setMaxChange(double maxChange) {
        if (maxChange < 0 || Double.isNaN(maxChange)) {
            throw new IllegalArgumentException("maxChange must not be negative, got " + maxChange);
        }
        this.maxChange = maxChange;
    }

    public boolean isForceFullCalculation() {
        return forceFullCalculation;
    }

    public void setForceFullCalculation(boolean forceFullCalculation) {
        this.forceFullCalculation = forceFullCalculation;
    }

    public boolean isCalculateVolatile() {
        return calculateVolatile;
    }

    public void setCalculateVolatile(boolean calculateVolatile) {
        this.calculateVolatile = calculateVolatile;
    }

    @Override
    public String toString() {
        return "CalculationOptions{iterative=" + iterative
                + ", maxIterations=" + maxIterations
                + ", maxChange=" + maxChange
                + ", forceFullCalculation=" + forceFullCalculation
                + ", calculateVolatile=" + calculateVolatile + "}";
    }
}
