package com.spreadsheet.calc.config;

import com.spreadsheet.calc.services.CalculationOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for calculation passes, bound from {@code spreadsheet.calculation.*}.
 */
@ConfigurationProperties("spreadsheet.calculation")
public class CalculationProperties {

    private boolean iterative = false;
    private int maxIterations = 100;
    private double maxChange = 0.001;
    private boolean calculateVolatile = true;
    // Run a full pass after every cell write
    private boolean autoCalculate = true;

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
        this.maxIterations = maxIterations;
    }

    public double getMaxChange() {
        return maxChange;
    }

    public void setMaxChange(double maxChange) {
        this.maxChange = maxChange;
    }

    public boolean isCalculateVolatile() {
        return calculateVolatile;
    }

    public void setCalculateVolatile(boolean calculateVolatile) {
        this.calculateVolatile = calculateVolatile;
    }

    public boolean isAutoCalculate() {
        return autoCalculate;
    }

    public void setAutoCalculate(boolean autoCalculate) {
        this.autoCalculate = autoCalculate;
    }

    /**
     * A fresh options object carrying these defaults.
     */
    public CalculationOptions toOptions() {
        CalculationOptions options = new CalculationOptions();
        options.setIterative(iterative);
        options.setMaxIterations(maxIterations);
        options.setMaxChange(maxChange);
        options.setCalculateVolatile(calculateVolatile);
        return options;
    }
}
