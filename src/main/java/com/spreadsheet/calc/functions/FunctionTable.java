package com.spreadsheet.calc.functions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Collects function definitions while the registry is being built.
 */
final class FunctionTable {

    private final Map<String, FunctionDefinition> entries = new HashMap<>();

    FunctionTable add(String name, int minArgs, int maxArgs, FormulaFunction implementation) {
        return put(new FunctionDefinition(name, minArgs, maxArgs, false, implementation));
    }

    FunctionTable addVariadic(String name, int minArgs, FormulaFunction implementation) {
        return put(new FunctionDefinition(name, minArgs, null, false, implementation));
    }

    FunctionTable addVolatile(String name, int minArgs, int maxArgs, FormulaFunction implementation) {
        return put(new FunctionDefinition(name, minArgs, maxArgs, true, implementation));
    }

    private FunctionTable put(FunctionDefinition definition) {
        if (entries.putIfAbsent(definition.getName(), definition) != null) {
            throw new IllegalStateException("Function registered twice: " + definition.getName());
        }
        return this;
    }

    Map<String, FunctionDefinition> build() {
        return Collections.unmodifiableMap(new HashMap<>(entries));
    }
}
