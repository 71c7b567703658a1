package com.spreadsheet.calc.functions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Name to definition lookup for every built-in function.
 * Built once on first use and read-only afterwards, so concurrent
 * evaluators can share it without locking.
 */
public final class FunctionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, FunctionDefinition> functions;

    private FunctionRegistry() {
        FunctionTable table = new FunctionTable();
        MathFunctions.register(table);
        LogicalFunctions.register(table);
        TextFunctions.register(table);
        InfoFunctions.register(table);
        DateFunctions.register(table);
        LookupFunctions.register(table);
        StatisticalFunctions.register(table);
        this.functions = table.build();
        logger.debug("Function registry initialised with {} functions", functions.size());
    }

    private static final class Holder {
        private static final FunctionRegistry INSTANCE = new FunctionRegistry();
    }

    public static FunctionRegistry getInstance() {
        return Holder.INSTANCE;
    }

    /**
     * Case-insensitive lookup. Returns null for an unknown name.
     */
    public FunctionDefinition get(String name) {
        if (name == null) {
            return null;
        }
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public boolean isVolatile(String name) {
        FunctionDefinition definition = get(name);
        return definition != null && definition.isVolatile();
    }

    public int size() {
        return functions.size();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(functions.keySet()));
    }
}
