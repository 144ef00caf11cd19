package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellValue;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of named functions available to formulas. Names are case-insensitive.
 * {@link #withDefaults(Clock)} registers the built-in library; callers may add or replace entries.
 */
public class FunctionRegistry {

    private final Map<String, SheetFunction> functions = new ConcurrentHashMap<>();

    /**
     * Registry with every built-in function. Date functions read the given clock.
     */
    public static FunctionRegistry withDefaults(Clock clock) {
        FunctionRegistry registry = new FunctionRegistry();
        AggregateFunctions.registerAll(registry);
        MathFunctions.registerAll(registry);
        LogicalFunctions.registerAll(registry);
        TextFunctions.registerAll(registry);
        DateFunctions.registerAll(registry, clock);
        return registry;
    }

    public void register(String name, SheetFunction function) {
        functions.put(normalize(name), function);
    }

    /**
     * Registers a function that evaluates its own arguments on demand (IF, IFERROR).
     */
    public void registerLazy(String name, SheetFunction function) {
        register(name, new SheetFunction() {
            @Override
            public CellValue apply(FunctionArguments args) {
                return function.apply(args);
            }

            @Override
            public boolean isLazy() {
                return true;
            }
        });
    }

    public Optional<SheetFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(normalize(name)));
    }

    public Set<String> names() {
        return new TreeSet<>(functions.keySet());
    }

    private static String normalize(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
