package com.sheetcalc.app.formula;

import com.sheetcalc.app.exceptions.FormulaSyntaxException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses formulas once per distinct raw input and remembers the outcome, including failures.
 * Bounded, least-recently-used eviction; safe to share between concurrent evaluations
 * since parsed expressions are immutable.
 */
public class FormulaCache {

    private final Map<String, ParsedFormula> cache;

    public FormulaCache(int maxEntries) {
        int capacity = Math.max(1, maxEntries);
        this.cache = Collections.synchronizedMap(new LinkedHashMap<String, ParsedFormula>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ParsedFormula> eldest) {
                return size() > capacity;
            }
        });
    }

    /**
     * True if the raw cell input is a formula (starts with '=' after leading whitespace).
     */
    public static boolean isFormula(String rawInput) {
        return rawInput != null && rawInput.trim().startsWith("=");
    }

    /**
     * Parses a raw formula cell input such as "=A1+1". The leading '=' is stripped.
     */
    public ParsedFormula parse(String rawInput) {
        String key = rawInput.trim();
        ParsedFormula cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        ParsedFormula parsed = parseUncached(key);
        cache.put(key, parsed);
        return parsed;
    }

    private static ParsedFormula parseUncached(String trimmed) {
        String body = trimmed.startsWith("=") ? trimmed.substring(1) : trimmed;
        try {
            return ParsedFormula.of(FormulaParser.parse(body));
        } catch (FormulaSyntaxException e) {
            return ParsedFormula.failed(e.getMessage());
        }
    }

    public int size() {
        return cache.size();
    }
}
