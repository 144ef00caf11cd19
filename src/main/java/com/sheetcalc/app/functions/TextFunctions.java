package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellValue;
import com.sheetcalc.app.engine.ErrorKind;
import com.sheetcalc.app.exceptions.FormulaEvaluationException;

import java.util.Locale;
import java.util.stream.Collectors;

final class TextFunctions {

    private static final int MAX_REPEAT = 10_000;

    private TextFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("CONCAT", TextFunctions::concat);
        registry.register("CONCATENATE", TextFunctions::concat);
        registry.register("UPPER", args -> {
            args.requireExactly("UPPER", 1);
            return CellValue.text(text(args, 0).toUpperCase(Locale.ROOT));
        });
        registry.register("LOWER", args -> {
            args.requireExactly("LOWER", 1);
            return CellValue.text(text(args, 0).toLowerCase(Locale.ROOT));
        });
        registry.register("TRIM", args -> {
            args.requireExactly("TRIM", 1);
            return CellValue.text(text(args, 0).trim());
        });
        registry.register("LEN", args -> {
            args.requireExactly("LEN", 1);
            return CellValue.number(text(args, 0).length());
        });
        registry.register("LEFT", args -> {
            args.requireBetween("LEFT", 1, 2);
            String text = text(args, 0);
            int count = Math.min(text.length(), characterCount(args));
            return CellValue.text(text.substring(0, count));
        });
        registry.register("RIGHT", args -> {
            args.requireBetween("RIGHT", 1, 2);
            String text = text(args, 0);
            int count = Math.min(text.length(), characterCount(args));
            return CellValue.text(text.substring(text.length() - count));
        });
        registry.register("MID", TextFunctions::mid);
        registry.register("SUBSTITUTE", TextFunctions::substitute);
        registry.register("REPT", args -> {
            args.requireExactly("REPT", 2);
            int times = (int) Math.max(0, Math.floor(MathFunctions.number(args, 1)));
            if (times > MAX_REPEAT) {
                throw new FormulaEvaluationException(ErrorKind.VALUE, "REPT repeat count too large");
            }
            return CellValue.text(text(args, 0).repeat(times));
        });
        registry.register("FIND", args -> find(args, "FIND", false));
        registry.register("SEARCH", args -> find(args, "SEARCH", true));
    }

    private static String text(FunctionArguments args, int index) {
        return Coercions.toText(args.get(index));
    }

    private static int characterCount(FunctionArguments args) {
        if (args.count() < 2) {
            return 1;
        }
        return (int) Math.max(0, Math.floor(MathFunctions.number(args, 1)));
    }

    private static CellValue concat(FunctionArguments args) {
        return CellValue.text(args.flattened().stream().map(Coercions::toText).collect(Collectors.joining()));
    }

    private static CellValue mid(FunctionArguments args) {
        args.requireExactly("MID", 3);
        String text = text(args, 0);
        int start = (int) Math.max(1, Math.floor(MathFunctions.number(args, 1))) - 1;
        int count = (int) Math.max(0, Math.floor(MathFunctions.number(args, 2)));
        if (start >= text.length()) {
            return CellValue.text("");
        }
        return CellValue.text(text.substring(start, (int) Math.min(text.length(), (long) start + count)));
    }

    private static CellValue substitute(FunctionArguments args) {
        args.requireBetween("SUBSTITUTE", 3, 4);
        String text = text(args, 0);
        String oldText = text(args, 1);
        String newText = text(args, 2);
        if (oldText.isEmpty()) {
            return CellValue.text(text);
        }
        if (args.count() < 4) {
            return CellValue.text(text.replace(oldText, newText));
        }

        int instance = (int) Math.floor(MathFunctions.number(args, 3));
        if (instance < 1) {
            throw new FormulaEvaluationException(ErrorKind.VALUE, "SUBSTITUTE instance_num must be positive");
        }
        int at = -1;
        for (int seen = 0; seen < instance; seen++) {
            at = text.indexOf(oldText, at < 0 ? 0 : at + oldText.length());
            if (at < 0) {
                return CellValue.text(text);
            }
        }
        return CellValue.text(text.substring(0, at) + newText + text.substring(at + oldText.length()));
    }

    private static CellValue find(FunctionArguments args, String name, boolean ignoreCase) {
        args.requireBetween(name, 2, 3);
        String needle = text(args, 0);
        String haystack = text(args, 1);
        if (ignoreCase) {
            needle = needle.toLowerCase(Locale.ROOT);
            haystack = haystack.toLowerCase(Locale.ROOT);
        }
        int start = args.count() > 2 ? (int) Math.max(1, Math.floor(MathFunctions.number(args, 2))) : 1;
        int index = haystack.indexOf(needle, start - 1);
        if (index < 0) {
            throw new FormulaEvaluationException(ErrorKind.VALUE, name + ": Text not found");
        }
        return CellValue.number(index + 1);
    }
}
