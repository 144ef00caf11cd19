package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellValue;
import com.sheetcalc.app.engine.ErrorKind;
import com.sheetcalc.app.exceptions.FormulaEvaluationException;

import java.util.List;

/**
 * IF and IFERROR are lazy: only the branch that is selected gets evaluated.
 */
final class LogicalFunctions {

    private LogicalFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.registerLazy("IF", LogicalFunctions::ifFunction);
        registry.registerLazy("IFERROR", args -> {
            args.requireExactly("IFERROR", 2);
            CellValue value = args.get(0);
            return value.isError() ? args.get(1) : value;
        });
        registry.register("AND", args -> {
            List<CellValue> values = nonEmpty(args, "AND");
            return CellValue.bool(values.stream().allMatch(Coercions::toBoolean));
        });
        registry.register("OR", args -> {
            List<CellValue> values = nonEmpty(args, "OR");
            return CellValue.bool(values.stream().anyMatch(Coercions::toBoolean));
        });
        registry.register("NOT", args -> {
            args.requireExactly("NOT", 1);
            return CellValue.bool(!Coercions.toBoolean(args.get(0)));
        });
        registry.register("ISBLANK", args -> {
            args.requireExactly("ISBLANK", 1);
            return CellValue.bool(args.get(0).isBlank());
        });
        registry.register("ISNUMBER", args -> {
            args.requireExactly("ISNUMBER", 1);
            return CellValue.bool(args.get(0).isNumber());
        });
        registry.register("ISTEXT", args -> {
            args.requireExactly("ISTEXT", 1);
            CellValue value = args.get(0);
            return CellValue.bool(value.isText() && !value.getText().isEmpty());
        });
    }

    private static CellValue ifFunction(FunctionArguments args) {
        args.requireBetween("IF", 2, 3);
        CellValue condition = args.get(0);
        if (condition.isError()) {
            return condition;
        }
        if (Coercions.toBoolean(condition)) {
            return args.get(1);
        }
        return args.count() > 2 ? args.get(2) : CellValue.blank();
    }

    private static List<CellValue> nonEmpty(FunctionArguments args, String name) {
        List<CellValue> values = args.flattened();
        if (values.isEmpty()) {
            throw new FormulaEvaluationException(ErrorKind.VALUE, name + " expects at least 1 argument");
        }
        return values;
    }
}
