package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellValue;
import com.sheetcalc.app.engine.ErrorKind;
import com.sheetcalc.app.exceptions.FormulaEvaluationException;

import java.util.List;

/**
 * SUM, AVERAGE, MIN, MAX, COUNT, COUNTA.
 * Work over all arguments flattened; non-numeric members are skipped rather than rejected.
 */
final class AggregateFunctions {

    private AggregateFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("SUM", AggregateFunctions::sum);
        registry.register("AVERAGE", AggregateFunctions::average);
        registry.register("AVG", AggregateFunctions::average);
        registry.register("MIN", args -> extreme(args, true));
        registry.register("MAX", args -> extreme(args, false));
        registry.register("COUNT", args -> CellValue.number(Coercions.numericMembers(args.flattened()).size()));
        registry.register("COUNTA", AggregateFunctions::countNonBlank);
    }

    private static CellValue sum(FunctionArguments args) {
        double total = 0;
        for (double number : Coercions.numericMembers(args.flattened())) {
            total += number;
        }
        return CellValue.number(total);
    }

    private static CellValue average(FunctionArguments args) {
        List<Double> numbers = Coercions.numericMembers(args.flattened());
        if (numbers.isEmpty()) {
            throw new FormulaEvaluationException(ErrorKind.DIV0, "AVERAGE of no numeric values");
        }
        double total = 0;
        for (double number : numbers) {
            total += number;
        }
        return CellValue.number(total / numbers.size());
    }

    private static CellValue extreme(FunctionArguments args, boolean min) {
        List<Double> numbers = Coercions.numericMembers(args.flattened());
        if (numbers.isEmpty()) {
            return CellValue.number(0);
        }
        double result = numbers.get(0);
        for (double number : numbers) {
            result = min ? Math.min(result, number) : Math.max(result, number);
        }
        return CellValue.number(result);
    }

    private static CellValue countNonBlank(FunctionArguments args) {
        long count = args.flattened().stream().filter(value -> !value.isBlank()).count();
        return CellValue.number(count);
    }
}
