package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellValue;
import com.sheetcalc.app.engine.ErrorKind;
import com.sheetcalc.app.exceptions.FormulaEvaluationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class MathFunctions {

    // Doubles have no decimal digits beyond this scale in either direction
    private static final int MAX_ROUND_DIGITS = 340;

    private MathFunctions() {
    }

    static void registerAll(FunctionRegistry registry) {
        registry.register("ABS", args -> {
            args.requireExactly("ABS", 1);
            return CellValue.number(Math.abs(number(args, 0)));
        });
        registry.register("ROUND", MathFunctions::round);
        registry.register("FLOOR", args -> toSignificance(args, "FLOOR", false));
        registry.register("CEILING", args -> toSignificance(args, "CEILING", true));
        registry.register("INT", args -> {
            args.requireExactly("INT", 1);
            return CellValue.number(Math.floor(number(args, 0)));
        });
        registry.register("SIGN", args -> {
            args.requireExactly("SIGN", 1);
            return CellValue.number(Math.signum(number(args, 0)));
        });
        registry.register("SQRT", args -> {
            args.requireExactly("SQRT", 1);
            double value = number(args, 0);
            if (value < 0) {
                throw new FormulaEvaluationException(ErrorKind.VALUE, "SQRT: Cannot take square root of negative number");
            }
            return CellValue.number(Math.sqrt(value));
        });
        registry.register("POWER", MathFunctions::power);
        registry.register("POW", MathFunctions::power);
        registry.register("MOD", args -> {
            args.requireExactly("MOD", 2);
            double divisor = number(args, 1);
            if (divisor == 0) {
                throw new FormulaEvaluationException(ErrorKind.DIV0, "MOD: Division by zero");
            }
            return CellValue.number(number(args, 0) % divisor);
        });
        registry.register("PI", args -> {
            args.requireExactly("PI", 0);
            return CellValue.number(Math.PI);
        });
    }

    static double number(FunctionArguments args, int index) {
        return Coercions.toNumber(args.get(index));
    }

    private static CellValue round(FunctionArguments args) {
        args.requireBetween("ROUND", 1, 2);
        double value = number(args, 0);
        double digits = args.count() > 1 ? number(args, 1) : 0;
        if (!Double.isFinite(value) || digits > MAX_ROUND_DIGITS) {
            return CellValue.number(value);
        }
        if (digits < -MAX_ROUND_DIGITS) {
            return CellValue.number(0);
        }
        return CellValue.number(BigDecimal.valueOf(value).setScale((int) digits, RoundingMode.HALF_UP).doubleValue());
    }

    private static CellValue toSignificance(FunctionArguments args, String name, boolean up) {
        args.requireBetween(name, 1, 2);
        double value = number(args, 0);
        double significance = args.count() > 1 ? Math.abs(number(args, 1)) : 1;
        if (significance == 0) {
            throw new FormulaEvaluationException(ErrorKind.VALUE, name + " significance cannot be zero");
        }
        double steps = value / significance;
        return CellValue.number((up ? Math.ceil(steps) : Math.floor(steps)) * significance);
    }

    private static CellValue power(FunctionArguments args) {
        args.requireExactly("POWER", 2);
        return CellValue.number(Math.pow(number(args, 0), number(args, 1)));
    }
}
