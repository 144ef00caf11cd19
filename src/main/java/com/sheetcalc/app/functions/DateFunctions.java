package com.sheetcalc.app.functions;

import com.sheetcalc.app.engine.CellValue;
import com.sheetcalc.app.engine.ErrorKind;
import com.sheetcalc.app.exceptions.FormulaEvaluationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.function.Function;

/**
 * TODAY, NOW, YEAR, MONTH, DAY. Dates are ISO text ("2024-03-15"); the current time comes
 * from the registry's clock, so a fixed clock keeps evaluation repeatable.
 */
final class DateFunctions {

    private DateFunctions() {
    }

    static void registerAll(FunctionRegistry registry, Clock clock) {
        registry.register("TODAY", args -> {
            args.requireExactly("TODAY", 0);
            return CellValue.text(LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE));
        });
        registry.register("NOW", args -> {
            args.requireExactly("NOW", 0);
            return CellValue.text(DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
        });
        registry.register("YEAR", args -> datePart(args, "YEAR", ChronoField.YEAR, clock));
        registry.register("MONTH", args -> datePart(args, "MONTH", ChronoField.MONTH_OF_YEAR, clock));
        registry.register("DAY", args -> datePart(args, "DAY", ChronoField.DAY_OF_MONTH, clock));
    }

    private static CellValue datePart(FunctionArguments args, String name, ChronoField field, Clock clock) {
        args.requireExactly(name, 1);
        String text = Coercions.toText(args.get(0)).trim();
        List<Function<String, LocalDate>> parsers = List.of(
                LocalDate::parse,
                value -> LocalDateTime.parse(value).toLocalDate(),
                value -> OffsetDateTime.parse(value).toLocalDate(),
                value -> Instant.parse(value).atZone(clock.getZone()).toLocalDate());
        for (Function<String, LocalDate> parser : parsers) {
            LocalDate date = tryParse(parser, text);
            if (date != null) {
                return CellValue.number(date.get(field));
            }
        }
        throw new FormulaEvaluationException(ErrorKind.VALUE, name + ": Invalid date");
    }

    private static LocalDate tryParse(Function<String, LocalDate> parser, String text) {
        try {
            return parser.apply(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
