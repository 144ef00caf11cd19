package com.sheetcalc.app.serialization;

import com.sheetcalc.app.engine.CellResult;
import com.sheetcalc.app.engine.EvaluationResult;
import com.sheetcalc.app.exceptions.SheetFormatException;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.Sheet;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical line-oriented text form of a sheet.
 *
 * Format:
 * - first line: {@code #SHEET rows=<n> columns=<m>}
 * - then one line per non-blank cell, row-major: {@code <Address>=<text>}
 * - lines end with a single {@code \n}; inside a text, backslash, newline and carriage
 *   return are written as {@code \\}, {@code \n} and {@code \r}
 * - the display form appends {@code " [<marker> <message>]"} to error cells,
 *   e.g. {@code A3=#ERROR [#DIV/0! Division by zero]}
 *
 * Serialization is a pure function of its inputs; {@link #parse(String)} restores an equal Sheet
 * from the raw form.
 */
public class SheetTextSerializer {

    public static final String HEADER_PREFIX = "#SHEET";
    private static final Pattern HEADER = Pattern.compile("^#SHEET\\s+rows=(\\d+)\\s+columns=(\\d+)\\s*$");

    public SerializedSheet serialize(Sheet sheet) {
        return new SerializedSheet(toRawText(sheet), null);
    }

    public SerializedSheet serialize(Sheet sheet, EvaluationResult evaluation) {
        return new SerializedSheet(toRawText(sheet), evaluation == null ? null : toDisplayText(sheet, evaluation));
    }

    public String toRawText(Sheet sheet) {
        StringBuilder text = header(sheet);
        for (Map.Entry<Address, String> cell : sheet.getCells().entrySet()) {
            text.append(cell.getKey()).append('=').append(escape(cell.getValue())).append('\n');
        }
        return text.toString();
    }

    /**
     * Display snapshot: one line per non-blank cell of the sheet with its evaluated display string.
     */
    public String toDisplayText(Sheet sheet, EvaluationResult evaluation) {
        StringBuilder text = header(sheet);
        for (Address address : sheet.getCells().keySet()) {
            CellResult result = evaluation.get(address);
            if (result == null) {
                continue;
            }
            text.append(address).append('=').append(escape(result.getDisplay()));
            if (result.isError()) {
                text.append(" [").append(result.getError().getToken()).append(' ')
                        .append(escape(result.getErrorMessage())).append(']');
            }
            text.append('\n');
        }
        return text.toString();
    }

    /**
     * Reads the raw form back into a Sheet.
     * Throws SheetFormatException if the header or a cell line is malformed.
     */
    public Sheet parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new SheetFormatException("Sheet text is empty");
        }
        String[] lines = text.split("\n", -1);
        Matcher header = HEADER.matcher(stripCarriageReturn(lines[0]));
        if (!header.matches()) {
            throw new SheetFormatException("Line 1: expected \"" + HEADER_PREFIX + " rows=<n> columns=<m>\"");
        }
        Sheet sheet;
        try {
            sheet = new Sheet(Integer.parseInt(header.group(1)), Integer.parseInt(header.group(2)));
        } catch (NumberFormatException e) {
            throw new SheetFormatException("Line 1: sheet extents are out of range", e);
        }

        for (int i = 1; i < lines.length; i++) {
            String line = stripCarriageReturn(lines[i]);
            if (line.isEmpty()) {
                continue;
            }
            int separator = line.indexOf('=');
            if (separator <= 0) {
                throw new SheetFormatException("Line " + (i + 1) + ": expected <Address>=<input>");
            }
            String addressText = line.substring(0, separator);
            if (!Address.isValid(addressText)) {
                throw new SheetFormatException("Line " + (i + 1) + ": invalid cell address " + addressText);
            }
            sheet.setCell(Address.parse(addressText), unescape(line.substring(separator + 1), i + 1));
        }
        return sheet;
    }

    private static StringBuilder header(Sheet sheet) {
        return new StringBuilder(HEADER_PREFIX)
                .append(" rows=").append(sheet.getRowCount())
                .append(" columns=").append(sheet.getColumnCount())
                .append('\n');
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\r':
                    escaped.append("\\r");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return escaped.toString();
    }

    static String unescape(String value, int lineNumber) {
        StringBuilder plain = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\') {
                plain.append(c);
                continue;
            }
            if (i + 1 >= value.length()) {
                throw new SheetFormatException("Line " + lineNumber + ": dangling escape");
            }
            char next = value.charAt(++i);
            switch (next) {
                case '\\':
                    plain.append('\\');
                    break;
                case 'n':
                    plain.append('\n');
                    break;
                case 'r':
                    plain.append('\r');
                    break;
                default:
                    throw new SheetFormatException("Line " + lineNumber + ": unknown escape \\" + next);
            }
        }
        return plain.toString();
    }
}
