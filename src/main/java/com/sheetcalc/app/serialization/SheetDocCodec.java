package com.sheetcalc.app.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.sheetcalc.app.engine.CellError;
import com.sheetcalc.app.engine.CellResult;
import com.sheetcalc.app.engine.DependencyGraph;
import com.sheetcalc.app.engine.ErrorKind;
import com.sheetcalc.app.engine.EvaluationResult;
import com.sheetcalc.app.engine.ExternalDependency;
import com.sheetcalc.app.exceptions.SheetFormatException;
import com.sheetcalc.app.formula.FormulaCache;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.Sheet;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reads and writes the SheetDoc persistence form: a {@code #%SHEETDOC v1} header line
 * followed by a TOML document (see {@link SheetDocument}).
 *
 * Writing records each cell's input together with its evaluated value, type, error and
 * dependency edges. Reading restores only the inputs of the primary sheet; a formula wins
 * over a stored value.
 */
public class SheetDocCodec {

    public static final String MAGIC = "#%SHEETDOC";
    public static final String VERSION = "v1";
    public static final String DEFAULT_SHEET_NAME = "Sheet1";

    private final TomlMapper mapper;

    public SheetDocCodec(TomlMapper mapper) {
        this.mapper = mapper;
    }

    public SheetDocCodec() {
        this(defaultMapper());
    }

    /**
     * TOML mapper that skips keys it doesn't know, so documents carrying extra sheet metadata still load.
     */
    public static TomlMapper defaultMapper() {
        return TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public static boolean isSheetDoc(String text) {
        return text != null && text.stripLeading().startsWith(MAGIC);
    }

    public String write(Sheet sheet, EvaluationResult evaluation, String pageId) {
        return write(toDocument(sheet, evaluation, pageId));
    }

    public String write(SheetDocument document) {
        try {
            return MAGIC + " " + VERSION + "\n" + mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new SheetFormatException("Could not write SheetDoc: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a SheetDoc and returns the primary sheet's inputs.
     */
    public Sheet read(String text) {
        return toSheet(readDocument(text));
    }

    public SheetDocument readDocument(String text) {
        if (!isSheetDoc(text)) {
            throw new SheetFormatException("Missing SheetDoc header");
        }
        String body = text.stripLeading();
        int lineEnd = body.indexOf('\n');
        String headerLine = (lineEnd < 0 ? body : body.substring(0, lineEnd)).trim();
        String version = headerLine.substring(MAGIC.length()).trim();
        if (!version.isEmpty() && !version.equals(VERSION)) {
            throw new SheetFormatException("Unsupported SheetDoc version: " + version);
        }
        String toml = lineEnd < 0 ? "" : body.substring(lineEnd + 1);
        if (toml.trim().isEmpty()) {
            return new SheetDocument();
        }
        try {
            return mapper.readValue(toml, SheetDocument.class);
        } catch (JsonProcessingException e) {
            throw new SheetFormatException("Invalid SheetDoc body: " + e.getOriginalMessage(), e);
        }
    }

    public SheetDocument toDocument(Sheet sheet, EvaluationResult evaluation, String pageId) {
        SheetDocSheet docSheet = new SheetDocSheet();
        docSheet.setName(DEFAULT_SHEET_NAME);
        docSheet.setOrder(0);
        docSheet.setRowCount(sheet.getRowCount());
        docSheet.setColumnCount(sheet.getColumnCount());

        DependencyGraph graph = evaluation.getDependencies();
        for (Map.Entry<Address, String> entry : sheet.getCells().entrySet()) {
            Address address = entry.getKey();
            CellResult result = evaluation.get(address);
            docSheet.getCells().put(address.toString(), toDocCell(entry.getValue(), result, graph));

            List<String> dependsOn = dependsOn(graph, address);
            List<String> dependents = names(graph.dependents(address));
            if (!dependsOn.isEmpty() || !dependents.isEmpty()) {
                SheetDocDependencies dependencies = new SheetDocDependencies();
                dependencies.setDependsOn(dependsOn);
                dependencies.setDependents(dependents);
                docSheet.getDependencies().put(address.toString(), dependencies);
            }
        }

        SheetDocument document = new SheetDocument();
        document.setPageId(pageId);
        document.getSheets().add(docSheet);
        return document;
    }

    private static SheetDocCell toDocCell(String raw, CellResult result, DependencyGraph graph) {
        SheetDocCell cell = new SheetDocCell();
        String trimmed = raw.trim();
        boolean formula = FormulaCache.isFormula(trimmed);
        if (formula) {
            cell.setFormula(trimmed);
        }
        if (result == null) {
            cell.setValue(raw);
            return cell;
        }

        cell.setType(result.getValue().getType().getLabel());
        if (result.isError()) {
            cell.setValue(formula ? "" : raw);
            cell.setError(toDocError(result, graph));
        } else {
            Object value = result.getValue().toJavaValue();
            cell.setValue(value == null ? "" : value);
        }
        return cell;
    }

    private static SheetDocError toDocError(CellResult result, DependencyGraph graph) {
        CellError error = result.getError();
        SheetDocError docError = new SheetDocError();
        docError.setType(error.getKind().name());
        docError.setMessage(error.getMessage());
        if (error.getKind() == ErrorKind.CIRCULAR) {
            SortedSet<Address> members = new TreeSet<>(graph.dependsOn(result.getAddress()));
            members.add(result.getAddress());
            docError.setDetails(names(members));
        }
        return docError;
    }

    private static List<String> dependsOn(DependencyGraph graph, Address address) {
        List<String> edges = names(graph.dependsOn(address));
        for (ExternalDependency external : graph.externalDependencies(address)) {
            edges.add(external.toString());
        }
        return edges;
    }

    private static List<String> names(SortedSet<Address> addresses) {
        List<String> names = new ArrayList<>();
        for (Address address : addresses) {
            names.add(address.toString());
        }
        return names;
    }

    /**
     * Inputs of the document's primary sheet (lowest order, then name).
     * Cells with an unreadable address are skipped.
     */
    public Sheet toSheet(SheetDocument document) {
        SheetDocSheet primary = document.getSheets().stream()
                .min(Comparator.comparing((SheetDocSheet s) -> s.getOrder() == null ? 0 : s.getOrder())
                        .thenComparing(s -> s.getName() == null ? "" : s.getName()))
                .orElse(null);
        if (primary == null) {
            return new Sheet();
        }

        Sheet sheet = new Sheet(
                primary.getRowCount() == null ? Sheet.DEFAULT_ROWS : primary.getRowCount(),
                primary.getColumnCount() == null ? Sheet.DEFAULT_COLUMNS : primary.getColumnCount());
        for (Map.Entry<String, SheetDocCell> entry : primary.getCells().entrySet()) {
            if (!Address.isValid(entry.getKey()) || entry.getValue() == null) {
                continue;
            }
            String input = toInput(entry.getValue());
            if (input != null) {
                sheet.setCell(Address.parse(entry.getKey()), input);
            }
        }
        return sheet;
    }

    private static String toInput(SheetDocCell cell) {
        if (cell.getFormula() != null && !cell.getFormula().trim().isEmpty()) {
            String formula = cell.getFormula().trim();
            return formula.startsWith("=") ? formula : "=" + formula;
        }
        Object value = cell.getValue();
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }
}
