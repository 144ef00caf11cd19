package com.sheetcalc.app.serialization;

import com.sheetcalc.app.engine.EvaluationResult;
import com.sheetcalc.app.engine.SheetEvaluator;
import com.sheetcalc.app.exceptions.SheetFormatException;
import com.sheetcalc.app.models.Address;
import com.sheetcalc.app.models.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the SheetDoc (header + TOML) codec.
 */
class SheetDocCodecTest {

    private SheetDocCodec codec;
    private SheetEvaluator evaluator;

    @BeforeEach
    void setUp() {
        codec = new SheetDocCodec();
        evaluator = new SheetEvaluator();
    }

    private static Sheet sample() {
        Sheet sheet = new Sheet(6, 4);
        sheet.setCell("A1", "Revenue");
        sheet.setCell("B1", "1000");
        sheet.setCell("B2", "0.25");
        sheet.setCell("B3", "=B1*B2");
        sheet.setCell("C1", "=B1/0");
        sheet.setCell("D1", "=D2");
        sheet.setCell("D2", "=D1");
        return sheet;
    }

    @Test
    void testWriteThenRead() {
        Sheet sheet = sample();
        String doc = codec.write(sheet, evaluator.evaluate(sheet), "page-7");

        assertTrue(doc.startsWith("#%SHEETDOC v1\n"));
        assertTrue(SheetDocCodec.isSheetDoc(doc));
        assertEquals(sheet, codec.read(doc));
    }

    /**
     * The document records evaluated values, errors and dependency edges next to the inputs.
     */
    @Test
    void testDocumentContents() {
        Sheet sheet = sample();
        EvaluationResult result = evaluator.evaluate(sheet);
        SheetDocument document = codec.readDocument(codec.write(sheet, result, "page-7"));

        assertEquals("page-7", document.getPageId());
        assertEquals(1, document.getSheets().size());
        SheetDocSheet docSheet = document.getSheets().get(0);
        assertEquals(6, docSheet.getRowCount());
        assertEquals(4, docSheet.getColumnCount());

        SheetDocCell b3 = docSheet.getCells().get("B3");
        assertEquals("=B1*B2", b3.getFormula());
        assertEquals(250.0, ((Number) b3.getValue()).doubleValue());
        assertEquals("number", b3.getType());

        SheetDocCell c1 = docSheet.getCells().get("C1");
        assertEquals("DIV0", c1.getError().getType());
        assertEquals("Division by zero", c1.getError().getMessage());
        assertEquals("", c1.getValue());

        SheetDocCell d1 = docSheet.getCells().get("D1");
        assertEquals("CIRCULAR", d1.getError().getType());
        assertEquals(List.of("D1", "D2"), d1.getError().getDetails());

        assertEquals(List.of("B1", "B2"), docSheet.getDependencies().get("B3").getDependsOn());
        assertEquals(List.of("C1", "B3"), docSheet.getDependencies().get("B1").getDependents());
    }

    /**
     * Hand-written documents: formulas win over values, '=' is optional, unknown keys are ignored.
     */
    @Test
    void testReadHandWrittenDocument() {
        String doc = "#%SHEETDOC v1\n"
                + "page_id = \"budget\"\n"
                + "\n"
                + "[[sheets]]\n"
                + "name = \"Sheet1\"\n"
                + "order = 0\n"
                + "row_count = 8\n"
                + "column_count = 3\n"
                + "frozen_rows = 1\n"
                + "\n"
                + "[sheets.cells.A1]\n"
                + "value = 10\n"
                + "\n"
                + "[sheets.cells.B1]\n"
                + "formula = \"A1*2\"\n"
                + "value = 999\n"
                + "\n"
                + "[sheets.cells.C1]\n"
                + "value = \"label\"\n";

        Sheet sheet = codec.read(doc);
        assertEquals(8, sheet.getRowCount());
        assertEquals(3, sheet.getColumnCount());
        assertEquals("10", sheet.getRaw(Address.parse("A1")));
        assertEquals("=A1*2", sheet.getRaw(Address.parse("B1")));
        assertEquals("label", sheet.getRaw(Address.parse("C1")));
        assertEquals(20, evaluator.evaluate(sheet).get("B1").getValue().getNumber());
    }

    @Test
    void testEmptyBodyGivesDefaultSheet() {
        assertEquals(new Sheet(), codec.read("#%SHEETDOC v1\n"));
    }

    @Test
    void testInvalidDocuments() {
        assertThrows(SheetFormatException.class, () -> codec.read("page_id = \"x\""));
        SheetFormatException version = assertThrows(SheetFormatException.class,
                () -> codec.read("#%SHEETDOC v2\n"));
        assertEquals("Unsupported SheetDoc version: v2", version.getMessage());
        assertThrows(SheetFormatException.class, () -> codec.read("#%SHEETDOC v1\n[[[not toml"));
    }
}
