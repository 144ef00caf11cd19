package com.sheetcalc.app.models;

public interface ReferenceVisitor<R> {

    R visitLocal(LocalCellReference reference);

    R visitLocalRange(LocalRangeReference reference);

    R visitCrossPage(CrossPageReference reference);
}
