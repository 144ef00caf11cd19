package com.sheetcalc.app.engine;

import com.sheetcalc.app.models.PageRef;

/**
 * Looks up the sheet behind a cross-page reference. Implemented by whatever owns pages.
 * Must answer the same way every time it is asked about the same page during one evaluation.
 * Timeouts, retries and permission checks are the implementation's business.
 */
@FunctionalInterface
public interface ExternalReferenceResolver {

    /**
     * Returns the resolved page, or a failed resolution carrying a message such as "Page not found".
     */
    ResolvedPage resolve(PageRef reference);
}
