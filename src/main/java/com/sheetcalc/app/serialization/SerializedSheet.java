package com.sheetcalc.app.serialization;

import java.util.Objects;

/**
 * The two-part text form of a sheet:
 * - rawForm: unevaluated inputs, used for persistence and round-trips
 * - displayForm: evaluated display strings, or null when no evaluation was supplied
 */
public final class SerializedSheet {
    private final String rawForm;
    private final String displayForm;

    public SerializedSheet(String rawForm, String displayForm) {
        this.rawForm = Objects.requireNonNull(rawForm, "rawForm");
        this.displayForm = displayForm;
    }

    public String getRawForm() {
        return rawForm;
    }

    public String getDisplayForm() {
        return displayForm;
    }

    public boolean hasDisplayForm() {
        return displayForm != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SerializedSheet)) {
            return false;
        }
        SerializedSheet that = (SerializedSheet) o;
        return rawForm.equals(that.rawForm) && Objects.equals(displayForm, that.displayForm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawForm, displayForm);
    }
}
