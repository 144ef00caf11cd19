package com.sheetcalc.app.models;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies another page's sheet inside a formula, written as "@[Label](identifier)".
 * - label: the human-readable page title, always present and used for display
 * - identifier: the opaque page id (optional; without it the page is looked up by label)
 * - mentionType: optional qualifier written as "@[Label](identifier:type)"
 */
public final class PageRef {
    private final String label;
    private final String identifier;
    private final String mentionType;

    public PageRef(String label, String identifier, String mentionType) {
        if (label == null || label.trim().isEmpty()) {
            throw new IllegalArgumentException("Page reference label cannot be empty");
        }
        this.label = label.trim();
        this.identifier = blankToNull(identifier);
        this.mentionType = blankToNull(mentionType);
    }

    public PageRef(String label, String identifier) {
        this(label, identifier, null);
    }

    private static String blankToNull(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    public String getLabel() {
        return label;
    }

    public String getNormalizedLabel() {
        return label.toLowerCase(Locale.ROOT);
    }

    /**
     * The page id, or null when the reference only names a label.
     */
    public String getIdentifier() {
        return identifier;
    }

    public String getMentionType() {
        return mentionType;
    }

    /**
     * Identifier if present, otherwise the label. Used as a fallback page id.
     */
    public String getKey() {
        return identifier != null ? identifier : label;
    }

    /**
     * Canonical formula text of the mention, without any cell suffix.
     */
    public String getRaw() {
        StringBuilder raw = new StringBuilder("@[").append(label).append(']');
        if (identifier != null) {
            raw.append('(').append(identifier);
            if (mentionType != null) {
                raw.append(':').append(mentionType);
            }
            raw.append(')');
        }
        return raw.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageRef)) {
            return false;
        }
        PageRef pageRef = (PageRef) o;
        return label.equals(pageRef.label)
                && Objects.equals(identifier, pageRef.identifier)
                && Objects.equals(mentionType, pageRef.mentionType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, identifier, mentionType);
    }

    @Override
    public String toString() {
        return getRaw();
    }
}
