package com.identity.matching.rules;

/**
 * The person fields the engine compares. Normalization rules are scoped to one or more of them.
 */
public enum FieldType {
    NAME("Name"),
    EMAIL("Email"),
    PHONE("Phone");

    private final String label;

    FieldType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
