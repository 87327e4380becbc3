package com.lending.dialog.domain.valueobject;

/**
 * Validator reference for a step: selects the parsing rule applied to raw input.
 */
public enum FieldKind {
    NAME,
    TEXT,
    DATE,
    NUMERIC,
    BOOLEAN,
    CHOICE,
    DOCUMENT,
    BANK_DETAILS,
    NONE
}
