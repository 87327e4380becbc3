package com.lending.dialog.domain.valueobject;

/**
 * Reasons a raw input is rejected. Each maps to a localized hint in the prompt catalog.
 */
public enum ValidationError {

    EMPTY("hint_empty"),
    UNPARSEABLE("hint_unparseable_date"),
    FUTURE_DATE("hint_future_date"),
    UNDERAGE("hint_underage"),
    OVERAGE("hint_overage"),
    NOT_NUMERIC("hint_not_numeric"),
    NON_POSITIVE("hint_non_positive"),
    AMBIGUOUS("hint_ambiguous"),
    UNKNOWN_OPTION("hint_unknown_option"),
    MISSING_DOCUMENT("hint_missing_document"),
    MALFORMED_BANK_DETAILS("hint_bank_details"),
    CONSENT_REQUIRED("hint_consent_required"),
    AGREEMENT_REQUIRED("hint_agreement_required");

    private final String hintKey;

    ValidationError(String hintKey) {
        this.hintKey = hintKey;
    }

    public String getHintKey() {
        return hintKey;
    }
}
